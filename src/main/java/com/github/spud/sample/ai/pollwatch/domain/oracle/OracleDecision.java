package com.github.spud.sample.ai.pollwatch.domain.oracle;

import java.util.Objects;

/**
 * 答案服务返回的结构化决定
 * <pre>
 * Answered      - 置信度 high/medium，选项号已校验
 * LowConfidence - 置信度 low，选项号已校验
 * Failed        - 选项号缺失/越界/无法解析，或调用失败；不论置信度字段如何
 * </pre>
 * 通过 {@link #match(Cases)} 穷举处理三种情况。
 */
public sealed interface OracleDecision
  permits OracleDecision.Answered, OracleDecision.LowConfidence, OracleDecision.Failed {

  DecisionStatus status();

  String rationale();

  <R> R match(Cases<R> cases);

  static OracleDecision of(int option, Confidence confidence, String rationale) {
    if (confidence == Confidence.LOW) {
      return new LowConfidence(option, rationale);
    }
    return new Answered(option, confidence, rationale);
  }

  static OracleDecision failed(String rationale) {
    return new Failed(rationale);
  }

  interface Cases<R> {

    R answered(Answered answered);

    R lowConfidence(LowConfidence lowConfidence);

    R failed(Failed failed);
  }

  record Answered(int option, Confidence confidence, String rationale) implements OracleDecision {

    public Answered {
      if (option < 1) {
        throw new IllegalArgumentException("Option must be 1-indexed: " + option);
      }
      if (Objects.requireNonNull(confidence, "confidence") == Confidence.LOW) {
        throw new IllegalArgumentException("Answered requires high or medium confidence");
      }
    }

    @Override
    public DecisionStatus status() {
      return DecisionStatus.ANSWERED;
    }

    @Override
    public <R> R match(Cases<R> cases) {
      return cases.answered(this);
    }
  }

  record LowConfidence(int option, String rationale) implements OracleDecision {

    public LowConfidence {
      if (option < 1) {
        throw new IllegalArgumentException("Option must be 1-indexed: " + option);
      }
    }

    public Confidence confidence() {
      return Confidence.LOW;
    }

    @Override
    public DecisionStatus status() {
      return DecisionStatus.LOW_CONFIDENCE;
    }

    @Override
    public <R> R match(Cases<R> cases) {
      return cases.lowConfidence(this);
    }
  }

  record Failed(String rationale) implements OracleDecision {

    @Override
    public DecisionStatus status() {
      return DecisionStatus.ERROR;
    }

    @Override
    public <R> R match(Cases<R> cases) {
      return cases.failed(this);
    }
  }
}
