package com.github.spud.sample.ai.pollwatch.domain.decision;

import com.github.spud.sample.ai.pollwatch.domain.session.QuestionSnapshot;

/**
 * 决策流水线的结果
 *
 * @param kind     结果类型
 * @param snapshot 处理的题目，NONE 时可能为空
 * @param option   已提交的选项号（从 1 开始），未提交为 0
 */
public record DecisionOutcome(Kind kind, QuestionSnapshot snapshot, int option) {

  public enum Kind {
    /**
     * 当前没有题目
     */
    NO_QUESTION,

    /**
     * 同一题目已经处理过
     */
    DUPLICATE,

    /**
     * 已提交答案，无需兜底
     */
    COMMITTED,

    /**
     * 已提交基线答案，等待人工兜底
     */
    AWAIT_FALLBACK,

    /**
     * 答案服务错误，未提交
     */
    ERROR
  }

  public static DecisionOutcome noQuestion() {
    return new DecisionOutcome(Kind.NO_QUESTION, null, 0);
  }

  public static DecisionOutcome duplicate(QuestionSnapshot snapshot) {
    return new DecisionOutcome(Kind.DUPLICATE, snapshot, 0);
  }

  public static DecisionOutcome committed(QuestionSnapshot snapshot, int option) {
    return new DecisionOutcome(Kind.COMMITTED, snapshot, option);
  }

  public static DecisionOutcome awaitFallback(QuestionSnapshot snapshot, int option) {
    return new DecisionOutcome(Kind.AWAIT_FALLBACK, snapshot, option);
  }

  public static DecisionOutcome error(QuestionSnapshot snapshot) {
    return new DecisionOutcome(Kind.ERROR, snapshot, 0);
  }

  public boolean needsFallback() {
    return kind == Kind.AWAIT_FALLBACK;
  }
}
