package com.github.spud.sample.ai.pollwatch.domain.oracle;

import java.util.List;

/**
 * 答案服务：给定题干与有序选项，返回推荐答案
 */
public interface AnswerOracle {

  /**
   * 不会因为答案格式错误而抛出异常，错误统一规整为 {@link OracleDecision.Failed}
   */
  OracleDecision ask(String question, List<String> options);
}
