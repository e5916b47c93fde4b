package com.github.spud.sample.ai.pollwatch.domain.decision;

import com.github.spud.sample.ai.pollwatch.domain.oracle.OracleDecision;
import com.github.spud.sample.ai.pollwatch.domain.session.QuestionSnapshot;

/**
 * 操作员通知：低置信度与答案服务错误
 */
public interface OperatorNotifier {

  void lowConfidence(String className, QuestionSnapshot snapshot,
    OracleDecision.LowConfidence decision);

  void oracleError(String className, QuestionSnapshot snapshot, OracleDecision.Failed decision);
}
