package com.github.spud.sample.ai.pollwatch.infrastructure.notify;

import com.github.spud.sample.ai.pollwatch.domain.decision.OperatorNotifier;
import com.github.spud.sample.ai.pollwatch.domain.oracle.OracleDecision;
import com.github.spud.sample.ai.pollwatch.domain.session.QuestionSnapshot;
import lombok.extern.slf4j.Slf4j;

/**
 * 以 WARN 日志形式通知操作员
 */
@Slf4j
public class LoggingOperatorNotifier implements OperatorNotifier {

  @Override
  public void lowConfidence(String className, QuestionSnapshot snapshot,
    OracleDecision.LowConfidence decision) {
    log.warn("[{}] NOTIFY low confidence: clicked option {} for '{}'", className,
      decision.option(), abbreviate(snapshot.getQuestion(), 40));
  }

  @Override
  public void oracleError(String className, QuestionSnapshot snapshot,
    OracleDecision.Failed decision) {
    log.warn("[{}] NOTIFY oracle error for '{}': {}", className,
      abbreviate(snapshot.getQuestion(), 40), abbreviate(decision.rationale(), 50));
  }

  private String abbreviate(String text, int maxLen) {
    if (text == null) {
      return "";
    }
    return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
  }
}
