package com.github.spud.sample.ai.pollwatch.domain.decision;

import com.github.spud.sample.ai.pollwatch.application.config.PollWatchProperties;
import com.github.spud.sample.ai.pollwatch.domain.oracle.AnswerOracle;
import com.github.spud.sample.ai.pollwatch.domain.oracle.OracleDecision;
import com.github.spud.sample.ai.pollwatch.domain.session.PageSession;
import com.github.spud.sample.ai.pollwatch.domain.session.QuestionSnapshot;
import com.github.spud.sample.ai.pollwatch.domain.session.SessionState;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 题目决策流水线
 * <p>
 * 策略：
 * <pre>
 * Failed        -> 通知操作员，不提交，不兜底
 * Answered      -> 立即提交
 * LowConfidence -> 立即提交作为基线，再交给人工兜底（需配置联系人）
 * </pre>
 * 题干在首次咨询答案服务后即记为已处理，兜底期间不会重复触发。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionDecisionPipeline {

  private final AnswerOracle oracle;
  private final OperatorNotifier notifier;
  private final PollWatchProperties properties;

  /**
   * 读取当前题目并决策
   */
  public DecisionOutcome decide(SessionState state, PageSession page) {
    Optional<QuestionSnapshot> snapshot = page.readQuestion();
    if (snapshot.isEmpty()) {
      return DecisionOutcome.noQuestion();
    }
    return decide(state, page, snapshot.get());
  }

  public DecisionOutcome decide(SessionState state, PageSession page, QuestionSnapshot snapshot) {
    String className = state.getClassName();
    if (state.isAlreadyCommitted(snapshot)) {
      log.debug("[{}] Question already handled: '{}'", className, snapshot.getQuestion());
      return DecisionOutcome.duplicate(snapshot);
    }

    log.info("[{}] Asking oracle: options={} question='{}'", className, snapshot.getOptions(),
      snapshot.getQuestion());
    OracleDecision decision = oracle.ask(snapshot.getQuestion(), snapshot.getOptions());
    state.markCommitted(snapshot);

    return decision.match(new OracleDecision.Cases<>() {
      @Override
      public DecisionOutcome answered(OracleDecision.Answered answered) {
        log.info("[{}] Oracle answered: confidence={}, option={}", className,
          answered.confidence().label(), answered.option());
        commit(className, page, answered.option());
        return DecisionOutcome.committed(snapshot, answered.option());
      }

      @Override
      public DecisionOutcome lowConfidence(OracleDecision.LowConfidence low) {
        log.warn("[{}] Low confidence: option={}, rationale={}", className, low.option(),
          truncate(low.rationale(), 100));
        notifier.lowConfidence(className, snapshot, low);
        commit(className, page, low.option());

        if (!StringUtils.hasText(properties.getFallback().getRecipient())) {
          log.warn("[{}] No fallback recipient configured, keeping option {}", className,
            low.option());
          return DecisionOutcome.committed(snapshot, low.option());
        }
        return DecisionOutcome.awaitFallback(snapshot, low.option());
      }

      @Override
      public DecisionOutcome failed(OracleDecision.Failed failed) {
        log.error("[{}] Oracle error: {}", className, failed.rationale());
        notifier.oracleError(className, snapshot, failed);
        return DecisionOutcome.error(snapshot);
      }
    });
  }

  private void commit(String className, PageSession page, int option) {
    log.info("[{}] Clicking option {}", className, option);
    if (!page.applyChoice(option)) {
      log.error("[{}] Failed to click option {}", className, option);
    }
  }

  private String truncate(String text, int maxLen) {
    if (text == null) {
      return null;
    }
    return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
  }
}
