package com.github.spud.sample.ai.pollwatch.domain.watch;

import com.github.spud.sample.ai.pollwatch.application.config.PollWatchProperties;
import com.github.spud.sample.ai.pollwatch.domain.decision.DecisionOutcome;
import com.github.spud.sample.ai.pollwatch.domain.decision.QuestionDecisionPipeline;
import com.github.spud.sample.ai.pollwatch.domain.detect.ChangeDetector;
import com.github.spud.sample.ai.pollwatch.domain.fallback.FallbackMediator;
import com.github.spud.sample.ai.pollwatch.domain.fallback.FallbackOutcome;
import com.github.spud.sample.ai.pollwatch.domain.schedule.ClassSchedule;
import com.github.spud.sample.ai.pollwatch.domain.session.CancellationToken;
import com.github.spud.sample.ai.pollwatch.domain.session.PageSession;
import com.github.spud.sample.ai.pollwatch.domain.session.PageSessionProvider;
import com.github.spud.sample.ai.pollwatch.domain.session.SessionState;
import com.github.spud.sample.ai.pollwatch.domain.session.SessionUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 单个课程的监控循环
 * <p>
 * 打开页面后先尝试处理已经打开的题目，然后按固定间隔轮询：地址或内容变化时重新读取题目并决策。
 * 题目检测与决策严格串行，兜底等待期间不会处理新的变化。页面会话在任何退出路径上都会关闭。
 */
@Slf4j
@Component
public class SessionWatcher {

  private final PageSessionProvider pageSessionProvider;
  private final QuestionDecisionPipeline decisionPipeline;
  private final FallbackMediator fallbackMediator;
  private final PollWatchProperties properties;
  private final Clock clock;

  public SessionWatcher(PageSessionProvider pageSessionProvider,
    QuestionDecisionPipeline decisionPipeline, FallbackMediator fallbackMediator,
    PollWatchProperties properties, Clock clock) {
    this.pageSessionProvider = pageSessionProvider;
    this.decisionPipeline = decisionPipeline;
    this.fallbackMediator = fallbackMediator;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * 运行监控循环直到课程结束、全局关闭或出现不可恢复的错误
   */
  public WatchResult watch(SessionState state, CancellationToken token) {
    ClassSchedule schedule = state.getSchedule();
    String className = schedule.getName();
    log.info("[{}] Starting session {}", className, schedule.getConnection());

    try (PageSession page = pageSessionProvider.open(schedule)) {
      return monitor(state, page, token);

    } catch (SessionUnavailableException e) {
      log.error("[{}] Session unavailable, skipping class for this run: {}", className,
        e.getMessage());
      return WatchResult.UNAVAILABLE;

    } catch (RuntimeException e) {
      log.error("[{}] Session error: {}", className, e.getMessage(), e);
      return WatchResult.FAILED;

    } finally {
      log.info("[{}] Session closed", className);
    }
  }

  private WatchResult monitor(SessionState state, PageSession page, CancellationToken token) {
    String className = state.getClassName();
    ClassSchedule schedule = state.getSchedule();
    Duration interval = properties.getWatchInterval();

    ChangeDetector detector = new ChangeDetector(page.fingerprint(), page.currentLocation());
    state.setCurrentFingerprint(detector.lastFingerprint());

    // 启动时题目可能已经打开
    DecisionOutcome initial = decisionPipeline.decide(state, page);
    runFallbackIfNeeded(state, page, initial, token);

    while (!token.isCancelled()) {
      if (hasEnded(schedule)) {
        log.info("[{}] Class ended at {}", className, schedule.getEndTime());
        return WatchResult.ENDED;
      }

      if (token.sleep(interval)) {
        break;
      }

      if (hasEnded(schedule)) {
        log.info("[{}] Class ended at {}", className, schedule.getEndTime());
        return WatchResult.ENDED;
      }

      if (detector.observeLocation(page.currentLocation())) {
        log.info("[{}] Location changed to {}", className, detector.lastLocation());
        // 导航使去重状态失效
        state.clearLastCommitted();
        detector.rebase(page.fingerprint());
        state.setCurrentFingerprint(detector.lastFingerprint());
        handleChange(state, page, token);
        continue;
      }

      String fingerprint = page.fingerprint();
      if (detector.observe(fingerprint)) {
        log.debug("[{}] Page content updated", className);
        state.setCurrentFingerprint(fingerprint);
        handleChange(state, page, token);
      }
    }

    log.info("[{}] Shutdown requested, leaving class", className);
    return WatchResult.SHUTDOWN;
  }

  private void handleChange(SessionState state, PageSession page, CancellationToken token) {
    DecisionOutcome outcome = decisionPipeline.decide(state, page);
    if (outcome.kind() == DecisionOutcome.Kind.NO_QUESTION) {
      // 题目关闭后同一题干再次出现时视为新题
      state.clearLastCommitted();
      return;
    }
    runFallbackIfNeeded(state, page, outcome, token);
  }

  private void runFallbackIfNeeded(SessionState state, PageSession page, DecisionOutcome outcome,
    CancellationToken token) {
    if (!outcome.needsFallback()) {
      return;
    }
    FallbackOutcome result = fallbackMediator.mediate(state.getClassName(), page,
      outcome.snapshot(), properties.getFallback().getRecipient(), token);
    log.info("[{}] Fallback finished: state={}, overrides={}, lastOption={}",
      state.getClassName(), result.finalState(), result.overrides(), result.lastAppliedOption());
  }

  private boolean hasEnded(ClassSchedule schedule) {
    return schedule.hasEndedAt(LocalTime.now(clock));
  }
}
