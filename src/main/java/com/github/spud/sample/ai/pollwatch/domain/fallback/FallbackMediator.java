package com.github.spud.sample.ai.pollwatch.domain.fallback;

import com.github.spud.sample.ai.pollwatch.application.config.PollWatchProperties;
import com.github.spud.sample.ai.pollwatch.domain.detect.ChangeDetector;
import com.github.spud.sample.ai.pollwatch.domain.session.CancellationToken;
import com.github.spud.sample.ai.pollwatch.domain.session.PageSession;
import com.github.spud.sample.ai.pollwatch.domain.session.QuestionSnapshot;
import com.github.spud.sample.ai.pollwatch.domain.state.FallbackEvent;
import com.github.spud.sample.ai.pollwatch.domain.state.FallbackState;
import com.github.spud.sample.ai.pollwatch.domain.state.FallbackTransitions;
import com.github.spud.sample.ai.pollwatch.domain.state.ListenSignals;
import com.github.spud.sample.ai.pollwatch.domain.state.ReplyKind;
import com.github.spud.sample.ai.pollwatch.domain.state.StateMachineDriver;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.statemachine.StateMachine;
import org.springframework.stereotype.Component;

/**
 * 人工兜底协调器
 * <p>
 * 低置信度题目已提交基线答案后，向联系人发送求助消息，然后在 "题目变化" 与 "收到新回复" 之间竞争：
 * <p> - 每轮先检查页面内容是否变化，变化则终止（之后的回复会作用在错误的题目上）
 * <p> - 再检查是否有比水位更新的回复；有效选项号则先取消当前选择再改选，并继续监听
 * <p> - 全局关闭时立即终止；配置了 max-wait 时超时终止
 */
@Slf4j
@Component
public class FallbackMediator {

  private final FallbackChannel channel;
  private final StateMachineDriver stateMachineDriver;
  private final Clock clock;
  private final Duration pollInterval;
  private final Duration maxWait;

  public FallbackMediator(FallbackChannel channel, StateMachineDriver stateMachineDriver,
    Clock clock, PollWatchProperties properties) {
    this.channel = channel;
    this.stateMachineDriver = stateMachineDriver;
    this.clock = clock;
    this.pollInterval = properties.getFallback().getPollInterval();
    this.maxWait = properties.getFallback().getMaxWait();
  }

  /**
   * 运行一次兜底流程，直到题目变化、超时或全局关闭
   * <p>
   * 页面读取异常会向上抛出，由 watcher 结束会话。
   */
  public FallbackOutcome mediate(String className, PageSession page, QuestionSnapshot snapshot,
    String recipient, CancellationToken token) {
    StateMachine<FallbackState, FallbackEvent> sm =
      stateMachineDriver.create(className + "-fallback");
    int overrides = 0;
    int lastApplied = 0;

    try {
      // 起始读取为空时没有基线，第一次有效摘要即视为变化
      ChangeDetector detector = new ChangeDetector(page.fingerprint(), null);

      FallbackWatermark watermark;
      try {
        watermark = new FallbackWatermark(
          channel.latest(recipient).map(InboundMessage::id).orElse(0L));
        if (!channel.send(recipient, FallbackPrompt.format(snapshot))) {
          log.error("[{}] Failed to send fallback message to {}", className, recipient);
          stateMachineDriver.sendEvent(sm, FallbackEvent.SEND_FAILED);
          return outcome(sm, overrides, lastApplied);
        }
      } catch (FallbackChannelException e) {
        log.error("[{}] Fallback channel error before listening: {}", className, e.getMessage(), e);
        stateMachineDriver.sendEvent(sm, FallbackEvent.SEND_FAILED);
        return outcome(sm, overrides, lastApplied);
      }

      log.info("[{}] Sent fallback message to {}, waiting for replies (watermark={})",
        className, recipient, watermark.value());
      stateMachineDriver.sendEvent(sm, FallbackEvent.SEND_OK);
      stateMachineDriver.sendEvent(sm, FallbackEvent.LISTEN);

      Instant deadline = maxWait != null ? clock.instant().plus(maxWait) : null;

      while (!stateMachineDriver.isInFinalState(sm)) {
        boolean shutdown = token.isCancelled() || Thread.currentThread().isInterrupted();
        boolean changed = !shutdown && detector.observe(page.fingerprint());

        ReplyCheck reply = ReplyCheck.NONE;
        if (!shutdown && !changed) {
          try {
            reply = checkReply(className, recipient, snapshot, watermark);
          } catch (FallbackChannelException e) {
            log.error("[{}] Fallback channel poll failed: {}", className, e.getMessage(), e);
            stateMachineDriver.sendEvent(sm, FallbackEvent.CHANNEL_FAILED);
            break;
          }
        }
        boolean deadlinePassed = deadline != null && !clock.instant().isBefore(deadline);

        Optional<FallbackEvent> event = FallbackTransitions.next(
          new ListenSignals(shutdown, changed, reply.kind(), deadlinePassed));

        if (event.isPresent()) {
          if (event.get() == FallbackEvent.REPLY_APPLIED) {
            if (applyOverride(className, page, reply.option())) {
              overrides++;
              lastApplied = reply.option();
              stateMachineDriver.sendEvent(sm, FallbackEvent.REPLY_APPLIED);
              stateMachineDriver.sendEvent(sm, FallbackEvent.RESUME);
            }
          } else {
            logTermination(className, event.get());
            stateMachineDriver.sendEvent(sm, event.get());
            break;
          }
        }

        token.sleep(pollInterval);
      }

      return outcome(sm, overrides, lastApplied);

    } finally {
      stateMachineDriver.stop(sm);
    }
  }

  /**
   * 查询最新回复；比水位新的消息无论是否有效都会推进水位，保证同一条消息只处理一次
   */
  private ReplyCheck checkReply(String className, String recipient, QuestionSnapshot snapshot,
    FallbackWatermark watermark) {
    Optional<InboundMessage> latest = channel.latest(recipient);
    if (latest.isEmpty() || !watermark.isNewer(latest.get())) {
      return ReplyCheck.NONE;
    }

    InboundMessage message = latest.get();
    watermark.advanceTo(message);
    log.info("[{}] Received reply: {}", className, message.text());

    OptionalInt choice = FallbackPrompt.parseReply(message.text(), snapshot.optionCount());
    if (choice.isEmpty()) {
      log.warn("[{}] Ignoring reply '{}': expected a number 1-{}", className, message.text(),
        snapshot.optionCount());
      return ReplyCheck.INVALID;
    }
    return new ReplyCheck(ReplyKind.VALID, choice.getAsInt());
  }

  /**
   * 先取消当前选择再应用新选项，保证页面上同时最多只有一个已选项
   */
  private boolean applyOverride(String className, PageSession page, int option) {
    log.info("[{}] Human replied: option {}, clearing previous selection", className, option);
    page.clearChoice();
    if (page.applyChoice(option)) {
      log.info("[{}] Changed answer to option {}", className, option);
      return true;
    }
    log.error("[{}] Failed to apply option {}", className, option);
    return false;
  }

  private void logTermination(String className, FallbackEvent event) {
    switch (event) {
      case CONTENT_CHANGED -> log.info("[{}] Page content changed, stopping fallback listener",
        className);
      case SHUTDOWN -> log.info("[{}] Shutdown requested, stopping fallback listener", className);
      case DEADLINE_PASSED -> log.info("[{}] No reply within {}, giving up", className, maxWait);
      default -> log.debug("[{}] Fallback terminating on {}", className, event);
    }
  }

  private FallbackOutcome outcome(StateMachine<FallbackState, FallbackEvent> sm, int overrides,
    int lastApplied) {
    return new FallbackOutcome(stateMachineDriver.getCurrentState(sm), overrides, lastApplied);
  }

  private record ReplyCheck(ReplyKind kind, int option) {

    static final ReplyCheck NONE = new ReplyCheck(ReplyKind.NONE, 0);
    static final ReplyCheck INVALID = new ReplyCheck(ReplyKind.INVALID, 0);
  }
}
