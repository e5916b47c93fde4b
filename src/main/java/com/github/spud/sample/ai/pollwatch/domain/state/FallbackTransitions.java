package com.github.spud.sample.ai.pollwatch.domain.state;

import java.util.Optional;

/**
 * LISTENING 状态的纯转移函数
 * <p>
 * 优先级：全局关闭 > 内容变化 > 有效回复 > 超时。无效回复或无回复时保持 LISTENING。
 */
public final class FallbackTransitions {

  private FallbackTransitions() {
  }

  public static Optional<FallbackEvent> next(ListenSignals signals) {
    if (signals.shutdownRequested()) {
      return Optional.of(FallbackEvent.SHUTDOWN);
    }
    if (signals.contentChanged()) {
      return Optional.of(FallbackEvent.CONTENT_CHANGED);
    }
    if (signals.reply() == ReplyKind.VALID) {
      return Optional.of(FallbackEvent.REPLY_APPLIED);
    }
    if (signals.deadlinePassed()) {
      return Optional.of(FallbackEvent.DEADLINE_PASSED);
    }
    return Optional.empty();
  }
}
