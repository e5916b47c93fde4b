package com.github.spud.sample.ai.pollwatch.domain.state;

/**
 * LISTENING 状态下一次轮询观察到的信号
 */
public record ListenSignals(boolean shutdownRequested, boolean contentChanged, ReplyKind reply,
                            boolean deadlinePassed) {

  public static ListenSignals quiet() {
    return new ListenSignals(false, false, ReplyKind.NONE, false);
  }
}
