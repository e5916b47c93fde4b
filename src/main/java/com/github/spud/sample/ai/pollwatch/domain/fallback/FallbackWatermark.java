package com.github.spud.sample.ai.pollwatch.domain.fallback;

/**
 * 已处理的最新入站消息 id，只增不减
 */
public class FallbackWatermark {

  private long value;

  public FallbackWatermark(long initial) {
    this.value = initial;
  }

  public boolean isNewer(InboundMessage message) {
    return message.id() > value;
  }

  /**
   * 推进到消息 id；旧消息不会让水位回退
   */
  public void advanceTo(InboundMessage message) {
    value = Math.max(value, message.id());
  }

  public long value() {
    return value;
  }
}
