package com.github.spud.sample.ai.pollwatch.infrastructure.channel;

import com.github.spud.sample.ai.pollwatch.domain.fallback.FallbackChannel;
import com.github.spud.sample.ai.pollwatch.domain.fallback.InboundMessage;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * 未注册消息通道时的占位实现：发送总是失败，兜底流程随即终止
 */
@Slf4j
public class DisabledFallbackChannel implements FallbackChannel {

  @Override
  public boolean send(String recipient, String text) {
    log.warn("No fallback channel registered, message to {} not sent", recipient);
    return false;
  }

  @Override
  public Optional<InboundMessage> latest(String recipient) {
    return Optional.empty();
  }
}
