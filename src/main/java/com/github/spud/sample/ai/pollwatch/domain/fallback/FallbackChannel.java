package com.github.spud.sample.ai.pollwatch.domain.fallback;

import java.util.Optional;

/**
 * 人工兜底的消息通道
 * <p>
 * 传输失败时抛出 {@link FallbackChannelException}。
 */
public interface FallbackChannel {

  /**
   * 向联系人发送纯文本消息
   */
  boolean send(String recipient, String text);

  /**
   * 非阻塞地查询来自联系人的最新一条入站消息
   */
  Optional<InboundMessage> latest(String recipient);
}
