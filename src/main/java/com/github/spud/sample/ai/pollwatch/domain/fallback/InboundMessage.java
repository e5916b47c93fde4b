package com.github.spud.sample.ai.pollwatch.domain.fallback;

/**
 * 入站消息；id 单调递增，越大越新
 */
public record InboundMessage(String text, long id) {

}
