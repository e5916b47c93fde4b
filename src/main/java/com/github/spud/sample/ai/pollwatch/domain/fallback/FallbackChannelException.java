package com.github.spud.sample.ai.pollwatch.domain.fallback;

/**
 * Send or poll failure on the fallback channel.
 */
public class FallbackChannelException extends RuntimeException {

  public FallbackChannelException(String message) {
    super(message);
  }

  public FallbackChannelException(String message, Throwable cause) {
    super(message, cause);
  }
}
