package com.github.spud.sample.ai.pollwatch.domain.oracle.protocol;

import lombok.Getter;

/**
 * 答案服务回复无法解析为 JSON
 */
@Getter
public class OracleResponseParseException extends Exception {

  private final String originalText;
  private final String reason;

  public OracleResponseParseException(String reason, String originalText) {
    super("Failed to parse oracle response: " + reason);
    this.reason = reason;
    this.originalText = originalText;
  }

  public OracleResponseParseException(String reason, String originalText, Throwable cause) {
    super("Failed to parse oracle response: " + reason, cause);
    this.reason = reason;
    this.originalText = originalText;
  }

}
