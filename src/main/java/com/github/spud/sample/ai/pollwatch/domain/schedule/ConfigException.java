package com.github.spud.sample.ai.pollwatch.domain.schedule;

/**
 * Raised when the schedule store is missing or malformed. Fatal at startup.
 */
public class ConfigException extends RuntimeException {

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
