package com.github.spud.sample.ai.pollwatch.domain.session;

/**
 * The class cannot be watched; it is skipped for the rest of the run.
 */
public class SessionUnavailableException extends RuntimeException {

  public SessionUnavailableException(String message) {
    super(message);
  }

  public SessionUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
