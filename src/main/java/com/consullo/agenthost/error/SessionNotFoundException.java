package com.consullo.agenthost.error;

/**
 * Raised for unknown session ids and for sessions owned by a different user.
 *
 * <p>Both cases share one message so callers cannot probe which session ids exist.
 */
public final class SessionNotFoundException extends SessionException {

  private static final String MESSAGE = "session not found";

  public SessionNotFoundException() {
    super(ErrorCode.NOT_FOUND, MESSAGE);
  }
}
