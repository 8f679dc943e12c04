package com.consullo.agenthost.error;

/**
 * Operation on a session that is not active.
 */
public final class InvalidStateException extends SessionException {

  public InvalidStateException(final String message) {
    super(ErrorCode.INVALID_STATE, message);
  }
}
