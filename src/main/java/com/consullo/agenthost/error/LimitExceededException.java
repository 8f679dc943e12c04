package com.consullo.agenthost.error;

/**
 * A per-user session quota or per-session command throttle was hit.
 */
public final class LimitExceededException extends SessionException {

  public LimitExceededException(final String message) {
    super(ErrorCode.LIMIT_EXCEEDED, message);
  }
}
