package com.consullo.agenthost.error;

/**
 * The caller exceeded its request rate.
 */
public final class RateLimitedException extends SessionException {

  public RateLimitedException(final String message) {
    super(ErrorCode.RATE_LIMITED, message);
  }
}
