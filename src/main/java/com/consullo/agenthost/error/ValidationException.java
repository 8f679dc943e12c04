package com.consullo.agenthost.error;

/**
 * Caller input was rejected before any resource was touched.
 */
public final class ValidationException extends SessionException {

  public ValidationException(final String message) {
    super(ErrorCode.VALIDATION, message);
  }

  public ValidationException(final String message, final Throwable cause) {
    super(ErrorCode.VALIDATION, message, cause);
  }
}
