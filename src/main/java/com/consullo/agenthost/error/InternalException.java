package com.consullo.agenthost.error;

/**
 * A collaborator (cipher, store) failed.
 */
public final class InternalException extends SessionException {

  public InternalException(final String message) {
    super(ErrorCode.INTERNAL, message);
  }

  public InternalException(final String message, final Throwable cause) {
    super(ErrorCode.INTERNAL, message, cause);
  }
}
