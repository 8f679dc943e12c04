package com.consullo.agenthost.error;

/**
 * Write or resize against the session process failed.
 */
public final class SessionIoException extends SessionException {

  public SessionIoException(final String message) {
    super(ErrorCode.IO_FAILURE, message);
  }

  public SessionIoException(final String message, final Throwable cause) {
    super(ErrorCode.IO_FAILURE, message, cause);
  }
}
