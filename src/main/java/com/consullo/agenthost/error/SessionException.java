package com.consullo.agenthost.error;

/**
 * Base type of every classified failure raised by the session layer and the API facade.
 *
 * @since 1.0
 */
public abstract class SessionException extends Exception {

  private final ErrorCode code;

  protected SessionException(final ErrorCode code, final String message) {
    super(message);
    this.code = code;
  }

  protected SessionException(final ErrorCode code, final String message, final Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ErrorCode code() {
    return code;
  }
}
