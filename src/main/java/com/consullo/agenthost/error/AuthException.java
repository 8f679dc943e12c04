package com.consullo.agenthost.error;

/**
 * The caller's bearer token did not match the configured secret.
 */
public final class AuthException extends SessionException {

  public AuthException(final String message) {
    super(ErrorCode.AUTH, message);
  }
}
