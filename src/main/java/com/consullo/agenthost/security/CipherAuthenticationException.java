package com.consullo.agenthost.security;

/**
 * Ciphertext failed its integrity check: wrong key, or the blob was tampered with.
 *
 * @since 1.0
 */
public final class CipherAuthenticationException extends CipherException {

  public CipherAuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
