package com.consullo.agenthost.security;

/**
 * Encryption or decryption of credential material failed.
 *
 * @since 1.0
 */
public class CipherException extends Exception {

  public CipherException(final String message) {
    super(message);
  }

  public CipherException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
