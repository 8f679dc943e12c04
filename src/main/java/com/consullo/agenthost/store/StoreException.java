package com.consullo.agenthost.store;

/**
 * A durable store operation failed.
 *
 * @since 1.0
 */
public final class StoreException extends Exception {

  public StoreException(final String message) {
    super(message);
  }

  public StoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
