package com.consullo.agenthost.error;

/**
 * The pty-backed agent process could not be started.
 */
public final class SpawnFailureException extends SessionException {

  public SpawnFailureException(final String message) {
    super(ErrorCode.SPAWN_FAILURE, message);
  }

  public SpawnFailureException(final String message, final Throwable cause) {
    super(ErrorCode.SPAWN_FAILURE, message, cause);
  }
}
