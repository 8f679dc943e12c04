package com.consullo.agenthost.error;

/**
 * Classification of failures reported to API callers.
 *
 * @since 1.0
 */
public enum ErrorCode {
  VALIDATION,
  LIMIT_EXCEEDED,
  /** Covers both a missing session and a session owned by someone else. */
  NOT_FOUND,
  SPAWN_FAILURE,
  WORKSPACE,
  INVALID_STATE,
  IO_FAILURE,
  AUTH,
  RATE_LIMITED,
  INTERNAL
}
