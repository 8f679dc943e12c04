package com.consullo.agenthost.session;

import java.util.Locale;
import java.util.Optional;

/**
 * How a session's working directory is allocated.
 *
 * @since 1.0
 */
public enum WorkspaceType {
  /** Fresh directory per session, deleted on cleanup. */
  ISOLATED,
  /** One directory per user, reused across sessions and never deleted by the host. */
  PERSISTENT;

  /**
   * Parses the configuration/API spelling ({@code isolated}, {@code persistent}), case-insensitively.
   *
   * @param value raw value
   * @return parsed type, or empty if the value names no known type
   */
  public static Optional<WorkspaceType> parse(final String value) {
    if (value == null) {
      return Optional.empty();
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "isolated":
        return Optional.of(ISOLATED);
      case "persistent":
        return Optional.of(PERSISTENT);
      default:
        return Optional.empty();
    }
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
