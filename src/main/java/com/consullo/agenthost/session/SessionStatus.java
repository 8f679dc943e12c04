package com.consullo.agenthost.session;

/**
 * Lifecycle states of a {@link Session}.
 *
 * <p>{@code INITIALIZING -> ACTIVE -> (TERMINATED | ERROR)}. Idle is not a state; the sweep derives it
 * from the last activity time.
 *
 * @since 1.0
 */
public enum SessionStatus {
  INITIALIZING("initializing"),
  ACTIVE("active"),
  TERMINATED("terminated"),
  ERROR("error");

  private final String label;

  SessionStatus(final String label) {
    this.label = label;
  }

  /**
   * Lower-case name used in persisted records.
   *
   * @return label
   */
  public String label() {
    return label;
  }

  public boolean isTerminal() {
    return this == TERMINATED || this == ERROR;
  }
}
