package com.consullo.agenthost.pty;

/**
 * Spawns PTY-attached processes.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface PtyProcessLauncher {

  /**
   * Starts the process described by {@code config}.
   *
   * @param config process configuration
   * @return controller owning the new process
   * @throws Exception if the process cannot be started
   */
  PtyProcessController launch(final PtyProcessConfig config) throws Exception;

  /**
   * Launcher backed by pty4j.
   *
   * @return pty4j launcher
   */
  static PtyProcessLauncher pty4j() {
    return PtyProcessControllerPty4j::new;
  }
}
