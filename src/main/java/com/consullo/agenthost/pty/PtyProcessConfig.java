package com.consullo.agenthost.pty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration for spawning a PTY-attached process.
 *
 * @param command command and arguments (e.g., ["claude", "code"])
 * @param workingDirectory working directory for the spawned process
 * @param environment environment variables to add/override (may be null)
 * @param initialColumns initial PTY columns
 * @param initialRows initial PTY rows
 * @param terminationGrace how long {@link PtyProcessController#close()} waits after the graceful signal
 *     before killing the process
 * @since 1.0
 */
public record PtyProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    int initialColumns,
    int initialRows,
    Duration terminationGrace) {

  /**
   * Environment values may hold credentials; keep them out of log lines that print the config.
   */
  @Override
  public String toString() {
    return "PtyProcessConfig[command=" + command
        + ", workingDirectory=" + workingDirectory
        + ", environmentKeys=" + (environment == null ? "[]" : environment.keySet())
        + ", initialColumns=" + initialColumns
        + ", initialRows=" + initialRows
        + ", terminationGrace=" + terminationGrace + "]";
  }
}
