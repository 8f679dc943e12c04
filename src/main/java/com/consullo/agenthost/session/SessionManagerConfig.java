package com.consullo.agenthost.session;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Session manager configuration values.
 *
 * @param maxPerUser maximum number of non-terminal sessions per user
 * @param idleTimeout inactivity after which the sweep reclaims a session
 * @param outputBufferSize output chunks retained per session
 * @param workspaceBasePath directory under which workspaces are allocated
 * @param defaultWorkspaceType workspace type used when a create request names none
 * @param agentCommand command line of the agent process
 * @param initialColumns initial PTY columns
 * @param initialRows initial PTY rows
 * @param maxCommandLength longest accepted command, in UTF-8 bytes
 * @param commandInterval minimum spacing between commands on one session
 * @param sweepInterval period of the idle-timeout sweep
 * @param terminationGrace wait between the graceful signal and the forced kill
 * @param encryptionKey hex-encoded 256-bit key for credentials at rest; null or blank disables it
 * @since 1.0
 */
public record SessionManagerConfig(
    int maxPerUser,
    Duration idleTimeout,
    int outputBufferSize,
    Path workspaceBasePath,
    WorkspaceType defaultWorkspaceType,
    List<String> agentCommand,
    int initialColumns,
    int initialRows,
    int maxCommandLength,
    Duration commandInterval,
    Duration sweepInterval,
    Duration terminationGrace,
    String encryptionKey) {

  public SessionManagerConfig {
    Validate.isTrue(maxPerUser > 0, "maxPerUser must be positive");
    Validate.notNull(idleTimeout, "idleTimeout must not be null");
    Validate.isTrue(!idleTimeout.isNegative() && !idleTimeout.isZero(), "idleTimeout must be positive");
    Validate.isTrue(outputBufferSize > 0, "outputBufferSize must be positive");
    Validate.notNull(workspaceBasePath, "workspaceBasePath must not be null");
    Validate.notNull(defaultWorkspaceType, "defaultWorkspaceType must not be null");
    Validate.notEmpty(agentCommand, "agentCommand must not be empty");
    Validate.isTrue(initialColumns > 0 && initialRows > 0, "initial columns/rows must be positive");
    Validate.isTrue(maxCommandLength > 0, "maxCommandLength must be positive");
    Validate.notNull(commandInterval, "commandInterval must not be null");
    Validate.isTrue(!commandInterval.isNegative(), "commandInterval must not be negative");
    Validate.notNull(sweepInterval, "sweepInterval must not be null");
    Validate.isTrue(!sweepInterval.isNegative() && !sweepInterval.isZero(), "sweepInterval must be positive");
    Validate.notNull(terminationGrace, "terminationGrace must not be null");
    agentCommand = List.copyOf(agentCommand);
  }

  public boolean encryptionEnabled() {
    return encryptionKey != null && !encryptionKey.isBlank();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "SessionManagerConfig[maxPerUser=" + maxPerUser
        + ", idleTimeout=" + idleTimeout
        + ", outputBufferSize=" + outputBufferSize
        + ", workspaceBasePath=" + workspaceBasePath
        + ", defaultWorkspaceType=" + defaultWorkspaceType
        + ", agentCommand=" + agentCommand
        + ", encryption=" + (encryptionEnabled() ? "enabled" : "disabled") + "]";
  }

  /**
   * Builder pre-filled with the service defaults.
   */
  public static final class Builder {

    private int maxPerUser = 3;
    private Duration idleTimeout = Duration.ofMinutes(30);
    private int outputBufferSize = 100;
    private Path workspaceBasePath = Path.of("/tmp/claude-sessions");
    private WorkspaceType defaultWorkspaceType = WorkspaceType.ISOLATED;
    private List<String> agentCommand = List.of("claude", "code");
    private int initialColumns = 120;
    private int initialRows = 40;
    private int maxCommandLength = 16_384;
    private Duration commandInterval = Duration.ofMillis(100);
    private Duration sweepInterval = Duration.ofMinutes(1);
    private Duration terminationGrace = Duration.ofSeconds(5);
    private String encryptionKey;

    private Builder() {
    }

    public Builder maxPerUser(int maxPerUser) {
      this.maxPerUser = maxPerUser;
      return this;
    }

    public Builder idleTimeout(Duration idleTimeout) {
      this.idleTimeout = idleTimeout;
      return this;
    }

    public Builder outputBufferSize(int outputBufferSize) {
      this.outputBufferSize = outputBufferSize;
      return this;
    }

    public Builder workspaceBasePath(Path workspaceBasePath) {
      this.workspaceBasePath = workspaceBasePath;
      return this;
    }

    public Builder defaultWorkspaceType(WorkspaceType defaultWorkspaceType) {
      this.defaultWorkspaceType = defaultWorkspaceType;
      return this;
    }

    public Builder agentCommand(List<String> agentCommand) {
      this.agentCommand = agentCommand;
      return this;
    }

    public Builder terminalSize(int columns, int rows) {
      this.initialColumns = columns;
      this.initialRows = rows;
      return this;
    }

    public Builder maxCommandLength(int maxCommandLength) {
      this.maxCommandLength = maxCommandLength;
      return this;
    }

    public Builder commandInterval(Duration commandInterval) {
      this.commandInterval = commandInterval;
      return this;
    }

    public Builder sweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
      return this;
    }

    public Builder terminationGrace(Duration terminationGrace) {
      this.terminationGrace = terminationGrace;
      return this;
    }

    public Builder encryptionKey(String encryptionKey) {
      this.encryptionKey = encryptionKey;
      return this;
    }

    public SessionManagerConfig build() {
      return new SessionManagerConfig(
          maxPerUser,
          idleTimeout,
          outputBufferSize,
          workspaceBasePath,
          defaultWorkspaceType,
          agentCommand,
          initialColumns,
          initialRows,
          maxCommandLength,
          commandInterval,
          sweepInterval,
          terminationGrace,
          encryptionKey);
    }
  }
}
