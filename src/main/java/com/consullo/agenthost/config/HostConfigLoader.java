package com.consullo.agenthost.config;

import com.consullo.agenthost.session.SessionManagerConfig;
import com.consullo.agenthost.session.WorkspaceType;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link HostConfig} from environment variables.
 *
 * <p>
 * Unset or blank variables take their defaults. Numeric variables that do not parse also fall back
 * to the default (with a warning). Values that parse but are out of range, and unknown workspace
 * types, fail with {@link IllegalArgumentException}.
 * </p>
 *
 * <table>
 * <caption>Recognized variables</caption>
 * <tr><td>SESSION_TIMEOUT_MINUTES</td><td>30</td></tr>
 * <tr><td>MAX_SESSIONS_PER_USER</td><td>3</td></tr>
 * <tr><td>OUTPUT_BUFFER_SIZE</td><td>100</td></tr>
 * <tr><td>WORKSPACE_BASE_PATH</td><td>/tmp/claude-sessions</td></tr>
 * <tr><td>WORKSPACE_TYPE</td><td>isolated</td></tr>
 * <tr><td>AGENT_COMMAND</td><td>claude code</td></tr>
 * <tr><td>MAX_COMMAND_LENGTH</td><td>16384</td></tr>
 * <tr><td>COMMAND_INTERVAL_MILLIS</td><td>100</td></tr>
 * <tr><td>API_AUTH_TOKEN</td><td>none</td></tr>
 * <tr><td>ENCRYPTION_KEY</td><td>none</td></tr>
 * <tr><td>RATE_LIMIT_RPS</td><td>10</td></tr>
 * </table>
 *
 * @since 1.0
 */
public final class HostConfigLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(HostConfigLoader.class);

  private static final Splitter COMMAND_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private HostConfigLoader() {
  }

  public static HostConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads configuration from the given variables.
   *
   * @param env variable map, usually {@link System#getenv()}
   * @return validated configuration
   * @throws IllegalArgumentException if a value is out of range
   */
  public static HostConfig fromEnvironment(final Map<String, String> env) {
    Validate.notNull(env, "env must not be null");
    final SessionManagerConfig defaults = SessionManagerConfig.builder().build();

    final String workspaceTypeName = get(env, "WORKSPACE_TYPE", defaults.defaultWorkspaceType().label());
    final WorkspaceType workspaceType = WorkspaceType.parse(workspaceTypeName)
        .orElseThrow(() -> new IllegalArgumentException("WORKSPACE_TYPE must be isolated or persistent, got "
            + workspaceTypeName));

    final String encryptionKey = StringUtils.trimToNull(env.get("ENCRYPTION_KEY"));
    final String agentCommandLine = env.get("AGENT_COMMAND");
    final List<String> agentCommand = StringUtils.isBlank(agentCommandLine)
        ? defaults.agentCommand()
        : COMMAND_SPLITTER.splitToList(agentCommandLine);

    final SessionManagerConfig session = SessionManagerConfig.builder()
        .idleTimeout(Duration.ofMinutes(
            getInt(env, "SESSION_TIMEOUT_MINUTES", (int) defaults.idleTimeout().toMinutes())))
        .maxPerUser(getInt(env, "MAX_SESSIONS_PER_USER", defaults.maxPerUser()))
        .outputBufferSize(getInt(env, "OUTPUT_BUFFER_SIZE", defaults.outputBufferSize()))
        .workspaceBasePath(Path.of(get(env, "WORKSPACE_BASE_PATH", defaults.workspaceBasePath().toString())))
        .defaultWorkspaceType(workspaceType)
        .agentCommand(agentCommand)
        .maxCommandLength(getInt(env, "MAX_COMMAND_LENGTH", defaults.maxCommandLength()))
        .commandInterval(Duration.ofMillis(
            getInt(env, "COMMAND_INTERVAL_MILLIS", (int) defaults.commandInterval().toMillis())))
        .encryptionKey(encryptionKey)
        .build();

    final SecurityConfig security =
        new SecurityConfig(StringUtils.trimToNull(env.get("API_AUTH_TOKEN")), encryptionKey);

    final RateLimitConfig limits = RateLimitConfig.defaults();
    final RateLimitConfig rateLimit = new RateLimitConfig(
        getDouble(env, "RATE_LIMIT_RPS", limits.permitsPerSecond()),
        limits.retention(),
        limits.sweepInterval());

    final HostConfig config = new HostConfig(session, security, rateLimit);
    LOGGER.debug("Loaded configuration: {} {} {}", session, security, rateLimit);
    return config;
  }

  private static String get(final Map<String, String> env, final String key, final String defaultValue) {
    final String value = env.get(key);
    return StringUtils.isBlank(value) ? defaultValue : value.trim();
  }

  private static int getInt(final Map<String, String> env, final String key, final int defaultValue) {
    final String value = StringUtils.trimToNull(env.get(key));
    if (value == null) {
      return defaultValue;
    }
    if (!NumberUtils.isParsable(value) || value.contains(".")) {
      LOGGER.warn("Ignoring non-integer {}={}; using {}", key, value, defaultValue);
      return defaultValue;
    }
    return NumberUtils.toInt(value, defaultValue);
  }

  private static double getDouble(final Map<String, String> env, final String key, final double defaultValue) {
    final String value = StringUtils.trimToNull(env.get(key));
    if (value == null) {
      return defaultValue;
    }
    if (!NumberUtils.isParsable(value)) {
      LOGGER.warn("Ignoring non-numeric {}={}; using {}", key, value, defaultValue);
      return defaultValue;
    }
    return NumberUtils.toDouble(value, defaultValue);
  }
}
