package com.consullo.agenthost.config;

import com.consullo.agenthost.session.WorkspaceType;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for environment-based configuration.
 *
 * @since 1.0
 */
public class HostConfigLoaderTest {

  @Test
  @DisplayName("Should use the service defaults for an empty environment")
  void fromEnvironment_Empty_Defaults() {
    final HostConfig config = HostConfigLoader.fromEnvironment(Map.of());

    assertThat(config.session().maxPerUser()).isEqualTo(3);
    assertThat(config.session().idleTimeout()).isEqualTo(Duration.ofMinutes(30));
    assertThat(config.session().outputBufferSize()).isEqualTo(100);
    assertThat(config.session().workspaceBasePath()).isEqualTo(Path.of("/tmp/claude-sessions"));
    assertThat(config.session().defaultWorkspaceType()).isEqualTo(WorkspaceType.ISOLATED);
    assertThat(config.session().agentCommand()).containsExactly("claude", "code");
    assertThat(config.session().maxCommandLength()).isEqualTo(16_384);
    assertThat(config.session().commandInterval()).isEqualTo(Duration.ofMillis(100));
    assertThat(config.session().encryptionEnabled()).isFalse();
    assertThat(config.security().apiAuthToken()).isNull();
    assertThat(config.rateLimit().permitsPerSecond()).isEqualTo(10.0);
  }

  @Test
  @DisplayName("Should read every recognized variable")
  void fromEnvironment_AllSet_Applied() {
    final Map<String, String> env = new HashMap<>();
    env.put("SESSION_TIMEOUT_MINUTES", "5");
    env.put("MAX_SESSIONS_PER_USER", "7");
    env.put("OUTPUT_BUFFER_SIZE", "250");
    env.put("WORKSPACE_BASE_PATH", "/srv/agents");
    env.put("WORKSPACE_TYPE", "persistent");
    env.put("AGENT_COMMAND", "  claude   code --verbose ");
    env.put("MAX_COMMAND_LENGTH", "1024");
    env.put("COMMAND_INTERVAL_MILLIS", "0");
    env.put("API_AUTH_TOKEN", "token");
    env.put("ENCRYPTION_KEY", "00".repeat(32));
    env.put("RATE_LIMIT_RPS", "2.5");

    final HostConfig config = HostConfigLoader.fromEnvironment(env);

    assertThat(config.session().idleTimeout()).isEqualTo(Duration.ofMinutes(5));
    assertThat(config.session().maxPerUser()).isEqualTo(7);
    assertThat(config.session().outputBufferSize()).isEqualTo(250);
    assertThat(config.session().workspaceBasePath()).isEqualTo(Path.of("/srv/agents"));
    assertThat(config.session().defaultWorkspaceType()).isEqualTo(WorkspaceType.PERSISTENT);
    assertThat(config.session().agentCommand()).containsExactly("claude", "code", "--verbose");
    assertThat(config.session().maxCommandLength()).isEqualTo(1024);
    assertThat(config.session().commandInterval()).isZero();
    assertThat(config.session().encryptionEnabled()).isTrue();
    assertThat(config.security().apiAuthToken()).isEqualTo("token");
    assertThat(config.rateLimit().permitsPerSecond()).isEqualTo(2.5);
  }

  @Test
  @DisplayName("Should fall back to defaults for values that are not numbers")
  void fromEnvironment_NonNumeric_Defaults() {
    final HostConfig config = HostConfigLoader.fromEnvironment(Map.of(
        "MAX_SESSIONS_PER_USER", "many",
        "SESSION_TIMEOUT_MINUTES", "1.5",
        "RATE_LIMIT_RPS", "fast"));

    assertThat(config.session().maxPerUser()).isEqualTo(3);
    assertThat(config.session().idleTimeout()).isEqualTo(Duration.ofMinutes(30));
    assertThat(config.rateLimit().permitsPerSecond()).isEqualTo(10.0);
  }

  @Test
  @DisplayName("Should fail fast on out-of-range values and unknown workspace types")
  void fromEnvironment_Invalid_Throws() {
    assertThatThrownBy(() -> HostConfigLoader.fromEnvironment(Map.of("MAX_SESSIONS_PER_USER", "0")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> HostConfigLoader.fromEnvironment(Map.of("WORKSPACE_TYPE", "shared")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("WORKSPACE_TYPE");
    assertThatThrownBy(() -> HostConfigLoader.fromEnvironment(Map.of("RATE_LIMIT_RPS", "-1")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should keep secrets out of toString")
  void securityConfig_ToString_Redacted() {
    final SecurityConfig security = new SecurityConfig("token-value", "ab".repeat(32));

    assertThat(security.toString()).doesNotContain("token-value").doesNotContain("abab");
  }
}
