package com.consullo.agenthost.demo;

import com.consullo.agenthost.api.AgentHostApi;
import com.consullo.agenthost.api.CallerContext;
import com.consullo.agenthost.api.OutputView;
import com.consullo.agenthost.app.AgentHost;
import com.consullo.agenthost.config.HostConfig;
import com.consullo.agenthost.config.RateLimitConfig;
import com.consullo.agenthost.config.SecurityConfig;
import com.consullo.agenthost.security.Credentials;
import com.consullo.agenthost.session.OutputChunk;
import com.consullo.agenthost.session.SessionManagerConfig;
import com.consullo.agenthost.session.SessionSnapshot;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that hosts one session running a shell, sends it a command and prints what came back.
 *
 * @since 1.0
 */
public final class AgentHostDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(AgentHostDemo.class);

  private AgentHostDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final Path base = Files.createTempDirectory("agent-host-demo");
    final HostConfig config = new HostConfig(
        SessionManagerConfig.builder()
            .workspaceBasePath(base)
            .agentCommand(List.of("/bin/bash", "--norc", "--noprofile"))
            .terminalSize(120, 40)
            .build(),
        new SecurityConfig(null, null),
        RateLimitConfig.defaults());

    try (final AgentHost host = new AgentHost(config)) {
      host.start();
      final AgentHostApi api = host.api();
      final CallerContext caller = new CallerContext("127.0.0.1", null, "demo-user");

      final SessionSnapshot created = api.create(caller, new Credentials("demo-key", null), null);
      LOGGER.info("Started demo session {} in {}", created.sessionId(), created.workspacePath());

      api.sendCommand(caller, created.sessionId(), "echo \"hello from $PWD\"\n");

      System.out.println("=== Captured Output ===");
      int emptyPolls = 0;
      int totalChunks = 0;
      while (emptyPolls < 5) {
        final OutputView output = api.getOutput(caller, created.sessionId(), true);
        for (final OutputChunk chunk : output.chunks()) {
          System.out.print(chunk.data());
          totalChunks++;
        }
        emptyPolls = output.chunks().isEmpty() ? emptyPolls + 1 : 0;
        Thread.sleep(200L);
      }
      System.out.println();
      System.out.println("=== End Output (" + totalChunks + " chunks) ===");

      api.terminate(caller, created.sessionId());
      LOGGER.info("Demo completed; health: {}", api.health());
    }
  }
}
