package com.consullo.agenthost.app;

import com.consullo.agenthost.api.AgentHostApi;
import com.consullo.agenthost.config.HostConfig;
import com.consullo.agenthost.pty.PtyProcessLauncher;
import com.consullo.agenthost.ratelimit.ClientRateLimiter;
import com.consullo.agenthost.security.AesGcmCredentialCipher;
import com.consullo.agenthost.security.CredentialVault;
import com.consullo.agenthost.security.SharedSecretAuthGate;
import com.consullo.agenthost.session.SessionManager;
import com.consullo.agenthost.store.InMemorySessionStore;
import com.consullo.agenthost.store.SessionRecorder;
import com.consullo.agenthost.store.SessionStore;
import java.time.Clock;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the host together: store, recorder, session manager, auth gate, rate limiter and API facade.
 *
 * <p>Lifecycle: {@link #start()} reconciles the store with the fact that no process survives a restart
 * and starts the background sweeps; {@link #close()} terminates every session and stops them again.
 *
 * @since 1.0
 */
public final class AgentHost implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(AgentHost.class);

  private final HostConfig config;
  private final SessionRecorder recorder;
  private final SessionManager sessionManager;
  private final ClientRateLimiter rateLimiter;
  private final AgentHostApi api;

  public AgentHost(final HostConfig config) {
    this(config, new InMemorySessionStore(Clock.systemUTC()), PtyProcessLauncher.pty4j(), Clock.systemUTC());
  }

  /**
   * Creates a host.
   *
   * @param config configuration
   * @param store durable store, or null to keep sessions in memory only
   * @param launcher agent process launcher
   * @param clock time source
   */
  public AgentHost(
      final HostConfig config,
      final SessionStore store,
      final PtyProcessLauncher launcher,
      final Clock clock) {
    Validate.notNull(config, "config must not be null");
    this.config = config;
    if (store == null) {
      LOGGER.info("No session store configured; running with in-memory session storage only");
      this.recorder = SessionRecorder.disabled();
    } else {
      this.recorder = new SessionRecorder(store);
    }
    final CredentialVault vault = new CredentialVault(new AesGcmCredentialCipher(), config.security().encryptionKey());
    this.sessionManager = new SessionManager(config.session(), launcher, recorder, vault, clock);
    this.rateLimiter = new ClientRateLimiter(config.rateLimit().permitsPerSecond(), config.rateLimit().retention());
    this.api = new AgentHostApi(
        new SharedSecretAuthGate(config.security().apiAuthToken()), rateLimiter, sessionManager, clock);
  }

  public AgentHostApi api() {
    return api;
  }

  public SessionManager sessionManager() {
    return sessionManager;
  }

  public void start() {
    LOGGER.info("Starting agent host (workspace base {})", config.session().workspaceBasePath());
    sessionManager.reconcileStore();
    sessionManager.start();
    rateLimiter.start(config.rateLimit().sweepInterval());
  }

  @Override
  public void close() {
    LOGGER.info("Shutting down agent host");
    rateLimiter.close();
    sessionManager.close();
    recorder.close();
    LOGGER.info("Agent host stopped");
  }
}
