package com.consullo.agenthost.api;

import com.consullo.agenthost.error.AuthException;
import com.consullo.agenthost.error.RateLimitedException;
import com.consullo.agenthost.error.SessionException;
import com.consullo.agenthost.error.ValidationException;
import com.consullo.agenthost.ratelimit.ClientRateLimiter;
import com.consullo.agenthost.security.Credentials;
import com.consullo.agenthost.security.SharedSecretAuthGate;
import com.consullo.agenthost.session.Session;
import com.consullo.agenthost.session.SessionManager;
import com.consullo.agenthost.session.SessionSnapshot;
import java.time.Clock;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport-agnostic entry point for session operations.
 *
 * <p>
 * Every call except {@link #health()} is authenticated, then rate limited per client, and must name
 * the user it acts for. Sessions are only reachable by their owner; a session owned by someone else
 * is reported exactly like a missing one.
 * </p>
 *
 * @since 1.0
 */
public final class AgentHostApi {

  private static final Logger LOGGER = LoggerFactory.getLogger(AgentHostApi.class);

  private final SharedSecretAuthGate authGate;
  private final ClientRateLimiter rateLimiter;
  private final SessionManager sessionManager;
  private final Clock clock;

  public AgentHostApi(
      final SharedSecretAuthGate authGate,
      final ClientRateLimiter rateLimiter,
      final SessionManager sessionManager,
      final Clock clock) {
    Validate.notNull(authGate, "authGate must not be null");
    Validate.notNull(rateLimiter, "rateLimiter must not be null");
    Validate.notNull(sessionManager, "sessionManager must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.authGate = authGate;
    this.rateLimiter = rateLimiter;
    this.sessionManager = sessionManager;
    this.clock = clock;
  }

  /**
   * Creates a session for the caller.
   *
   * @param ctx caller
   * @param credentials agent credentials; the Anthropic API key is required
   * @param workspaceType {@code isolated}, {@code persistent}, or null for the configured default
   * @return status of the new session
   * @throws SessionException on any classified failure
   */
  public SessionSnapshot create(final CallerContext ctx, final Credentials credentials, final String workspaceType)
      throws SessionException {
    final String userId = admit(ctx);
    if (credentials == null || StringUtils.isBlank(credentials.anthropicApiKey())) {
      throw new ValidationException("anthropicApiKey is required");
    }
    try {
      return sessionManager.createSession(userId, credentials, workspaceType).getStatus();
    } catch (final SessionException e) {
      LOGGER.error("Failed to create session for user {}: {}", userId, e.getMessage());
      throw e;
    }
  }

  public void sendCommand(final CallerContext ctx, final String sessionId, final String command)
      throws SessionException {
    final String userId = admit(ctx);
    sessionManager.getSessionForUser(sessionId, userId).sendCommand(command);
  }

  /**
   * Reads buffered output.
   *
   * @param ctx caller
   * @param sessionId session handle
   * @param clear whether to empty the buffer in the same step
   * @return buffered chunks and current status
   * @throws SessionException on any classified failure
   */
  public OutputView getOutput(final CallerContext ctx, final String sessionId, final boolean clear)
      throws SessionException {
    final String userId = admit(ctx);
    final Session session = sessionManager.getSessionForUser(sessionId, userId);
    return new OutputView(session.sessionId(), session.getOutput(clear), session.status());
  }

  /**
   * Returns the session status. Counts as activity for the idle timeout.
   */
  public SessionSnapshot getStatus(final CallerContext ctx, final String sessionId) throws SessionException {
    final String userId = admit(ctx);
    final Session session = sessionManager.getSessionForUser(sessionId, userId);
    session.touch();
    return session.getStatus();
  }

  public void resize(final CallerContext ctx, final String sessionId, final int columns, final int rows)
      throws SessionException {
    final String userId = admit(ctx);
    sessionManager.getSessionForUser(sessionId, userId).resize(columns, rows);
  }

  public void terminate(final CallerContext ctx, final String sessionId) throws SessionException {
    final String userId = admit(ctx);
    sessionManager.terminateSessionForUser(sessionId, userId);
  }

  public List<SessionSnapshot> listForUser(final CallerContext ctx) throws SessionException {
    final String userId = admit(ctx);
    return sessionManager.listSessionsForUser(userId);
  }

  public HealthReport health() {
    final Runtime runtime = Runtime.getRuntime();
    final long usedMb = (runtime.totalMemory() - runtime.freeMemory()) / (1024 * 1024);
    return new HealthReport("healthy", clock.instant(), sessionManager.activeSessionCount(), usedMb);
  }

  private String admit(final CallerContext ctx) throws AuthException, RateLimitedException, ValidationException {
    Validate.notNull(ctx, "ctx must not be null");
    authGate.authenticate(ctx.bearerToken());
    if (!rateLimiter.tryAcquire(ctx.clientAddress())) {
      LOGGER.warn("Rate limit exceeded for client {}", ctx.clientAddress());
      throw new RateLimitedException("rate limit exceeded");
    }
    if (StringUtils.isBlank(ctx.userId())) {
      throw new ValidationException("user id is required");
    }
    return ctx.userId();
  }
}
