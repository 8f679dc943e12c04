package com.consullo.agenthost.session;

import com.consullo.agenthost.error.InternalException;
import com.consullo.agenthost.error.LimitExceededException;
import com.consullo.agenthost.error.SessionException;
import com.consullo.agenthost.error.SessionNotFoundException;
import com.consullo.agenthost.error.SpawnFailureException;
import com.consullo.agenthost.error.ValidationException;
import com.consullo.agenthost.error.WorkspaceException;
import com.consullo.agenthost.pty.PtyProcessConfig;
import com.consullo.agenthost.pty.PtyProcessController;
import com.consullo.agenthost.pty.PtyProcessLauncher;
import com.consullo.agenthost.security.AesGcmCredentialCipher;
import com.consullo.agenthost.security.CipherException;
import com.consullo.agenthost.security.CredentialVault;
import com.consullo.agenthost.security.Credentials;
import com.consullo.agenthost.store.SessionRecord;
import com.consullo.agenthost.store.SessionRecorder;
import com.google.common.base.CharMatcher;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of live sessions keyed by session id.
 *
 * <p>
 * Enforces ownership (a session is only visible to the user that created it), the per-user session
 * quota and the idle timeout. The registry lock covers membership only: spawning, workspace I/O and
 * cleanup always run outside it. A session leaves the registry before its cleanup starts, so a lookup
 * never returns a session that is being torn down by the sweep or by a terminate call.
 * </p>
 *
 * <p>Lock order is registry, then session. Sessions never call back into the manager while holding
 * their own lock.</p>
 *
 * @since 1.0
 */
public final class SessionManager implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

  private static final CharMatcher USER_ID_CHARS = CharMatcher.inRange('a', 'z')
      .or(CharMatcher.inRange('A', 'Z'))
      .or(CharMatcher.inRange('0', '9'))
      .or(CharMatcher.anyOf("_-"));

  private final SessionManagerConfig config;
  private final PtyProcessLauncher launcher;
  private final SessionRecorder recorder;
  private final CredentialVault vault;
  private final Clock clock;
  private final WorkspaceAllocator workspaces;
  private final SessionListener listener = new RegistryListener();

  private final Object registryLock = new Object();
  // Guarded by registryLock.
  private final Map<String, Session> sessions = new HashMap<>();
  private final Map<String, Integer> pendingCreates = new HashMap<>();

  private ScheduledExecutorService sweeper;

  public SessionManager(final SessionManagerConfig config) {
    this(config, PtyProcessLauncher.pty4j(), SessionRecorder.disabled(),
        new CredentialVault(new AesGcmCredentialCipher(), config.encryptionKey()), Clock.systemUTC());
  }

  /**
   * Creates a manager.
   *
   * @param config limits, defaults and agent command
   * @param launcher spawns agent processes
   * @param recorder persistence boundary; {@link SessionRecorder#disabled()} keeps everything in memory
   * @param vault encrypts credentials before they are recorded
   * @param clock time source for activity and timeouts
   */
  public SessionManager(
      final SessionManagerConfig config,
      final PtyProcessLauncher launcher,
      final SessionRecorder recorder,
      final CredentialVault vault,
      final Clock clock) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(launcher, "launcher must not be null");
    Validate.notNull(recorder, "recorder must not be null");
    Validate.notNull(vault, "vault must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.config = config;
    this.launcher = launcher;
    this.recorder = recorder;
    this.vault = vault;
    this.clock = clock;
    this.workspaces = new WorkspaceAllocator(config.workspaceBasePath());
    LOGGER.info("Session manager configured: {}", config);
  }

  public SessionManagerConfig config() {
    return config;
  }

  /**
   * Creates a session: allocates its workspace, spawns the agent with the credentials in its
   * environment and starts draining its output.
   *
   * @param userId owner
   * @param credentials credentials exported to the agent process
   * @param workspaceType {@code isolated} or {@code persistent}; null or blank selects the default
   * @return the new, active session
   * @throws ValidationException if the user id or workspace type is invalid
   * @throws LimitExceededException if the user already holds {@code maxPerUser} sessions
   * @throws InternalException if the credentials cannot be encrypted
   * @throws WorkspaceException if the workspace cannot be created
   * @throws SpawnFailureException if the agent process cannot be started
   */
  public Session createSession(final String userId, final Credentials credentials, final String workspaceType)
      throws SessionException {
    validateUserId(userId);
    if (credentials == null) {
      throw new ValidationException("credentials are required");
    }
    final WorkspaceType type = resolveWorkspaceType(workspaceType);

    reserveSlot(userId);
    boolean registered = false;
    try {
      final String sessionId = UUID.randomUUID().toString();
      final Optional<String> sealed = sealCredentials(credentials);
      final Path workspace = workspaces.allocate(userId, sessionId, type);
      final Session session = new Session(sessionId, userId, type, workspace, config, workspaces, clock, listener);

      recorder.sessionSaved(new SessionRecord(
          sessionId,
          userId,
          workspace.toString(),
          SessionStatus.INITIALIZING,
          sealed.orElse(null),
          session.lastActivity(),
          session.created(),
          clock.instant()));

      spawn(session, credentials);

      synchronized (registryLock) {
        releaseSlot(userId);
        registered = true;
        final SessionStatus status = session.status();
        if (!status.isTerminal()) {
          sessions.put(sessionId, session);
        }
        recorder.statusChanged(sessionId, status);
      }
      LOGGER.info("Created session {} for user {} ({} workspace {})", sessionId, userId, type.label(), workspace);
      return session;
    } finally {
      if (!registered) {
        synchronized (registryLock) {
          releaseSlot(userId);
        }
      }
    }
  }

  /**
   * Looks up a session owned by {@code userId}.
   *
   * @param sessionId session handle
   * @param userId caller
   * @return the session
   * @throws SessionNotFoundException if the session does not exist or belongs to someone else
   */
  public Session getSessionForUser(final String sessionId, final String userId) throws SessionNotFoundException {
    synchronized (registryLock) {
      return ownedSession(sessionId, userId);
    }
  }

  /**
   * Removes an owned session from the registry and cleans it up.
   *
   * @param sessionId session handle
   * @param userId caller
   * @throws SessionNotFoundException if the session does not exist or belongs to someone else
   * @throws WorkspaceException if the isolated workspace could not be removed; the session is gone
   *     regardless
   */
  public void terminateSessionForUser(final String sessionId, final String userId)
      throws SessionNotFoundException, WorkspaceException {
    final Session session;
    synchronized (registryLock) {
      session = ownedSession(sessionId, userId);
      sessions.remove(sessionId);
    }
    LOGGER.info("Terminating session {} at the request of user {}", sessionId, userId);
    session.cleanup();
  }

  /**
   * Point-in-time status of every session owned by {@code userId}, oldest first.
   *
   * @param userId owner
   * @return snapshots
   */
  public List<SessionSnapshot> listSessionsForUser(final String userId) {
    final List<Session> owned = new ArrayList<>();
    synchronized (registryLock) {
      for (final Session session : sessions.values()) {
        if (session.userId().equals(userId)) {
          owned.add(session);
        }
      }
    }
    final List<SessionSnapshot> snapshots = new ArrayList<>(owned.size());
    for (final Session session : owned) {
      snapshots.add(session.getStatus());
    }
    snapshots.sort(Comparator.comparing(SessionSnapshot::created));
    return snapshots;
  }

  public int activeSessionCount() {
    synchronized (registryLock) {
      int count = 0;
      for (final Session session : sessions.values()) {
        if (!session.status().isTerminal()) {
          count++;
        }
      }
      return count;
    }
  }

  /**
   * Evicts every session idle for longer than the configured timeout. A failing cleanup is logged and
   * does not stop the sweep.
   *
   * @return number of sessions evicted
   */
  public int checkTimeouts() {
    final Instant cutoff = clock.instant().minus(config.idleTimeout());
    final List<Session> expired = new ArrayList<>();
    synchronized (registryLock) {
      final Iterator<Session> it = sessions.values().iterator();
      while (it.hasNext()) {
        final Session session = it.next();
        if (!session.status().isTerminal() && session.lastActivity().isBefore(cutoff)) {
          expired.add(session);
          it.remove();
        }
      }
    }
    for (final Session session : expired) {
      LOGGER.info("Session {} of user {} timed out (last activity {})",
          session.sessionId(), session.userId(), session.lastActivity());
      cleanupLogged(session);
    }
    return expired.size();
  }

  /**
   * Starts the periodic idle-timeout sweep. Calling it again has no effect.
   */
  public synchronized void start() {
    if (sweeper != null) {
      return;
    }
    sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread t = new Thread(r, "SessionTimeoutSweep");
      t.setDaemon(true);
      return t;
    });
    final long periodMillis = config.sweepInterval().toMillis();
    sweeper.scheduleAtFixedRate(this::sweepOnce, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    LOGGER.info("Idle-timeout sweep started (every {}, timeout {})", config.sweepInterval(), config.idleTimeout());
  }

  /**
   * Marks sessions recorded as live by a previous run as terminated.
   *
   * @return number of records changed
   */
  public int reconcileStore() {
    return recorder.reconcileAfterRestart();
  }

  /**
   * Removes and cleans up every session.
   */
  public void cleanupAll() {
    final List<Session> all;
    synchronized (registryLock) {
      all = new ArrayList<>(sessions.values());
      sessions.clear();
    }
    LOGGER.info("Cleaning up {} sessions", all.size());
    for (final Session session : all) {
      cleanupLogged(session);
    }
  }

  @Override
  public void close() {
    synchronized (this) {
      if (sweeper != null) {
        sweeper.shutdownNow();
        sweeper = null;
      }
    }
    cleanupAll();
  }

  /**
   * Accepts ASCII letters, digits, {@code _} and {@code -} only. The id becomes a directory name under
   * the workspace base.
   *
   * @param userId candidate id
   * @throws ValidationException if the id is unusable
   */
  static void validateUserId(final String userId) throws ValidationException {
    if (StringUtils.isEmpty(userId)) {
      throw new ValidationException("user_id is required");
    }
    if (!USER_ID_CHARS.matchesAllOf(userId)) {
      throw new ValidationException("invalid user_id: must be alphanumeric, hyphens, or underscores");
    }
  }

  private WorkspaceType resolveWorkspaceType(final String requested) throws ValidationException {
    if (StringUtils.isBlank(requested)) {
      return config.defaultWorkspaceType();
    }
    return WorkspaceType.parse(requested)
        .orElseThrow(() -> new ValidationException("unknown workspace type: " + requested));
  }

  private void reserveSlot(final String userId) throws LimitExceededException {
    synchronized (registryLock) {
      int held = pendingCreates.getOrDefault(userId, 0);
      for (final Session session : sessions.values()) {
        if (session.userId().equals(userId) && !session.status().isTerminal()) {
          held++;
        }
      }
      if (held >= config.maxPerUser()) {
        throw new LimitExceededException("maximum sessions per user reached (" + config.maxPerUser() + ")");
      }
      pendingCreates.merge(userId, 1, Integer::sum);
    }
  }

  // Caller holds registryLock.
  private void releaseSlot(final String userId) {
    pendingCreates.computeIfPresent(userId, (k, n) -> n > 1 ? n - 1 : null);
  }

  private Optional<String> sealCredentials(final Credentials credentials) throws InternalException {
    if (!recorder.enabled()) {
      return Optional.empty();
    }
    try {
      return vault.seal(credentials);
    } catch (final CipherException e) {
      throw new InternalException("failed to encrypt credentials", e);
    }
  }

  private void spawn(final Session session, final Credentials credentials) throws SpawnFailureException {
    final PtyProcessConfig processConfig = new PtyProcessConfig(
        config.agentCommand(),
        session.workspacePath(),
        childEnvironment(credentials, session.workspacePath()),
        config.initialColumns(),
        config.initialRows(),
        config.terminationGrace());
    PtyProcessController process = null;
    try {
      process = launcher.launch(processConfig);
      session.attach(process);
    } catch (final Exception e) {
      LOGGER.error("Failed to start agent for session {}: {}", session.sessionId(), e.getMessage());
      closeAfterFailedSpawn(process, session);
      throw new SpawnFailureException("failed to start agent process: " + e.getMessage(), e);
    }
  }

  private void closeAfterFailedSpawn(final PtyProcessController process, final Session session) {
    if (process != null) {
      try {
        process.close();
      } catch (final Exception e) {
        LOGGER.warn("Error closing process of failed session {}: {}", session.sessionId(), e.getMessage());
      }
    }
    try {
      workspaces.release(session.workspacePath(), session.workspaceType());
    } catch (final WorkspaceException e) {
      LOGGER.warn("Error removing workspace of failed session {}: {}", session.sessionId(), e.getMessage());
    }
    recorder.statusChanged(session.sessionId(), SessionStatus.ERROR);
  }

  private static Map<String, String> childEnvironment(final Credentials credentials, final Path workspace) {
    final Map<String, String> env = new LinkedHashMap<>();
    if (StringUtils.isNotBlank(credentials.anthropicApiKey())) {
      env.put("ANTHROPIC_API_KEY", credentials.anthropicApiKey());
    }
    if (credentials.hasGithubToken()) {
      env.put("GITHUB_TOKEN", credentials.githubToken());
    }
    env.put("HOME", workspace.toString());
    env.put("PWD", workspace.toString());
    env.put("TERM", "xterm-256color");
    return env;
  }

  // Caller holds registryLock.
  private Session ownedSession(final String sessionId, final String userId) throws SessionNotFoundException {
    final Session session = sessionId == null ? null : sessions.get(sessionId);
    if (session == null || !session.userId().equals(userId)) {
      throw new SessionNotFoundException();
    }
    return session;
  }

  private void sweepOnce() {
    try {
      final int evicted = checkTimeouts();
      if (evicted > 0) {
        LOGGER.info("Idle-timeout sweep evicted {} sessions", evicted);
      }
    } catch (final RuntimeException e) {
      LOGGER.error("Idle-timeout sweep failed", e);
    }
  }

  private static void cleanupLogged(final Session session) {
    try {
      session.cleanup();
    } catch (final WorkspaceException e) {
      LOGGER.warn("Error cleaning up session {}: {}", session.sessionId(), e.getMessage(), e);
    } catch (final RuntimeException e) {
      LOGGER.error("Unexpected error cleaning up session {}", session.sessionId(), e);
    }
  }

  private final class RegistryListener implements SessionListener {

    @Override
    public void onOutput(final Session session, final OutputChunk chunk) {
      recorder.outputCaptured(session.sessionId(), chunk);
    }

    @Override
    public void onClosed(final Session session, final SessionStatus finalStatus, final boolean unsolicited) {
      if (unsolicited) {
        synchronized (registryLock) {
          sessions.remove(session.sessionId(), session);
        }
        LOGGER.info("Session {} ended on its own ({})", session.sessionId(), finalStatus.label());
      }
      recorder.activityRecorded(session.sessionId(), session.lastActivity());
      recorder.statusChanged(session.sessionId(), finalStatus);
    }
  }
}
