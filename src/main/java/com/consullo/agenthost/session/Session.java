package com.consullo.agenthost.session;

import com.consullo.agenthost.error.InvalidStateException;
import com.consullo.agenthost.error.LimitExceededException;
import com.consullo.agenthost.error.SessionIoException;
import com.consullo.agenthost.error.ValidationException;
import com.consullo.agenthost.error.WorkspaceException;
import com.consullo.agenthost.pty.PtyProcessController;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One interactive agent process attached to a PTY, plus its output buffer and activity clock.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the PTY process controller (never shared)</li>
 * <li>a daemon thread draining PTY output into the {@link OutputBuffer}</li>
 * <li>the workspace directory, when it is isolated</li>
 * </ul>
 * </p>
 *
 * <p>
 * {@code lock} guards status, activity time and the buffer. PTY writes serialize on
 * {@code writeLock} instead, so a write stuck on a full PTY never stalls output draining.
 * </p>
 */
public final class Session {

  private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

  private final String sessionId;
  private final String userId;
  private final WorkspaceType workspaceType;
  private final Path workspacePath;
  private final Instant created;
  private final int maxCommandLength;
  private final Duration commandInterval;
  private final WorkspaceAllocator workspaces;
  private final Clock clock;
  private final SessionListener listener;

  private final Object lock = new Object();
  private final Object writeLock = new Object();
  private final AtomicBoolean stopSignal = new AtomicBoolean(false);

  // Guarded by lock.
  private final OutputBuffer outputBuffer;
  private SessionStatus status = SessionStatus.INITIALIZING;
  private Instant lastActivity;
  private Instant lastCommandAt;
  private boolean closing;
  private PtyProcessController process;
  private long processId = -1L;
  private OutputStream ptyInput;

  Session(
      String sessionId,
      String userId,
      WorkspaceType workspaceType,
      Path workspacePath,
      SessionManagerConfig config,
      WorkspaceAllocator workspaces,
      Clock clock,
      SessionListener listener) {
    this.sessionId = sessionId;
    this.userId = userId;
    this.workspaceType = workspaceType;
    this.workspacePath = workspacePath;
    this.maxCommandLength = config.maxCommandLength();
    this.commandInterval = config.commandInterval();
    this.workspaces = workspaces;
    this.clock = clock;
    this.listener = listener;
    this.outputBuffer = new OutputBuffer(config.outputBufferSize());
    this.created = clock.instant();
    this.lastActivity = this.created;
  }

  public String sessionId() {
    return sessionId;
  }

  public String userId() {
    return userId;
  }

  public Path workspacePath() {
    return workspacePath;
  }

  public WorkspaceType workspaceType() {
    return workspaceType;
  }

  public Instant created() {
    return created;
  }

  public SessionStatus status() {
    synchronized (lock) {
      return status;
    }
  }

  public Instant lastActivity() {
    synchronized (lock) {
      return lastActivity;
    }
  }

  /**
   * Takes ownership of a freshly spawned process, moves to {@link SessionStatus#ACTIVE} and starts the
   * output draining thread.
   *
   * @param controller spawned process
   * @throws Exception if the PTY streams cannot be obtained; the caller still owns the process then
   */
  void attach(PtyProcessController controller) throws Exception {
    final long pid = controller.pid();
    final OutputStream input = controller.getPtyInput();
    final Reader output = new InputStreamReader(controller.getPtyOutput(), StandardCharsets.UTF_8);
    synchronized (lock) {
      if (status != SessionStatus.INITIALIZING) {
        throw new IllegalStateException("Session " + sessionId + " is already " + status.label());
      }
      this.process = controller;
      this.processId = pid;
      this.ptyInput = input;
      this.status = SessionStatus.ACTIVE;
      this.lastActivity = clock.instant();
    }
    LOGGER.info("Session {} attached to process {}", sessionId, pid);
    startOutputDrain(output);
  }

  /**
   * Id of the attached process, or -1 before one is attached.
   */
  public long processId() {
    synchronized (lock) {
      return processId;
    }
  }

  /**
   * Sanitizes {@code command} and writes it to the process.
   *
   * @param command raw command text; a trailing newline is not added
   * @throws InvalidStateException if the session is not active
   * @throws ValidationException if the command is too long
   * @throws LimitExceededException if commands arrive faster than the per-session interval
   * @throws SessionIoException if the PTY write fails
   */
  public void sendCommand(final String command)
      throws InvalidStateException, ValidationException, LimitExceededException, SessionIoException {
    if (command == null) {
      throw new ValidationException("command must not be null");
    }
    final OutputStream input;
    synchronized (lock) {
      requireActive();
      if (command.getBytes(StandardCharsets.UTF_8).length > maxCommandLength) {
        throw new ValidationException("command too long (max " + maxCommandLength + " bytes)");
      }
      final Instant now = clock.instant();
      if (lastCommandAt != null && Duration.between(lastCommandAt, now).compareTo(commandInterval) < 0) {
        throw new LimitExceededException("command rate limit exceeded, try again shortly");
      }
      lastCommandAt = now;
      lastActivity = now;
      input = ptyInput;
    }

    final String sanitized = CommandSanitizer.sanitize(command);
    synchronized (writeLock) {
      try {
        input.write(sanitized.getBytes(StandardCharsets.UTF_8));
        input.flush();
      } catch (final IOException e) {
        if (stopSignal.get()) {
          throw new InvalidStateException("session is not active (status: terminated)");
        }
        throw new SessionIoException("failed to write command", e);
      }
    }
    LOGGER.debug("Command sent to session {} ({} chars)", sessionId, sanitized.length());
  }

  /**
   * Appends process output to the buffer, dropping the oldest chunks beyond capacity.
   *
   * @param data decoded output
   */
  void handleOutput(final String data) {
    final OutputChunk chunk;
    synchronized (lock) {
      if (status.isTerminal()) {
        return;
      }
      final Instant now = clock.instant();
      chunk = new OutputChunk(now, data);
      outputBuffer.append(chunk);
      lastActivity = now;
    }
    listener.onOutput(this, chunk);
  }

  /**
   * Returns buffered output, oldest first.
   *
   * @param clear if true the buffer is emptied in the same critical section as the copy
   * @return copy of the buffered chunks
   */
  public List<OutputChunk> getOutput(final boolean clear) {
    synchronized (lock) {
      return clear ? outputBuffer.drain() : outputBuffer.snapshot();
    }
  }

  /**
   * Forwards new terminal geometry to the PTY.
   *
   * @param columns new column count
   * @param rows new row count
   * @throws ValidationException if either dimension is not positive
   * @throws InvalidStateException if the session is not active
   * @throws SessionIoException if the PTY rejects the resize
   */
  public void resize(final int columns, final int rows)
      throws ValidationException, InvalidStateException, SessionIoException {
    if (columns <= 0 || rows <= 0) {
      throw new ValidationException("cols/rows must be positive");
    }
    final PtyProcessController controller;
    synchronized (lock) {
      requireActive();
      lastActivity = clock.instant();
      controller = process;
    }
    try {
      controller.resize(columns, rows);
    } catch (final Exception e) {
      throw new SessionIoException("failed to resize PTY", e);
    }
  }

  public SessionSnapshot getStatus() {
    synchronized (lock) {
      return new SessionSnapshot(
          sessionId, userId, status, workspaceType, workspacePath, created, lastActivity, outputBuffer.size());
    }
  }

  /**
   * Refreshes the activity clock without any other effect.
   */
  public void touch() {
    synchronized (lock) {
      if (!status.isTerminal()) {
        lastActivity = clock.instant();
      }
    }
  }

  /**
   * Stops output draining, terminates the process (graceful signal, then kill), closes the PTY and
   * removes an isolated workspace. Calls after the first return immediately.
   *
   * @throws WorkspaceException if the isolated workspace could not be removed; the session is
   *     terminated regardless
   */
  public void cleanup() throws WorkspaceException {
    close(SessionStatus.TERMINATED, false);
  }

  @VisibleForTesting
  void markLastActivity(final Instant instant) {
    synchronized (lock) {
      lastActivity = instant;
    }
  }

  private void requireActive() throws InvalidStateException {
    if (status != SessionStatus.ACTIVE || closing) {
      throw new InvalidStateException("session is not active (status: " + status.label() + ")");
    }
  }

  private void close(final SessionStatus finalStatus, final boolean unsolicited) throws WorkspaceException {
    final PtyProcessController controller;
    final long pid;
    synchronized (lock) {
      if (closing || status.isTerminal()) {
        return;
      }
      closing = true;
      controller = process;
      pid = processId;
    }
    stopSignal.set(true);
    LOGGER.info("Cleaning up session {} (user {}, process {})", sessionId, userId, pid);

    if (controller != null) {
      try {
        controller.close();
      } catch (final Exception e) {
        LOGGER.warn("Error terminating process for session {}: {}", sessionId, e.getMessage(), e);
      }
    }

    WorkspaceException workspaceFailure = null;
    try {
      workspaces.release(workspacePath, workspaceType);
    } catch (final WorkspaceException e) {
      workspaceFailure = e;
    }

    synchronized (lock) {
      status = finalStatus;
    }
    listener.onClosed(this, finalStatus, unsolicited);

    if (workspaceFailure != null) {
      throw workspaceFailure;
    }
  }

  private void startOutputDrain(final Reader reader) {
    final Thread drain = new Thread(() -> drainOutput(reader), "PtyReadLoop-" + sessionId);
    drain.setDaemon(true);
    drain.start();
  }

  private void drainOutput(final Reader reader) {
    final char[] buffer = new char[4096];
    try {
      int n;
      while (!stopSignal.get() && (n = reader.read(buffer)) != -1) {
        if (n > 0) {
          handleOutput(new String(buffer, 0, n));
        }
      }
      if (!stopSignal.get()) {
        LOGGER.info("Process for session {} exited", sessionId);
        closeAfterDrainEnded(SessionStatus.TERMINATED);
      }
    } catch (final IOException e) {
      if (stopSignal.get()) {
        LOGGER.debug("Output reader for session {} stopped: {}", sessionId, e.getMessage());
      } else {
        LOGGER.error("Error reading from PTY for session {}", sessionId, e);
        closeAfterDrainEnded(SessionStatus.ERROR);
      }
    } finally {
      LOGGER.info("Output reader for session {} terminated", sessionId);
    }
  }

  private void closeAfterDrainEnded(final SessionStatus finalStatus) {
    try {
      close(finalStatus, true);
    } catch (final WorkspaceException e) {
      LOGGER.warn("Error removing workspace of session {}: {}", sessionId, e.getMessage(), e);
    }
  }
}
