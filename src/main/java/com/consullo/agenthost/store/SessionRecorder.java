package com.consullo.agenthost.store;

import com.consullo.agenthost.session.OutputChunk;
import com.consullo.agenthost.session.SessionStatus;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes session state to a {@link SessionStore} off the caller's thread.
 *
 * <p>
 * A single writer thread keeps writes in submission order, so output chunks are stored in the order
 * they were captured. Idempotent writes (record upserts, status and activity updates) are retried;
 * output appends are attempted once. Failures are logged and never propagate into session state.
 * </p>
 */
public class SessionRecorder implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionRecorder.class);

  private final SessionStore store;
  private final Retry retry;
  private final ExecutorService writer;

  /**
   * Creates a recorder with the default retry policy (3 attempts, 200 ms apart).
   *
   * @param store target store
   */
  public SessionRecorder(final SessionStore store) {
    this(store, RetryConfig.custom()
        .maxAttempts(3)
        .waitDuration(Duration.ofMillis(200))
        .retryExceptions(StoreException.class)
        .build());
  }

  public SessionRecorder(final SessionStore store, final RetryConfig retryConfig) {
    Validate.notNull(store, "store must not be null");
    Validate.notNull(retryConfig, "retryConfig must not be null");
    this.store = store;
    this.retry = Retry.of("sessionStore", retryConfig);
    this.retry.getEventPublisher().onRetry(event -> LOGGER.debug(
        "Retrying store write (attempt {}): {}",
        event.getNumberOfRetryAttempts(),
        event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
    this.writer = Executors.newSingleThreadExecutor(r -> {
      final Thread t = new Thread(r, "SessionRecorder");
      t.setDaemon(true);
      return t;
    });
  }

  private SessionRecorder() {
    this.store = null;
    this.retry = null;
    this.writer = null;
  }

  /**
   * Recorder that drops every write, for in-memory-only operation.
   *
   * @return no-op recorder
   */
  public static SessionRecorder disabled() {
    return new SessionRecorder();
  }

  public boolean enabled() {
    return store != null;
  }

  public void sessionSaved(final SessionRecord record) {
    submitRetried("save session", record.sessionId(), () -> store.upsertSession(record));
  }

  public void outputCaptured(final String sessionId, final OutputChunk chunk) {
    submit("save output chunk", sessionId, () -> store.appendOutput(sessionId, chunk.timestamp(), chunk.data()));
  }

  public void statusChanged(final String sessionId, final SessionStatus status) {
    submitRetried("update status", sessionId, () -> store.updateStatus(sessionId, status));
  }

  public void activityRecorded(final String sessionId, final Instant lastActivity) {
    submitRetried("update last activity", sessionId, () -> store.updateLastActivity(sessionId, lastActivity));
  }

  /**
   * Marks records left {@code active}/{@code initializing} by a previous run as terminated. Runs on the
   * calling thread.
   *
   * @return number of records changed, or 0 when disabled or the store failed
   */
  public int reconcileAfterRestart() {
    if (!enabled()) {
      return 0;
    }
    try {
      final int count = retry.executeCallable(store::markStaleSessionsTerminated);
      if (count > 0) {
        LOGGER.info("Marked {} stale sessions as terminated on startup", count);
      } else {
        LOGGER.info("No stale sessions found on startup");
      }
      return count;
    } catch (final Exception e) {
      LOGGER.error("Failed to mark stale sessions as terminated", e);
      return 0;
    }
  }

  /**
   * Blocks until every write submitted so far has been attempted.
   *
   * @param timeout maximum wait
   * @return true if the writer caught up within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitIdle(final Duration timeout) throws InterruptedException {
    if (!enabled()) {
      return true;
    }
    try {
      writer.submit(() -> { }).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (final TimeoutException | RejectedExecutionException e) {
      return false;
    } catch (final ExecutionException e) {
      throw new IllegalStateException("no-op write failed", e.getCause());
    }
  }

  @Override
  public void close() {
    if (!enabled()) {
      return;
    }
    writer.shutdown();
    try {
      if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warn("Session recorder did not drain within 5s; dropping pending writes");
        writer.shutdownNow();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      writer.shutdownNow();
    }
  }

  private void submitRetried(final String operation, final String sessionId, final StoreWrite write) {
    submit(operation, sessionId, () -> retry.executeCallable(toCallable(write)));
  }

  private void submit(final String operation, final String sessionId, final Callable<?> write) {
    if (!enabled()) {
      return;
    }
    try {
      writer.execute(() -> {
        try {
          write.call();
        } catch (final Exception e) {
          LOGGER.warn("Failed to {} for session {}: {}", operation, sessionId, e.getMessage());
        }
      });
    } catch (final RejectedExecutionException e) {
      LOGGER.warn("Dropped store write '{}' for session {}: recorder is closed", operation, sessionId);
    }
  }

  private static Callable<Void> toCallable(final StoreWrite write) {
    return () -> {
      write.run();
      return null;
    };
  }

  @FunctionalInterface
  private interface StoreWrite {
    void run() throws StoreException;
  }
}
