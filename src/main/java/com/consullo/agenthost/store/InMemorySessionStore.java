package com.consullo.agenthost.store;

import com.consullo.agenthost.session.SessionStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Heap-backed {@link SessionStore}. Contents do not survive the JVM.
 *
 * @since 1.0
 */
public final class InMemorySessionStore implements SessionStore {

  private static final Comparator<SessionRecord> NEWEST_FIRST =
      Comparator.comparing(SessionRecord::createdAt).reversed();

  private final Object lock = new Object();
  private final Map<String, SessionRecord> sessions = new HashMap<>();
  private final Map<String, List<StoredOutputChunk>> output = new HashMap<>();
  private final Clock clock;
  private long nextChunkId = 1;

  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  public InMemorySessionStore(final Clock clock) {
    Validate.notNull(clock, "clock must not be null");
    this.clock = clock;
  }

  @Override
  public void upsertSession(final SessionRecord record) {
    Validate.notNull(record, "record must not be null");
    synchronized (lock) {
      sessions.put(record.sessionId(), record);
    }
  }

  @Override
  public long appendOutput(final String sessionId, final Instant timestamp, final String data) throws StoreException {
    synchronized (lock) {
      if (!sessions.containsKey(sessionId)) {
        throw new StoreException("unknown session " + sessionId);
      }
      final long id = nextChunkId++;
      output.computeIfAbsent(sessionId, k -> new ArrayList<>())
          .add(new StoredOutputChunk(id, sessionId, timestamp, data));
      return id;
    }
  }

  @Override
  public void updateStatus(final String sessionId, final SessionStatus status) {
    synchronized (lock) {
      sessions.computeIfPresent(sessionId, (id, rec) -> rec.withStatus(status, clock.instant()));
    }
  }

  @Override
  public void updateLastActivity(final String sessionId, final Instant lastActivity) {
    synchronized (lock) {
      sessions.computeIfPresent(sessionId, (id, rec) -> rec.withLastActivity(lastActivity, clock.instant()));
    }
  }

  @Override
  public Optional<SessionRecord> findSession(final String sessionId) {
    synchronized (lock) {
      return Optional.ofNullable(sessions.get(sessionId));
    }
  }

  @Override
  public List<SessionRecord> findByUser(final String userId) {
    synchronized (lock) {
      return sessions.values().stream()
          .filter(rec -> rec.userId().equals(userId))
          .sorted(NEWEST_FIRST)
          .toList();
    }
  }

  @Override
  public List<SessionRecord> findActive() {
    synchronized (lock) {
      return sessions.values().stream()
          .filter(rec -> isLive(rec.status()))
          .sorted(NEWEST_FIRST)
          .toList();
    }
  }

  @Override
  public List<StoredOutputChunk> findOutput(final String sessionId, final int limit) {
    Validate.isTrue(limit >= 0, "limit must not be negative");
    synchronized (lock) {
      final List<StoredOutputChunk> chunks = output.getOrDefault(sessionId, List.of());
      final int from = Math.max(0, chunks.size() - limit);
      return List.copyOf(chunks.subList(from, chunks.size()));
    }
  }

  @Override
  public void deleteSession(final String sessionId) {
    synchronized (lock) {
      sessions.remove(sessionId);
      output.remove(sessionId);
    }
  }

  @Override
  public int markStaleSessionsTerminated() {
    synchronized (lock) {
      final Instant now = clock.instant();
      int changed = 0;
      for (final Map.Entry<String, SessionRecord> entry : sessions.entrySet()) {
        if (isLive(entry.getValue().status())) {
          entry.setValue(entry.getValue().withStatus(SessionStatus.TERMINATED, now));
          changed++;
        }
      }
      return changed;
    }
  }

  private static boolean isLive(final SessionStatus status) {
    return status == SessionStatus.ACTIVE || status == SessionStatus.INITIALIZING;
  }
}
