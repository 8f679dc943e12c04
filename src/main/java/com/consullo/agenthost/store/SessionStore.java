package com.consullo.agenthost.store;

import com.consullo.agenthost.session.SessionStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for session metadata and output history.
 *
 * <p>Implementations must be safe for concurrent use.
 *
 * @since 1.0
 */
public interface SessionStore {

  /**
   * Inserts or replaces the record with the same session id.
   *
   * @param record record to write
   * @throws StoreException on failure
   */
  void upsertSession(SessionRecord record) throws StoreException;

  /**
   * Appends an output chunk.
   *
   * @param sessionId owning session
   * @param timestamp capture time
   * @param data output text
   * @return id assigned to the chunk, greater than every id assigned before
   * @throws StoreException on failure
   */
  long appendOutput(String sessionId, Instant timestamp, String data) throws StoreException;

  void updateStatus(String sessionId, SessionStatus status) throws StoreException;

  void updateLastActivity(String sessionId, Instant lastActivity) throws StoreException;

  Optional<SessionRecord> findSession(String sessionId) throws StoreException;

  /**
   * Sessions of one owner, newest first.
   *
   * @param userId owner
   * @return records
   * @throws StoreException on failure
   */
  List<SessionRecord> findByUser(String userId) throws StoreException;

  /**
   * Sessions recorded as {@code active} or {@code initializing}, newest first.
   *
   * @return records
   * @throws StoreException on failure
   */
  List<SessionRecord> findActive() throws StoreException;

  /**
   * The most recent {@code limit} chunks of a session, oldest first.
   *
   * @param sessionId owning session
   * @param limit maximum number of chunks
   * @return chunks
   * @throws StoreException on failure
   */
  List<StoredOutputChunk> findOutput(String sessionId, int limit) throws StoreException;

  /**
   * Removes a session record together with its output.
   *
   * @param sessionId session to delete
   * @throws StoreException on failure
   */
  void deleteSession(String sessionId) throws StoreException;

  /**
   * Marks every {@code active} or {@code initializing} record as {@code terminated}. Called once at
   * startup: no process survives a restart of the host.
   *
   * @return number of records changed
   * @throws StoreException on failure
   */
  int markStaleSessionsTerminated() throws StoreException;
}
