package com.consullo.agenthost.store;

import com.consullo.agenthost.session.SessionStatus;
import java.time.Instant;

/**
 * Persisted view of a session.
 *
 * @param sessionId session handle
 * @param userId owner
 * @param workspacePath workspace directory
 * @param status last recorded status
 * @param encryptedCredentials JSON blob of encrypted credentials, or null when none were stored
 * @param lastActivity last recorded activity
 * @param createdAt creation time
 * @param updatedAt time of the last write to this record
 * @since 1.0
 */
public record SessionRecord(
    String sessionId,
    String userId,
    String workspacePath,
    SessionStatus status,
    String encryptedCredentials,
    Instant lastActivity,
    Instant createdAt,
    Instant updatedAt) {

  public SessionRecord withStatus(final SessionStatus newStatus, final Instant now) {
    return new SessionRecord(sessionId, userId, workspacePath, newStatus, encryptedCredentials, lastActivity,
        createdAt, now);
  }

  public SessionRecord withLastActivity(final Instant activity, final Instant now) {
    return new SessionRecord(sessionId, userId, workspacePath, status, encryptedCredentials, activity,
        createdAt, now);
  }
}
