package com.consullo.agenthost.session;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Point-in-time copy of a session's observable state.
 *
 * @param sessionId session handle
 * @param userId owner
 * @param status lifecycle state when the snapshot was taken
 * @param workspaceType isolated or persistent
 * @param workspacePath working directory of the process
 * @param created creation time
 * @param lastActivity last command, output, resize or status read
 * @param outputBufferLength number of buffered chunks
 * @since 1.0
 */
public record SessionSnapshot(
    String sessionId,
    String userId,
    SessionStatus status,
    WorkspaceType workspaceType,
    Path workspacePath,
    Instant created,
    Instant lastActivity,
    int outputBufferLength) {
}
