package com.consullo.agenthost.api;

import java.time.Instant;

/**
 * Liveness information, served without authentication.
 *
 * @param status always {@code healthy} while the host answers
 * @param timestamp time of the report
 * @param activeSessions number of non-terminal sessions
 * @param memoryAllocatedMb heap in use, in MiB
 */
public record HealthReport(String status, Instant timestamp, int activeSessions, long memoryAllocatedMb) {
}
