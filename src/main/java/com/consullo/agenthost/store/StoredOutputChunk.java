package com.consullo.agenthost.store;

import java.time.Instant;

/**
 * Output chunk as persisted. Ids increase monotonically in append order.
 *
 * @param id store-assigned id
 * @param sessionId owning session
 * @param timestamp capture time
 * @param data output text
 * @since 1.0
 */
public record StoredOutputChunk(long id, String sessionId, Instant timestamp, String data) {
}
