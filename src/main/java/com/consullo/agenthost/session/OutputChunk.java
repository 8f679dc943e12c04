package com.consullo.agenthost.session;

import java.time.Instant;

/**
 * One timestamped fragment of captured process output.
 *
 * @param timestamp when the fragment was read from the PTY
 * @param data decoded text
 * @since 1.0
 */
public record OutputChunk(Instant timestamp, String data) {

  public OutputChunk {
    if (timestamp == null || data == null) {
      throw new IllegalArgumentException("timestamp/data must not be null.");
    }
  }
}
