package com.consullo.agenthost.api;

import com.consullo.agenthost.session.OutputChunk;
import com.consullo.agenthost.session.SessionStatus;
import java.util.List;

/**
 * Result of an output read.
 *
 * @param sessionId session handle
 * @param chunks buffered output, oldest first
 * @param status session status at the time of the read
 */
public record OutputView(String sessionId, List<OutputChunk> chunks, SessionStatus status) {

  public OutputView {
    chunks = List.copyOf(chunks);
  }
}
