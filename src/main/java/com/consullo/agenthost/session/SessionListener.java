package com.consullo.agenthost.session;

/**
 * Receives session events. Callbacks run on the thread that caused the event and never while the
 * session holds its own lock.
 *
 * @since 1.0
 */
interface SessionListener {

  /**
   * Output was appended to the session buffer.
   *
   * @param session source session
   * @param chunk appended chunk
   */
  void onOutput(Session session, OutputChunk chunk);

  /**
   * The session reached a terminal state and released its resources.
   *
   * @param session source session
   * @param finalStatus {@link SessionStatus#TERMINATED} or {@link SessionStatus#ERROR}
   * @param unsolicited true when the process ended on its own rather than through {@link Session#cleanup()}
   */
  void onClosed(Session session, SessionStatus finalStatus, boolean unsolicited);
}
