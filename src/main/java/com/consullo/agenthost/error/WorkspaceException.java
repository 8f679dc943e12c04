package com.consullo.agenthost.error;

/**
 * Workspace directory allocation or removal failed.
 */
public final class WorkspaceException extends SessionException {

  public WorkspaceException(final String message) {
    super(ErrorCode.WORKSPACE, message);
  }

  public WorkspaceException(final String message, final Throwable cause) {
    super(ErrorCode.WORKSPACE, message, cause);
  }
}
