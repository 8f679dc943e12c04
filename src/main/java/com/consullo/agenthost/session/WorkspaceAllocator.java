package com.consullo.agenthost.session;

import com.consullo.agenthost.error.WorkspaceException;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allocates and removes session working directories under a base path.
 *
 * <p>Isolated workspaces live at {@code <base>/<userId>/<sessionId>} and are created fresh; persistent
 * workspaces live at {@code <base>/<userId>} and are reused. Every resolved path must stay under the
 * base directory.
 *
 * @since 1.0
 */
public final class WorkspaceAllocator {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkspaceAllocator.class);

  private final Path basePath;

  public WorkspaceAllocator(final Path basePath) {
    Validate.notNull(basePath, "basePath must not be null");
    this.basePath = basePath.toAbsolutePath().normalize();
  }

  public Path basePath() {
    return basePath;
  }

  /**
   * Creates (or, for persistent workspaces, reuses) the working directory for a session.
   *
   * @param userId validated owner id
   * @param sessionId new session id
   * @param type workspace type
   * @return absolute workspace path
   * @throws WorkspaceException if the path escapes the base or the directory cannot be created
   */
  public Path allocate(final String userId, final String sessionId, final WorkspaceType type)
      throws WorkspaceException {
    final Path userDir = resolveUnderBase(basePath.resolve(userId));
    try {
      if (type == WorkspaceType.PERSISTENT) {
        Files.createDirectories(userDir);
        LOGGER.debug("Using persistent workspace {} for user {}", userDir, userId);
        return userDir;
      }
      final Path sessionDir = resolveUnderBase(userDir.resolve(sessionId));
      Files.createDirectories(userDir);
      Files.createDirectory(sessionDir);
      LOGGER.debug("Created isolated workspace {} for session {}", sessionDir, sessionId);
      return sessionDir;
    } catch (final IOException e) {
      throw new WorkspaceException("failed to create workspace for user " + userId, e);
    }
  }

  /**
   * Removes an isolated workspace. Persistent workspaces are left in place.
   *
   * @param workspace workspace path returned by {@link #allocate}
   * @param type workspace type
   * @throws WorkspaceException if deletion fails
   */
  public void release(final Path workspace, final WorkspaceType type) throws WorkspaceException {
    if (type != WorkspaceType.ISOLATED || workspace == null) {
      return;
    }
    try {
      deleteRecursively(workspace);
      LOGGER.debug("Removed isolated workspace {}", workspace);
    } catch (final IOException e) {
      throw new WorkspaceException("failed to remove workspace " + workspace, e);
    }
  }

  private Path resolveUnderBase(final Path candidate) throws WorkspaceException {
    final Path normalized = candidate.toAbsolutePath().normalize();
    if (normalized.equals(basePath) || !normalized.startsWith(basePath)) {
      throw new WorkspaceException("workspace path traversal detected");
    }
    return normalized;
  }

  /**
   * Deletes a tree without following symbolic links; a link is removed, never its target.
   */
  private static void deleteRecursively(final Path path) throws IOException {
    if (Files.notExists(path, LinkOption.NOFOLLOW_LINKS)) {
      return;
    }

    Files.walkFileTree(path, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) throws IOException {
        Files.delete(file);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(final Path dir, final IOException exc) throws IOException {
        if (exc != null) {
          throw exc;
        }
        Files.delete(dir);
        return FileVisitResult.CONTINUE;
      }
    });
  }
}
