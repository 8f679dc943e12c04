package com.consullo.agenthost.session;

import com.consullo.agenthost.error.WorkspaceException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for workspace allocation and removal.
 *
 * @since 1.0
 */
public class WorkspaceAllocatorTest {

  @TempDir
  Path baseDir;

  @Test
  @DisplayName("Should create a fresh per-session directory for isolated workspaces")
  void allocate_Isolated_CreatesSessionDirectory() throws Exception {
    final WorkspaceAllocator allocator = new WorkspaceAllocator(baseDir);

    final Path workspace = allocator.allocate("alice", "s1", WorkspaceType.ISOLATED);

    assertThat(workspace).isEqualTo(baseDir.toAbsolutePath().normalize().resolve("alice").resolve("s1"));
    assertThat(workspace).isDirectory();
  }

  @Test
  @DisplayName("Should reuse the per-user directory for persistent workspaces")
  void allocate_PersistentTwice_SamePath() throws Exception {
    final WorkspaceAllocator allocator = new WorkspaceAllocator(baseDir);

    final Path first = allocator.allocate("bob", "s1", WorkspaceType.PERSISTENT);
    Files.writeString(first.resolve("notes.txt"), "keep");
    final Path second = allocator.allocate("bob", "s2", WorkspaceType.PERSISTENT);

    assertThat(second).isEqualTo(first);
    assertThat(second.resolve("notes.txt")).exists();
  }

  @Test
  @DisplayName("Should refuse to allocate the same isolated workspace twice")
  void allocate_IsolatedExisting_Fails() throws Exception {
    final WorkspaceAllocator allocator = new WorkspaceAllocator(baseDir);
    allocator.allocate("alice", "s1", WorkspaceType.ISOLATED);

    assertThatThrownBy(() -> allocator.allocate("alice", "s1", WorkspaceType.ISOLATED))
        .isInstanceOf(WorkspaceException.class);
  }

  @Test
  @DisplayName("Should reject ids resolving outside the base directory")
  void allocate_Traversal_Rejected() {
    final WorkspaceAllocator allocator = new WorkspaceAllocator(baseDir);

    assertThatThrownBy(() -> allocator.allocate("..", "s1", WorkspaceType.PERSISTENT))
        .isInstanceOf(WorkspaceException.class)
        .hasMessageContaining("traversal");
    assertThatThrownBy(() -> allocator.allocate("alice", "../../etc", WorkspaceType.ISOLATED))
        .isInstanceOf(WorkspaceException.class);
  }

  @Test
  @DisplayName("Should delete isolated workspaces recursively and leave persistent ones")
  void release_ByType_DeletesOnlyIsolated() throws Exception {
    final WorkspaceAllocator allocator = new WorkspaceAllocator(baseDir);
    final Path isolated = allocator.allocate("alice", "s1", WorkspaceType.ISOLATED);
    Files.createDirectories(isolated.resolve("src/main"));
    Files.writeString(isolated.resolve("src/main/App.java"), "class App {}");
    final Path persistent = allocator.allocate("carol", "s2", WorkspaceType.PERSISTENT);

    allocator.release(isolated, WorkspaceType.ISOLATED);
    allocator.release(persistent, WorkspaceType.PERSISTENT);

    assertThat(isolated).doesNotExist();
    assertThat(persistent).isDirectory();
  }

  @Test
  @DisplayName("Should remove a symlink inside an isolated workspace without touching its target")
  void release_SymlinkToOtherWorkspace_TargetKept() throws Exception {
    final WorkspaceAllocator allocator = new WorkspaceAllocator(baseDir);
    final Path bob = allocator.allocate("bob", "s1", WorkspaceType.PERSISTENT);
    Files.writeString(bob.resolve("precious.txt"), "keep");
    final Path isolated = allocator.allocate("alice", "s2", WorkspaceType.ISOLATED);
    Files.createDirectories(isolated.resolve("nested"));
    Files.createSymbolicLink(isolated.resolve("link"), bob);
    Files.createSymbolicLink(isolated.resolve("nested").resolve("file-link"), bob.resolve("precious.txt"));

    allocator.release(isolated, WorkspaceType.ISOLATED);

    assertThat(isolated).doesNotExist();
    assertThat(bob.resolve("precious.txt")).hasContent("keep");
  }

  @Test
  @DisplayName("Should remove dangling symlinks along with the isolated workspace")
  void release_DanglingSymlink_WorkspaceRemoved() throws Exception {
    final WorkspaceAllocator allocator = new WorkspaceAllocator(baseDir);
    final Path isolated = allocator.allocate("alice", "s1", WorkspaceType.ISOLATED);
    Files.createSymbolicLink(isolated.resolve("dangling"), baseDir.resolve("does-not-exist"));

    allocator.release(isolated, WorkspaceType.ISOLATED);

    assertThat(Files.exists(isolated.resolve("dangling"), LinkOption.NOFOLLOW_LINKS)).isFalse();
    assertThat(isolated).doesNotExist();
  }

  @Test
  @DisplayName("Should treat release of a missing directory as done")
  void release_Missing_NoError() throws Exception {
    final WorkspaceAllocator allocator = new WorkspaceAllocator(baseDir);

    allocator.release(baseDir.resolve("nobody").resolve("gone"), WorkspaceType.ISOLATED);

    assertThat(baseDir.resolve("nobody")).doesNotExist();
  }
}
