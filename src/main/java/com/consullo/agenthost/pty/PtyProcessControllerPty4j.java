package com.consullo.agenthost.pty;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PTY controller implemented with pty4j.
 *
 * <p>The child inherits the host environment, overlaid with {@link PtyProcessConfig#environment()}.
 * {@link #close()} sends the graceful termination signal, waits for the configured grace period,
 * then kills the process and closes both PTY streams.
 *
 * @since 1.0
 */
public final class PtyProcessControllerPty4j implements PtyProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyProcessControllerPty4j.class);

  private final PtyProcess process;
  private final Duration terminationGrace;
  private final CompletableFuture<Integer> exitFuture;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Spawns a PTY-attached process.
   *
   * @param config process configuration (command, working directory, environment, initial size)
   * @throws Exception if process cannot be started
   */
  public PtyProcessControllerPty4j(final PtyProcessConfig config) throws Exception {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(config.command(), "command must not be null");
    Validate.isTrue(!config.command().isEmpty(), "command must not be empty");
    Validate.notNull(config.workingDirectory(), "workingDirectory must not be null");
    Validate.isTrue(config.initialColumns() > 0, "initialColumns must be positive");
    Validate.isTrue(config.initialRows() > 0, "initialRows must be positive");
    Validate.notNull(config.terminationGrace(), "terminationGrace must not be null");

    final String[] cmd = config.command().toArray(new String[0]);

    final Map<String, String> env = new HashMap<>(System.getenv());
    if (config.environment() != null) {
      env.putAll(config.environment());
    }

    final PtyProcessBuilder builder = new PtyProcessBuilder(cmd)
        .setDirectory(config.workingDirectory().toString())
        .setEnvironment(env)
        .setInitialColumns(config.initialColumns())
        .setInitialRows(config.initialRows())
        .setRedirectErrorStream(true);

    this.process = builder.start();
    this.terminationGrace = config.terminationGrace();

    this.exitFuture = new CompletableFuture<>();
    startExitMonitorThread();
  }

  @Override
  public InputStream getPtyOutput() throws Exception {
    return this.process.getInputStream();
  }

  @Override
  public OutputStream getPtyInput() throws Exception {
    return this.process.getOutputStream();
  }

  @Override
  public void resize(final int columns, final int rows) throws Exception {
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");

    try {
      this.process.setWinSize(new WinSize(columns, rows));
    } catch (final Exception e) {
      LOGGER.warn("PTY resize failed: {}", e.getMessage(), e);
      throw e;
    }
  }

  @Override
  public CompletableFuture<Integer> onExit() throws Exception {
    return this.exitFuture;
  }

  @Override
  public long pid() throws Exception {
    return this.process.pid();
  }

  @Override
  public boolean isAlive() throws Exception {
    return this.process.isAlive();
  }

  @Override
  public void close() throws Exception {
    if (!this.closed.compareAndSet(false, true)) {
      return;
    }
    try {
      if (this.process.isAlive()) {
        this.process.destroy();
        if (!this.process.waitFor(this.terminationGrace.toMillis(), TimeUnit.MILLISECONDS)) {
          LOGGER.warn("PTY process {} did not exit within {}, killing it", this.process.pid(), this.terminationGrace);
          ProcessHandle.of(this.process.pid()).ifPresent(ProcessHandle::destroyForcibly);
          this.process.destroyForcibly();
        }
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      this.process.destroyForcibly();
    } finally {
      closeQuietly(this.process.getOutputStream());
      closeQuietly(this.process.getInputStream());
    }
  }

  private static void closeQuietly(final AutoCloseable stream) {
    try {
      stream.close();
    } catch (final Exception e) {
      LOGGER.debug("Closing PTY stream failed: {}", e.getMessage());
    }
  }

  /**
   * Starts a monitor thread that completes the exit future when the subprocess terminates.
   */
  private void startExitMonitorThread() {
    final Thread monitor = new Thread(() -> {
      try {
        final int code = this.process.waitFor();
        this.exitFuture.complete(code);
      } catch (final Exception e) {
        this.exitFuture.completeExceptionally(e);
      }
    }, "PtyProcessExitMonitor-" + this.process.pid());
    monitor.setDaemon(true);
    monitor.start();
  }
}
