package com.consullo.agenthost.session;

import com.consullo.agenthost.pty.PtyProcessController;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted stand-in for a PTY process. Output is fed with {@link #emit(String)}; whatever the session
 * writes is captured and exposed through {@link #written()}.
 */
public final class FakePtyProcessController implements PtyProcessController {

  private static final int EOF = -1;
  private static final int READ_ERROR = -2;

  private final BlockingQueue<Integer> output = new LinkedBlockingQueue<>();
  private final ByteArrayOutputStream input = new ByteArrayOutputStream();
  private final CompletableFuture<Integer> exit = new CompletableFuture<>();
  private final AtomicInteger closeCount = new AtomicInteger();
  private final List<int[]> resizes = new ArrayList<>();
  private volatile boolean failWrites;

  /**
   * Queues process output.
   *
   * @param text output text
   */
  public void emit(final String text) {
    for (final byte b : text.getBytes(StandardCharsets.UTF_8)) {
      output.add(b & 0xFF);
    }
  }

  /**
   * Simulates the process exiting on its own.
   */
  public void exit() {
    output.add(EOF);
    exit.complete(0);
  }

  /**
   * Makes the next read fail with an {@link IOException}.
   */
  public void breakOutput() {
    output.add(READ_ERROR);
  }

  public void failWrites() {
    this.failWrites = true;
  }

  public String written() {
    synchronized (input) {
      return input.toString(StandardCharsets.UTF_8);
    }
  }

  public int closeCount() {
    return closeCount.get();
  }

  public synchronized List<int[]> resizes() {
    return new ArrayList<>(resizes);
  }

  @Override
  public InputStream getPtyOutput() {
    return new QueueInputStream();
  }

  @Override
  public OutputStream getPtyInput() {
    return new OutputStream() {
      @Override
      public void write(final int b) throws IOException {
        if (failWrites) {
          throw new IOException("broken pipe");
        }
        synchronized (input) {
          input.write(b);
        }
      }

      @Override
      public void write(final byte[] b, final int off, final int len) throws IOException {
        if (failWrites) {
          throw new IOException("broken pipe");
        }
        synchronized (input) {
          input.write(b, off, len);
        }
      }
    };
  }

  @Override
  public synchronized void resize(final int columns, final int rows) {
    resizes.add(new int[] { columns, rows });
  }

  @Override
  public CompletableFuture<Integer> onExit() {
    return exit;
  }

  @Override
  public long pid() {
    return 4242L;
  }

  @Override
  public boolean isAlive() {
    return !exit.isDone();
  }

  @Override
  public void close() {
    if (closeCount.getAndIncrement() == 0) {
      output.add(EOF);
      exit.complete(143);
    }
  }

  private final class QueueInputStream extends InputStream {

    private boolean ended;

    @Override
    public int read() throws IOException {
      final byte[] one = new byte[1];
      final int n = read(one, 0, 1);
      return n == -1 ? -1 : one[0] & 0xFF;
    }

    @Override
    public int read(final byte[] b, final int off, final int len) throws IOException {
      if (ended) {
        return -1;
      }
      if (len == 0) {
        return 0;
      }
      final int first;
      try {
        first = output.take();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("interrupted", e);
      }
      if (first == EOF) {
        ended = true;
        return -1;
      }
      if (first == READ_ERROR) {
        throw new IOException("simulated read failure");
      }
      b[off] = (byte) first;
      int n = 1;
      while (n < len) {
        final Integer next = output.peek();
        if (next == null || next < 0) {
          break;
        }
        b[off + n] = (byte) (int) output.poll();
        n++;
      }
      return n;
    }

    @Override
    public int available() {
      int count = 0;
      for (final Integer value : output) {
        if (value < 0) {
          break;
        }
        count++;
      }
      return count;
    }
  }
}
