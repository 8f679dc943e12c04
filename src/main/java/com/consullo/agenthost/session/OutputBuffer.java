package com.consullo.agenthost.session;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, ordered log of output chunks for one session.
 *
 * <p>When an append pushes the size past capacity the oldest chunks are dropped, so a chatty process
 * can never grow memory without bound and the reader never blocks.
 *
 * <p>Not thread-safe. The owning {@link Session} serializes every call under its own lock, which is
 * what makes {@link #drain()} atomic with respect to concurrent appends.
 *
 * @since 1.0
 */
public final class OutputBuffer {

  static final int DEFAULT_CAPACITY = 100;

  private final int capacity;
  private final Deque<OutputChunk> chunks;

  /**
   * Creates an empty buffer.
   *
   * @param capacity maximum number of retained chunks; non-positive values fall back to 100
   */
  public OutputBuffer(final int capacity) {
    this.capacity = capacity > 0 ? capacity : DEFAULT_CAPACITY;
    this.chunks = new ArrayDeque<>(Math.min(this.capacity, 1024));
  }

  public void append(final OutputChunk chunk) {
    if (chunk == null) {
      throw new IllegalArgumentException("chunk must not be null.");
    }
    chunks.addLast(chunk);
    while (chunks.size() > capacity) {
      chunks.removeFirst();
    }
  }

  /**
   * Copies the buffered chunks, oldest first, leaving the buffer untouched.
   *
   * @return immutable copy
   */
  public List<OutputChunk> snapshot() {
    return Collections.unmodifiableList(new ArrayList<>(chunks));
  }

  /**
   * Copies the buffered chunks, oldest first, and empties the buffer.
   *
   * @return immutable copy of what was buffered
   */
  public List<OutputChunk> drain() {
    final List<OutputChunk> copy = snapshot();
    chunks.clear();
    return copy;
  }

  public int size() {
    return chunks.size();
  }

  public int capacity() {
    return capacity;
  }
}
