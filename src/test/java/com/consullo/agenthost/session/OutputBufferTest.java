package com.consullo.agenthost.session;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the bounded output buffer.
 *
 * @since 1.0
 */
public class OutputBufferTest {

  @Test
  @DisplayName("Should keep only the most recent chunks once capacity is exceeded")
  void append_OverCapacity_DropsOldest() {
    final OutputBuffer buffer = new OutputBuffer(100);
    for (int i = 0; i < 150; i++) {
      buffer.append(chunk("line " + i));
    }

    final List<OutputChunk> chunks = buffer.snapshot();
    assertThat(chunks).hasSize(100);
    assertThat(chunks.get(0).data()).isEqualTo("line 50");
    assertThat(chunks.get(99).data()).isEqualTo("line 149");
  }

  @Test
  @DisplayName("Should return the same content from repeated snapshots")
  void snapshot_Repeated_IsIdempotent() {
    final OutputBuffer buffer = new OutputBuffer(10);
    buffer.append(chunk("a"));
    buffer.append(chunk("b"));

    assertThat(buffer.snapshot()).isEqualTo(buffer.snapshot());
    assertThat(buffer.size()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should empty the buffer when drained")
  void drain_WithChunks_ReturnsThemAndClears() {
    final OutputBuffer buffer = new OutputBuffer(10);
    buffer.append(chunk("a"));
    buffer.append(chunk("b"));

    assertThat(buffer.drain()).extracting(OutputChunk::data).containsExactly("a", "b");
    assertThat(buffer.snapshot()).isEmpty();
  }

  @Test
  @DisplayName("Should fall back to the default capacity for non-positive sizes")
  void constructor_NonPositiveCapacity_UsesDefault() {
    assertThat(new OutputBuffer(0).capacity()).isEqualTo(OutputBuffer.DEFAULT_CAPACITY);
    assertThat(new OutputBuffer(-5).capacity()).isEqualTo(OutputBuffer.DEFAULT_CAPACITY);
  }

  @Test
  @DisplayName("Should not let callers modify the buffer through a snapshot")
  void snapshot_Modified_Throws() {
    final OutputBuffer buffer = new OutputBuffer(10);
    buffer.append(chunk("a"));

    final List<OutputChunk> copy = buffer.snapshot();
    assertThatThrownBy(() -> copy.add(chunk("b")))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThat(buffer.size()).isEqualTo(1);
  }

  private static OutputChunk chunk(final String data) {
    return new OutputChunk(Instant.EPOCH, data);
  }
}
