package com.consullo.agenthost.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for command sanitization.
 *
 * @since 1.0
 */
public class CommandSanitizerTest {

  @Test
  @DisplayName("Should strip control characters but keep newline, carriage return and tab")
  void sanitize_ControlCharacters_RemovedExceptWhitespace() {
    assertThat(CommandSanitizer.sanitize("ls\u0000 -la\u001b[31m\n")).isEqualTo("ls -la[31m\n");
    assertThat(CommandSanitizer.sanitize("a\tb\r\n")).isEqualTo("a\tb\r\n");
    assertThat(CommandSanitizer.sanitize("\u0003\u0004")).isEmpty();
  }

  @Test
  @DisplayName("Should pass DEL and multi-byte characters through unchanged")
  void sanitize_DelAndUnicode_Unchanged() {
    assertThat(CommandSanitizer.sanitize("x\u007fy")).isEqualTo("x\u007fy");
    assertThat(CommandSanitizer.sanitize("héllo 世界 😀")).isEqualTo("héllo 世界 😀");
  }

  @Test
  @DisplayName("Should be idempotent")
  void sanitize_AppliedTwice_SameResult() {
    final String once = CommandSanitizer.sanitize("echo \u0007hi\u0000\n");
    assertThat(CommandSanitizer.sanitize(once)).isEqualTo(once);
  }

  @Test
  @DisplayName("Should reject null input")
  void sanitize_Null_Throws() {
    assertThatThrownBy(() -> CommandSanitizer.sanitize(null)).isInstanceOf(IllegalArgumentException.class);
  }
}
