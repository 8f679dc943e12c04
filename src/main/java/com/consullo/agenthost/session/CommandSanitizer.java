package com.consullo.agenthost.session;

/**
 * Strips C0 control characters from command text before it reaches the PTY.
 *
 * <p>Newline, carriage return and tab survive so multi-line input still works. ESC, NUL, BEL,
 * backspace and the rest of the C0 range are removed, which closes terminal escape and control
 * injection. Everything at or above 0x20 passes through, including DEL and non-ASCII text.
 * Applying it twice gives the same result as applying it once.
 *
 * @since 1.0
 */
public final class CommandSanitizer {

  private CommandSanitizer() {
  }

  /**
   * Returns {@code text} without disallowed control characters.
   *
   * @param text raw command text
   * @return sanitized text
   */
  public static String sanitize(final String text) {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null.");
    }
    final StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c >= 0x20 || c == '\n' || c == '\r' || c == '\t') {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
