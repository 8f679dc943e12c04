package com.consullo.agenthost.config;

/**
 * Secrets of the API edge.
 *
 * @param apiAuthToken shared bearer secret; null or blank disables authentication
 * @param encryptionKey hex-encoded 256-bit key for credentials at rest; null or blank disables their
 *     persistence
 * @since 1.0
 */
public record SecurityConfig(String apiAuthToken, String encryptionKey) {

  @Override
  public String toString() {
    return "SecurityConfig[apiAuthToken=" + (isSet(apiAuthToken) ? "***" : "<none>")
        + ", encryptionKey=" + (isSet(encryptionKey) ? "***" : "<none>") + "]";
  }

  private static boolean isSet(final String value) {
    return value != null && !value.isBlank();
  }
}
