package com.consullo.agenthost.security;

import com.consullo.agenthost.error.AuthException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares a caller's bearer token with the configured shared secret in constant time.
 *
 * <p>With no secret configured every caller is let through, and that is announced at WARN level.
 *
 * @since 1.0
 */
public final class SharedSecretAuthGate {

  private static final Logger LOGGER = LoggerFactory.getLogger(SharedSecretAuthGate.class);

  private final byte[] secret;

  public SharedSecretAuthGate(final String sharedSecret) {
    final String trimmed = StringUtils.trimToNull(sharedSecret);
    this.secret = trimmed == null ? null : trimmed.getBytes(StandardCharsets.UTF_8);
    if (this.secret == null) {
      LOGGER.warn("API_AUTH_TOKEN is not configured; authentication is DISABLED and every caller is trusted");
    }
  }

  public boolean enabled() {
    return secret != null;
  }

  /**
   * Checks the caller's token.
   *
   * @param bearerToken token presented by the caller, may be null
   * @throws AuthException if authentication is enabled and the token is missing or wrong
   */
  public void authenticate(final String bearerToken) throws AuthException {
    if (secret == null) {
      return;
    }
    if (StringUtils.isEmpty(bearerToken)) {
      throw new AuthException("missing or invalid authorization token");
    }
    final byte[] provided = bearerToken.getBytes(StandardCharsets.UTF_8);
    if (!MessageDigest.isEqual(provided, secret)) {
      throw new AuthException("invalid authentication token");
    }
  }
}
