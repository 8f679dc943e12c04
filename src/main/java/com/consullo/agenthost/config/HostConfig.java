package com.consullo.agenthost.config;

import com.consullo.agenthost.session.SessionManagerConfig;
import org.apache.commons.lang3.Validate;

/**
 * Complete host configuration.
 *
 * @param session session manager limits and defaults
 * @param security API secrets
 * @param rateLimit per-client rate limit
 * @since 1.0
 */
public record HostConfig(SessionManagerConfig session, SecurityConfig security, RateLimitConfig rateLimit) {

  public HostConfig {
    Validate.notNull(session, "session must not be null");
    Validate.notNull(security, "security must not be null");
    Validate.notNull(rateLimit, "rateLimit must not be null");
  }
}
