package com.consullo.agenthost.config;

import java.time.Duration;
import org.apache.commons.lang3.Validate;

/**
 * Per-client request rate limit.
 *
 * @param permitsPerSecond sustained requests per second per client
 * @param retention idle time after which a client's bucket is dropped
 * @param sweepInterval period of the idle-bucket purge
 * @since 1.0
 */
public record RateLimitConfig(double permitsPerSecond, Duration retention, Duration sweepInterval) {

  public static final double DEFAULT_PERMITS_PER_SECOND = 10.0;

  public RateLimitConfig {
    Validate.isTrue(permitsPerSecond > 0, "permitsPerSecond must be positive");
    Validate.notNull(retention, "retention must not be null");
    Validate.notNull(sweepInterval, "sweepInterval must not be null");
    Validate.isTrue(!sweepInterval.isNegative() && !sweepInterval.isZero(), "sweepInterval must be positive");
  }

  public static RateLimitConfig defaults() {
    return new RateLimitConfig(DEFAULT_PERMITS_PER_SECOND, Duration.ofMinutes(10), Duration.ofMinutes(1));
  }
}
