package com.consullo.agenthost.ratelimit;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.RateLimiter;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token bucket per caller key (typically the client address).
 *
 * <p>Buckets untouched for longer than the retention window are dropped, either lazily on access or by
 * the periodic sweep started with {@link #start(Duration)}.
 *
 * @since 1.0
 */
public final class ClientRateLimiter implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClientRateLimiter.class);

  private final double permitsPerSecond;
  private final LoadingCache<String, RateLimiter> buckets;
  private ScheduledExecutorService sweeper;

  public ClientRateLimiter(final double permitsPerSecond, final Duration retention) {
    this(permitsPerSecond, retention, Ticker.systemTicker());
  }

  @VisibleForTesting
  ClientRateLimiter(final double permitsPerSecond, final Duration retention, final Ticker ticker) {
    Validate.isTrue(permitsPerSecond > 0, "permitsPerSecond must be positive");
    Validate.notNull(retention, "retention must not be null");
    Validate.notNull(ticker, "ticker must not be null");
    this.permitsPerSecond = permitsPerSecond;
    this.buckets = CacheBuilder.newBuilder()
        .expireAfterAccess(retention.toMillis(), TimeUnit.MILLISECONDS)
        .ticker(ticker)
        .build(new CacheLoader<>() {
          @Override
          public RateLimiter load(final String key) {
            return RateLimiter.create(ClientRateLimiter.this.permitsPerSecond);
          }
        });
  }

  /**
   * Takes one permit for {@code key} without waiting.
   *
   * @param key caller key
   * @return false if the caller is over its rate
   */
  public boolean tryAcquire(final String key) {
    return buckets.getUnchecked(key == null ? "" : key).tryAcquire();
  }

  /**
   * Starts the periodic purge of idle buckets. Calling it again has no effect.
   *
   * @param interval sweep period
   */
  public synchronized void start(final Duration interval) {
    if (sweeper != null) {
      return;
    }
    sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread t = new Thread(r, "RateLimiterSweep");
      t.setDaemon(true);
      return t;
    });
    sweeper.scheduleAtFixedRate(this::purgeIdle, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Drops buckets idle beyond the retention window.
   */
  public void purgeIdle() {
    final long before = buckets.size();
    buckets.cleanUp();
    final long purged = before - buckets.size();
    if (purged > 0) {
      LOGGER.debug("Purged {} idle rate limit buckets", purged);
    }
  }

  public long trackedClients() {
    return buckets.size();
  }

  @Override
  public synchronized void close() {
    if (sweeper != null) {
      sweeper.shutdownNow();
      sweeper = null;
    }
  }
}
