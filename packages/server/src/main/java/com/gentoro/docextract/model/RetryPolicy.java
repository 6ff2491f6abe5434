package com.gentoro.docextract.model;

import java.time.Duration;
import java.util.Random;
import org.apache.commons.configuration2.Configuration;

/**
 * Bounded exponential backoff with jitter for transient extraction failures.
 *
 * <p>The delay before retry number {@code attempt + 1} is {@code baseDelay * 2^attempt +
 * random(0, maxJitter)}.
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxJitter) {
  public static final RetryPolicy DEFAULT =
      new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofMillis(500));

  public RetryPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
    maxJitter = maxJitter == null || maxJitter.isNegative() ? Duration.ZERO : maxJitter;
  }

  public static RetryPolicy fromConfiguration(Configuration configuration) {
    return new RetryPolicy(
        configuration.getInt("extraction.retries", DEFAULT.maxRetries()),
        Duration.ofMillis(
            configuration.getLong("extraction.backoff.baseMs", DEFAULT.baseDelay().toMillis())),
        Duration.ofMillis(
            configuration.getLong("extraction.backoff.jitterMs", DEFAULT.maxJitter().toMillis())));
  }

  public Duration delayFor(int attempt, Random random) {
    long base = baseDelay.toMillis() << Math.min(attempt, 20);
    long jitterBound = maxJitter.toMillis();
    long jitter = jitterBound > 0 ? (long) (random.nextDouble() * jitterBound) : 0L;
    return Duration.ofMillis(base + jitter);
  }
}
