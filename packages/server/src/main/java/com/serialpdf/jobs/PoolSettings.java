package com.serialpdf.jobs;

import java.time.Duration;

/**
 * Worker pool sizing and shutdown behaviour.
 *
 * @param awaitInFlight whether shutdown lets running jobs finish (bounded by {@code
 *     shutdownTimeout}) or interrupts them
 */
public record PoolSettings(int concurrency, boolean awaitInFlight, Duration shutdownTimeout) {

  public PoolSettings {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
    }
    if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
      shutdownTimeout = Duration.ofSeconds(120);
    }
  }

  public static PoolSettings defaults() {
    return new PoolSettings(4, true, Duration.ofSeconds(120));
  }
}
