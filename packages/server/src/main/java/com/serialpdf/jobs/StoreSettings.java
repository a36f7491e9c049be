package com.serialpdf.jobs;

import java.time.Duration;

/**
 * Which {@link JobStore} to use and how to reach it.
 *
 * @param type {@code memory} or {@code redis}
 * @param ttl expiry of stored jobs in Redis, zero for none
 */
public record StoreSettings(
    String type, String redisHost, int redisPort, String keyPrefix, Duration ttl) {

  public static final String MEMORY = "memory";
  public static final String REDIS = "redis";

  public static StoreSettings memory() {
    return new StoreSettings(MEMORY, "localhost", 6379, "serial-pdf:job:", Duration.ZERO);
  }
}
