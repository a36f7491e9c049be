package com.serialpdf.jobs;

import com.serialpdf.exception.ConfigException;
import java.util.Locale;
import org.slf4j.Logger;
import redis.clients.jedis.JedisPool;

/** Creates the configured {@link JobStore}. */
public final class JobStores {
  private static final Logger log = com.serialpdf.logging.LoggingService.getLogger(JobStores.class);

  private JobStores() {}

  public static JobStore create(StoreSettings settings) {
    String type = settings.type() == null ? StoreSettings.MEMORY : settings.type();
    switch (type.toLowerCase(Locale.ROOT)) {
      case StoreSettings.MEMORY:
        log.info("Using in-memory job store");
        return new InMemoryJobStore();
      case StoreSettings.REDIS:
        log.info(
            "Using Redis job store at {}:{} (prefix '{}')",
            settings.redisHost(),
            settings.redisPort(),
            settings.keyPrefix());
        return new RedisJobStore(
            new JedisPool(settings.redisHost(), settings.redisPort()),
            settings.keyPrefix(),
            settings.ttl());
      default:
        throw new ConfigException("Unknown job store type: " + settings.type());
    }
  }
}
