package com.serialpdf.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.serialpdf.exception.IoException;
import com.serialpdf.exception.StateException;
import com.serialpdf.render.PlaceholderValue;
import com.serialpdf.render.RenderReport;
import com.serialpdf.render.UnmatchedPlaceholder;
import com.serialpdf.staging.ExportMetadata;
import com.serialpdf.staging.StagedResult;
import com.serialpdf.utility.JacksonUtility;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.params.SetParams;

/**
 * JobStore keeping each job as a JSON document under {@code <prefix><jobId>}.
 *
 * <p>Transitions use optimistic locking ({@code WATCH}/{@code MULTI}/{@code EXEC}) and are retried
 * a few times when another writer touched the key in between. With a positive TTL every write
 * refreshes the expiry, so abandoned jobs eventually disappear.
 */
public final class RedisJobStore implements JobStore {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(RedisJobStore.class);

  static final int MAX_TRANSITION_ATTEMPTS = 5;

  private final JedisPool pool;
  private final String keyPrefix;
  private final Duration ttl;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public RedisJobStore(JedisPool pool, String keyPrefix, Duration ttl) {
    this.pool = pool;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    this.ttl = ttl == null ? Duration.ZERO : ttl;
  }

  String key(String id) {
    return keyPrefix + id;
  }

  @Override
  public boolean put(Job job) {
    SetParams params = SetParams.setParams().nx();
    if (hasTtl()) {
      params.ex(ttl.toSeconds());
    }
    try (Jedis jedis = pool.getResource()) {
      return "OK".equalsIgnoreCase(jedis.set(key(job.id()), encode(job), params));
    }
  }

  @Override
  public Optional<Job> get(String id) {
    if (id == null) {
      return Optional.empty();
    }
    try (Jedis jedis = pool.getResource()) {
      return Optional.ofNullable(jedis.get(key(id))).map(this::decode);
    }
  }

  @Override
  public Optional<Job> transition(String id, JobState expected, UnaryOperator<Job> change) {
    String key = key(id);
    try (Jedis jedis = pool.getResource()) {
      for (int attempt = 1; attempt <= MAX_TRANSITION_ATTEMPTS; attempt++) {
        jedis.watch(key);
        String json = jedis.get(key);
        if (json == null) {
          jedis.unwatch();
          return Optional.empty();
        }
        Job current = decode(json);
        if (current.state() != expected) {
          jedis.unwatch();
          return Optional.empty();
        }
        Job next;
        try {
          next = change.apply(current);
          Job.checkTransition(current, next);
        } catch (RuntimeException e) {
          jedis.unwatch();
          throw e;
        }

        Transaction tx = jedis.multi();
        if (hasTtl()) {
          tx.setex(key, ttl.toSeconds(), encode(next));
        } else {
          tx.set(key, encode(next));
        }
        List<Object> committed = tx.exec();
        if (committed != null && !committed.isEmpty()) {
          return Optional.of(next);
        }
        log.debug("Concurrent update of job {}, retrying transition ({})", id, attempt);
      }
    }
    throw new StateException(
        "Job %s kept changing concurrently, gave up after %d attempts"
            .formatted(id, MAX_TRANSITION_ATTEMPTS));
  }

  @Override
  public boolean remove(String id) {
    if (id == null) {
      return false;
    }
    try (Jedis jedis = pool.getResource()) {
      return jedis.del(key(id)) > 0;
    }
  }

  @Override
  public void close() {
    pool.close();
  }

  private boolean hasTtl() {
    return ttl.toSeconds() > 0;
  }

  String encode(Job job) {
    try {
      return mapper.writeValueAsString(JobDocument.from(job));
    } catch (JsonProcessingException e) {
      throw new IoException("Could not serialize job " + job.id(), e);
    }
  }

  Job decode(String json) {
    try {
      return mapper.readValue(json, JobDocument.class).toJob();
    } catch (JsonProcessingException e) {
      throw new IoException("Could not read stored job document", e);
    }
  }

  /** Wire shape of a job; times are epoch milliseconds. */
  record JobDocument(
      String id,
      String templateId,
      String templatePath,
      String requestedCommit,
      String commit,
      Map<String, PlaceholderValue> data,
      JobState state,
      long createdAt,
      Long finishedAt,
      StagedDocument result,
      ExportMetadata export,
      JobFailure failure) {

    static JobDocument from(Job job) {
      return new JobDocument(
          job.id(),
          job.templateId(),
          job.templatePath(),
          job.requestedCommit(),
          job.commit(),
          job.data(),
          job.state(),
          job.createdAt() == null ? 0L : job.createdAt().toEpochMilli(),
          job.finishedAt() == null ? null : job.finishedAt().toEpochMilli(),
          job.result() == null ? null : StagedDocument.from(job.result()),
          job.export(),
          job.failure());
    }

    Job toJob() {
      return new Job(
          id,
          templateId,
          templatePath,
          requestedCommit,
          commit,
          data,
          state,
          Instant.ofEpochMilli(createdAt),
          finishedAt == null ? null : Instant.ofEpochMilli(finishedAt),
          result == null ? null : result.toStagedResult(),
          export,
          failure);
    }
  }

  record StagedDocument(
      String jobId,
      String pdf,
      String commit,
      long processingMillis,
      Map<String, List<UnmatchedPlaceholder>> unmatched) {

    static StagedDocument from(StagedResult staged) {
      return new StagedDocument(
          staged.jobId(),
          staged.pdf().toString(),
          staged.commit(),
          staged.processingTime() == null ? 0L : staged.processingTime().toMillis(),
          staged.renderReport().unmatched());
    }

    StagedResult toStagedResult() {
      return new StagedResult(
          jobId,
          Path.of(pdf),
          commit,
          Duration.ofMillis(processingMillis),
          new RenderReport(unmatched));
    }
  }
}
