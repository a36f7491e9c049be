package com.serialpdf.jobs;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/** Process-local JobStore; every operation is atomic per job id. */
public final class InMemoryJobStore implements JobStore {
  private final Map<String, Job> map = new ConcurrentHashMap<>();

  @Override
  public boolean put(Job job) {
    return map.putIfAbsent(job.id(), job) == null;
  }

  @Override
  public Optional<Job> get(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(map.get(id));
  }

  @Override
  public Optional<Job> transition(String id, JobState expected, UnaryOperator<Job> change) {
    AtomicReference<Job> applied = new AtomicReference<>();
    map.computeIfPresent(
        id,
        (key, current) -> {
          if (current.state() != expected) {
            return current;
          }
          Job next = change.apply(current);
          Job.checkTransition(current, next);
          applied.set(next);
          return next;
        });
    return Optional.ofNullable(applied.get());
  }

  @Override
  public boolean remove(String id) {
    return id != null && map.remove(id) != null;
  }

  int size() {
    return map.size();
  }
}
