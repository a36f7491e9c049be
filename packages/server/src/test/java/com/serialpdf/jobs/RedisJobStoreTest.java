package com.serialpdf.jobs;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.serialpdf.exception.StateException;
import com.serialpdf.render.PlaceholderValue;
import com.serialpdf.render.RenderReport;
import com.serialpdf.render.UnmatchedPlaceholder;
import com.serialpdf.staging.ExportMetadata;
import com.serialpdf.staging.StagedResult;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.params.SetParams;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RedisJobStoreTest {

  @Mock JedisPool pool;
  @Mock Jedis jedis;
  @Mock Transaction tx;

  private RedisJobStore store;

  @BeforeEach
  void setUp() {
    when(pool.getResource()).thenReturn(jedis);
    when(jedis.multi()).thenReturn(tx);
    store = new RedisJobStore(pool, "serial-pdf:job:", Duration.ofHours(1));
  }

  private static Job readyJob() {
    StagedResult staged =
        new StagedResult(
            "J1",
            Path.of("/staging/J1.pdf"),
            "c0ffee",
            Duration.ofMillis(1500),
            new RenderReport(
                Map.of("main.tex", List.of(new UnmatchedPlaceholder("\\VAR{x}", "x", 4)))));
    return pendingJob().withResult(staged);
  }

  private static Job pendingJob() {
    return Job.pending(
        "J1",
        "letters/invoice",
        "letters/invoice",
        "HEAD",
        "c0ffee",
        Map.of(
            "name", PlaceholderValue.of("Ada"),
            "items", PlaceholderValue.of(List.of("a", "b"))));
  }

  @Test
  void documentsSurviveEncoding() {
    Job pending = pendingJob();
    Job ready = readyJob();
    Job exported = ready.withExport(new ExportMetadata("J1.pdf", "c0ffee", 1.5, Map.of()));

    Job decodedPending = store.decode(store.encode(pending));
    Job decodedReady = store.decode(store.encode(ready));
    Job decodedExported = store.decode(store.encode(exported));

    assertEquals(pending.id(), decodedPending.id());
    assertEquals(pending.data(), decodedPending.data());
    assertEquals(pending.createdAt().toEpochMilli(), decodedPending.createdAt().toEpochMilli());
    assertEquals(JobState.READY, decodedReady.state());
    assertEquals(ready.result().pdf(), decodedReady.result().pdf());
    assertEquals(ready.result().renderReport(), decodedReady.result().renderReport());
    assertEquals(exported.export(), decodedExported.export());
    assertNull(decodedExported.failure());
  }

  @Test
  void putUsesSetIfAbsentWithExpiry() {
    when(jedis.set(eq("serial-pdf:job:J1"), anyString(), any(SetParams.class))).thenReturn("OK");

    assertTrue(store.put(readyJob()));

    verify(jedis).set(eq("serial-pdf:job:J1"), anyString(), any(SetParams.class));
    verify(jedis).close();
  }

  @Test
  void putReportsExistingKey() {
    when(jedis.set(anyString(), anyString(), any(SetParams.class))).thenReturn(null);

    assertFalse(store.put(readyJob()));
  }

  @Test
  void getDecodesStoredDocument() {
    Job job = readyJob();
    when(jedis.get("serial-pdf:job:J1")).thenReturn(store.encode(job));

    assertEquals(JobState.READY, store.get("J1").orElseThrow().state());
    assertTrue(store.get("J2").isEmpty());
  }

  @Test
  void transitionWritesInsideTransaction() {
    Job job = readyJob();
    when(jedis.get("serial-pdf:job:J1")).thenReturn(store.encode(job));
    when(tx.exec()).thenReturn(List.of("OK"));
    ExportMetadata metadata = new ExportMetadata("J1.pdf", "c0ffee", 1.5, Map.of());

    Job next = store.transition("J1", JobState.READY, j -> j.withExport(metadata)).orElseThrow();

    assertEquals(metadata, next.export());
    verify(jedis).watch("serial-pdf:job:J1");
    ArgumentCaptor<String> written = ArgumentCaptor.forClass(String.class);
    verify(tx).setex(eq("serial-pdf:job:J1"), eq(3600L), written.capture());
    assertEquals(metadata, store.decode(written.getValue()).export());
  }

  @Test
  void transitionRetriesWhenKeyChanged() {
    when(jedis.get("serial-pdf:job:J1")).thenReturn(store.encode(readyJob()));
    when(tx.exec()).thenReturn(null).thenReturn(List.of("OK"));

    assertTrue(
        store
            .transition(
                "J1",
                JobState.READY,
                j -> j.withExport(new ExportMetadata("J1.pdf", "c0ffee", 1.5, Map.of())))
            .isPresent());
    verify(tx, times(2)).exec();
  }

  @Test
  void transitionGivesUpAfterRepeatedConflicts() {
    when(jedis.get("serial-pdf:job:J1")).thenReturn(store.encode(readyJob()));
    when(tx.exec()).thenReturn(null);

    assertThrows(
        StateException.class,
        () ->
            store.transition(
                "J1",
                JobState.READY,
                j -> j.withExport(new ExportMetadata("J1.pdf", "c0ffee", 1.5, Map.of()))));
    verify(tx, times(RedisJobStore.MAX_TRANSITION_ATTEMPTS)).exec();
  }

  @Test
  void transitionSkipsUnexpectedState() {
    when(jedis.get("serial-pdf:job:J1")).thenReturn(store.encode(readyJob()));

    assertTrue(store.transition("J1", JobState.PENDING, j -> j).isEmpty());
    verify(jedis).unwatch();
    verify(jedis, never()).multi();
  }

  @Test
  void rejectedTransitionReleasesWatch() {
    when(jedis.get("serial-pdf:job:J1")).thenReturn(store.encode(readyJob()));

    assertThrows(
        StateException.class,
        () ->
            store.transition(
                "J1", JobState.READY, j -> j.withFailure(JobFailure.internal("too late"))));
    verify(jedis).unwatch();
  }

  @Test
  void storeWithoutTtlUsesPlainSet() {
    RedisJobStore noTtl = new RedisJobStore(pool, "p:", Duration.ZERO);
    when(jedis.get("p:J1")).thenReturn(noTtl.encode(readyJob()));
    when(tx.exec()).thenReturn(List.of("OK"));

    noTtl.transition(
        "J1",
        JobState.READY,
        j -> j.withExport(new ExportMetadata("J1.pdf", "c0ffee", 1.5, Map.of())));

    verify(tx).set(eq("p:J1"), anyString());
    verify(tx, never()).setex(anyString(), anyLong(), anyString());
  }

  @Test
  void removeDeletesKey() {
    when(jedis.del("serial-pdf:job:J1")).thenReturn(1L);

    assertTrue(store.remove("J1"));
    assertFalse(store.remove(null));
  }
}
