package com.serialpdf.jobs;

import static org.junit.jupiter.api.Assertions.*;

import com.serialpdf.exception.StateException;
import com.serialpdf.render.PlaceholderValue;
import com.serialpdf.staging.ExportMetadata;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JobTest {

  @Test
  void notFoundIsNeverStored() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new Job(
                "A",
                "t",
                "t",
                null,
                "c",
                Map.of(),
                JobState.NOT_FOUND,
                null,
                null,
                null,
                null,
                null));
  }

  @Test
  void dataIsCopied() {
    Map<String, PlaceholderValue> data = new HashMap<>();
    data.put("name", PlaceholderValue.of("Ada"));
    Job job = Job.pending("A", "t", "t", null, "c", data);

    data.put("other", PlaceholderValue.of("x"));

    assertEquals(1, job.data().size());
    assertThrows(UnsupportedOperationException.class, () -> job.data().put("x", null));
  }

  @Test
  void failureDropsLogOfNonCompilationKinds() {
    assertNull(new JobFailure(JobFailure.Kind.CHECKOUT, "gone", "A.log").errorLog());
    assertEquals("A.log", JobFailure.compilation("failed", "A.log").errorLog());
  }

  @Test
  void idChangeIsRejected() {
    Job job = Job.pending("A", "t", "t", null, "c", Map.of());
    Job other = Job.pending("B", "t", "t", null, "c", Map.of());

    assertThrows(StateException.class, () -> Job.checkTransition(job, other));
    assertThrows(StateException.class, () -> Job.checkTransition(job, null));
  }

  @Test
  @DisplayName("Finished jobs keep only what polls answer with")
  void finishedJobsDropPayload() {
    Job pending = InMemoryJobStoreTest.pendingJob("A");
    ExportMetadata metadata = new ExportMetadata("A.pdf", "c0ffee", 2.0, Map.of());

    Job ready = pending.withResult(InMemoryJobStoreTest.staged("A"));
    Job exported = ready.withExport(metadata);
    Job failed = pending.withFailure(JobFailure.internal("boom"));

    assertTrue(ready.data().isEmpty());
    assertNotNull(ready.result());
    assertNull(exported.result());
    assertEquals(metadata, exported.export());
    assertEquals(JobState.READY, exported.state());
    assertTrue(failed.data().isEmpty());
    assertEquals("c0ffee", failed.commit());
  }
}
