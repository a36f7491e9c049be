package com.serialpdf.staging;

import static org.junit.jupiter.api.Assertions.*;

import com.serialpdf.exception.ExportException;
import com.serialpdf.exception.SerialPdfErrorCode;
import com.serialpdf.render.RenderReport;
import com.serialpdf.render.UnmatchedPlaceholder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultStagerTest {

  @TempDir Path temp;

  private ResultStager stager;
  private Path exportRoot;

  @BeforeEach
  void setUp() {
    exportRoot = temp.resolve("export");
    stager = ResultStager.create(temp.resolve("staging"), exportRoot);
  }

  private StagedResult stageOne(String jobId) throws Exception {
    Path pdf = Files.writeString(temp.resolve("build-" + jobId + ".pdf"), "%PDF " + jobId);
    RenderReport report =
        new RenderReport(
            Map.of("main.tex", List.of(new UnmatchedPlaceholder("\\VAR{missing}", "missing", 3))));
    return stager.stage(pdf, jobId, "abc123", Duration.ofMillis(1234), report);
  }

  @Test
  void stagingMovesPdfIntoPrivateRoot() throws Exception {
    StagedResult staged = stageOne("J1");

    assertEquals(stager.stagingRoot().resolve("J1.pdf"), staged.pdf());
    assertTrue(Files.isRegularFile(staged.pdf()));
    assertFalse(Files.exists(temp.resolve("build-J1.pdf")));
  }

  @Test
  void exportMovesFileAndDescribesIt() throws Exception {
    StagedResult staged = stageOne("J2");

    ExportMetadata metadata = stager.export(staged);

    assertEquals("J2.pdf", metadata.exportFile());
    assertEquals("abc123", metadata.commit());
    assertEquals(1.23, metadata.processingTime());
    assertEquals(Map.of("main.tex", List.of("\\VAR{missing}")), metadata.unmatchedPlaceholders());
    assertEquals("%PDF J2", Files.readString(exportRoot.resolve("J2.pdf")));
    assertFalse(Files.exists(staged.pdf()));
  }

  @Test
  void repeatedExportReturnsSameMetadata() throws Exception {
    StagedResult staged = stageOne("J3");

    ExportMetadata first = stager.export(staged);
    ExportMetadata second = stager.export(staged);

    assertEquals(first, second);
  }

  @Test
  void refusesToOverwriteForeignFile() throws Exception {
    StagedResult staged = stageOne("J4");
    Files.createDirectories(exportRoot);
    Files.writeString(exportRoot.resolve("J4.pdf"), "someone else's");

    ExportException e = assertThrows(ExportException.class, () -> stager.export(staged));
    assertEquals(SerialPdfErrorCode.EXPORT_ERROR, e.getCode());
    assertEquals("someone else's", Files.readString(exportRoot.resolve("J4.pdf")));
    assertTrue(Files.exists(staged.pdf()));
  }

  @Test
  void lostStagedFileIsAnExportFailure() throws Exception {
    StagedResult staged = stageOne("J5");
    Files.delete(staged.pdf());

    assertThrows(ExportException.class, () -> stager.export(staged));
  }

  @Test
  void exportToExplicitDirectory() throws Exception {
    StagedResult staged = stageOne("J6");
    Path elsewhere = temp.resolve("elsewhere");

    stager.export(staged, elsewhere);

    assertTrue(Files.isRegularFile(elsewhere.resolve("J6.pdf")));
  }

  @Test
  void closeRemovesStagingRoot() throws Exception {
    stageOne("J7");

    stager.close();

    assertFalse(Files.exists(stager.stagingRoot()));
  }

  @Test
  void processingTimeIsRoundedToHundredths() {
    assertEquals(0.0, ExportMetadata.seconds(null));
    assertEquals(0.01, ExportMetadata.seconds(Duration.ofMillis(5)));
    assertEquals(2.5, ExportMetadata.seconds(Duration.ofMillis(2499)));
  }
}
