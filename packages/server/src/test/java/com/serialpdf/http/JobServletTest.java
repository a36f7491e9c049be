package com.serialpdf.http;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.serialpdf.compile.BuildLogFilter;
import com.serialpdf.compile.ErrorLogArchive;
import com.serialpdf.exception.CompilationException;
import com.serialpdf.exception.NotFoundException;
import com.serialpdf.jobs.InMemoryJobStore;
import com.serialpdf.jobs.JobManager;
import com.serialpdf.jobs.PoolSettings;
import com.serialpdf.render.PlaceholderSyntax;
import com.serialpdf.render.RenderReport;
import com.serialpdf.render.UnmatchedPlaceholder;
import com.serialpdf.staging.ResultStager;
import com.serialpdf.template.TemplateLocation;
import com.serialpdf.template.VersionResolver;
import com.serialpdf.utility.JacksonUtility;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobServletTest {

  @TempDir Path temp;

  private final HttpClient client = HttpClient.newHttpClient();
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private EmbeddedJettyServer server;
  private JobManager jobs;
  private String base;

  @BeforeEach
  void setUp() {
    VersionResolver resolver = mock(VersionResolver.class);
    when(resolver.resolve(eq("invoice"), any()))
        .thenReturn(new TemplateLocation("invoice", "invoice", "c0ffee", "main.tex"));
    when(resolver.resolve(eq("broken"), any()))
        .thenReturn(new TemplateLocation("broken", "broken", "c0ffee", "main.tex"));
    when(resolver.resolve(eq("missing"), any()))
        .thenThrow(new NotFoundException("Could not find template associated with id: missing"));

    ResultStager stager = ResultStager.create(temp.resolve("staging"), temp.resolve("export"));
    jobs =
        new JobManager(
            new InMemoryJobStore(),
            resolver,
            PlaceholderSyntax.defaults(),
            job -> {
              if (job.templateId().equals("broken")) {
                throw new CompilationException(
                    "PDF conversion failed: latexmk return code was 12", "! Emergency stop.", false);
              }
              Path pdf = Files.writeString(temp.resolve(job.id() + ".pdf"), "%PDF");
              RenderReport report =
                  new RenderReport(
                      Map.of(
                          "main.tex",
                          List.of(new UnmatchedPlaceholder("\\placeholder{x}", "x", 1))));
              return stager.stage(pdf, job.id(), job.commit(), Duration.ofMillis(1500), report);
            },
            stager,
            new ErrorLogArchive(temp.resolve("logs"), 10, 0, new BuildLogFilter()),
            new PoolSettings(1, true, Duration.ofSeconds(5)));

    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("http.hostname", "127.0.0.1");
    config.addProperty("http.port", 0);
    server = new EmbeddedJettyServer(config);
    server.prepare();
    server
        .getContextHandler()
        .addServlet(new ServletHolder(new IndexServlet(jobs.concurrency())), "");
    server.getContextHandler().addServlet(new ServletHolder(new JobServlet(jobs)), "/job/*");
    server.start();
    base = "http://127.0.0.1:" + server.getPort();
  }

  @AfterEach
  void tearDown() {
    server.close();
    jobs.shutdown();
  }

  private HttpResponse<String> get(String path) throws Exception {
    return client.send(
        HttpRequest.newBuilder(URI.create(base + path)).GET().build(),
        HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> post(String path, String body) throws Exception {
    return client.send(
        HttpRequest.newBuilder(URI.create(base + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build(),
        HttpResponse.BodyHandlers.ofString());
  }

  private JsonNode awaitFinished(String id) throws Exception {
    long deadline = System.currentTimeMillis() + 10_000;
    JsonNode node = mapper.readTree(get("/job/?id=" + id).body());
    while ("PENDING".equals(node.path("state").asText())
        && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
      node = mapper.readTree(get("/job/?id=" + id).body());
    }
    return node;
  }

  @Test
  void indexReportsWorkers() throws Exception {
    HttpResponse<String> response = get("/");

    assertEquals(200, response.statusCode());
    assertEquals("serial-pdf is running with up to 1 worker(s)", response.body());
  }

  @Test
  void submitThenPollReady() throws Exception {
    HttpResponse<String> created =
        post("/job/?template_id=invoice", "{\"name\": \"Ada\", \"items\": [\"a\", \"b\"]}");
    assertEquals(200, created.statusCode());
    String id = mapper.readTree(created.body()).get("id").asText();
    assertTrue(id.matches("[0-9A-F]{12}"));

    JsonNode node = awaitFinished(id);

    assertEquals("READY", node.get("state").asText());
    JsonNode pdf = node.get("pdf_data");
    assertEquals(id + ".pdf", pdf.get("export_file").asText());
    assertEquals("c0ffee", pdf.get("commit").asText());
    assertEquals(1.5, pdf.get("processing_time").asDouble());
    assertEquals(
        "\\placeholder{x}", pdf.get("unmatched_placeholders").get("main.tex").get(0).asText());
    assertTrue(Files.isRegularFile(temp.resolve("export").resolve(id + ".pdf")));
  }

  @Test
  void failedCompilationExposesLog() throws Exception {
    String id =
        mapper.readTree(post("/job/?template_id=broken&commit=HEAD", "{}").body()).get("id").asText();

    JsonNode node = awaitFinished(id);

    assertEquals("FAILED", node.get("state").asText());
    assertEquals("COMPILATION", node.get("failure").asText());
    assertEquals(id + ".log", node.get("error_log").asText());
    assertFalse(node.has("pdf_data"));
  }

  @Test
  void unknownJobIsNotFound() throws Exception {
    HttpResponse<String> response = get("/job/?id=ABCDEF123456");

    assertEquals(200, response.statusCode());
    assertEquals("NOT_FOUND", mapper.readTree(response.body()).get("state").asText());
  }

  @Test
  void badPollRequests() throws Exception {
    assertEquals(400, get("/job/").statusCode());
    assertEquals(400, get("/job/?id=..%2Fetc").statusCode());
  }

  @Test
  void badSubmitRequests() throws Exception {
    assertEquals(400, post("/job/", "{}").statusCode());
    assertEquals(400, post("/job/?template_id=invoice", "not json").statusCode());
    assertEquals(400, post("/job/?template_id=invoice", "[1, 2]").statusCode());
    assertEquals(400, post("/job/?template_id=invoice", "{\"n\": {\"nested\": 1}}").statusCode());
    assertEquals(400, post("/job/?template_id=invoice", "{\"bad key\": \"x\"}").statusCode());
    assertEquals(400, post("/job/?template_id=invoice&commit=a-b", "{}").statusCode());
    assertEquals(404, post("/job/?template_id=missing", "{}").statusCode());
  }

  @Test
  void submitAfterShutdownIsUnavailable() throws Exception {
    jobs.shutdown();

    assertEquals(503, post("/job/?template_id=invoice", "{}").statusCode());
  }
}
