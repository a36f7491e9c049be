package com.serialpdf.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.serialpdf.exception.ExceptionUtil;
import com.serialpdf.exception.NotFoundException;
import com.serialpdf.exception.SerialPdfException;
import com.serialpdf.exception.StateException;
import com.serialpdf.exception.ValidationException;
import com.serialpdf.jobs.JobManager;
import com.serialpdf.jobs.JobState;
import com.serialpdf.jobs.JobStatus;
import com.serialpdf.render.PlaceholderValue;
import com.serialpdf.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * /job/ endpoint.
 *
 * <ul>
 *   <li>{@code GET ?id=<id>} polls a job; a {@code READY} answer carries {@code pdf_data}, a
 *       {@code FAILED} one may carry {@code error_log}
 *   <li>{@code POST ?template_id=<id>[&commit=<hash|HEAD>]} with a JSON object body queues a job
 *       and answers {@code {"id": ...}}
 * </ul>
 */
public final class JobServlet extends HttpServlet {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(JobServlet.class);

  private static final TypeReference<LinkedHashMap<String, PlaceholderValue>> DATA_TYPE =
      new TypeReference<>() {};

  private final JobManager jobs;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public JobServlet(JobManager jobs) {
    this.jobs = jobs;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String jobId = req.getParameter("id");
    if (jobId == null || !StringUtils.isAlphanumeric(jobId)) {
      resp.sendError(400, "Missing or bad parameter: id (alphanum)");
      return;
    }

    JobStatus status = jobs.poll(jobId);
    ObjectNode node = mapper.createObjectNode();
    node.put("id", jobId);
    node.put("state", status.state().name());
    if (status.state() == JobState.READY && status.exportFile() != null) {
      ObjectNode pdf = node.putObject("pdf_data");
      pdf.put("export_file", status.exportFile());
      pdf.put("commit", status.commit());
      pdf.set("unmatched_placeholders", unmatched(status.unmatchedPlaceholders()));
      pdf.put("processing_time", status.processingTime());
    }
    if (status.errorLog() != null) {
      node.put("error_log", status.errorLog());
    }
    if (status.failure() != null) {
      node.put("failure", status.failure().name());
    }
    if (status.error() != null) {
      node.put("error", status.error());
    }
    writeJson(resp, 200, node);
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String templateId = req.getParameter("template_id");
    if (StringUtils.isBlank(templateId)) {
      resp.sendError(400, "Missing parameter: template_id");
      return;
    }
    String commit = req.getParameter("commit");

    Map<String, PlaceholderValue> data;
    try (InputStream body = req.getInputStream()) {
      JsonNode json = mapper.readTree(body);
      if (json == null || !json.isObject()) {
        resp.sendError(400, "Request does not include valid JSON data for template rendering");
        return;
      }
      data = mapper.readerFor(DATA_TYPE).readValue(json);
    } catch (JsonProcessingException e) {
      resp.sendError(
          400, "Request does not include valid JSON data for template rendering: "
              + e.getOriginalMessage());
      return;
    }

    try {
      String id = jobs.submit(templateId, StringUtils.isBlank(commit) ? null : commit, data);
      ObjectNode node = mapper.createObjectNode();
      node.put("id", id);
      writeJson(resp, 200, node);
    } catch (ValidationException e) {
      resp.sendError(400, e.getMessage());
    } catch (NotFoundException e) {
      resp.sendError(404, e.getMessage());
    } catch (StateException e) {
      resp.sendError(503, e.getMessage());
    } catch (SerialPdfException e) {
      log.error(
          "Could not create new job for '{}' [{}]: {}", templateId, e.getCode(), e.getMessage());
      resp.sendError(500, "Failed to create new job: " + ExceptionUtil.extractErrorMessage(e));
    }
  }

  private JsonNode unmatched(Map<String, List<String>> unmatched) {
    ObjectNode node = mapper.createObjectNode();
    if (unmatched != null) {
      unmatched.forEach(
          (file, tokens) -> {
            ArrayNode list = node.putArray(file);
            tokens.forEach(list::add);
          });
    }
    return node;
  }

  private void writeJson(HttpServletResponse resp, int status, JsonNode node) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }
}
