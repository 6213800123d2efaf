package com.gentoro.doctrans.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.doctrans.exception.ValidationException;
import com.gentoro.doctrans.execution.TranslationService;
import com.gentoro.doctrans.tasks.TaskManager;
import com.gentoro.doctrans.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * POST /api/translate: starts a translation of an uploaded file.
 *
 * <p>Body: {@code {"file_id": "...", "settings": {...}}}. {@code settings} may also be sent as a
 * JSON-encoded string. Answers 202 with the new task id.
 */
public final class TranslateServlet extends HttpServlet {
  private final TranslationService translations;
  private final OwnerResolver owners;

  public TranslateServlet(TranslationService translations, OwnerResolver owners) {
    this.translations = translations;
    this.owners = owners;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Optional<String> owner = ApiResponses.requireOwner(owners, req, resp);
    if (owner.isEmpty()) return;
    try {
      JsonNode body = readBody(req);
      String fileId = body.path("file_id").asText("");
      Map<String, Object> settings = readSettings(body.get("settings"));

      String taskId = translations.start(owner.get(), fileId, settings);

      ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
      node.put("task_id", taskId);
      node.put("status", "queued");
      node.put("message", TaskManager.QUEUED_MESSAGE);
      ApiResponses.writeJson(resp, 202, node);
    } catch (Exception e) {
      ApiResponses.writeFailure(resp, e);
    }
  }

  private static JsonNode readBody(HttpServletRequest req) throws IOException {
    byte[] bytes = req.getInputStream().readAllBytes();
    if (bytes.length == 0) {
      throw new ValidationException("Empty request body");
    }
    JsonNode node;
    try {
      node = JacksonUtility.getJsonMapper().readTree(bytes);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Invalid request body: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new ValidationException("Request body must be a JSON object");
    }
    return node;
  }

  private static Map<String, Object> readSettings(JsonNode settings) {
    if (settings == null || settings.isNull()) return Map.of();
    if (settings.isTextual()) {
      return JacksonUtility.readObjectMap(settings.asText());
    }
    if (!settings.isObject()) {
      throw new ValidationException("Invalid settings JSON");
    }
    return JacksonUtility.getJsonMapper().convertValue(settings, JacksonUtility.OBJECT_MAP);
  }
}
