package com.gentoro.doctrans.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.doctrans.exception.EngineException;
import com.gentoro.doctrans.utility.JacksonUtility;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes the engine's loosely typed JSON events into {@link EngineEvent} cases. This is the only
 * place that knows the wire field names; missing progress fields fall back to neutral defaults.
 */
public final class EngineEventDecoder {

  public EngineEvent decode(String line) {
    JsonNode node;
    try {
      node = JacksonUtility.getJsonMapper().readTree(line);
    } catch (Exception e) {
      throw new EngineException("Malformed engine event: " + e.getMessage(), e);
    }
    return decode(node);
  }

  public EngineEvent decode(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new EngineException("Engine event must be a JSON object");
    }
    String type = node.path("type").asText("");
    return switch (type) {
      case "progress_start" ->
          new EngineEvent.ProgressStart(
              stage(node),
              intField(node, "overall_progress", 0),
              intField(node, "part_index", 1),
              intField(node, "total_parts", 1),
              intField(node, "stage_current", 0),
              intField(node, "stage_total", 1));
      case "progress_update" ->
          new EngineEvent.ProgressUpdate(
              stage(node),
              intField(node, "overall_progress", 0),
              intField(node, "part_index", 1),
              intField(node, "total_parts", 1),
              intField(node, "stage_current", 0),
              intField(node, "stage_total", 1));
      case "progress_end" ->
          new EngineEvent.ProgressEnd(
              stage(node),
              intField(node, "overall_progress", 0),
              intField(node, "part_index", 1),
              intField(node, "total_parts", 1),
              intField(node, "stage_current", 0),
              intField(node, "stage_total", 1));
      case "finish" -> new EngineEvent.Finish(artifacts(node));
      case "error" -> {
        String detail = node.path("error_detail").asText(node.path("error").asText(""));
        yield new EngineEvent.Failure(detail.isBlank() ? "Unknown error" : detail);
      }
      default -> throw new EngineException("Unknown engine event type: '" + type + "'");
    };
  }

  private static String stage(JsonNode node) {
    String stage = node.path("stage").asText("");
    return stage.isBlank() ? "Processing" : stage;
  }

  /** Numeric fields may arrive as floats; they are truncated. */
  private static int intField(JsonNode node, String field, int defaultValue) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || !value.isNumber()) return defaultValue;
    return (int) value.asDouble();
  }

  /**
   * Accepts {@code output_artifacts: {"mono": "...", "dual": "..."}} and the older {@code
   * translate_result: {"mono_pdf_path": ..., "dual_pdf_path": ...}} shape.
   */
  private static Map<String, Path> artifacts(JsonNode node) {
    Map<String, Path> out = new LinkedHashMap<>();
    JsonNode artifacts = node.get("output_artifacts");
    if (artifacts != null && artifacts.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = artifacts.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        if (e.getValue().isTextual() && !e.getValue().asText().isBlank()) {
          out.put(e.getKey(), Path.of(e.getValue().asText()));
        }
      }
      return out;
    }
    JsonNode result = node.path("translate_result");
    putPath(out, "mono", result.get("mono_pdf_path"));
    putPath(out, "dual", result.get("dual_pdf_path"));
    return out;
  }

  private static void putPath(Map<String, Path> out, String variant, JsonNode value) {
    if (value != null && value.isTextual() && !value.asText().isBlank()) {
      out.put(variant, Path.of(value.asText()));
    }
  }
}
