package com.gentoro.doctrans.utility;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.doctrans.exception.ValidationException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Shared Jackson mapper and the small JSON helpers used by the store and the servlets. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public static final TypeReference<LinkedHashMap<String, Object>> OBJECT_MAP =
      new TypeReference<>() {};
  private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP =
      new TypeReference<>() {};

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object value) {
    try {
      return JSON_MAPPER.writeValueAsString(value);
    } catch (Exception e) {
      throw new ValidationException("Failed to serialize JSON", e);
    }
  }

  /** Parse a JSON object into an ordered map; null or blank input yields an empty map. */
  public static Map<String, Object> readObjectMap(String json) {
    if (json == null || json.isBlank()) return new LinkedHashMap<>();
    try {
      return JSON_MAPPER.readValue(json, OBJECT_MAP);
    } catch (Exception e) {
      throw new ValidationException("Invalid JSON object: " + e.getMessage(), e);
    }
  }

  public static Map<String, String> readStringMap(String json) {
    if (json == null || json.isBlank()) return new LinkedHashMap<>();
    try {
      return JSON_MAPPER.readValue(json, STRING_MAP);
    } catch (Exception e) {
      throw new ValidationException("Invalid JSON object: " + e.getMessage(), e);
    }
  }
}
