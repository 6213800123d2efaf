package com.gentoro.doctrans.execution;

import com.gentoro.doctrans.exception.ValidationException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Effective configuration of one engine run: the owner's saved settings overlaid with the task's
 * per-run overrides. Built once when the task starts and never re-read during the run.
 */
public final class TranslationConfiguration {
  public static final String DEFAULT_SERVICE = "SiliconFlowFree";
  public static final String DEFAULT_LANG_IN = "en";
  public static final String DEFAULT_LANG_OUT = "zh";
  public static final int DEFAULT_QPS = 4;

  private static final Pattern PAGES =
      Pattern.compile("^\\s*\\d+(-\\d*)?(\\s*,\\s*\\d+(-\\d*)?)*\\s*$");
  private static final Pattern LANGUAGE = Pattern.compile("^[A-Za-z]{2,3}([-_][A-Za-z0-9]+)*$");

  private final String service;
  private final String langIn;
  private final String langOut;
  private final String pages;
  private final int qps;
  private final Path outputDir;
  private final Map<String, Object> options;

  private TranslationConfiguration(
      String service,
      String langIn,
      String langOut,
      String pages,
      int qps,
      Path outputDir,
      Map<String, Object> options) {
    this.service = service;
    this.langIn = langIn;
    this.langOut = langOut;
    this.pages = pages;
    this.qps = qps;
    this.outputDir = outputDir;
    this.options = options;
  }

  /**
   * Merge {@code saved} settings with per-run {@code overrides}; override keys win. Values are not
   * checked here, see {@link #validate()}.
   */
  public static TranslationConfiguration merge(
      Map<String, Object> saved, Map<String, Object> overrides, Path outputDir) {
    Map<String, Object> merged = new LinkedHashMap<>();
    if (saved != null) merged.putAll(saved);
    if (overrides != null) merged.putAll(overrides);

    Object qpsValue =
        merged.get("custom_qps") != null ? merged.get("custom_qps") : merged.get("qps");
    return new TranslationConfiguration(
        stringValue(merged.get("service"), DEFAULT_SERVICE),
        stringValue(merged.get("lang_from"), DEFAULT_LANG_IN),
        stringValue(merged.get("lang_to"), DEFAULT_LANG_OUT),
        stringValue(merged.get("pages"), null),
        intValue(qpsValue, DEFAULT_QPS),
        outputDir,
        Collections.unmodifiableMap(merged));
  }

  /**
   * @throws ValidationException listing every problem found
   */
  public TranslationConfiguration validate() {
    List<String> problems = new ArrayList<>();
    if (!LANGUAGE.matcher(langIn).matches()) {
      problems.add("unsupported source language '" + langIn + "'");
    }
    if (!LANGUAGE.matcher(langOut).matches()) {
      problems.add("unsupported target language '" + langOut + "'");
    }
    if (qps < 1) problems.add("qps must be at least 1, got " + qps);
    if (pages != null && !PAGES.matcher(pages).matches()) {
      problems.add("pages must look like '1,3-5', got '" + pages + "'");
    }
    if (outputDir == null) problems.add("output directory is required");
    if (!problems.isEmpty()) {
      throw new ValidationException("Invalid translation settings: " + String.join("; ", problems));
    }
    return this;
  }

  public String service() {
    return service;
  }

  public String langIn() {
    return langIn;
  }

  public String langOut() {
    return langOut;
  }

  /** Page selection such as {@code "1,3-5"}, or null for all pages. */
  public String pages() {
    return pages;
  }

  public int qps() {
    return qps;
  }

  public Path outputDir() {
    return outputDir;
  }

  /** All merged settings, including those only the engine understands. */
  public Map<String, Object> options() {
    return options;
  }

  /** Flat view handed to the engine process. */
  public Map<String, Object> toEngineSettings() {
    Map<String, Object> out = new LinkedHashMap<>(options);
    out.put("service", service);
    out.put("lang_from", langIn);
    out.put("lang_to", langOut);
    out.put("qps", qps);
    if (pages != null) out.put("pages", pages);
    out.put("output", outputDir == null ? null : outputDir.toString());
    return out;
  }

  private static String stringValue(Object value, String defaultValue) {
    if (value == null) return defaultValue;
    String s = value.toString().trim();
    return s.isEmpty() ? defaultValue : s;
  }

  private static int intValue(Object value, int defaultValue) {
    if (value == null) return defaultValue;
    if (value instanceof Number n) return n.intValue();
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ValidationException("Invalid translation settings: qps is not a number: " + value);
    }
  }
}
