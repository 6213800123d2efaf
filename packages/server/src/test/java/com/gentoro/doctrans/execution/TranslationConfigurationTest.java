package com.gentoro.doctrans.execution;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.doctrans.exception.ValidationException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TranslationConfigurationTest {

  private static final Path OUT = Path.of("/tmp/out");

  @Test
  void appliesDefaultsWhenNothingIsSet() {
    TranslationConfiguration c = TranslationConfiguration.merge(null, null, OUT).validate();
    assertEquals(TranslationConfiguration.DEFAULT_SERVICE, c.service());
    assertEquals("en", c.langIn());
    assertEquals("zh", c.langOut());
    assertEquals(4, c.qps());
    assertNull(c.pages());
    assertEquals(OUT, c.outputDir());
  }

  @Test
  void overridesWinAndBlankValuesFallBack() {
    TranslationConfiguration c =
        TranslationConfiguration.merge(
            Map.of("lang_from", "ja", "lang_to", "fr", "qps", 2, "pages", "1-3"),
            Map.of("lang_to", "de", "pages", " "),
            OUT);
    assertEquals("ja", c.langIn());
    assertEquals("de", c.langOut());
    assertEquals(2, c.qps());
    assertNull(c.pages());
  }

  @Test
  void customQpsTakesPrecedence() {
    TranslationConfiguration c =
        TranslationConfiguration.merge(Map.of("qps", 2, "custom_qps", "12"), Map.of(), OUT);
    assertEquals(12, c.qps());
  }

  @Test
  void validationReportsEveryProblem() {
    ValidationException e =
        assertThrows(
            ValidationException.class,
            () ->
                TranslationConfiguration.merge(
                        Map.of("lang_from", "english!", "qps", 0, "pages", "one"), Map.of(), null)
                    .validate());
    String msg = e.getMessage();
    assertTrue(msg.startsWith("Invalid translation settings: "), msg);
    assertTrue(msg.contains("source language"), msg);
    assertTrue(msg.contains("qps"), msg);
    assertTrue(msg.contains("pages"), msg);
    assertTrue(msg.contains("output directory"), msg);
  }

  @Test
  void acceptsRegionalLanguagesAndPageRanges() {
    TranslationConfiguration.merge(
            Map.of("lang_from", "zh-CN", "lang_to", "pt_BR", "pages", "1, 3-5,8-"), Map.of(), OUT)
        .validate();
  }

  @Test
  void nonNumericQpsIsAValidationError() {
    assertThrows(
        ValidationException.class,
        () -> TranslationConfiguration.merge(Map.of("qps", "fast"), Map.of(), OUT));
  }

  @Test
  void engineSettingsIncludeResolvedValuesAndExtraOptions() {
    Map<String, Object> settings =
        TranslationConfiguration.merge(Map.of("openai_model", "gpt"), Map.of("pages", "2"), OUT)
            .toEngineSettings();
    assertEquals("gpt", settings.get("openai_model"));
    assertEquals("2", settings.get("pages"));
    assertEquals(4, settings.get("qps"));
    assertEquals(OUT.toString(), settings.get("output"));
  }
}
