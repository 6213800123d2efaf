package com.gentoro.doctrans.engine;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Events produced by a {@link TranslationEngine} run. The set of cases is closed; each case carries
 * only the fields meaningful for it.
 */
public sealed interface EngineEvent {

  /** Common shape of the three progress kinds. */
  sealed interface Progress extends EngineEvent {
    String stage();

    int overallProgress();

    int partIndex();

    int totalParts();

    int stageCurrent();

    int stageTotal();

    /** Message shown to users, e.g. {@code "Layout (1/2, 2/5)"}. */
    default String describe() {
      return "%s (%d/%d, %d/%d)"
          .formatted(stage(), partIndex(), totalParts(), stageCurrent(), stageTotal());
    }
  }

  record ProgressStart(
      String stage,
      int overallProgress,
      int partIndex,
      int totalParts,
      int stageCurrent,
      int stageTotal)
      implements Progress {}

  record ProgressUpdate(
      String stage,
      int overallProgress,
      int partIndex,
      int totalParts,
      int stageCurrent,
      int stageTotal)
      implements Progress {}

  record ProgressEnd(
      String stage,
      int overallProgress,
      int partIndex,
      int totalParts,
      int stageCurrent,
      int stageTotal)
      implements Progress {}

  /** Successful end of the run; keys name the variant (e.g. {@code mono}, {@code dual}). */
  record Finish(Map<String, Path> outputArtifacts) implements EngineEvent {
    public Finish {
      outputArtifacts =
          outputArtifacts == null
              ? Map.of()
              : Collections.unmodifiableMap(new LinkedHashMap<>(outputArtifacts));
    }
  }

  /** Failed end of the run, reported by the engine as an {@code error} event. */
  record Failure(String errorDetail) implements EngineEvent {}
}
