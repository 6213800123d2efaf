package com.gentoro.doctrans.engine;

import com.gentoro.doctrans.execution.TranslationConfiguration;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * External translation engine. A run yields a finite, lazily produced, non-restartable sequence of
 * {@link EngineEvent}s. Callers consume it until {@link EngineEvent.Finish}, {@link
 * EngineEvent.Failure} or exhaustion and must close the stream to release engine resources.
 */
public interface TranslationEngine {
  Stream<EngineEvent> run(TranslationConfiguration configuration, Path input);
}
