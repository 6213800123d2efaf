package com.gentoro.doctrans.engine;

import com.gentoro.doctrans.exception.ConfigException;
import com.gentoro.doctrans.exception.EngineException;
import com.gentoro.doctrans.execution.TranslationConfiguration;
import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.slf4j.Logger;

/**
 * Runs the translation engine as an external process.
 *
 * <p>The configured command is invoked with the input path as its last argument. The effective
 * settings are written to the process's stdin as one JSON object; the process answers with one
 * JSON event per stdout line. Lines that are not JSON objects are treated as engine chatter and
 * logged. A non-zero exit without a terminal event surfaces as {@link EngineEvent.Failure}.
 */
public final class ProcessTranslationEngine implements TranslationEngine {
  private static final Logger log = LoggingService.getLogger(ProcessTranslationEngine.class);

  private final List<String> command;
  private final EngineEventDecoder decoder;

  public ProcessTranslationEngine(List<String> command) {
    if (command == null || command.isEmpty()) {
      throw new ConfigException("engine.command must name the translation engine executable");
    }
    this.command = List.copyOf(command);
    this.decoder = new EngineEventDecoder();
  }

  @Override
  public Stream<EngineEvent> run(TranslationConfiguration configuration, Path input) {
    List<String> argv = new ArrayList<>(command);
    argv.add(input.toAbsolutePath().toString());

    Process process;
    try {
      process =
          new ProcessBuilder(argv).redirectError(ProcessBuilder.Redirect.INHERIT).start();
    } catch (IOException e) {
      throw new EngineException("Failed to start translation engine: " + e.getMessage(), e);
    }
    log.debug("Started engine process {} for {}", process.pid(), input);

    try (OutputStream stdin = process.getOutputStream()) {
      stdin.write(
          JacksonUtility.toJson(configuration.toEngineSettings())
              .getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      process.destroyForcibly();
      throw new EngineException("Failed to send settings to translation engine", e);
    }

    BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));

    Stream<EngineEvent> events =
        reader.lines().map(String::trim).filter(this::isEventLine).map(decoder::decode);
    Stream<EngineEvent> exit =
        Stream.generate(() -> exitEvent(process)).limit(1).filter(Objects::nonNull);

    return Stream.concat(events, exit).onClose(() -> terminate(process, reader));
  }

  private boolean isEventLine(String line) {
    if (line.startsWith("{")) return true;
    if (!line.isEmpty()) log.debug("engine: {}", line);
    return false;
  }

  private static EngineEvent exitEvent(Process process) {
    try {
      int code = process.waitFor();
      return code == 0
          ? null
          : new EngineEvent.Failure("Translation engine exited with code " + code);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EngineException("Interrupted while waiting for translation engine", e);
    }
  }

  private static void terminate(Process process, BufferedReader reader) {
    try {
      reader.close();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } finally {
      if (process.isAlive()) {
        process.destroy();
        try {
          if (!process.waitFor(5, TimeUnit.SECONDS)) {
            process.destroyForcibly();
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          process.destroyForcibly();
        }
      }
    }
  }
}
