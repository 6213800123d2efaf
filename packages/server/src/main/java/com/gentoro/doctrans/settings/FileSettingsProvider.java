package com.gentoro.doctrans.settings;

import com.gentoro.doctrans.exception.ValidationException;
import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.tasks.TaskWorkspace;
import com.gentoro.doctrans.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;

/** Reads {@code users/<owner>/settings.json}; a missing file means "no saved settings". */
public final class FileSettingsProvider implements SettingsProvider {
  private static final Logger log = LoggingService.getLogger(FileSettingsProvider.class);

  private final TaskWorkspace workspace;

  public FileSettingsProvider(TaskWorkspace workspace) {
    this.workspace = workspace;
  }

  @Override
  public Map<String, Object> get(String owner) {
    Path file = workspace.settingsFile(owner);
    if (!Files.isRegularFile(file)) {
      log.debug("No saved settings for user {}", owner);
      return new LinkedHashMap<>();
    }
    try {
      return JacksonUtility.readObjectMap(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new ValidationException("Unable to read saved settings for user " + owner, e);
    }
  }
}
