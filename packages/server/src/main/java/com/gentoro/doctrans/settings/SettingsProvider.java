package com.gentoro.doctrans.settings;

import java.util.Map;

/**
 * Source of an owner's saved translation settings. Read once when a task starts; the result is
 * never re-read during a run.
 */
@FunctionalInterface
public interface SettingsProvider {
  Map<String, Object> get(String owner);
}
