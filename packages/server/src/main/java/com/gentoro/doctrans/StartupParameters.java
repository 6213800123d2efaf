package com.gentoro.doctrans;

import java.util.HashMap;
import java.util.Map;

/**
 * Command line parameters in {@code --name=value} form. A bare {@code --flag} is stored as {@code
 * "true"}.
 */
public class StartupParameters {
  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() <= 2) continue;
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public String getParameter(String name, String defaultValue) {
    return parameters.getOrDefault(name, defaultValue);
  }

  /** Explicit configuration file, or null to use the bundled {@code application.yaml}. */
  public String configFile() {
    return parameters.get("config");
  }
}
