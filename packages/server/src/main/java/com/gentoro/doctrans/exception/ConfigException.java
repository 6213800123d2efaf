package com.gentoro.doctrans.exception;

/** Missing or invalid application configuration. */
public class ConfigException extends DocTransException {
  public ConfigException(String message) {
    super(DocTransErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(DocTransErrorCode.CONFIG_ERROR, message, cause);
  }
}
