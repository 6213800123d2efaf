package com.gentoro.doctrans.exception;

import java.util.Map;

/** Base unchecked exception for all DocTrans failures. */
public class DocTransException extends RuntimeException {
  private final DocTransErrorCode code;
  private final Map<String, Object> context;

  public DocTransException(DocTransErrorCode code, String message) {
    this(code, message, null, null);
  }

  public DocTransException(DocTransErrorCode code, String message, Throwable cause) {
    this(code, message, cause, null);
  }

  public DocTransException(
      DocTransErrorCode code, String message, Throwable cause, Map<String, Object> context) {
    super(message, cause);
    this.code = code == null ? DocTransErrorCode.UNKNOWN : code;
    this.context = context;
  }

  public DocTransErrorCode getCode() {
    return code;
  }

  /** Optional structured context; may be null. */
  public Map<String, Object> getContext() {
    return context;
  }
}
