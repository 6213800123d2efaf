package com.gentoro.doctrans.exception;

/** Rejected input: malformed configuration, out-of-range progress, bad request payloads. */
public class ValidationException extends DocTransException {
  public ValidationException(String message) {
    super(DocTransErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(DocTransErrorCode.VALIDATION_ERROR, message, cause);
  }
}
