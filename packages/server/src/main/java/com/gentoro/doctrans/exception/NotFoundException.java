package com.gentoro.doctrans.exception;

/** Unknown task, or a task that does not belong to the requesting owner. */
public class NotFoundException extends DocTransException {
  public NotFoundException(String message) {
    super(DocTransErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(DocTransErrorCode.NOT_FOUND, message, cause);
  }
}
