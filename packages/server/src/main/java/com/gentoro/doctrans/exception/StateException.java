package com.gentoro.doctrans.exception;

/** Illegal lifecycle transition, or a component used before it was initialized. */
public class StateException extends DocTransException {
  public StateException(String message) {
    super(DocTransErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(DocTransErrorCode.STATE_ERROR, message, cause);
  }
}
