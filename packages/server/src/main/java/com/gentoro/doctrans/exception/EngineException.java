package com.gentoro.doctrans.exception;

/** Failure reported or thrown by the external translation engine. */
public class EngineException extends DocTransException {
  public EngineException(String message) {
    super(DocTransErrorCode.ENGINE_ERROR, message);
  }

  public EngineException(String message, Throwable cause) {
    super(DocTransErrorCode.ENGINE_ERROR, message, cause);
  }
}
