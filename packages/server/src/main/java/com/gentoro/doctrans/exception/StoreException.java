package com.gentoro.doctrans.exception;

/** Durable store failure. The enclosing transaction has already been rolled back. */
public class StoreException extends DocTransException {
  public StoreException(String message) {
    super(DocTransErrorCode.STORE_ERROR, message);
  }

  public StoreException(String message, Throwable cause) {
    super(DocTransErrorCode.STORE_ERROR, message, cause);
  }
}
