package com.gentoro.doctrans.exception;

/** Problems binding or running the embedded HTTP listener. */
public class NetworkException extends DocTransException {
  public NetworkException(String message) {
    super(DocTransErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(DocTransErrorCode.NETWORK_ERROR, message, cause);
  }
}
