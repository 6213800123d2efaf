package com.gentoro.doctrans.exception;

/** Stable error codes surfaced through {@link ErrorDetails} and API error bodies. */
public enum DocTransErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  NETWORK_ERROR,
  VALIDATION_ERROR,
  NOT_FOUND,
  STATE_ERROR,
  STORE_ERROR,
  ENGINE_ERROR
}
