package com.gentoro.doctrans.exception;

import java.time.Instant;
import java.util.Map;

/** Flattened error representation used for logging and API responses. */
public record ErrorDetails(
    String type,
    String message,
    DocTransErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
