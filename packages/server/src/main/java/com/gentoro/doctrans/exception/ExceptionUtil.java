package com.gentoro.doctrans.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is a {@link DocTransException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof DocTransException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        DocTransErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Human-readable failure detail stored on a failed task. Engine and validation failures carry a
   * message written for the user, so it is used verbatim; anything else is prefixed with the
   * exception type.
   */
  public static String describeFailure(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    String message = t.getMessage();
    if (t instanceof EngineException || t instanceof ValidationException) {
      return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }
    if (message == null || message.isBlank()) {
      return t.getClass().getSimpleName();
    }
    return t.getClass().getSimpleName() + ": " + message;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static DocTransException rethrowIfUnchecked(
      Throwable t, Function<Throwable, DocTransException> supplier) {
    if (t instanceof DocTransException) {
      return (DocTransException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
