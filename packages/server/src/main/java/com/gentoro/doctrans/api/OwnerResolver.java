package com.gentoro.doctrans.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/** Determines which owner a request acts for. Token validation happens upstream. */
@FunctionalInterface
public interface OwnerResolver {
  Optional<String> resolve(HttpServletRequest request);

  /**
   * Reads the owner from {@code header}, falling back to the query parameter {@code parameter} for
   * clients such as {@code EventSource} that cannot set headers.
   */
  static OwnerResolver fromHeaderOrParameter(String header, String parameter) {
    return request -> {
      String owner = request.getHeader(header);
      if (owner == null || owner.isBlank()) {
        owner = request.getParameter(parameter);
      }
      return owner == null || owner.isBlank() ? Optional.empty() : Optional.of(owner.trim());
    };
  }
}
