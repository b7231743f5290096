package org.flyte.flytekit.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for the identifiers that name configuration settings.
 * <p><strong>Why:</strong> Section, option and switch names flow into environment variable names and
 * file lookups; rejecting blank or control-character input early keeps those lookups well defined.
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a dot-delimited path has no empty segments, e.g. rejects {@code "admin..endpoint"}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate path
   * @return trimmed path
   * @throws IllegalArgumentException if the path is blank, starts or ends with a dot, or has an empty segment
   */
  public static String requireDottedPath(String name, String value) {
    String path = requireNonBlank(name, value);
    if (path.startsWith(".") || path.endsWith(".") || path.contains("..")) {
      throw new IllegalArgumentException(message(name, "must not contain empty segments: " + path));
    }
    return path;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
