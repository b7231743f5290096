package org.flyte.flytekit.config;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Value transforms applied to raw setting values before they are handed to callers.
 */
public final class Transformers {
  private static final Set<String> FALSE_WORDS = Set.of("false", "0", "off", "no");

  private Transformers() {}

  /**
   * Coerces environment style flag strings to booleans. Empty strings and {@code false}, {@code 0},
   * {@code off}, {@code no} (any case) are {@code false}; every other string is {@code true}.
   * Values that are not strings, such as booleans already parsed from a file, pass through unchanged.
   *
   * @param value raw value
   * @return coerced value
   */
  public static Object bool(Object value) {
    if (value instanceof String text) {
      return !text.isEmpty() && !FALSE_WORDS.contains(text.toLowerCase(Locale.ROOT));
    }
    return value;
  }

  /**
   * Transform adopted by a {@link ConfigEntry} that was not given one explicitly.
   *
   * @param type legacy value type
   * @return default transform, or empty when values are returned untouched
   */
  public static Optional<Function<Object, ?>> defaultFor(ValueType type) {
    if (type == ValueType.BOOLEAN) {
      Function<Object, ?> coercion = Transformers::bool;
      return Optional.of(coercion);
    }
    return Optional.empty();
  }

  static Optional<Object> apply(Object raw, Function<Object, ?> transform) {
    if (raw == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(transform == null ? raw : transform.apply(raw));
  }
}
