package org.flyte.flytekit.config;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for building option maps out of resolved settings.
 */
public final class ConfigMaps {

  private ConfigMaps() {}

  /**
   * Returns a copy of {@code source} with {@code key} mapped to {@code value} when the value is set.
   * {@code source} is never modified.
   *
   * <p>A value counts as set unless it is {@code null}, an empty string, or an empty collection or map.
   *
   * @param source existing options; may be {@code null}
   * @param key option key
   * @param value resolved value
   * @param <V> value type
   * @return new unmodifiable map in insertion order
   */
  public static <V> Map<String, V> setIfExists(Map<String, V> source, String key, V value) {
    Objects.requireNonNull(key, "key");
    Map<String, V> result = source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
    if (isSet(value)) {
      result.put(key, value);
    }
    return Collections.unmodifiableMap(result);
  }

  private static boolean isSet(Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof CharSequence text) {
      return text.length() > 0;
    }
    if (value instanceof Collection<?> items) {
      return !items.isEmpty();
    }
    if (value instanceof Map<?, ?> mapping) {
      return !mapping.isEmpty();
    }
    return true;
  }
}
