package org.flyte.flytekit.config;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.flyte.flytekit.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates a setting in a YAML config file by its switch, a dot-delimited path such as
 * {@code admin.endpoint}. Switches stay dot-delimited so they line up with the flag names of the
 * {@code flytectl} command-line tool.
 *
 * <p>Reading never fails: a missing key, a path that runs into a non-mapping node, or a file without
 * a YAML document all yield empty and are logged at ERROR. Leaves that are {@code false}, zero, or empty
 * also yield empty, so callers fall back to their own default. This is broader than {@link LegacyConfigEntry}, which only absorbs
 * INI lookup failures, because a path walk over arbitrary YAML fails in more than one way.
 *
 * @param switchPath dot-delimited path to the value
 * @param type expected type of the value
 */
public record YamlConfigEntry(String switchPath, ValueType type) implements ConfigDescriptor {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigEntry.class);
  private static final Pattern SEPARATOR = Pattern.compile(Pattern.quote("."));

  public YamlConfigEntry {
    switchPath = Strings.requireDottedPath("switchPath", switchPath);
    Objects.requireNonNull(type, "type");
  }

  /**
   * Creates a {@link ValueType#STRING} entry.
   *
   * @param switchPath dot-delimited path to the value
   */
  public YamlConfigEntry(String switchPath) {
    this(switchPath, ValueType.STRING);
  }

  /**
   * Keys walked from the document root to the value.
   *
   * @return ordered, immutable list of keys
   */
  public List<String> keys() {
    return List.of(SEPARATOR.split(switchPath));
  }

  /**
   * Reads the value from a YAML config file.
   *
   * @param configFile loaded config file; {@code null} yields empty
   * @return the value, or empty when the document does not define it
   */
  public Optional<Object> readFromFile(ConfigFile configFile) {
    return readFromFile(configFile, null);
  }

  /**
   * Reads the value from a YAML config file and applies {@code transform}.
   *
   * @param configFile loaded config file; {@code null} yields empty
   * @param transform transform applied to the value; may be {@code null}
   * @return the transformed value, or empty when the document does not define it
   */
  public Optional<Object> readFromFile(ConfigFile configFile, Function<Object, ?> transform) {
    if (configFile == null) {
      return Optional.empty();
    }
    try {
      return configFile.get(this)
          .filter(YamlConfigEntry::isSet)
          .flatMap(value -> Transformers.apply(value, transform));
    } catch (RuntimeException ex) {
      log.error("Switch {} could not be read from {}: {}", switchPath, configFile.location(),
          ex.getMessage());
      log.debug("Switch {} lookup failure", switchPath, ex);
      return Optional.empty();
    }
  }

  /**
   * A YAML leaf only counts as set when it is not {@code false}, zero, or an empty string,
   * collection or mapping.
   */
  static boolean isSet(Object value) {
    if (value instanceof Boolean flag) {
      return flag;
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.signum() != 0;
    }
    if (value instanceof BigInteger integer) {
      return integer.signum() != 0;
    }
    if (value instanceof Number number) {
      return number.doubleValue() != 0;
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
    return value != null;
  }
}
