package org.flyte.flytekit.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.flyte.flytekit.config.ini.IniException;
import org.flyte.flytekit.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Locates a setting in the legacy INI format, and in the matching environment variable.
 * <p><strong>Environment:</strong> the variable name is {@code FLYTE_{SECTION}_{OPTION}}, upper-cased.</p>
 * <p><strong>Errors:</strong> lookup failures in the file (missing section or option, unconvertible value)
 * are treated as "not set" so resolution can fall through to the next source.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param section section the option is found under
 * @param option option name within the section
 * @param type expected type of the value
 * @since 0.1.0
 */
public record LegacyConfigEntry(String section, String option, ValueType type)
    implements ConfigDescriptor {
  /** Prefix of every per-setting environment variable. */
  public static final String ENV_PREFIX = "FLYTE";

  private static final Logger log = LoggerFactory.getLogger(LegacyConfigEntry.class);

  public LegacyConfigEntry {
    section = Strings.requireNonBlank("section", section);
    option = Strings.requireNonBlank("option", option);
    Objects.requireNonNull(type, "type");
  }

  /**
   * Creates a {@link ValueType#STRING} entry.
   *
   * @param section section name
   * @param option option name
   */
  public LegacyConfigEntry(String section, String option) {
    this(section, option, ValueType.STRING);
  }

  /**
   * Name of the environment variable that overrides this setting.
   *
   * @return e.g. {@code FLYTE_PLATFORM_URL} for section {@code platform}, option {@code url}
   */
  public String envVariableName() {
    return ENV_PREFIX + "_" + section.toUpperCase(Locale.ROOT) + "_" + option.toUpperCase(Locale.ROOT);
  }

  /**
   * Reads the raw environment value of the running process.
   *
   * @return the variable value, or empty when unset
   */
  public Optional<Object> readFromEnv() {
    return readFromEnv(null, EnvironmentReader.system());
  }

  /**
   * Reads the environment value of the running process and applies {@code transform}.
   *
   * @param transform transform applied to the raw string; may be {@code null}
   * @return the transformed value, or empty when unset
   */
  public Optional<Object> readFromEnv(Function<Object, ?> transform) {
    return readFromEnv(transform, EnvironmentReader.system());
  }

  /**
   * Reads the value from {@code environment} and applies {@code transform}.
   *
   * @param transform transform applied to the raw string; may be {@code null}
   * @param environment variable source
   * @return the transformed value, or empty when unset
   */
  public Optional<Object> readFromEnv(Function<Object, ?> transform, EnvironmentReader environment) {
    Objects.requireNonNull(environment, "environment");
    return environment.get(envVariableName())
        .flatMap(value -> Transformers.apply(value, transform));
  }

  /**
   * Reads the value from a legacy config file.
   *
   * @param configFile loaded config file; {@code null} yields empty
   * @return the typed value, or empty when the file does not define it
   */
  public Optional<Object> readFromFile(ConfigFile configFile) {
    return readFromFile(configFile, null);
  }

  /**
   * Reads the value from a legacy config file and applies {@code transform}.
   *
   * @param configFile loaded config file; {@code null} yields empty
   * @param transform transform applied to the typed value; may be {@code null}
   * @return the transformed value, or empty when the file does not define it
   */
  public Optional<Object> readFromFile(ConfigFile configFile, Function<Object, ?> transform) {
    if (configFile == null) {
      return Optional.empty();
    }
    try {
      return configFile.get(this).flatMap(value -> Transformers.apply(value, transform));
    } catch (IniException ex) {
      log.debug("[{}] {} not read from {}: {}", section, option, configFile.location(), ex.getMessage());
      return Optional.empty();
    }
  }
}
