package org.flyte.flytekit.config;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * <strong>What:</strong> A setting with every representation it can be found under: its legacy
 * {@code section/option} (which also names its environment variable) and, optionally, its YAML switch.
 * <p><strong>Resolution order:</strong> the first source that yields a value wins.
 * <ol>
 *   <li>the {@code FLYTE_{SECTION}_{OPTION}} environment variable;</li>
 *   <li>the legacy INI document, when the supplied file is an INI file;</li>
 *   <li>the YAML document, when the supplied file is a YAML file and a switch is declared.</li>
 * </ol>
 * <p>Steps 2 and 3 are exclusive: an entry without a switch cannot resolve against a YAML file.</p>
 * <p><strong>Transform:</strong> applied to whatever source matched. Boolean entries without an explicit
 * transform adopt {@link Transformers#bool(Object)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; typically held in a {@code static final} field and
 * resolved against many files.</p>
 *
 * @since 0.1.0
 */
public final class ConfigEntry {
  private final LegacyConfigEntry legacy;
  private final YamlConfigEntry yamlEntry;
  private final Function<Object, ?> transform;

  /**
   * Creates an entry resolvable from the environment and legacy files only.
   *
   * @param legacy legacy descriptor
   */
  public ConfigEntry(LegacyConfigEntry legacy) {
    this(legacy, null, null);
  }

  /**
   * Creates an entry with an optional YAML switch.
   *
   * @param legacy legacy descriptor
   * @param yamlEntry YAML descriptor; may be {@code null}
   */
  public ConfigEntry(LegacyConfigEntry legacy, YamlConfigEntry yamlEntry) {
    this(legacy, yamlEntry, null);
  }

  /**
   * Creates an entry with an optional YAML switch and transform.
   *
   * @param legacy legacy descriptor
   * @param yamlEntry YAML descriptor; may be {@code null}
   * @param transform transform applied to resolved values; {@code null} adopts the default for the
   *     legacy type, see {@link Transformers#defaultFor(ValueType)}
   */
  public ConfigEntry(
      LegacyConfigEntry legacy, YamlConfigEntry yamlEntry, Function<Object, ?> transform) {
    this.legacy = Objects.requireNonNull(legacy, "legacy");
    this.yamlEntry = yamlEntry;
    this.transform = transform != null
        ? transform
        : Transformers.defaultFor(legacy.type()).orElse(null);
  }

  /**
   * Resolves from the process environment only.
   *
   * @return the value, or empty
   */
  public Optional<Object> read() {
    return read(null, EnvironmentReader.system());
  }

  /**
   * Resolves from the process environment, then {@code configFile}.
   *
   * @param configFile loaded config file; may be {@code null}
   * @return the value, or empty
   */
  public Optional<Object> read(ConfigFile configFile) {
    return read(configFile, EnvironmentReader.system());
  }

  /**
   * Resolves from {@code environment}, then {@code configFile}.
   *
   * @param configFile loaded config file; may be {@code null}
   * @param environment environment variable source
   * @return the value, or empty
   */
  public Optional<Object> read(ConfigFile configFile, EnvironmentReader environment) {
    Optional<Object> fromEnv = legacy.readFromEnv(transform, environment);
    if (fromEnv.isPresent()) {
      return fromEnv;
    }
    if (configFile == null) {
      return Optional.empty();
    }
    if (configFile.legacyConfig().isPresent()) {
      return legacy.readFromFile(configFile, transform);
    }
    if (configFile.yamlConfig().isPresent() && yamlEntry != null) {
      return yamlEntry.readFromFile(configFile, transform);
    }
    return Optional.empty();
  }

  /**
   * Resolves like {@link #read(ConfigFile)} and casts the result.
   *
   * @param configFile loaded config file; may be {@code null}
   * @param type expected Java type of the resolved value
   * @param <T> value type
   * @return the value, or empty
   * @throws ClassCastException when the resolved value is not a {@code T}
   */
  public <T> Optional<T> readAs(ConfigFile configFile, Class<T> type) {
    return readAs(configFile, EnvironmentReader.system(), type);
  }

  /**
   * Resolves like {@link #read(ConfigFile, EnvironmentReader)} and casts the result.
   *
   * @param configFile loaded config file; may be {@code null}
   * @param environment environment variable source
   * @param type expected Java type of the resolved value
   * @param <T> value type
   * @return the value, or empty
   * @throws ClassCastException when the resolved value is not a {@code T}
   */
  public <T> Optional<T> readAs(ConfigFile configFile, EnvironmentReader environment, Class<T> type) {
    Objects.requireNonNull(type, "type");
    return read(configFile, environment).map(type::cast);
  }

  public LegacyConfigEntry legacy() {
    return legacy;
  }

  public Optional<YamlConfigEntry> yamlEntry() {
    return Optional.ofNullable(yamlEntry);
  }

  public Optional<Function<Object, ?>> transform() {
    return Optional.ofNullable(transform);
  }

  @Override
  public String toString() {
    return "ConfigEntry[legacy=" + legacy + ", yamlEntry=" + yamlEntry + "]";
  }
}
