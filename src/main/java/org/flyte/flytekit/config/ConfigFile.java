package org.flyte.flytekit.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.flyte.flytekit.config.ini.IniDocument;
import org.flyte.flytekit.config.ini.IniException;
import org.flyte.flytekit.config.ini.IniParser;

/**
 * <strong>What:</strong> A config file loaded once from disk, either legacy INI or YAML.
 * <p><strong>Invariant:</strong> exactly one of {@link #legacyConfig()} / {@link #yamlConfig()} can be
 * present, chosen by {@link ConfigFileFormat#fromLocation(Path)}. A malformed YAML file leaves both empty.</p>
 * <p><strong>Errors:</strong> an INI file declaring the reserved {@value #RESERVED_SECTION} section is
 * rejected with {@link ConfigurationException}.</p>
 * <p><strong>Thread-safety:</strong> Read-only after construction; safe to share across threads.</p>
 *
 * @since 0.1.0
 */
public final class ConfigFile {
  /** Section name reserved for internal-only settings; never allowed in a user file. */
  public static final String RESERVED_SECTION = "internal";

  private final Path location;
  private final ConfigFileFormat format;
  private final IniDocument legacyConfig;
  private final Map<?, ?> yamlConfig;

  private ConfigFile(
      Path location, ConfigFileFormat format, IniDocument legacyConfig, Map<?, ?> yamlConfig) {
    this.location = location;
    this.format = format;
    this.legacyConfig = legacyConfig;
    this.yamlConfig = yamlConfig;
  }

  /**
   * Loads the config file at {@code location}.
   *
   * @param location file path
   * @return loaded config file
   * @throws IOException when the file cannot be read
   * @throws ConfigurationException when an INI file declares the reserved section
   */
  public static ConfigFile load(String location) throws IOException {
    Objects.requireNonNull(location, "location");
    return load(Path.of(location));
  }

  /**
   * Loads the config file at {@code location}. A missing legacy file loads as an empty document; a
   * missing YAML file fails with {@link java.nio.file.NoSuchFileException}.
   *
   * @param location file path
   * @return loaded config file
   * @throws IOException when the file cannot be read
   * @throws ConfigurationException when an INI file declares the reserved section
   */
  public static ConfigFile load(Path location) throws IOException {
    Objects.requireNonNull(location, "location");
    ConfigFileFormat format = ConfigFileFormat.fromLocation(location);
    if (format == ConfigFileFormat.YAML) {
      return new ConfigFile(location, format, null, YamlDocumentReader.read(location).orElse(null));
    }
    IniDocument document = IniParser.parse(location);
    if (document.hasSection(RESERVED_SECTION)) {
      throw new ConfigurationException("The config file '" + location
          + "' cannot contain a section for " + RESERVED_SECTION + " only configurations.");
    }
    return new ConfigFile(location, format, document, null);
  }

  /**
   * Looks up a descriptor in this file.
   *
   * <p>Legacy descriptors are converted according to their {@link ValueType} and never yield empty:
   * a missing section or option raises {@link IniException}. YAML descriptors yield empty when a key
   * is missing.
   *
   * @param descriptor where the value lives
   * @return the value
   * @throws IniException when a legacy lookup fails or this file holds no INI document
   * @throws IllegalStateException when a YAML lookup is made against a file without a YAML document,
   *     or the switch runs into a non-mapping node
   */
  public Optional<Object> get(ConfigDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    if (descriptor instanceof LegacyConfigEntry legacy) {
      return Optional.of(getFromLegacy(legacy));
    }
    if (descriptor instanceof YamlConfigEntry yaml) {
      return getFromYaml(yaml);
    }
    throw new UnsupportedOperationException(
        "Config descriptor " + descriptor.getClass().getName() + " is not supported");
  }

  private Object getFromLegacy(LegacyConfigEntry entry) {
    if (legacyConfig == null) {
      throw new IniException("Config file '" + location + "' is not a legacy INI file");
    }
    return entry.type().extract(legacyConfig, entry.section(), entry.option());
  }

  private Optional<Object> getFromYaml(YamlConfigEntry entry) {
    if (yamlConfig == null) {
      throw new IllegalStateException("Config file '" + location + "' holds no YAML document");
    }
    return YamlDocumentReader.walk(yamlConfig, entry.switchPath(), entry.keys());
  }

  /**
   * Location the file was loaded from.
   *
   * @return file path
   */
  public Path location() {
    return location;
  }

  /**
   * Format chosen from the location.
   *
   * @return file format
   */
  public ConfigFileFormat format() {
    return format;
  }

  /**
   * Parsed INI document.
   *
   * @return document, present only for legacy files
   */
  public Optional<IniDocument> legacyConfig() {
    return Optional.ofNullable(legacyConfig);
  }

  /**
   * Root mapping of the parsed YAML document.
   *
   * @return unmodifiable root mapping, present only for well-formed YAML files
   */
  public Optional<Map<?, ?>> yamlConfig() {
    return Optional.ofNullable(yamlConfig);
  }

  @Override
  public String toString() {
    return "ConfigFile[" + format + " " + location + "]";
  }
}
