package org.flyte.flytekit.config;

/**
 * Identifies where a setting lives inside a config file: either a legacy INI {@code section/option}
 * pair or a dot-delimited YAML switch.
 *
 * @see ConfigFile#get(ConfigDescriptor)
 */
public sealed interface ConfigDescriptor permits LegacyConfigEntry, YamlConfigEntry {

  /**
   * Expected type of the value at this location.
   *
   * @return value type
   */
  ValueType type();
}
