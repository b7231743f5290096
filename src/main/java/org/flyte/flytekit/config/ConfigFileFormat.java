package org.flyte.flytekit.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * On-disk format of a config file.
 */
public enum ConfigFileFormat {
  /** INI sections and options; historically the only supported format. */
  LEGACY,
  /** Nested YAML mappings addressed by dot-delimited switches. */
  YAML;

  /**
   * Chooses the format from a file location: names ending in {@code yaml} are YAML, everything else is
   * legacy INI.
   *
   * @param location config file location
   * @return detected format
   */
  public static ConfigFileFormat fromLocation(Path location) {
    Objects.requireNonNull(location, "location");
    return location.toString().endsWith("yaml") ? YAML : LEGACY;
  }
}
