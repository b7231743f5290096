package org.flyte.flytekit.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Source of environment variables. Lets callers resolve settings against a substitute environment.
 */
@FunctionalInterface
public interface EnvironmentReader {

  /**
   * Looks up a variable.
   *
   * @param name variable name
   * @return the value, or empty when the variable is not set
   */
  Optional<String> get(String name);

  /**
   * Reads the environment of the running process.
   *
   * @return reader backed by {@link System#getenv(String)}
   */
  static EnvironmentReader system() {
    return name -> Optional.ofNullable(System.getenv(name));
  }

  /**
   * Reads variables from a fixed map.
   *
   * @param variables name to value mapping; copied
   * @return reader backed by the copy
   */
  static EnvironmentReader of(Map<String, String> variables) {
    Map<String, String> copy = Map.copyOf(Objects.requireNonNull(variables, "variables"));
    return name -> Optional.ofNullable(copy.get(name));
  }
}
