package org.flyte.flytekit.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Finds the config file to resolve settings against.
 * <p><strong>Search order</strong> when no file is named, first existing wins:</p>
 * <ol>
 *   <li>{@value #WORKING_DIR_CONFIG_NAME} in the working directory;</li>
 *   <li>{@code ~/.flyte/config} (legacy INI);</li>
 *   <li>the file named by {@value #FLYTECTL_CONFIG_ENV_VAR}, INI or YAML by its name;</li>
 *   <li>{@code ~/.flyte/config.yaml}.</li>
 * </ol>
 * <p>When nothing matches the result is empty and settings can only come from the environment.
 * The {@code locate(...)} overloads taking a path or a loaded file skip the search.</p>
 * <p><strong>Observability:</strong> logs the chosen file and its source at INFO.</p>
 *
 * @since 0.1.0
 */
public final class ConfigFileLocator {
  /** Environment variable that the flytectl sandbox instructions tell users to set. */
  public static final String FLYTECTL_CONFIG_ENV_VAR = "FLYTECTL_CONFIG";
  /** File name looked up in the working directory. */
  public static final String WORKING_DIR_CONFIG_NAME = "flytekit.config";

  private static final Logger log = LoggerFactory.getLogger(ConfigFileLocator.class);
  private static final String HOME_CONFIG_DIR = ".flyte";
  private static final String HOME_CONFIG_NAME = "config";
  private static final String HOME_YAML_CONFIG_NAME = "config.yaml";

  private final Path workingDirectory;
  private final Path homeDirectory;
  private final EnvironmentReader environment;

  /**
   * Creates a locator over explicit search roots.
   *
   * @param workingDirectory directory searched first; also resolves a relative
   *     {@value #FLYTECTL_CONFIG_ENV_VAR} path
   * @param homeDirectory user home holding {@code .flyte/}
   * @param environment environment variable source
   */
  public ConfigFileLocator(Path workingDirectory, Path homeDirectory, EnvironmentReader environment) {
    this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
    this.homeDirectory = Objects.requireNonNull(homeDirectory, "homeDirectory");
    this.environment = Objects.requireNonNull(environment, "environment");
  }

  /**
   * Creates a locator for the running process: {@code user.dir}, {@code user.home} and the real environment.
   *
   * @return process locator
   */
  public static ConfigFileLocator system() {
    return new ConfigFileLocator(
        Path.of(System.getProperty("user.dir")),
        Path.of(System.getProperty("user.home")),
        EnvironmentReader.system());
  }

  /**
   * Searches the candidate locations.
   *
   * @return the first existing config file, loaded; empty when none exists
   * @throws IOException when a matched file cannot be read
   */
  public Optional<ConfigFile> locate() throws IOException {
    Path local = workingDirectory.resolve(WORKING_DIR_CONFIG_NAME);
    if (Files.exists(local)) {
      log.info("Using configuration from working directory {}", local.toAbsolutePath());
      return Optional.of(ConfigFile.load(local.toAbsolutePath()));
    }

    Path homeConfig = homeDirectory.resolve(HOME_CONFIG_DIR).resolve(HOME_CONFIG_NAME);
    if (Files.exists(homeConfig)) {
      log.info("Using configuration from home directory {}", homeConfig.toAbsolutePath());
      return Optional.of(ConfigFile.load(homeConfig.toAbsolutePath()));
    }

    Optional<String> fromEnv = environment.get(FLYTECTL_CONFIG_ENV_VAR).filter(value -> !value.isBlank());
    if (fromEnv.isPresent()) {
      Path envConfig = workingDirectory.resolve(fromEnv.get().trim());
      if (Files.exists(envConfig)) {
        log.info("Using flytectl/YAML config from {} {}",
            FLYTECTL_CONFIG_ENV_VAR, envConfig.toAbsolutePath());
        return Optional.of(ConfigFile.load(envConfig.toAbsolutePath()));
      }
      log.debug("{} points at {} which does not exist", FLYTECTL_CONFIG_ENV_VAR, envConfig);
    }

    Path homeYaml = homeDirectory.resolve(HOME_CONFIG_DIR).resolve(HOME_YAML_CONFIG_NAME);
    if (Files.exists(homeYaml)) {
      log.info("Using flytectl/YAML config from home directory {}", homeYaml.toAbsolutePath());
      return Optional.of(ConfigFile.load(homeYaml.toAbsolutePath()));
    }

    log.debug("No config file found; settings resolve from the environment only");
    return Optional.empty();
  }

  /**
   * Loads the named file. Use {@link #locate()} to search instead.
   *
   * @param location config file path
   * @return the loaded file
   * @throws IOException when the file cannot be read
   */
  public Optional<ConfigFile> locate(String location) throws IOException {
    Objects.requireNonNull(location, "location");
    return Optional.of(ConfigFile.load(location));
  }

  /**
   * Loads the named file. Use {@link #locate()} to search instead.
   *
   * @param location config file path
   * @return the loaded file
   * @throws IOException when the file cannot be read
   */
  public Optional<ConfigFile> locate(Path location) throws IOException {
    Objects.requireNonNull(location, "location");
    return Optional.of(ConfigFile.load(location));
  }

  /**
   * Returns an already loaded file unchanged. Use {@link #locate()} to search instead.
   *
   * @param configFile loaded config file
   * @return {@code configFile}
   */
  public Optional<ConfigFile> locate(ConfigFile configFile) {
    return Optional.of(Objects.requireNonNull(configFile, "configFile"));
  }
}
