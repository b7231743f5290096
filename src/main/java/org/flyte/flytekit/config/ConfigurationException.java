package org.flyte.flytekit.config;

/**
 * Raised when a user supplied config file is structurally unacceptable, for example when it declares a
 * section reserved for internal settings.
 */
public class ConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with the given message.
   *
   * @param message description shown to the user
   */
  public ConfigurationException(String message) {
    super(message);
  }
}
