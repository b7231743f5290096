package org.flyte.flytekit.config.ini;

/**
 * Lookup failure raised by {@link IniDocument} when a section or option is missing, a value cannot be
 * converted to the requested type, or interpolation cannot be resolved.
 *
 * <p>Callers reading optional settings catch this type and treat the setting as absent.
 */
public class IniException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with the given message.
   *
   * @param message human readable description
   */
  public IniException(String message) {
    super(message);
  }

  /**
   * Creates an exception with the given message and cause.
   *
   * @param message human readable description
   * @param cause underlying failure
   */
  public IniException(String message, Throwable cause) {
    super(message, cause);
  }

  static IniException noSection(String section) {
    return new IniException("No section: '" + section + "'");
  }

  static IniException noOption(String section, String option) {
    return new IniException("No option '" + option + "' in section: '" + section + "'");
  }

  static IniException invalidValue(String section, String option, String expected, String value) {
    return new IniException("Option '" + option + "' in section '" + section + "' is not a valid "
        + expected + ": '" + value + "'");
  }

  static IniException interpolation(String section, String option, String detail) {
    return new IniException("Cannot interpolate option '" + option + "' in section '" + section
        + "': " + detail);
  }
}
