package org.flyte.flytekit.config.ini;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable view over a parsed legacy INI config file.
 * <p><strong>Semantics:</strong>
 * <ul>
 *   <li>Section names are case-sensitive; option names are case-insensitive.</li>
 *   <li>Options of the {@value #DEFAULT_SECTION} section are visible from every section.</li>
 *   <li>{@code %(name)s} references are expanded against the same section (and defaults) at read
 *       time; {@code %%} yields a literal percent sign.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share.</p>
 *
 * @since 0.1.0
 * @see IniParser
 */
public final class IniDocument {
  /** Name of the section whose options act as fallbacks for every other section. */
  public static final String DEFAULT_SECTION = "DEFAULT";

  static final int MAX_INTERPOLATION_DEPTH = 10;

  private static final Map<String, Boolean> BOOLEAN_STATES = Map.of(
      "1", true, "yes", true, "true", true, "on", true,
      "0", false, "no", false, "false", false, "off", false);

  private static final IniDocument EMPTY = new IniDocument(Map.of(), Map.of());

  private final Map<String, String> defaults;
  private final Map<String, Map<String, String>> sections;

  IniDocument(Map<String, String> defaults, Map<String, Map<String, String>> sections) {
    this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    Map<String, Map<String, String>> copy = new LinkedHashMap<>();
    sections.forEach((name, options) ->
        copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(options))));
    this.sections = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns a document with no sections and no defaults.
   *
   * @return shared empty document
   */
  public static IniDocument empty() {
    return EMPTY;
  }

  /**
   * Reports whether the named section is present. The {@value #DEFAULT_SECTION} section is never reported.
   *
   * @param section section name, case-sensitive
   * @return {@code true} when the section was declared in the file
   */
  public boolean hasSection(String section) {
    return sections.containsKey(section);
  }

  /**
   * Lists declared sections in file order, excluding {@value #DEFAULT_SECTION}.
   *
   * @return immutable ordered set of section names
   */
  public Set<String> sections() {
    return sections.keySet();
  }

  /**
   * Lists options visible from a section, including inherited defaults.
   *
   * @param section section name
   * @return immutable list of lower-cased option names
   * @throws IniException when the section does not exist
   */
  public List<String> options(String section) {
    Map<String, String> visible = visibleOptions(section);
    return List.copyOf(visible.keySet());
  }

  /**
   * Reads the interpolated string value of an option.
   *
   * @param section section name
   * @param option option name, case-insensitive
   * @return trimmed, interpolated value
   * @throws IniException when the section or option is missing or interpolation fails
   */
  public String get(String section, String option) {
    Objects.requireNonNull(section, "section");
    Objects.requireNonNull(option, "option");
    Map<String, String> visible = visibleOptions(section);
    String key = normalizeOption(option);
    String raw = visible.get(key);
    if (raw == null) {
      throw IniException.noOption(section, option);
    }
    return interpolate(section, option, raw, visible, 1);
  }

  /**
   * Reads an option as a boolean using the {@code 1/yes/true/on} and {@code 0/no/false/off} vocabulary.
   *
   * @param section section name
   * @param option option name
   * @return parsed flag
   * @throws IniException when the option is missing or not a recognized boolean word
   */
  public boolean getBoolean(String section, String option) {
    String value = get(section, option);
    Boolean state = BOOLEAN_STATES.get(value.toLowerCase(Locale.ROOT));
    if (state == null) {
      throw IniException.invalidValue(section, option, "boolean", value);
    }
    return state;
  }

  /**
   * Reads an option as a decimal integer.
   *
   * @param section section name
   * @param option option name
   * @return parsed integer
   * @throws IniException when the option is missing or not an integer
   */
  public int getInt(String section, String option) {
    String value = get(section, option);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IniException(
          IniException.invalidValue(section, option, "integer", value).getMessage(), ex);
    }
  }

  @Override
  public String toString() {
    Map<String, Object> view = new LinkedHashMap<>();
    if (!defaults.isEmpty()) {
      view.put(DEFAULT_SECTION, defaults);
    }
    view.putAll(sections);
    return view.toString();
  }

  static String normalizeOption(String option) {
    return option.trim().toLowerCase(Locale.ROOT);
  }

  private Map<String, String> visibleOptions(String section) {
    if (DEFAULT_SECTION.equals(section)) {
      return defaults;
    }
    Map<String, String> options = sections.get(section);
    if (options == null) {
      throw IniException.noSection(section);
    }
    Map<String, String> visible = new LinkedHashMap<>(defaults);
    visible.putAll(options);
    return visible;
  }

  private static String interpolate(
      String section, String option, String value, Map<String, String> vars, int depth) {
    if (depth > MAX_INTERPOLATION_DEPTH) {
      throw IniException.interpolation(section, option,
          "recursion limit of " + MAX_INTERPOLATION_DEPTH + " exceeded");
    }
    StringBuilder out = new StringBuilder(value.length());
    int index = 0;
    while (index < value.length()) {
      int percent = value.indexOf('%', index);
      if (percent < 0) {
        out.append(value, index, value.length());
        break;
      }
      out.append(value, index, percent);
      if (percent + 1 >= value.length()) {
        throw IniException.interpolation(section, option, "'%' must be followed by '%' or '('");
      }
      char next = value.charAt(percent + 1);
      if (next == '%') {
        out.append('%');
        index = percent + 2;
      } else if (next == '(') {
        int close = value.indexOf(")s", percent + 2);
        if (close < 0) {
          throw IniException.interpolation(section, option,
              "bad variable reference in '" + value + "'");
        }
        String name = normalizeOption(value.substring(percent + 2, close));
        String referenced = vars.get(name);
        if (referenced == null) {
          throw IniException.interpolation(section, option, "unknown reference '" + name + "'");
        }
        out.append(interpolate(section, option, referenced, vars, depth + 1));
        index = close + 2;
      } else {
        throw IniException.interpolation(section, option, "'%' must be followed by '%' or '('");
      }
    }
    return out.toString();
  }
}
