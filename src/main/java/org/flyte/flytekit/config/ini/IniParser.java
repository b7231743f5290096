package org.flyte.flytekit.config.ini;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses legacy INI config files into {@link IniDocument} instances.
 *
 * <p>Parsing is lenient: malformed lines are logged and skipped so the remaining settings still load.
 * Lookup problems surface later, at read time, as {@link IniException}.
 */
public final class IniParser {
  private static final Logger log = LoggerFactory.getLogger(IniParser.class);

  private IniParser() {}

  /**
   * Parses the file at {@code path}. A missing file yields an empty document.
   *
   * @param path location of the INI file
   * @return parsed document
   * @throws IOException when the file exists but cannot be read
   */
  public static IniDocument parse(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      log.debug("Legacy config file {} does not exist, using empty configuration", path);
      return IniDocument.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  /**
   * Parses INI content from a reader. The reader is not closed.
   *
   * @param reader source of INI text
   * @param source name used in log messages
   * @return parsed document
   * @throws IOException when reading fails
   */
  public static IniDocument parse(Reader reader, String source) throws IOException {
    Objects.requireNonNull(reader, "reader");
    BufferedReader lines = reader instanceof BufferedReader buffered
        ? buffered
        : new BufferedReader(reader);

    Map<String, String> defaults = new LinkedHashMap<>();
    Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    Map<String, String> current = null;
    String currentSection = null;
    String currentOption = null;

    String line;
    int lineNumber = 0;
    while ((line = lines.readLine()) != null) {
      lineNumber++;
      String stripped = line.strip();
      if (stripped.isEmpty()) {
        currentOption = null;
        continue;
      }
      if (stripped.startsWith("#") || stripped.startsWith(";")) {
        continue;
      }

      boolean indented = Character.isWhitespace(line.charAt(0));
      if (indented && current != null && currentOption != null) {
        current.merge(currentOption, stripped, (previous, more) -> previous + "\n" + more);
        continue;
      }

      if (stripped.startsWith("[")) {
        if (!stripped.endsWith("]") || stripped.length() < 3) {
          malformed(source, lineNumber, "invalid section header", stripped);
          current = null;
          currentSection = null;
          currentOption = null;
          continue;
        }
        String name = stripped.substring(1, stripped.length() - 1).trim();
        if (name.isEmpty()) {
          malformed(source, lineNumber, "empty section name", stripped);
          current = null;
          currentSection = null;
          currentOption = null;
          continue;
        }
        if (IniDocument.DEFAULT_SECTION.equals(name)) {
          current = defaults;
        } else {
          if (sections.containsKey(name)) {
            log.warn("{}:{} section [{}] declared more than once; merging", source, lineNumber, name);
          }
          current = sections.computeIfAbsent(name, key -> new LinkedHashMap<>());
        }
        currentSection = name;
        currentOption = null;
        continue;
      }

      if (current == null) {
        malformed(source, lineNumber, "option outside of any section", stripped);
        continue;
      }
      int separator = separatorIndex(stripped);
      if (separator <= 0) {
        malformed(source, lineNumber, "expected 'option = value'", stripped);
        currentOption = null;
        continue;
      }
      String option = IniDocument.normalizeOption(stripped.substring(0, separator));
      if (option.isEmpty()) {
        malformed(source, lineNumber, "empty option name", stripped);
        currentOption = null;
        continue;
      }
      String value = stripped.substring(separator + 1).strip();
      if (current.put(option, value) != null) {
        log.warn("{}:{} option '{}' repeated in section [{}]; last value wins",
            source, lineNumber, option, currentSection);
      }
      currentOption = option;
    }
    return new IniDocument(defaults, sections);
  }

  private static int separatorIndex(String line) {
    int equals = line.indexOf('=');
    int colon = line.indexOf(':');
    if (equals < 0) {
      return colon;
    }
    if (colon < 0) {
      return equals;
    }
    return Math.min(equals, colon);
  }

  private static void malformed(String source, int lineNumber, String reason, String line) {
    log.warn("{}:{} {}, skipping line: {}", source, lineNumber, reason, line);
  }
}
