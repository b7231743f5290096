package org.flyte.flytekit.config;

import java.util.Arrays;
import java.util.List;
import org.flyte.flytekit.config.ini.IniDocument;

/**
 * Expected type of a legacy setting. Each constant owns the rule that extracts its value from an INI
 * document, so the parsing rules for every supported type live in one place.
 */
public enum ValueType {
  /** Raw option text. */
  STRING {
    @Override
    Object extract(IniDocument document, String section, String option) {
      return document.get(section, option);
    }
  },
  /** {@code 1/yes/true/on} or {@code 0/no/false/off}, any case. */
  BOOLEAN {
    @Override
    Object extract(IniDocument document, String section, String option) {
      return document.getBoolean(section, option);
    }
  },
  /** Decimal {@code int}. */
  INTEGER {
    @Override
    Object extract(IniDocument document, String section, String option) {
      return document.getInt(section, option);
    }
  },
  /** Comma separated items, order preserved, items kept verbatim. */
  LIST {
    @Override
    Object extract(IniDocument document, String section, String option) {
      return splitList(document.get(section, option));
    }
  };

  /**
   * Reads {@code section.option} from {@code document} converted to this type.
   *
   * @param document parsed legacy config
   * @param section section name
   * @param option option name
   * @return converted value, never {@code null}
   * @throws org.flyte.flytekit.config.ini.IniException when the option is missing or not convertible
   */
  abstract Object extract(IniDocument document, String section, String option);

  static List<String> splitList(String raw) {
    return List.copyOf(Arrays.asList(raw.split(",", -1)));
  }
}
