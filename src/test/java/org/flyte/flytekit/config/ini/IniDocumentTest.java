package org.flyte.flytekit.config.ini;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import org.junit.jupiter.api.Test;

class IniDocumentTest {

  @Test
  void getBooleanAcceptsIniVocabulary() throws IOException {
    IniDocument document = parse("""
        [flags]
        a = yes
        b = On
        c = 1
        d = TRUE
        e = no
        f = off
        g = 0
        h = False
        """);

    assertTrue(document.getBoolean("flags", "a"));
    assertTrue(document.getBoolean("flags", "b"));
    assertTrue(document.getBoolean("flags", "c"));
    assertTrue(document.getBoolean("flags", "d"));
    assertFalse(document.getBoolean("flags", "e"));
    assertFalse(document.getBoolean("flags", "f"));
    assertFalse(document.getBoolean("flags", "g"));
    assertFalse(document.getBoolean("flags", "h"));
  }

  @Test
  void getBooleanRejectsOtherWords() throws IOException {
    IniDocument document = parse("[flags]\nenabled = maybe\n");

    IniException ex = assertThrows(IniException.class, () -> document.getBoolean("flags", "enabled"));
    assertTrue(ex.getMessage().contains("maybe"));
  }

  @Test
  void getIntParsesAndRejects() throws IOException {
    IniDocument document = parse("""
        [sdk]
        retries = 3
        level = twenty
        """);

    assertEquals(3, document.getInt("sdk", "retries"));
    assertThrows(IniException.class, () -> document.getInt("sdk", "level"));
  }

  @Test
  void missingSectionAndOptionRaiseLookupFailures() throws IOException {
    IniDocument document = parse("[sdk]\nretries = 3\n");

    IniException noSection = assertThrows(IniException.class, () -> document.get("platform", "url"));
    assertTrue(noSection.getMessage().contains("No section"));
    IniException noOption = assertThrows(IniException.class, () -> document.get("sdk", "url"));
    assertTrue(noOption.getMessage().contains("No option"));
  }

  @Test
  void interpolatesReferencesFromSectionAndDefaults() throws IOException {
    IniDocument document = parse("""
        [DEFAULT]
        project = flytesnacks

        [sdk]
        domain = development
        log_dir = /var/log/%(project)s/%(domain)s
        """);

    assertEquals("/var/log/flytesnacks/development", document.get("sdk", "log_dir"));
  }

  @Test
  void doublePercentIsLiteral() throws IOException {
    IniDocument document = parse("[sdk]\nratio = 50%%\n");

    assertEquals("50%", document.get("sdk", "ratio"));
  }

  @Test
  void unknownReferenceAndStrayPercentFail() throws IOException {
    IniDocument document = parse("""
        [sdk]
        unknown = %(missing)s
        stray = 50%
        """);

    assertThrows(IniException.class, () -> document.get("sdk", "unknown"));
    assertThrows(IniException.class, () -> document.get("sdk", "stray"));
  }

  @Test
  void selfReferenceHitsRecursionLimit() throws IOException {
    IniDocument document = parse("[sdk]\nloop = x%(loop)s\n");

    IniException ex = assertThrows(IniException.class, () -> document.get("sdk", "loop"));
    assertTrue(ex.getMessage().contains("recursion limit"));
  }

  @Test
  void defaultSectionCanBeReadDirectly() throws IOException {
    IniDocument document = parse("[DEFAULT]\nproject = flytesnacks\n");

    assertEquals("flytesnacks", document.get(IniDocument.DEFAULT_SECTION, "project"));
  }

  private static IniDocument parse(String content) throws IOException {
    return IniParser.parse(new StringReader(content), "test.config");
  }
}
