package org.flyte.flytekit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class YamlConfigEntryTest {

  @TempDir Path tempDir;

  @Test
  void keysSplitSwitchOnDots() {
    assertEquals(List.of("storage", "connection", "endpoint"),
        new YamlConfigEntry("storage.connection.endpoint").keys());
  }

  @Test
  void walksNestedMappings() throws IOException {
    ConfigFile file = yamlFile("""
        a:
          b:
            c: 42
        """);

    assertEquals(Optional.of(42), new YamlConfigEntry("a.b.c", ValueType.INTEGER).readFromFile(file));
  }

  @Test
  void missingKeyIsEmptyAndLogged() throws IOException {
    ConfigFile file = yamlFile("""
        a:
          b: {}
        """);

    Logger logger = (Logger) LoggerFactory.getLogger(YamlDocumentReader.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    Optional<Object> value;
    try {
      value = new YamlConfigEntry("a.b.c").readFromFile(file);
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertTrue(value.isEmpty());
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("Switch a.b.c could not be found")));
  }

  @Test
  void nonMappingIntermediateNodeIsEmpty() throws IOException {
    ConfigFile file = yamlFile("""
        a:
          b: plain
        """);

    assertTrue(new YamlConfigEntry("a.b.c").readFromFile(file).isEmpty());
  }

  @Test
  void nullLeafIsEmpty() throws IOException {
    ConfigFile file = yamlFile("a:\n  b:\n");

    assertTrue(new YamlConfigEntry("a.b").readFromFile(file).isEmpty());
  }

  @Test
  void falsyLeavesAreEmpty() throws IOException {
    ConfigFile file = yamlFile("""
        admin:
          insecure: false
          retries: 0
          timeout: 0.0
          name: ''
          scopes: []
          headers: {}
        """);

    for (String key : List.of("insecure", "retries", "timeout", "name", "scopes", "headers")) {
      assertTrue(new YamlConfigEntry("admin." + key).readFromFile(file).isEmpty(), key);
    }
    assertEquals(Optional.of(false), file.get(new YamlConfigEntry("admin.insecure")));
  }

  @Test
  void truthyLeavesAreReturned() throws IOException {
    ConfigFile file = yamlFile("""
        admin:
          insecure: true
          retries: 3
          scopes: [all]
        """);

    assertEquals(Optional.of(true), new YamlConfigEntry("admin.insecure").readFromFile(file));
    assertEquals(Optional.of(3), new YamlConfigEntry("admin.retries").readFromFile(file));
    assertEquals(Optional.of(List.of("all")), new YamlConfigEntry("admin.scopes").readFromFile(file));
  }

  @Test
  void nonMappingIntermediateNodeIsLoggedLikeMissingKey() throws IOException {
    ConfigFile file = yamlFile("a:\n  b: plain\n");

    Logger logger = (Logger) LoggerFactory.getLogger(YamlConfigEntry.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      new YamlConfigEntry("a.b.c").readFromFile(file);
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("Switch a.b.c could not be read")));
  }

  @Test
  void appliesTransform() throws IOException {
    ConfigFile file = yamlFile("admin:\n  endpoint: localhost\n");

    assertEquals(Optional.of("dns:///localhost"),
        new YamlConfigEntry("admin.endpoint").readFromFile(file, value -> "dns:///" + value));
  }

  @Test
  void legacyFileAndMissingFileAreEmpty() throws IOException {
    Path ini = tempDir.resolve("flytekit.config");
    Files.writeString(ini, "[admin]\nendpoint = localhost\n");

    assertTrue(new YamlConfigEntry("admin.endpoint").readFromFile(ConfigFile.load(ini)).isEmpty());
    assertTrue(new YamlConfigEntry("admin.endpoint").readFromFile(null).isEmpty());
  }

  @Test
  void rejectsEmptySegments() {
    assertThrows(IllegalArgumentException.class, () -> new YamlConfigEntry("admin..endpoint"));
    assertThrows(IllegalArgumentException.class, () -> new YamlConfigEntry(".admin"));
  }

  private ConfigFile yamlFile(String content) throws IOException {
    Path file = tempDir.resolve("config.yaml");
    Files.writeString(file, content);
    return ConfigFile.load(file);
  }
}
