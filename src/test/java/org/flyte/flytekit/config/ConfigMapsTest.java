package org.flyte.flytekit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigMapsTest {

  @Test
  void addsPresentValueWithoutMutatingSource() {
    Map<String, Object> source = new HashMap<>(Map.of("project", "flytesnacks"));

    Map<String, Object> result = ConfigMaps.setIfExists(source, "domain", "development");

    assertEquals(Map.of("project", "flytesnacks", "domain", "development"), result);
    assertEquals(Map.of("project", "flytesnacks"), source);
  }

  @Test
  void skipsUnsetValues() {
    Map<String, Object> source = Map.of("project", "flytesnacks");

    assertEquals(source, ConfigMaps.setIfExists(source, "domain", null));
    assertEquals(source, ConfigMaps.setIfExists(source, "domain", ""));
    assertEquals(source, ConfigMaps.setIfExists(source, "domain", List.of()));
  }

  @Test
  void keepsFalseAndZero() {
    assertEquals(Map.of("insecure", false), ConfigMaps.setIfExists(Map.of(), "insecure", false));
    assertEquals(Map.of("retries", 0), ConfigMaps.setIfExists(null, "retries", 0));
  }

  @Test
  void resultIsUnmodifiable() {
    Map<String, String> result = ConfigMaps.setIfExists(Map.of(), "project", "flytesnacks");

    assertThrows(UnsupportedOperationException.class, () -> result.put("domain", "development"));
  }
}
