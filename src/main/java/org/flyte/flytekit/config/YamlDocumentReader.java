package org.flyte.flytekit.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.flyte.flytekit.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads YAML config documents and walks switches through them.
 */
final class YamlDocumentReader {
  private static final Logger log = LoggerFactory.getLogger(YamlDocumentReader.class);

  private YamlDocumentReader() {}

  /**
   * Loads the mapping at the root of the YAML file at {@code path}.
   *
   * @param path location of the YAML file
   * @return the root mapping, or empty when the file is malformed, empty, or not a mapping
   * @throws IOException when the file cannot be read
   */
  static Optional<Map<?, ?>> read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        log.warn("YAML config file at {} is empty, ignoring...", path);
        return Optional.empty();
      }
      if (!(document instanceof Map<?, ?> root)) {
        log.warn("YAML config file at {} must contain a mapping at its root, found {}, ignoring...",
            path, document.getClass().getSimpleName());
        return Optional.empty();
      }
      Map<?, ?> frozen = (Map<?, ?>) freeze(root);
      return Optional.of(frozen);
    } catch (YAMLException ex) {
      log.warn("Error {} reading yaml config file at {}, ignoring...", ex.getMessage(), path);
      return Optional.empty();
    }
  }

  /**
   * Copies a parsed node into unmodifiable maps and lists, all the way down. {@code null} values
   * are kept.
   *
   * @throws YAMLException when the document refers back to itself through an alias
   */
  static Object freeze(Object node) {
    return freeze(node, Collections.newSetFromMap(new IdentityHashMap<>()));
  }

  private static Object freeze(Object node, Set<Object> enclosing) {
    if (!(node instanceof Map<?, ?>) && !(node instanceof Collection<?>)) {
      return node;
    }
    if (!enclosing.add(node)) {
      throw new YAMLException("recursive structure is not supported in config documents");
    }
    Object copy;
    if (node instanceof Map<?, ?> mapping) {
      Map<Object, Object> entries = new LinkedHashMap<>();
      mapping.forEach((key, value) -> entries.put(key, freeze(value, enclosing)));
      copy = Collections.unmodifiableMap(entries);
    } else if (node instanceof Set<?> members) {
      Set<Object> items = new LinkedHashSet<>();
      members.forEach(member -> items.add(freeze(member, enclosing)));
      copy = Collections.unmodifiableSet(items);
    } else {
      List<Object> items = new ArrayList<>();
      ((Collection<?>) node).forEach(item -> items.add(freeze(item, enclosing)));
      copy = Collections.unmodifiableList(items);
    }
    enclosing.remove(node);
    return copy;
  }

  /**
   * Walks {@code keys} from {@code root}. A key missing from a mapping is logged and yields empty.
   *
   * @param root document root
   * @param switchPath switch being resolved, for diagnostics
   * @param keys keys in walk order
   * @return the value at the end of the path; empty when a key is missing or the value is {@code null}
   * @throws IllegalStateException when an intermediate node is not a mapping
   */
  static Optional<Object> walk(Map<?, ?> root, String switchPath, List<String> keys) {
    Object node = root;
    StringBuilder walked = new StringBuilder();
    for (String key : keys) {
      if (!(node instanceof Map<?, ?> mapping)) {
        throw new IllegalStateException("Switch " + switchPath + ": value at '" + walked
            + "' is not a mapping");
      }
      if (!mapping.containsKey(key)) {
        log.error("Switch {} could not be found in yaml config", switchPath);
        if (log.isDebugEnabled()) {
          log.debug("{}", Logs.dump(root));
        }
        return Optional.empty();
      }
      node = mapping.get(key);
      if (walked.length() > 0) {
        walked.append('.');
      }
      walked.append(key);
    }
    return Optional.ofNullable(node);
  }
}
