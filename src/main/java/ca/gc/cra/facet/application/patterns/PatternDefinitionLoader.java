package ca.gc.cra.facet.application.patterns;

import ca.gc.cra.facet.domain.entity.EntityCategory;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads custom pattern sources from YAML files.
 *
 * <pre>
 * version: 1
 * patterns:
 *   - name: money.loss
 *     category: MONEY
 *     tier: 4            # rank or enum name such as NEGATIVE_SCALAR
 *     regex: "\\bshortfall\\s+of\\s+(?&lt;value&gt;\\$\\d+)"
 *     guard: "optional must-not-precede regex"
 * </pre>
 *
 * @since FACET 0.1.0
 */
final class PatternDefinitionLoader {

  List<PatternSource> load(List<Path> sources) throws IOException {
    Objects.requireNonNull(sources, "sources");
    List<PatternSource> patterns = new ArrayList<>();
    Set<String> names = new LinkedHashSet<>();
    for (Path path : sources) {
      for (PatternSource source : parseDocument(path)) {
        if (!names.add(source.name())) {
          throw new IllegalArgumentException("Duplicate pattern name detected: " + source.name());
        }
        patterns.add(source);
      }
    }
    return List.copyOf(patterns);
  }

  private List<PatternSource> parseDocument(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IOException("Pattern file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object rootObj = new Yaml().load(reader);
      if (rootObj == null) {
        return List.of();
      }
      Map<String, Object> root = asMap(rootObj, "root");

      int version = toInt(root.get("version"), "version");
      if (version != 1) {
        throw new IllegalArgumentException("Unsupported pattern file version " + version + " in " + path);
      }

      List<PatternSource> definitions = new ArrayList<>();
      Object patternsNode = root.get("patterns");
      if (patternsNode instanceof Iterable<?> iterable) {
        for (Object node : iterable) {
          definitions.add(parsePattern(asMap(node, "pattern")));
        }
      } else if (patternsNode != null) {
        throw new IllegalArgumentException("patterns must be a list in " + path);
      }
      return definitions;
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML patterns at " + path, ex);
    }
  }

  private PatternSource parsePattern(Map<String, Object> map) {
    String name = requireString(map, "name").strip();
    EntityCategory category = EntityCategory.parse(requireString(map, "category"));
    Tier tier = parseTier(map.get("tier"));
    String regex = requireString(map, "regex");
    String guard = toOptionalString(map.get("guard"));
    return new PatternSource(name, category, tier, regex, guard, CaptureRole.inferFrom(regex));
  }

  private Tier parseTier(Object node) {
    if (node == null) {
      throw new IllegalArgumentException("Missing required field: tier");
    }
    if (node instanceof String str && !str.isBlank() && !Character.isDigit(str.strip().charAt(0))) {
      try {
        return Tier.valueOf(str.strip().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("Unknown tier: '" + str + "'", ex);
      }
    }
    return Tier.fromRank(toInt(node, "tier"));
  }

  private Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private String requireString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null || value.toString().isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + key);
    }
    return value.toString();
  }

  private String toOptionalString(Object value) {
    if (value == null) {
      return null;
    }
    String str = value.toString();
    return str.isBlank() ? null : str;
  }

  private int toInt(Object value, String context) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Integer.parseInt(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid integer for " + context + ": '" + str + "'");
      }
    }
    throw new IllegalArgumentException("Invalid integer for " + context + ": " + value);
  }
}
