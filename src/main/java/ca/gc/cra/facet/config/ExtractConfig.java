package ca.gc.cra.facet.config;

import ca.gc.cra.facet.domain.entity.EntityCategory;
import ca.gc.cra.facet.validation.Numbers;
import ca.gc.cra.facet.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Settings for one {@code facet extract} or {@code facet patterns} run.
 * <p><strong>Why:</strong> Folds defaults, {@code facet.yaml}, and CLI overrides into one validated value so the
 * composition code never re-parses strings.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@code ExtractCli} and {@code PatternsCli}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param categories categories to extract; never empty
 * @param patternFiles custom YAML pattern files in load order
 * @param strict whether a rejected pattern aborts start-up
 * @param metricsEnabled whether metrics are exported through OpenTelemetry
 * @param maxInputBytes largest accepted input document in bytes
 * @since FACET 0.1.0
 */
public record ExtractConfig(
    Set<EntityCategory> categories,
    List<Path> patternFiles,
    boolean strict,
    boolean metricsEnabled,
    long maxInputBytes) {

  /** Default input cap: 16 MiB. */
  public static final long DEFAULT_MAX_INPUT_BYTES = 16L * 1024 * 1024;
  /** Hard input cap: 1 GiB. */
  public static final long MAX_INPUT_BYTES_LIMIT = 1024L * 1024 * 1024;

  static final String KEY_CATEGORIES = "categories";
  static final String KEY_PATTERNS = "patterns";
  static final String KEY_STRICT = "strict";
  static final String KEY_METRICS = "metrics";
  static final String KEY_MAX_INPUT_BYTES = "maxInputBytes";

  /**
   * Normalizes collections and validates invariants.
   *
   * @throws IllegalArgumentException if no category is selected or {@code maxInputBytes} is out of range
   */
  public ExtractConfig {
    Objects.requireNonNull(categories, "categories");
    if (categories.isEmpty()) {
      throw new IllegalArgumentException("categories must name at least one category");
    }
    categories = Set.copyOf(EnumSet.copyOf(categories));
    patternFiles = patternFiles == null ? List.of() : List.copyOf(patternFiles);
    Numbers.requireRange(KEY_MAX_INPUT_BYTES, maxInputBytes, 1, MAX_INPUT_BYTES_LIMIT);
  }

  /**
   * Returns the built-in configuration: every category, no custom patterns, lenient, metrics off.
   *
   * @return default configuration
   */
  public static ExtractConfig defaults() {
    return new ExtractConfig(EnumSet.allOf(EntityCategory.class), List.of(), false, false,
        DEFAULT_MAX_INPUT_BYTES);
  }

  /**
   * Returns the defaults as the flat string map used by {@link ConfigMerger}.
   *
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> defaultsAsFlatMap() {
    ExtractConfig defaults = defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put(KEY_CATEGORIES, "date,time,money,measurement");
    map.put(KEY_PATTERNS, "");
    map.put(KEY_STRICT, Boolean.toString(defaults.strict()));
    map.put(KEY_METRICS, Boolean.toString(defaults.metricsEnabled()));
    map.put(KEY_MAX_INPUT_BYTES, Long.toString(defaults.maxInputBytes()));
    return Map.copyOf(map);
  }

  /**
   * Creates a configuration from flat key/value pairs; absent keys take their defaults.
   *
   * @param options keys {@code categories}, {@code patterns}, {@code strict}, {@code metrics},
   *     {@code maxInputBytes}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static ExtractConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ExtractConfig defaults = defaults();

    Set<EntityCategory> categories = defaults.categories();
    String rawCategories = options.get(KEY_CATEGORIES);
    if (rawCategories != null && !rawCategories.isBlank()) {
      categories = EnumSet.noneOf(EntityCategory.class);
      for (String name : Strings.splitList(KEY_CATEGORIES, rawCategories)) {
        categories.add(EntityCategory.parse(name));
      }
    }

    List<Path> patternFiles = new ArrayList<>();
    for (String file : Strings.splitList(KEY_PATTERNS, options.get(KEY_PATTERNS))) {
      try {
        patternFiles.add(Path.of(file));
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("patterns contains an invalid path: " + file, ex);
      }
    }

    boolean strict = parseBoolean(KEY_STRICT, options.get(KEY_STRICT), defaults.strict());
    boolean metrics = parseBoolean(KEY_METRICS, options.get(KEY_METRICS), defaults.metricsEnabled());
    String rawMax = options.get(KEY_MAX_INPUT_BYTES);
    long maxInputBytes = rawMax == null || rawMax.isBlank()
        ? defaults.maxInputBytes()
        : Numbers.parseInRange(KEY_MAX_INPUT_BYTES, rawMax, 1, MAX_INPUT_BYTES_LIMIT);

    return new ExtractConfig(categories, patternFiles, strict, metrics, maxInputBytes);
  }

  /**
   * Renders the selected categories in declaration order, e.g. {@code DATE,MONEY}.
   *
   * @return comma-separated category names
   */
  public String categoriesText() {
    return EnumSet.copyOf(categories).stream().map(Enum::name).collect(Collectors.joining(","));
  }

  private static boolean parseBoolean(String key, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + value.trim() + "')");
    };
  }
}
