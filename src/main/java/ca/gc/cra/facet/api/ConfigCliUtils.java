package ca.gc.cra.facet.api;

import ca.gc.cra.facet.config.ConfigMerger;
import ca.gc.cra.facet.config.ExtractConfig;
import ca.gc.cra.facet.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Shared helpers that fold CLI flags, {@code key=value} options, and {@code facet.yaml} into an
 * {@link ExtractConfig}.
 *
 * @since FACET 0.1.0
 */
public final class ConfigCliUtils {
  /** YAML section read by every FACET command. */
  public static final String SECTION = "extract";

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} option.
   *
   * @param args mutable option map
   * @return trimmed config path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Resolves the effective configuration for one command.
   *
   * <p>{@code --strict} and {@code --metrics} flags win over every other source. Keys in {@code options} that
   * are not configuration keys (such as {@code in} or {@code out}) are ignored by {@link ExtractConfig}.</p>
   *
   * @param input parsed CLI input
   * @param options option map; the {@code config} key is removed
   * @param warn receives override warnings
   * @return validated configuration
   * @throws IllegalArgumentException when the config file is missing or a value is invalid
   * @throws IOException when the config file cannot be read
   */
  public static ExtractConfig resolve(CliInput input, Map<String, String> options, Consumer<String> warn)
      throws IOException {
    String configPath = extractConfigPath(options);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, SECTION);
    }

    Map<String, String> cli = new LinkedHashMap<>(options);
    if (input.hasFlag("--strict")) {
      cli.put("strict", "true");
    }
    if (input.hasFlag("--metrics")) {
      cli.put("metrics", "true");
    }
    Map<String, String> effective =
        ConfigMerger.buildEffectiveConfig(yaml, cli, ExtractConfig.defaultsAsFlatMap(), warn);
    return ExtractConfig.fromMap(effective);
  }
}
