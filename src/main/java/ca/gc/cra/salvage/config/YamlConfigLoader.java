package ca.gc.cra.salvage.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads salvage configuration from a YAML document and flattens sections into simple key/value maps.
 *
 * <p>Layout: a {@code common} section applied to every command, then one section per command
 * ({@code validate}, {@code decide}, {@code repair}, {@code run}). Nested mappings flatten with dots
 * ({@code successRate: {truncated: 80}} becomes {@code successRate.truncated=80}); lists of scalars become
 * comma-separated values ({@code externalChecks: [jpeginfo, pngcheck]}).
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  private static final Set<String> SECTIONS = Set.of("common", "validate", "decide", "repair", "run");

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the requested {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode command name (validate, decide, repair, run)
   * @return flat map containing merged configuration, empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");
      Map<String, Object> sections = new LinkedHashMap<>();
      for (Map.Entry<String, Object> entry : root.entrySet()) {
        String section = entry.getKey().trim().toLowerCase(Locale.ROOT);
        if (SECTIONS.contains(section)) {
          sections.put(section, entry.getValue());
        } else {
          log.warn("Ignoring unknown section '{}' in {}", entry.getKey(), path);
        }
      }

      Map<String, String> flattened = new LinkedHashMap<>();
      Object common = sections.get("common");
      if (common != null) {
        flatten(asMap(common, "common"), "", flattened);
      }
      Object modeSection = sections.get(normalizedMode);
      if (modeSection != null) {
        flatten(asMap(modeSection, normalizedMode), "", flattened);
      }
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String composite = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(composite, joinScalars(composite, items));
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static String joinScalars(String key, Iterable<?> items) {
    List<String> values = new ArrayList<>();
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list for key " + key + " must contain only scalars");
      }
      if (item != null) {
        values.add(item.toString().trim());
      }
    }
    return String.join(",", values);
  }
}
