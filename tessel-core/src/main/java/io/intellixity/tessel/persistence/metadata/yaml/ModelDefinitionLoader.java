package io.intellixity.tessel.persistence.metadata.yaml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.tessel.persistence.metadata.ModelDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads model definitions from YAML or JSON files.
 *
 * <pre>
 * name: Product
 * tableName: products
 * columns:
 *   id: { type: integer, primaryKey: true }
 *   name: { type: string, required: true }
 *   aliases: { type: "string[]", columnName: alias_names }
 *   store: { model: Store, columnName: store_id }
 *   categories: { collection: Category, via: product, through: ProductCategory }
 * </pre>
 *
 * Column order follows the file. Behaviors and hooks are attached in code via {@link ModelDefinition#toBuilder()}.
 */
public final class ModelDefinitionLoader {
  private static final Logger log = LoggerFactory.getLogger(ModelDefinitionLoader.class);

  private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
  private final ObjectMapper json = new ObjectMapper();

  public List<ModelDefinition> loadDir(Path dir) {
    Objects.requireNonNull(dir, "dir");
    if (!Files.isDirectory(dir)) throw new IllegalArgumentException("Not a directory: " + dir);
    List<Path> files;
    try (Stream<Path> s = Files.list(dir)) {
      files = s.filter(ModelDefinitionLoader::isModelFile).sorted().toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list model files in " + dir, e);
    }
    List<ModelDefinition> out = new ArrayList<>(files.size());
    for (Path f : files) out.add(loadFile(f));
    log.debug("tessel.models dir={} loaded={}", dir, out.size());
    return out;
  }

  public ModelDefinition loadFile(Path file) {
    ObjectMapper mapper = file.getFileName().toString().endsWith(".json") ? json : yaml;
    try (InputStream in = Files.newInputStream(file)) {
      return parse(mapper.readTree(in), mapper, file.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read model file " + file, e);
    }
  }

  /** Reads a YAML (or JSON, which is valid YAML) document from a stream, e.g. a classpath resource. */
  public ModelDefinition load(InputStream in, String sourceName) {
    try {
      return parse(yaml.readTree(in), yaml, sourceName);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read model file " + sourceName, e);
    }
  }

  private static ModelDefinition parse(JsonNode root, ObjectMapper mapper, String source) {
    if (root == null || !root.isObject()) throw new IllegalArgumentException("Model file must be a map: " + source);
    JsonNode name = root.get("name");
    if (name == null || !name.isTextual()) throw new IllegalArgumentException("Model file has no 'name': " + source);

    ModelDefinition.Builder b = ModelDefinition.builder(name.asText());
    JsonNode table = root.get("tableName");
    if (table != null && table.isTextual()) b.tableName(table.asText());

    JsonNode columns = root.get("columns");
    if (columns != null && columns.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = columns.fields();
      while (it.hasNext()) {
        var e = it.next();
        b.column(ColumnSpecParser.parse(name.asText(), e.getKey(), e.getValue(), mapper));
      }
    }
    return b.build();
  }

  private static boolean isModelFile(Path p) {
    String n = p.getFileName().toString();
    return Files.isRegularFile(p) && (n.endsWith(".yaml") || n.endsWith(".yml") || n.endsWith(".json"));
  }
}
