package io.intellixity.tessel.persistence.metadata.yaml;

import io.intellixity.tessel.persistence.metadata.*;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ModelDefinitionLoaderTest {
  private final ModelDefinitionLoader loader = new ModelDefinitionLoader();

  private static Path modelsDir() throws URISyntaxException {
    return Path.of(ModelDefinitionLoaderTest.class.getResource("/models").toURI());
  }

  @Test
  void loadsDirectoryIntoLinkableRegistry() throws Exception {
    List<ModelDefinition> defs = loader.loadDir(modelsDir());
    assertEquals(List.of("Category", "Product", "ProductCategory", "Store"),
        defs.stream().map(ModelDefinition::name).toList());

    ModelRegistry registry = ModelRegistry.of(defs);
    ModelMetadata product = registry.model("Product");
    assertEquals("products", product.tableName());

    ScalarColumn aliases = (ScalarColumn) product.column("aliases");
    assertEquals(ColumnType.STRING_ARRAY, aliases.type());
    assertEquals("alias_names", aliases.columnName());
    assertEquals("active", ((ScalarColumn) product.column("status")).defaultsTo().get());

    ModelColumn store = (ModelColumn) product.column("store");
    assertEquals("store_id", store.columnName());
    assertFalse(store.required());
    assertTrue(((ModelColumn) registry.model("ProductCategory").column("product")).required());

    CollectionColumn categories = (CollectionColumn) product.column("categories");
    assertTrue(categories.manyToMany());
    assertSame(registry.model("Category").column("products"), registry.counterpart(categories));
  }

  @Test
  void loadsFromStream() {
    String doc = "name: Tag\ncolumns:\n  label: { type: text, required: true }\n";
    InputStream in = new ByteArrayInputStream(doc.getBytes(StandardCharsets.UTF_8));
    ModelDefinition tag = loader.load(in, "tag.yaml");
    assertEquals("tag", tag.tableName());
    ScalarColumn label = (ScalarColumn) tag.columns().get(0);
    assertEquals(ColumnType.STRING, label.type());
    assertTrue(label.required());
  }

  @Test
  void rejectsBadColumnSpecs() {
    String unknownType = "name: Tag\ncolumns:\n  label: { type: money }\n";
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> loader.load(new ByteArrayInputStream(unknownType.getBytes(StandardCharsets.UTF_8)), "tag.yaml"));
    assertEquals("Tag.label: Unknown column type: money", ex.getMessage());

    String noVia = "name: Tag\ncolumns:\n  items: { collection: Item }\n";
    assertThrows(IllegalArgumentException.class,
        () -> loader.load(new ByteArrayInputStream(noVia.getBytes(StandardCharsets.UTF_8)), "tag.yaml"));
    assertThrows(IllegalArgumentException.class,
        () -> loader.load(new ByteArrayInputStream("columns: {}".getBytes(StandardCharsets.UTF_8)), "x.yaml"));
  }
}
