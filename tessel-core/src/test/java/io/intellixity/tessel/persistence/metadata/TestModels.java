package io.intellixity.tessel.persistence.metadata;

/**
 * Catalog used across compiler tests.
 * <p>
 * Product belongs to a Store and maps to Categories through ProductCategory. Item carries json, float, default,
 * date and version columns.
 */
public final class TestModels {
  private TestModels() {}

  public static ModelDefinition product() {
    return ModelDefinition.builder("Product")
        .tableName("products")
        .column(ScalarColumn.of("id", ColumnType.INTEGER).primary())
        .column(ScalarColumn.of("name", ColumnType.STRING).asRequired())
        .column(ScalarColumn.of("sku", ColumnType.STRING))
        .column(ScalarColumn.of("aliases", ColumnType.STRING_ARRAY).named("alias_names"))
        .column(ModelColumn.of("store", "Store").named("store_id"))
        .column(CollectionColumn.of("categories", "Category", "product").through("ProductCategory"))
        .build();
  }

  public static ModelDefinition store() {
    return ModelDefinition.builder("Store")
        .tableName("stores")
        .column(ScalarColumn.of("name", ColumnType.STRING))
        .column(CollectionColumn.of("products", "Product", "store"))
        .build();
  }

  public static ModelDefinition category() {
    return ModelDefinition.builder("Category")
        .tableName("categories")
        .column(ScalarColumn.of("id", ColumnType.INTEGER))
        .column(ScalarColumn.of("name", ColumnType.STRING))
        .column(CollectionColumn.of("products", "Product", "category").through("ProductCategory"))
        .build();
  }

  public static ModelDefinition productCategory() {
    return ModelDefinition.builder("ProductCategory")
        .tableName("product__category")
        .column(ModelColumn.of("product", "Product").named("product_id"))
        .column(ModelColumn.of("category", "Category").named("category_id"))
        .build();
  }

  public static ModelDefinition item() {
    return ModelDefinition.builder("Item")
        .tableName("items")
        .column(ScalarColumn.of("name", ColumnType.STRING))
        .column(ScalarColumn.of("meta", ColumnType.JSON))
        .column(ScalarColumn.of("weight", ColumnType.FLOAT))
        .column(ScalarColumn.of("status", ColumnType.STRING).defaultsTo("new"))
        .column(ScalarColumn.of("createdAt", ColumnType.DATETIME).named("created_at").asCreateDate())
        .column(ScalarColumn.of("updatedAt", ColumnType.DATETIME).named("updated_at").asUpdateDate())
        .column(ScalarColumn.of("version", ColumnType.INTEGER).asVersion())
        .build();
  }

  public static ModelRegistry registry() {
    return ModelRegistry.of(product(), store(), category(), productCategory(), item());
  }
}
