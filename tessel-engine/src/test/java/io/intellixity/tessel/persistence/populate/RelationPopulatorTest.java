package io.intellixity.tessel.persistence.populate;

import io.intellixity.tessel.persistence.exec.CapturingPool;
import io.intellixity.tessel.persistence.exec.TestCatalog;
import io.intellixity.tessel.persistence.mapping.ResultRow;
import io.intellixity.tessel.persistence.metadata.ConfigurationException;
import io.intellixity.tessel.persistence.metadata.ModelRegistry;
import io.intellixity.tessel.persistence.query.ValidationException;
import io.intellixity.tessel.persistence.query.Where;
import io.intellixity.tessel.persistence.repository.Repository;
import io.intellixity.tessel.persistence.repository.Tessel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static io.intellixity.tessel.persistence.exec.CapturingPool.row;
import static org.junit.jupiter.api.Assertions.*;

final class RelationPopulatorTest {
  private static final String PRODUCT_COLUMNS = "\"id\",\"name\",\"sku\",\"alias_names\" AS \"aliases\",\"store_id\" AS \"store\"";

  private final CapturingPool primary = new CapturingPool();
  private final CapturingPool readonly = new CapturingPool();
  private final Tessel tessel = Tessel.initialize(TestCatalog.registry(), primary, readonly);
  private final Repository products = tessel.repository("Product");
  private final Repository stores = tessel.repository("Store");

  @Test
  void singleManyToManyUsesThreeQueries() {
    readonly.reply(row("id", 1, "name", "p"))
        .reply(row("category", 11, "id", 100), row("category", 10, "id", 101))
        .reply(row("id", 10, "name", "tools"), row("id", 11, "name", "garden"));

    ResultRow product = products.findOne(Where.of("id", 1)).populate("categories").execute().join();

    assertEquals(List.of(
        "SELECT " + PRODUCT_COLUMNS + " FROM \"products\" WHERE \"id\"=$1 LIMIT 1",
        "SELECT \"category_id\" AS \"category\",\"id\" FROM \"product__category\" WHERE \"product_id\"=$1",
        "SELECT \"id\",\"name\" FROM \"categories\" WHERE \"id\"=ANY($1::INTEGER[])"), readonly.sql());
    assertEquals(List.of(List.of(11, 10)), readonly.call(2).params());
    List<?> categories = (List<?>) product.get("categories");
    assertEquals(List.of("tools", "garden"), names(categories));
    assertTrue(primary.calls().isEmpty());
  }

  @Test
  void manyToManyWithoutJoinsSkipsTargetQuery() {
    readonly.reply(row("id", 1, "name", "p"));

    ResultRow product = products.findOne().populate("categories").execute().join();

    assertEquals(2, readonly.calls().size());
    assertEquals(List.of(), product.get("categories"));
  }

  @Test
  void nullForeignKeyIssuesNoQuery() {
    readonly.reply(row("id", 1, "name", "p", "store", null));

    ResultRow product = products.findOne().populate("store").execute().join();

    assertEquals(1, readonly.calls().size());
    assertTrue(product.containsKey("store"));
    assertNull(product.get("store"));
  }

  @Test
  void singleBelongsToLimitsToOneRow() {
    readonly.reply(row("id", 1, "name", "p", "store", 5)).reply(row("id", 5, "name", "north"));

    ResultRow product = products.findOne().populate("store").execute().join();

    assertEquals("SELECT \"id\",\"name\" FROM \"stores\" WHERE \"id\"=$1 LIMIT 1", readonly.call(1).text());
    assertEquals("north", ((Map<?, ?>) product.get("store")).get("name"));
  }

  @Test
  void explicitSelectGainsPopulatedForeignKey() {
    readonly.reply(row("id", 1, "name", "p", "store", 5)).reply(row("id", 5, "name", "north"));

    ResultRow product = products.findOne().select(List.of("name")).populate("store").execute().join();
    products.find().select(List.of("name", "store")).populate("store").execute().join();

    assertEquals("SELECT \"name\",\"store_id\" AS \"store\",\"id\" FROM \"products\" LIMIT 1", readonly.call(0).text());
    assertEquals("SELECT \"name\",\"store_id\" AS \"store\",\"id\" FROM \"products\"", readonly.call(2).text());
    assertEquals("north", ((Map<?, ?>) product.get("store")).get("name"));
  }

  @Test
  void batchedBelongsToQueriesDistinctKeysOnce() {
    readonly.reply(
            row("id", 1, "name", "a", "store", 1),
            row("id", 2, "name", "b", "store", 2),
            row("id", 3, "name", "c", "store", 1),
            row("id", 4, "name", "d", "store", null))
        .reply(row("id", "2", "name", "south"), row("id", 1, "name", "north"));

    List<ResultRow> rows = products.find().populate("store").execute().join();

    assertEquals("SELECT \"id\",\"name\" FROM \"stores\" WHERE \"id\"=ANY($1::INTEGER[])", readonly.call(1).text());
    assertEquals(List.of(List.of(1, 2)), readonly.call(1).params());
    assertEquals("north", store(rows.get(0)));
    assertEquals("south", store(rows.get(1)));
    assertEquals("north", store(rows.get(2)));
    assertNull(rows.get(3).get("store"));
  }

  @Test
  void batchedHasManyGroupsByOwner() {
    readonly.reply(row("id", 1, "name", "north"), row("id", 2, "name", "south"), row("id", 3, "name", "east"))
        .reply(
            row("id", 10, "name", "a", "store", 1),
            row("id", 11, "name", "b", "store", 2),
            row("id", 12, "name", "c", "store", 1));

    List<ResultRow> rows = stores.find().populate("products").execute().join();

    assertEquals("SELECT " + PRODUCT_COLUMNS + " FROM \"products\" WHERE \"store_id\"=ANY($1::INTEGER[])", readonly.call(1).text());
    assertEquals(List.of("a", "c"), names((List<?>) rows.get(0).get("products")));
    assertEquals(List.of("b"), names((List<?>) rows.get(1).get("products")));
    assertEquals(List.of(), rows.get(2).get("products"));
  }

  @Test
  void callerWhereIsMergedWithRelationKey() {
    readonly.reply(row("id", 1, "name", "north"));

    stores.findOne().populate(PopulateRequest.of("products").withWhere(Where.of("sku", "x")).withLimit(2)).execute().join();

    assertEquals("SELECT " + PRODUCT_COLUMNS + " FROM \"products\" WHERE \"store_id\"=$1 AND \"sku\"=$2 LIMIT 2", readonly.call(1).text());
    assertEquals(List.of(1, "x"), readonly.call(1).params());
  }

  @Test
  void batchedHasManyRequiresViaInSelect() {
    readonly.reply(row("id", 1, "name", "north"), row("id", 2, "name", "south"));

    CompletableFuture<List<ResultRow>> f = stores.find()
        .populate(PopulateRequest.of("products").withSelect(List.of("name")))
        .execute();

    CompletionException ex = assertThrows(CompletionException.class, f::join);
    assertInstanceOf(ValidationException.class, ex.getCause());
    assertEquals("Unable to populate \"products\" on Store. \"store\" is not included in select array.", ex.getCause().getMessage());
    assertEquals(1, readonly.calls().size());
  }

  @Test
  void unknownRelationIsAConfigurationError() {
    readonly.reply(row("id", 1, "name", "p"));

    CompletionException ex = assertThrows(CompletionException.class,
        () -> products.find().populate("sku").execute().join());

    assertInstanceOf(ConfigurationException.class, ex.getCause());
    assertEquals("Unable to find sku on Product model for populating.", ex.getCause().getMessage());
    assertEquals("Product.find()", ex.getCause().getSuppressed()[0].getMessage());
  }

  @Test
  void batchedManyToManyAssignsInJoinOrder() {
    readonly.reply(row("id", 1, "name", "a"), row("id", 2, "name", "b"))
        .reply(
            row("product", 1, "category", 10, "id", 100),
            row("product", 1, "category", 11, "id", 101),
            row("product", 2, "category", 10, "id", 102))
        .reply(row("id", 11, "name", "garden"), row("id", 10, "name", "tools"));

    List<ResultRow> rows = products.find().populate("categories").execute().join();

    assertEquals("SELECT \"product_id\" AS \"product\",\"category_id\" AS \"category\",\"id\" FROM \"product__category\""
        + " WHERE \"product_id\"=ANY($1::INTEGER[])", readonly.call(1).text());
    assertEquals(List.of(List.of(10, 11)), readonly.call(2).params());
    assertEquals(List.of("tools", "garden"), names((List<?>) rows.get(0).get("categories")));
    assertEquals(List.of("tools"), names((List<?>) rows.get(1).get("categories")));
  }

  @Test
  void nestedRequestsPopulateRelatedRows() {
    readonly.reply(row("id", 1, "name", "north"))
        .reply(row("id", 10, "name", "a", "store", 1), row("id", 11, "name", "b", "store", 1))
        .reply(row("product", 11, "category", 7, "id", 100))
        .reply(row("id", 7, "name", "tools"));

    ResultRow store = stores.findOne()
        .populate(PopulateRequest.of("products").populate(PopulateRequest.of("categories")))
        .execute().join();

    assertEquals(4, readonly.calls().size());
    List<?> related = (List<?>) store.get("products");
    assertEquals(List.of(), ((Map<?, ?>) related.get(0)).get("categories"));
    assertEquals(List.of("tools"), names((List<?>) ((Map<?, ?>) related.get(1)).get("categories")));
  }

  @Test
  void failedBranchLeavesRowsUntouched() {
    ModelRegistry registry = TestCatalog.registry();
    IllegalStateException boom = new IllegalStateException("stores offline");
    RowFinder finder = (model, criteria) -> {
      switch (model.name()) {
        case "Store":
          return CompletableFuture.failedFuture(boom);
        case "ProductCategory":
          return CompletableFuture.completedFuture(List.of(new ResultRow(row("product", 1, "category", 10, "id", 1), null)));
        default:
          return CompletableFuture.completedFuture(List.of(new ResultRow(row("id", 10, "name", "tools"), null)));
      }
    };
    List<ResultRow> rows = new ArrayList<>();
    rows.add(new ResultRow(row("id", 1, "store", 5), null));
    rows.add(new ResultRow(row("id", 2, "store", 6), null));

    CompletableFuture<Void> f = new RelationPopulator(registry, finder).populate(registry.model("Product"), rows,
        List.of(PopulateRequest.of("categories"), PopulateRequest.of("store")));

    CompletionException ex = assertThrows(CompletionException.class, f::join);
    assertSame(boom, ex.getCause());
    assertEquals(5, rows.get(0).get("store"));
    assertFalse(rows.get(0).containsKey("categories"));
    assertFalse(rows.get(1).containsKey("categories"));
  }

  private static String store(ResultRow row) {
    return (String) ((Map<?, ?>) row.get("store")).get("name");
  }

  private static List<Object> names(List<?> rows) {
    List<Object> out = new ArrayList<>();
    for (Object r : rows) out.add(((Map<?, ?>) r).get("name"));
    return out;
  }
}
