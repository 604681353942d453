package io.intellixity.tessel.persistence.compile;

import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import io.intellixity.tessel.persistence.metadata.ModelRegistry;
import io.intellixity.tessel.persistence.metadata.TestModels;
import io.intellixity.tessel.persistence.query.Criteria;
import io.intellixity.tessel.persistence.query.SortTerm;
import io.intellixity.tessel.persistence.query.ValidationException;
import io.intellixity.tessel.persistence.query.Where;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SelectBuilderTest {
  private final ModelRegistry registry = TestModels.registry();
  private final SelectBuilder select = new SqlCompiler(registry).select();
  private final ModelMetadata product = registry.model("Product");

  @Test
  void projectsEveryNonCollectionColumnByDefault() {
    SqlStatement st = select.select(product, Criteria.empty());
    assertEquals("SELECT \"id\",\"name\",\"sku\",\"alias_names\" AS \"aliases\",\"store_id\" AS \"store\" FROM \"products\"",
        st.text());
    assertTrue(st.params().isEmpty());
  }

  @Test
  void explicitSelectAlwaysIncludesPrimaryKey() {
    SqlStatement st = select.select(product, Criteria.empty().withSelect(List.of("name", "store")));
    assertEquals("SELECT \"name\",\"store_id\" AS \"store\",\"id\" FROM \"products\"", st.text());

    st = select.select(product, Criteria.empty().withSelect(List.of("id", "name")));
    assertEquals("SELECT \"id\",\"name\" FROM \"products\"", st.text());
  }

  @Test
  void rendersWhereOrderLimitAndOffset() {
    Criteria c = new Criteria(
        List.of("name"),
        Where.of("name", Where.startsWith("a")),
        List.of(SortTerm.desc("name"), SortTerm.asc("store")),
        20,
        10);
    SqlStatement st = select.select(product, c);
    assertEquals("SELECT \"name\",\"id\" FROM \"products\" WHERE \"name\" ILIKE $1"
        + " ORDER BY \"name\" DESC,\"store_id\" LIMIT 10 OFFSET 20", st.text());
    assertEquals(List.of("a%"), st.params());
  }

  @Test
  void omitsZeroLimitAndSkip() {
    SqlStatement st = select.select(product, Criteria.empty().withSelect(List.of("id")).withLimit(0).withSkip(0));
    assertEquals("SELECT \"id\" FROM \"products\"", st.text());
  }

  @Test
  void rendersCount() {
    SqlStatement st = select.count(product, Where.of("store", 4));
    assertEquals("SELECT count(*) AS \"count\" FROM \"products\" WHERE \"store_id\"=$1", st.text());
    assertEquals(List.of(4), st.params());
    assertEquals("SELECT count(*) AS \"count\" FROM \"products\"", select.count(product, null).text());
  }

  @Test
  void rejectsUnknownSelectAndSortProperties() {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> select.select(product, Criteria.empty().withSelect(List.of("nope"))));
    assertEquals("Unable to find column for property: nope on products", ex.getMessage());

    assertThrows(ValidationException.class,
        () -> select.select(product, Criteria.empty().withSelect(List.of("categories"))));
    assertThrows(ValidationException.class,
        () -> select.select(product, Criteria.empty().withSorts(List.of(SortTerm.asc("nope")))));
  }
}
