package io.intellixity.tessel.persistence.query;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class CriteriaNormalizerTest {
  private final CriteriaNormalizer normalizer = new CriteriaNormalizer();

  @Test
  void rejectsStringPredicates() {
    ValidationException ex = assertThrows(ValidationException.class, () -> normalizer.normalize("name = 'a'"));
    assertEquals("The query cannot be a string, it must be an object", ex.getMessage());
    assertThrows(ValidationException.class, () -> normalizer.fromArgs(Map.of("where", "id = 1")));
  }

  @Test
  void treatsNonArgMapsAsPredicate() {
    Criteria c = normalizer.normalize(Where.of("name", "a", "limit", 3));
    assertEquals(Where.of("name", "a", "limit", 3), c.where());
    assertNull(c.select());
    assertNull(c.limit());
  }

  @Test
  void readsStructuredArgs() {
    Criteria c = normalizer.normalize(Where.of(
        "select", List.of("name"),
        "where", Where.of("id", List.of(1, 2)),
        "sort", "name desc, id",
        "skip", 5,
        "limit", 10L));

    assertEquals(List.of("name"), c.select());
    assertEquals(Where.of("id", List.of(1, 2)), c.where());
    assertEquals(List.of(SortTerm.desc("name"), SortTerm.asc("id")), c.sorts());
    assertEquals(5, c.skip());
    assertEquals(10, c.limit());
  }

  @Test
  void emptyInputIsEmptyCriteria() {
    assertEquals(Criteria.empty(), normalizer.normalize(null));
    assertTrue(normalizer.normalize(Map.of()).where().isEmpty());
  }

  @Test
  void parsesSortShapes() {
    assertEquals(List.of(SortTerm.desc("name"), SortTerm.asc("id")), normalizer.parseSort(Where.of("name", -1, "id", 1)));
    assertEquals(List.of(SortTerm.desc("name")), normalizer.parseSort(Map.of("name", "DESC")));
    assertEquals(List.of(SortTerm.asc("a"), SortTerm.desc("b")), normalizer.parseSort(List.of("a", SortTerm.desc("b"))));
    assertTrue(normalizer.parseSort(null).isEmpty());

    assertThrows(ValidationException.class, () -> normalizer.parseSort("name sideways"));
    assertThrows(ValidationException.class, () -> normalizer.parseSort("name desc extra"));
  }

  @Test
  void rejectsBadPaging() {
    assertThrows(ValidationException.class, () -> normalizer.fromArgs(Map.of("skip", -1)));
    assertThrows(ValidationException.class, () -> normalizer.fromArgs(Map.of("limit", 1.5)));
    assertThrows(ValidationException.class, () -> normalizer.fromArgs(Map.of("limit", "10")));
    assertThrows(ValidationException.class, () -> normalizer.fromArgs(Map.of("offset", 10)));
  }
}
