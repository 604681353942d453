package io.intellixity.tessel.persistence.jdbc;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PlaceholderRewriterTest {

  @Test
  void rewritesPositionalPlaceholdersInOrder() {
    var r = PlaceholderRewriter.rewrite("UPDATE \"t\" SET \"a\"=$1,\"b\"=$2 WHERE \"id\"=$3");
    assertEquals("UPDATE \"t\" SET \"a\"=?,\"b\"=? WHERE \"id\"=?", r.sql());
    assertEquals(List.of(0, 1, 2), r.paramIndexes());
    assertTrue(r.arrayTypes().isEmpty());
  }

  @Test
  void capturesArrayCastElementType() {
    var r = PlaceholderRewriter.rewrite("SELECT \"id\" FROM \"t\" WHERE \"id\"=ANY($1::INTEGER[]) AND \"s\"<>ALL($2::TEXT[])");
    assertEquals("SELECT \"id\" FROM \"t\" WHERE \"id\"=ANY(?::INTEGER[]) AND \"s\"<>ALL(?::TEXT[])", r.sql());
    assertEquals(Map.of(0, "integer", 1, "text"), r.arrayTypes());
  }

  @Test
  void scalarCastIsNotAnArrayType() {
    var r = PlaceholderRewriter.rewrite("INSERT INTO \"t\" (\"j\") VALUES ($1::jsonb)");
    assertEquals("INSERT INTO \"t\" (\"j\") VALUES (?::jsonb)", r.sql());
    assertTrue(r.arrayTypes().isEmpty());
  }

  @Test
  void leavesQuotedTextAlone() {
    var r = PlaceholderRewriter.rewrite("SELECT '$1', 'it''s $2', \"col$3\" FROM \"t\" WHERE \"a\"=$1");
    assertEquals("SELECT '$1', 'it''s $2', \"col$3\" FROM \"t\" WHERE \"a\"=?", r.sql());
    assertEquals(List.of(0), r.paramIndexes());
  }

  @Test
  void repeatedPlaceholderBindsEachOccurrence() {
    var r = PlaceholderRewriter.rewrite("SELECT 1 WHERE $2=ANY(\"a\") OR $2=ANY(\"b\") OR \"c\"=$1");
    assertEquals(List.of(1, 1, 0), r.paramIndexes());
  }

  @Test
  void multiDigitPlaceholders() {
    var r = PlaceholderRewriter.rewrite("VALUES ($10,$11)");
    assertEquals("VALUES (?,?)", r.sql());
    assertEquals(List.of(9, 10), r.paramIndexes());
  }

  @Test
  void rejectsUnterminatedLiteral() {
    assertThrows(IllegalArgumentException.class, () -> PlaceholderRewriter.rewrite("SELECT 'oops FROM t WHERE a=$1"));
  }
}
