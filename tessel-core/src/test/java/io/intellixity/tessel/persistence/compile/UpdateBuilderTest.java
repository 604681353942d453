package io.intellixity.tessel.persistence.compile;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import io.intellixity.tessel.persistence.metadata.ModelRegistry;
import io.intellixity.tessel.persistence.metadata.TestModels;
import io.intellixity.tessel.persistence.query.ValidationException;
import io.intellixity.tessel.persistence.query.Where;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class UpdateBuilderTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-06T07:08:09Z"), ZoneOffset.UTC);

  private final ModelRegistry registry = TestModels.registry();
  private final UpdateBuilder update = new SqlCompiler(registry, new ObjectMapper(), CLOCK).update();
  private final ModelMetadata product = registry.model("Product");

  @Test
  void numbersSetParametersBeforeWhere() {
    SqlStatement st = update.update(product, Where.of("id", 1), Where.of("name", "x", "sku", null), false, null);
    assertEquals("UPDATE \"products\" SET \"name\"=$1,\"sku\"=NULL WHERE \"id\"=$2", st.text());
    assertEquals(List.of("x", 1), st.params());
  }

  @Test
  void stampsUpdateDateAndIncrementsVersion() {
    SqlStatement st = update.update(registry.model("Item"), Where.of("id", 1), Where.of("name", "y", "version", 7), false, null);
    assertEquals("UPDATE \"items\" SET \"name\"=$1,\"updated_at\"=$2,\"version\"=\"version\"+1 WHERE \"id\"=$3", st.text());
    assertEquals(List.of("y", OffsetDateTime.now(CLOCK), 1), st.params());
  }

  @Test
  void collapsesHydratedRelationAndReturnsSelection() {
    SqlStatement st = update.update(product, null, Where.of("store", Map.of("id", 9)), true, List.of("name"));
    assertEquals("UPDATE \"products\" SET \"store_id\"=$1 RETURNING \"name\",\"id\"", st.text());
    assertEquals(List.of(9), st.params());
  }

  @Test
  void failsWhenNothingToSet() {
    assertThrows(ValidationException.class, () -> update.update(product, Where.of("id", 1), Map.of(), false, null));
    assertThrows(ValidationException.class, () -> update.update(product, null, Where.of("categories", List.of()), false, null));
  }
}
