package io.intellixity.tessel.persistence.mapping;

import io.intellixity.tessel.persistence.metadata.*;
import io.intellixity.tessel.persistence.query.Where;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RowMaterializerTest {
  private final RowMaterializer materializer = new RowMaterializer();

  @Test
  void coercesNumericTextWhenLossless() {
    ModelMetadata item = TestModels.registry().model("Item");
    ResultRow row = materializer.materialize(item, Where.of("id", "12", "weight", "2.5", "name", "7"));

    assertEquals(12L, row.get("id"));
    assertEquals(2.5, row.get("weight"));
    assertEquals("7", row.get("name"));
  }

  @Test
  void keepsUnsafeIntegersAsText() {
    ModelMetadata item = TestModels.registry().model("Item");
    ResultRow row = materializer.materialize(item, Where.of("id", "9007199254740993", "weight", "1.10"));
    assertEquals("9007199254740993", row.get("id"));
    assertEquals("1.10", row.get("weight"));
  }

  @Test
  void bindsRowsToSharedBehaviors() {
    ModelRegistry registry = ModelRegistry.of(ModelDefinition.builder("Tag")
        .column(ScalarColumn.of("label", ColumnType.STRING))
        .behavior("shout", (row, args) -> row.get("label") + "!".repeat((Integer) args[0]))
        .build());
    ModelMetadata tag = registry.model("Tag");

    List<ResultRow> rows = materializer.materializeAll(tag, List.of(Map.of("id", 1, "label", "a"), Map.of("id", 2, "label", "b")));

    assertEquals("a!!", rows.get(0).invoke("shout", 2));
    assertSame(rows.get(0).behaviors(), rows.get(1).behaviors());
    assertEquals(Map.of("id", 1, "label", "a"), rows.get(0));
  }

  @Test
  void nullRowStaysNull() {
    assertNull(materializer.materialize(TestModels.registry().model("Item"), null));
    assertTrue(materializer.materializeAll(TestModels.registry().model("Item"), null).isEmpty());
  }
}
