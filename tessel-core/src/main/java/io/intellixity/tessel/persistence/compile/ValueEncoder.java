package io.intellixity.tessel.persistence.compile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tessel.persistence.metadata.*;
import io.intellixity.tessel.persistence.query.ValidationException;

import java.util.List;
import java.util.Map;

/** Renders one INSERT/UPDATE value: {@code NULL}, a placeholder, or a placeholder cast to jsonb. */
final class ValueEncoder {
  private final ModelRegistry registry;
  private final ObjectMapper json;

  ValueEncoder(ModelRegistry registry, ObjectMapper json) {
    this.registry = registry;
    this.json = json;
  }

  String render(ModelMetadata model, ColumnMetadata column, Object value, ParamList params) {
    if (value == null) return "NULL";

    if (column instanceof ModelColumn mc && value instanceof Map<?, ?> hydrated) {
      ModelMetadata target = registry.target(mc);
      Object pk = hydrated.get(target.primaryKey().propertyName());
      if (pk == null) {
        throw new ValidationException("Undefined primary key value for hydrated object value for \""
            + mc.propertyName() + "\" on \"" + model.name() + "\"");
      }
      return params.add(pk);
    }

    List<?> list = WhereCompiler.asList(value);
    if (column instanceof ScalarColumn s && s.type() == ColumnType.JSON && list != null) {
      // a bare list binds as a Postgres array, not JSON
      try {
        return params.add(json.writeValueAsString(list)) + "::jsonb";
      } catch (JsonProcessingException e) {
        throw new ValidationException("Unable to serialize json value for \"" + s.propertyName() + "\" on \""
            + model.name() + "\"", e);
      }
    }
    return params.add(value);
  }
}
