package io.intellixity.tessel.persistence.mapping;

import io.intellixity.tessel.persistence.metadata.ColumnMetadata;
import io.intellixity.tessel.persistence.metadata.ColumnType;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import io.intellixity.tessel.persistence.metadata.ScalarColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Raw driver rows to {@link ResultRow}s. Rows are keyed by property name already (projections alias columns);
 * integer and float columns holding text are coerced when lossless, and every row is bound to the model's shared
 * behaviors.
 */
public final class RowMaterializer {
  private static final Logger log = LoggerFactory.getLogger(RowMaterializer.class);

  public List<ResultRow> materializeAll(ModelMetadata model, List<? extends Map<String, ?>> rows) {
    List<ResultRow> out = new ArrayList<>(rows == null ? 0 : rows.size());
    if (rows == null) return out;
    for (Map<String, ?> r : rows) out.add(materialize(model, r));
    return out;
  }

  /** Null in, null out. */
  public ResultRow materialize(ModelMetadata model, Map<String, ?> raw) {
    if (raw == null) return null;
    ResultRow row = new ResultRow(raw, model.behaviors());
    for (var e : row.entrySet()) {
      ColumnMetadata c = model.column(e.getKey());
      Object v = e.getValue();
      if (!(c instanceof ScalarColumn s) || !s.type().isNumeric()) continue;
      if (!(v instanceof CharSequence || v instanceof BigDecimal || v instanceof BigInteger)) continue;
      Object coerced;
      if (s.type() == ColumnType.INTEGER) {
        coerced = Coercions.toInteger(v);
      } else {
        coerced = Coercions.toFloat(v);
      }
      if (coerced != null) {
        e.setValue(coerced);
      } else {
        log.trace("tessel.materialize model={} property={} kept raw {}", model.name(), e.getKey(), v.getClass().getSimpleName());
      }
    }
    return row;
  }
}
