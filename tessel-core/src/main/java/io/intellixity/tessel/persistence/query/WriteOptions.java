package io.intellixity.tessel.persistence.query;

import java.util.List;

/** Options for create/update/destroy. {@code returnSelect} limits the RETURNING projection. */
public record WriteOptions(List<String> returnSelect, OnConflict onConflict) {
  private static final WriteOptions DEFAULTS = new WriteOptions(null, null);

  public WriteOptions {
    returnSelect = (returnSelect == null) ? null : List.copyOf(returnSelect);
  }

  public static WriteOptions defaults() { return DEFAULTS; }

  public static WriteOptions returning(List<String> returnSelect) {
    return new WriteOptions(returnSelect, null);
  }

  public WriteOptions withOnConflict(OnConflict onConflict) {
    return new WriteOptions(returnSelect, onConflict);
  }
}
