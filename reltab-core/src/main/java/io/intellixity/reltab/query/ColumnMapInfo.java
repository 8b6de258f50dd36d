package io.intellixity.reltab.query;

/** Rename and/or relabel a column; null fields keep the current value. */
public record ColumnMapInfo(String id, String displayName) {
  public static ColumnMapInfo rename(String id) { return new ColumnMapInfo(id, null); }
  public static ColumnMapInfo relabel(String displayName) { return new ColumnMapInfo(null, displayName); }
}
