package io.intellixity.reltab.table;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.intellixity.reltab.schema.Schema;
import io.intellixity.reltab.schema.SchemaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Materialized query result: a schema plus rows whose values follow the schema's column order.
 * Values are {@code Long}, {@code Double}, {@code String}, {@code Boolean} or null.
 */
public final class TableRep {
  private final Schema schema;
  private final List<List<Object>> rowData;

  @JsonCreator
  public TableRep(@JsonProperty("schema") Schema schema,
                  @JsonProperty("rowData") List<List<Object>> rowData) {
    this.schema = Objects.requireNonNull(schema, "schema");
    List<List<Object>> rows = new ArrayList<>(rowData == null ? 0 : rowData.size());
    if (rowData != null) {
      for (List<Object> r : rowData) {
        if (r.size() != schema.size()) {
          throw new SchemaException("Row has " + r.size() + " values but schema has " + schema.size() + " columns");
        }
        rows.add(Collections.unmodifiableList(new ArrayList<>(r)));
      }
    }
    this.rowData = Collections.unmodifiableList(rows);
  }

  @JsonProperty("schema")
  public Schema schema() { return schema; }

  @JsonProperty("rowData")
  public List<List<Object>> rowData() { return rowData; }

  public int rowCount() { return rowData.size(); }

  /** Value at {@code row} for column {@code columnId}. */
  public Object value(int row, String columnId) {
    return rowData.get(row).get(index(columnId));
  }

  /**
   * All values of one column, in row order.
   *
   * @throws SchemaException if the column is not in the schema
   */
  public List<Object> getColumn(String columnId) {
    int i = index(columnId);
    List<Object> out = new ArrayList<>(rowData.size());
    for (List<Object> r : rowData) out.add(r.get(i));
    return out;
  }

  private int index(String columnId) {
    int i = schema.columnIndex(columnId);
    if (i < 0) throw new SchemaException("Unknown column '" + columnId + "' (columns: " + schema.columns() + ")");
    return i;
  }

  @Override
  public String toString() {
    return "TableRep" + schema.columns() + " (" + rowData.size() + " rows)";
  }
}
