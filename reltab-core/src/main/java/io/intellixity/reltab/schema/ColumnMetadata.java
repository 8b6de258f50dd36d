package io.intellixity.reltab.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Per-column type and display metadata. */
public record ColumnMetadata(ColumnType type, String displayName) {
  @JsonCreator
  public ColumnMetadata(@JsonProperty("type") ColumnType type,
                        @JsonProperty("displayName") String displayName) {
    this.type = Objects.requireNonNull(type, "type");
    this.displayName = displayName;
  }

  public ColumnMetadata withDisplayName(String displayName) {
    return new ColumnMetadata(type, displayName);
  }
}
