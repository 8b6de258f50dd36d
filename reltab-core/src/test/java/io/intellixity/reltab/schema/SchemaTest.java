package io.intellixity.reltab.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void buildsFromExternalTypeNames() {
    Schema s = Schema.of(List.of("Name", "Base"), Map.of("Name", "text", "Base", "integer"));
    assertEquals(List.of("Name", "Base"), s.columns());
    assertEquals(ColumnType.TEXT, s.columnType("Name"));
    assertEquals(ColumnType.INTEGER, s.columnType("Base"));
    assertEquals("Base", s.displayName("Base"));
    assertEquals(1, s.columnIndex("Base"));
    assertEquals(-1, s.columnIndex("TCOE"));
  }

  @Test
  void rejectsUnknownTypeName() {
    SchemaException ex = assertThrows(SchemaException.class,
        () -> Schema.of(List.of("x"), Map.of("x", "money")));
    assertTrue(ex.getMessage().contains("money"));
  }

  @Test
  void rejectsDuplicateColumn() {
    assertThrows(SchemaException.class,
        () -> Schema.builder().column("a", ColumnType.TEXT).column("a", ColumnType.INTEGER).build());
  }

  @Test
  void rejectsMetadataForMissingColumn() {
    Map<String, ColumnMetadata> md = new LinkedHashMap<>();
    md.put("a", new ColumnMetadata(ColumnType.TEXT, null));
    md.put("b", new ColumnMetadata(ColumnType.TEXT, null));
    assertThrows(SchemaException.class, () -> new Schema(List.of("a"), md));
  }

  @Test
  void unknownColumnLookupFails() {
    Schema s = Schema.builder().column("a", ColumnType.TEXT).build();
    assertThrows(SchemaException.class, () -> s.columnType("nope"));
  }

  @Test
  void compatibilityIgnoresDisplayNames() {
    Schema a = Schema.builder().column("x", ColumnType.INTEGER, "X").build();
    Schema b = Schema.builder().column("x", ColumnType.INTEGER, "Ex").build();
    Schema c = Schema.builder().column("x", ColumnType.REAL).build();
    assertTrue(a.isCompatibleWith(b));
    assertNotEquals(a, b);
    assertFalse(a.isCompatibleWith(c));
  }

  @Test
  void jsonFormUsesTypeIds() throws Exception {
    Schema s = Schema.builder().column("Base", ColumnType.INTEGER, "Base Pay").build();
    String json = JSON.writeValueAsString(s);
    assertTrue(json.contains("\"integer\""), json);
    assertEquals(s, JSON.readValue(json, Schema.class));
  }

  @Test
  void integerWidensToReal() {
    assertEquals(ColumnType.REAL, ColumnType.widen(ColumnType.INTEGER, ColumnType.REAL));
    assertEquals(ColumnType.INTEGER, ColumnType.widen(ColumnType.INTEGER, ColumnType.INTEGER));
    assertNull(ColumnType.widen(ColumnType.TEXT, ColumnType.INTEGER));
  }
}
