package io.intellixity.reltab.table;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;
import io.intellixity.reltab.schema.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TableRepTest {
  private static final Schema S = Schema.builder()
      .column("Name", ColumnType.TEXT)
      .column("Base", ColumnType.INTEGER)
      .build();

  @Test
  void columnAccess() {
    TableRep t = new TableRep(S, List.of(List.of("Wu, Julie", 172361L), Arrays.asList("Ng, Vincent", null)));
    assertEquals(2, t.rowCount());
    assertEquals(Arrays.asList(172361L, null), t.getColumn("Base"));
    assertEquals("Ng, Vincent", t.value(1, "Name"));
    assertThrows(SchemaException.class, () -> t.getColumn("TCOE"));
  }

  @Test
  void rowWidthMustMatchSchema() {
    assertThrows(SchemaException.class, () -> new TableRep(S, List.of(List.of("only name"))));
  }

  @Test
  void serializesSchemaAndRows() throws Exception {
    ObjectMapper json = new ObjectMapper();
    TableRep t = new TableRep(S, List.of(List.of("Wu, Julie", 172361L)));
    String s = json.writeValueAsString(t);
    assertTrue(s.contains("\"rowData\":[[\"Wu, Julie\",172361]]"), s);
    assertEquals(S, json.readValue(s, TableRep.class).schema());
  }
}
