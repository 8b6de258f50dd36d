package io.intellixity.reltab.jdbc.postgres;

import io.intellixity.reltab.jdbc.Bind;
import io.intellixity.reltab.jdbc.SqlStatement;
import io.intellixity.reltab.jdbc.dialect.SqlDialects;
import io.intellixity.reltab.query.OffsetPage;
import io.intellixity.reltab.query.Queries;
import io.intellixity.reltab.query.QueryExp;
import io.intellixity.reltab.query.SortKey;
import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.reltab.expr.Exprs.*;
import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect();

  private static QueryExp orders() {
    return Queries.table("orders", Schema.builder()
        .column("status", ColumnType.TEXT)
        .column("amount", ColumnType.INTEGER)
        .build());
  }

  @Test
  void textConstantsCastToText() {
    SqlStatement ss = d.compile(orders().filter(eq("status", "CREATED")));
    assertEquals("SELECT \"status\", \"amount\" FROM \"orders\" WHERE (\"status\" = CAST(? AS TEXT))", ss.sql());
    assertEquals(List.of(new Bind("CREATED", ColumnType.TEXT)), ss.binds());
  }

  @Test
  void toTextUsesTextType() {
    String sql = d.compile(orders().extend("label", ColumnType.TEXT, toText(col("amount")))).sql();
    assertTrue(sql.contains("CAST(\"amount\" AS TEXT) AS \"label\""), sql);
  }

  @Test
  void pagingUsesLimitOffset() {
    SqlStatement ss = d.compile(orders().sort(SortKey.desc("amount")), new OffsetPage(40, 20));
    assertTrue(ss.sql().endsWith("ORDER BY \"amount\" DESC NULLS LAST LIMIT 20 OFFSET 40"), ss.sql());
  }

  @Test
  void registeredAlongsideH2() {
    assertTrue(SqlDialects.forId("postgres") instanceof PostgresDialect);
    assertEquals("h2", SqlDialects.forId("h2").id());
  }
}
