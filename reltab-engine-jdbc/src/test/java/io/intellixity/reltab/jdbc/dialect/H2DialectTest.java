package io.intellixity.reltab.jdbc.dialect;

import io.intellixity.reltab.exec.CompileException;
import io.intellixity.reltab.jdbc.Bind;
import io.intellixity.reltab.jdbc.SqlStatement;
import io.intellixity.reltab.query.AggFn;
import io.intellixity.reltab.query.AggSpec;
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

final class H2DialectTest {
  private static final String COLS = "\"Name\", \"Title\", \"Base\", \"TCOE\", \"JobFamily\", \"Union\"";
  private static final String TABLE_SQL = "SELECT " + COLS + " FROM \"barttest\"";

  private final SqlDialect d = new H2Dialect();

  private static QueryExp bart() {
    return Queries.table("barttest", Schema.builder()
        .column("Name", ColumnType.TEXT)
        .column("Title", ColumnType.TEXT)
        .column("Base", ColumnType.INTEGER)
        .column("TCOE", ColumnType.INTEGER)
        .column("JobFamily", ColumnType.TEXT)
        .column("Union", ColumnType.TEXT)
        .build());
  }

  @Test
  void tableQuerySelectsColumnsInSchemaOrder() {
    SqlStatement ss = d.compile(bart());
    assertEquals(TABLE_SQL, ss.sql());
    assertTrue(ss.binds().isEmpty());
  }

  @Test
  void filterBindsConstantsAsTypedPlaceholders() {
    SqlStatement ss = d.compile(bart().filter(eq("JobFamily", "Executive Management")));
    assertEquals(TABLE_SQL + " WHERE (\"JobFamily\" = CAST(? AS VARCHAR))", ss.sql());
    assertEquals(List.of(new Bind("Executive Management", ColumnType.TEXT)), ss.binds());
  }

  @Test
  void bindsFollowPlaceholderOrder() {
    QueryExp q = bart()
        .filter(gt(col("Base"), constVal(100000)))
        .extend("Bonus", ColumnType.INTEGER, add(col("TCOE"), constVal(5)));
    SqlStatement ss = d.compile(q);
    assertTrue(ss.sql().indexOf("CAST(? AS BIGINT)) AS \"Bonus\"") < ss.sql().indexOf("WHERE"), ss.sql());
    assertEquals(List.of(new Bind(5L, ColumnType.INTEGER), new Bind(100000L, ColumnType.INTEGER)), ss.binds());
  }

  @Test
  void nullConstantIsRenderedInline() {
    SqlStatement ss = d.compile(bart().extend("Note", ColumnType.TEXT, nullOf(ColumnType.TEXT)));
    assertTrue(ss.sql().contains("CAST(NULL AS VARCHAR) AS \"Note\""), ss.sql());
    assertTrue(ss.binds().isEmpty());
  }

  @Test
  void orderingIsAppliedOnceAtTheOutside() {
    SqlStatement ss = d.compile(bart().sort(SortKey.asc("Name")).sort(SortKey.desc("TCOE")).project("Name", "TCOE"));
    assertEquals("SELECT \"Name\", \"TCOE\" FROM (SELECT \"Name\", \"TCOE\" FROM \"barttest\") t0"
        + " ORDER BY \"TCOE\" DESC NULLS LAST, \"Name\" ASC NULLS FIRST", ss.sql());
  }

  @Test
  void projectionKeepsOrderingOnRemovedColumns() {
    SqlStatement ss = d.compile(bart().sort(SortKey.desc("TCOE")).project("Name", "Base"));
    assertEquals("SELECT \"Name\", \"Base\" FROM (SELECT \"Name\", \"Base\", \"TCOE\" AS \"reltab_sort0\" FROM \"barttest\") t0"
        + " ORDER BY \"reltab_sort0\" DESC NULLS LAST", ss.sql());
  }

  @Test
  void hiddenSortColumnsAreNotCounted() {
    SqlStatement ss = d.compileCount(bart().sort(SortKey.asc("Name")).project("Title"));
    assertEquals("SELECT COUNT(1) FROM (SELECT \"Title\" FROM \"barttest\") reltab_count", ss.sql());
  }

  @Test
  void consecutiveNodesFoldIntoOneSelect() {
    QueryExp q = bart()
        .filter(eq("JobFamily", "Executive Management"))
        .extend("Bonus", ColumnType.INTEGER, add(col("TCOE"), constVal(5)))
        .project("Name", "Bonus")
        .filter(gt(col("Bonus"), constVal(100000)));
    SqlStatement ss = d.compile(q);
    assertEquals("SELECT \"Name\", (\"TCOE\" + CAST(? AS BIGINT)) AS \"Bonus\" FROM \"barttest\""
        + " WHERE (\"JobFamily\" = CAST(? AS VARCHAR)) AND ((\"TCOE\" + CAST(? AS BIGINT)) > CAST(? AS BIGINT))", ss.sql());
    assertEquals(List.of(new Bind(5L, ColumnType.INTEGER), new Bind("Executive Management", ColumnType.TEXT),
        new Bind(5L, ColumnType.INTEGER), new Bind(100000L, ColumnType.INTEGER)), ss.binds());
  }

  @Test
  void groupByFoldsOverFilterAndComputedColumns() {
    QueryExp q = bart()
        .filter(eq("JobFamily", "Executive Management"))
        .extend("Rec", ColumnType.INTEGER, constVal(1))
        .groupBy(List.of("Title"), List.of(AggSpec.col("Rec")))
        .extend("_depth", ColumnType.INTEGER, constVal(2));
    SqlStatement ss = d.compile(q);
    assertEquals("SELECT \"Title\", CAST(SUM(CAST(? AS BIGINT)) AS BIGINT) AS \"Rec\", CAST(? AS BIGINT) AS \"_depth\""
        + " FROM \"barttest\" WHERE (\"JobFamily\" = CAST(? AS VARCHAR)) GROUP BY \"Title\"", ss.sql());
    assertEquals(List.of(new Bind(1L, ColumnType.INTEGER), new Bind(2L, ColumnType.INTEGER),
        new Bind("Executive Management", ColumnType.TEXT)), ss.binds());
  }

  @Test
  void aggregateOfBoundValueRepeatsItsBinds() {
    QueryExp q = bart()
        .extend("Label", ColumnType.TEXT, constVal("x"))
        .groupBy(List.of("JobFamily"), List.of(AggSpec.col("Label")));
    SqlStatement ss = d.compile(q);
    assertTrue(ss.sql().contains("CASE WHEN MIN(CAST(? AS VARCHAR)) = MAX(CAST(? AS VARCHAR)) THEN MIN(CAST(? AS VARCHAR))"),
        ss.sql());
    assertEquals(3, ss.binds().size());
  }

  @Test
  void groupingOnBoundValueUsesDerivedTable() {
    QueryExp q = bart()
        .extend("Bucket", ColumnType.TEXT, constVal("all"))
        .groupBy(List.of("Bucket"), "TCOE");
    SqlStatement ss = d.compile(q);
    assertEquals("SELECT \"Bucket\", CAST(SUM(\"TCOE\") AS BIGINT) AS \"TCOE\" FROM (SELECT " + COLS
        + ", CAST(? AS VARCHAR) AS \"Bucket\" FROM \"barttest\") t0 GROUP BY \"Bucket\"", ss.sql());
  }

  @Test
  void filterOverAggregateUsesDerivedTable() {
    QueryExp q = bart().groupBy(List.of("JobFamily"), "TCOE").filter(gt(col("TCOE"), constVal(700000)));
    String sql = d.compile(q).sql();
    assertTrue(sql.startsWith("SELECT \"JobFamily\", \"TCOE\" FROM (SELECT \"JobFamily\", "), sql);
    assertTrue(sql.endsWith("GROUP BY \"JobFamily\") t0 WHERE (\"TCOE\" > CAST(? AS BIGINT))"), sql);
  }

  @Test
  void renamedColumnsCarryTheirOrdering() {
    SqlStatement ss = d.compile(bart().sort(SortKey.asc("Name"))
        .mapColumns(java.util.Map.of("Name", io.intellixity.reltab.query.ColumnMapInfo.rename("EmpName"))));
    assertTrue(ss.sql().contains("\"Name\" AS \"EmpName\""), ss.sql());
    assertTrue(ss.sql().endsWith("ORDER BY \"EmpName\" ASC NULLS FIRST"), ss.sql());
  }

  @Test
  void groupByRendersAggregates() {
    QueryExp q = bart().groupBy(List.of("JobFamily"),
        List.of(AggSpec.col("Title"), AggSpec.col("Base"), AggSpec.of(AggFn.AVG, "TCOE"), AggSpec.of(AggFn.COUNT, "Name")));
    String sql = d.compile(q).sql();
    assertTrue(sql.contains("CASE WHEN MIN(\"Title\") = MAX(\"Title\") THEN MIN(\"Title\") ELSE NULL END AS \"Title\""), sql);
    assertTrue(sql.contains("CAST(SUM(\"Base\") AS BIGINT) AS \"Base\""), sql);
    assertTrue(sql.contains("AVG(CAST(\"TCOE\" AS DOUBLE PRECISION)) AS \"TCOE\""), sql);
    assertTrue(sql.contains("COUNT(\"Name\") AS \"Name\""), sql);
    assertTrue(sql.endsWith("GROUP BY \"JobFamily\""), sql);
    assertFalse(sql.contains("ORDER BY"), sql);
  }

  @Test
  void concatIsUnionAll() {
    QueryExp a = bart().filter(eq("JobFamily", "Executive Management"));
    QueryExp b = bart().filter(eq("JobFamily", "Safety"));
    SqlStatement ss = d.compile(a.concat(b));
    assertEquals(TABLE_SQL + " WHERE (\"JobFamily\" = CAST(? AS VARCHAR)) UNION ALL "
        + TABLE_SQL + " WHERE (\"JobFamily\" = CAST(? AS VARCHAR))", ss.sql());
    assertEquals(List.of(new Bind("Executive Management", ColumnType.TEXT), new Bind("Safety", ColumnType.TEXT)),
        ss.binds());
  }

  @Test
  void concatChainIsOneUnionList() {
    QueryExp q = bart();
    for (String family : List.of("Executive Management", "Safety", "Police", "Legal & Paralegal")) {
      q = q.concat(bart().filter(eq("JobFamily", family)));
    }
    SqlStatement ss = d.compile(q.concat(bart().concat(bart())));
    assertEquals(7, ss.sql().split(" UNION ALL ", -1).length, ss.sql());
    assertFalse(ss.sql().contains("FROM ("), ss.sql());
    assertEquals(4, ss.binds().size());
  }

  @Test
  void concatUnderOtherNodesIsWrappedOnce() {
    QueryExp q = bart().concat(bart()).concat(bart()).filter(eq("Union", "ATU"));
    String sql = d.compile(q).sql();
    assertEquals("SELECT " + COLS + " FROM (" + TABLE_SQL + " UNION ALL " + TABLE_SQL + " UNION ALL " + TABLE_SQL
        + ") t0 WHERE (\"Union\" = CAST(? AS VARCHAR))", sql);
  }

  @Test
  void joinMatchesKeysNullSafely() {
    QueryExp left = bart().project("Name", "JobFamily");
    QueryExp right = bart().groupBy(List.of("JobFamily"), "TCOE");
    String sql = d.compile(left.join(right, List.of("JobFamily"))).sql();
    assertEquals("SELECT t0.\"JobFamily\", t0.\"Name\", t1.\"TCOE\""
        + " FROM (SELECT \"Name\", \"JobFamily\" FROM \"barttest\") t0"
        + " LEFT OUTER JOIN (SELECT \"JobFamily\", CAST(SUM(\"TCOE\") AS BIGINT) AS \"TCOE\" FROM \"barttest\" GROUP BY \"JobFamily\") t1"
        + " ON t0.\"JobFamily\" IS NOT DISTINCT FROM t1.\"JobFamily\"", sql);
  }

  @Test
  void filterOverJoinUsesQualifiedColumns() {
    QueryExp left = bart().project("Name", "JobFamily");
    QueryExp right = bart().groupBy(List.of("JobFamily"), "TCOE");
    String sql = d.compile(left.join(right, List.of("JobFamily")).filter(eq("JobFamily", "Safety"))).sql();
    assertTrue(sql.endsWith(" WHERE (t0.\"JobFamily\" = CAST(? AS VARCHAR))"), sql);
  }

  @Test
  void rowNumberOrdersInsideWindow() {
    String sql = d.compile(bart().rowNumber("rank", List.of(SortKey.desc("TCOE")))).sql();
    assertEquals("SELECT " + COLS + ", ROW_NUMBER() OVER (ORDER BY \"TCOE\" DESC NULLS LAST) AS \"rank\" FROM \"barttest\"", sql);
  }

  @Test
  void rowNumberOverAggregateRanksAggregatedValues() {
    QueryExp q = bart().groupBy(List.of("JobFamily"), "TCOE")
        .rowNumber("rank", List.of(SortKey.desc("TCOE")))
        .project("JobFamily", "rank");
    String sql = d.compile(q).sql();
    assertEquals("SELECT \"JobFamily\", ROW_NUMBER() OVER (ORDER BY CAST(SUM(\"TCOE\") AS BIGINT) DESC NULLS LAST) AS \"rank\""
        + " FROM \"barttest\" GROUP BY \"JobFamily\"", sql);
  }

  @Test
  void divisionIsAlwaysReal() {
    String sql = d.compile(bart().extend("Ratio", ColumnType.REAL, div(col("TCOE"), col("Base")))).sql();
    assertTrue(sql.contains("(CAST(\"TCOE\" AS DOUBLE PRECISION) / \"Base\") AS \"Ratio\""), sql);
  }

  @Test
  void pagingUsesOffsetFetch() {
    SqlStatement ss = d.compile(bart().sort(SortKey.asc("Name")), new OffsetPage(10, 5));
    assertTrue(ss.sql().endsWith("ORDER BY \"Name\" ASC NULLS FIRST OFFSET 10 ROWS FETCH NEXT 5 ROWS ONLY"), ss.sql());
    SqlStatement unsorted = d.compile(bart(), new OffsetPage(0, 5));
    assertEquals("SELECT " + COLS + " FROM (" + TABLE_SQL + ") t0 OFFSET 0 ROWS FETCH NEXT 5 ROWS ONLY", unsorted.sql());
  }

  @Test
  void countWrapsTheQuery() {
    SqlStatement ss = d.compileCount(bart().filter(eq("Union", "ATU")).sort(SortKey.asc("Name")));
    assertTrue(ss.sql().startsWith("SELECT COUNT(1) FROM ("), ss.sql());
    assertTrue(ss.sql().endsWith(") reltab_count"), ss.sql());
    assertFalse(ss.sql().contains("ORDER BY"), ss.sql());
    assertEquals(1, ss.binds().size());
  }

  @Test
  void identifiersAreQuoted() {
    Schema s = Schema.builder().column("say \"hi\"", ColumnType.TEXT).build();
    assertEquals("SELECT \"say \"\"hi\"\"\" FROM \"odd\"\"table\"", d.compile(Queries.table("odd\"table", s)).sql());
  }

  @Test
  void identifierWithNulIsRejected() {
    Schema s = Schema.builder().column("Name", ColumnType.TEXT).build();
    assertThrows(CompileException.class, () -> d.compile(Queries.table("bad\0table", s)));
  }

  @Test
  void dialectsAreDiscoverable() {
    assertEquals("h2", SqlDialects.forId("h2").id());
    assertThrows(IllegalArgumentException.class, () -> SqlDialects.forId("oracle"));
  }
}
