package io.intellixity.reltab.query;

import io.intellixity.reltab.expr.ExprTypeException;
import io.intellixity.reltab.schema.ColumnMetadata;
import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.reltab.expr.Exprs.*;
import static io.intellixity.reltab.query.BartSchemas.bart;
import static org.junit.jupiter.api.Assertions.*;

final class QueryExpTest {
  private static final List<String> PCOLS = List.of("JobFamily", "Title", "Union", "Name", "Base", "TCOE");

  @Test
  void projectReordersColumns() {
    QueryExp q = bart().project(PCOLS);
    assertEquals(PCOLS, q.schema().columns());
    assertEquals(ColumnType.INTEGER, q.schema().columnType("Base"));
  }

  @Test
  void projectRejectsUnknownEmptyAndDuplicateColumns() {
    assertThrows(QueryBuildException.class, () -> bart().project("Salary"));
    assertThrows(QueryBuildException.class, () -> bart().project(List.of()));
    assertThrows(QueryBuildException.class, () -> bart().project("Name", "Name"));
  }

  @Test
  void filterKeepsSchemaAndChecksPredicate() {
    QueryExp q = bart().filter(eq("JobFamily", "Executive Management"));
    assertEquals(bart().schema(), q.schema());
    assertThrows(QueryBuildException.class, () -> bart().filter(eq("Dept", "x")));
    assertThrows(ExprTypeException.class, () -> bart().filter(col("Base")));
    assertThrows(ExprTypeException.class, () -> bart().filter(eq(col("Name"), constVal(1))));
  }

  @Test
  void groupBySchemaIsGroupColumnsThenAggregates() {
    QueryExp q = bart().groupBy(List.of("JobFamily"), "Base", "TCOE");
    assertEquals(List.of("JobFamily", "Base", "TCOE"), q.schema().columns());
    assertEquals(ColumnType.INTEGER, q.schema().columnType("TCOE"));
  }

  @Test
  void groupByDefaultsAndResultTypes() {
    GroupByQuery q = (GroupByQuery) bart().groupBy(List.of("JobFamily"),
        List.of(AggSpec.col("Title"), AggSpec.col("Base"), AggSpec.of(AggFn.AVG, "TCOE")));
    assertEquals(List.of(AggSpec.of(AggFn.UNIQ, "Title"), AggSpec.of(AggFn.SUM, "Base"), AggSpec.of(AggFn.AVG, "TCOE")),
        q.aggs());
    assertEquals(ColumnType.REAL, q.schema().columnType("TCOE"));
    assertEquals(ColumnType.INTEGER,
        bart().groupBy(List.of(), List.of(AggSpec.of(AggFn.COUNT, "Name"))).schema().columnType("Name"));
  }

  @Test
  void groupByRejectsBadAggregates() {
    assertThrows(QueryBuildException.class, () -> bart().groupBy(List.of("JobFamily"), List.of(AggSpec.of(AggFn.SUM, "Name"))));
    assertThrows(QueryBuildException.class, () -> bart().groupBy(List.of("JobFamily"), "JobFamily"));
    assertThrows(QueryBuildException.class, () -> bart().groupBy(List.of("Dept"), "Base"));
  }

  @Test
  void sortValidatesKeys() {
    QueryExp q = bart().sort(SortKey.desc("TCOE"), SortKey.asc("Name"));
    assertEquals(bart().schema(), q.schema());
    assertThrows(QueryBuildException.class, () -> bart().sort(List.of()));
    assertThrows(QueryBuildException.class, () -> bart().sort(SortKey.asc("Salary")));
    assertThrows(QueryBuildException.class, () -> bart().sort(SortKey.asc("Name"), SortKey.desc("Name")));
  }

  @Test
  void extendAppendsTypedColumn() {
    QueryExp q = bart().extend("ExtraComp", ColumnType.INTEGER, sub(col("TCOE"), col("Base")));
    assertEquals("ExtraComp", q.schema().columns().get(q.schema().size() - 1));
    assertEquals(ColumnType.INTEGER, q.schema().columnType("ExtraComp"));

    QueryExp r = bart().extend("Ratio", new ColumnMetadata(ColumnType.REAL, "TCOE / Base"), div(col("TCOE"), col("Base")));
    assertEquals("TCOE / Base", r.schema().displayName("Ratio"));
  }

  @Test
  void extendRejectsCollisionsAndTypeMismatch() {
    assertThrows(QueryBuildException.class, () -> bart().extend("Base", ColumnType.INTEGER, constVal(1)));
    assertThrows(ExprTypeException.class, () -> bart().extend("X", ColumnType.TEXT, col("Base")));
    assertThrows(QueryBuildException.class, () -> bart().extend("X", ColumnType.INTEGER, col("Salary")));
  }

  @Test
  void extendWidensIntegerToReal() {
    QueryExp q = bart().extend("BaseReal", ColumnType.REAL, col("Base"));
    assertEquals(ColumnType.REAL, q.schema().columnType("BaseReal"));
  }

  @Test
  void mapColumnsRenamesAndRelabels() {
    QueryExp q = bart().project(PCOLS)
        .mapColumns(Map.of("Name", new ColumnMapInfo("EmpName", "Employee Name")));
    Schema s = q.schema();
    assertEquals(List.of("JobFamily", "Title", "Union", "EmpName", "Base", "TCOE"), s.columns());
    assertEquals(new ColumnMetadata(ColumnType.TEXT, "Employee Name"), s.metadata("EmpName"));
  }

  @Test
  void mapColumnsByIndex() {
    QueryExp q = bart().project(PCOLS).mapColumnsByIndex(Map.of(0, ColumnMapInfo.rename("Family")));
    assertEquals("Family", q.schema().columns().get(0));
    assertEquals("JobFamily", q.schema().displayName("Family"));
    assertThrows(QueryBuildException.class,
        () -> bart().mapColumnsByIndex(Map.of(6, ColumnMapInfo.rename("x"))));
  }

  @Test
  void mapColumnsRejectsUnknownAndCollidingIds() {
    assertThrows(QueryBuildException.class, () -> bart().mapColumns(Map.of("Salary", ColumnMapInfo.rename("S"))));
    assertThrows(QueryBuildException.class, () -> bart().mapColumns(Map.of("Name", ColumnMapInfo.rename("Title"))));
  }

  @Test
  void concatRequiresCompatibleSchemas() {
    QueryExp a = bart().filter(eq("JobFamily", "Executive Management"));
    QueryExp b = bart().filter(eq("JobFamily", "Safety"));
    assertEquals(bart().schema(), a.concat(b).schema());
    assertThrows(QueryBuildException.class, () -> a.concat(bart().project(PCOLS)));
  }

  @Test
  void joinSchemaIsKeysThenLeftThenRight() {
    QueryExp left = bart().project("Name", "JobFamily", "Base");
    QueryExp right = bart().groupBy(List.of("JobFamily"), List.of(AggSpec.of(AggFn.SUM, "TCOE")));
    QueryExp j = left.join(right, List.of("JobFamily"));
    assertEquals(List.of("JobFamily", "Name", "Base", "TCOE"), j.schema().columns());
    assertEquals(JoinType.LEFT_OUTER, ((JoinQuery) j).joinType());
  }

  @Test
  void joinRejectsBadKeysAndOverlap() {
    QueryExp left = bart().project("Name", "JobFamily", "Base");
    assertThrows(QueryBuildException.class, () -> left.join(bart(), List.of()));
    assertThrows(QueryBuildException.class, () -> left.join(bart().project("Title"), List.of("JobFamily")));
    assertThrows(QueryBuildException.class, () -> left.join(bart().project("JobFamily", "Base"), List.of("JobFamily")));
    QueryExp typed = bart().mapColumns(Map.of("JobFamily", ColumnMapInfo.rename("Fam")))
        .extend("JobFamily", ColumnType.INTEGER, constVal(1)).project("JobFamily", "Title");
    assertThrows(QueryBuildException.class, () -> left.join(typed, List.of("JobFamily")));
  }

  @Test
  void rowNumberAppendsIntegerColumn() {
    QueryExp q = bart().rowNumber("rank", List.of(SortKey.desc("TCOE")));
    assertEquals(ColumnType.INTEGER, q.schema().columnType("rank"));
    assertThrows(QueryBuildException.class, () -> bart().rowNumber("Name", List.of(SortKey.desc("TCOE"))));
  }

  @Test
  void structurallyEqualTreesAreEqual() {
    QueryExp a = bart().project(PCOLS).filter(gt(col("Base"), constVal(100000)));
    QueryExp b = bart().project(PCOLS).filter(gt(col("Base"), constVal(100000L)));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }
}
