package io.intellixity.reltab.aggtree;

import io.intellixity.reltab.expr.Expr;
import io.intellixity.reltab.query.AggSpec;
import io.intellixity.reltab.query.ColumnMapInfo;
import io.intellixity.reltab.query.QueryBuildException;
import io.intellixity.reltab.query.QueryExp;
import io.intellixity.reltab.query.SortKey;
import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.util.*;

import static io.intellixity.reltab.expr.Exprs.*;

/**
 * Pivot-tree query synthesizer.
 *
 * <p>Given a base query and pivot columns {@code P = [p0..pk-1]}, builds the queries that render a
 * hierarchical pivot table. It holds no rows; every method returns a new {@link QueryExp}.</p>
 *
 * <p>All tree queries share one row schema: the base columns (base order, interior rows aggregated with
 * each column's default aggregation), then {@value #REC} (number of base rows under the node),
 * {@value #DEPTH} (0 for the root, d for a node at pivot level d, k+1 for leaf rows), {@value #PIVOT}
 * (the node's pivot value as text), {@value #IS_ROOT}, and {@code _path0.._path{k-1}} (the node's path,
 * null below its depth).</p>
 */
public final class AggTree {
  public static final String REC = "Rec";
  public static final String DEPTH = "_depth";
  public static final String PIVOT = "_pivot";
  public static final String IS_ROOT = "_isRoot";
  public static final String PATH_PREFIX = "_path";
  public static final String SORT_IDX_PREFIX = "_sortIdx";
  /** Join key marking tree rows deep enough to take a rank at a given depth. */
  static final String LEVEL_PREFIX = "_lvl";

  private final QueryExp baseQuery;
  private final List<String> pivotColumns;
  private final String leafColumn;
  private final boolean showRoot;
  private final boolean showLeafRows;
  private final List<SortKey> sortKey;
  private final Schema treeSchema;

  /**
   * @param leafColumn column shown as {@value #PIVOT} on leaf rows; may be null
   * @param sortKey    per-depth ordering of sibling nodes; empty orders siblings by pivot value
   * @throws QueryBuildException on unknown or duplicate pivot columns, an unknown leaf or sort column, or a
   *                             base column that collides with a reserved tree column
   */
  public AggTree(QueryExp baseQuery, List<String> pivotColumns, String leafColumn,
                 boolean showRoot, boolean showLeafRows, List<SortKey> sortKey) {
    this.baseQuery = Objects.requireNonNull(baseQuery, "baseQuery");
    this.pivotColumns = List.copyOf(Objects.requireNonNull(pivotColumns, "pivotColumns"));
    this.leafColumn = leafColumn;
    this.showRoot = showRoot;
    this.showLeafRows = showLeafRows;
    this.sortKey = List.copyOf(sortKey == null ? List.of() : sortKey);

    Schema base = baseQuery.schema();
    for (String c : base.columns()) {
      if (isReserved(c)) throw new QueryBuildException("pivot: base column '" + c + "' collides with a reserved tree column");
    }
    Set<String> seen = new HashSet<>();
    for (String p : this.pivotColumns) {
      if (!base.hasColumn(p)) throw new QueryBuildException("pivot: unknown pivot column '" + p + "'");
      if (!seen.add(p)) throw new QueryBuildException("pivot: duplicate pivot column '" + p + "'");
    }
    if (leafColumn != null && !base.hasColumn(leafColumn)) {
      throw new QueryBuildException("pivot: unknown leaf column '" + leafColumn + "'");
    }
    Set<String> sortCols = new HashSet<>();
    for (SortKey k : this.sortKey) {
      if (!base.hasColumn(k.column()) && !REC.equals(k.column())) {
        throw new QueryBuildException("pivot: sort column '" + k.column() + "' is not a column of the tree rows");
      }
      if (!sortCols.add(k.column())) throw new QueryBuildException("pivot: duplicate sort column '" + k.column() + "'");
    }

    Schema.Builder b = Schema.builder().columns(base)
        .column(REC, ColumnType.INTEGER)
        .column(DEPTH, ColumnType.INTEGER)
        .column(PIVOT, ColumnType.TEXT)
        .column(IS_ROOT, ColumnType.BOOLEAN);
    for (int i = 0; i < this.pivotColumns.size(); i++) {
      b.column(pathColumn(i), base.columnType(this.pivotColumns.get(i)));
    }
    this.treeSchema = b.build();
  }

  public QueryExp baseQuery() { return baseQuery; }
  public List<String> pivotColumns() { return pivotColumns; }
  public String leafColumn() { return leafColumn; }
  public boolean showRoot() { return showRoot; }
  public boolean showLeafRows() { return showLeafRows; }
  public List<SortKey> sortKey() { return sortKey; }

  /** Row schema shared by {@link #rootQuery()}, {@link #applyPath(List)} and {@link #getTreeQuery(PathTree)}. */
  public Schema treeSchema() { return treeSchema; }

  public static String pathColumn(int depth) { return PATH_PREFIX + depth; }

  public static String sortIdxColumn(int depth) { return SORT_IDX_PREFIX + depth; }

  /** Single row aggregating every base row. */
  public QueryExp rootQuery() {
    Schema base = baseQuery.schema();
    QueryExp q = withRec(baseQuery).groupBy(List.of(), aggsExcept(base, null));
    q = q.extend(DEPTH, ColumnType.INTEGER, constVal(0L))
        .extend(PIVOT, ColumnType.TEXT, nullOf(ColumnType.TEXT))
        .extend(IS_ROOT, ColumnType.BOOLEAN, constVal(true));
    for (int i = 0; i < pivotColumns.size(); i++) {
      q = q.extend(pathColumn(i), pathType(i), nullOf(pathType(i)));
    }
    return q.project(treeSchema.columns());
  }

  /**
   * Rows directly below {@code path}: one aggregated row per distinct value of the next pivot column, or,
   * when the path names a node at the deepest pivot level, its leaf rows (none if leaf rows are hidden).
   *
   * @throws QueryBuildException if the path is longer than the pivot column list
   */
  public QueryExp applyPath(List<?> path) {
    Objects.requireNonNull(path, "path");
    int depth = path.size();
    int k = pivotColumns.size();
    if (depth > k) {
      throw new QueryBuildException("pivot: path " + path + " is deeper than the " + k + " pivot columns");
    }
    Schema base = baseQuery.schema();

    QueryExp q = baseQuery;
    for (int i = 0; i < depth; i++) {
      String p = pivotColumns.get(i);
      Object v = path.get(i);
      q = q.filter(v == null ? isNull(col(p)) : eq(col(p), constVal(v, pathType(i))));
    }
    q = withRec(q);

    if (depth < k) {
      String p = pivotColumns.get(depth);
      q = q.groupBy(List.of(p), aggsExcept(base, p))
          .extend(DEPTH, ColumnType.INTEGER, constVal((long) depth + 1))
          .extend(PIVOT, ColumnType.TEXT, toText(col(p)))
          .extend(IS_ROOT, ColumnType.BOOLEAN, constVal(false));
      for (int i = 0; i < k; i++) {
        Expr v;
        if (i < depth) v = constVal(path.get(i), pathType(i));
        else if (i == depth) v = col(p);
        else v = nullOf(pathType(i));
        q = q.extend(pathColumn(i), pathType(i), v);
      }
      return q.project(treeSchema.columns());
    }

    q = q.extend(DEPTH, ColumnType.INTEGER, constVal((long) k + 1))
        .extend(PIVOT, ColumnType.TEXT, leafColumn == null ? nullOf(ColumnType.TEXT) : toText(col(leafColumn)))
        .extend(IS_ROOT, ColumnType.BOOLEAN, constVal(false));
    for (int i = 0; i < k; i++) {
      q = q.extend(pathColumn(i), pathType(i), constVal(path.get(i), pathType(i)));
    }
    if (!showLeafRows) q = q.filter(constVal(false));
    return q.project(treeSchema.columns());
  }

  /**
   * Rank of every node at {@code depth} under the configured sort key.
   *
   * <p>Schema: {@code _path0.._path{depth-1}, _sortIdx{depth}}. Ties on the sort key fall back to pivot
   * value order, so ranks are deterministic. The rank is materialized as a column because row order does not
   * survive the joins and unions of the tree query.</p>
   */
  public QueryExp getSortQuery(int depth) {
    int k = pivotColumns.size();
    if (depth < 1 || depth > k) throw new QueryBuildException("pivot: sort depth " + depth + " outside 1.." + k);
    List<String> groupCols = pivotColumns.subList(0, depth);

    List<AggSpec> aggs = new ArrayList<>();
    for (SortKey sk : sortKey) {
      if (!groupCols.contains(sk.column())) aggs.add(AggSpec.col(sk.column()));
    }
    QueryExp q = withRec(baseQuery).groupBy(groupCols, aggs);

    Map<String, ColumnMapInfo> renames = new LinkedHashMap<>();
    for (int i = 0; i < depth; i++) {
      renames.put(groupCols.get(i), ColumnMapInfo.rename(pathColumn(i)));
    }
    q = q.mapColumns(renames);

    List<SortKey> keys = new ArrayList<>();
    Set<String> used = new HashSet<>();
    for (SortKey sk : sortKey) {
      int gi = groupCols.indexOf(sk.column());
      SortKey key = gi >= 0 ? sk.withColumn(pathColumn(gi)) : sk;
      if (used.add(key.column())) keys.add(key);
    }
    List<String> out = new ArrayList<>();
    for (int i = 0; i < depth; i++) {
      String pc = pathColumn(i);
      out.add(pc);
      if (used.add(pc)) keys.add(SortKey.asc(pc));
    }
    String idx = sortIdxColumn(depth);
    out.add(idx);
    return q.rowNumber(idx, keys).project(out).sort(SortKey.asc(idx));
  }

  /**
   * Flat tree for {@code openPaths}: the root row (if shown), the root's children, and the children of every
   * open node. With the root closed the tree is the root row alone, whatever {@code showRoot} says.
   * Row order is unspecified; see {@link #getSortedTreeQuery(PathTree)}.
   */
  public QueryExp getTreeQuery(PathTree openPaths) {
    Objects.requireNonNull(openPaths, "openPaths");
    if (!openPaths.isOpen(List.of())) return rootQuery();
    QueryExp q = applyPath(List.of());
    if (showRoot) q = rootQuery().concat(q);
    for (List<Object> path : openPaths.openPaths()) {
      if (path.size() > pivotColumns.size()) {
        throw new QueryBuildException("pivot: open path " + path + " is deeper than the pivot columns");
      }
      q = q.concat(applyPath(path));
    }
    return q;
  }

  /**
   * {@link #getTreeQuery(PathTree)} in display order: every node follows its parent and siblings follow the
   * sort key independently at each depth. Leaf rows follow their node, ordered by the sort key.
   * The schema is the tree schema plus {@code _sortIdx1.._sortIdx{k}}.
   */
  public QueryExp getSortedTreeQuery(PathTree openPaths) {
    QueryExp q = getTreeQuery(openPaths);
    int k = pivotColumns.size();
    List<String> out = new ArrayList<>(treeSchema.columns());
    List<SortKey> order = new ArrayList<>();
    for (int d = 1; d <= k; d++) {
      // rows above depth d keep a null rank even when a null pivot value matches their path
      String level = LEVEL_PREFIX + d;
      List<String> on = new ArrayList<>(d + 1);
      for (int i = 0; i < d; i++) on.add(pathColumn(i));
      on.add(level);
      q = q.extend(level, ColumnType.BOOLEAN, ge(col(DEPTH), constVal((long) d)))
          .join(getSortQuery(d).extend(level, ColumnType.BOOLEAN, constVal(true)), on);
      out.add(sortIdxColumn(d));
      order.add(SortKey.asc(sortIdxColumn(d)));
    }
    order.add(SortKey.asc(DEPTH));
    order.addAll(sortKey);
    return q.project(out).sort(order);
  }

  private ColumnType pathType(int i) {
    return baseQuery.schema().columnType(pivotColumns.get(i));
  }

  private static QueryExp withRec(QueryExp q) {
    return q.extend(REC, ColumnType.INTEGER, constVal(1L));
  }

  /** Default aggregation for every base column except {@code groupCol}, then {@value #REC}. */
  private static List<AggSpec> aggsExcept(Schema base, String groupCol) {
    List<AggSpec> aggs = new ArrayList<>();
    for (String c : base.columns()) {
      if (!c.equals(groupCol)) aggs.add(AggSpec.col(c));
    }
    aggs.add(AggSpec.col(REC));
    return aggs;
  }

  private static boolean isReserved(String c) {
    return c.equals(REC) || c.equals(DEPTH) || c.equals(PIVOT) || c.equals(IS_ROOT)
        || c.startsWith(PATH_PREFIX) || c.startsWith(SORT_IDX_PREFIX) || c.startsWith(LEVEL_PREFIX);
  }
}
