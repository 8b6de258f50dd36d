package io.intellixity.reltab.query;

public interface QueryExpVisitor<R> {
  R visit(TableQuery q);
  R visit(ProjectQuery q);
  R visit(FilterQuery q);
  R visit(GroupByQuery q);
  R visit(SortQuery q);
  R visit(ExtendQuery q);
  R visit(MapColumnsQuery q);
  R visit(MapColumnsByIndexQuery q);
  R visit(ConcatQuery q);
  R visit(JoinQuery q);
  R visit(RowNumberQuery q);
}
