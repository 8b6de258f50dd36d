package io.intellixity.reltab.expr;

import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

/**
 * Scalar expression over the columns of one row.
 *
 * <p>Expressions are never interpreted by reltab itself; they are type checked against a schema when a
 * query node is built and rendered into the backing engine's statement by the compiler.</p>
 */
public interface Expr {
  /**
   * Result type when evaluated over rows of {@code schema}.
   *
   * @throws ExprTypeException on an unknown column or an operand type mismatch
   */
  ColumnType typeIn(Schema schema);

  /** Result type derivable without a schema, or null when it depends on column types. */
  ColumnType staticType();

  <R> R accept(ExprVisitor<R> visitor);
}
