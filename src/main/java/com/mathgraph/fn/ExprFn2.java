package com.mathgraph.fn;

import com.mathgraph.node.Expr;

/**
 * A formula of two variables.
 *
 * <p>
 * Example: {@code (x, y) -> x.times(y).plus(x)}
 */
@FunctionalInterface
public interface ExprFn2 {
    Expr apply(Expr a, Expr b);
}
