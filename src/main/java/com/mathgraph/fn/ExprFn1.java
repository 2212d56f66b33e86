package com.mathgraph.fn;

import com.mathgraph.node.Expr;

/**
 * A formula of one variable, written with the expression DSL.
 *
 * <p>
 * Example: {@code x -> x.pow(2).plus(1)}
 */
@FunctionalInterface
public interface ExprFn1 {
    Expr apply(Expr a);
}
