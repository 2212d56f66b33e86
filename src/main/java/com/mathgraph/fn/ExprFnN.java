package com.mathgraph.fn;

import com.mathgraph.node.Expr;

/**
 * A formula of any number of variables. The array holds one input per
 * declared name, in declaration order.
 */
@FunctionalInterface
public interface ExprFnN {
    Expr apply(Expr[] inputs);
}
