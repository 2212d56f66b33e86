package com.mathgraph.fn;

import com.mathgraph.node.Expr;

@FunctionalInterface
public interface ExprFn3 {
    Expr apply(Expr a, Expr b, Expr c);
}
