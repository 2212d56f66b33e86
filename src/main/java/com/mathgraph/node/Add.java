package com.mathgraph.node;

import com.mathgraph.api.ExprVisitor;

public final class Add extends BinaryOperation {

    public Add(Expr a, Expr b) {
        super(Operator.ADD, a, b);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAdd(this);
    }
}
