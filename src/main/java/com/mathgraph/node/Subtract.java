package com.mathgraph.node;

import com.mathgraph.api.ExprVisitor;

public final class Subtract extends BinaryOperation {

    public Subtract(Expr a, Expr b) {
        super(Operator.SUBTRACT, a, b);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSubtract(this);
    }
}
