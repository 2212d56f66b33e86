package com.mathgraph.node;

import com.mathgraph.api.ExprVisitor;

public final class Multiply extends BinaryOperation {

    public Multiply(Expr a, Expr b) {
        super(Operator.MULTIPLY, a, b);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMultiply(this);
    }
}
