package com.mathgraph.node;

import com.mathgraph.api.ExprVisitor;

/**
 * {@code a / b}. A zero divisor only fails once both sides are constants.
 */
public final class Divide extends BinaryOperation {

    public Divide(Expr a, Expr b) {
        super(Operator.DIVIDE, a, b);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDivide(this);
    }
}
