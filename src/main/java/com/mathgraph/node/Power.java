package com.mathgraph.node;

import com.mathgraph.api.ExprVisitor;

/**
 * {@code a ^ b}. Both the base and the exponent may depend on inputs.
 */
public final class Power extends BinaryOperation {

    public Power(Expr a, Expr b) {
        super(Operator.POWER, a, b);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitPower(this);
    }
}
