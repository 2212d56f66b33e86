package com.mathgraph.node;

import java.util.List;

/**
 * An operation with two inputs, {@code a} and {@code b}, in the order written.
 */
public abstract sealed class BinaryOperation extends Operation
        permits Add, Subtract, Multiply, Divide, Power {
    private final Expr a;
    private final Expr b;

    protected BinaryOperation(Operator operator, Expr a, Expr b) {
        super(operator, a, b);
        this.a = a;
        this.b = b;
    }

    public final Expr a() {
        return a;
    }

    public final Expr b() {
        return b;
    }

    @Override
    public final List<Expr> inputs() {
        return List.of(a, b);
    }

    @Override
    public String toString() {
        return "(" + a + " " + operator().symbol() + " " + b + ")";
    }
}
