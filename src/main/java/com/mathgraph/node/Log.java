package com.mathgraph.node;

import com.mathgraph.api.ExprVisitor;

import java.util.List;

/**
 * Natural logarithm. The only unary operation.
 */
public final class Log extends Operation {
    private final Expr a;

    public Log(Expr a) {
        super(Operator.LOG, a);
        this.a = a;
    }

    public Expr a() {
        return a;
    }

    @Override
    public List<Expr> inputs() {
        return List.of(a);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLog(this);
    }

    @Override
    public String toString() {
        return "log(" + a + ")";
    }
}
