package com.mathgraph.node;

import com.mathgraph.error.ArityViolationException;

/**
 * Base class for operator nodes.
 *
 * Depth and hash code are computed once at construction from the (already
 * computed) values of the inputs, so neither requires walking the graph.
 */
public abstract sealed class Operation implements Expr permits BinaryOperation, Log {
    private final Operator operator;
    private final int depth;
    private final int hash;

    protected Operation(Operator operator, Expr... inputs) {
        if (inputs.length != operator.arity())
            throw ArityViolationException.operands(operator.displayName(), operator.arity(), inputs.length);
        int d = 0;
        int h = operator.ordinal();
        for (Expr in : inputs) {
            if (in == null)
                throw new IllegalArgumentException(operator.displayName() + " input must not be null");
            d = Math.max(d, in.depth());
            h = 31 * h + in.hashCode();
        }
        this.operator = operator;
        this.depth = d + 1;
        this.hash = h;
    }

    public final Operator operator() {
        return operator;
    }

    @Override
    public final int arity() {
        return operator.arity();
    }

    @Override
    public final Expr input(int slot) {
        if (slot < 0 || slot >= arity())
            throw ArityViolationException.slot(operator.displayName(), arity(), slot);
        return inputs().get(slot);
    }

    @Override
    public String description() {
        return operator.displayName();
    }

    @Override
    public final int depth() {
        return depth;
    }

    @Override
    public final int hashCode() {
        return hash;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Operation other) || other.operator != operator || other.hash != hash)
            return false;
        return inputs().equals(other.inputs());
    }
}
