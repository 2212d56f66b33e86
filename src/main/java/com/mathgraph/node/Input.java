package com.mathgraph.node;

import com.mathgraph.api.ExprVisitor;
import com.mathgraph.error.ArityViolationException;

import java.util.Objects;

/**
 * A free variable, bound by name at evaluation time.
 *
 * Construction is side-effect free: two inputs with the same name are equal and
 * interchangeable.
 */
public final class Input implements Expr {
    private final String name;

    public Input(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty())
            throw new IllegalArgumentException("Input name must not be empty");
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public int arity() {
        return 0;
    }

    @Override
    public Expr input(int slot) {
        throw ArityViolationException.slot("Input", 0, slot);
    }

    @Override
    public String description() {
        return "Input: \"" + name + "\"";
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitInput(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Input i && name.equals(i.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
