package com.mathgraph.node;

import com.mathgraph.api.ExprVisitor;
import com.mathgraph.error.ArityViolationException;

/**
 * A literal scalar.
 */
public final class Constant implements Expr {
    public static final Constant ZERO = new Constant(0.0);
    public static final Constant ONE = new Constant(1.0);

    private final double value;

    public Constant(double value) {
        this.value = value;
    }

    public double value() {
        return value;
    }

    public boolean isZero() {
        return value == 0.0;
    }

    public boolean isOne() {
        return value == 1.0;
    }

    /** True if {@code e} is a constant equal to zero. */
    public static boolean isZero(Expr e) {
        return e instanceof Constant c && c.isZero();
    }

    /** True if {@code e} is a constant equal to one. */
    public static boolean isOne(Expr e) {
        return e instanceof Constant c && c.isOne();
    }

    @Override
    public int arity() {
        return 0;
    }

    @Override
    public Expr input(int slot) {
        throw ArityViolationException.slot("Constant", 0, slot);
    }

    @Override
    public String description() {
        return "Constant: " + format(value);
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Constant c && Double.compare(value, c.value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return format(value);
    }

    /**
     * Formats a value without a trailing ".0" when it is integral.
     */
    static String format(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v) && Math.abs(v) < 1e15)
            return Long.toString((long) v);
        return Double.toString(v);
    }
}
