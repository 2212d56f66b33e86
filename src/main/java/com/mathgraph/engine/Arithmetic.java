package com.mathgraph.engine;

import com.mathgraph.error.DivisionByZeroException;
import com.mathgraph.error.DomainException;
import com.mathgraph.node.Constant;
import com.mathgraph.node.Expr;
import com.mathgraph.node.Operator;

/**
 * Numeric kernel shared by evaluation and constant folding.
 *
 * <p>
 * {@link #combine(Operator, Expr, Expr)} is the "arithmetic combination" step:
 * two constants collapse to a constant holding the result, anything else is
 * rebuilt structurally.
 */
public final class Arithmetic {
    private Arithmetic() {
        // Utility class
    }

    /**
     * Combines two already reduced operands.
     *
     * @return A {@link Constant} if both operands are constants, otherwise a new
     *         node of kind {@code op} over {@code a} and {@code b}.
     */
    public static Expr combine(Operator op, Expr a, Expr b) {
        if (a instanceof Constant ca && b instanceof Constant cb)
            return new Constant(apply(op, ca.value(), cb.value()));
        return op.create(a, b);
    }

    /**
     * Natural log of an operand, folded when the operand is a constant.
     */
    public static Expr log(Expr a) {
        if (a instanceof Constant c)
            return new Constant(log(c.value()));
        return Operator.LOG.create(a);
    }

    public static double apply(Operator op, double a, double b) {
        return switch (op) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> divide(a, b);
            case POWER -> pow(a, b);
            case LOG -> throw new IllegalArgumentException("LOG is unary");
        };
    }

    public static double divide(double a, double b) {
        if (b == 0.0)
            throw new DivisionByZeroException(a);
        return a / b;
    }

    public static double pow(double base, double exponent) {
        double r = Math.pow(base, exponent);
        if (Double.isNaN(r) && !Double.isNaN(base) && !Double.isNaN(exponent))
            throw new DomainException("Power undefined for " + base + " ^ " + exponent);
        return r;
    }

    public static double log(double v) {
        if (!(v > 0.0))
            throw new DomainException("Logarithm of non-positive value: " + v);
        return Math.log(v);
    }
}
