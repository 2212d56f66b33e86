package com.mathgraph.dsl;

import com.mathgraph.node.Add;
import com.mathgraph.node.Constant;
import com.mathgraph.node.Divide;
import com.mathgraph.node.Expr;
import com.mathgraph.node.Log;
import com.mathgraph.node.Multiply;
import com.mathgraph.node.Operator;
import com.mathgraph.node.Power;
import com.mathgraph.node.Subtract;

/**
 * Free arithmetic functions over expressions.
 *
 * <p>
 * Complements the instance methods on {@link Expr} for the case where the raw
 * number is written first:
 *
 * <pre>{@code
 * import static com.mathgraph.dsl.Ops.*;
 *
 * Expr f = sub(3, y);      // Subtract(Constant 3, y)
 * Expr g = add(x, 2);      // Add(x, Constant 2)
 * }</pre>
 *
 * Raw numbers are promoted to {@link Constant} on either side. Nothing is
 * folded: {@code add(2, 3)} is an Add node, not a Constant.
 */
public final class Ops {
    private Ops() {
        // Utility class
    }

    public static Expr add(Expr a, Expr b) {
        return new Add(a, b);
    }

    public static Expr add(double a, Expr b) {
        return new Add(new Constant(a), b);
    }

    public static Expr add(Expr a, double b) {
        return new Add(a, new Constant(b));
    }

    public static Expr sub(Expr a, Expr b) {
        return new Subtract(a, b);
    }

    public static Expr sub(double a, Expr b) {
        return new Subtract(new Constant(a), b);
    }

    public static Expr sub(Expr a, double b) {
        return new Subtract(a, new Constant(b));
    }

    public static Expr mul(Expr a, Expr b) {
        return new Multiply(a, b);
    }

    public static Expr mul(double a, Expr b) {
        return new Multiply(new Constant(a), b);
    }

    public static Expr mul(Expr a, double b) {
        return new Multiply(a, new Constant(b));
    }

    public static Expr div(Expr a, Expr b) {
        return new Divide(a, b);
    }

    public static Expr div(double a, Expr b) {
        return new Divide(new Constant(a), b);
    }

    public static Expr div(Expr a, double b) {
        return new Divide(a, new Constant(b));
    }

    public static Expr pow(Expr a, Expr b) {
        return new Power(a, b);
    }

    public static Expr pow(double a, Expr b) {
        return new Power(new Constant(a), b);
    }

    public static Expr pow(Expr a, double b) {
        return new Power(a, new Constant(b));
    }

    /** {@code 0 - a}. */
    public static Expr neg(Expr a) {
        return a.negate();
    }

    public static Expr log(Expr a) {
        return new Log(a);
    }

    public static Expr log(double a) {
        return new Log(new Constant(a));
    }

    /**
     * Dynamically typed construction. Each operand may be a {@link Number} or
     * an {@link Expr}.
     *
     * @throws com.mathgraph.error.ArityViolationException if the operand count
     *                                                     does not match the
     *                                                     operator.
     */
    public static Expr apply(Operator op, Object... operands) {
        return op.apply(operands);
    }
}
