package com.mathgraph.engine;

import com.mathgraph.api.ExprVisitor;
import com.mathgraph.node.Add;
import com.mathgraph.node.Constant;
import com.mathgraph.node.Divide;
import com.mathgraph.node.Expr;
import com.mathgraph.node.Input;
import com.mathgraph.node.Log;
import com.mathgraph.node.Multiply;
import com.mathgraph.node.Power;
import com.mathgraph.node.Subtract;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the symbolic partial derivative with respect to one input.
 *
 * <p>
 * The result is a new, unsimplified graph that shares the original operands
 * where a rule reuses them. Nothing is evaluated.
 *
 * <p>
 * Derivatives are cached by node identity: a subgraph shared by several
 * parents is differentiated once and its derivative is shared in the result.
 * Not thread-safe; create one per derivative.
 */
public final class Differentiator implements ExprVisitor<Expr> {
    private static final Constant TWO = new Constant(2.0);

    private final String name;
    private final Map<Expr, Expr> done = new IdentityHashMap<>();

    public Differentiator(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Expr gradient(Expr node) {
        Expr cached = done.get(node);
        if (cached != null)
            return cached;
        Expr result = node.accept(this);
        done.put(node, result);
        return result;
    }

    @Override
    public Expr visitConstant(Constant node) {
        return Constant.ZERO;
    }

    @Override
    public Expr visitInput(Input node) {
        return node.name().equals(name) ? Constant.ONE : Constant.ZERO;
    }

    @Override
    public Expr visitAdd(Add node) {
        return new Add(gradient(node.a()), gradient(node.b()));
    }

    @Override
    public Expr visitSubtract(Subtract node) {
        return new Subtract(gradient(node.a()), gradient(node.b()));
    }

    @Override
    public Expr visitMultiply(Multiply node) {
        // d(ab) = a b' + a' b
        Expr a = node.a();
        Expr b = node.b();
        return new Add(new Multiply(a, gradient(b)), new Multiply(gradient(a), b));
    }

    @Override
    public Expr visitDivide(Divide node) {
        // d(a/b) = (a' b - a b') / b^2
        Expr a = node.a();
        Expr b = node.b();
        return new Divide(
                new Subtract(new Multiply(gradient(a), b), new Multiply(a, gradient(b))),
                new Power(b, TWO));
    }

    @Override
    public Expr visitPower(Power node) {
        // d(a^b) = a^(b-1) (b a' + a log(a) b')
        Expr a = node.a();
        Expr b = node.b();
        return new Multiply(
                new Power(a, new Subtract(b, Constant.ONE)),
                new Add(
                        new Multiply(b, gradient(a)),
                        new Multiply(new Multiply(a, new Log(a)), gradient(b))));
    }

    @Override
    public Expr visitLog(Log node) {
        return new Divide(gradient(node.a()), node.a());
    }
}
