package com.mathgraph.engine;

import com.mathgraph.api.ExprVisitor;
import com.mathgraph.node.Add;
import com.mathgraph.node.Constant;
import com.mathgraph.node.Divide;
import com.mathgraph.node.Expr;
import com.mathgraph.node.Input;
import com.mathgraph.node.Log;
import com.mathgraph.node.Multiply;
import com.mathgraph.node.Operator;
import com.mathgraph.node.Power;
import com.mathgraph.node.Subtract;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Substitutes bound inputs and folds constant sub-results.
 *
 * <p>
 * Children are always evaluated before the parent's identity short-circuits
 * are checked. Unbound inputs are left in place (partial evaluation), so the
 * result is a {@link Constant} exactly when every reachable input is bound.
 *
 * <p>
 * An evaluator instance is tied to one set of bindings and may be reused for
 * several expressions. Results are cached by node identity, so a subgraph
 * shared by several parents is evaluated once and its result stays shared.
 * Not thread-safe.
 */
public final class Evaluator implements ExprVisitor<Expr> {
    private final Map<String, Expr> bindings;
    private final Map<Expr, Expr> done = new IdentityHashMap<>();

    /**
     * @param bindings Input name to a {@link Number} or an {@link Expr}.
     * @throws IllegalArgumentException if a binding has any other type.
     */
    public Evaluator(Map<String, ?> bindings) {
        Map<String, Expr> coerced = new HashMap<>(bindings.size() * 2);
        for (Map.Entry<String, ?> e : bindings.entrySet())
            coerced.put(e.getKey(), Expr.of(e.getValue()));
        this.bindings = coerced;
    }

    public Expr evaluate(Expr node) {
        Expr cached = done.get(node);
        if (cached != null)
            return cached;
        Expr result = node.accept(this);
        done.put(node, result);
        return result;
    }

    @Override
    public Expr visitConstant(Constant node) {
        return node;
    }

    @Override
    public Expr visitInput(Input node) {
        Expr bound = bindings.get(node.name());
        return bound != null ? bound : node;
    }

    @Override
    public Expr visitAdd(Add node) {
        Expr a = evaluate(node.a());
        Expr b = evaluate(node.b());
        if (Constant.isZero(a))
            return b;
        if (Constant.isZero(b))
            return a;
        return Arithmetic.combine(Operator.ADD, a, b);
    }

    @Override
    public Expr visitSubtract(Subtract node) {
        return Arithmetic.combine(Operator.SUBTRACT, evaluate(node.a()), evaluate(node.b()));
    }

    @Override
    public Expr visitMultiply(Multiply node) {
        Expr a = evaluate(node.a());
        Expr b = evaluate(node.b());
        if (Constant.isZero(a) || Constant.isZero(b))
            return Constant.ZERO;
        if (Constant.isOne(a))
            return b;
        if (Constant.isOne(b))
            return a;
        return Arithmetic.combine(Operator.MULTIPLY, a, b);
    }

    @Override
    public Expr visitDivide(Divide node) {
        return Arithmetic.combine(Operator.DIVIDE, evaluate(node.a()), evaluate(node.b()));
    }

    @Override
    public Expr visitPower(Power node) {
        Expr exponent = evaluate(node.b());
        if (Constant.isZero(exponent))
            return Constant.ONE;
        Expr base = evaluate(node.a());
        if (Constant.isOne(exponent))
            return base;
        return Arithmetic.combine(Operator.POWER, base, exponent);
    }

    /**
     * Folds a constant operand (domain checked); an unresolved operand keeps
     * its Log, so {@code log(x + y)} with only {@code x} bound stays a Log.
     */
    @Override
    public Expr visitLog(Log node) {
        return Arithmetic.log(evaluate(node.a()));
    }
}
