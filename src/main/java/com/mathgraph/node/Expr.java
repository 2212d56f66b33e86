package com.mathgraph.node;

import com.mathgraph.api.ExprVisitor;
import com.mathgraph.engine.ExpressionEngine;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A node in an expression graph.
 *
 * This interface is the fundamental unit of the MathGraph model. Every element
 * of a formula -- a literal, a free variable, or an arithmetic operation --
 * implements it.
 *
 * Key Properties:
 *
 * 1. Immutability: A node never changes after construction. Evaluation,
 * simplification and differentiation all return new nodes, so a subtree may be
 * shared by any number of parents (the graph is a DAG, not necessarily a
 * tree).
 *
 * 2. Fixed Arity: Constants and Inputs have no inputs, Log has one, every other
 * operation has exactly two. The arity is fixed per variant.
 *
 * 3. Closed Hierarchy: The set of variants is sealed. Algorithms dispatch over
 * it with {@link ExprVisitor}, which has one method per variant, so the
 * compiler checks that every variant is handled.
 *
 * Construction:
 * The arithmetic methods ({@link #plus(Expr)}, {@link #times(double)}, ...)
 * build new operation nodes with the operands in the order written. A raw
 * number is promoted to a {@link Constant}. Nothing is folded or simplified at
 * construction time.
 */
public sealed interface Expr permits Constant, Input, Operation {

    /**
     * Promotes a raw value to a node.
     *
     * @param value A {@link Number} or an existing {@link Expr}.
     * @return The node itself, or a {@link Constant} holding the number.
     * @throws IllegalArgumentException for any other type.
     */
    static Expr of(Object value) {
        if (value instanceof Expr e)
            return e;
        if (value instanceof Number n)
            return new Constant(n.doubleValue());
        throw new IllegalArgumentException(
                "Cannot convert " + (value == null ? "null" : value.getClass().getName()) + " to an expression");
    }

    /**
     * Number of inputs this variant always has (0, 1 or 2).
     */
    int arity();

    /**
     * Returns the input in the given slot.
     *
     * @throws com.mathgraph.error.ArityViolationException if {@code slot} is
     *                                                     not below
     *                                                     {@link #arity()}.
     */
    Expr input(int slot);

    /**
     * Inputs in fixed slot order (a, then b). Empty for leaves.
     */
    default List<Expr> inputs() {
        return Collections.emptyList();
    }

    /**
     * Human-readable label: the variant name plus its distinguishing data,
     * e.g. {@code Constant: 5}, {@code Input: "x"}, {@code Add}.
     */
    String description();

    /**
     * Height of this node. Leaves have depth 1.
     */
    int depth();

    <R> R accept(ExprVisitor<R> visitor);

    // ── Construction ─────────────────────────────────────────────

    default Expr plus(Expr other) {
        return new Add(this, other);
    }

    default Expr plus(double other) {
        return new Add(this, new Constant(other));
    }

    default Expr minus(Expr other) {
        return new Subtract(this, other);
    }

    default Expr minus(double other) {
        return new Subtract(this, new Constant(other));
    }

    default Expr times(Expr other) {
        return new Multiply(this, other);
    }

    default Expr times(double other) {
        return new Multiply(this, new Constant(other));
    }

    default Expr dividedBy(Expr other) {
        return new Divide(this, other);
    }

    default Expr dividedBy(double other) {
        return new Divide(this, new Constant(other));
    }

    default Expr pow(Expr exponent) {
        return new Power(this, exponent);
    }

    default Expr pow(double exponent) {
        return new Power(this, new Constant(exponent));
    }

    /** Negation, built as {@code 0 - this}. */
    default Expr negate() {
        return new Subtract(Constant.ZERO, this);
    }

    default Expr log() {
        return new Log(this);
    }

    // ── Algorithms (default engine) ──────────────────────────────

    /**
     * Single bottom-up simplification pass.
     */
    default Expr simplified() {
        return ExpressionEngine.defaultEngine().simplify(this);
    }

    /**
     * Substitutes bound inputs and folds what can be folded.
     *
     * @param bindings Input name to a {@link Number} or an {@link Expr}.
     * @return A {@link Constant} when every reachable input is bound, otherwise
     *         a reduced expression over the unbound inputs.
     */
    default Expr evaluate(Map<String, ?> bindings) {
        return ExpressionEngine.defaultEngine().evaluate(this, bindings);
    }

    default Expr evaluate() {
        return evaluate(Collections.emptyMap());
    }

    /**
     * Symbolic partial derivative with respect to the named input. The result
     * is not simplified.
     */
    default Expr gradient(String name) {
        return ExpressionEngine.defaultEngine().gradient(this, name);
    }
}
