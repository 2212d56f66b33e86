package com.mathgraph.engine;

import com.mathgraph.api.ExprVisitor;
import com.mathgraph.node.Add;
import com.mathgraph.node.BinaryOperation;
import com.mathgraph.node.Constant;
import com.mathgraph.node.Divide;
import com.mathgraph.node.Expr;
import com.mathgraph.node.Input;
import com.mathgraph.node.Log;
import com.mathgraph.node.Multiply;
import com.mathgraph.node.Operator;
import com.mathgraph.node.Power;
import com.mathgraph.node.Subtract;
import com.mathgraph.rewrite.RuleSet;

import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Single bottom-up simplification pass.
 *
 * <p>
 * Each operation simplifies its inputs first. If both simplified inputs are
 * constants they are folded into one constant; otherwise the operator's
 * {@link RuleSet} rewrites the node once. There is no fixpoint iteration.
 *
 * <p>
 * Log is simplified structurally only: its operand is simplified and the Log
 * is kept, constant or not.
 *
 * <p>
 * Each call to {@link #simplify(Expr)} runs one pass with its own result
 * cache keyed by node identity, so a subgraph shared by several parents is
 * simplified once and the result is shared the same way. The simplifier
 * itself holds only its rule sets and may be used from any thread.
 */
public final class Simplifier {
    private final Map<Operator, RuleSet> ruleSets;

    public Simplifier() {
        this(RuleSet.defaults());
    }

    /**
     * @param ruleSets Rules per binary operator. Operators without an entry are
     *                 only constant folded.
     */
    public Simplifier(Map<Operator, RuleSet> ruleSets) {
        Map<Operator, RuleSet> copy = new EnumMap<>(Operator.class);
        for (Operator op : Operator.values()) {
            if (op.arity() != 2)
                continue;
            RuleSet set = ruleSets.get(op);
            if (set != null && set.operator() != op)
                throw new IllegalArgumentException("Rule set for " + set.operator() + " registered under " + op);
            copy.put(op, set != null ? set : RuleSet.empty(op));
        }
        this.ruleSets = copy;
    }

    public Expr simplify(Expr node) {
        return new Pass().simplify(node);
    }

    private final class Pass implements ExprVisitor<Expr> {
        private final Map<Expr, Expr> done = new IdentityHashMap<>();

        Expr simplify(Expr node) {
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
            return node;
        }

        @Override
        public Expr visitAdd(Add node) {
            return binary(node);
        }

        @Override
        public Expr visitSubtract(Subtract node) {
            return binary(node);
        }

        @Override
        public Expr visitMultiply(Multiply node) {
            return binary(node);
        }

        @Override
        public Expr visitDivide(Divide node) {
            return binary(node);
        }

        @Override
        public Expr visitPower(Power node) {
            return binary(node);
        }

        @Override
        public Expr visitLog(Log node) {
            return new Log(simplify(node.a()));
        }

        private Expr binary(BinaryOperation node) {
            Expr a = simplify(node.a());
            Expr b = simplify(node.b());
            if (a instanceof Constant && b instanceof Constant)
                return Arithmetic.combine(node.operator(), a, b);
            return ruleSets.get(node.operator()).apply(a, b);
        }
    }
}
