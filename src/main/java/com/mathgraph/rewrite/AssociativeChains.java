package com.mathgraph.rewrite;

import com.mathgraph.engine.Arithmetic;
import com.mathgraph.node.BinaryOperation;
import com.mathgraph.node.Constant;
import com.mathgraph.node.Expr;
import com.mathgraph.node.Operator;

/**
 * Canonicalization rules shared by the associative operators (Add, Multiply).
 *
 * <p>
 * A "chain" is a node {@code x op k} whose right operand is a constant. The
 * rules keep such constants at the outermost position so that consecutive
 * constants meet and fold:
 *
 * <pre>
 * x     2                            x     y
 *  \   /                              \   /
 *   op     3   --&gt;  x op (2 op 3)      op     2
 *      \   /                              \   /
 *       op                                 op
 *  (fold-trailing-constant)        (lower-trailing-constant, from (x op 2) op y)
 * </pre>
 */
final class AssociativeChains {
    private AssociativeChains() {
        // Utility class
    }

    /** {@code (x op k) op c -> x op (k op c)}, either operand order. */
    static RewriteRule foldTrailingConstant(Operator op) {
        return new RewriteRule("fold-trailing-constant", (a, b) -> {
            if (b instanceof Constant c && trailing(op, a) instanceof BinaryOperation chain)
                return op.create(chain.a(), fold(op, (Constant) chain.b(), c));
            if (a instanceof Constant c && trailing(op, b) instanceof BinaryOperation chain)
                return op.create(chain.a(), fold(op, c, (Constant) chain.b()));
            return null;
        });
    }

    /**
     * {@code (x op k) op y -> (x op y) op k} and
     * {@code y op (x op k) -> (y op x) op k} for non-constant {@code y}.
     */
    static RewriteRule lowerTrailingConstant(Operator op) {
        return new RewriteRule("lower-trailing-constant", (a, b) -> {
            if (!(b instanceof Constant) && trailing(op, a) instanceof BinaryOperation chain)
                return op.create(op.create(chain.a(), b), chain.b());
            if (!(a instanceof Constant) && trailing(op, b) instanceof BinaryOperation chain)
                return op.create(op.create(a, chain.a()), chain.b());
            return null;
        });
    }

    /** {@code c op y -> y op c}. */
    static RewriteRule constantToRight(Operator op) {
        return new RewriteRule("constant-to-right", (a, b) -> {
            if (a instanceof Constant && !(b instanceof Constant))
                return op.create(b, a);
            return null;
        });
    }

    private static Expr trailing(Operator op, Expr e) {
        if (e instanceof BinaryOperation bo && bo.operator() == op && bo.b() instanceof Constant)
            return bo;
        return null;
    }

    private static Constant fold(Operator op, Constant left, Constant right) {
        return new Constant(Arithmetic.apply(op, left.value(), right.value()));
    }
}
