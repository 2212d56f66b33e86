package com.mathgraph.rewrite;

import com.mathgraph.node.Expr;

import java.util.Optional;

/**
 * A named local rewrite over the simplified operands of a binary node.
 *
 * <p>
 * Rules see the operands only after they have been simplified, and only when
 * constant folding did not already apply (at least one operand is not a
 * constant).
 *
 * @param name    Stable identifier, used in trace logs and for lookup.
 * @param rewrite The rewrite. Returns {@code null} when the rule does not
 *                apply.
 */
public record RewriteRule(String name, Rewrite rewrite) {

    /**
     * Applies the rule.
     *
     * @return The rewritten node, or empty if the rule does not match.
     */
    public Optional<Expr> apply(Expr a, Expr b) {
        return Optional.ofNullable(rewrite.apply(a, b));
    }

    @FunctionalInterface
    public interface Rewrite {
        Expr apply(Expr a, Expr b);
    }
}
