package com.mathgraph.rewrite;

import com.mathgraph.node.Constant;
import com.mathgraph.node.Operator;
import com.mathgraph.node.Power;

import java.util.List;

/**
 * Rewrite rules for {@code a ^ b}.
 *
 * <p>
 * Only one level of nesting is folded. Longer chains reduce because the
 * inner power has already been simplified by the time the outer one is seen.
 */
public final class PowerRules {
    private PowerRules() {
        // Utility class
    }

    /** {@code a ^ 0 -> 1}. */
    public static final RewriteRule ZERO_EXPONENT = new RewriteRule("zero-exponent",
            (a, b) -> Constant.isZero(b) ? Constant.ONE : null);

    /** {@code a ^ 1 -> a}. */
    public static final RewriteRule UNIT_EXPONENT = new RewriteRule("unit-exponent",
            (a, b) -> Constant.isOne(b) ? a : null);

    /** {@code (x ^ 2) ^ 3 -> x ^ 6}. */
    public static final RewriteRule FOLD_NESTED_EXPONENTS = new RewriteRule("fold-nested-exponents", (a, b) -> {
        if (a instanceof Power inner && inner.b() instanceof Constant k && b instanceof Constant c)
            return new Power(inner.a(), new Constant(k.value() * c.value()));
        return null;
    });

    /** {@code (x ^ 2) ^ y -> (x ^ y) ^ 2}. */
    public static final RewriteRule LOWER_NESTED_EXPONENT = new RewriteRule("lower-nested-exponent", (a, b) -> {
        if (a instanceof Power inner && inner.b() instanceof Constant && !(b instanceof Constant))
            return new Power(new Power(inner.a(), b), inner.b());
        return null;
    });

    public static RuleSet ruleSet() {
        return new RuleSet(Operator.POWER, List.of(
                ZERO_EXPONENT,
                UNIT_EXPONENT,
                FOLD_NESTED_EXPONENTS,
                LOWER_NESTED_EXPONENT));
    }
}
