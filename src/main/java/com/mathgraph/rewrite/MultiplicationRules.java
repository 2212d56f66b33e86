package com.mathgraph.rewrite;

import com.mathgraph.node.Constant;
import com.mathgraph.node.Operator;

import java.util.List;

/**
 * Rewrite rules for {@code a * b}. Mirrors {@link AdditionRules} for chains of
 * factors.
 */
public final class MultiplicationRules {
    private MultiplicationRules() {
        // Utility class
    }

    /** {@code 0 * b -> 0}, {@code a * 0 -> 0}. */
    public static final RewriteRule ZERO_ABSORBS = new RewriteRule("zero-absorbs", (a, b) -> {
        if (Constant.isZero(a) || Constant.isZero(b))
            return Constant.ZERO;
        return null;
    });

    /** {@code 1 * b -> b}, {@code a * 1 -> a}. */
    public static final RewriteRule MULTIPLICATIVE_IDENTITY = new RewriteRule("multiplicative-identity",
            (a, b) -> {
                if (Constant.isOne(a))
                    return b;
                if (Constant.isOne(b))
                    return a;
                return null;
            });

    /** {@code (x * 2) * 3 -> x * 6}. */
    public static final RewriteRule FOLD_TRAILING_CONSTANT = AssociativeChains
            .foldTrailingConstant(Operator.MULTIPLY);

    /** {@code (x * 2) * y -> (x * y) * 2}. */
    public static final RewriteRule LOWER_TRAILING_CONSTANT = AssociativeChains
            .lowerTrailingConstant(Operator.MULTIPLY);

    /** {@code 2 * x -> x * 2}. */
    public static final RewriteRule CONSTANT_TO_RIGHT = AssociativeChains.constantToRight(Operator.MULTIPLY);

    public static RuleSet ruleSet() {
        return new RuleSet(Operator.MULTIPLY, List.of(
                ZERO_ABSORBS,
                MULTIPLICATIVE_IDENTITY,
                FOLD_TRAILING_CONSTANT,
                LOWER_TRAILING_CONSTANT,
                CONSTANT_TO_RIGHT));
    }
}
