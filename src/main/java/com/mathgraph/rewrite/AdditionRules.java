package com.mathgraph.rewrite;

import com.mathgraph.node.Constant;
import com.mathgraph.node.Operator;

import java.util.List;

/**
 * Rewrite rules for {@code a + b}.
 */
public final class AdditionRules {
    private AdditionRules() {
        // Utility class
    }

    /** {@code 0 + b -> b}, {@code a + 0 -> a}. */
    public static final RewriteRule ADDITIVE_IDENTITY = new RewriteRule("additive-identity", (a, b) -> {
        if (Constant.isZero(a))
            return b;
        if (Constant.isZero(b))
            return a;
        return null;
    });

    /** {@code (x + 2) + 3 -> x + 5}. */
    public static final RewriteRule FOLD_TRAILING_CONSTANT = AssociativeChains.foldTrailingConstant(Operator.ADD);

    /** {@code (x + 2) + y -> (x + y) + 2}. */
    public static final RewriteRule LOWER_TRAILING_CONSTANT = AssociativeChains.lowerTrailingConstant(Operator.ADD);

    /** {@code 2 + x -> x + 2}. */
    public static final RewriteRule CONSTANT_TO_RIGHT = AssociativeChains.constantToRight(Operator.ADD);

    public static RuleSet ruleSet() {
        return new RuleSet(Operator.ADD, List.of(
                ADDITIVE_IDENTITY,
                FOLD_TRAILING_CONSTANT,
                LOWER_TRAILING_CONSTANT,
                CONSTANT_TO_RIGHT));
    }
}
