package com.mathgraph.rewrite;

import com.mathgraph.node.Constant;
import com.mathgraph.node.Operator;

import java.util.List;

public final class SubtractionRules {
    private SubtractionRules() {
        // Utility class
    }

    /** {@code a - 0 -> a}. */
    public static final RewriteRule SUBTRACT_ZERO = new RewriteRule("subtract-zero",
            (a, b) -> Constant.isZero(b) ? a : null);

    public static RuleSet ruleSet() {
        return new RuleSet(Operator.SUBTRACT, List.of(SUBTRACT_ZERO));
    }
}
