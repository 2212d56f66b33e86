package com.mathgraph.rewrite;

import com.mathgraph.node.Constant;
import com.mathgraph.node.Operator;

import java.util.List;

/**
 * Rewrite rules for {@code a / b}. None of them divides, so a zero divisor is
 * never touched here.
 */
public final class DivisionRules {
    private DivisionRules() {
        // Utility class
    }

    /** {@code 0 / b -> 0}. */
    public static final RewriteRule ZERO_DIVIDEND = new RewriteRule("zero-dividend",
            (a, b) -> Constant.isZero(a) ? Constant.ZERO : null);

    /** {@code a / 1 -> a}. */
    public static final RewriteRule DIVIDE_BY_ONE = new RewriteRule("divide-by-one",
            (a, b) -> Constant.isOne(b) ? a : null);

    public static RuleSet ruleSet() {
        return new RuleSet(Operator.DIVIDE, List.of(ZERO_DIVIDEND, DIVIDE_BY_ONE));
    }
}
