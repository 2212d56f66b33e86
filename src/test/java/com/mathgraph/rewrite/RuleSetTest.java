package com.mathgraph.rewrite;

import com.mathgraph.node.Constant;
import com.mathgraph.node.Input;
import com.mathgraph.node.Operator;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class RuleSetTest {
    private final Input x = new Input("x");
    private final Input y = new Input("y");

    @Test
    public void testDefaultsCoverBinaryOperators() {
        Map<Operator, RuleSet> sets = RuleSet.defaults();
        assertEquals(5, sets.size());
        assertFalse(sets.containsKey(Operator.LOG));
        for (Map.Entry<Operator, RuleSet> e : sets.entrySet())
            assertEquals(e.getKey(), e.getValue().operator());
    }

    @Test
    public void testRulesRunInOrder() {
        List<String> names = AdditionRules.ruleSet().rules().stream().map(RewriteRule::name).toList();
        assertEquals(List.of("additive-identity", "fold-trailing-constant", "lower-trailing-constant",
                "constant-to-right"), names);
    }

    @Test
    public void testFirstMatchWins() {
        RuleSet set = RuleSet.empty(Operator.ADD)
                .withLast(new RewriteRule("first", (a, b) -> a))
                .withLast(new RewriteRule("second", (a, b) -> b));
        assertSame(x, set.apply(x, y));
        assertSame(y, set.withFirst(new RewriteRule("zeroth", (a, b) -> b)).apply(x, y));
    }

    @Test
    public void testFallbackRebuildsNode() {
        assertEquals(x.minus(y), SubtractionRules.ruleSet().apply(x, y));
        assertEquals(x.times(y), RuleSet.empty(Operator.MULTIPLY).apply(x, y));
    }

    @Test
    public void testLookupByName() {
        assertSame(PowerRules.FOLD_NESTED_EXPONENTS, PowerRules.ruleSet().rule("fold-nested-exponents").get());
        assertTrue(PowerRules.ruleSet().rule("no-such-rule").isEmpty());
    }

    @Test
    public void testCopiesDoNotShareRules() {
        RuleSet base = DivisionRules.ruleSet();
        RuleSet extended = base.withLast(new RewriteRule("never", (a, b) -> null));
        assertEquals(2, base.rules().size());
        assertEquals(3, extended.rules().size());
        assertEquals(Constant.ZERO, extended.apply(Constant.ZERO, x));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnaryOperatorRejected() {
        RuleSet.empty(Operator.LOG);
    }
}
