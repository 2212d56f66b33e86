package com.mathgraph.rewrite;

import com.mathgraph.node.Expr;
import com.mathgraph.node.Operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Ordered rewrite rules for one binary operator.
 *
 * <p>
 * Rules are tried in order and the first match wins. When no rule matches,
 * the node is rebuilt from its simplified operands. Rule results are not
 * simplified again (one pass per node).
 */
@Log4j2
public final class RuleSet {
    private final Operator operator;
    private final List<RewriteRule> rules;

    public RuleSet(Operator operator, List<RewriteRule> rules) {
        if (operator.arity() != 2)
            throw new IllegalArgumentException("Rule sets apply to binary operators, not " + operator);
        this.operator = operator;
        this.rules = List.copyOf(rules);
    }

    public static RuleSet empty(Operator operator) {
        return new RuleSet(operator, Collections.emptyList());
    }

    /**
     * The standard rule sets, one per binary operator.
     */
    public static Map<Operator, RuleSet> defaults() {
        Map<Operator, RuleSet> sets = new EnumMap<>(Operator.class);
        sets.put(Operator.ADD, AdditionRules.ruleSet());
        sets.put(Operator.SUBTRACT, SubtractionRules.ruleSet());
        sets.put(Operator.MULTIPLY, MultiplicationRules.ruleSet());
        sets.put(Operator.DIVIDE, DivisionRules.ruleSet());
        sets.put(Operator.POWER, PowerRules.ruleSet());
        return sets;
    }

    public Operator operator() {
        return operator;
    }

    public List<RewriteRule> rules() {
        return rules;
    }

    public Optional<RewriteRule> rule(String name) {
        return rules.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    /** Returns a copy with {@code rule} tried before the existing rules. */
    public RuleSet withFirst(RewriteRule rule) {
        List<RewriteRule> copy = new ArrayList<>(rules.size() + 1);
        copy.add(rule);
        copy.addAll(rules);
        return new RuleSet(operator, copy);
    }

    /** Returns a copy with {@code rule} tried after the existing rules. */
    public RuleSet withLast(RewriteRule rule) {
        List<RewriteRule> copy = new ArrayList<>(rules);
        copy.add(rule);
        return new RuleSet(operator, copy);
    }

    /**
     * Rewrites {@code a op b} with the first matching rule.
     */
    public Expr apply(Expr a, Expr b) {
        for (RewriteRule rule : rules) {
            Optional<Expr> result = rule.apply(a, b);
            if (result.isPresent()) {
                log.trace("{} rule '{}': {} {} {} -> {}", operator.displayName(), rule.name(), a,
                        operator.symbol(), b, result.get());
                return result.get();
            }
        }
        return operator.create(a, b);
    }
}
