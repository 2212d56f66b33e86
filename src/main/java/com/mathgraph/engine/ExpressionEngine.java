package com.mathgraph.engine;

import com.mathgraph.error.ExpressionTooDeepException;
import com.mathgraph.node.Expr;
import com.mathgraph.node.Input;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import lombok.extern.log4j.Log4j2;

/**
 * Entry point for the three graph algorithms.
 *
 * Responsibilities:
 * - Guard: rejects graphs deeper than {@link EngineConfig#getMaxDepth()} before
 * any recursion starts.
 * - Dispatch: runs {@link Evaluator}, {@link Simplifier} or
 * {@link Differentiator} over the graph.
 *
 * The engine holds no mutable state. One instance can serve any number of
 * threads; the graphs it reads are immutable and the results are new graphs.
 */
@Log4j2
public final class ExpressionEngine {
    private static final ExpressionEngine DEFAULT = new ExpressionEngine(EngineConfig.defaults());

    private final EngineConfig config;
    private final Simplifier simplifier;

    public ExpressionEngine(EngineConfig config) {
        this(config, new Simplifier());
    }

    public ExpressionEngine(EngineConfig config, Simplifier simplifier) {
        if (config.getMaxDepth() <= 0)
            throw new IllegalArgumentException("maxDepth must be positive: " + config.getMaxDepth());
        this.config = config;
        this.simplifier = simplifier;
    }

    /** The shared engine behind the convenience methods on {@link Expr}. */
    public static ExpressionEngine defaultEngine() {
        return DEFAULT;
    }

    public EngineConfig config() {
        return config;
    }

    public Expr simplify(Expr expr) {
        checkDepth(expr);
        Expr result = simplifier.simplify(expr);
        log.debug("Simplified {} -> {}", expr, result);
        return result;
    }

    /**
     * Evaluates with the given bindings. Missing bindings are not an error.
     *
     * @param bindings Input name to a {@link Number} or an {@link Expr}.
     */
    public Expr evaluate(Expr expr, Map<String, ?> bindings) {
        checkDepth(expr);
        Expr result = new Evaluator(bindings).evaluate(expr);
        log.debug("Evaluated {} with {} -> {}", expr, bindings, result);
        return result;
    }

    /** Unsimplified partial derivative of {@code expr} with respect to {@code name}. */
    public Expr gradient(Expr expr, String name) {
        checkDepth(expr);
        Expr result = new Differentiator(name).gradient(expr);
        log.debug("d/d{} {} -> {}", name, expr, result);
        return result;
    }

    /**
     * Partial derivatives with respect to every free input, in name order.
     */
    public Map<String, Expr> gradients(Expr expr) {
        Map<String, Expr> result = new LinkedHashMap<>();
        for (String name : inputNames(expr))
            result.put(name, gradient(expr, name));
        return result;
    }

    /**
     * Names of all inputs reachable from {@code expr}.
     *
     * Iterative walk, so it is safe on graphs of any depth. Shared subgraphs
     * are visited once.
     */
    public SortedSet<String> inputNames(Expr expr) {
        SortedSet<String> names = new TreeSet<>();
        Set<Expr> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(expr);
        while (!stack.isEmpty()) {
            Expr e = stack.pop();
            if (!seen.add(e))
                continue;
            if (e instanceof Input in)
                names.add(in.name());
            for (Expr child : e.inputs())
                stack.push(child);
        }
        return names;
    }

    private void checkDepth(Expr expr) {
        if (expr.depth() > config.getMaxDepth())
            throw new ExpressionTooDeepException(expr.depth(), config.getMaxDepth());
    }
}
