package com.mathgraph;

import com.mathgraph.dsl.ExpressionCompiler;
import com.mathgraph.engine.EngineConfig;
import com.mathgraph.engine.ExpressionEngine;
import com.mathgraph.fn.ExprFn1;
import com.mathgraph.fn.ExprFn2;
import com.mathgraph.fn.ExprFn3;
import com.mathgraph.fn.ExprFnN;
import com.mathgraph.node.Constant;
import com.mathgraph.node.Expr;
import com.mathgraph.node.Input;
import com.mathgraph.node.Log;
import com.mathgraph.util.ExpressionExplain;

/**
 * MathGraph -- expression graphs you can evaluate, differentiate and simplify.
 *
 * <h2>Model</h2>
 * <p>
 * A formula is an immutable DAG of {@link Expr} nodes:
 * <ul>
 * <li><b>Constants</b> and named <b>Inputs</b> are the leaves.</li>
 * <li><b>Operations</b> (add, subtract, multiply, divide, power, natural log)
 * reference one or two existing nodes.</li>
 * </ul>
 *
 * <h3>Algorithms</h3>
 * <ul>
 * <li><b>Evaluation:</b> substitutes bound inputs, folds constants. Unbound
 * inputs are left in place.</li>
 * <li><b>Differentiation:</b> builds the exact partial derivative as a new
 * graph.</li>
 * <li><b>Simplification:</b> one bottom-up pass of local rewrite rules.</li>
 * </ul>
 *
 * <pre>{@code
 * Expr x = MathGraph.input("x");
 * Expr f = x.pow(2).plus(x.times(3));
 * Expr df = f.gradient("x").simplified();
 * df.evaluate(Map.of("x", 2.0)); // Constant 7
 * }</pre>
 */
public final class MathGraph {

    private MathGraph() {
        // Prevent instantiation of utility class
    }

    public static Input input(String name) {
        return new Input(name);
    }

    public static Constant constant(double value) {
        return new Constant(value);
    }

    public static Expr log(Expr a) {
        return new Log(a);
    }

    /**
     * Creates an engine with custom settings. The convenience methods on
     * {@link Expr} use {@link ExpressionEngine#defaultEngine()}.
     */
    public static ExpressionEngine engine(EngineConfig config) {
        return new ExpressionEngine(config);
    }

    public static Expr compile(ExprFn1 fn, String a) {
        return ExpressionCompiler.compile(fn, a);
    }

    public static Expr compile(ExprFn2 fn, String a, String b) {
        return ExpressionCompiler.compile(fn, a, b);
    }

    public static Expr compile(ExprFn3 fn, String a, String b, String c) {
        return ExpressionCompiler.compile(fn, a, b, c);
    }

    public static Expr compile(ExprFnN fn, String... names) {
        return ExpressionCompiler.compile(fn, names);
    }

    /** Graphviz DOT rendering of {@code root}. */
    public static String toDot(Expr root) {
        return new ExpressionExplain(root).toDot();
    }
}
