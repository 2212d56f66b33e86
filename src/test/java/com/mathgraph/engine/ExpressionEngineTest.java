package com.mathgraph.engine;

import com.mathgraph.MathGraph;
import com.mathgraph.error.ExpressionTooDeepException;
import com.mathgraph.node.Constant;
import com.mathgraph.node.Expr;
import com.mathgraph.node.Input;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ExpressionEngineTest {
    private final Input x = new Input("x");
    private final Input y = new Input("y");

    private static Expr chain(Expr start, int length) {
        Expr e = start;
        for (int i = 0; i < length; i++)
            e = e.plus(1);
        return e;
    }

    @Test
    public void testConfigDefaults() {
        EngineConfig config = EngineConfig.defaults();
        assertEquals((int) Integer.getInteger(EngineConfig.MAX_DEPTH_PROPERTY, EngineConfig.DEFAULT_MAX_DEPTH),
                config.getMaxDepth());
        assertEquals(16, config.toBuilder().maxDepth(16).build().getMaxDepth());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveDepthRejected() {
        new ExpressionEngine(EngineConfig.builder().maxDepth(0).build());
    }

    @Test(expected = ExpressionTooDeepException.class)
    public void testDepthGuardOnSimplify() {
        ExpressionEngine engine = MathGraph.engine(EngineConfig.builder().maxDepth(50).build());
        assertEquals(50, engine.config().getMaxDepth());
        engine.simplify(chain(x, 100));
    }

    @Test(expected = ExpressionTooDeepException.class)
    public void testDepthGuardOnEvaluate() {
        ExpressionEngine engine = MathGraph.engine(EngineConfig.builder().maxDepth(50).build());
        engine.evaluate(chain(x, 100), Map.of("x", 1));
    }

    @Test(expected = ExpressionTooDeepException.class)
    public void testDepthGuardOnGradient() {
        ExpressionEngine engine = MathGraph.engine(EngineConfig.builder().maxDepth(50).build());
        engine.gradient(chain(x, 100), "x");
    }

    @Test
    public void testDepthAtLimitAccepted() {
        ExpressionEngine engine = MathGraph.engine(EngineConfig.builder().maxDepth(11).build());
        Expr e = chain(x, 10);
        assertEquals(11, e.depth());
        assertEquals(new Constant(10), engine.evaluate(e, Map.of("x", 0)));
    }

    @Test
    public void testDeepChainWithinDefaultLimit() {
        Expr e = chain(x, 1000);
        ExpressionEngine engine = ExpressionEngine.defaultEngine();
        assertEquals(new Constant(1001), engine.evaluate(e, Map.of("x", 1)));
        assertEquals(x.plus(1000), engine.simplify(e));
    }

    @Test
    public void testInputNames() {
        ExpressionEngine engine = ExpressionEngine.defaultEngine();
        Expr shared = x.times(y);
        Expr f = shared.plus(shared).minus(new Input("a").log());
        assertEquals(List.of("a", "x", "y"), List.copyOf(engine.inputNames(f)));
        assertTrue(engine.inputNames(new Constant(1)).isEmpty());
    }

    @Test
    public void testInputNamesOnVeryDeepGraph() {
        Expr e = chain(x, 20_000);
        assertEquals(List.of("x"), List.copyOf(ExpressionEngine.defaultEngine().inputNames(e)));
    }

    @Test
    public void testCustomSimplifier() {
        ExpressionEngine engine = new ExpressionEngine(EngineConfig.defaults(), new Simplifier(Map.of()));
        assertEquals(x.plus(0), engine.simplify(x.plus(0)));
    }

    @Test
    public void testExprConvenienceMethodsUseDefaultEngine() {
        Expr f = x.times(y).plus(0);
        ExpressionEngine engine = ExpressionEngine.defaultEngine();
        assertEquals(engine.simplify(f), f.simplified());
        assertEquals(engine.gradient(f, "y"), f.gradient("y"));
        assertEquals(engine.evaluate(f, Map.of("x", 2)), f.evaluate(Map.of("x", 2)));
    }
}
