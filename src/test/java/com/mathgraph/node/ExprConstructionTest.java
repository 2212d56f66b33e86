package com.mathgraph.node;

import com.mathgraph.dsl.Ops;
import com.mathgraph.error.ArityViolationException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ExprConstructionTest {
    private final Input x = new Input("x");
    private final Input y = new Input("y");

    @Test
    public void testLiteralOnRightIsPromoted() {
        Expr e = x.plus(5);
        assertTrue(e instanceof Add);
        Add add = (Add) e;
        assertSame(x, add.a());
        assertEquals(new Constant(5), add.b());
    }

    @Test
    public void testLiteralOnLeftIsPromoted() {
        Add add = (Add) Ops.add(5, x);
        assertEquals(new Constant(5), add.a());
        assertSame(x, add.b());

        Subtract sub = (Subtract) Ops.sub(3, y);
        assertEquals(new Constant(3), sub.a());
        assertSame(y, sub.b());
    }

    @Test
    public void testOperandOrderIsPreserved() {
        assertEquals(List.of(x, y), x.minus(y).inputs());
        assertEquals(List.of(y, x), y.dividedBy(x).inputs());
        assertEquals(List.of(x, new Constant(2)), x.pow(2).inputs());
    }

    @Test
    public void testNegationIsZeroMinus() {
        Expr neg = x.negate();
        assertEquals(new Subtract(Constant.ZERO, x), neg);
    }

    @Test
    public void testConstructionDoesNotFold() {
        Expr e = new Constant(2).plus(3);
        assertTrue(e instanceof Add);
        assertEquals("(2 + 3)", e.toString());
    }

    @Test
    public void testVariantsHaveExpectedConcreteTypes() {
        assertTrue(x.minus(1) instanceof Subtract);
        assertTrue(x.times(y) instanceof Multiply);
        assertTrue(x.dividedBy(2) instanceof Divide);
        assertTrue(x.pow(y) instanceof Power);
        assertTrue(x.log() instanceof Log);
        assertEquals(Operator.POWER, ((Operation) x.pow(y)).operator());
    }

    @Test(expected = ArityViolationException.class)
    public void testTooManyOperandsRejected() {
        Operator.ADD.create(x, y, new Constant(1));
    }

    @Test(expected = ArityViolationException.class)
    public void testTooFewOperandsRejected() {
        Operator.MULTIPLY.create(x);
    }

    @Test(expected = ArityViolationException.class)
    public void testLogTakesOneOperand() {
        Operator.LOG.create(x, y);
    }

    @Test(expected = ArityViolationException.class)
    public void testSecondSlotOfLogRejected() {
        new Log(x).input(1);
    }

    @Test(expected = ArityViolationException.class)
    public void testLeafHasNoSlots() {
        x.input(0);
    }

    @Test
    public void testSlotAccess() {
        Expr e = x.times(y);
        assertSame(x, e.input(0));
        assertSame(y, e.input(1));
        assertEquals(2, e.arity());
        assertEquals(1, new Log(x).arity());
        assertEquals(0, new Constant(1).arity());
    }

    @Test
    public void testDescriptions() {
        assertEquals("Constant: 5", new Constant(5).description());
        assertEquals("Constant: 2.5", new Constant(2.5).description());
        assertEquals("Input: \"x\"", x.description());
        assertEquals("Add", x.plus(y).description());
        assertEquals("Power", x.pow(2).description());
        assertEquals("Log", x.log().description());
    }

    @Test
    public void testToString() {
        assertEquals("((x + 2) * log(y))", x.plus(2).times(y.log()).toString());
        assertEquals("(x ^ 0.5)", x.pow(0.5).toString());
    }

    @Test
    public void testStructuralEquality() {
        Expr a = new Input("x").plus(2).times(y);
        Expr b = x.plus(2).times(new Input("y"));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(x.plus(y), y.plus(x));
        assertNotEquals(x.plus(y), x.minus(y));
        assertNotEquals(new Constant(1), new Constant(2));
    }

    @Test
    public void testDepth() {
        assertEquals(1, x.depth());
        assertEquals(2, x.plus(2).depth());
        assertEquals(3, x.plus(2).log().depth());
        assertEquals(3, x.times(y.plus(1)).depth());
    }

    @Test
    public void testSharedSubgraph() {
        Expr shared = x.plus(1);
        Expr square = shared.times(shared);
        assertSame(square.input(0), square.input(1));
    }

    @Test
    public void testPromotion() {
        assertEquals(new Constant(3), Expr.of(3));
        assertEquals(new Constant(0.25), Expr.of(0.25f));
        assertSame(x, Expr.of(x));
        assertEquals(new Multiply(new Constant(2), x), Operator.MULTIPLY.apply(2, x));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPromotionRejectsOtherTypes() {
        Expr.of("x");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyInputNameRejected() {
        new Input("");
    }

    @Test
    public void testOperatorFromString() {
        assertEquals(Operator.DIVIDE, Operator.fromString("divide"));
        assertEquals(Operator.POWER, Operator.fromString("^"));
    }
}
