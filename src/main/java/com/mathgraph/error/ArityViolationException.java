package com.mathgraph.error;

/**
 * A node was built with the wrong number of operands, or a slot beyond its
 * arity was requested.
 */
public class ArityViolationException extends MathGraphException {

    public ArityViolationException(String message) {
        super(message);
    }

    public static ArityViolationException operands(String variant, int arity, int given) {
        return new ArityViolationException(
                variant + " takes exactly " + arity + " operand(s), got " + given);
    }

    public static ArityViolationException slot(String variant, int arity, int slot) {
        return new ArityViolationException(
                "No input slot " + slot + " on " + variant + " (arity " + arity + ")");
    }
}
