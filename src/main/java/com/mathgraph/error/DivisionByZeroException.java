package com.mathgraph.error;

public class DivisionByZeroException extends MathGraphException {

    public DivisionByZeroException(double dividend) {
        super("Division by zero: " + dividend + " / 0");
    }
}
