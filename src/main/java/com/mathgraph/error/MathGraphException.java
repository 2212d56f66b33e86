package com.mathgraph.error;

/**
 * Root of all failures raised by the expression core.
 *
 * Unchecked: every failure is a programming or domain error of the whole call,
 * there is nothing for a caller to retry.
 */
public class MathGraphException extends RuntimeException {

    public MathGraphException(String message) {
        super(message);
    }

    public MathGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
