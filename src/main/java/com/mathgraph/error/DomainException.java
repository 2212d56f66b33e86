package com.mathgraph.error;

/**
 * An operation was applied to a constant outside its domain, e.g. the
 * logarithm of a non-positive number.
 */
public class DomainException extends MathGraphException {

    public DomainException(String message) {
        super(message);
    }
}
