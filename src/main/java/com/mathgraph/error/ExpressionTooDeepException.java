package com.mathgraph.error;

/**
 * Raised before walking a graph whose depth exceeds the configured limit.
 */
public class ExpressionTooDeepException extends MathGraphException {

    public ExpressionTooDeepException(int depth, int maxDepth) {
        super("Expression depth " + depth + " exceeds limit " + maxDepth);
    }
}
