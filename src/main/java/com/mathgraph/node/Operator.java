package com.mathgraph.node;

import com.mathgraph.error.ArityViolationException;

import java.util.Arrays;

/**
 * The fixed set of operations, with their arity and a factory for each.
 *
 * <p>
 * {@link #create(Expr...)} is the generic construction path. It enforces the
 * arity of the variant, so a caller can never receive a malformed node.
 */
public enum Operator {
    ADD("Add", "+", 2, in -> new Add(in[0], in[1])),
    SUBTRACT("Subtract", "-", 2, in -> new Subtract(in[0], in[1])),
    MULTIPLY("Multiply", "*", 2, in -> new Multiply(in[0], in[1])),
    DIVIDE("Divide", "/", 2, in -> new Divide(in[0], in[1])),
    POWER("Power", "^", 2, in -> new Power(in[0], in[1])),
    LOG("Log", "log", 1, in -> new Log(in[0]));

    private final String displayName;
    private final String symbol;
    private final int arity;
    private final Factory factory;

    Operator(String displayName, String symbol, int arity, Factory factory) {
        this.displayName = displayName;
        this.symbol = symbol;
        this.arity = arity;
        this.factory = factory;
    }

    public String displayName() {
        return displayName;
    }

    public String symbol() {
        return symbol;
    }

    public int arity() {
        return arity;
    }

    /**
     * Builds a node of this kind.
     *
     * @throws ArityViolationException if the number of operands does not match
     *                                 {@link #arity()}.
     */
    public Operation create(Expr... operands) {
        if (operands.length != arity)
            throw ArityViolationException.operands(displayName, arity, operands.length);
        return factory.create(operands);
    }

    /**
     * Builds a node of this kind, promoting raw numbers to constants.
     */
    public Operation apply(Object... operands) {
        return create(Arrays.stream(operands).map(Expr::of).toArray(Expr[]::new));
    }

    public static Operator fromString(String text) {
        for (Operator op : values()) {
            if (op.name().equalsIgnoreCase(text) || op.symbol.equals(text))
                return op;
        }
        throw new IllegalArgumentException("Unknown Operator: " + text);
    }

    @FunctionalInterface
    interface Factory {
        Operation create(Expr[] inputs);
    }
}
