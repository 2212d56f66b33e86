package com.mathgraph.api;

import com.mathgraph.node.Add;
import com.mathgraph.node.Constant;
import com.mathgraph.node.Divide;
import com.mathgraph.node.Input;
import com.mathgraph.node.Log;
import com.mathgraph.node.Multiply;
import com.mathgraph.node.Power;
import com.mathgraph.node.Subtract;

/**
 * Dispatch over the closed set of expression variants.
 *
 * <p>
 * Every algorithm over the graph (evaluation, simplification,
 * differentiation, export) implements this interface. Adding a variant adds a
 * method here, so the compiler points at every algorithm that must handle it.
 *
 * @param <R> Result of visiting a node.
 */
public interface ExprVisitor<R> {

    R visitConstant(Constant node);

    R visitInput(Input node);

    R visitAdd(Add node);

    R visitSubtract(Subtract node);

    R visitMultiply(Multiply node);

    R visitDivide(Divide node);

    R visitPower(Power node);

    R visitLog(Log node);
}
