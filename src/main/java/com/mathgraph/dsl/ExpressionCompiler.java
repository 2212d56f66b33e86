package com.mathgraph.dsl;

import com.mathgraph.error.MathGraphException;
import com.mathgraph.fn.ExprFn1;
import com.mathgraph.fn.ExprFn2;
import com.mathgraph.fn.ExprFn3;
import com.mathgraph.fn.ExprFnN;
import com.mathgraph.node.Expr;
import com.mathgraph.node.Input;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Turns an ordinary function into an expression graph.
 *
 * <p>
 * One {@link Input} is created per declared parameter name and the function
 * is invoked once with those inputs; whatever it builds is the graph.
 *
 * <pre>{@code
 * Expr f = ExpressionCompiler.compile((x, y) -> x.times(y).plus(1), "x", "y");
 * f.evaluate(Map.of("x", 2, "y", 3)); // Constant 7
 * }</pre>
 *
 * Lambdas carry no parameter names at runtime, so they are passed
 * explicitly. {@link #compile(Method, Object)} reads the names from the
 * class file instead, which requires compiling with {@code -parameters}.
 */
@Log4j2
public final class ExpressionCompiler {
    private ExpressionCompiler() {
        // Utility class
    }

    public static Expr compile(ExprFn1 fn, String a) {
        checkNames(a);
        return fn.apply(new Input(a));
    }

    public static Expr compile(ExprFn2 fn, String a, String b) {
        checkNames(a, b);
        return fn.apply(new Input(a), new Input(b));
    }

    public static Expr compile(ExprFn3 fn, String a, String b, String c) {
        checkNames(a, b, c);
        return fn.apply(new Input(a), new Input(b), new Input(c));
    }

    public static Expr compile(ExprFnN fn, String... names) {
        checkNames(names);
        return fn.apply(inputs(names));
    }

    /**
     * Compiles a method whose parameters are all {@link Expr}.
     *
     * @param method Method to invoke; its parameter names become input names.
     * @param target Receiver, or {@code null} for a static method.
     * @throws IllegalArgumentException if parameter names were not compiled
     *                                  in, a parameter is not an {@link Expr},
     *                                  or the method does not return one.
     */
    public static Expr compile(Method method, Object target) {
        if (!Expr.class.isAssignableFrom(method.getReturnType()))
            throw new IllegalArgumentException(method.getName() + " must return " + Expr.class.getSimpleName());
        if (!Modifier.isStatic(method.getModifiers()) && target == null)
            throw new IllegalArgumentException("Instance method " + method.getName() + " needs a target");

        Parameter[] params = method.getParameters();
        String[] names = new String[params.length];
        for (int i = 0; i < params.length; i++) {
            Parameter p = params[i];
            if (!p.isNamePresent())
                throw new IllegalArgumentException(
                        "Parameter names of " + method.getName() + " are not available; compile with -parameters");
            if (!Expr.class.isAssignableFrom(p.getType()))
                throw new IllegalArgumentException(
                        "Parameter " + p.getName() + " of " + method.getName() + " must be an Expr");
            names[i] = p.getName();
        }
        log.debug("Compiling {} with inputs {}", method.getName(), Arrays.toString(names));

        try {
            method.setAccessible(true);
            Object[] args = inputs(names);
            return (Expr) method.invoke(target, args);
        } catch (IllegalAccessException e) {
            throw new IllegalArgumentException("Cannot access " + method.getName(), e);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException re)
                throw re;
            throw new MathGraphException("Failed to compile " + method.getName(), e.getCause());
        }
    }

    private static Input[] inputs(String[] names) {
        Input[] in = new Input[names.length];
        for (int i = 0; i < names.length; i++)
            in[i] = new Input(names[i]);
        return in;
    }

    private static void checkNames(String... names) {
        Set<String> seen = new HashSet<>();
        for (String n : names) {
            if (!seen.add(n))
                throw new IllegalArgumentException("Duplicate input name: " + n);
        }
    }
}
