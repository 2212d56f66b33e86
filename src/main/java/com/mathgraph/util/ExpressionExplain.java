package com.mathgraph.util;

import com.mathgraph.node.Expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Diagnostic exports of an expression graph.
 *
 * <p>
 * The graph is unfolded into a tree from the root: a subgraph shared by two
 * parents appears once under each. Every vertex is identified by its path from
 * the root ({@code f}, {@code f-a}, {@code f-a-b}, ...) and labeled with the
 * node's {@link Expr#description()} plus its role:
 * {@code [output f]} for the root, {@code [input <slot>]} for a child, where
 * the slot is {@code a} or {@code b}. Edges point from child to parent.
 *
 * <p>
 * <b>Usage:</b> debugging and documentation. Allocates strings for every
 * vertex; do not use on large graphs in a loop. Because shared subgraphs are
 * unfolded, the vertex count is the number of root-to-node paths, which grows
 * exponentially with repeated sharing ({@code f = f * f} doubles it).
 */
public final class ExpressionExplain {
    public static final String OUTPUT_NAME = "f";
    private static final String SLOTS = "ab";

    private final Expr root;

    public ExpressionExplain(Expr root) {
        this.root = root;
    }

    /** Slot letter for an input position. */
    public static String slotName(int slot) {
        return String.valueOf(SLOTS.charAt(slot));
    }

    /**
     * Vertices in pre-order (parent before children, children in slot order).
     */
    public List<Vertex> vertices() {
        List<Vertex> out = new ArrayList<>();
        Deque<Vertex> stack = new ArrayDeque<>();
        stack.push(new Vertex(OUTPUT_NAME, null, OUTPUT_NAME, root, 0));
        while (!stack.isEmpty()) {
            Vertex v = stack.pop();
            out.add(v);
            List<Expr> inputs = v.node().inputs();
            for (int i = inputs.size() - 1; i >= 0; i--) {
                String slot = slotName(i);
                stack.push(new Vertex(v.id() + "-" + slot, v.id(), slot, inputs.get(i), v.level() + 1));
            }
        }
        return out;
    }

    /**
     * Graphviz DOT digraph.
     */
    public String toDot() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("digraph visualisation {\n");
        sb.append("  bgcolor=\"white\";\n");
        for (Vertex v : vertices()) {
            sb.append("  \"").append(v.id()).append("\" [label=\"").append(escapeDot(v.label())).append("\"];\n");
            if (v.parentId() != null)
                sb.append("  \"").append(v.id()).append("\" -> \"").append(v.parentId()).append("\";\n");
        }
        return sb.append("}\n").toString();
    }

    /**
     * Mermaid JS flowchart, suitable for embedding in Markdown.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph BT;\n");
        List<Vertex> vertices = vertices();
        // 1. Declare nodes
        for (Vertex v : vertices) {
            sb.append("  ").append(sanitize(v.id())).append("[\"").append(v.label().replace("\"", "#quot;"))
                    .append("\"];\n");
        }
        // 2. Edges afterwards
        for (Vertex v : vertices) {
            if (v.parentId() != null)
                sb.append("  ").append(sanitize(v.id())).append(" --> ").append(sanitize(v.parentId()))
                        .append(";\n");
        }
        return sb.toString();
    }

    /**
     * Indented text listing, one vertex per line.
     */
    public String dumpTree() {
        StringBuilder sb = new StringBuilder(512);
        for (Vertex v : vertices()) {
            sb.append("  ".repeat(v.level())).append(v.label()).append('\n');
        }
        return sb.toString();
    }

    private static String escapeDot(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String sanitize(String id) {
        return id.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    /**
     * One vertex of the unfolded graph.
     *
     * @param id       Path from the root, e.g. {@code f-a-b}.
     * @param parentId Id of the consuming vertex, {@code null} for the root.
     * @param slot     Slot letter under the parent, or the output name for the
     *                 root.
     */
    public record Vertex(String id, String parentId, String slot, Expr node, int level) {

        public String label() {
            return node.description() + (parentId == null ? " [output " : " [input ") + slot + "]";
        }
    }
}
