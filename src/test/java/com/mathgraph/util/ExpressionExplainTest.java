package com.mathgraph.util;

import com.mathgraph.MathGraph;
import com.mathgraph.node.Expr;
import com.mathgraph.node.Input;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class ExpressionExplainTest {
    private final Input x = new Input("x");

    @Test
    public void testDotOutput() {
        String dot = MathGraph.toDot(x.plus(2));
        String expected = "digraph visualisation {\n"
                + "  bgcolor=\"white\";\n"
                + "  \"f\" [label=\"Add [output f]\"];\n"
                + "  \"f-a\" [label=\"Input: \\\"x\\\" [input a]\"];\n"
                + "  \"f-a\" -> \"f\";\n"
                + "  \"f-b\" [label=\"Constant: 2 [input b]\"];\n"
                + "  \"f-b\" -> \"f\";\n"
                + "}\n";
        assertEquals(expected, dot);
    }

    @Test
    public void testVerticesArePreOrder() {
        Expr f = x.times(3).plus(x.log());
        List<String> ids = new ExpressionExplain(f).vertices().stream()
                .map(ExpressionExplain.Vertex::id)
                .collect(Collectors.toList());
        assertEquals(List.of("f", "f-a", "f-a-a", "f-a-b", "f-b", "f-b-a"), ids);
    }

    @Test
    public void testSharedSubgraphIsUnfolded() {
        Expr shared = x.plus(1);
        List<ExpressionExplain.Vertex> vs = new ExpressionExplain(shared.times(shared)).vertices();
        assertEquals(7, vs.size());
        assertSame(vs.get(1).node(), vs.get(4).node());
    }

    @Test
    public void testLabels() {
        List<ExpressionExplain.Vertex> vs = new ExpressionExplain(x.log()).vertices();
        assertEquals("Log [output f]", vs.get(0).label());
        assertEquals("Input: \"x\" [input a]", vs.get(1).label());
        assertEquals("f", vs.get(1).parentId());
        assertNull(vs.get(0).parentId());
    }

    @Test
    public void testMermaid() {
        String mermaid = new ExpressionExplain(x.pow(2)).toMermaid();
        assertTrue(mermaid.startsWith("graph BT;\n"));
        assertTrue(mermaid.contains("  f[\"Power [output f]\"];\n"));
        assertTrue(mermaid.contains("  f_a[\"Input: #quot;x#quot; [input a]\"];\n"));
        assertTrue(mermaid.contains("  f_b --> f;\n"));
    }

    @Test
    public void testDumpTree() {
        String tree = new ExpressionExplain(x.minus(1)).dumpTree();
        assertEquals("Subtract [output f]\n  Input: \"x\" [input a]\n  Constant: 1 [input b]\n", tree);
    }

    @Test
    public void testSlotNames() {
        assertEquals("a", ExpressionExplain.slotName(0));
        assertEquals("b", ExpressionExplain.slotName(1));
    }
}
