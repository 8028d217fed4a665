package com.graphscript.dsl;

import com.graphscript.api.DataType;
import com.graphscript.api.FunctionId;
import com.graphscript.api.NodeId;
import com.graphscript.api.ValueType;
import com.graphscript.graph.GraphDocument;
import com.graphscript.template.NodeTemplate;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GraphBuilderTest {

    @Test
    public void testNodesGoToCurrentFunction() {
        GraphBuilder g = GraphBuilder.create();
        g.enter();
        FunctionId f = g.function("f", List.of(), List.of());
        g.in(f).print("inside");

        assertEquals(1, g.catalog().main().graph().nodeCount());
        assertEquals(1, g.catalog().function(f).graph().nodeCount());
        assertEquals(f, g.current());
        assertEquals(g.catalog().mainId(), g.inMain().current());
    }

    @Test
    public void testConstantsAreSet() {
        GraphBuilder g = GraphBuilder.create();
        NodeId add = g.addNumber(4, 5);
        GraphDocument doc = g.catalog().main().graph();

        assertEquals(ValueType.integer(4), doc.input(g.dataInput(add, 0)).value());
        assertEquals(ValueType.integer(5), doc.input(g.dataInput(add, 1)).value());
        assertEquals(DataType.INTEGER, doc.output(g.dataOutput(add, 0)).type());
    }

    @Test
    public void testSequenceConnectsExecutionPorts() {
        GraphBuilder g = GraphBuilder.create();
        NodeId enter = g.enter();
        NodeId a = g.print("a");
        NodeId b = g.print("b");
        g.sequence(enter, a, b);
        GraphDocument doc = g.catalog().main().graph();

        assertEquals(2, doc.connections().size());
        assertEquals(doc.node(enter).outputs().get(0), doc.connection(doc.node(a).inputs().get(0)));
        assertEquals(doc.node(a).outputs().get(0), doc.connection(doc.node(b).inputs().get(0)));
    }

    @Test
    public void testNamedExecutionOutput() {
        GraphBuilder g = GraphBuilder.create();
        NodeId test = g.node(NodeTemplate.IF);
        NodeId p = g.print("p");
        g.then(test, "Else", p);
        GraphDocument doc = g.catalog().main().graph();

        assertEquals("Else", doc.output(doc.connection(doc.node(p).inputs().get(0))).name());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownExecutionOutput() {
        GraphBuilder g = GraphBuilder.create();
        g.then(g.node(NodeTemplate.IF), "Maybe", g.print(""));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReturnHasNoExecutionOutput() {
        GraphBuilder g = GraphBuilder.create();
        FunctionId f = g.function("f", List.of(), List.of());
        g.in(f);
        g.then(g.returns(), g.print(""));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDataPortOutOfRange() {
        GraphBuilder g = GraphBuilder.create();
        g.dataInput(g.print(""), 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWireTypeMismatch() {
        GraphBuilder g = GraphBuilder.create();
        g.wire(g.addNumber(1, 2), 0, g.print(""), 0);
    }
}
