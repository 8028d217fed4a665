package com.graphscript.function;

import com.graphscript.api.DataType;
import com.graphscript.api.FunctionId;
import com.graphscript.api.InputId;
import com.graphscript.api.NodeId;
import com.graphscript.api.OutputId;
import com.graphscript.api.ValueType;
import com.graphscript.graph.GraphDocument;
import com.graphscript.graph.Node;
import com.graphscript.graph.NodeKind;
import com.graphscript.template.NodeTemplate;

import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FunctionCatalogTest {

    private FunctionCatalog catalog;

    @Before
    public void setUp() {
        catalog = new FunctionCatalog();
    }

    @Test
    public void testMainExistsAndIsProtected() {
        GraphFunction main = catalog.main();
        assertEquals(FunctionCatalog.MAIN_NAME, main.name());
        assertFalse(main.removable());
        assertFalse(main.renamable());
        assertEquals(1, catalog.functions().size());

        try {
            catalog.removeFunction(catalog.mainId());
            fail("Main must not be removable");
        } catch (IllegalStateException expected) {
            // expected
        }
        try {
            catalog.renameFunction(catalog.mainId(), "Other");
            fail("Main must not be renamable");
        } catch (IllegalStateException expected) {
            // expected
        }
    }

    @Test
    public void testFunctionNamesAreUnique() {
        FunctionId a = catalog.addFunction("my func", List.of(), List.of());
        FunctionId b = catalog.addFunction("my func", List.of(), List.of());
        FunctionId m = catalog.addFunction("Main", List.of(), List.of());

        assertEquals("my_func", catalog.function(a).name());
        assertEquals("my_func_1", catalog.function(b).name());
        assertEquals("Main_1", catalog.function(m).name());

        // renaming to its own name keeps it; renaming onto another name is uniquified
        assertEquals("my_func", catalog.renameFunction(a, "my func"));
        assertEquals("Main_2", catalog.renameFunction(b, "Main"));
    }

    @Test
    public void testSignatureEntriesAreUniquified() {
        FunctionId f = catalog.addFunction("f",
                List.of(new FunctionIO("x", ValueType.integer(0)), new FunctionIO("x", ValueType.string(""))),
                List.of());
        assertEquals("x", catalog.function(f).inputs().get(0).name());
        assertEquals("x_1", catalog.function(f).inputs().get(1).name());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExecutionSignatureEntryRejected() {
        new FunctionIO("go", ValueType.EXECUTION);
    }

    @Test
    public void testVariables() {
        FunctionId main = catalog.mainId();
        assertEquals("score", catalog.addVariable(main, "score", ValueType.integer(1)));
        assertEquals("score_1", catalog.addVariable(main, "score", ValueType.integer(2)));
        assertEquals(2, catalog.main().variables().size());

        catalog.removeVariable(main, "score");
        assertNull(catalog.main().variable("score"));
        assertNotNull(catalog.main().variable("score_1"));
    }

    @Test
    public void testCallableFunctions() {
        FunctionId f = catalog.addFunction("f", List.of(), List.of());
        FunctionId g = catalog.addFunction("g", List.of(), List.of());

        List<GraphFunction> fromF = catalog.callableFunctions(f, true);
        assertEquals(1, fromF.size());
        assertEquals(g, fromF.get(0).id());

        assertEquals(2, catalog.callableFunctions(f, false).size());
        assertEquals(2, catalog.callableFunctions(catalog.mainId(), true).size());
    }

    @Test
    public void testStaticTemplatePorts() {
        NodeId ask = catalog.addNode(catalog.mainId(), NodeKind.of(NodeTemplate.ASK));
        GraphDocument doc = catalog.main().graph();
        Node node = doc.node(ask);

        assertEquals(2, node.inputs().size());
        assertEquals(DataType.EXECUTION, doc.input(node.inputs().get(0)).type());
        assertEquals(DataType.STRING, doc.input(node.inputs().get(1)).type());
        assertEquals(2, node.outputs().size());
        assertEquals("Answer", doc.output(node.outputs().get(1)).name());
    }

    @Test
    public void testFunctionNodeMirrorsSignature() {
        FunctionId f = catalog.addFunction("f",
                List.of(new FunctionIO("a", ValueType.integer(3)), new FunctionIO("b", ValueType.string("s"))),
                List.of(new FunctionIO("r", ValueType.bool(false))));
        NodeId call = catalog.addNode(catalog.mainId(), NodeKind.function(f));
        GraphDocument doc = catalog.main().graph();
        Node node = doc.node(call);

        // exec in + a + b, exec out + r
        assertEquals(3, node.inputs().size());
        assertEquals(ValueType.integer(3), doc.input(node.inputs().get(1)).value());
        assertEquals(2, node.outputs().size());
        assertEquals(DataType.BOOLEAN, doc.output(node.outputs().get(1)).type());
    }

    @Test
    public void testFunctionNodeWithoutCalleeHasNoPorts() {
        NodeId call = catalog.addNode(catalog.mainId(), new NodeKind(NodeTemplate.FUNCTION, null, null));
        Node node = catalog.main().graph().node(call);
        assertTrue(node.inputs().isEmpty());
        assertTrue(node.outputs().isEmpty());
    }

    @Test
    public void testAssignFunctionRebuildsPortsAndDropsConnections() {
        FunctionId f = catalog.addFunction("f", List.of(new FunctionIO("a", ValueType.integer(0))), List.of());
        FunctionId g = catalog.addFunction("g", List.of(), List.of(new FunctionIO("r", ValueType.string(""))));
        FunctionId main = catalog.mainId();
        GraphDocument doc = catalog.main().graph();

        NodeId enter = catalog.addNode(main, NodeKind.of(NodeTemplate.ENTER));
        NodeId call = catalog.addNode(main, NodeKind.function(f));
        OutputId enterOut = doc.node(enter).outputs().get(0);
        InputId callIn = doc.node(call).inputs().get(0);
        doc.connect(enterOut, callIn);

        catalog.assignFunction(main, call, g, true);

        Node node = doc.node(call);
        assertEquals(g, node.kind().function());
        assertEquals(1, node.inputs().size());
        assertEquals(2, node.outputs().size());
        assertTrue(doc.outgoing(enterOut).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAssignMainRejected() {
        FunctionId f = catalog.addFunction("f", List.of(), List.of());
        NodeId call = catalog.addNode(catalog.mainId(), NodeKind.function(f));
        catalog.assignFunction(catalog.mainId(), call, catalog.mainId(), true);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAssignSelfRejectedWhenRecursionDisabled() {
        FunctionId f = catalog.addFunction("f", List.of(), List.of());
        NodeId call = catalog.addNode(f, new NodeKind(NodeTemplate.FUNCTION, null, null));
        catalog.assignFunction(f, call, f, true);
    }

    @Test
    public void testArgumentAndReturnNodes() {
        FunctionId f = catalog.addFunction("f",
                List.of(new FunctionIO("x", ValueType.floating(1.5))),
                List.of(new FunctionIO("y", ValueType.integer(0)), new FunctionIO("z", ValueType.string(""))));
        GraphDocument doc = catalog.function(f).graph();

        Node arg = doc.node(catalog.addNode(f, NodeKind.symbol(NodeTemplate.ARGUMENT, "x")));
        assertTrue(arg.inputs().isEmpty());
        assertEquals(DataType.FLOAT, doc.output(arg.outputs().get(0)).type());

        Node ret = doc.node(catalog.addNode(f, NodeKind.of(NodeTemplate.RETURN)));
        assertEquals(3, ret.inputs().size());
        assertTrue(ret.outputs().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownArgumentRejected() {
        FunctionId f = catalog.addFunction("f", List.of(), List.of());
        catalog.addNode(f, NodeKind.symbol(NodeTemplate.ARGUMENT, "nope"));
    }

    @Test
    public void testVariableNodesResolveLocalThenMain() {
        catalog.addVariable(catalog.mainId(), "global", ValueType.integer(0));
        FunctionId f = catalog.addFunction("f", List.of(), List.of());
        catalog.addVariable(f, "local", ValueType.bool(true));
        GraphDocument doc = catalog.function(f).graph();

        Node get = doc.node(catalog.addNode(f, NodeKind.symbol(NodeTemplate.GET_VARIABLE, "global")));
        assertEquals(DataType.INTEGER, doc.output(get.outputs().get(0)).type());

        Node set = doc.node(catalog.addNode(f, NodeKind.symbol(NodeTemplate.SET_VARIABLE, "local")));
        assertEquals(DataType.BOOLEAN, doc.input(set.inputs().get(1)).type());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExecutionVariableCannotBeRead() {
        catalog.addVariable(catalog.mainId(), "flow", ValueType.EXECUTION);
        catalog.addNode(catalog.mainId(), NodeKind.symbol(NodeTemplate.GET_VARIABLE, "flow"));
    }
}
