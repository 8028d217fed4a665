package com.graphscript.engine;

import com.graphscript.api.CompileError;
import com.graphscript.api.CompileException;
import com.graphscript.api.FunctionId;
import com.graphscript.api.NodeId;
import com.graphscript.api.ValueType;
import com.graphscript.dsl.GraphBuilder;
import com.graphscript.function.FunctionIO;
import com.graphscript.template.TemplateRegistry;

import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FunctionInliningTest {

    private GraphBuilder g;
    private ScriptCompiler compiler;

    @Before
    public void setUp() {
        g = GraphBuilder.create();
        compiler = new ScriptCompiler();
    }

    // double(x) -> result = x + x
    private FunctionId defineDouble() {
        FunctionId twice = g.function("double",
                List.of(new FunctionIO("x", ValueType.integer(0))),
                List.of(new FunctionIO("result", ValueType.integer(0))));
        g.in(twice);
        NodeId x = g.argument("x");
        NodeId sum = g.addNumber(0, 0);
        NodeId ret = g.returns();
        g.wire(x, 0, sum, 0).wire(x, 0, sum, 1).wire(sum, 0, ret, 0);
        g.inMain();
        return twice;
    }

    @Test
    public void testArgumentsAndReturnsAreBound() throws CompileException {
        FunctionId twice = defineDouble();
        String total = g.variable("total", ValueType.integer(0));
        NodeId call = g.call(twice);
        g.constant(call, 0, ValueType.integer(21));
        NodeId store = g.setVariable(total);
        g.wire(call, 0, store, 0);
        g.sequence(g.enter(), call, store);

        assertEquals(List.of(
                "(local total 0)",
                "(local var_1 nil)",
                "(do (local arg_2 21) (set var_1 (+ arg_2 arg_2)))",
                "(set total var_1)"), compiler.compile(g.catalog()).fragments());
    }

    @Test
    public void testEachCallGetsFreshNames() throws CompileException {
        FunctionId twice = defineDouble();
        String total = g.variable("total", ValueType.integer(0));
        NodeId first = g.call(twice);
        NodeId second = g.call(twice);
        NodeId store = g.setVariable(total);
        g.constant(first, 0, ValueType.integer(1));
        g.wire(first, 0, second, 0).wire(second, 0, store, 0);
        g.sequence(g.enter(), first, second, store);

        assertEquals("(local total 0)"
                + " (local var_1 nil) (do (local arg_2 1) (set var_1 (+ arg_2 arg_2)))"
                + " (local var_3 nil) (do (local arg_4 var_1) (set var_3 (+ arg_4 arg_4)))"
                + " (set total var_3)", compiler.compile(g.catalog()).render());
    }

    @Test
    public void testCalleeVariablesAndFlow() throws CompileException {
        FunctionId greet = g.function("greet", List.of(new FunctionIO("name", ValueType.string(""))), List.of());
        g.in(greet);
        String greeting = g.variable("greeting", ValueType.string("Hi "));
        NodeId get = g.getVariable(greeting);
        NodeId arg = g.argument("name");
        NodeId concat = g.addString("", "");
        NodeId print = g.print("");
        NodeId bye = g.print("bye");
        g.wire(get, 0, concat, 0).wire(arg, 0, concat, 1).wire(concat, 0, print, 0);
        g.sequence(print, bye);

        g.inMain();
        NodeId call = g.call(greet);
        g.constant(call, 0, ValueType.string("Bob"));
        g.sequence(g.enter(), call, g.print("end"));

        assertEquals("(do (local arg_1 \"Bob\") (local greeting \"Hi \")"
                + " (io.write (.. greeting arg_1)) (io.write \"bye\")) (io.write \"end\")",
                compiler.compile(g.catalog()).render());
    }

    @Test
    public void testEmptyFunctionInlinesToNothing() throws CompileException {
        FunctionId noop = g.function("noop", List.of(), List.of());
        g.sequence(g.enter(), g.call(noop), g.print("after"));
        assertEquals("(io.write \"after\")", compiler.compile(g.catalog()).render());
    }

    @Test
    public void testRecursionDisabled() {
        FunctionId f = g.function("f", List.of(), List.of());
        g.in(f);
        g.call(f);
        g.inMain();
        g.sequence(g.enter(), g.call(f));

        assertError(CompileError.RECURSIVE_FUNCTION_DISABLED);
    }

    @Test
    public void testRecursionStopsAtMaxDepth() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setDisableRecursiveFunctions(false);
        config.setMaxInlineDepth(3);
        compiler = new ScriptCompiler(new TemplateRegistry(), config);

        FunctionId f = g.function("f", List.of(), List.of());
        g.in(f);
        g.call(f);
        g.inMain();
        g.sequence(g.enter(), g.call(f));

        CompileException e = assertError(CompileError.INLINE_DEPTH_EXCEEDED);
        assertTrue(e.getMessage().contains("3"));
    }

    @Test
    public void testGuardedRecursionStillExceedsDepth() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setDisableRecursiveFunctions(false);
        config.setMaxInlineDepth(4);
        compiler = new ScriptCompiler(new TemplateRegistry(), config);

        // f: if (cond) { f() } else { print("done") }
        FunctionId f = g.function("f", List.of(), List.of());
        g.in(f);
        NodeId test = g.branch(false);
        g.then(test, "If", g.call(f)).then(test, "Else", g.print("done"));
        g.inMain();
        g.sequence(g.enter(), g.call(f));

        assertError(CompileError.INLINE_DEPTH_EXCEEDED);
    }

    @Test
    public void testMutualRecursionDetected() {
        FunctionId a = g.function("a", List.of(), List.of());
        FunctionId b = g.function("b", List.of(), List.of());
        g.in(a).call(b);
        g.in(b).call(a);
        g.inMain();
        g.sequence(g.enter(), g.call(a));

        assertError(CompileError.RECURSIVE_FUNCTION_DISABLED);
    }

    @Test
    public void testRemovedCalleeIsUnknownReference() {
        FunctionId f = g.function("f", List.of(), List.of());
        g.sequence(g.enter(), g.call(f));
        g.catalog().removeFunction(f);

        assertError(CompileError.UNKNOWN_FUNCTION_REFERENCE);
    }

    @Test
    public void testCallingMainRejected() {
        g.sequence(g.enter(), g.call(g.catalog().mainId()));
        assertError(CompileError.MAIN_FUNCTION_CALL);
    }

    @Test
    public void testUnsetOperandUsesSignatureDefault() throws CompileException {
        FunctionId twice = defineDouble();
        g.sequence(g.enter(), g.call(twice));

        assertEquals("(local var_1 nil) (do (local arg_2 0) (set var_1 (+ arg_2 arg_2)))",
                compiler.compile(g.catalog()).render());
    }

    private CompileException assertError(CompileError expected) {
        try {
            compiler.compile(g.catalog());
            fail("Expected " + expected);
            return null;
        } catch (CompileException e) {
            assertEquals(expected, e.error());
            return e;
        }
    }
}
