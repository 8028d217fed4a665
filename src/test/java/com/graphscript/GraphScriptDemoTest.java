package com.graphscript;

import com.graphscript.api.CompileException;
import com.graphscript.engine.ScriptCompiler;

import org.junit.Test;

import static org.junit.Assert.*;

public class GraphScriptDemoTest {

    private final ScriptCompiler compiler = GraphScript.compiler();

    @Test
    public void testHello() throws CompileException {
        assertEquals("(io.write \"Hello, world\")", compiler.compile(GraphScriptDemo.hello().catalog()).render());
    }

    @Test
    public void testGreeting() throws CompileException {
        assertEquals("(io.write \"Name?\") (local var_1 (io.read)) (io.write (.. \"Hi \" var_1))",
                compiler.compile(GraphScriptDemo.greeting().catalog()).render());
    }

    @Test
    public void testBranch() throws CompileException {
        assertEquals("(local flag true) (if flag (do (io.write \"yes\")) (do (io.write \"no\"))) (io.write \"done\")",
                compiler.compile(GraphScriptDemo.branch().catalog()).render());
    }

    @Test
    public void testFunctionCall() throws CompileException {
        assertEquals("(local total 0) (local var_1 nil) (do (local arg_2 21) (set var_1 (+ arg_2 arg_2)))"
                + " (set total var_1)",
                compiler.compile(GraphScriptDemo.functionCall().catalog()).render());
    }

    @Test
    public void testMainRuns() throws CompileException {
        GraphScriptDemo.main(new String[0]);
    }
}
