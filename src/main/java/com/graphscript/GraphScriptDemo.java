package com.graphscript;

import com.graphscript.api.CompileException;
import com.graphscript.api.FunctionId;
import com.graphscript.api.NodeId;
import com.graphscript.api.Script;
import com.graphscript.api.ValueType;
import com.graphscript.dsl.GraphBuilder;
import com.graphscript.engine.ScriptCompiler;
import com.graphscript.function.FunctionIO;
import com.graphscript.template.NodeTemplate;
import com.graphscript.util.CompileStatsListener;
import com.graphscript.util.GraphExplain;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds a few sample programs and logs the scripts they compile to.
 */
public class GraphScriptDemo {
    private static final Logger log = LogManager.getLogger(GraphScriptDemo.class);

    public static void main(String[] args) throws CompileException {
        ScriptCompiler compiler = GraphScript.compiler();
        CompileStatsListener stats = new CompileStatsListener();
        compiler.setListener(stats);

        log.info("Hello:    {}", compiler.compile(hello().catalog()).render());
        log.info("Greeting: {}", compiler.compile(greeting().catalog()).render());
        log.info("Branch:   {}", compiler.compile(branch().catalog()).render());

        GraphBuilder call = functionCall();
        Script script = compiler.compile(call.catalog());
        log.info("Function:\n{}", script.render("\n"));
        log.info("Graph:\n{}", new GraphExplain(call.catalog()).dumpCatalog());

        log.info("Stats: {}", stats);
    }

    // Enter -> Print("Hello, world")
    static GraphBuilder hello() {
        GraphBuilder g = GraphScript.builder();
        g.sequence(g.enter(), g.print("Hello, world"));
        return g;
    }

    // Enter -> Ask("Name?") -> Print("Hi " .. answer)
    static GraphBuilder greeting() {
        GraphBuilder g = GraphScript.builder();
        NodeId ask = g.ask("Name?");
        NodeId concat = g.addString("Hi ", "");
        NodeId print = g.print("");
        g.wire(ask, 0, concat, 1).wire(concat, 0, print, 0);
        g.sequence(g.enter(), ask, print);
        return g;
    }

    // Enter -> If(flag) { Print("yes") } else { Print("no") } -> Print("done")
    static GraphBuilder branch() {
        GraphBuilder g = GraphScript.builder();
        String flag = g.variable("flag", ValueType.bool(true));
        NodeId enter = g.enter();
        NodeId cond = g.getVariable(flag);
        NodeId test = g.node(NodeTemplate.IF);
        g.wire(cond, 0, test, 0);
        g.then(enter, test)
                .then(test, "If", g.print("yes"))
                .then(test, "Else", g.print("no"))
                .then(test, "Continue", g.print("done"));
        return g;
    }

    // total = double(21), where double(x) returns x + x
    static GraphBuilder functionCall() {
        GraphBuilder g = GraphScript.builder();
        FunctionId twice = g.function("double",
                List.of(new FunctionIO("x", ValueType.integer(0))),
                List.of(new FunctionIO("result", ValueType.integer(0))));

        g.in(twice);
        NodeId x = g.argument("x");
        NodeId sum = g.addNumber(0, 0);
        NodeId ret = g.returns();
        g.wire(x, 0, sum, 0).wire(x, 0, sum, 1).wire(sum, 0, ret, 0);

        g.inMain();
        String total = g.variable("total", ValueType.integer(0));
        NodeId enter = g.enter();
        NodeId call = g.call(twice);
        g.constant(call, 0, ValueType.integer(21));
        NodeId store = g.setVariable(total);
        g.wire(call, 0, store, 0);
        g.sequence(enter, call, store);
        return g;
    }
}
