package com.graphscript.dsl;

import com.graphscript.api.FunctionId;
import com.graphscript.api.InputId;
import com.graphscript.api.NodeId;
import com.graphscript.api.OutputId;
import com.graphscript.api.ValueType;
import com.graphscript.function.FunctionCatalog;
import com.graphscript.function.FunctionIO;
import com.graphscript.graph.GraphDocument;
import com.graphscript.graph.NodeKind;
import com.graphscript.template.NodeTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Graph Builder -- fluent construction of a program on top of a
 * {@link FunctionCatalog}.
 *
 * The builder drives the same mutation API an editor would. Nodes are added to
 * the current function (Main unless {@link #in(FunctionId)} selected another);
 * ports are addressed by position among the node's data ports, execution ports
 * by name.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create();
 * 2. Add nodes: NodeId enter = g.enter(); NodeId hi = g.print("hi");
 * 3. Wire control flow: g.sequence(enter, hi);
 * 4. Wire data: g.wire(ask, 0, print, 0);
 * 5. Compile: new ScriptCompiler().compile(g.catalog());
 */
public final class GraphBuilder {
    private final FunctionCatalog catalog;
    private FunctionId current;

    private GraphBuilder(FunctionCatalog catalog) {
        this.catalog = catalog;
        this.current = catalog.mainId();
    }

    public static GraphBuilder create() {
        return new GraphBuilder(new FunctionCatalog());
    }

    public static GraphBuilder create(FunctionCatalog catalog) {
        return new GraphBuilder(catalog);
    }

    public FunctionCatalog catalog() {
        return catalog;
    }

    /** The function new nodes are added to. */
    public FunctionId current() {
        return current;
    }

    /** Selects the function subsequent calls operate on. */
    public GraphBuilder in(FunctionId function) {
        catalog.function(function);
        this.current = function;
        return this;
    }

    public GraphBuilder inMain() {
        return in(catalog.mainId());
    }

    // ── Functions and variables ──────────────────────────────────

    public FunctionId function(String name, List<FunctionIO> inputs, List<FunctionIO> outputs) {
        return catalog.addFunction(name, inputs, outputs);
    }

    /** Declares a variable in the current function and returns its (uniquified) name. */
    public String variable(String name, ValueType value) {
        return catalog.addVariable(current, name, value);
    }

    // ── Nodes ────────────────────────────────────────────────────

    public NodeId node(NodeTemplate template) {
        return catalog.addNode(current, NodeKind.of(template));
    }

    public NodeId enter() {
        return node(NodeTemplate.ENTER);
    }

    public NodeId print(String text) {
        NodeId id = node(NodeTemplate.PRINT);
        constant(id, 0, ValueType.string(text));
        return id;
    }

    public NodeId ask(String prompt) {
        NodeId id = node(NodeTemplate.ASK);
        constant(id, 0, ValueType.string(prompt));
        return id;
    }

    public NodeId branch(boolean condition) {
        NodeId id = node(NodeTemplate.IF);
        constant(id, 0, ValueType.bool(condition));
        return id;
    }

    public NodeId addNumber(int a, int b) {
        NodeId id = node(NodeTemplate.ADD_NUMBER);
        constant(id, 0, ValueType.integer(a));
        constant(id, 1, ValueType.integer(b));
        return id;
    }

    public NodeId addString(String a, String b) {
        NodeId id = node(NodeTemplate.ADD_STRING);
        constant(id, 0, ValueType.string(a));
        constant(id, 1, ValueType.string(b));
        return id;
    }

    /** A Function node calling {@code callee}, with ports mirroring its signature. */
    public NodeId call(FunctionId callee) {
        return catalog.addNode(current, NodeKind.function(callee));
    }

    public NodeId argument(String name) {
        return catalog.addNode(current, NodeKind.symbol(NodeTemplate.ARGUMENT, name));
    }

    public NodeId returns() {
        return node(NodeTemplate.RETURN);
    }

    public NodeId getVariable(String name) {
        return catalog.addNode(current, NodeKind.symbol(NodeTemplate.GET_VARIABLE, name));
    }

    public NodeId setVariable(String name) {
        return catalog.addNode(current, NodeKind.symbol(NodeTemplate.SET_VARIABLE, name));
    }

    // ── Wiring ───────────────────────────────────────────────────

    /** Connects each node's first execution output to the next node's execution input. */
    public GraphBuilder sequence(NodeId... nodes) {
        for (int i = 0; i + 1 < nodes.length; i++)
            then(nodes[i], nodes[i + 1]);
        return this;
    }

    public GraphBuilder then(NodeId from, NodeId to) {
        List<OutputId> outs = executionOutputs(from);
        if (outs.isEmpty())
            throw new IllegalArgumentException(from + " has no execution output");
        doc().connect(outs.get(0), executionInput(to));
        return this;
    }

    /** Connects the execution output called {@code output} (e.g. "If", "Else", "Continue"). */
    public GraphBuilder then(NodeId from, String output, NodeId to) {
        GraphDocument doc = doc();
        for (OutputId out : executionOutputs(from)) {
            if (doc.output(out).name().equals(output)) {
                doc.connect(out, executionInput(to));
                return this;
            }
        }
        throw new IllegalArgumentException(from + " has no execution output named " + output);
    }

    /** Connects data output {@code output} of {@code from} to data input {@code input} of {@code to}. */
    public GraphBuilder wire(NodeId from, int output, NodeId to, int input) {
        doc().connect(dataOutput(from, output), dataInput(to, input));
        return this;
    }

    /** Sets the inline value of a data input. */
    public GraphBuilder constant(NodeId node, int input, ValueType value) {
        doc().setInlineValue(dataInput(node, input), value);
        return this;
    }

    /** The {@code index}-th data input of a node, execution inputs not counted. */
    public InputId dataInput(NodeId node, int index) {
        GraphDocument doc = doc();
        List<InputId> data = new ArrayList<>();
        for (InputId in : doc.node(node).inputs())
            if (!doc.input(in).type().isExecution())
                data.add(in);
        if (index < 0 || index >= data.size())
            throw new IllegalArgumentException(node + " has no data input #" + index);
        return data.get(index);
    }

    /** The {@code index}-th data output of a node, execution outputs not counted. */
    public OutputId dataOutput(NodeId node, int index) {
        GraphDocument doc = doc();
        List<OutputId> data = new ArrayList<>();
        for (OutputId out : doc.node(node).outputs())
            if (!doc.output(out).type().isExecution())
                data.add(out);
        if (index < 0 || index >= data.size())
            throw new IllegalArgumentException(node + " has no data output #" + index);
        return data.get(index);
    }

    private InputId executionInput(NodeId node) {
        GraphDocument doc = doc();
        for (InputId in : doc.node(node).inputs())
            if (doc.input(in).type().isExecution())
                return in;
        throw new IllegalArgumentException(node + " has no execution input");
    }

    private List<OutputId> executionOutputs(NodeId node) {
        GraphDocument doc = doc();
        List<OutputId> result = new ArrayList<>();
        for (OutputId out : doc.node(node).outputs())
            if (doc.output(out).type().isExecution())
                result.add(out);
        return result;
    }

    private GraphDocument doc() {
        return catalog.function(current).graph();
    }
}
