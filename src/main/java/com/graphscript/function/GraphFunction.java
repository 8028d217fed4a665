package com.graphscript.function;

import com.graphscript.api.FunctionId;
import com.graphscript.graph.GraphDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named sub-graph: its own document, its declared signature and its local
 * variable declarations.
 *
 * <p>
 * The signature is fixed at creation. Name and variables are changed through
 * {@link FunctionCatalog}, which keeps names unique.
 */
public final class GraphFunction {
    private final FunctionId id;
    private String name;
    private final GraphDocument graph = new GraphDocument();
    private final List<FunctionIO> inputs;
    private final List<FunctionIO> outputs;
    private final List<Variable> variables = new ArrayList<>();
    private final boolean removable;
    private final boolean renamable;

    GraphFunction(FunctionId id, String name, List<FunctionIO> inputs, List<FunctionIO> outputs,
            boolean removable, boolean renamable) {
        this.id = id;
        this.name = name;
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.removable = removable;
        this.renamable = renamable;
    }

    public FunctionId id() {
        return id;
    }

    public String name() {
        return name;
    }

    public GraphDocument graph() {
        return graph;
    }

    public List<FunctionIO> inputs() {
        return inputs;
    }

    public List<FunctionIO> outputs() {
        return outputs;
    }

    /** Variable declarations, in declaration order. */
    public List<Variable> variables() {
        return Collections.unmodifiableList(variables);
    }

    public boolean removable() {
        return removable;
    }

    public boolean renamable() {
        return renamable;
    }

    /** The declared input called {@code name}, or {@code null}. */
    public FunctionIO input(String name) {
        for (FunctionIO io : inputs)
            if (io.name().equals(name))
                return io;
        return null;
    }

    /** The variable called {@code name}, or {@code null}. */
    public Variable variable(String name) {
        for (Variable v : variables)
            if (v.name().equals(name))
                return v;
        return null;
    }

    void name(String name) {
        this.name = name;
    }

    List<Variable> mutableVariables() {
        return variables;
    }

    @Override
    public String toString() {
        return name + "(" + id + ")";
    }
}
