package com.graphscript.graph;

import com.graphscript.api.FunctionId;
import com.graphscript.template.NodeTemplate;

import java.util.Objects;

/**
 * A node's template together with its kind-specific parameters.
 *
 * <p>
 * {@code function} is the callee of a FUNCTION node ({@code null} until one is
 * chosen). {@code symbol} is the variable name of GET_VARIABLE / SET_VARIABLE
 * nodes and the argument name of ARGUMENT nodes.
 */
public record NodeKind(NodeTemplate template, FunctionId function, String symbol) {

    public NodeKind {
        Objects.requireNonNull(template, "template");
        if (function != null && template != NodeTemplate.FUNCTION)
            throw new IllegalArgumentException(template + " does not reference a function");
        if (template.requiresSymbol() && (symbol == null || symbol.isEmpty()))
            throw new IllegalArgumentException(template + " requires a symbol");
    }

    public static NodeKind of(NodeTemplate template) {
        return new NodeKind(template, null, null);
    }

    public static NodeKind function(FunctionId callee) {
        return new NodeKind(NodeTemplate.FUNCTION, callee, null);
    }

    public static NodeKind symbol(NodeTemplate template, String symbol) {
        return new NodeKind(template, null, symbol);
    }

    @Override
    public String toString() {
        if (function != null)
            return template + "(" + function + ")";
        if (symbol != null)
            return template + "(" + symbol + ")";
        return template.toString();
    }
}
