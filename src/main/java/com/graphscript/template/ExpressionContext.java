package com.graphscript.template;

import com.graphscript.graph.NodeKind;

import java.util.List;

/**
 * Input of an expression hook: the node's kind and the expression text of its
 * data inputs, in port order.
 */
public record ExpressionContext(NodeKind kind, List<String> operands) {

    public ExpressionContext {
        operands = List.copyOf(operands);
    }

    public String operand(int i) {
        return operands.get(i);
    }
}
