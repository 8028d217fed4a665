package com.graphscript.template;

import com.graphscript.api.CompileException;

/**
 * Expression hook of a data template. Pure: formats already-resolved operand
 * text and never traverses the graph.
 */
@FunctionalInterface
public interface ExpressionEvaluator {
    String evaluate(ExpressionContext ctx) throws CompileException;
}
