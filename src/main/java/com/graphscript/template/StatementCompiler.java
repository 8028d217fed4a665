package com.graphscript.template;

import com.graphscript.api.CompileException;
import com.graphscript.api.Script;

/**
 * Statement hook of a control template. Pure: formats already-resolved text
 * and never traverses the graph.
 */
@FunctionalInterface
public interface StatementCompiler {
    Script compile(StatementContext ctx) throws CompileException;
}
