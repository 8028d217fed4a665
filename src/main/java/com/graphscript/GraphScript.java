package com.graphscript;

import com.graphscript.dsl.GraphBuilder;
import com.graphscript.engine.CompilerConfig;
import com.graphscript.engine.ScriptCompiler;
import com.graphscript.function.FunctionCatalog;
import com.graphscript.template.TemplateRegistry;

/**
 * GraphScript -- compiles visual node graphs into script text.
 *
 * <h2>Model</h2>
 * <p>
 * A program is a {@link FunctionCatalog}: a Main function plus user functions,
 * each owning a graph of nodes connected through typed ports.
 * <ul>
 * <li><b>Execution</b> connections order statements (Enter, Print, Ask, If,
 * Function, Set Variable, Return).</li>
 * <li><b>Data</b> connections feed values into them (literals, Add, Get
 * Variable, Argument, outputs of earlier statements).</li>
 * </ul>
 *
 * <h3>Compilation</h3>
 * <ul>
 * <li>Starts at the unique Enter node of Main and walks execution
 * connections.</li>
 * <li>Data expressions are resolved on demand and shared data nodes are
 * evaluated once.</li>
 * <li>Function nodes are inlined at their call site.</li>
 * </ul>
 */
public final class GraphScript {

    private GraphScript() {
        // Prevent instantiation of utility class
    }

    /** A new, empty program holding only Main. */
    public static FunctionCatalog catalog() {
        return new FunctionCatalog();
    }

    /** A builder over a new, empty program. */
    public static GraphBuilder builder() {
        return GraphBuilder.create();
    }

    /** A compiler with built-in templates and the settings of {@code graphscript.json}, if present. */
    public static ScriptCompiler compiler() {
        return compiler(CompilerConfig.load());
    }

    public static ScriptCompiler compiler(CompilerConfig config) {
        return new ScriptCompiler(new TemplateRegistry(), config);
    }
}
