package com.graphscript.engine;

import com.graphscript.api.CompileException;
import com.graphscript.api.CompileListener;
import com.graphscript.api.FunctionId;
import com.graphscript.api.NodeId;
import com.graphscript.api.Script;
import com.graphscript.function.FunctionCatalog;
import com.graphscript.function.GraphFunction;
import com.graphscript.template.TemplateRegistry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns a {@link FunctionCatalog} into script text, starting from its Enter
 * node.
 *
 * Steps of {@link #compile(FunctionCatalog, FunctionId)}:
 *
 * 1. Validate: exactly one Enter node, located in the start function.
 *
 * 2. Prelude: one {@code (local <name> <literal>)} per variable of the start
 * function, in declaration order. Execution-typed variables are skipped.
 *
 * 3. Flow: compile the Enter node and everything reachable from its execution
 * output. Function nodes are inlined at their call site.
 *
 * Every call works on fresh state (caches, name counter, call stack), so the
 * same input always yields the same script. The catalog is only read.
 *
 * Not thread-safe with respect to the catalog: do not mutate it while a
 * compilation runs.
 */
public final class ScriptCompiler {
    private static final Logger log = LogManager.getLogger(ScriptCompiler.class);

    private final TemplateRegistry templates;
    private final CompilerConfig config;
    private CompileListener listener;

    public ScriptCompiler() {
        this(new TemplateRegistry(), CompilerConfig.defaults());
    }

    public ScriptCompiler(TemplateRegistry templates) {
        this(templates, CompilerConfig.defaults());
    }

    public ScriptCompiler(TemplateRegistry templates, CompilerConfig config) {
        this.templates = templates;
        this.config = config;
    }

    public void setListener(CompileListener listener) {
        this.listener = listener;
    }

    public TemplateRegistry templates() {
        return templates;
    }

    public CompilerConfig config() {
        return config;
    }

    /** Compiles the catalog starting from its Main function. */
    public Script compile(FunctionCatalog catalog) throws CompileException {
        return compile(catalog, catalog.mainId());
    }

    /**
     * Compiles the program whose entry function is {@code mainId}.
     *
     * @throws CompileException the first error met; no partial script is
     *                          returned.
     */
    public Script compile(FunctionCatalog catalog, FunctionId mainId) throws CompileException {
        final CompileListener l = this.listener;
        if (l != null)
            l.onCompileStart(mainId);

        GraphFunction main = catalog.function(mainId);
        log.info("Compiling {} ({} functions)", main.name(), catalog.functions().size());
        long start = System.nanoTime();
        try {
            NodeId enter = EnterNodeValidator.validate(catalog, mainId);

            CompileSession session = new CompileSession(catalog, templates, config, l);
            ExecutionFlowCompiler flow = new ExecutionFlowCompiler(session);
            Frame root = Frame.root(main);

            Script prelude = Declarations.of(main.variables());
            session.enter(mainId);
            Script body;
            try {
                body = flow.compile(root, main.graph().node(enter));
            } finally {
                session.exit();
            }

            Script script = prelude.then(body);
            log.info("Compiled {} into {} statements in {} us", main.name(), script.fragments().size(),
                    (System.nanoTime() - start) / 1000);
            if (l != null)
                l.onCompileEnd(mainId, null);
            return script;
        } catch (CompileException e) {
            log.warn("Compilation of {} failed: {}", main.name(), e.getMessage());
            if (l != null)
                l.onCompileEnd(mainId, e);
            throw e;
        }
    }
}
