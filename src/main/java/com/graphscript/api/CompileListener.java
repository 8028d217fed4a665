package com.graphscript.api;

/**
 * Observability interface for monitoring a compilation.
 *
 * Implementations can be registered with the ScriptCompiler to receive
 * callbacks while a graph is turned into script text. Typical uses are tracing
 * which nodes were visited, counting expression evaluations to confirm that
 * shared data nodes are evaluated once, and timing compilations.
 *
 * Callbacks run synchronously on the compiling thread and must not mutate the
 * graph.
 */
public interface CompileListener {

    /**
     * Called before validation starts.
     *
     * @param mainId The function compilation starts from.
     */
    void onCompileStart(FunctionId mainId);

    /**
     * Called after a control node produced its statement fragment.
     *
     * @param functionId The function whose graph holds the node.
     * @param nodeId     The compiled node.
     * @param template   Label of the node's template.
     */
    void onStatementCompiled(FunctionId functionId, NodeId nodeId, String template);

    /**
     * Called after a data node was evaluated. Cache hits do not trigger this.
     *
     * @param functionId The function whose graph holds the node.
     * @param nodeId     The evaluated node.
     * @param template   Label of the node's template.
     */
    void onExpressionEvaluated(FunctionId functionId, NodeId nodeId, String template);

    /**
     * Called once the compilation finished, successfully or not.
     *
     * @param mainId The function compilation started from.
     * @param error  The error that aborted the compilation, or {@code null} on
     *               success.
     */
    void onCompileEnd(FunctionId mainId, CompileException error);
}
