package com.graphscript.engine;

import com.graphscript.api.CompileListener;
import com.graphscript.api.FunctionId;
import com.graphscript.api.NodeId;
import com.graphscript.function.FunctionCatalog;
import com.graphscript.template.TemplateRegistry;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * State shared by every frame of one compile() call: the inputs, the name
 * allocator and the stack of functions being inlined. Discarded when the call
 * returns.
 */
final class CompileSession {
    private final FunctionCatalog catalog;
    private final TemplateRegistry templates;
    private final CompilerConfig config;
    private final CompileListener listener;

    private final Deque<FunctionId> callStack = new ArrayDeque<>();
    private int nextName;

    CompileSession(FunctionCatalog catalog, TemplateRegistry templates, CompilerConfig config,
            CompileListener listener) {
        this.catalog = catalog;
        this.templates = templates;
        this.config = config;
        this.listener = listener;
    }

    FunctionCatalog catalog() {
        return catalog;
    }

    TemplateRegistry templates() {
        return templates;
    }

    CompilerConfig config() {
        return config;
    }

    // One counter for both prefixes keeps names unique even if the prefixes match.
    String newTemporary() {
        return config.getTemporaryPrefix() + (++nextName);
    }

    String newArgument() {
        return config.getArgumentPrefix() + (++nextName);
    }

    void enter(FunctionId function) {
        callStack.push(function);
    }

    void exit() {
        callStack.pop();
    }

    boolean isActive(FunctionId function) {
        return callStack.contains(function);
    }

    /** Number of inlined calls currently open, Main excluded. */
    int inlineDepth() {
        return Math.max(0, callStack.size() - 1);
    }

    void statementCompiled(Frame frame, NodeId node, String template) {
        if (listener != null)
            listener.onStatementCompiled(frame.function().id(), node, template);
    }

    void expressionEvaluated(Frame frame, NodeId node, String template) {
        if (listener != null)
            listener.onExpressionEvaluated(frame.function().id(), node, template);
    }
}
