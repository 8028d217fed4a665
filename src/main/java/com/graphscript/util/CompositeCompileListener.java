package com.graphscript.util;

import com.graphscript.api.CompileException;
import com.graphscript.api.CompileListener;
import com.graphscript.api.FunctionId;
import com.graphscript.api.NodeId;

import java.util.Arrays;

/** Fans every {@link CompileListener} callback out to several listeners, in registration order. */
public class CompositeCompileListener implements CompileListener {
    private CompileListener[] listeners = new CompileListener[0];

    public void addForComposite(CompileListener listener) {
        CompileListener[] old = listeners;
        CompileListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    @Override
    public void onCompileStart(FunctionId mainId) {
        for (CompileListener l : listeners)
            l.onCompileStart(mainId);
    }

    @Override
    public void onStatementCompiled(FunctionId functionId, NodeId nodeId, String template) {
        for (CompileListener l : listeners)
            l.onStatementCompiled(functionId, nodeId, template);
    }

    @Override
    public void onExpressionEvaluated(FunctionId functionId, NodeId nodeId, String template) {
        for (CompileListener l : listeners)
            l.onExpressionEvaluated(functionId, nodeId, template);
    }

    @Override
    public void onCompileEnd(FunctionId mainId, CompileException error) {
        for (CompileListener l : listeners)
            l.onCompileEnd(mainId, error);
    }
}
