package com.graphscript.util;

import com.graphscript.api.CompileError;
import com.graphscript.api.CompileException;
import com.graphscript.api.FunctionId;
import com.graphscript.api.NodeId;

import org.junit.Test;

import static org.junit.Assert.*;

public class CompileListenerTest {

    @Test
    public void testCompositeForwardsToAll() {
        CompileStatsListener first = new CompileStatsListener();
        CompileStatsListener second = new CompileStatsListener();
        CompositeCompileListener composite = new CompositeCompileListener();
        composite.addForComposite(first);
        composite.addForComposite(second);

        FunctionId main = new FunctionId(0);
        composite.onCompileStart(main);
        composite.onStatementCompiled(main, new NodeId(0), "Print");
        composite.onExpressionEvaluated(main, new NodeId(1), "Add Number");
        composite.onCompileEnd(main, null);

        for (CompileStatsListener l : new CompileStatsListener[] { first, second }) {
            assertEquals(1, l.statementCount("Print"));
            assertEquals(1, l.expressionCount("Add Number"));
            assertEquals(1, l.compilations());
        }
    }

    @Test
    public void testStatsRecordFailuresAndReset() {
        CompileStatsListener stats = new CompileStatsListener();
        FunctionId main = new FunctionId(0);

        stats.onCompileStart(main);
        stats.onCompileEnd(main, new CompileException(CompileError.MISSING_ENTER_NODE, "Main"));
        assertEquals(1, stats.failures());
        assertEquals(CompileError.MISSING_ENTER_NODE, stats.lastError());
        assertEquals(0, stats.statementCount("Print"));

        stats.reset();
        assertEquals(0, stats.compilations());
        assertNull(stats.lastError());
    }
}
