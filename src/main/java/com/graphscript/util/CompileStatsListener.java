package com.graphscript.util;

import com.graphscript.api.CompileError;
import com.graphscript.api.CompileException;
import com.graphscript.api.CompileListener;
import com.graphscript.api.FunctionId;
import com.graphscript.api.NodeId;

import java.util.Map;
import java.util.TreeMap;

/**
 * Counts what the compiler did: statements and expressions per template label,
 * completed and failed compilations, and the error of the last failure.
 */
public class CompileStatsListener implements CompileListener {
    private final Map<String, Integer> statements = new TreeMap<>();
    private final Map<String, Integer> expressions = new TreeMap<>();
    private long compilations;
    private long failures;
    private CompileError lastError;
    private long startNanos;
    private long lastDurationNanos;

    @Override
    public void onCompileStart(FunctionId mainId) {
        startNanos = System.nanoTime();
    }

    @Override
    public void onStatementCompiled(FunctionId functionId, NodeId nodeId, String template) {
        statements.merge(template, 1, Integer::sum);
    }

    @Override
    public void onExpressionEvaluated(FunctionId functionId, NodeId nodeId, String template) {
        expressions.merge(template, 1, Integer::sum);
    }

    @Override
    public void onCompileEnd(FunctionId mainId, CompileException error) {
        lastDurationNanos = System.nanoTime() - startNanos;
        compilations++;
        if (error != null) {
            failures++;
            lastError = error.error();
        }
    }

    /** Statements compiled for a template label, over all compilations. */
    public int statementCount(String template) {
        return statements.getOrDefault(template, 0);
    }

    /** Evaluations of a data template label, over all compilations. Cache hits are not counted. */
    public int expressionCount(String template) {
        return expressions.getOrDefault(template, 0);
    }

    public long compilations() {
        return compilations;
    }

    public long failures() {
        return failures;
    }

    /** @return Error of the most recent failed compilation, or {@code null}. */
    public CompileError lastError() {
        return lastError;
    }

    public long lastDurationNanos() {
        return lastDurationNanos;
    }

    public void reset() {
        statements.clear();
        expressions.clear();
        compilations = 0;
        failures = 0;
        lastError = null;
        lastDurationNanos = 0;
    }

    @Override
    public String toString() {
        return "compilations=" + compilations + ", failures=" + failures + ", statements=" + statements
                + ", expressions=" + expressions;
    }
}
