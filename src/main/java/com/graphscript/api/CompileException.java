package com.graphscript.api;

/**
 * Thrown when a graph cannot be compiled.
 *
 * <p>
 * For {@link CompileError#CYCLE_DETECTED} the exception names the edge that
 * closed the loop: {@link #outputId()} feeds {@link #inputId()}, and the
 * input's node was already being evaluated.
 */
public class CompileException extends Exception {
    private final CompileError error;
    private final OutputId outputId;
    private final InputId inputId;

    public CompileException(CompileError error, String detail) {
        this(error, detail, null, null);
    }

    private CompileException(CompileError error, String detail, OutputId outputId, InputId inputId) {
        super(detail == null || detail.isEmpty() ? error.description() : error.description() + ": " + detail);
        this.error = error;
        this.outputId = outputId;
        this.inputId = inputId;
    }

    public static CompileException cycle(OutputId outputId, InputId inputId) {
        return new CompileException(CompileError.CYCLE_DETECTED,
                outputId + " feeds " + inputId + " whose node is already being evaluated", outputId, inputId);
    }

    public CompileError error() {
        return error;
    }

    /** The output of the closing edge, or {@code null} when the error is not a cycle. */
    public OutputId outputId() {
        return outputId;
    }

    /** The input of the closing edge, or {@code null} when the error is not a cycle. */
    public InputId inputId() {
        return inputId;
    }
}
