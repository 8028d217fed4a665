package com.graphscript.template;

import java.util.ArrayList;
import java.util.List;

/**
 * The execution ports of a template.
 *
 * <ul>
 * <li>EXECUTE: a single execution output (Enter).</li>
 * <li>EXECUTED: a single execution input.</li>
 * <li>EXECUTED_AND_EXECUTE: one execution input, one or more named execution
 * outputs.</li>
 * <li>DATA: no execution ports.</li>
 * </ul>
 */
public record PortShape(Kind kind, String inName, List<String> outNames) {

    public enum Kind {
        EXECUTE, EXECUTED, EXECUTED_AND_EXECUTE, DATA
    }

    public PortShape {
        outNames = List.copyOf(outNames);
        if (kind == Kind.EXECUTED_AND_EXECUTE && outNames.isEmpty())
            throw new IllegalArgumentException("EXECUTED_AND_EXECUTE needs at least one execution output");
    }

    public static PortShape execute(String outName) {
        return new PortShape(Kind.EXECUTE, null, List.of(outName));
    }

    public static PortShape executed(String inName) {
        return new PortShape(Kind.EXECUTED, inName, List.of());
    }

    public static PortShape executedAndExecute(String inName, String... outNames) {
        return new PortShape(Kind.EXECUTED_AND_EXECUTE, inName, List.of(outNames));
    }

    public static PortShape data() {
        return new PortShape(Kind.DATA, null, List.of());
    }

    public boolean isControl() {
        return kind != Kind.DATA;
    }

    public boolean hasExecutionInput() {
        return kind == Kind.EXECUTED || kind == Kind.EXECUTED_AND_EXECUTE;
    }

    public List<InputSpec> executionInputs() {
        return hasExecutionInput() ? List.of(InputSpec.execution(inName)) : List.of();
    }

    public List<OutputSpec> executionOutputs() {
        List<OutputSpec> specs = new ArrayList<>(outNames.size());
        for (String name : outNames)
            specs.add(OutputSpec.execution(name));
        return specs;
    }
}
