package com.graphscript.api;

/**
 * The type of a port.
 *
 * {@link #EXECUTION} marks control-flow ports. They carry no value and only
 * decide the order in which statements are emitted.
 */
public enum DataType {
    STRING("String"),
    INTEGER("Integer"),
    FLOAT("Float"),
    BOOLEAN("Boolean"),
    EXECUTION("Execution");

    private final String displayName;

    DataType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isExecution() {
        return this == EXECUTION;
    }
}
