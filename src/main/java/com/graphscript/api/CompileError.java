package com.graphscript.api;

/**
 * Structural errors that abort a compilation. The first one encountered wins;
 * no partial script is ever produced.
 */
public enum CompileError {
    MISSING_ENTER_NODE("You don't have any Enter node"),
    MULTIPLE_ENTER_NODES("You have too many Enter nodes"),
    ENTER_IN_FUNCTION("An Enter node is placed in a function"),
    CYCLE_DETECTED("Data cycle detected"),
    RECURSIVE_FUNCTION_DISABLED("Recursive functions are disabled"),
    UNKNOWN_FUNCTION_REFERENCE("Function node does not reference an existing function"),
    MISSING_REQUIRED_OPERAND("Required operand is missing"),
    MAIN_FUNCTION_CALL("Main cannot be called from a Function node"),
    INLINE_DEPTH_EXCEEDED("Function inlining exceeded the maximum depth");

    private final String description;

    CompileError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
