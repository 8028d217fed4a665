package com.graphscript.api;

/** Opaque handle of a function. Never reused while the function lives. */
public record FunctionId(int index) {

    @Override
    public String toString() {
        return "function#" + index;
    }
}
