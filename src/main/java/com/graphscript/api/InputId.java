package com.graphscript.api;

/** Opaque handle of an input. Never reused while the input lives. */
public record InputId(int index) {

    @Override
    public String toString() {
        return "input#" + index;
    }
}
