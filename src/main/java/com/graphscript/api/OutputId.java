package com.graphscript.api;

/** Opaque handle of an output. Never reused while the output lives. */
public record OutputId(int index) {

    @Override
    public String toString() {
        return "output#" + index;
    }
}
