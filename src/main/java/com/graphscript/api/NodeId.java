package com.graphscript.api;

/** Opaque handle of a node. Never reused while the node lives. */
public record NodeId(int index) {

    @Override
    public String toString() {
        return "node#" + index;
    }
}
