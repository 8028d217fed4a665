package com.graphscript.engine;

import com.graphscript.api.NodeId;
import com.graphscript.function.GraphFunction;
import com.graphscript.graph.GraphDocument;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Traversal state for one function graph within a compilation: Main's graph,
 * or one inlined call of a function. Handles are only unique within a graph,
 * so every frame has its own cache and visiting set.
 */
final class Frame {
    private final GraphFunction function;
    private final OutputCache cache = new OutputCache();
    private final Set<NodeId> visiting = new HashSet<>();
    private final List<String> returnTargets;

    Frame(GraphFunction function, List<String> returnTargets) {
        this.function = function;
        this.returnTargets = List.copyOf(returnTargets);
    }

    static Frame root(GraphFunction main) {
        return new Frame(main, List.of());
    }

    GraphFunction function() {
        return function;
    }

    GraphDocument graph() {
        return function.graph();
    }

    OutputCache cache() {
        return cache;
    }

    Set<NodeId> visiting() {
        return visiting;
    }

    /** Caller temporaries assigned by Return nodes; empty in Main. */
    List<String> returnTargets() {
        return returnTargets;
    }
}
