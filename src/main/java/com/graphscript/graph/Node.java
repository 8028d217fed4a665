package com.graphscript.graph;

import com.graphscript.api.InputId;
import com.graphscript.api.NodeId;
import com.graphscript.api.OutputId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of a {@link GraphDocument}: its kind and its ordered port handles.
 * The ports themselves live in the document's arena.
 */
public final class Node {
    private final NodeId id;
    private NodeKind kind;
    private final List<InputId> inputs = new ArrayList<>();
    private final List<OutputId> outputs = new ArrayList<>();

    Node(NodeId id, NodeKind kind) {
        this.id = id;
        this.kind = kind;
    }

    public NodeId id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public List<InputId> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<OutputId> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    void kind(NodeKind kind) {
        this.kind = kind;
    }

    List<InputId> mutableInputs() {
        return inputs;
    }

    List<OutputId> mutableOutputs() {
        return outputs;
    }

    @Override
    public String toString() {
        return id + ":" + kind;
    }
}
