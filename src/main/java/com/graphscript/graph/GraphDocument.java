package com.graphscript.graph;

import com.graphscript.api.DataType;
import com.graphscript.api.InputId;
import com.graphscript.api.InputKind;
import com.graphscript.api.NodeId;
import com.graphscript.api.OutputId;
import com.graphscript.api.ValueType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Graph Document -- an arena of nodes, ports and connections.
 *
 * Nodes and ports are owned records addressed by opaque integer handles, so the
 * structure can describe arbitrary (even cyclic) wiring without object
 * reference cycles.
 *
 * Connections are stored as a forward index (input -> output). The reverse
 * index (output -> inputs) is derived and kept in step on every connect and
 * disconnect.
 *
 * Invariants:
 * - An input has at most one incoming connection. Connecting an already
 * connected input supersedes the previous connection.
 * - An execution output has at most one outgoing connection, so the control
 * walk never fans out. A data output may feed any number of inputs.
 * - Both ends of a connection share the same DataType.
 *
 * Handles are never reused within one document. Iteration over nodes follows
 * creation order.
 *
 * The document is not thread-safe. The editor owns it; the compiler only reads.
 */
public final class GraphDocument {
    private final Map<NodeId, Node> nodes = new LinkedHashMap<>();
    private final Map<InputId, InputParam> inputs = new LinkedHashMap<>();
    private final Map<OutputId, OutputParam> outputs = new LinkedHashMap<>();

    private final Map<InputId, OutputId> connections = new LinkedHashMap<>();
    private final Map<OutputId, Set<InputId>> reverse = new LinkedHashMap<>();

    private int nextNode, nextInput, nextOutput;

    // ── Nodes ──────────────────────────────────────────────────

    /** Creates a node without ports. */
    public NodeId addNode(NodeKind kind) {
        NodeId id = new NodeId(nextNode++);
        nodes.put(id, new Node(id, kind));
        return id;
    }

    /** Removes a node together with its ports and every connection touching them. */
    public void removeNode(NodeId id) {
        clearPorts(id);
        nodes.remove(id);
    }

    /** Changes a node's kind. Ports are left untouched. */
    public void replaceKind(NodeId id, NodeKind kind) {
        requireNode(id).kind(kind);
    }

    /** Removes every port of a node and every connection touching them. */
    public void clearPorts(NodeId id) {
        Node node = requireNode(id);
        for (InputId in : node.mutableInputs()) {
            disconnect(in);
            inputs.remove(in);
        }
        for (OutputId out : node.mutableOutputs()) {
            Set<InputId> targets = reverse.remove(out);
            if (targets != null)
                for (InputId in : targets)
                    connections.remove(in);
            outputs.remove(out);
        }
        node.mutableInputs().clear();
        node.mutableOutputs().clear();
    }

    public Node node(NodeId id) {
        return requireNode(id);
    }

    public boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    /** All nodes, in creation order. */
    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    // ── Ports ──────────────────────────────────────────────────

    public InputId addInputParam(NodeId node, String name, DataType type, ValueType value, InputKind kind) {
        Node owner = requireNode(node);
        if (value.type() != type)
            throw new IllegalArgumentException(
                    "Inline value " + value + " does not match input type " + type + " on " + owner);
        InputId id = new InputId(nextInput++);
        inputs.put(id, new InputParam(id, node, name, type, value, kind));
        owner.mutableInputs().add(id);
        return id;
    }

    public OutputId addOutputParam(NodeId node, String name, DataType type) {
        Node owner = requireNode(node);
        OutputId id = new OutputId(nextOutput++);
        outputs.put(id, new OutputParam(id, node, name, type));
        owner.mutableOutputs().add(id);
        return id;
    }

    public InputParam input(InputId id) {
        InputParam p = inputs.get(id);
        if (p == null)
            throw new IllegalArgumentException("Unknown input: " + id);
        return p;
    }

    public OutputParam output(OutputId id) {
        OutputParam p = outputs.get(id);
        if (p == null)
            throw new IllegalArgumentException("Unknown output: " + id);
        return p;
    }

    /** Replaces the inline value of an input. */
    public void setInlineValue(InputId id, ValueType value) {
        InputParam p = input(id);
        if (value.type() != p.type())
            throw new IllegalArgumentException("Value " + value + " does not match input type " + p.type());
        inputs.put(id, p.withValue(value));
    }

    // ── Connections ────────────────────────────────────────────

    /**
     * Connects {@code from} to {@code to}, superseding any existing connection
     * of {@code to} (and of {@code from}, when it is an execution output).
     */
    public void connect(OutputId from, InputId to) {
        OutputParam out = output(from);
        InputParam in = input(to);
        if (out.type() != in.type())
            throw new IllegalArgumentException(
                    "Cannot connect " + out.type() + " output " + from + " to " + in.type() + " input " + to);
        if (!in.kind().acceptsConnection())
            throw new IllegalArgumentException("Input " + to + " (" + in.name() + ") only accepts a constant");

        disconnect(to);
        if (out.type().isExecution()) {
            for (InputId previous : new ArrayList<>(outgoing(from)))
                disconnect(previous);
        }
        connections.put(to, from);
        reverse.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
    }

    /** Removes the connection of an input, if any. */
    public void disconnect(InputId to) {
        OutputId from = connections.remove(to);
        if (from == null)
            return;
        Set<InputId> targets = reverse.get(from);
        if (targets != null) {
            targets.remove(to);
            if (targets.isEmpty())
                reverse.remove(from);
        }
    }

    /** The output feeding an input, or {@code null} when the input is not connected. */
    public OutputId connection(InputId to) {
        return connections.get(to);
    }

    /** Inputs fed by an output, in connection order. */
    public List<InputId> outgoing(OutputId from) {
        Set<InputId> targets = reverse.get(from);
        return targets == null ? List.of() : List.copyOf(targets);
    }

    /** All connections as input -> output, in connection order. */
    public Map<InputId, OutputId> connections() {
        return Collections.unmodifiableMap(connections);
    }

    private Node requireNode(NodeId id) {
        Node n = nodes.get(id);
        if (n == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return n;
    }
}
