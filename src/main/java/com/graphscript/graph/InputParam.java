package com.graphscript.graph;

import com.graphscript.api.DataType;
import com.graphscript.api.InputId;
import com.graphscript.api.InputKind;
import com.graphscript.api.NodeId;
import com.graphscript.api.ValueType;

/**
 * An input port. {@code value} is the inline fallback used when the input is
 * not connected.
 */
public record InputParam(InputId id, NodeId node, String name, DataType type, ValueType value, InputKind kind) {

    InputParam withValue(ValueType newValue) {
        return new InputParam(id, node, name, type, newValue, kind);
    }
}
