package com.graphscript.graph;

import com.graphscript.api.DataType;
import com.graphscript.api.NodeId;
import com.graphscript.api.OutputId;

/** An output port. */
public record OutputParam(OutputId id, NodeId node, String name, DataType type) {
}
