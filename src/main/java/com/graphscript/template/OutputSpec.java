package com.graphscript.template;

import com.graphscript.api.DataType;

/** Blueprint of an output port created when a node is instantiated. */
public record OutputSpec(String name, DataType type) {

    public static OutputSpec execution(String name) {
        return new OutputSpec(name, DataType.EXECUTION);
    }
}
