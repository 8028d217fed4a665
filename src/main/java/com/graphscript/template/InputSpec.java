package com.graphscript.template;

import com.graphscript.api.DataType;
import com.graphscript.api.InputKind;
import com.graphscript.api.ValueType;

/** Blueprint of an input port created when a node is instantiated. */
public record InputSpec(String name, DataType type, ValueType defaultValue, InputKind kind) {

    public static InputSpec execution(String name) {
        return new InputSpec(name, DataType.EXECUTION, ValueType.EXECUTION, InputKind.CONNECTION_ONLY);
    }

    public static InputSpec data(String name, ValueType defaultValue) {
        return new InputSpec(name, defaultValue.type(), defaultValue, InputKind.CONNECTION_OR_CONSTANT);
    }
}
