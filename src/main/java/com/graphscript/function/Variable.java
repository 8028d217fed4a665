package com.graphscript.function;

import com.graphscript.api.DataType;
import com.graphscript.api.ValueType;

/** A local variable declaration of a function: name, typed default, removability. */
public record Variable(String name, ValueType value, boolean removable) {

    public DataType type() {
        return value.type();
    }
}
