package com.graphscript.function;

import com.graphscript.api.DataType;
import com.graphscript.api.ValueType;

/**
 * One entry of a function signature: a named, typed input or output with its
 * default value. Execution entries are not allowed.
 */
public record FunctionIO(String name, ValueType value) {

    public FunctionIO {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Signature entry needs a name");
        if (value.type().isExecution())
            throw new IllegalArgumentException("Signature entry '" + name + "' cannot be of type Execution");
    }

    public DataType type() {
        return value.type();
    }
}
