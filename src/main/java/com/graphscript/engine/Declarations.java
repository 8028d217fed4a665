package com.graphscript.engine;

import com.graphscript.api.Script;
import com.graphscript.function.Variable;

import java.util.ArrayList;
import java.util.List;

/** Renders variable declarations as {@code (local <name> <literal>)} statements. */
final class Declarations {
    private Declarations() {
        // Utility class
    }

    static Script of(List<Variable> variables) {
        List<String> fragments = new ArrayList<>(variables.size());
        for (Variable v : variables) {
            if (v.type().isExecution())
                continue;
            fragments.add(local(v.name(), v.value().render()));
        }
        return Script.of(fragments);
    }

    static String local(String name, String value) {
        return "(local " + name + " " + value + ")";
    }
}
