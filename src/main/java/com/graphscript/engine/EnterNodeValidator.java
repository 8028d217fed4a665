package com.graphscript.engine;

import com.graphscript.api.CompileError;
import com.graphscript.api.CompileException;
import com.graphscript.api.FunctionId;
import com.graphscript.api.NodeId;
import com.graphscript.function.FunctionCatalog;
import com.graphscript.function.GraphFunction;
import com.graphscript.graph.Node;
import com.graphscript.template.NodeTemplate;

/**
 * Checks that the program has exactly one Enter node and that it lives in the
 * function compilation starts from. Every function of the catalog is scanned,
 * so a stray Enter node in a callee is reported even when nothing calls it.
 */
final class EnterNodeValidator {
    private EnterNodeValidator() {
        // Utility class
    }

    static NodeId validate(FunctionCatalog catalog, FunctionId mainId) throws CompileException {
        NodeId found = null;
        GraphFunction foundIn = null;
        for (GraphFunction f : catalog.functions()) {
            for (Node n : f.graph().nodes()) {
                if (n.kind().template() != NodeTemplate.ENTER)
                    continue;
                if (found != null)
                    throw new CompileException(CompileError.MULTIPLE_ENTER_NODES,
                            found + " in " + foundIn.name() + " and " + n.id() + " in " + f.name());
                found = n.id();
                foundIn = f;
            }
        }
        if (found == null)
            throw new CompileException(CompileError.MISSING_ENTER_NODE, catalog.function(mainId).name());
        if (!foundIn.id().equals(mainId))
            throw new CompileException(CompileError.ENTER_IN_FUNCTION, found + " in " + foundIn.name());
        return found;
    }
}
