package com.graphscript.template;

import com.graphscript.api.Script;
import com.graphscript.graph.NodeKind;

import java.util.List;

/**
 * Everything a statement hook needs, already resolved.
 *
 * @param kind          The node's kind.
 * @param operands      Expression text of the node's data inputs, in port
 *                      order.
 * @param branches      One script per execution output, in port order; empty
 *                      when the output is unconnected.
 * @param bindings      Temporary names bound to the node's data outputs, in
 *                      port order. The statement must introduce them.
 * @param callee        Inlined body of the called function; empty for other
 *                      templates.
 * @param returnTargets Caller temporaries a Return node assigns, in the owning
 *                      function's output order; empty outside an inlined call.
 */
public record StatementContext(NodeKind kind, List<String> operands, List<Script> branches,
        List<String> bindings, Script callee, List<String> returnTargets) {

    public StatementContext {
        operands = List.copyOf(operands);
        branches = List.copyOf(branches);
        bindings = List.copyOf(bindings);
        returnTargets = List.copyOf(returnTargets);
    }

    public String operand(int i) {
        return operands.get(i);
    }

    /** The branch of execution output {@code i}, or an empty script. */
    public Script branch(int i) {
        return i < branches.size() ? branches.get(i) : Script.EMPTY;
    }

    public String binding(int i) {
        return bindings.get(i);
    }
}
