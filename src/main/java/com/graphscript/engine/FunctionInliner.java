package com.graphscript.engine;

import com.graphscript.api.CompileError;
import com.graphscript.api.CompileException;
import com.graphscript.api.FunctionId;
import com.graphscript.api.InputId;
import com.graphscript.api.OutputId;
import com.graphscript.api.Script;
import com.graphscript.function.FunctionCatalog;
import com.graphscript.function.GraphFunction;
import com.graphscript.graph.GraphDocument;
import com.graphscript.graph.Node;
import com.graphscript.template.NodeTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Inlines the body of the function a FUNCTION node calls.
 *
 * <p>
 * The body is compiled in a fresh {@link Frame} over the callee's graph and
 * consists of:
 * <ol>
 * <li>one {@code (local <arg> <operand>)} per declared input, so each caller
 * operand is evaluated exactly once;</li>
 * <li>the callee's variable declarations;</li>
 * <li>the flow starting at the callee's entry: its first control node (in
 * creation order) whose execution input is unconnected.</li>
 * </ol>
 * ARGUMENT nodes of the callee resolve to the argument locals; RETURN nodes
 * assign the caller's temporaries.
 */
@Log4j2
final class FunctionInliner {
    private final CompileSession session;
    private final ExecutionFlowCompiler flow;

    FunctionInliner(CompileSession session, ExecutionFlowCompiler flow) {
        this.session = session;
        this.flow = flow;
    }

    Script inline(Frame caller, Node node, List<String> operands, List<String> bindings) throws CompileException {
        GraphFunction callee = resolveCallee(caller, node);

        if (operands.size() != callee.inputs().size() || bindings.size() != callee.outputs().size())
            throw new CompileException(CompileError.MISSING_REQUIRED_OPERAND,
                    node + " in " + caller.function().name() + " does not match the signature of " + callee.name());

        Frame frame = new Frame(callee, bindings);
        List<String> prologue = new ArrayList<>(callee.inputs().size());
        Map<String, String> arguments = new HashMap<>();
        for (int i = 0; i < callee.inputs().size(); i++) {
            String arg = session.newArgument();
            arguments.put(callee.inputs().get(i).name(), arg);
            prologue.add(Declarations.local(arg, operands.get(i)));
        }
        bindArguments(frame, arguments);

        session.enter(callee.id());
        try {
            Node entry = entryOf(callee);
            Script body = entry == null ? Script.EMPTY : flow.compile(frame, entry);
            log.debug("Inlined {} into {} at depth {}", callee.name(), caller.function().name(),
                    session.inlineDepth());
            return Script.of(prologue).then(Declarations.of(callee.variables())).then(body);
        } finally {
            session.exit();
        }
    }

    private GraphFunction resolveCallee(Frame caller, Node node) throws CompileException {
        FunctionCatalog catalog = session.catalog();
        FunctionId calleeId = node.kind().function();
        if (!catalog.contains(calleeId))
            throw new CompileException(CompileError.UNKNOWN_FUNCTION_REFERENCE,
                    node + " in " + caller.function().name() + " calls " + (calleeId == null ? "nothing" : calleeId));
        if (calleeId.equals(catalog.mainId()))
            throw new CompileException(CompileError.MAIN_FUNCTION_CALL, node + " in " + caller.function().name());

        GraphFunction callee = catalog.function(calleeId);
        if (session.isActive(calleeId) && session.config().isDisableRecursiveFunctions())
            throw new CompileException(CompileError.RECURSIVE_FUNCTION_DISABLED,
                    caller.function().name() + " calls " + callee.name() + " while it is being compiled");
        if (session.inlineDepth() >= session.config().getMaxInlineDepth())
            throw new CompileException(CompileError.INLINE_DEPTH_EXCEEDED,
                    callee.name() + " at depth " + session.config().getMaxInlineDepth());
        return callee;
    }

    private static void bindArguments(Frame frame, Map<String, String> arguments) {
        for (Node n : frame.graph().nodes()) {
            if (n.kind().template() != NodeTemplate.ARGUMENT)
                continue;
            String arg = arguments.get(n.kind().symbol());
            if (arg == null)
                continue;
            for (OutputId out : n.outputs())
                frame.cache().put(out, arg);
        }
    }

    static Node entryOf(GraphFunction function) {
        GraphDocument doc = function.graph();
        for (Node n : doc.nodes()) {
            if (!n.kind().template().shape().hasExecutionInput())
                continue;
            boolean connected = false;
            for (InputId in : n.inputs()) {
                if (doc.input(in).type().isExecution() && doc.connection(in) != null) {
                    connected = true;
                    break;
                }
            }
            if (!connected)
                return n;
        }
        return null;
    }
}
