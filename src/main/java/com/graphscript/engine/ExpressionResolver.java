package com.graphscript.engine;

import com.graphscript.api.CompileError;
import com.graphscript.api.CompileException;
import com.graphscript.api.InputId;
import com.graphscript.api.OutputId;
import com.graphscript.graph.GraphDocument;
import com.graphscript.graph.InputParam;
import com.graphscript.graph.Node;
import com.graphscript.template.ExpressionContext;
import com.graphscript.template.ExpressionEvaluator;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Data Expression Evaluator -- resolves one input to expression text.
 *
 * Algorithm:
 *
 * 1. Unconnected input: render the inline value as a literal. A
 * connection-only input without connection is a missing operand.
 *
 * 2. Connected to output O: if O is in the frame's OutputCache, return the
 * cached text. Control-node outputs are found here while their temporary is in
 * scope: the node ran on this path and no enclosing block has closed since.
 * Any other read of a control-node output is a missing operand.
 *
 * 3. Otherwise O belongs to a data node. If that node is currently being
 * visited, the edge O -> input closes a cycle and compilation fails naming
 * that edge. Else mark the node visiting and resolve its data inputs in port
 * order (recursively, steps 1-4).
 *
 * 4. Call the template's expression hook with the operands and store the
 * result under every output of the node (a data node's outputs all share its
 * single result). Unmark the node and return the text for O.
 *
 * Each data node is evaluated at most once per frame, however many inputs it
 * feeds.
 */
@Log4j2
final class ExpressionResolver {
    private final CompileSession session;

    ExpressionResolver(CompileSession session) {
        this.session = session;
    }

    /** Resolves every non-execution input of {@code node}, in port order. */
    List<String> operands(Frame frame, Node node) throws CompileException {
        GraphDocument doc = frame.graph();
        List<String> operands = new ArrayList<>(node.inputs().size());
        for (InputId in : node.inputs()) {
            if (doc.input(in).type().isExecution())
                continue;
            operands.add(resolve(frame, in));
        }
        return operands;
    }

    String resolve(Frame frame, InputId inputId) throws CompileException {
        GraphDocument doc = frame.graph();
        InputParam input = doc.input(inputId);
        OutputId source = doc.connection(inputId);

        if (source == null)
            return literal(frame, input);

        String cached = frame.cache().get(source);
        if (cached != null)
            return cached;

        Node owner = doc.node(doc.output(source).node());
        if (owner.kind().template().isControl())
            throw new CompileException(CompileError.MISSING_REQUIRED_OPERAND,
                    "input '" + input.name() + "' of " + doc.node(input.node()) + " in " + frame.function().name()
                            + " reads " + source + " of " + owner + ", which has not run on this path");
        if (frame.visiting().contains(owner.id()))
            throw CompileException.cycle(source, inputId);

        evaluate(frame, owner);
        return frame.cache().get(source);
    }

    private void evaluate(Frame frame, Node node) throws CompileException {
        frame.visiting().add(node.id());

        List<String> operands = operands(frame, node);
        ExpressionEvaluator hook = session.templates().metadata(node.kind().template()).expression();
        String text = hook.evaluate(new ExpressionContext(node.kind(), operands));

        for (OutputId out : node.outputs())
            frame.cache().put(out, text);
        frame.visiting().remove(node.id());

        log.debug("{}: {} = {}", frame.function().name(), node, text);
        session.expressionEvaluated(frame, node.id(), node.kind().template().label());
    }

    private static String literal(Frame frame, InputParam input) throws CompileException {
        if (!input.kind().hasMeaningfulConstant())
            throw new CompileException(CompileError.MISSING_REQUIRED_OPERAND,
                    "input '" + input.name() + "' of " + frame.graph().node(input.node()) + " in "
                            + frame.function().name() + " must be connected");
        return input.value().render();
    }
}
