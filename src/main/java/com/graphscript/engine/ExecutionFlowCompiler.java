package com.graphscript.engine;

import com.graphscript.api.CompileException;
import com.graphscript.api.InputId;
import com.graphscript.api.OutputId;
import com.graphscript.api.Script;
import com.graphscript.graph.GraphDocument;
import com.graphscript.graph.Node;
import com.graphscript.template.Composition;
import com.graphscript.template.NodeTemplate;
import com.graphscript.template.StatementCompiler;
import com.graphscript.template.StatementContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Execution-Flow Compiler -- turns a control node and everything reachable
 * downstream of it into a script.
 *
 * For a control node N:
 *
 * 1. Operands: resolve N's data inputs in port order through the
 * {@link ExpressionResolver}.
 *
 * 2. Temporaries: bind a fresh name to every data output of N in the frame's
 * cache, so any consumer of those outputs (typically further down N's
 * branches) resolves to the name. N's statement introduces it.
 *
 * 3. Callee: for a FUNCTION node, inline the callee's body.
 *
 * 4. Branches: for every execution output, in port order, compile the node on
 * the other end of its connection; an unconnected output yields an empty
 * script. Branches of an EMBEDDED node end up inside their own block, so cache
 * entries a branch adds are dropped once it is compiled: its temporaries are
 * out of scope for sibling branches and for what follows the block.
 *
 * 5. Statement: call the template's statement hook with all of the above.
 *
 * 6. Compose according to the template's declared composition: SEQUENTIAL
 * appends the first branch, EMBEDDED and TERMINAL append nothing.
 *
 * An execution input accepts one connection and an execution output feeds one
 * input, so the walk from the entry is a tree descent. Only data can
 * re-converge, and that is handled by the resolver's cache.
 */
@Log4j2
final class ExecutionFlowCompiler {
    private final CompileSession session;
    private final ExpressionResolver resolver;
    private final FunctionInliner inliner;

    ExecutionFlowCompiler(CompileSession session) {
        this.session = session;
        this.resolver = new ExpressionResolver(session);
        this.inliner = new FunctionInliner(session, this);
    }

    Script compile(Frame frame, Node node) throws CompileException {
        GraphDocument doc = frame.graph();
        NodeTemplate template = node.kind().template();
        if (!template.isControl())
            throw new IllegalStateException("Execution reached data node " + node + " in " + frame.function().name());

        List<String> operands = resolver.operands(frame, node);

        List<String> bindings = new ArrayList<>();
        List<OutputId> executionOutputs = new ArrayList<>();
        for (OutputId out : node.outputs()) {
            if (doc.output(out).type().isExecution()) {
                executionOutputs.add(out);
                continue;
            }
            String name = session.newTemporary();
            frame.cache().put(out, name);
            bindings.add(name);
        }

        Script callee = template == NodeTemplate.FUNCTION
                ? inliner.inline(frame, node, operands, bindings)
                : Script.EMPTY;

        boolean scoped = template.composition() == Composition.EMBEDDED;
        List<Script> branches = new ArrayList<>(executionOutputs.size());
        for (OutputId out : executionOutputs) {
            Set<OutputId> mark = scoped ? frame.cache().mark() : null;
            branches.add(follow(frame, out));
            if (scoped)
                frame.cache().restore(mark);
        }

        List<String> returnTargets = template == NodeTemplate.RETURN ? frame.returnTargets() : List.of();
        StatementCompiler hook = session.templates().metadata(template).statement();
        Script own = hook.compile(new StatementContext(node.kind(), operands, branches, bindings, callee,
                returnTargets));

        log.debug("{}: {} -> {}", frame.function().name(), node, own);
        session.statementCompiled(frame, node.id(), template.label());

        return switch (template.composition()) {
            case SEQUENTIAL -> branches.isEmpty() ? own : own.then(branches.get(0));
            case EMBEDDED, TERMINAL -> own;
        };
    }

    private Script follow(Frame frame, OutputId out) throws CompileException {
        GraphDocument doc = frame.graph();
        List<InputId> targets = doc.outgoing(out);
        if (targets.isEmpty())
            return Script.EMPTY;
        return compile(frame, doc.node(doc.input(targets.get(0)).node()));
    }
}
