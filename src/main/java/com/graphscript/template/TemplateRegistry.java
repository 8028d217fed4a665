package com.graphscript.template;

import com.graphscript.api.CompileError;
import com.graphscript.api.CompileException;
import com.graphscript.api.DataType;
import com.graphscript.api.Script;
import com.graphscript.api.ValueType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Registry mapping {@link NodeTemplate}s to their static data ports and their
 * behavior hooks.
 *
 * <p>
 * The built-ins are produced by an exhaustive {@code switch} over the enum, so
 * adding a template without behavior does not compile. Hooks can be replaced
 * per template afterwards, e.g. to target another script dialect or to
 * instrument a hook in tests.
 *
 * <p>
 * Target notation of the built-ins is an s-expression Lua dialect:
 * {@code (io.write "hi")}, {@code (local var_1 (io.read))},
 * {@code (if c (do ...) (do ...))}, {@code (+ a b)}, {@code (.. a b)}.
 */
@Log4j2
public final class TemplateRegistry {

    /**
     * Static data ports and hooks of a template. Control templates carry a
     * statement hook, data templates an expression hook.
     */
    public record TemplateMetadata(NodeTemplate template, List<InputSpec> dataInputs, List<OutputSpec> dataOutputs,
            StatementCompiler statement, ExpressionEvaluator expression) {

        /**
         * True when the template's data ports depend on the catalog (callee
         * signature, owning function signature or variable type) instead of
         * {@link #dataInputs()} / {@link #dataOutputs()}.
         */
        public boolean dynamicPorts() {
            return switch (template) {
                case FUNCTION, ARGUMENT, RETURN, GET_VARIABLE, SET_VARIABLE -> true;
                default -> false;
            };
        }
    }

    private final Map<NodeTemplate, TemplateMetadata> registry = new EnumMap<>(NodeTemplate.class);

    public TemplateRegistry() {
        for (NodeTemplate t : NodeTemplate.values())
            registry.put(t, builtIn(t));
    }

    public TemplateMetadata metadata(NodeTemplate template) {
        return registry.get(template);
    }

    /** Replaces the statement hook of a control template. */
    public TemplateRegistry registerStatement(NodeTemplate template, StatementCompiler hook) {
        if (!template.isControl())
            throw new IllegalArgumentException(template + " is a data template");
        TemplateMetadata m = registry.get(template);
        registry.put(template, new TemplateMetadata(template, m.dataInputs(), m.dataOutputs(), hook, null));
        log.debug("Statement hook of {} replaced", template);
        return this;
    }

    /** Replaces the expression hook of a data template. */
    public TemplateRegistry registerExpression(NodeTemplate template, ExpressionEvaluator hook) {
        if (template.isControl())
            throw new IllegalArgumentException(template + " is a control template");
        TemplateMetadata m = registry.get(template);
        registry.put(template, new TemplateMetadata(template, m.dataInputs(), m.dataOutputs(), null, hook));
        log.debug("Expression hook of {} replaced", template);
        return this;
    }

    // ── Built-ins ──────────────────────────────────────────────────

    private static TemplateMetadata builtIn(NodeTemplate t) {
        return switch (t) {
            case ENTER -> control(t, List.of(), List.of(), ctx -> Script.EMPTY);
            case PRINT -> control(t,
                    List.of(InputSpec.data("What ?", ValueType.string(""))), List.of(),
                    ctx -> Script.of("(io.write " + ctx.operand(0) + ")"));
            case ASK -> control(t,
                    List.of(InputSpec.data("What ?", ValueType.string(""))),
                    List.of(new OutputSpec("Answer", DataType.STRING)),
                    ctx -> Script.of(
                            "(io.write " + ctx.operand(0) + ")",
                            "(local " + ctx.binding(0) + " (io.read))"));
            case IF -> control(t,
                    List.of(InputSpec.data("Condition", ValueType.bool(false))), List.of(),
                    ctx -> Script.of("(if " + ctx.operand(0) + " " + block(ctx.branch(0)) + " "
                            + block(ctx.branch(1)) + ")")
                            .then(ctx.branch(2)));
            case ADD_NUMBER -> data(t,
                    List.of(InputSpec.data("What ?", ValueType.integer(0)),
                            InputSpec.data("What ?", ValueType.integer(0))),
                    List.of(new OutputSpec("What ?", DataType.INTEGER)),
                    ctx -> "(+ " + ctx.operand(0) + " " + ctx.operand(1) + ")");
            case ADD_STRING -> data(t,
                    List.of(InputSpec.data("What ?", ValueType.string("")),
                            InputSpec.data("What ?", ValueType.string(""))),
                    List.of(new OutputSpec("What ?", DataType.STRING)),
                    ctx -> "(.. " + ctx.operand(0) + " " + ctx.operand(1) + ")");
            case FUNCTION -> control(t, List.of(), List.of(), TemplateRegistry::inlineCall);
            case ARGUMENT -> data(t, List.of(), List.of(), ctx -> {
                throw new CompileException(CompileError.MISSING_REQUIRED_OPERAND,
                        "argument '" + ctx.kind().symbol() + "' is only bound inside a function call");
            });
            case RETURN -> control(t, List.of(), List.of(), TemplateRegistry::assignReturns);
            case GET_VARIABLE -> data(t, List.of(), List.of(), ctx -> ctx.kind().symbol());
            case SET_VARIABLE -> control(t, List.of(), List.of(),
                    ctx -> Script.of("(set " + ctx.kind().symbol() + " " + ctx.operand(0) + ")"));
        };
    }

    private static TemplateMetadata control(NodeTemplate t, List<InputSpec> in, List<OutputSpec> out,
            StatementCompiler hook) {
        return new TemplateMetadata(t, in, out, hook, null);
    }

    private static TemplateMetadata data(NodeTemplate t, List<InputSpec> in, List<OutputSpec> out,
            ExpressionEvaluator hook) {
        return new TemplateMetadata(t, in, out, null, hook);
    }

    private static String block(Script branch) {
        return branch.isEmpty() ? "(do)" : "(do " + branch.render() + ")";
    }

    // Caller temporaries are declared before the inlined body so the body's
    // Return nodes can assign them and later statements can read them.
    private static Script inlineCall(StatementContext ctx) {
        List<String> fragments = new ArrayList<>(ctx.bindings().size() + 1);
        for (String b : ctx.bindings())
            fragments.add("(local " + b + " nil)");
        if (!ctx.callee().isEmpty())
            fragments.add(block(ctx.callee()));
        return Script.of(fragments);
    }

    private static Script assignReturns(StatementContext ctx) throws CompileException {
        if (ctx.returnTargets().isEmpty())
            return Script.EMPTY;
        if (ctx.returnTargets().size() != ctx.operands().size())
            throw new CompileException(CompileError.MISSING_REQUIRED_OPERAND,
                    "Return has " + ctx.operands().size() + " values for " + ctx.returnTargets().size() + " outputs");
        List<String> fragments = new ArrayList<>(ctx.operands().size());
        for (int i = 0; i < ctx.operands().size(); i++)
            fragments.add("(set " + ctx.returnTargets().get(i) + " " + ctx.operand(i) + ")");
        return Script.of(fragments);
    }
}
