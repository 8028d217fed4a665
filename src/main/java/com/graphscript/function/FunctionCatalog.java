package com.graphscript.function;

import com.graphscript.api.FunctionId;
import com.graphscript.api.NodeId;
import com.graphscript.api.ValueType;
import com.graphscript.graph.GraphDocument;
import com.graphscript.graph.NodeKind;
import com.graphscript.template.InputSpec;
import com.graphscript.template.NodeTemplate;
import com.graphscript.template.OutputSpec;
import com.graphscript.template.PortShape;
import com.graphscript.template.TemplateRegistry;
import com.graphscript.util.Names;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Function Catalog -- every {@link GraphFunction} of a program plus the
 * designated Main function.
 *
 * <p>
 * Main is created with the catalog and can be neither removed nor renamed. The
 * catalog is also where nodes are instantiated, because the ports of several
 * templates depend on it:
 * <ul>
 * <li>FUNCTION nodes mirror the callee's signature (no ports at all while no
 * existing callee is assigned).</li>
 * <li>ARGUMENT nodes expose one declared input of the owning function.</li>
 * <li>RETURN nodes take one input per declared output of the owning
 * function.</li>
 * <li>GET_VARIABLE / SET_VARIABLE nodes are typed after the variable, looked
 * up in the owning function first and in Main second.</li>
 * </ul>
 *
 * <p>
 * The catalog does not enforce Enter placement; that is validated when
 * compiling, so a misplaced Enter node is reported rather than prevented.
 */
@Log4j2
public final class FunctionCatalog {
    public static final String MAIN_NAME = "Main";

    private final Map<FunctionId, GraphFunction> functions = new LinkedHashMap<>();
    private final TemplateRegistry templates;
    private final FunctionId mainId;
    private int nextFunction;

    public FunctionCatalog() {
        this(new TemplateRegistry());
    }

    public FunctionCatalog(TemplateRegistry templates) {
        this.templates = templates;
        this.mainId = insert(MAIN_NAME, List.of(), List.of(), false, false);
    }

    // ── Functions ──────────────────────────────────────────────

    public FunctionId mainId() {
        return mainId;
    }

    public GraphFunction main() {
        return functions.get(mainId);
    }

    public GraphFunction function(FunctionId id) {
        GraphFunction f = functions.get(id);
        if (f == null)
            throw new IllegalArgumentException("Unknown function: " + id);
        return f;
    }

    public boolean contains(FunctionId id) {
        return id != null && functions.containsKey(id);
    }

    /** All functions, Main first, then in creation order. */
    public Collection<GraphFunction> functions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    /**
     * Creates a removable, renamable function. The name is made unique; signature
     * entry names are made unique within their side of the signature.
     */
    public FunctionId addFunction(String name, List<FunctionIO> inputs, List<FunctionIO> outputs) {
        return insert(Names.uniquify(name, functionNames()), uniquifyEntries(inputs), uniquifyEntries(outputs),
                true, true);
    }

    /**
     * Removes a function. FUNCTION nodes calling it keep their reference and fail
     * to compile.
     */
    public void removeFunction(FunctionId id) {
        GraphFunction f = function(id);
        if (!f.removable())
            throw new IllegalStateException("Function " + f.name() + " cannot be removed");
        functions.remove(id);
        log.debug("Removed function {}", f);
    }

    /** Renames a function and returns the (uniquified) name it got. */
    public String renameFunction(FunctionId id, String name) {
        GraphFunction f = function(id);
        if (!f.renamable())
            throw new IllegalStateException("Function " + f.name() + " cannot be renamed");
        List<String> taken = functionNames();
        taken.remove(f.name());
        f.name(Names.uniquify(name, taken));
        return f.name();
    }

    /**
     * Functions a FUNCTION node inside {@code from} may call: never Main, and
     * {@code from} itself only when recursion is allowed.
     */
    public List<GraphFunction> callableFunctions(FunctionId from, boolean disableRecursion) {
        List<GraphFunction> result = new ArrayList<>();
        for (GraphFunction f : functions.values()) {
            if (f.id().equals(mainId))
                continue;
            if (disableRecursion && f.id().equals(from))
                continue;
            result.add(f);
        }
        return result;
    }

    // ── Variables ──────────────────────────────────────────────

    /** Declares a removable variable and returns the (uniquified) name it got. */
    public String addVariable(FunctionId owner, String name, ValueType value) {
        GraphFunction f = function(owner);
        List<String> taken = new ArrayList<>();
        for (Variable v : f.variables())
            taken.add(v.name());
        String unique = Names.uniquify(name, taken);
        f.mutableVariables().add(new Variable(unique, value, true));
        return unique;
    }

    public void removeVariable(FunctionId owner, String name) {
        GraphFunction f = function(owner);
        Variable v = f.variable(name);
        if (v == null)
            throw new IllegalArgumentException("Unknown variable " + name + " in " + f.name());
        if (!v.removable())
            throw new IllegalStateException("Variable " + name + " cannot be removed");
        f.mutableVariables().remove(v);
    }

    // ── Nodes ──────────────────────────────────────────────────

    /** Instantiates a node in {@code owner}'s graph with the ports its kind calls for. */
    public NodeId addNode(FunctionId owner, NodeKind kind) {
        GraphFunction f = function(owner);
        List<InputSpec> ins = new ArrayList<>();
        List<OutputSpec> outs = new ArrayList<>();
        layout(f, kind, ins, outs);

        GraphDocument doc = f.graph();
        NodeId id = doc.addNode(kind);
        addPorts(doc, id, ins, outs);
        log.debug("Added {} to {}", kind, f.name());
        return id;
    }

    /**
     * Points a FUNCTION node at {@code callee} and rebuilds its ports from the
     * callee's signature. The node's previous connections are dropped.
     */
    public void assignFunction(FunctionId owner, NodeId node, FunctionId callee, boolean disableRecursion) {
        GraphFunction f = function(owner);
        GraphDocument doc = f.graph();
        if (doc.node(node).kind().template() != NodeTemplate.FUNCTION)
            throw new IllegalArgumentException(node + " is not a Function node");
        function(callee);
        if (callee.equals(mainId))
            throw new IllegalArgumentException("Main cannot be called from a Function node");
        if (disableRecursion && callee.equals(owner))
            throw new IllegalArgumentException("Recursive functions are disabled: " + f.name() + " cannot call itself");

        NodeKind kind = NodeKind.function(callee);
        List<InputSpec> ins = new ArrayList<>();
        List<OutputSpec> outs = new ArrayList<>();
        layout(f, kind, ins, outs);

        doc.clearPorts(node);
        doc.replaceKind(node, kind);
        addPorts(doc, node, ins, outs);
    }

    private void layout(GraphFunction owner, NodeKind kind, List<InputSpec> ins, List<OutputSpec> outs) {
        NodeTemplate template = kind.template();
        if (template == NodeTemplate.FUNCTION && !contains(kind.function()))
            return;

        PortShape shape = template.shape();
        ins.addAll(shape.executionInputs());
        outs.addAll(shape.executionOutputs());

        switch (template) {
            case FUNCTION -> {
                GraphFunction callee = functions.get(kind.function());
                for (FunctionIO io : callee.inputs())
                    ins.add(InputSpec.data(io.name(), io.value()));
                for (FunctionIO io : callee.outputs())
                    outs.add(new OutputSpec(io.name(), io.type()));
            }
            case ARGUMENT -> {
                FunctionIO arg = owner.input(kind.symbol());
                if (arg == null)
                    throw new IllegalArgumentException(owner.name() + " has no input named " + kind.symbol());
                outs.add(new OutputSpec(arg.name(), arg.type()));
            }
            case RETURN -> {
                for (FunctionIO io : owner.outputs())
                    ins.add(InputSpec.data(io.name(), io.value()));
            }
            case GET_VARIABLE -> {
                Variable v = resolveVariable(owner, kind.symbol());
                outs.add(new OutputSpec(v.name(), v.type()));
            }
            case SET_VARIABLE -> {
                Variable v = resolveVariable(owner, kind.symbol());
                ins.add(InputSpec.data("Value", v.value()));
            }
            default -> {
                var meta = templates.metadata(template);
                ins.addAll(meta.dataInputs());
                outs.addAll(meta.dataOutputs());
            }
        }
    }

    private Variable resolveVariable(GraphFunction owner, String name) {
        Variable v = owner.variable(name);
        if (v == null)
            v = main().variable(name);
        if (v == null)
            throw new IllegalArgumentException("Unknown variable " + name + " in " + owner.name());
        if (v.type().isExecution())
            throw new IllegalArgumentException("Variable " + name + " has type Execution and cannot be read or set");
        return v;
    }

    private static void addPorts(GraphDocument doc, NodeId id, List<InputSpec> ins, List<OutputSpec> outs) {
        for (InputSpec in : ins)
            doc.addInputParam(id, in.name(), in.type(), in.defaultValue(), in.kind());
        for (OutputSpec out : outs)
            doc.addOutputParam(id, out.name(), out.type());
    }

    private FunctionId insert(String name, List<FunctionIO> inputs, List<FunctionIO> outputs,
            boolean removable, boolean renamable) {
        FunctionId id = new FunctionId(nextFunction++);
        functions.put(id, new GraphFunction(id, name, inputs, outputs, removable, renamable));
        return id;
    }

    private List<String> functionNames() {
        List<String> names = new ArrayList<>(functions.size());
        for (GraphFunction f : functions.values())
            names.add(f.name());
        return names;
    }

    private static List<FunctionIO> uniquifyEntries(List<FunctionIO> entries) {
        List<FunctionIO> result = new ArrayList<>(entries.size());
        List<String> taken = new ArrayList<>(entries.size());
        for (FunctionIO io : entries) {
            String name = Names.uniquify(io.name(), taken);
            taken.add(name);
            result.add(new FunctionIO(name, io.value()));
        }
        return result;
    }
}
