package com.graphscript.util;

import com.graphscript.api.InputId;
import com.graphscript.api.OutputId;
import com.graphscript.function.FunctionCatalog;
import com.graphscript.function.FunctionIO;
import com.graphscript.function.GraphFunction;
import com.graphscript.function.Variable;
import com.graphscript.graph.GraphDocument;
import com.graphscript.graph.InputParam;
import com.graphscript.graph.Node;
import com.graphscript.graph.OutputParam;

import java.util.Map;

/**
 * Diagnostic dumps of a program: signatures, variables, nodes with their ports,
 * and connections.
 *
 * <p>
 * Intended for debugging sessions and error logs. Output format is not stable.
 */
public final class GraphExplain {
    private final FunctionCatalog catalog;

    public GraphExplain(FunctionCatalog catalog) {
        this.catalog = catalog;
    }

    /** Dumps every function of the catalog, Main first. */
    public String dumpCatalog() {
        StringBuilder sb = new StringBuilder(1024);
        for (GraphFunction f : catalog.functions())
            sb.append(dumpFunction(f));
        return sb.toString();
    }

    /** Dumps one function: signature, variables, nodes and connections. */
    public String dumpFunction(GraphFunction f) {
        GraphDocument doc = f.graph();
        StringBuilder sb = new StringBuilder(512);
        sb.append("Function ").append(f.name()).append(" (").append(f.id()).append(')');
        if (f.id().equals(catalog.mainId()))
            sb.append(" [main]");
        sb.append('\n');
        appendSignature(sb, "  In: ", f);
        sb.append("  Out: ");
        appendEntries(sb, f.outputs());
        sb.append('\n');
        for (Variable v : f.variables())
            sb.append("  var ").append(v.name()).append(" : ").append(v.type().displayName())
                    .append(" = ").append(v.value().render()).append('\n');

        sb.append("  Nodes (").append(doc.nodeCount()).append("):\n");
        for (Node n : doc.nodes()) {
            sb.append("    ").append(n).append('\n');
            for (InputId in : n.inputs()) {
                InputParam p = doc.input(in);
                sb.append("      > ").append(in).append(' ').append(label(p.name()))
                        .append(" : ").append(p.type().displayName());
                OutputId src = doc.connection(in);
                if (src != null)
                    sb.append(" <- ").append(src);
                else if (p.kind().hasMeaningfulConstant())
                    sb.append(" = ").append(p.value().render());
                sb.append('\n');
            }
            for (OutputId out : n.outputs()) {
                OutputParam p = doc.output(out);
                sb.append("      < ").append(out).append(' ').append(label(p.name()))
                        .append(" : ").append(p.type().displayName()).append('\n');
            }
        }
        return sb.toString();
    }

    /** One line per connection: {@code nodeA.output -> nodeB.input}. */
    public String dumpConnections(GraphFunction f) {
        GraphDocument doc = f.graph();
        StringBuilder sb = new StringBuilder(256);
        for (Map.Entry<InputId, OutputId> e : doc.connections().entrySet()) {
            OutputParam out = doc.output(e.getValue());
            InputParam in = doc.input(e.getKey());
            sb.append(doc.node(out.node())).append('.').append(label(out.name()))
                    .append(" -> ")
                    .append(doc.node(in.node())).append('.').append(label(in.name()))
                    .append('\n');
        }
        return sb.toString();
    }

    private static void appendSignature(StringBuilder sb, String prefix, GraphFunction f) {
        sb.append(prefix);
        appendEntries(sb, f.inputs());
        sb.append('\n');
    }

    private static void appendEntries(StringBuilder sb, java.util.List<FunctionIO> entries) {
        for (int i = 0; i < entries.size(); i++) {
            FunctionIO io = entries.get(i);
            sb.append(io.name()).append(':').append(io.type().displayName());
            if (i < entries.size() - 1)
                sb.append(", ");
        }
    }

    private static String label(String name) {
        return name.isEmpty() ? "<exec>" : "'" + name + "'";
    }
}
