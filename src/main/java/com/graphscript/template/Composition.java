package com.graphscript.template;

/**
 * How the flow compiler assembles a control node's subtree from the node's own
 * fragment and the scripts of its execution outputs.
 */
public enum Composition {
    /** Own fragment, then the branch of the first execution output. */
    SEQUENTIAL,
    /** The statement hook embeds every branch itself; nothing is appended. */
    EMBEDDED,
    /** No execution outputs; own fragment only. */
    TERMINAL
}
