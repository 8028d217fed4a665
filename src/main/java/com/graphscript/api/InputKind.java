package com.graphscript.api;

/**
 * Governs whether an input accepts a connection, an inline constant, or both.
 */
public enum InputKind {
    /** Must be connected; the inline value is never used. */
    CONNECTION_ONLY,
    /** Never connected; always uses the inline value. */
    CONSTANT_ONLY,
    CONNECTION_OR_CONSTANT;

    public boolean acceptsConnection() {
        return this != CONSTANT_ONLY;
    }

    public boolean hasMeaningfulConstant() {
        return this != CONNECTION_ONLY;
    }
}
