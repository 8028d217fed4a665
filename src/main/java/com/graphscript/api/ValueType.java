package com.graphscript.api;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A typed constant: the inline value of an input, the default of a variable or
 * of a function signature entry.
 *
 * <p>
 * The payload always matches {@link #type()}: a {@link String} for STRING, an
 * {@link Integer} for INTEGER, a finite {@link Double} for FLOAT, a
 * {@link Boolean} for BOOLEAN and {@code null} for EXECUTION. Use the static
 * factories; the canonical constructor checks the pairing.
 */
public record ValueType(DataType type, Object value) {

    public static final ValueType EXECUTION = new ValueType(DataType.EXECUTION, null);

    public ValueType {
        Objects.requireNonNull(type, "type");
        boolean ok = switch (type) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer;
            case FLOAT -> value instanceof Double d && Double.isFinite(d);
            case BOOLEAN -> value instanceof Boolean;
            case EXECUTION -> value == null;
        };
        if (!ok)
            throw new IllegalArgumentException("Invalid " + type.displayName() + " value: " + value);
    }

    public static ValueType string(String value) {
        return new ValueType(DataType.STRING, value);
    }

    public static ValueType integer(int value) {
        return new ValueType(DataType.INTEGER, value);
    }

    public static ValueType floating(double value) {
        return new ValueType(DataType.FLOAT, value);
    }

    public static ValueType bool(boolean value) {
        return new ValueType(DataType.BOOLEAN, value);
    }

    /** The zero value for a type: empty string, 0, 0.0, false. */
    public static ValueType defaultFor(DataType type) {
        return switch (type) {
            case STRING -> string("");
            case INTEGER -> integer(0);
            case FLOAT -> floating(0.0);
            case BOOLEAN -> bool(false);
            case EXECUTION -> EXECUTION;
        };
    }

    public String asString() {
        return (String) require(DataType.STRING);
    }

    public int asInteger() {
        return (Integer) require(DataType.INTEGER);
    }

    public double asFloat() {
        return (Double) require(DataType.FLOAT);
    }

    public boolean asBoolean() {
        return (Boolean) require(DataType.BOOLEAN);
    }

    private Object require(DataType expected) {
        if (type != expected)
            throw new IllegalStateException("Invalid cast from " + type.displayName() + " to " + expected.displayName());
        return value;
    }

    /**
     * Renders this value as a literal of the target notation.
     * Execution values render as the empty string.
     */
    public String render() {
        return switch (type) {
            case STRING -> quote((String) value);
            case INTEGER -> Integer.toString((Integer) value);
            case FLOAT -> renderFloat((Double) value);
            case BOOLEAN -> Boolean.toString((Boolean) value);
            case EXECUTION -> "";
        };
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    // 3.0 -> "3", 0.5 -> "0.5", 1e20 -> "100000000000000000000"
    static String renderFloat(double d) {
        if (d == 0.0)
            return "0";
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
