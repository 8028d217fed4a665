package com.graphscript.template;

import java.util.Arrays;
import java.util.List;

/**
 * The closed set of node templates.
 *
 * Each constant declares the static facts the editor and the compiler rely on:
 * the finder label and categories, the optional shape-shift category (templates
 * sharing one can be swapped in place), the execution port shape and the
 * composition rule the flow compiler applies. Data ports and behavior hooks are
 * registered in {@link TemplateRegistry}.
 */
public enum NodeTemplate {
    ENTER("Enter", List.of("Special"), null,
            PortShape.execute("Enter"), Composition.SEQUENTIAL, false),
    PRINT("Print", List.of("I/O"), null,
            PortShape.executedAndExecute("", ""), Composition.SEQUENTIAL, false),
    ASK("Ask", List.of("I/O"), null,
            PortShape.executedAndExecute("", ""), Composition.SEQUENTIAL, false),
    IF("If", List.of("Logic"), null,
            PortShape.executedAndExecute("", "If", "Else", "Continue"), Composition.EMBEDDED, false),
    ADD_NUMBER("Add Number", List.of("Logic"), "Add",
            PortShape.data(), Composition.TERMINAL, false),
    ADD_STRING("Add String", List.of("Logic"), "Add",
            PortShape.data(), Composition.TERMINAL, false),
    FUNCTION("Function", List.of("Special"), null,
            PortShape.executedAndExecute("", ""), Composition.SEQUENTIAL, false),
    ARGUMENT("Argument", List.of("Special"), null,
            PortShape.data(), Composition.TERMINAL, true),
    RETURN("Return", List.of("Special"), null,
            PortShape.executed(""), Composition.TERMINAL, false),
    GET_VARIABLE("Get Variable", List.of("Variables"), null,
            PortShape.data(), Composition.TERMINAL, true),
    SET_VARIABLE("Set Variable", List.of("Variables"), null,
            PortShape.executedAndExecute("", ""), Composition.SEQUENTIAL, true);

    private final String label;
    private final List<String> categories;
    private final String shapeShiftCategory;
    private final PortShape shape;
    private final Composition composition;
    private final boolean requiresSymbol;

    NodeTemplate(String label, List<String> categories, String shapeShiftCategory,
            PortShape shape, Composition composition, boolean requiresSymbol) {
        this.label = label;
        this.categories = categories;
        this.shapeShiftCategory = shapeShiftCategory;
        this.shape = shape;
        this.composition = composition;
        this.requiresSymbol = requiresSymbol;
    }

    public String label() {
        return label;
    }

    public List<String> categories() {
        return categories;
    }

    /** Category shared by interchangeable templates, or {@code null}. */
    public String shapeShiftCategory() {
        return shapeShiftCategory;
    }

    public PortShape shape() {
        return shape;
    }

    public Composition composition() {
        return composition;
    }

    public boolean isControl() {
        return shape.isControl();
    }

    public boolean requiresSymbol() {
        return requiresSymbol;
    }

    /** Templates this one can be swapped with in place, including itself. */
    public List<NodeTemplate> shapeShiftAlternatives() {
        if (shapeShiftCategory == null)
            return List.of(this);
        return Arrays.stream(values())
                .filter(t -> shapeShiftCategory.equals(t.shapeShiftCategory))
                .toList();
    }

    public static NodeTemplate fromString(String text) {
        for (NodeTemplate t : NodeTemplate.values()) {
            if (t.name().equalsIgnoreCase(text) || t.label.equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown NodeTemplate: " + text);
    }
}
