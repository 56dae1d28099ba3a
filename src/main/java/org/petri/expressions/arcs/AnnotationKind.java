package org.petri.expressions.arcs;

/**
 * 弧标注的种类。
 */
public enum AnnotationKind {

    VALUE("Value"),
    VARIABLE("Variable"),
    EXPRESSION("Expression"),
    MULTI_ARC("MultiArc"),
    TUPLE("Tuple"),
    TEST("Test"),
    INHIBITOR("Inhibitor"),
    FLUSH("Flush");

    private final String displayName;

    AnnotationKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
