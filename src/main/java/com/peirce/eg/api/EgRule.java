package com.peirce.eg.api;

/**
 * The transformation rules the editor enforces.
 * A {@link ValidationException} always names the rule whose precondition
 * failed.
 */
public enum EgRule {
    INSERTION("insertion"),
    ERASURE("erasure"),
    ITERATION("iteration"),
    DEITERATION("de-iteration"),
    DOUBLE_CUT_REMOVAL("double cut removal"),
    FUNCTIONAL_PROPERTY("functional property"),
    CONSTANT_IDENTITY("constant identity"),
    LIGATURE_BRANCH_MOVE("ligature branch move"),
    ISOLATED_CONSTANT_ERASURE("isolated constant erasure");

    private final String displayName;

    EgRule(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
