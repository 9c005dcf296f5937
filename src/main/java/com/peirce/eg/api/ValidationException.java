package com.peirce.eg.api;

/**
 * A transformation rule's precondition does not hold for the requested
 * operation. The model is untouched when this is thrown.
 */
public class ValidationException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final EgRule rule;

    public ValidationException(EgRule rule, String message) {
        super(rule.displayName() + ": " + message);
        this.rule = rule;
    }

    public EgRule rule() {
        return rule;
    }
}
