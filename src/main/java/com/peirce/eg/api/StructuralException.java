package com.peirce.eg.api;

/**
 * Malformed use of the editor API: a missing or wrong-kind element, a hook
 * index outside a predicate's arity, an arity the predicate kind does not
 * allow.
 */
public class StructuralException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public StructuralException(String message) {
        super(message);
    }
}
