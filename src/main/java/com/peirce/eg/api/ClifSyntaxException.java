package com.peirce.eg.api;

/**
 * CLIF text could not be tokenized or parsed.
 *
 * <p>
 * {@link #position()} is the character offset of the offending token, or the
 * input length when the input ended early.
 */
public class ClifSyntaxException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int position;

    public ClifSyntaxException(String message, int position) {
        super(message + " (at offset " + position + ")");
        this.position = position;
    }

    public int position() {
        return position;
    }
}
