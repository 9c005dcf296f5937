package com.peirce.eg.api;

/**
 * The three kinds of Peirce "spot", following Dau's extensions.
 *
 * <ul>
 * <li>{@link #RELATION}: an n-ary relation, every hook is an argument.</li>
 * <li>{@link #FUNCTION}: hooks 1..n-1 are inputs, hook n is the output.</li>
 * <li>{@link #CONSTANT}: a named individual, one hook (or none for a bare
 * name with no line attached).</li>
 * </ul>
 */
public enum PredicateKind {
    RELATION,
    FUNCTION,
    CONSTANT;

    /** Case-insensitive lookup, e.g. "function" or "FUNCTION". */
    public static PredicateKind fromString(String s) {
        for (PredicateKind k : values())
            if (k.name().equalsIgnoreCase(s))
                return k;
        throw new IllegalArgumentException("Unknown predicate kind: " + s);
    }
}
