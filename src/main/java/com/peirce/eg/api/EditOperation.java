package com.peirce.eg.api;

/** Operation kinds reported to an {@link EditListener}. */
public enum EditOperation {
    ADD_CUT,
    ADD_PREDICATE,
    ADD_LIGATURE,
    CONNECT,
    SEVER,
    ERASE,
    ITERATE,
    DEITERATE,
    INSERT_DOUBLE_CUT,
    REMOVE_DOUBLE_CUT,
    FUNCTIONAL_PROPERTY,
    CONSTANT_IDENTITY,
    MOVE_BRANCH,
    DISCARD_LIGATURES
}
