package com.peirce.eg.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An area of the graph: the Sheet of Assertion or a cut.
 *
 * <p>
 * A context only owns the ordered ids of its direct children (predicates and
 * sub-contexts). Its parent is kept in the {@link GraphModel}'s parent index
 * so that no entity holds a reference to another.
 */
public final class Context {
    private final int id;
    private final List<Integer> children = new ArrayList<>();

    Context(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    /** Read-only view of the direct children in insertion order. */
    public List<Integer> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    void addChild(int childId, int position) {
        if (position < 0 || position > children.size())
            children.add(childId);
        else
            children.add(position, childId);
    }

    /** Removes the child and returns the index it occupied, or -1. */
    int removeChild(int childId) {
        int idx = children.indexOf(childId);
        if (idx >= 0)
            children.remove(idx);
        return idx;
    }

    @Override
    public String toString() {
        return "Context[" + id + ", children=" + children + "]";
    }
}
