package com.peirce.eg.model;

import com.peirce.eg.api.HookRef;
import com.peirce.eg.api.PredicateKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A Peirce spot: a relation, function or constant with numbered hooks.
 *
 * <p>
 * Hooks are 1-based. Each hook holds the id of the ligature it is bound to, or
 * {@link #UNBOUND}. For functions the highest hook is the output.
 */
public final class Predicate {
    public static final int UNBOUND = -1;

    private final int id;
    private final String label;
    private final int arity;
    private final PredicateKind kind;
    private final int[] hookLigatures;

    Predicate(int id, String label, int arity, PredicateKind kind) {
        this.id = id;
        this.label = label;
        this.arity = arity;
        this.kind = kind;
        this.hookLigatures = new int[arity];
        Arrays.fill(hookLigatures, UNBOUND);
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public int arity() {
        return arity;
    }

    public PredicateKind kind() {
        return kind;
    }

    public boolean hasHook(int index) {
        return index >= 1 && index <= arity;
    }

    /** Ligature bound at the given hook, or {@link #UNBOUND}. */
    public int ligatureAt(int index) {
        return hookLigatures[index - 1];
    }

    public boolean isBound(int index) {
        return hookLigatures[index - 1] != UNBOUND;
    }

    /** The output hook of a function (its highest hook). */
    public int outputHook() {
        return arity;
    }

    public HookRef hook(int index) {
        return new HookRef(id, index);
    }

    public List<HookRef> hooks() {
        List<HookRef> refs = new ArrayList<>(arity);
        for (int i = 1; i <= arity; i++)
            refs.add(new HookRef(id, i));
        return refs;
    }

    void bind(int index, int ligatureId) {
        hookLigatures[index - 1] = ligatureId;
    }

    @Override
    public String toString() {
        return kind + "[" + id + ", " + label + "/" + arity + ", hooks=" + Arrays.toString(hookLigatures) + "]";
    }
}
