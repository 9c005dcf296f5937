package com.peirce.eg.model;

import com.peirce.eg.api.HookRef;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * A line of identity: the set of hooks asserted to denote one individual.
 *
 * <p>
 * The home context (where the line is quantified) is derived, not stored; see
 * {@code EgEditor.homeContext}. The traversed-cut set is bookkeeping refreshed
 * by the editor whenever the attachments change.
 */
public final class Ligature {
    private final int id;
    private final Set<HookRef> attachments = new LinkedHashSet<>();
    private final Set<Integer> traversedCuts = new TreeSet<>();

    Ligature(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public Set<HookRef> attachments() {
        return Collections.unmodifiableSet(attachments);
    }

    public int size() {
        return attachments.size();
    }

    public boolean isDetached() {
        return attachments.isEmpty();
    }

    /** Cuts lying strictly between the home context and some attachment. */
    public Set<Integer> traversedCuts() {
        return Collections.unmodifiableSet(traversedCuts);
    }

    void attach(HookRef hook) {
        attachments.add(hook);
    }

    void detach(HookRef hook) {
        attachments.remove(hook);
    }

    void setTraversedCuts(Set<Integer> cuts) {
        traversedCuts.clear();
        traversedCuts.addAll(cuts);
    }

    @Override
    public String toString() {
        return "Ligature[" + id + ", " + attachments + "]";
    }
}
