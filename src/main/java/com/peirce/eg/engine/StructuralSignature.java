package com.peirce.eg.engine;

import com.peirce.eg.api.HookRef;
import com.peirce.eg.model.GraphModel;
import com.peirce.eg.model.Ligature;
import com.peirce.eg.model.Predicate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Canonical description of a group of graph elements, used to decide whether
 * one group is a copy of another.
 *
 * <p>
 * This is a bounded, type-driven test rather than general graph isomorphism.
 * Every predicate inside the group gets a type key (label, arity, kind and the
 * shapes of the cuts enclosing it within the group). Predicates are ranked by
 * type key, refined by their wiring to other ranked predicates, then by id.
 * Each hook is described as one of:
 * <ul>
 * <li>{@code i:-} unbound,</li>
 * <li>{@code i:[r.h,...]} bound to a line lying wholly inside the group, with
 * the ranks and hooks of the partner attachments,</li>
 * <li>{@code i:ext<id>} bound to a line that leaves the group.</li>
 * </ul>
 * Two groups are isomorphic when their top-level shapes and their ordered
 * entry lists are equal.
 */
final class StructuralSignature {

    private final List<String> entries;

    private StructuralSignature(List<String> entries) {
        this.entries = entries;
    }

    static StructuralSignature of(GraphModel model, Collection<Integer> topLevel) {
        Map<Integer, String> typeKeys = new LinkedHashMap<>();
        for (int id : topLevel)
            collect(model, id, "", typeKeys);

        Set<Integer> members = typeKeys.keySet();
        Map<Integer, String> colour = new HashMap<>(typeKeys);
        int distinct = new HashSet<>(colour.values()).size();
        // Refine colours by neighbourhood until the partition stops splitting
        for (int round = 0; round < members.size(); round++) {
            Map<Integer, String> next = new HashMap<>();
            for (int p : members)
                next.put(p, colour.get(p) + "{" + String.join(" ", hookEntries(model, p, members, colour::get)) + "}");
            colour = compress(next);
            int refined = new HashSet<>(colour.values()).size();
            if (refined == distinct)
                break;
            distinct = refined;
        }

        final Map<Integer, String> finalColour = colour;
        List<Integer> ranked = new ArrayList<>(members);
        ranked.sort(Comparator.comparing((Integer p) -> finalColour.get(p)).thenComparing(p -> p));
        Map<Integer, Integer> rank = new HashMap<>();
        for (int i = 0; i < ranked.size(); i++)
            rank.put(ranked.get(i), i);

        List<String> shapes = new ArrayList<>();
        for (int id : topLevel)
            shapes.add(elementKey(model, id));
        shapes.sort(null);

        List<String> entries = new ArrayList<>(ranked.size() + 1);
        entries.add(String.join(",", shapes));
        for (int p : ranked)
            entries.add(typeKeys.get(p) + " "
                    + String.join(" ", hookEntries(model, p, members, q -> String.valueOf(rank.get(q)))));
        return new StructuralSignature(entries);
    }

    /** Replaces each colour by its position among the sorted distinct colours. */
    private static Map<Integer, String> compress(Map<Integer, String> colour) {
        List<String> distinct = new ArrayList<>(new TreeSet<>(colour.values()));
        Map<Integer, String> compact = new HashMap<>();
        for (Map.Entry<Integer, String> e : colour.entrySet())
            compact.put(e.getKey(), String.format("%06d", distinct.indexOf(e.getValue())));
        return compact;
    }

    private static List<String> hookEntries(GraphModel model, int predicateId, Set<Integer> members,
            Function<Integer, String> partnerName) {
        Predicate p = model.predicate(predicateId);
        List<String> hooks = new ArrayList<>(p.arity());
        for (int i = 1; i <= p.arity(); i++) {
            if (!p.isBound(i)) {
                hooks.add(i + ":-");
                continue;
            }
            Ligature l = model.ligature(p.ligatureAt(i));
            boolean internal = true;
            for (HookRef h : l.attachments()) {
                if (!members.contains(h.predicateId())) {
                    internal = false;
                    break;
                }
            }
            if (!internal) {
                hooks.add(i + ":ext" + l.id());
                continue;
            }
            List<String> partners = new ArrayList<>();
            for (HookRef h : l.attachments())
                if (!(h.predicateId() == predicateId && h.index() == i))
                    partners.add(partnerName.apply(h.predicateId()) + "." + h.index());
            partners.sort(null);
            hooks.add(i + ":" + partners);
        }
        return hooks;
    }

    private static void collect(GraphModel model, int id, String path, Map<Integer, String> typeKeys) {
        if (model.isPredicate(id)) {
            typeKeys.put(id, elementKey(model, id) + "@" + path);
            return;
        }
        String inner = path + "/" + elementKey(model, id);
        for (int child : model.context(id).children())
            collect(model, child, inner, typeKeys);
    }

    /**
     * Type of a single element: {@code label/arity/kind} for a predicate, the
     * sorted multiset of its children's keys for a cut.
     */
    static String elementKey(GraphModel model, int id) {
        if (model.isPredicate(id)) {
            Predicate p = model.predicate(id);
            return p.label() + "/" + p.arity() + "/" + p.kind();
        }
        List<String> children = new ArrayList<>();
        for (int child : model.context(id).children())
            children.add(elementKey(model, child));
        children.sort(null);
        return "cut" + children;
    }

    List<String> entries() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StructuralSignature s && entries.equals(s.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
