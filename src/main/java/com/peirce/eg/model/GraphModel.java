package com.peirce.eg.model;

import com.peirce.eg.api.HookRef;
import com.peirce.eg.api.PredicateKind;
import com.peirce.eg.api.StructuralException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Arena of all graph entities, keyed by identity.
 *
 * <p>
 * Contexts, predicates and ligatures share one increasing id sequence. The
 * Sheet of Assertion always has id {@link #SHEET}. Parent relations live in a
 * separate index ({@code element id -> context id}) rather than in the
 * entities, so removal never leaves back-references behind.
 *
 * <p>
 * The model only stores and looks up. It keeps its indexes consistent (child
 * lists, parent index, hook bindings vs. ligature attachments) but enforces no
 * logic: all rule checking lives in the editor and validator, which are the
 * only intended callers of the mutators.
 *
 * <p>
 * Not thread-safe.
 */
public final class GraphModel {
    public static final int SHEET = 0;

    private final Map<Integer, Context> contexts = new LinkedHashMap<>();
    private final Map<Integer, Predicate> predicates = new LinkedHashMap<>();
    private final Map<Integer, Ligature> ligatures = new LinkedHashMap<>();

    // child id -> parent context id; the sheet has no entry
    private final Map<Integer, Integer> parentIndex = new HashMap<>();

    private int nextId = SHEET + 1;

    public GraphModel() {
        contexts.put(SHEET, new Context(SHEET));
    }

    public int sheetOfAssertion() {
        return SHEET;
    }

    public boolean contains(int id) {
        return contexts.containsKey(id) || predicates.containsKey(id) || ligatures.containsKey(id);
    }

    public boolean isContext(int id) {
        return contexts.containsKey(id);
    }

    /** True for every context except the Sheet of Assertion. */
    public boolean isCut(int id) {
        return id != SHEET && contexts.containsKey(id);
    }

    public boolean isPredicate(int id) {
        return predicates.containsKey(id);
    }

    public boolean isLigature(int id) {
        return ligatures.containsKey(id);
    }

    public Context context(int id) {
        Context c = contexts.get(id);
        if (c == null)
            throw new StructuralException("No context with id " + id);
        return c;
    }

    public Predicate predicate(int id) {
        Predicate p = predicates.get(id);
        if (p == null)
            throw new StructuralException("No predicate with id " + id);
        return p;
    }

    public Ligature ligature(int id) {
        Ligature l = ligatures.get(id);
        if (l == null)
            throw new StructuralException("No ligature with id " + id);
        return l;
    }

    /**
     * Returns the parent context of a predicate or cut, or -1 for the sheet.
     *
     * @throws StructuralException if the id is not a placed element.
     */
    public int parentOf(int elementId) {
        if (elementId == SHEET)
            return -1;
        Integer parent = parentIndex.get(elementId);
        if (parent == null)
            throw new StructuralException("Element " + elementId + " has no parent context");
        return parent;
    }

    public Collection<Context> contexts() {
        return Collections.unmodifiableCollection(contexts.values());
    }

    public Collection<Predicate> predicates() {
        return Collections.unmodifiableCollection(predicates.values());
    }

    public Collection<Ligature> ligatures() {
        return Collections.unmodifiableCollection(ligatures.values());
    }

    public int contextCount() {
        return contexts.size();
    }

    public int predicateCount() {
        return predicates.size();
    }

    public int ligatureCount() {
        return ligatures.size();
    }

    /** True when the sheet has no children and no ligature exists. */
    public boolean isEmpty() {
        return contexts.get(SHEET).isEmpty() && ligatures.isEmpty();
    }

    /** Ids of all entities, in ascending order. */
    public Set<Integer> ids() {
        Set<Integer> all = new TreeSet<>(contexts.keySet());
        all.addAll(predicates.keySet());
        all.addAll(ligatures.keySet());
        return all;
    }

    public int newContext(int parentId, int position) {
        Context parent = context(parentId);
        int id = nextId++;
        contexts.put(id, new Context(id));
        parent.addChild(id, position);
        parentIndex.put(id, parentId);
        return id;
    }

    public int newPredicate(String label, int arity, PredicateKind kind, int parentId, int position) {
        Context parent = context(parentId);
        int id = nextId++;
        predicates.put(id, new Predicate(id, label, arity, kind));
        parent.addChild(id, position);
        parentIndex.put(id, parentId);
        return id;
    }

    public int newLigature() {
        int id = nextId++;
        ligatures.put(id, new Ligature(id));
        return id;
    }

    /**
     * Moves a placed element under another context.
     *
     * @return the position the element occupied in its old parent.
     */
    public int reparent(int elementId, int newParentId, int position) {
        Context target = context(newParentId);
        int oldParent = parentOf(elementId);
        int oldPosition = contexts.get(oldParent).removeChild(elementId);
        target.addChild(elementId, position);
        parentIndex.put(elementId, newParentId);
        return oldPosition;
    }

    /**
     * Removes a predicate, detaching every bound hook from its ligature first.
     * Ligatures left empty are kept; discarding them is the caller's decision.
     */
    public void removePredicate(int id) {
        Predicate p = predicate(id);
        for (int i = 1; i <= p.arity(); i++)
            if (p.isBound(i))
                unbind(p.hook(i));
        Integer parent = parentIndex.remove(id);
        if (parent != null)
            contexts.get(parent).removeChild(id);
        predicates.remove(id);
    }

    /**
     * Removes a cut. The cut must be empty; callers move or remove its
     * contents beforehand.
     */
    public void removeContext(int id) {
        if (id == SHEET)
            throw new StructuralException("The Sheet of Assertion cannot be removed");
        Context c = context(id);
        if (!c.isEmpty())
            throw new StructuralException("Context " + id + " still has children " + c.children());
        Integer parent = parentIndex.remove(id);
        if (parent != null)
            contexts.get(parent).removeChild(id);
        contexts.remove(id);
    }

    /** Removes a ligature, unbinding any hooks still attached to it. */
    public void removeLigature(int id) {
        Ligature l = ligature(id);
        for (HookRef h : l.attachments().toArray(new HookRef[0])) {
            Predicate p = predicates.get(h.predicateId());
            if (p != null)
                p.bind(h.index(), Predicate.UNBOUND);
        }
        ligatures.remove(id);
    }

    /**
     * Binds a hook to a ligature, detaching it from any previous ligature.
     */
    public void bind(HookRef hook, int ligatureId) {
        Predicate p = predicate(hook.predicateId());
        if (!p.hasHook(hook.index()))
            throw new StructuralException("Predicate " + p.id() + " has no hook " + hook.index());
        Ligature target = ligature(ligatureId);
        int current = p.ligatureAt(hook.index());
        if (current == ligatureId)
            return;
        if (current != Predicate.UNBOUND)
            ligatures.get(current).detach(hook);
        p.bind(hook.index(), ligatureId);
        target.attach(hook);
    }

    /** Unbinds a hook. Returns the ligature it was bound to, or UNBOUND. */
    public int unbind(HookRef hook) {
        Predicate p = predicate(hook.predicateId());
        int current = p.ligatureAt(hook.index());
        if (current != Predicate.UNBOUND) {
            ligatures.get(current).detach(hook);
            p.bind(hook.index(), Predicate.UNBOUND);
        }
        return current;
    }

    public void setTraversedCuts(int ligatureId, Set<Integer> cuts) {
        ligature(ligatureId).setTraversedCuts(cuts);
    }
}
