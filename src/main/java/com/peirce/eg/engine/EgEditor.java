package com.peirce.eg.engine;

import com.peirce.eg.api.EditListener;
import com.peirce.eg.api.EditOperation;
import com.peirce.eg.api.EgSettings;
import com.peirce.eg.api.HookRef;
import com.peirce.eg.api.PredicateKind;
import com.peirce.eg.api.StructuralException;
import com.peirce.eg.model.Context;
import com.peirce.eg.model.GraphModel;
import com.peirce.eg.model.Ligature;
import com.peirce.eg.model.Predicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mutation API over a {@link GraphModel}.
 *
 * <p>
 * This is the only boundary through which the model changes. Construction
 * operations ({@link #addCut}, {@link #addPredicate}, {@link #connect},
 * {@link #sever}) are unrestricted apart from structural checks; the
 * transformation rules (erasure, iteration, de-iteration, double cut,
 * insertion and the two derived rules) are gated by the {@link EgValidator}.
 *
 * <p>
 * Failure discipline: every operation validates completely before it touches
 * the model. A {@link StructuralException} or
 * {@link com.peirce.eg.api.ValidationException} therefore always leaves the
 * model exactly as it was.
 *
 * <p>
 * Parent, ancestor and least-common-ancestor relationships are computed on
 * demand by walking the model's parent index.
 *
 * <p>
 * Single-threaded; not safe for concurrent use.
 */
public final class EgEditor {
    private static final Logger log = LogManager.getLogger(EgEditor.class);

    private static final String IDENTITY = "=";
    private static final Set<String> RESERVED_LABELS = Set.of("exists", "forall", "and", "or", "not", "if", "iff",
            "true");

    private final GraphModel model;
    private final EgValidator validator;
    private EditListener listener;

    public EgEditor() {
        this(new GraphModel());
    }

    public EgEditor(GraphModel model) {
        this(model, EgSettings.defaults());
    }

    public EgEditor(GraphModel model, EgSettings settings) {
        this.model = model;
        this.validator = new EgValidator(this, settings);
    }

    public GraphModel model() {
        return model;
    }

    public EgValidator validator() {
        return validator;
    }

    public int sheetOfAssertion() {
        return model.sheetOfAssertion();
    }

    public void setListener(EditListener listener) {
        this.listener = listener;
    }

    /** Parent context of a predicate or cut; -1 for the sheet. */
    public int parentOf(int elementId) {
        return model.parentOf(elementId);
    }

    /** Nesting depth of a context. The sheet is 0. */
    public int depth(int contextId) {
        requireContext(contextId);
        int d = 0;
        for (int c = model.parentOf(contextId); c != -1; c = model.parentOf(c))
            d++;
        return d;
    }

    public boolean isPositive(int contextId) {
        return depth(contextId) % 2 == 0;
    }

    /** The context itself followed by each enclosing context up to the sheet. */
    public List<Integer> ancestors(int contextId) {
        requireContext(contextId);
        List<Integer> path = new ArrayList<>();
        for (int c = contextId; c != -1; c = model.parentOf(c))
            path.add(c);
        return path;
    }

    /** True when {@code contextId} is {@code ancestorId} or lies inside it. */
    public boolean isEnclosedBy(int contextId, int ancestorId) {
        for (int c = contextId; c != -1; c = model.parentOf(c))
            if (c == ancestorId)
                return true;
        return false;
    }

    /**
     * Least common ancestor of a set of contexts: the deepest context enclosing
     * all of them. The sheet for an empty collection.
     */
    public int lca(Collection<Integer> contextIds) {
        if (contextIds.isEmpty())
            return model.sheetOfAssertion();
        List<Integer> candidate = null;
        List<Set<Integer>> others = new ArrayList<>();
        for (int id : contextIds) {
            if (candidate == null)
                candidate = ancestors(id);
            else
                others.add(new HashSet<>(ancestors(id)));
        }
        for (int c : candidate) {
            boolean common = true;
            for (Set<Integer> path : others) {
                if (!path.contains(c)) {
                    common = false;
                    break;
                }
            }
            if (common)
                return c;
        }
        // Unreachable in a single-rooted tree
        throw new IllegalStateException("No common ancestor for " + contextIds);
    }

    /**
     * Where a ligature is quantified: the least common ancestor of its
     * attached predicates' contexts, or the sheet when it is detached.
     */
    public int homeContext(int ligatureId) {
        Ligature l = model.ligature(ligatureId);
        Set<Integer> contexts = new LinkedHashSet<>();
        for (HookRef h : l.attachments())
            contexts.add(model.parentOf(h.predicateId()));
        return lca(contexts);
    }

    /** Resolves raw ids into a {@link Selection}. */
    public Selection selection(Collection<Integer> ids) {
        return Selection.resolve(this, ids);
    }

    public int addCut(int parentId) {
        requireContext(parentId);
        int id = model.newContext(parentId, -1);
        log.debug("Added cut {} in context {}", id, parentId);
        fire(EditOperation.ADD_CUT, List.of(id));
        return id;
    }

    public int addPredicate(String label, int arity, int parentId, PredicateKind kind) {
        requireContext(parentId);
        checkPredicateShape(label, arity, kind);
        int id = model.newPredicate(label, arity, kind, parentId, -1);
        log.debug("Added {} '{}'/{} as {} in context {}", kind, label, arity, id, parentId);
        fire(EditOperation.ADD_PREDICATE, List.of(id));
        return id;
    }

    public int addPredicate(String label, int arity, int parentId) {
        return addPredicate(label, arity, parentId, PredicateKind.RELATION);
    }

    /** Creates a ligature with no attachments. */
    public int addLigature() {
        int id = model.newLigature();
        fire(EditOperation.ADD_LIGATURE, List.of(id));
        return id;
    }

    /**
     * Joins hooks into one line of identity.
     *
     * <p>
     * If none of the hooks is bound a new ligature is created. Otherwise the
     * existing ligatures are merged: the one with most attachments survives
     * (the lower id on a tie) and takes the union of all attachments; the
     * others are discarded.
     *
     * @return id of the resulting ligature.
     */
    public int connect(Collection<HookRef> hooks) {
        return connectInto(-1, hooks);
    }

    public int connect(HookRef... hooks) {
        return connectInto(-1, List.of(hooks));
    }

    /**
     * Joins hooks onto a given ligature, which always survives any merge.
     */
    public int connect(int ligatureId, Collection<HookRef> hooks) {
        model.ligature(ligatureId);
        return connectInto(ligatureId, hooks);
    }

    private int connectInto(int target, Collection<HookRef> hooks) {
        if (hooks == null || hooks.isEmpty())
            throw new StructuralException("connect requires at least one hook");
        for (HookRef h : hooks)
            requireHook(h);

        Set<Integer> bound = new LinkedHashSet<>();
        for (HookRef h : hooks) {
            int l = model.predicate(h.predicateId()).ligatureAt(h.index());
            if (l != Predicate.UNBOUND)
                bound.add(l);
        }

        int survivor = target;
        if (survivor == -1) {
            for (int l : bound) {
                if (survivor == -1 || outranks(l, survivor))
                    survivor = l;
            }
            if (survivor == -1)
                survivor = model.newLigature();
        }

        for (int absorbed : bound) {
            if (absorbed == survivor)
                continue;
            for (HookRef h : new ArrayList<>(model.ligature(absorbed).attachments()))
                model.bind(h, survivor);
            model.removeLigature(absorbed);
            log.debug("Merged ligature {} into {}", absorbed, survivor);
        }
        for (HookRef h : hooks)
            model.bind(h, survivor);
        refreshTraversedCuts(survivor);

        List<Integer> affected = new ArrayList<>();
        affected.add(survivor);
        affected.addAll(bound);
        fire(EditOperation.CONNECT, affected);
        return survivor;
    }

    private boolean outranks(int a, int b) {
        int sa = model.ligature(a).size(), sb = model.ligature(b).size();
        return sa > sb || (sa == sb && a < b);
    }

    /**
     * Detaches a hook onto a fresh ligature of its own.
     *
     * <p>
     * An unbound hook is given a new singleton ligature. A hook that is
     * already alone on its ligature is left as it is.
     *
     * @return id of the ligature the hook ends up on.
     */
    public int sever(HookRef hook) {
        requireHook(hook);
        int current = model.predicate(hook.predicateId()).ligatureAt(hook.index());
        if (current != Predicate.UNBOUND && model.ligature(current).size() < 2)
            return current;

        int fresh = model.newLigature();
        model.bind(hook, fresh);
        refreshTraversedCuts(fresh);
        if (current != Predicate.UNBOUND)
            refreshTraversedCuts(current);
        log.debug("Severed {} from ligature {} onto {}", hook, current, fresh);
        fire(EditOperation.SEVER, current == Predicate.UNBOUND ? List.of(fresh) : List.of(fresh, current));
        return fresh;
    }

    /** Removes every ligature without attachments; returns how many. */
    public int discardDetachedLigatures() {
        List<Integer> detached = new ArrayList<>();
        for (Ligature l : model.ligatures())
            if (l.isDetached())
                detached.add(l.id());
        for (int id : detached)
            model.removeLigature(id);
        if (!detached.isEmpty())
            fire(EditOperation.DISCARD_LIGATURES, detached);
        return detached.size();
    }

    /** Insertion rule: adds a predicate to a negative context. */
    public int insertPredicate(String label, int arity, int contextId, PredicateKind kind) {
        requireContext(contextId);
        checkPredicateShape(label, arity, kind);
        validator.checkInsert(contextId);
        return addPredicate(label, arity, contextId, kind);
    }

    /** Insertion rule: adds an empty cut to a negative context. */
    public int insertCut(int contextId) {
        requireContext(contextId);
        validator.checkInsert(contextId);
        return addCut(contextId);
    }

    /**
     * Erasure rule: removes a selection whose root context is positive.
     * Ligatures left without attachments are discarded.
     */
    public void erase(Collection<Integer> selectionIds) {
        Selection sel = selection(selectionIds);
        validator.checkErase(sel);
        List<Integer> removed = removeSelection(sel);
        log.debug("Erased {}", sel);
        fire(EditOperation.ERASE, removed);
    }

    /**
     * Iteration rule: copies a selection into a context at least as deep as
     * its root.
     *
     * <p>
     * A ligature lying wholly inside the selection gets a private copy that
     * wires only the duplicated hooks. A ligature reaching outside the
     * selection is shared: the duplicated hooks join the same ligature.
     *
     * @return ids of the copied top-level elements, in selection order.
     */
    public List<Integer> iterate(Collection<Integer> selectionIds, int targetContext) {
        requireContext(targetContext);
        Selection sel = selection(selectionIds);
        validator.checkIterate(sel, targetContext);

        // Decide before copying which lines are private to the selection
        Set<Integer> internal = new HashSet<>();
        for (int p : sel.predicates()) {
            Predicate pred = model.predicate(p);
            for (int i = 1; i <= pred.arity(); i++) {
                if (!pred.isBound(i))
                    continue;
                int l = pred.ligatureAt(i);
                if (sel.predicates().containsAll(predicatesOf(l)))
                    internal.add(l);
            }
        }

        Map<Integer, Integer> copies = new HashMap<>();
        List<Integer> topCopies = new ArrayList<>();
        for (int id : sel.topLevel())
            topCopies.add(copyElement(id, targetContext, copies));

        Map<Integer, Integer> privateLines = new HashMap<>();
        Set<Integer> touched = new TreeSet<>();
        for (int p : sel.predicates()) {
            Predicate original = model.predicate(p);
            int copy = copies.get(p);
            for (int i = 1; i <= original.arity(); i++) {
                if (!original.isBound(i))
                    continue;
                int l = original.ligatureAt(i);
                int line = internal.contains(l)
                        ? privateLines.computeIfAbsent(l, k -> model.newLigature())
                        : l;
                model.bind(HookRef.of(copy, i), line);
                touched.add(line);
            }
        }
        for (int l : touched)
            refreshTraversedCuts(l);

        log.debug("Iterated {} into context {} as {}", sel, targetContext, topCopies);
        List<Integer> affected = new ArrayList<>(topCopies);
        affected.addAll(privateLines.values());
        fire(EditOperation.ITERATE, affected);
        return topCopies;
    }

    private int copyElement(int id, int parent, Map<Integer, Integer> copies) {
        int copy;
        if (model.isPredicate(id)) {
            Predicate p = model.predicate(id);
            copy = model.newPredicate(p.label(), p.arity(), p.kind(), parent, -1);
        } else {
            copy = model.newContext(parent, -1);
            for (int child : model.context(id).children())
                copyElement(child, copy, copies);
        }
        copies.put(id, copy);
        return copy;
    }

    /**
     * De-iteration rule: removes a selection that is a copy of a graph in the
     * same or an enclosing area. Permitted at either polarity.
     */
    public void deiterate(Collection<Integer> selectionIds) {
        Selection sel = selection(selectionIds);
        validator.checkDeiterate(sel);
        List<Integer> removed = removeSelection(sel);
        log.debug("De-iterated {}", sel);
        fire(EditOperation.DEITERATE, removed);
    }

    /**
     * Double cut insertion: always valid. Creates an outer cut in
     * {@code parentId} with an inner cut inside it, then moves the selected
     * elements (which must be direct children of {@code parentId}) into the
     * inner cut. The outer cut takes the position of the first selected
     * element.
     */
    public DoubleCut insertDoubleCut(Collection<Integer> selectionIds, int parentId) {
        requireContext(parentId);
        Context parent = model.context(parentId);
        Set<Integer> members = new LinkedHashSet<>();
        if (selectionIds != null) {
            for (Integer id : selectionIds) {
                if (id == null || !(model.isPredicate(id) || model.isCut(id)))
                    throw new StructuralException("Cannot enclose element " + id);
                if (model.parentOf(id) != parentId)
                    throw new StructuralException("Element " + id + " is not a direct child of context " + parentId);
                members.add(id);
            }
        }

        int position = -1;
        List<Integer> ordered = new ArrayList<>();
        for (int i = 0; i < parent.children().size(); i++) {
            int child = parent.children().get(i);
            if (members.contains(child)) {
                if (position == -1)
                    position = i;
                ordered.add(child);
            }
        }

        int outer = model.newContext(parentId, position);
        int inner = model.newContext(outer, -1);
        for (int id : ordered)
            model.reparent(id, inner, -1);
        refreshAllTraversedCuts();

        log.debug("Inserted double cut {}/{} in context {} around {}", outer, inner, parentId, ordered);
        List<Integer> affected = new ArrayList<>(List.of(outer, inner));
        affected.addAll(ordered);
        fire(EditOperation.INSERT_DOUBLE_CUT, affected);
        return new DoubleCut(outer, inner);
    }

    public DoubleCut insertDoubleCut(int parentId) {
        return insertDoubleCut(List.of(), parentId);
    }

    /**
     * Double cut removal: splices the inner cut's children into the outer
     * cut's parent, at the outer cut's position, and discards both cuts.
     */
    public void removeDoubleCut(int outerCut) {
        if (!model.isContext(outerCut))
            throw new StructuralException("No context with id " + outerCut);
        validator.checkRemoveDoubleCut(outerCut);

        int parentId = model.parentOf(outerCut);
        int inner = model.context(outerCut).children().get(0);
        int position = model.context(parentId).children().indexOf(outerCut);
        List<Integer> moved = new ArrayList<>(model.context(inner).children());
        for (int id : moved)
            model.reparent(id, parentId, position++);
        model.removeContext(inner);
        model.removeContext(outerCut);
        refreshAllTraversedCuts();

        log.debug("Removed double cut {}/{} from context {}", outerCut, inner, parentId);
        List<Integer> affected = new ArrayList<>(List.of(outerCut, inner));
        affected.addAll(moved);
        fire(EditOperation.REMOVE_DOUBLE_CUT, affected);
    }

    /**
     * Functional property rule: two applications of the same function to the
     * same inputs have the same output. Joins the two output hooks.
     *
     * @return the ligature now shared by both outputs.
     */
    public int applyFunctionalPropertyRule(int p1, int p2) {
        validator.checkFunctionalProperty(p1, p2);
        Predicate a = model.predicate(p1), b = model.predicate(p2);
        int line = connect(List.of(a.hook(a.outputHook()), b.hook(b.outputHook())));
        fire(EditOperation.FUNCTIONAL_PROPERTY, List.of(p1, p2, line));
        return line;
    }

    /**
     * Constant identity rule: two occurrences of the same constant denote the
     * same individual. Joins their hooks.
     *
     * @return the ligature now shared by both constants.
     */
    public int applyConstantIdentityRule(int p1, int p2) {
        validator.checkConstantIdentity(p1, p2);
        int line = connect(List.of(HookRef.of(p1, 1), HookRef.of(p2, 1)));
        fire(EditOperation.CONSTANT_IDENTITY, List.of(p1, p2, line));
        return line;
    }

    /**
     * Moves the attachment point of a branch along its line of identity, from
     * wherever it joins the line to {@code anchor}. Both hooks must be on the
     * same ligature and their predicates in the same context.
     *
     * <p>
     * A ligature stores its attachments as a set, so the move leaves the
     * attachments and the translation unchanged. Listeners are notified so a
     * drawing can re-route the branch.
     *
     * @return the ligature both hooks are on.
     */
    public int moveLigatureBranch(HookRef branch, HookRef anchor) {
        requireHook(branch);
        requireHook(anchor);
        validator.checkMoveLigatureBranch(branch, anchor);
        int line = model.predicate(branch.predicateId()).ligatureAt(branch.index());
        log.debug("Moved branch {} onto {} along ligature {}", branch, anchor, line);
        fire(EditOperation.MOVE_BRANCH, List.of(line, branch.predicateId(), anchor.predicateId()));
        return line;
    }

    private List<Integer> removeSelection(Selection sel) {
        Set<Integer> touched = new TreeSet<>();
        List<Integer> removed = new ArrayList<>();
        for (int id : sel.topLevel())
            removeElement(id, touched, removed);
        for (int l : touched) {
            if (!model.isLigature(l))
                continue;
            if (model.ligature(l).isDetached()) {
                model.removeLigature(l);
                removed.add(l);
            } else {
                refreshTraversedCuts(l);
            }
        }
        return removed;
    }

    private void removeElement(int id, Set<Integer> touched, List<Integer> removed) {
        if (model.isPredicate(id)) {
            Predicate p = model.predicate(id);
            for (int i = 1; i <= p.arity(); i++)
                if (p.isBound(i))
                    touched.add(p.ligatureAt(i));
            model.removePredicate(id);
        } else {
            for (int child : new ArrayList<>(model.context(id).children()))
                removeElement(child, touched, removed);
            model.removeContext(id);
        }
        removed.add(id);
    }

    private Set<Integer> predicatesOf(int ligatureId) {
        Set<Integer> preds = new HashSet<>();
        for (HookRef h : model.ligature(ligatureId).attachments())
            preds.add(h.predicateId());
        return preds;
    }

    /**
     * Recomputes which cuts a ligature passes through: every cut on the way
     * from each attachment's context up to (excluding) the home context.
     */
    private void refreshTraversedCuts(int ligatureId) {
        Ligature l = model.ligature(ligatureId);
        Set<Integer> traversed = new TreeSet<>();
        if (l.size() >= 2) {
            int home = homeContext(ligatureId);
            for (HookRef h : l.attachments())
                for (int c = model.parentOf(h.predicateId()); c != home && c != -1; c = model.parentOf(c))
                    traversed.add(c);
        }
        model.setTraversedCuts(ligatureId, traversed);
    }

    private void refreshAllTraversedCuts() {
        for (Ligature l : model.ligatures())
            refreshTraversedCuts(l.id());
    }

    private void requireContext(int id) {
        if (!model.isContext(id))
            throw new StructuralException("No context with id " + id);
    }

    private void requireHook(HookRef h) {
        if (h == null)
            throw new StructuralException("Null hook reference");
        if (!model.isPredicate(h.predicateId()))
            throw new StructuralException("No predicate with id " + h.predicateId());
        Predicate p = model.predicate(h.predicateId());
        if (!p.hasHook(h.index()))
            throw new StructuralException(
                    "Predicate " + p.id() + " ('" + p.label() + "'/" + p.arity() + ") has no hook " + h.index());
    }

    private static void checkPredicateShape(String label, int arity, PredicateKind kind) {
        if (label == null || label.isBlank())
            throw new StructuralException("Predicate label must not be blank");
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == ';')
                throw new StructuralException("Predicate label '" + label + "' is not a CLIF symbol");
        }
        if (RESERVED_LABELS.contains(label))
            throw new StructuralException("'" + label + "' is a CLIF keyword and cannot be a predicate label");
        if (kind == null)
            throw new StructuralException("Predicate kind must not be null");
        if (arity < 0)
            throw new StructuralException("Arity must be >= 0, got " + arity);
        if (IDENTITY.equals(label) && (kind != PredicateKind.RELATION || arity != 2))
            throw new StructuralException("Identity '=' is a binary relation, got " + kind + "/" + arity);
        if (kind == PredicateKind.FUNCTION && arity < 1)
            throw new StructuralException("Function '" + label + "' needs at least an output hook");
        if (kind == PredicateKind.CONSTANT && arity > 1)
            throw new StructuralException("Constant '" + label + "' has arity 0 or 1, got " + arity);
    }

    private void fire(EditOperation op, List<Integer> affected) {
        EditListener l = this.listener;
        if (l != null)
            l.onEdit(op, List.copyOf(affected));
    }
}
