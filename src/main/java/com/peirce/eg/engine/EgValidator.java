package com.peirce.eg.engine;

import com.peirce.eg.api.EgRule;
import com.peirce.eg.api.EgSettings;
import com.peirce.eg.api.HookRef;
import com.peirce.eg.api.PredicateKind;
import com.peirce.eg.api.ValidationException;
import com.peirce.eg.model.Context;
import com.peirce.eg.model.GraphModel;
import com.peirce.eg.model.Predicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Preconditions of the transformation rules.
 *
 * <p>
 * Pure queries: nothing here mutates the model. Each rule has three forms:
 * {@code whyNotX} returns a human readable reason the rule does not apply (or
 * null when it does), {@code canX} tests it, and {@code checkX} throws a
 * {@link ValidationException} naming the rule. The editor calls the
 * {@code check} forms before every rule-governed mutation.
 */
public final class EgValidator {
    private static final Logger log = LogManager.getLogger(EgValidator.class);

    private final EgEditor editor;
    private final GraphModel model;
    private final EgSettings settings;

    EgValidator(EgEditor editor, EgSettings settings) {
        this.editor = editor;
        this.model = editor.model();
        this.settings = settings;
    }

    public String whyNotInsert(int contextId) {
        if (editor.isPositive(contextId))
            return "context " + contextId + " is positive (depth " + editor.depth(contextId) + ")";
        return null;
    }

    public boolean canInsert(int contextId) {
        return whyNotInsert(contextId) == null;
    }

    public void checkInsert(int contextId) {
        reject(EgRule.INSERTION, whyNotInsert(contextId));
    }

    public String whyNotErase(Selection sel) {
        if (sel.isEmpty())
            return "nothing selected";
        if (!editor.isPositive(sel.root()))
            return "selection root " + sel.root() + " is negative (depth " + editor.depth(sel.root()) + ")";
        return null;
    }

    public boolean canErase(Collection<Integer> ids) {
        return whyNotErase(editor.selection(ids)) == null;
    }

    public void checkErase(Selection sel) {
        reject(EgRule.ERASURE, whyNotErase(sel));
    }

    public String whyNotIterate(Selection sel, int targetContext) {
        if (sel.isEmpty())
            return "nothing selected";
        for (int c : editor.ancestors(targetContext))
            if (sel.cuts().contains(c))
                return "target " + targetContext + " lies inside selected cut " + c;
        int rootDepth = editor.depth(sel.root());
        int targetDepth = editor.depth(targetContext);
        if (targetDepth < rootDepth)
            return "target " + targetContext + " (depth " + targetDepth + ") is shallower than selection root "
                    + sel.root() + " (depth " + rootDepth + ")";
        return null;
    }

    public boolean canIterate(Collection<Integer> ids, int targetContext) {
        return whyNotIterate(editor.selection(ids), targetContext) == null;
    }

    public void checkIterate(Selection sel, int targetContext) {
        reject(EgRule.ITERATION, whyNotIterate(sel, targetContext));
    }

    /**
     * The selection must be a copy of elements found in its own area or in an
     * enclosing one. Areas are searched from the selection's root outwards to
     * the sheet; within an area every combination of direct members with the
     * same top-level shapes as the selection is tried.
     */
    public String whyNotDeiterate(Selection sel) {
        if (sel.isEmpty())
            return "nothing selected";
        for (int id : sel.topLevel())
            if (model.parentOf(id) != sel.root())
                return "selected elements must share one parent context";

        StructuralSignature target = StructuralSignature.of(model, sel.topLevel());
        Map<String, Integer> wanted = shapeCounts(sel.topLevel());
        int[] budget = { settings.getMaxDeiterationCandidates() };

        for (int area : editor.ancestors(sel.root())) {
            Map<String, List<Integer>> pools = new LinkedHashMap<>();
            for (String shape : wanted.keySet())
                pools.put(shape, new ArrayList<>());
            for (int child : model.context(area).children()) {
                if (sel.contains(child))
                    continue;
                if (model.isCut(child) && editor.isEnclosedBy(sel.root(), child))
                    continue;
                List<Integer> pool = pools.get(StructuralSignature.elementKey(model, child));
                if (pool != null)
                    pool.add(child);
            }
            int found = search(new ArrayList<>(wanted.entrySet()), 0, pools, new ArrayList<>(), target, budget);
            if (found > 0) {
                log.debug("Selection {} is a copy of an original in context {}", sel, area);
                return null;
            }
            if (found < 0) {
                log.warn("De-iteration search for {} gave up after {} candidates", sel,
                        settings.getMaxDeiterationCandidates());
                return "no original found within the candidate limit of " + settings.getMaxDeiterationCandidates();
            }
        }
        return "no isomorphic original in context " + sel.root() + " or any enclosing context";
    }

    public boolean canDeiterate(Collection<Integer> ids) {
        return whyNotDeiterate(editor.selection(ids)) == null;
    }

    public void checkDeiterate(Selection sel) {
        reject(EgRule.DEITERATION, whyNotDeiterate(sel));
    }

    private Map<String, Integer> shapeCounts(List<Integer> topLevel) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int id : topLevel)
            counts.merge(StructuralSignature.elementKey(model, id), 1, Integer::sum);
        return counts;
    }

    /**
     * Picks, shape by shape, combinations of the required size from each
     * pool and compares the completed candidate against the target.
     *
     * @return 1 on a match, 0 when exhausted, -1 when the budget ran out.
     */
    private int search(List<Map.Entry<String, Integer>> shapes, int shapeIndex, Map<String, List<Integer>> pools,
            List<Integer> picked, StructuralSignature target, int[] budget) {
        if (shapeIndex == shapes.size()) {
            if (--budget[0] < 0)
                return -1;
            return StructuralSignature.of(model, picked).equals(target) ? 1 : 0;
        }
        Map.Entry<String, Integer> shape = shapes.get(shapeIndex);
        return choose(pools.get(shape.getKey()), 0, shape.getValue(), shapes, shapeIndex, pools, picked, target,
                budget);
    }

    private int choose(List<Integer> pool, int from, int remaining, List<Map.Entry<String, Integer>> shapes,
            int shapeIndex, Map<String, List<Integer>> pools, List<Integer> picked, StructuralSignature target,
            int[] budget) {
        if (remaining == 0)
            return search(shapes, shapeIndex + 1, pools, picked, target, budget);
        for (int i = from; i <= pool.size() - remaining; i++) {
            picked.add(pool.get(i));
            int r = choose(pool, i + 1, remaining - 1, shapes, shapeIndex, pools, picked, target, budget);
            picked.remove(picked.size() - 1);
            if (r != 0)
                return r;
        }
        return 0;
    }

    public String whyNotRemoveDoubleCut(int outerCut) {
        if (!model.isCut(outerCut))
            return outerCut + " is not a cut";
        if (editor.isPositive(outerCut))
            return "outer cut " + outerCut + " is positive (depth " + editor.depth(outerCut) + ")";
        Context outer = model.context(outerCut);
        for (int child : outer.children())
            if (model.isPredicate(child))
                return "outer cut " + outerCut + " owns predicate " + child;
        if (outer.children().size() != 1)
            return "outer cut " + outerCut + " has " + outer.children().size() + " children, expected exactly one";
        return null;
    }

    public boolean canRemoveDoubleCut(int outerCut) {
        return whyNotRemoveDoubleCut(outerCut) == null;
    }

    public void checkRemoveDoubleCut(int outerCut) {
        reject(EgRule.DOUBLE_CUT_REMOVAL, whyNotRemoveDoubleCut(outerCut));
    }

    public String whyNotFunctionalProperty(int p1, int p2) {
        if (p1 == p2)
            return "the two applications must be distinct predicates";
        Predicate a = model.predicate(p1), b = model.predicate(p2);
        if (a.kind() != PredicateKind.FUNCTION || b.kind() != PredicateKind.FUNCTION)
            return "both predicates must be functions";
        if (!a.label().equals(b.label()) || a.arity() != b.arity())
            return "'" + a.label() + "'/" + a.arity() + " and '" + b.label() + "'/" + b.arity()
                    + " are different functions";
        for (int i = 1; i < a.outputHook(); i++) {
            if (!a.isBound(i) || a.ligatureAt(i) != b.ligatureAt(i))
                return "input " + i + " of " + p1 + " and " + p2 + " is not on the same line";
        }
        return null;
    }

    public boolean canApplyFunctionalPropertyRule(int p1, int p2) {
        return whyNotFunctionalProperty(p1, p2) == null;
    }

    public void checkFunctionalProperty(int p1, int p2) {
        reject(EgRule.FUNCTIONAL_PROPERTY, whyNotFunctionalProperty(p1, p2));
    }

    public String whyNotConstantIdentity(int p1, int p2) {
        if (p1 == p2)
            return "the two constants must be distinct predicates";
        Predicate a = model.predicate(p1), b = model.predicate(p2);
        if (a.kind() != PredicateKind.CONSTANT || b.kind() != PredicateKind.CONSTANT)
            return "both predicates must be constants";
        if (a.arity() != 1 || b.arity() != 1)
            return "constants without a hook cannot be joined";
        if (!a.label().equals(b.label()))
            return "'" + a.label() + "' and '" + b.label() + "' are different constants";
        return null;
    }

    public boolean canApplyConstantIdentityRule(int p1, int p2) {
        return whyNotConstantIdentity(p1, p2) == null;
    }

    public void checkConstantIdentity(int p1, int p2) {
        reject(EgRule.CONSTANT_IDENTITY, whyNotConstantIdentity(p1, p2));
    }

    /**
     * A branch may slide along its own line: both hooks must be bound to the
     * same ligature and their predicates must share a context.
     */
    public String whyNotMoveLigatureBranch(HookRef branch, HookRef anchor) {
        String missing = missingHook(branch);
        if (missing == null)
            missing = missingHook(anchor);
        if (missing != null)
            return missing;
        if (branch.equals(anchor))
            return "branch and anchor are the same hook " + branch;
        int line = model.predicate(branch.predicateId()).ligatureAt(branch.index());
        int anchorLine = model.predicate(anchor.predicateId()).ligatureAt(anchor.index());
        if (line == Predicate.UNBOUND || anchorLine == Predicate.UNBOUND)
            return "both hooks must be bound to a ligature";
        if (line != anchorLine)
            return branch + " is on ligature " + line + " but " + anchor + " is on ligature " + anchorLine;
        int ctx = model.parentOf(branch.predicateId()), anchorCtx = model.parentOf(anchor.predicateId());
        if (ctx != anchorCtx)
            return branch + " lies in context " + ctx + " but " + anchor + " lies in context " + anchorCtx;
        return null;
    }

    public boolean canMoveLigatureBranch(HookRef branch, HookRef anchor) {
        return whyNotMoveLigatureBranch(branch, anchor) == null;
    }

    public void checkMoveLigatureBranch(HookRef branch, HookRef anchor) {
        reject(EgRule.LIGATURE_BRANCH_MOVE, whyNotMoveLigatureBranch(branch, anchor));
    }

    private String missingHook(HookRef h) {
        if (h == null)
            return "no hook given";
        if (!model.isPredicate(h.predicateId()) || !model.predicate(h.predicateId()).hasHook(h.index()))
            return "no hook " + h;
        return null;
    }

    /**
     * A unary constant attached to no line names an individual and says
     * nothing else.
     */
    public String whyNotEraseIsolatedConstant(int predicateId) {
        if (!model.isPredicate(predicateId))
            return predicateId + " is not a predicate";
        Predicate p = model.predicate(predicateId);
        if (p.kind() != PredicateKind.CONSTANT)
            return "'" + p.label() + "' is a " + p.kind() + ", not a constant";
        if (p.arity() == 0)
            return "'" + p.label() + "' has no hook and stands as an atomic sentence";
        for (int i = 1; i <= p.arity(); i++)
            if (p.isBound(i))
                return "constant '" + p.label() + "' is attached to ligature " + p.ligatureAt(i);
        return null;
    }

    public boolean canEraseIsolatedConstant(int predicateId) {
        return whyNotEraseIsolatedConstant(predicateId) == null;
    }

    public void checkEraseIsolatedConstant(int predicateId) {
        reject(EgRule.ISOLATED_CONSTANT_ERASURE, whyNotEraseIsolatedConstant(predicateId));
    }

    private static void reject(EgRule rule, String reason) {
        if (reason == null)
            return;
        log.debug("Rejected {}: {}", rule.displayName(), reason);
        throw new ValidationException(rule, reason);
    }
}
