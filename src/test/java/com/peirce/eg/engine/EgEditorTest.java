package com.peirce.eg.engine;

import com.peirce.eg.api.EditOperation;
import com.peirce.eg.api.EgRule;
import com.peirce.eg.api.HookRef;
import com.peirce.eg.api.PredicateKind;
import com.peirce.eg.api.StructuralException;
import com.peirce.eg.api.ValidationException;
import com.peirce.eg.model.GraphModel;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class EgEditorTest {

    private EgEditor editor;
    private GraphModel model;
    private int sa;

    @Before
    public void setUp() {
        editor = new EgEditor();
        model = editor.model();
        sa = editor.sheetOfAssertion();
    }

    private static HookRef h(int predicate, int index) {
        return HookRef.of(predicate, index);
    }

    // --- Topology ---

    @Test
    public void testDepthAndAncestors() {
        int c1 = editor.addCut(sa);
        int c2 = editor.addCut(c1);

        assertEquals(0, editor.depth(sa));
        assertEquals(2, editor.depth(c2));
        assertTrue(editor.isPositive(c2));
        assertFalse(editor.isPositive(c1));
        assertEquals(List.of(c2, c1, sa), editor.ancestors(c2));
    }

    @Test
    public void testLeastCommonAncestor() {
        int c1 = editor.addCut(sa);
        int c2 = editor.addCut(c1);
        int c3 = editor.addCut(c1);

        assertEquals(c1, editor.lca(List.of(c2, c3)));
        assertEquals(sa, editor.lca(List.of(c2, sa)));
        assertEquals(c2, editor.lca(List.of(c2)));
        assertEquals(sa, editor.lca(List.of()));
    }

    @Test(expected = StructuralException.class)
    public void testAddCutToUnknownParent() {
        editor.addCut(42);
    }

    @Test(expected = StructuralException.class)
    public void testAddCutToPredicate() {
        int p = editor.addPredicate("P", 0, sa);
        editor.addCut(p);
    }

    @Test(expected = StructuralException.class)
    public void testFunctionNeedsOutputHook() {
        editor.addPredicate("f", 0, sa, PredicateKind.FUNCTION);
    }

    @Test(expected = StructuralException.class)
    public void testConstantHasAtMostOneHook() {
        editor.addPredicate("a", 2, sa, PredicateKind.CONSTANT);
    }

    @Test
    public void testLabelsMustBeClifSymbols() {
        String[] bad = { "P Q", "P)", "(P", "P;", "exists", "forall", "and", "or", "not", "if", "iff", "true" };
        for (String label : bad) {
            try {
                editor.addPredicate(label, 1, sa);
                fail("Expected StructuralException for label: " + label);
            } catch (StructuralException expected) {
                assertNotNull(expected.getMessage());
            }
        }
        assertTrue(model.context(sa).isEmpty());
    }

    @Test
    public void testIdentityIsBinaryRelation() {
        int eq = editor.addPredicate("=", 2, sa);
        assertEquals("=", model.predicate(eq).label());

        try {
            editor.addPredicate("=", 3, sa);
            fail("Expected StructuralException");
        } catch (StructuralException expected) {
            assertTrue(expected.getMessage().contains("binary"));
        }
        try {
            editor.addPredicate("=", 1, sa, PredicateKind.CONSTANT);
            fail("Expected StructuralException");
        } catch (StructuralException expected) {
            assertTrue(expected.getMessage().contains("binary"));
        }
        assertEquals(List.of(eq), model.context(sa).children());
    }

    @Test
    public void testAddPredicateStartsUnbound() {
        int p = editor.addPredicate("on", 2, sa);

        assertEquals("on", model.predicate(p).label());
        assertEquals(PredicateKind.RELATION, model.predicate(p).kind());
        assertFalse(model.predicate(p).isBound(1));
        assertFalse(model.predicate(p).isBound(2));
        assertEquals(List.of(p), model.context(sa).children());
    }

    // --- connect / sever ---

    @Test
    public void testConnectCreatesLigature() {
        int p = editor.addPredicate("on", 2, sa);
        int l = editor.connect(h(p, 1), h(p, 2));

        assertEquals(2, model.ligature(l).size());
        assertEquals(l, model.predicate(p).ligatureAt(1));
        assertEquals(l, model.predicate(p).ligatureAt(2));
    }

    @Test
    public void testConnectMergesSmallerIntoLarger() {
        int a = editor.addPredicate("A", 1, sa);
        int b = editor.addPredicate("B", 1, sa);
        int c = editor.addPredicate("C", 1, sa);
        int big = editor.connect(h(a, 1), h(b, 1));
        int small = editor.connect(h(c, 1));

        int merged = editor.connect(h(c, 1), h(a, 1));

        assertEquals(big, merged);
        assertFalse(model.isLigature(small));
        assertEquals(3, model.ligature(big).size());
        assertEquals(big, model.predicate(c).ligatureAt(1));
    }

    @Test
    public void testConnectTieKeepsLowerId() {
        int a = editor.addPredicate("A", 1, sa);
        int b = editor.addPredicate("B", 1, sa);
        int la = editor.connect(h(a, 1));
        int lb = editor.connect(h(b, 1));

        assertEquals(la, editor.connect(h(b, 1), h(a, 1)));
        assertFalse(model.isLigature(lb));
    }

    @Test
    public void testConnectOntoNamedLigature() {
        int a = editor.addPredicate("A", 1, sa);
        int b = editor.addPredicate("B", 1, sa);
        int c = editor.addPredicate("C", 1, sa);
        int big = editor.connect(h(a, 1), h(b, 1));
        int target = editor.addLigature();

        assertEquals(target, editor.connect(target, List.of(h(c, 1), h(a, 1))));
        assertFalse(model.isLigature(big));
        assertEquals(3, model.ligature(target).size());
    }

    @Test(expected = StructuralException.class)
    public void testConnectRejectsMissingHook() {
        int p = editor.addPredicate("P", 1, sa);
        editor.connect(h(p, 2));
    }

    @Test
    public void testTraversedCuts() {
        int c1 = editor.addCut(sa);
        int c2 = editor.addCut(c1);
        int p = editor.addPredicate("P", 1, sa);
        int q = editor.addPredicate("Q", 1, c2);

        int l = editor.connect(h(p, 1), h(q, 1));

        assertEquals(sa, editor.homeContext(l));
        assertEquals(Set.of(c1, c2), model.ligature(l).traversedCuts());
    }

    @Test
    public void testHomeContextOfSiblingCuts() {
        int outer = editor.addCut(sa);
        int c1 = editor.addCut(outer);
        int c2 = editor.addCut(outer);
        int p = editor.addPredicate("P", 1, c1);
        int q = editor.addPredicate("Q", 1, c2);

        int l = editor.connect(h(p, 1), h(q, 1));

        assertEquals(outer, editor.homeContext(l));
        assertEquals(Set.of(c1, c2), model.ligature(l).traversedCuts());
    }

    @Test
    public void testSeverMovesHookToFreshLigature() {
        int p = editor.addPredicate("P", 1, sa);
        int q = editor.addPredicate("Q", 1, sa);
        int l = editor.connect(h(p, 1), h(q, 1));

        int fresh = editor.sever(h(q, 1));

        assertNotEquals(l, fresh);
        assertEquals(1, model.ligature(l).size());
        assertEquals(1, model.ligature(fresh).size());
        assertEquals(fresh, model.predicate(q).ligatureAt(1));
    }

    @Test
    public void testSeverAloneIsNoop() {
        int p = editor.addPredicate("P", 1, sa);
        int l = editor.connect(h(p, 1));

        assertEquals(l, editor.sever(h(p, 1)));
        assertEquals(1, model.ligatureCount());
    }

    @Test
    public void testSeverUnboundHook() {
        int p = editor.addPredicate("P", 1, sa);
        int l = editor.sever(h(p, 1));

        assertEquals(l, model.predicate(p).ligatureAt(1));
        assertEquals(1, model.ligature(l).size());
    }

    @Test
    public void testDiscardDetachedLigatures() {
        editor.addLigature();
        int p = editor.addPredicate("P", 1, sa);
        editor.connect(h(p, 1));

        assertEquals(1, editor.discardDetachedLigatures());
        assertEquals(1, model.ligatureCount());
    }

    // --- Erasure / insertion ---

    @Test
    public void testEraseRejectedInNegativeContext() {
        int c = editor.addCut(sa);
        int p = editor.addPredicate("P", 0, c);
        try {
            editor.erase(List.of(p));
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertEquals(EgRule.ERASURE, e.rule());
        }
        assertTrue(model.isPredicate(p));
    }

    @Test
    public void testEraseCutTakesContentsAndKeepsPartialLigature() {
        int c = editor.addCut(sa);
        int p = editor.addPredicate("P", 1, c);
        int q = editor.addPredicate("Q", 1, sa);
        int l = editor.connect(h(p, 1), h(q, 1));

        editor.erase(List.of(c));

        assertFalse(model.isContext(c));
        assertFalse(model.isPredicate(p));
        assertEquals(1, model.ligature(l).size());
        assertTrue(model.ligature(l).traversedCuts().isEmpty());

        editor.erase(List.of(q));
        assertFalse(model.isLigature(l));
        assertTrue(model.isEmpty());
    }

    @Test(expected = ValidationException.class)
    public void testEraseNothing() {
        editor.erase(List.of());
    }

    @Test(expected = StructuralException.class)
    public void testSheetCannotBeSelected() {
        editor.erase(List.of(sa));
    }

    @Test
    public void testInsertPredicateOnlyInNegativeContext() {
        try {
            editor.insertPredicate("P", 0, sa, PredicateKind.RELATION);
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertEquals(EgRule.INSERTION, e.rule());
        }
        assertTrue(model.context(sa).isEmpty());

        int c = editor.addCut(sa);
        int p = editor.insertPredicate("P", 0, c, PredicateKind.RELATION);
        int inner = editor.insertCut(c);
        assertEquals(List.of(p, inner), model.context(c).children());
    }

    // --- Iteration / de-iteration ---

    @Test
    public void testIterateSharesExternalLigature() {
        int p = editor.addPredicate("P", 1, sa);
        int q = editor.addPredicate("Q", 1, sa);
        int l = editor.connect(h(p, 1), h(q, 1));
        int c = editor.addCut(sa);

        List<Integer> copies = editor.iterate(List.of(p), c);

        assertEquals(1, copies.size());
        int copy = copies.get(0);
        assertEquals(c, model.parentOf(copy));
        assertEquals("P", model.predicate(copy).label());
        assertEquals(l, model.predicate(copy).ligatureAt(1));
        assertEquals(3, model.ligature(l).size());
        assertEquals(Set.of(c), model.ligature(l).traversedCuts());
    }

    @Test
    public void testIterateCopiesPrivateLigature() {
        int p = editor.addPredicate("cat", 1, sa);
        int q = editor.addPredicate("mat", 1, sa);
        int l = editor.connect(h(p, 1), h(q, 1));

        List<Integer> copies = editor.iterate(List.of(p, q), sa);

        int pc = copies.get(0), qc = copies.get(1);
        int copyLine = model.predicate(pc).ligatureAt(1);
        assertNotEquals(l, copyLine);
        assertEquals(copyLine, model.predicate(qc).ligatureAt(1));
        assertEquals(2, model.ligature(l).size());
        assertEquals(2, model.ligature(copyLine).size());
    }

    @Test
    public void testIterateCopiesCutContents() {
        int c = editor.addCut(sa);
        editor.addPredicate("P", 0, c);
        int inner = editor.addCut(c);
        editor.addPredicate("Q", 0, inner);
        int target = editor.addCut(sa);

        int copy = editor.iterate(List.of(c), target).get(0);

        assertTrue(model.isCut(copy));
        assertEquals(2, model.context(copy).children().size());
        int copiedInner = model.context(copy).children().get(1);
        assertEquals("Q", model.predicate(model.context(copiedInner).children().get(0)).label());
        assertEquals(6, model.contextCount());
    }

    @Test
    public void testIterateIntoShallowerContextRejected() {
        int c = editor.addCut(sa);
        int p = editor.addPredicate("P", 0, c);
        try {
            editor.iterate(List.of(p), sa);
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertEquals(EgRule.ITERATION, e.rule());
        }
        assertEquals(1, model.predicateCount());
    }

    @Test(expected = ValidationException.class)
    public void testIterateIntoSelectedCutRejected() {
        int c = editor.addCut(sa);
        editor.addPredicate("P", 0, c);
        editor.iterate(List.of(c), c);
    }

    @Test
    public void testDeiterateRemovesCopy() {
        int p = editor.addPredicate("P", 1, sa);
        int q = editor.addPredicate("Q", 1, sa);
        int l = editor.connect(h(p, 1), h(q, 1));
        int c = editor.addCut(sa);
        List<Integer> copies = editor.iterate(List.of(p), c);

        editor.deiterate(copies);

        assertTrue(model.context(c).isEmpty());
        assertEquals(2, model.ligature(l).size());
        assertTrue(model.ligature(l).traversedCuts().isEmpty());
    }

    @Test
    public void testDeiterateAllowedInNegativeArea() {
        int c = editor.addCut(sa);
        editor.addPredicate("P", 0, c);
        int second = editor.addPredicate("P", 0, c);

        assertFalse(editor.validator().canErase(List.of(second)));
        editor.deiterate(List.of(second));
        assertEquals(1, model.context(c).children().size());
    }

    @Test
    public void testDeiterateWithoutOriginalRejected() {
        editor.addPredicate("P", 1, sa);
        int c = editor.addCut(sa);
        int r = editor.addPredicate("R", 1, c);
        try {
            editor.deiterate(List.of(r));
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertEquals(EgRule.DEITERATION, e.rule());
        }
        assertTrue(model.isPredicate(r));
    }

    // --- Double cut ---

    @Test
    public void testInsertDoubleCutWrapsSelection() {
        int p = editor.addPredicate("P", 0, sa);
        int q = editor.addPredicate("Q", 0, sa);
        int r = editor.addPredicate("R", 0, sa);

        DoubleCut dc = editor.insertDoubleCut(List.of(q), sa);

        assertEquals(List.of(p, dc.outer(), r), model.context(sa).children());
        assertEquals(List.of(dc.inner()), model.context(dc.outer()).children());
        assertEquals(List.of(q), model.context(dc.inner()).children());
        assertEquals(2, editor.depth(dc.inner()));
    }

    @Test
    public void testInsertEmptyDoubleCut() {
        int p = editor.addPredicate("P", 0, sa);
        DoubleCut dc = editor.insertDoubleCut(sa);

        assertEquals(List.of(p, dc.outer()), model.context(sa).children());
        assertTrue(model.context(dc.inner()).isEmpty());
    }

    @Test(expected = StructuralException.class)
    public void testInsertDoubleCutNeedsDirectChildren() {
        int c = editor.addCut(sa);
        int p = editor.addPredicate("P", 0, c);
        editor.insertDoubleCut(List.of(p), sa);
    }

    @Test
    public void testRemoveDoubleCutRestoresMembership() {
        int p = editor.addPredicate("P", 0, sa);
        int q = editor.addPredicate("Q", 0, sa);
        int r = editor.addPredicate("R", 0, sa);
        DoubleCut dc = editor.insertDoubleCut(List.of(q, r), sa);

        editor.removeDoubleCut(dc.outer());

        assertEquals(List.of(p, q, r), model.context(sa).children());
        assertEquals(1, model.contextCount());
    }

    @Test
    public void testRemoveDoubleCutRejectsOwnPredicate() {
        int outer = editor.addCut(sa);
        editor.addCut(outer);
        editor.addPredicate("P", 0, outer);

        assertFalse(editor.validator().canRemoveDoubleCut(outer));
        try {
            editor.removeDoubleCut(outer);
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertEquals(EgRule.DOUBLE_CUT_REMOVAL, e.rule());
        }
        assertEquals(3, model.contextCount());
    }

    @Test(expected = ValidationException.class)
    public void testSheetIsNotADoubleCut() {
        editor.addCut(sa);
        editor.removeDoubleCut(sa);
    }

    // --- Derived rules ---

    @Test
    public void testFunctionalPropertyJoinsOutputs() {
        int f1 = editor.addPredicate("f", 2, sa, PredicateKind.FUNCTION);
        int f2 = editor.addPredicate("f", 2, sa, PredicateKind.FUNCTION);
        int a = editor.addPredicate("P", 1, sa);
        editor.connect(h(a, 1), h(f1, 1), h(f2, 1));

        int line = editor.applyFunctionalPropertyRule(f1, f2);

        assertEquals(line, model.predicate(f1).ligatureAt(2));
        assertEquals(line, model.predicate(f2).ligatureAt(2));
    }

    @Test
    public void testFunctionalPropertyNeedsSameInputs() {
        int f1 = editor.addPredicate("f", 2, sa, PredicateKind.FUNCTION);
        int f2 = editor.addPredicate("f", 2, sa, PredicateKind.FUNCTION);
        editor.connect(h(f1, 1));
        editor.connect(h(f2, 1));
        try {
            editor.applyFunctionalPropertyRule(f1, f2);
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertEquals(EgRule.FUNCTIONAL_PROPERTY, e.rule());
        }
        assertFalse(model.predicate(f1).isBound(2));
    }

    @Test
    public void testConstantIdentity() {
        int a1 = editor.addPredicate("a", 1, sa, PredicateKind.CONSTANT);
        int a2 = editor.addPredicate("a", 1, sa, PredicateKind.CONSTANT);
        int b = editor.addPredicate("b", 1, sa, PredicateKind.CONSTANT);

        int line = editor.applyConstantIdentityRule(a1, a2);
        assertEquals(line, model.predicate(a2).ligatureAt(1));

        try {
            editor.applyConstantIdentityRule(a1, b);
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertEquals(EgRule.CONSTANT_IDENTITY, e.rule());
        }
    }

    @Test
    public void testMoveLigatureBranchKeepsLine() {
        int p = editor.addPredicate("P", 1, sa);
        int q = editor.addPredicate("Q", 1, sa);
        int r = editor.addPredicate("R", 1, sa);
        editor.connect(h(p, 1), h(q, 1));
        int line = editor.connect(h(q, 1), h(r, 1));
        List<EditOperation> seen = new ArrayList<>();
        editor.setListener((op, ids) -> seen.add(op));

        assertEquals(line, editor.moveLigatureBranch(h(r, 1), h(p, 1)));

        assertEquals(Set.of(h(p, 1), h(q, 1), h(r, 1)), model.ligature(line).attachments());
        assertEquals(1, model.ligatureCount());
        assertEquals(List.of(EditOperation.MOVE_BRANCH), seen);
    }

    @Test
    public void testMoveLigatureBranchAcrossCutRejected() {
        int c = editor.addCut(sa);
        int p = editor.addPredicate("P", 1, sa);
        int q = editor.addPredicate("Q", 1, c);
        int line = editor.connect(h(p, 1), h(q, 1));
        try {
            editor.moveLigatureBranch(h(q, 1), h(p, 1));
            fail("Expected ValidationException");
        } catch (ValidationException e) {
            assertEquals(EgRule.LIGATURE_BRANCH_MOVE, e.rule());
        }
        assertEquals(Set.of(c), model.ligature(line).traversedCuts());
    }

    @Test(expected = StructuralException.class)
    public void testMoveLigatureBranchNeedsRealHook() {
        int p = editor.addPredicate("P", 1, sa);
        editor.connect(h(p, 1));
        editor.moveLigatureBranch(h(p, 2), h(p, 1));
    }

    // --- Listener ---

    @Test
    public void testListenerSeesOnlySuccessfulEdits() {
        List<EditOperation> seen = new ArrayList<>();
        List<List<Integer>> affected = new ArrayList<>();
        editor.setListener((op, ids) -> {
            seen.add(op);
            affected.add(ids);
        });

        int c = editor.addCut(sa);
        int p = editor.addPredicate("P", 0, c);
        try {
            editor.erase(List.of(p));
        } catch (ValidationException expected) {
            // rejected edits are not reported
        }
        editor.erase(List.of(c));

        assertEquals(List.of(EditOperation.ADD_CUT, EditOperation.ADD_PREDICATE, EditOperation.ERASE), seen);
        assertEquals(List.of(c), affected.get(0));
        assertTrue(affected.get(2).contains(p));
        assertTrue(affected.get(2).contains(c));
    }
}
