package com.peirce.eg.engine;

import com.peirce.eg.api.HookRef;
import com.peirce.eg.model.GraphModel;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

/**
 * Iterate-then-deiterate round trips and the structural matching behind them.
 */
public class DeiterationTest {

    private EgEditor editor;
    private GraphModel model;
    private int sa;

    @Before
    public void setUp() {
        editor = new EgEditor();
        model = editor.model();
        sa = editor.sheetOfAssertion();
    }

    @Test
    public void testRoundTripRestoresLigatures() {
        // P - Q - R(1) on one line; R(2) - S on a line private to the cut
        int p = editor.addPredicate("P", 1, sa);
        int q = editor.addPredicate("Q", 1, sa);
        int c1 = editor.addCut(sa);
        int r = editor.addPredicate("R", 2, c1);
        int s = editor.addPredicate("S", 1, c1);
        int shared = editor.connect(HookRef.of(p, 1), HookRef.of(q, 1), HookRef.of(r, 1));
        int inner = editor.connect(HookRef.of(r, 2), HookRef.of(s, 1));
        int c2 = editor.addCut(sa);
        int ligaturesBefore = model.ligatureCount();

        List<Integer> copies = editor.iterate(List.of(c1), c2);
        assertEquals(4, model.ligature(shared).size());
        assertEquals(ligaturesBefore + 1, model.ligatureCount());

        editor.deiterate(copies);

        assertTrue(model.context(c2).isEmpty());
        assertEquals(3, model.ligature(shared).size());
        assertEquals(2, model.ligature(inner).size());
        assertEquals(ligaturesBefore, model.ligatureCount());
    }

    @Test
    public void testOriginalInEnclosingArea() {
        editor.addPredicate("P", 0, sa);
        int c = editor.addCut(sa);
        int inner = editor.addCut(c);
        int copy = editor.addPredicate("P", 0, inner);

        assertTrue(editor.validator().canDeiterate(List.of(copy)));
    }

    @Test
    public void testEnclosingCutIsNotACandidate() {
        // nothing outside the selection but the cut that holds it
        int c = editor.addCut(sa);
        int p = editor.addPredicate("P", 0, c);

        assertFalse(editor.validator().canDeiterate(List.of(p)));
    }

    @Test
    public void testWiringMustMatch() {
        int loop = editor.addPredicate("A", 2, sa);
        editor.connect(HookRef.of(loop, 1), HookRef.of(loop, 2));
        int c = editor.addCut(sa);
        int open = editor.addPredicate("A", 2, c);

        assertFalse(editor.validator().canDeiterate(List.of(open)));

        editor.connect(HookRef.of(open, 1), HookRef.of(open, 2));
        assertTrue(editor.validator().canDeiterate(List.of(open)));
    }

    @Test
    public void testExternalLineMustBeTheSame() {
        int x = editor.addPredicate("X", 1, sa);
        int y = editor.addPredicate("Y", 1, sa);
        int original = editor.addPredicate("P", 1, sa);
        editor.connect(HookRef.of(x, 1), HookRef.of(original, 1));
        int c = editor.addCut(sa);
        int copy = editor.addPredicate("P", 1, c);
        editor.connect(HookRef.of(y, 1), HookRef.of(copy, 1));

        assertFalse(editor.validator().canDeiterate(List.of(copy)));
    }

    @Test
    public void testSelectionOrderDoesNotMatter() {
        int r1 = editor.addPredicate("R", 2, sa);
        int r2 = editor.addPredicate("R", 2, sa);
        editor.connect(HookRef.of(r1, 1), HookRef.of(r2, 2));
        int c = editor.addCut(sa);

        // copies get ids in selection order, reversed relative to the originals
        List<Integer> copies = editor.iterate(List.of(r2, r1), c);
        editor.deiterate(copies);

        assertTrue(model.context(c).isEmpty());
        assertEquals(1, model.ligatureCount());
    }

    @Test
    public void testCutShapesMustMatch() {
        int c1 = editor.addCut(sa);
        editor.addPredicate("P", 0, c1);
        editor.addPredicate("Q", 0, c1);
        int target = editor.addCut(sa);
        int c2 = editor.addCut(target);
        editor.addPredicate("P", 0, c2);

        assertFalse(editor.validator().canDeiterate(List.of(c2)));

        editor.addPredicate("Q", 0, c2);
        assertTrue(editor.validator().canDeiterate(List.of(c2)));
    }

    @Test
    public void testTwoMemberSelection() {
        int a = editor.addPredicate("A", 1, sa);
        int b = editor.addPredicate("B", 1, sa);
        editor.addPredicate("A", 1, sa);
        editor.connect(HookRef.of(a, 1), HookRef.of(b, 1));
        int c = editor.addCut(sa);
        List<Integer> copies = editor.iterate(List.of(a, b), c);

        assertTrue(editor.validator().canDeiterate(copies));
        assertFalse(editor.validator().canDeiterate(List.of(copies.get(0))));
    }
}
