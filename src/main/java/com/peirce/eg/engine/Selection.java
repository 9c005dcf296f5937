package com.peirce.eg.engine;

import com.peirce.eg.api.StructuralException;
import com.peirce.eg.model.Context;
import com.peirce.eg.model.GraphModel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A resolved subgraph selection.
 *
 * <p>
 * Callers select predicates and cuts by id. Selecting a cut selects everything
 * it encloses. Ligature ids may appear in a raw selection; they carry no
 * structure of their own (lines follow their predicates) and are dropped.
 *
 * <ul>
 * <li><b>top level</b>: selected elements not enclosed by another selected
 * cut, in selection order.</li>
 * <li><b>closure</b>: every predicate and cut inside the selection.</li>
 * <li><b>root context</b>: the least common ancestor of the top-level
 * members' parent contexts, i.e. the shallowest area containing all of
 * them.</li>
 * </ul>
 */
public final class Selection {
    private final List<Integer> topLevel;
    private final Set<Integer> predicates;
    private final Set<Integer> cuts;
    private final int root;

    private Selection(List<Integer> topLevel, Set<Integer> predicates, Set<Integer> cuts, int root) {
        this.topLevel = Collections.unmodifiableList(topLevel);
        this.predicates = Collections.unmodifiableSet(predicates);
        this.cuts = Collections.unmodifiableSet(cuts);
        this.root = root;
    }

    /**
     * Resolves raw ids against the editor's model.
     *
     * @throws StructuralException for unknown ids or the Sheet of Assertion.
     */
    static Selection resolve(EgEditor editor, Collection<Integer> ids) {
        GraphModel model = editor.model();
        Set<Integer> members = new LinkedHashSet<>();
        if (ids != null) {
            for (Integer id : ids) {
                if (id == null)
                    throw new StructuralException("Selection contains a null id");
                if (id == GraphModel.SHEET)
                    throw new StructuralException("The Sheet of Assertion cannot be selected");
                if (model.isLigature(id))
                    continue;
                if (!model.isPredicate(id) && !model.isCut(id))
                    throw new StructuralException("Selection refers to unknown element " + id);
                members.add(id);
            }
        }

        // An element is top level when no enclosing context is itself selected
        List<Integer> top = new ArrayList<>();
        for (int id : members) {
            boolean enclosed = false;
            for (int a = model.parentOf(id); a != -1; a = model.parentOf(a)) {
                if (members.contains(a)) {
                    enclosed = true;
                    break;
                }
            }
            if (!enclosed)
                top.add(id);
        }

        Set<Integer> preds = new TreeSet<>();
        Set<Integer> cuts = new TreeSet<>();
        for (int id : top)
            collect(model, id, preds, cuts);

        int root = -1;
        if (!top.isEmpty()) {
            List<Integer> parents = new ArrayList<>(top.size());
            for (int id : top)
                parents.add(model.parentOf(id));
            root = editor.lca(parents);
        }
        return new Selection(top, preds, cuts, root);
    }

    private static void collect(GraphModel model, int id, Set<Integer> preds, Set<Integer> cuts) {
        if (model.isPredicate(id)) {
            preds.add(id);
            return;
        }
        cuts.add(id);
        Context c = model.context(id);
        for (int child : c.children())
            collect(model, child, preds, cuts);
    }

    public boolean isEmpty() {
        return topLevel.isEmpty();
    }

    public List<Integer> topLevel() {
        return topLevel;
    }

    /** Every predicate inside the selection, ascending ids. */
    public Set<Integer> predicates() {
        return predicates;
    }

    /** Every cut inside the selection, ascending ids. */
    public Set<Integer> cuts() {
        return cuts;
    }

    /** Root context id, or -1 for an empty selection. */
    public int root() {
        return root;
    }

    public boolean contains(int id) {
        return predicates.contains(id) || cuts.contains(id);
    }

    @Override
    public String toString() {
        return "Selection[top=" + topLevel + ", root=" + root + "]";
    }
}
