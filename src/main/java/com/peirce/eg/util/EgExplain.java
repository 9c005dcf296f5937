package com.peirce.eg.util;

import com.peirce.eg.api.HookRef;
import com.peirce.eg.api.PredicateKind;
import com.peirce.eg.engine.EgEditor;
import com.peirce.eg.model.GraphModel;
import com.peirce.eg.model.Ligature;
import com.peirce.eg.model.Predicate;

/**
 * Diagnostic utility for inspecting a graph.
 *
 * <p>
 * Produces human-readable dumps of the context tree and of single elements.
 * Intended for debugging sessions and error logs; it allocates freely.
 */
public final class EgExplain {
    private final EgEditor editor;
    private final GraphModel model;

    public EgExplain(EgEditor editor) {
        this.editor = editor;
        this.model = editor.model();
    }

    /**
     * Indented tree of every context and predicate, followed by the
     * ligatures. Example:
     *
     * <pre>
     * SA 0 (+)
     *   cut 1 (-)
     *     cat#2 [1:4]
     * ligature 4: 2#1 home=1
     * </pre>
     */
    public String explainTree() {
        StringBuilder sb = new StringBuilder(256);
        appendContext(sb, model.sheetOfAssertion(), 0);
        for (Ligature l : model.ligatures())
            sb.append(describeLigature(l)).append('\n');
        return sb.toString();
    }

    private void appendContext(StringBuilder sb, int contextId, int indent) {
        sb.append("  ".repeat(indent))
                .append(contextId == model.sheetOfAssertion() ? "SA " : "cut ")
                .append(contextId)
                .append(editor.isPositive(contextId) ? " (+)" : " (-)")
                .append('\n');
        for (int child : model.context(contextId).children()) {
            if (model.isPredicate(child))
                sb.append("  ".repeat(indent + 1)).append(describePredicate(model.predicate(child))).append('\n');
            else
                appendContext(sb, child, indent + 1);
        }
    }

    /** Dumps one predicate, cut or ligature. */
    public String explainElement(int id) {
        StringBuilder sb = new StringBuilder(128);
        if (model.isPredicate(id)) {
            Predicate p = model.predicate(id);
            int parent = model.parentOf(id);
            sb.append("Predicate: ").append(p.label()).append('\n')
                    .append("  Id: ").append(id).append('\n')
                    .append("  Kind: ").append(p.kind()).append('\n')
                    .append("  Arity: ").append(p.arity()).append('\n')
                    .append("  Context: ").append(parent).append(" (depth ").append(editor.depth(parent)).append(")\n");
            for (int i = 1; i <= p.arity(); i++) {
                sb.append("  Hook ").append(i).append(": ");
                sb.append(p.isBound(i) ? "ligature " + p.ligatureAt(i) : "unbound");
                if (p.kind() == PredicateKind.FUNCTION && i == p.outputHook())
                    sb.append(" (output)");
                sb.append('\n');
            }
        } else if (model.isContext(id)) {
            int depth = editor.depth(id);
            sb.append(id == model.sheetOfAssertion() ? "Sheet of Assertion" : "Cut").append(": ").append(id).append('\n')
                    .append("  Depth: ").append(depth).append(depth % 2 == 0 ? " (positive)" : " (negative)")
                    .append('\n')
                    .append("  Children: ").append(model.context(id).children()).append('\n');
        } else if (model.isLigature(id)) {
            sb.append(describeLigature(model.ligature(id))).append('\n');
        } else {
            sb.append("Unknown element: ").append(id).append('\n');
        }
        return sb.toString();
    }

    private String describePredicate(Predicate p) {
        StringBuilder sb = new StringBuilder(p.label()).append('#').append(p.id());
        if (p.arity() > 0) {
            sb.append(" [");
            for (int i = 1; i <= p.arity(); i++) {
                if (i > 1)
                    sb.append(", ");
                sb.append(i).append(':').append(p.isBound(i) ? String.valueOf(p.ligatureAt(i)) : "-");
            }
            sb.append(']');
        }
        if (p.kind() != PredicateKind.RELATION)
            sb.append(' ').append(p.kind().name().toLowerCase());
        return sb.toString();
    }

    private String describeLigature(Ligature l) {
        StringBuilder sb = new StringBuilder("ligature ").append(l.id()).append(':');
        for (HookRef h : l.attachments())
            sb.append(' ').append(h);
        sb.append(" home=").append(editor.homeContext(l.id()));
        if (!l.traversedCuts().isEmpty())
            sb.append(" crosses=").append(l.traversedCuts());
        return sb.toString();
    }
}
