package com.peirce.eg.io;

import com.peirce.eg.api.EgSettings;
import com.peirce.eg.api.HookRef;
import com.peirce.eg.api.PredicateKind;
import com.peirce.eg.model.GraphModel;
import com.peirce.eg.model.Predicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a graph as canonical CLIF.
 *
 * <p>
 * Output is deterministic and stable under a parse/translate round trip:
 * clauses are sorted as text, and variable names follow an explicit sort key
 * rather than entity ids. Each line of identity is named once:
 * <ul>
 * <li>a line carrying a constant is named by the constant (the smallest label
 * when several are attached),</li>
 * <li>every other line, including the implicit line of an unbound hook, is a
 * variable {@code x1, x2, ...} quantified by {@code exists} in its home
 * context.</li>
 * </ul>
 * Variables are ordered by the sorted {@code (-depth, label, hook)} tuples of
 * their attachments. Lines with equal keys are ordered by where their name
 * first appears in the rendered text, repeated until the naming settles.
 *
 * <p>
 * Instances keep per-call caches and must not be shared between threads.
 */
public final class ClifTranslator {
    private static final Logger log = LogManager.getLogger(ClifTranslator.class);

    public static final String TRUE = "true";

    private final EgSettings settings;

    private final Map<Integer, Integer> depthCache = new HashMap<>();
    private final Map<Line, Integer> scopeCache = new HashMap<>();

    private GraphModel model;
    private Map<HookRef, Line> lineOfHook;

    public ClifTranslator() {
        this(EgSettings.defaults());
    }

    public ClifTranslator(EgSettings settings) {
        this.settings = settings;
    }

    public String translate(GraphModel graph) {
        this.model = graph;
        depthCache.clear();
        scopeCache.clear();
        try {
            return translateGraph();
        } finally {
            lineOfHook = null;
            this.model = null;
        }
    }

    private String translateGraph() {
        List<Line> lines = collectLines();
        Set<String> labels = new HashSet<>();
        for (Predicate p : model.predicates())
            labels.add(p.label());

        List<Line> variables = new ArrayList<>();
        for (Line line : lines) {
            line.constant = constantName(line);
            if (line.constant == null) {
                line.key = sortKey(line);
                variables.add(line);
            }
        }

        // Initial tie-break: ligature id, which for parsed text is declaration order
        variables.sort(Comparator.comparing((Line l) -> l.key, ClifTranslator::compareKeys)
                .thenComparingInt(l -> l.tieBreak));

        String text = null;
        for (int round = 0; round < settings.getMaxCanonicalRounds(); round++) {
            assignNames(variables, labels);
            text = render();

            Map<String, Integer> firstUse = firstTokenPositions(text);
            List<Line> reordered = new ArrayList<>(variables);
            reordered.sort(Comparator.comparing((Line l) -> l.key, ClifTranslator::compareKeys)
                    .thenComparingInt(l -> firstUse.getOrDefault(l.name, Integer.MAX_VALUE)));
            if (reordered.equals(variables))
                return text;
            variables = reordered;
        }
        log.warn("Variable naming did not settle after {} rounds", settings.getMaxCanonicalRounds());
        return text;
    }

    /** A ligature, or the implicit line of one unbound hook. */
    private static final class Line {
        final List<HookRef> attachments;
        final int tieBreak;
        String constant;
        List<AttachmentKey> key;
        String name;
        int index;

        Line(List<HookRef> attachments, int tieBreak) {
            this.attachments = attachments;
            this.tieBreak = tieBreak;
        }
    }

    private record AttachmentKey(int negDepth, String label, int hook) implements Comparable<AttachmentKey> {
        @Override
        public int compareTo(AttachmentKey o) {
            int c = Integer.compare(negDepth, o.negDepth);
            if (c != 0)
                return c;
            c = label.compareTo(o.label);
            return c != 0 ? c : Integer.compare(hook, o.hook);
        }
    }

    private List<Line> collectLines() {
        lineOfHook = new HashMap<>();
        Map<Integer, Line> byLigature = new HashMap<>();

        int nextVirtual = model.ids().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
        List<Line> lines = new ArrayList<>();
        for (int p : documentOrder()) {
            Predicate pred = model.predicate(p);
            for (int i = 1; i <= pred.arity(); i++) {
                HookRef hook = pred.hook(i);
                Line line;
                if (pred.isBound(i)) {
                    int lig = pred.ligatureAt(i);
                    line = byLigature.get(lig);
                    if (line == null) {
                        List<HookRef> attached = new ArrayList<>(model.ligature(lig).attachments());
                        Collections.sort(attached);
                        line = new Line(attached, lig);
                        byLigature.put(lig, line);
                        lines.add(line);
                    }
                } else if (pred.kind() != PredicateKind.CONSTANT) {
                    line = new Line(List.of(hook), nextVirtual++);
                    lines.add(line);
                } else {
                    continue;
                }
                lineOfHook.put(hook, line);
            }
        }
        return lines;
    }

    /** Predicate ids in depth-first, child-order traversal. */
    private List<Integer> documentOrder() {
        List<Integer> order = new ArrayList<>();
        walk(model.sheetOfAssertion(), order);
        return order;
    }

    private void walk(int context, List<Integer> order) {
        for (int child : model.context(context).children()) {
            if (model.isPredicate(child))
                order.add(child);
            else
                walk(child, order);
        }
    }

    private String constantName(Line line) {
        String name = null;
        for (HookRef h : line.attachments) {
            Predicate p = model.predicate(h.predicateId());
            if (p.kind() == PredicateKind.CONSTANT && (name == null || p.label().compareTo(name) < 0))
                name = p.label();
        }
        return name;
    }

    private List<AttachmentKey> sortKey(Line line) {
        List<AttachmentKey> key = new ArrayList<>(line.attachments.size());
        for (HookRef h : line.attachments) {
            Predicate p = model.predicate(h.predicateId());
            key.add(new AttachmentKey(-depth(model.parentOf(p.id())), p.label(), h.index()));
        }
        Collections.sort(key);
        return key;
    }

    private static int compareKeys(List<AttachmentKey> a, List<AttachmentKey> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0)
                return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    private void assignNames(List<Line> variables, Set<String> labels) {
        int counter = 0;
        for (Line line : variables) {
            String name;
            do {
                counter++;
                name = settings.getVariablePrefix() + counter;
            } while (labels.contains(name));
            line.name = name;
            line.index = counter;
        }
    }

    private static Map<String, Integer> firstTokenPositions(String text) {
        Map<String, Integer> first = new HashMap<>();
        int i = 0, n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '(' || c == ')' || Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            while (i < n && text.charAt(i) != '(' && text.charAt(i) != ')' && !Character.isWhitespace(text.charAt(i)))
                i++;
            first.putIfAbsent(text.substring(start, i), start);
        }
        return first;
    }

    private String nameOf(HookRef hook) {
        Line line = lineOfHook.get(hook);
        return line.constant != null ? line.constant : line.name;
    }

    private int depth(int context) {
        Integer cached = depthCache.get(context);
        if (cached != null)
            return cached;
        int parent = model.parentOf(context);
        int d = parent == -1 ? 0 : depth(parent) + 1;
        depthCache.put(context, d);
        return d;
    }

    private int home(Line line) {
        Integer cached = scopeCache.get(line);
        if (cached != null)
            return cached;
        int home = -1;
        for (HookRef h : line.attachments) {
            int ctx = model.parentOf(h.predicateId());
            home = home == -1 ? ctx : lca(home, ctx);
        }
        if (home == -1)
            home = model.sheetOfAssertion();
        scopeCache.put(line, home);
        return home;
    }

    private int lca(int a, int b) {
        while (depth(a) > depth(b))
            a = model.parentOf(a);
        while (depth(b) > depth(a))
            b = model.parentOf(b);
        while (a != b) {
            a = model.parentOf(a);
            b = model.parentOf(b);
        }
        return a;
    }

    private String render() {
        Map<Integer, List<Line>> quantified = new HashMap<>();
        for (Line line : new HashSet<>(lineOfHook.values()))
            if (line.constant == null)
                quantified.computeIfAbsent(home(line), k -> new ArrayList<>()).add(line);
        String body = renderContext(model.sheetOfAssertion(), quantified);
        return body == null ? TRUE : body;
    }

    /** CLIF for one area, or null when it asserts nothing. */
    private String renderContext(int context, Map<Integer, List<Line>> quantified) {
        List<String> clauses = new ArrayList<>();
        for (int child : model.context(context).children()) {
            if (model.isPredicate(child)) {
                String clause = predicateClause(model.predicate(child));
                if (clause != null)
                    clauses.add(clause);
            } else {
                String inner = renderContext(child, quantified);
                if (inner != null)
                    clauses.add("(not " + inner + ")");
            }
        }
        if (clauses.isEmpty())
            return null;
        Collections.sort(clauses);
        String body = clauses.size() == 1 ? clauses.get(0) : "(and " + String.join(" ", clauses) + ")";

        List<Line> vars = quantified.get(context);
        if (vars == null || vars.isEmpty())
            return body;
        List<Line> ordered = new ArrayList<>(vars);
        ordered.sort(Comparator.comparingInt(l -> l.index));
        StringBuilder sb = new StringBuilder("(exists (");
        for (int i = 0; i < ordered.size(); i++) {
            if (i > 0)
                sb.append(' ');
            sb.append(ordered.get(i).name);
        }
        return sb.append(") ").append(body).append(')').toString();
    }

    private String predicateClause(Predicate p) {
        return switch (p.kind()) {
            case CONSTANT -> constantClause(p);
            case FUNCTION -> {
                StringBuilder sb = new StringBuilder("(= ").append(nameOf(p.hook(p.outputHook()))).append(" (")
                        .append(p.label());
                for (int i = 1; i < p.outputHook(); i++)
                    sb.append(' ').append(nameOf(p.hook(i)));
                yield sb.append("))").toString();
            }
            case RELATION -> {
                StringBuilder sb = new StringBuilder("(").append(p.label());
                for (int i = 1; i <= p.arity(); i++)
                    sb.append(' ').append(nameOf(p.hook(i)));
                yield sb.append(')').toString();
            }
        };
    }

    /**
     * A constant says something on its own only when no other predicate uses
     * it as a term. A second, differently named constant on the same line
     * asserts an identity.
     */
    private String constantClause(Predicate p) {
        if (p.arity() == 0 || !p.isBound(1))
            return p.label();
        Line line = lineOfHook.get(p.hook(1));
        if (!p.label().equals(line.constant))
            return "(= " + line.constant + " " + p.label() + ")";
        for (HookRef h : line.attachments) {
            Predicate other = model.predicate(h.predicateId());
            if (other.kind() != PredicateKind.CONSTANT || !other.label().equals(line.constant))
                return null;
            if (other.id() < p.id())
                return null;
        }
        return p.label();
    }
}
