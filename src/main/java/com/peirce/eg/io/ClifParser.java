package com.peirce.eg.io;

import com.peirce.eg.api.ClifSyntaxException;
import com.peirce.eg.api.EgSettings;
import com.peirce.eg.api.HookRef;
import com.peirce.eg.api.PredicateKind;
import com.peirce.eg.engine.EgEditor;
import com.peirce.eg.model.GraphModel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds an existential graph from CLIF text.
 *
 * <p>
 * Every entity is created through {@link EgEditor}. The sentence is checked
 * in full before the first mutation, so a {@link ClifSyntaxException} never
 * leaves a half-built graph behind.
 *
 * <p>
 * Accepted sentences:
 *
 * <pre>
 * (exists (v...) S)   each v gets a fresh line, S is read in the same area
 * (and S...)          every S in the same area; (and) is true
 * (not S)             S inside a new cut
 * (or S...)           (not (and (not S)...))
 * (if A B)            (not (and A (not B)))
 * (iff A B)           (and (if A B) (if B A))
 * (forall (v...) S)   S inside two nested cuts
 * (= t t)             identity; a function form when either side is a list
 * (label t...)        relation
 * atom                0-ary constant; the atom true is the empty conjunction
 * </pre>
 *
 * A term is a declared variable, a constant (any other atom, which becomes a
 * fresh unary constant predicate) or a function application
 * {@code (f t...)}, which becomes a function predicate with its own output
 * line.
 */
public final class ClifParser {
    private static final Logger log = LogManager.getLogger(ClifParser.class);

    private static final Set<String> FORMS = Set.of("exists", "forall", "and", "or", "not", "if", "iff", "=");
    private static final String TRUE = "true";

    private final EgSettings settings;

    public ClifParser() {
        this(EgSettings.defaults());
    }

    public ClifParser(EgSettings settings) {
        this.settings = settings;
    }

    /** Parses one CLIF sentence into a fresh graph. */
    public GraphModel parse(String text) {
        Sexpr sentence = readChecked(text);
        EgEditor editor = new EgEditor(new GraphModel(), settings);
        new Builder(editor).sentence(sentence, editor.sheetOfAssertion(), new HashMap<>());
        editor.discardDetachedLigatures();
        log.debug("Parsed {} predicates, {} contexts, {} ligatures", editor.model().predicateCount(),
                editor.model().contextCount(), editor.model().ligatureCount());
        return editor.model();
    }

    /**
     * Inserts a sentence into an existing negative context of another graph,
     * under the insertion rule.
     *
     * @return ids of the new direct children of {@code contextId}.
     * @throws com.peirce.eg.api.ValidationException if the context is positive.
     */
    public List<Integer> parseInto(EgEditor editor, int contextId, String text) {
        Sexpr sentence = readChecked(text);
        editor.validator().checkInsert(contextId);
        Set<Integer> before = new HashSet<>(editor.model().context(contextId).children());
        new Builder(editor).sentence(sentence, contextId, new HashMap<>());
        editor.discardDetachedLigatures();

        List<Integer> added = new ArrayList<>();
        for (int id : editor.model().context(contextId).children())
            if (!before.contains(id))
                added.add(id);
        return added;
    }

    private static Sexpr readChecked(String text) {
        Sexpr sentence = SexprReader.read(text);
        checkSentence(sentence);
        return sentence;
    }

    private static void checkSentence(Sexpr s) {
        if (s.isAtom()) {
            if (FORMS.contains(s.text()))
                throw new ClifSyntaxException("'" + s.text() + "' is not a sentence on its own", s.position());
            return;
        }
        if (s.size() == 0)
            throw new ClifSyntaxException("Empty sentence '()'", s.position());
        String head = s.head();
        if (head == null)
            throw new ClifSyntaxException("Sentence must start with a symbol, got " + s.get(0), s.position());
        if (TRUE.equals(head))
            throw new ClifSyntaxException("'true' cannot be used as a relation", s.position());
        switch (head) {
            case "exists", "forall" -> {
                arity(s, 2);
                checkVariables(s.get(1), head);
                checkSentence(s.get(2));
            }
            case "and", "or" -> {
                for (int i = 1; i < s.size(); i++)
                    checkSentence(s.get(i));
            }
            case "not" -> {
                arity(s, 1);
                checkSentence(s.get(1));
            }
            case "if", "iff" -> {
                arity(s, 2);
                checkSentence(s.get(1));
                checkSentence(s.get(2));
            }
            case "=" -> {
                arity(s, 2);
                checkTerm(s.get(1));
                checkTerm(s.get(2));
            }
            default -> {
                for (int i = 1; i < s.size(); i++)
                    checkTerm(s.get(i));
            }
        }
    }

    private static void checkTerm(Sexpr t) {
        if (t.isAtom()) {
            if (FORMS.contains(t.text()) || TRUE.equals(t.text()))
                throw new ClifSyntaxException("'" + t.text() + "' cannot be used as a term", t.position());
            return;
        }
        String head = t.head();
        if (head == null)
            throw new ClifSyntaxException("Function term must start with a function name", t.position());
        if (FORMS.contains(head) || TRUE.equals(head))
            throw new ClifSyntaxException("'" + head + "' form cannot be used as a term", t.position());
        for (int i = 1; i < t.size(); i++)
            checkTerm(t.get(i));
    }

    private static void checkVariables(Sexpr vars, String form) {
        if (!vars.isList())
            throw new ClifSyntaxException("'" + form + "' expects a variable list, got '" + vars + "'",
                    vars.position());
        for (Sexpr v : vars.items()) {
            if (!v.isAtom())
                throw new ClifSyntaxException("Variable must be a symbol, got " + v, v.position());
            if (FORMS.contains(v.text()) || TRUE.equals(v.text()))
                throw new ClifSyntaxException("'" + v.text() + "' cannot be a variable name", v.position());
        }
    }

    private static void arity(Sexpr s, int expected) {
        int actual = s.size() - 1;
        if (actual != expected)
            throw new ClifSyntaxException("'" + s.head() + "' expects " + expected + " argument"
                    + (expected == 1 ? "" : "s") + ", got " + actual, s.position());
    }

    /** Walks a checked sentence, creating entities through the editor. */
    private static final class Builder {
        private final EgEditor editor;

        Builder(EgEditor editor) {
            this.editor = editor;
        }

        void sentence(Sexpr s, int context, Map<String, Integer> scope) {
            if (s.isAtom()) {
                if (!TRUE.equals(s.text()))
                    editor.addPredicate(s.text(), 0, context, PredicateKind.CONSTANT);
                return;
            }
            switch (s.head()) {
                case "exists" -> sentence(s.get(2), context, declare(s.get(1), scope));
                case "forall" -> {
                    int outer = editor.addCut(context);
                    int inner = editor.addCut(outer);
                    sentence(s.get(2), inner, declare(s.get(1), scope));
                }
                case "and" -> {
                    for (int i = 1; i < s.size(); i++)
                        sentence(s.get(i), context, scope);
                }
                case "or" -> {
                    int cut = editor.addCut(context);
                    for (int i = 1; i < s.size(); i++)
                        sentence(s.get(i), editor.addCut(cut), scope);
                }
                case "not" -> sentence(s.get(1), editor.addCut(context), scope);
                case "if" -> conditional(s.get(1), s.get(2), context, scope);
                case "iff" -> {
                    conditional(s.get(1), s.get(2), context, scope);
                    conditional(s.get(2), s.get(1), context, scope);
                }
                case "=" -> identity(s.get(1), s.get(2), context, scope);
                default -> relation(s, context, scope);
            }
        }

        private void conditional(Sexpr antecedent, Sexpr consequent, int context, Map<String, Integer> scope) {
            int outer = editor.addCut(context);
            sentence(antecedent, outer, scope);
            sentence(consequent, editor.addCut(outer), scope);
        }

        private Map<String, Integer> declare(Sexpr vars, Map<String, Integer> scope) {
            Map<String, Integer> inner = new HashMap<>(scope);
            for (Sexpr v : vars.items())
                inner.put(v.text(), editor.addLigature());
            return inner;
        }

        private void relation(Sexpr s, int context, Map<String, Integer> scope) {
            int arity = s.size() - 1;
            int p = editor.addPredicate(s.head(), arity, context, PredicateKind.RELATION);
            for (int i = 1; i <= arity; i++)
                editor.connect(term(s.get(i), context, scope), List.of(HookRef.of(p, i)));
        }

        private void identity(Sexpr left, Sexpr right, int context, Map<String, Integer> scope) {
            if (right.isList()) {
                application(right, term(left, context, scope), context, scope);
            } else if (left.isList()) {
                application(left, term(right, context, scope), context, scope);
            } else {
                int p = editor.addPredicate("=", 2, context, PredicateKind.RELATION);
                editor.connect(term(left, context, scope), List.of(HookRef.of(p, 1)));
                editor.connect(term(right, context, scope), List.of(HookRef.of(p, 2)));
            }
        }

        /** Ligature standing for a term, creating whatever the term needs. */
        private int term(Sexpr t, int context, Map<String, Integer> scope) {
            if (t.isList())
                return application(t, -1, context, scope);
            Integer bound = scope.get(t.text());
            if (bound != null)
                return bound;
            int c = editor.addPredicate(t.text(), 1, context, PredicateKind.CONSTANT);
            return editor.connect(HookRef.of(c, 1));
        }

        /**
         * Adds a function predicate for {@code (f t...)}. Its output joins
         * {@code outputLine}, or a fresh line when that is -1.
         */
        private int application(Sexpr t, int outputLine, int context, Map<String, Integer> scope) {
            int inputs = t.size() - 1;
            int f = editor.addPredicate(t.head(), inputs + 1, context, PredicateKind.FUNCTION);
            for (int i = 1; i <= inputs; i++)
                editor.connect(term(t.get(i), context, scope), List.of(HookRef.of(f, i)));
            HookRef output = HookRef.of(f, inputs + 1);
            return outputLine == -1 ? editor.connect(output) : editor.connect(outputLine, List.of(output));
        }
    }
}
