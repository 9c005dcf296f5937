package com.peirce.eg.io;

import java.util.Collections;
import java.util.List;

/**
 * Node of a parsed S-expression: either an atom or a parenthesised list.
 * Every node remembers the character offset it started at.
 */
public final class Sexpr {
    private final String atom;
    private final List<Sexpr> items;
    private final int position;

    private Sexpr(String atom, List<Sexpr> items, int position) {
        this.atom = atom;
        this.items = items;
        this.position = position;
    }

    public static Sexpr atom(String text, int position) {
        return new Sexpr(text, null, position);
    }

    public static Sexpr list(List<Sexpr> items, int position) {
        return new Sexpr(null, Collections.unmodifiableList(items), position);
    }

    public boolean isAtom() {
        return atom != null;
    }

    public boolean isList() {
        return items != null;
    }

    /** Atom text; null for a list. */
    public String text() {
        return atom;
    }

    /** List items; empty for an atom. */
    public List<Sexpr> items() {
        return items != null ? items : List.of();
    }

    public int size() {
        return items().size();
    }

    public Sexpr get(int index) {
        return items().get(index);
    }

    /** Head symbol of a list whose first item is an atom, else null. */
    public String head() {
        if (items == null || items.isEmpty() || !items.get(0).isAtom())
            return null;
        return items.get(0).text();
    }

    public int position() {
        return position;
    }

    @Override
    public String toString() {
        if (isAtom())
            return atom;
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < items.size(); i++) {
            if (i > 0)
                sb.append(' ');
            sb.append(items.get(i));
        }
        return sb.append(')').toString();
    }
}
