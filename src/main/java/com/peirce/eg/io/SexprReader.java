package com.peirce.eg.io;

import com.peirce.eg.api.ClifSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent reader for CLIF S-expressions.
 *
 * <p>
 * Parentheses are standalone tokens; any other run of characters up to
 * whitespace, a parenthesis or {@code ;} is an atom. A {@code ;} starts a
 * comment that runs to the end of the line.
 */
public final class SexprReader {
    private final String input;
    private int pos;

    private SexprReader(String input) {
        this.input = input;
    }

    /**
     * Reads exactly one expression.
     *
     * @throws ClifSyntaxException on blank input, unbalanced parentheses or
     *                             trailing text.
     */
    public static Sexpr read(String text) {
        if (text == null)
            throw new ClifSyntaxException("No input", 0);
        SexprReader reader = new SexprReader(text);
        reader.skipBlank();
        if (reader.atEnd())
            throw new ClifSyntaxException("Empty input", 0);
        Sexpr expr = reader.parseExpr();
        reader.skipBlank();
        if (!reader.atEnd())
            throw new ClifSyntaxException("Unexpected text after expression: '" + reader.peekToken() + "'", reader.pos);
        return expr;
    }

    private Sexpr parseExpr() {
        skipBlank();
        if (atEnd())
            throw new ClifSyntaxException("Unexpected end of input", pos);
        char c = input.charAt(pos);
        if (c == ')')
            throw new ClifSyntaxException("Unbalanced ')'", pos);
        if (c == '(')
            return parseList();
        return parseAtom();
    }

    private Sexpr parseList() {
        int start = pos++;
        List<Sexpr> items = new ArrayList<>();
        while (true) {
            skipBlank();
            if (atEnd())
                throw new ClifSyntaxException("Unbalanced '(': missing ')'", start);
            if (input.charAt(pos) == ')') {
                pos++;
                return Sexpr.list(items, start);
            }
            items.add(parseExpr());
        }
    }

    private Sexpr parseAtom() {
        int start = pos;
        while (!atEnd() && !isDelimiter(input.charAt(pos)))
            pos++;
        return Sexpr.atom(input.substring(start, pos), start);
    }

    private void skipBlank() {
        while (!atEnd()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == ';') {
                while (!atEnd() && input.charAt(pos) != '\n')
                    pos++;
            } else {
                return;
            }
        }
    }

    private String peekToken() {
        char c = input.charAt(pos);
        if (c == '(' || c == ')')
            return String.valueOf(c);
        int end = pos;
        while (end < input.length() && !isDelimiter(input.charAt(end)))
            end++;
        return input.substring(pos, end);
    }

    private boolean atEnd() {
        return pos >= input.length();
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == ';';
    }
}
