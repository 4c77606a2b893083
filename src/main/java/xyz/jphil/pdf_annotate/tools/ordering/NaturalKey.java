package xyz.jphil.pdf_annotate.tools.ordering;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sort key that orders mixed alphanumeric file stems the way a human expects,
 * so that "item2" sorts before "item10".
 * <p>
 * The stem is split into segments on whitespace, '-', '_' and every other non-word
 * character. Each segment is split into maximal digit runs (integer tokens) and
 * non-digit runs (string tokens). A segment whose last token is a string is closed
 * with a {@link Kind#BOUNDARY} token, and two integer tokens are never adjacent:
 * an empty string token is placed between them.
 * <p>
 * Tokens of different kinds order as BOUNDARY &lt; INTEGER &lt; STRING. Integers compare
 * numerically, strings with {@link String#compareTo}. A key that is a prefix of another
 * sorts first.
 */
public final class NaturalKey implements Comparable<NaturalKey> {

    private static final Pattern SEPARATORS = Pattern.compile("[-_\\W]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern RUNS = Pattern.compile("[0-9]+|[^0-9]+");

    public static final NaturalKey EMPTY = new NaturalKey(List.of());

    public enum Kind { BOUNDARY, INTEGER, STRING }

    public record Token(Kind kind, BigInteger number, String text) implements Comparable<Token> {

        static final Token BOUNDARY = new Token(Kind.BOUNDARY, null, null);
        static final Token SEPARATOR = text("");

        static Token integer(String digits) {
            return new Token(Kind.INTEGER, new BigInteger(digits), null);
        }

        static Token text(String text) {
            return new Token(Kind.STRING, null, text);
        }

        @Override
        public int compareTo(Token other) {
            if (kind != other.kind) {
                return kind.compareTo(other.kind);
            }
            return switch (kind) {
                case BOUNDARY -> 0;
                case INTEGER -> number.compareTo(other.number);
                case STRING -> text.compareTo(other.text);
            };
        }

        @Override
        public String toString() {
            return switch (kind) {
                case BOUNDARY -> "|";
                case INTEGER -> number.toString();
                case STRING -> "'" + text + "'";
            };
        }
    }

    private final List<Token> tokens;

    private NaturalKey(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static NaturalKey of(String stem) {
        if (stem == null || stem.isEmpty()) {
            return EMPTY;
        }
        var tokens = new ArrayList<Token>();
        for (String segment : SEPARATORS.split(stem)) {
            if (segment.isEmpty()) continue;

            Matcher runs = RUNS.matcher(segment);
            while (runs.find()) {
                String run = runs.group();
                char first = run.charAt(0);
                if (first >= '0' && first <= '9') {
                    if (!tokens.isEmpty() && last(tokens).kind() == Kind.INTEGER) {
                        tokens.add(Token.SEPARATOR);
                    }
                    tokens.add(Token.integer(run));
                } else {
                    tokens.add(Token.text(run));
                }
            }
            if (!tokens.isEmpty() && last(tokens).kind() != Kind.INTEGER) {
                tokens.add(Token.BOUNDARY);
            }
        }
        return tokens.isEmpty() ? EMPTY : new NaturalKey(Collections.unmodifiableList(tokens));
    }

    private static Token last(List<Token> tokens) {
        return tokens.get(tokens.size() - 1);
    }

    public List<Token> tokens() {
        return tokens;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    @Override
    public int compareTo(NaturalKey other) {
        int common = Math.min(tokens.size(), other.tokens.size());
        for (int i = 0; i < common; i++) {
            int cmp = tokens.get(i).compareTo(other.tokens.get(i));
            if (cmp != 0) return cmp;
        }
        return Integer.compare(tokens.size(), other.tokens.size());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NaturalKey other && compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Token t : tokens) {
            h = 31 * h + switch (t.kind()) {
                case BOUNDARY -> 0;
                case INTEGER -> t.number().hashCode();
                case STRING -> t.text().hashCode();
            };
        }
        return h;
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}
