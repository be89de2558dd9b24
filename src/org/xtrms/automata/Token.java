/* @LICENSE@
 */
package org.xtrms.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One element of a postfix expression: a literal symbol or one of the three
 * operators. Instances are immutable; the operators are singletons.
 * <p>
 * {@link #parse(CharSequence)} covers the common case of a postfix string
 * such as <code>"a b . c |"</code>. A front end which needs a literal
 * <code>'.'</code>, <code>'|'</code>, <code>'*'</code> or blank builds the
 * list itself with {@link #literal(char)}.
 */
public final class Token {

    public enum Kind {
        LITERAL(0),
        /** Concatenation, binary. */
        CAT(2),
        /** Alternation, binary. */
        ALT(2),
        /** Kleene closure, unary. */
        STAR(1);

        final int arity;

        Kind(int arity) {
            this.arity = arity;
        }

        /**
         * @return the number of fragments the token pops off the construction
         *         stack.
         */
        public int arity() {
            return arity;
        }
    }

    public static final char CAT_CHAR = '.';
    public static final char ALT_CHAR = '|';
    public static final char STAR_CHAR = '*';

    public static final Token CAT = new Token(Kind.CAT, CAT_CHAR);
    public static final Token ALT = new Token(Kind.ALT, ALT_CHAR);
    public static final Token STAR = new Token(Kind.STAR, STAR_CHAR);

    private final Kind kind;
    private final char c;

    private Token(Kind kind, char c) {
        this.kind = kind;
        this.c = c;
    }

    public static Token literal(char c) {
        return new Token(Kind.LITERAL, c);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the literal symbol, or the operator's character.
     */
    public char symbol() {
        return c;
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    /**
     * Splits a postfix string into tokens. Blanks separate tokens and are
     * dropped; <code>'.'</code>, <code>'|'</code> and <code>'*'</code> are
     * operators; every other char is a literal.
     */
    public static List<Token> parse(CharSequence postfix) {
        List<Token> ret = new ArrayList<Token>(postfix.length());
        for (int i = 0; i < postfix.length(); ++i) {
            char c = postfix.charAt(i);
            switch (c) {
            case CAT_CHAR:  ret.add(CAT);   break;
            case ALT_CHAR:  ret.add(ALT);   break;
            case STAR_CHAR: ret.add(STAR);  break;
            default:
                if (!Character.isWhitespace(c)) ret.add(literal(c));
            }
        }
        return Collections.unmodifiableList(ret);
    }

    /**
     * Renders a token list as postfix text, one space between tokens.
     */
    public static String toString(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(token.c);
        }
        return sb.toString();
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Token))
            return false;
        final Token other = (Token) o;
        return kind == other.kind && c == other.c;
    }

    @Override
    public String toString() {
        return isLiteral() ? "'" + c + "'" : kind.name();
    }
}
