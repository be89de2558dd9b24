/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.List;

/**
 * Entry points of the regex to automaton pipeline; analog to the static
 * factory methods of {@link java.util.regex.Pattern}.
 * <p>
 * <strong>Expressions</strong> are postfix token sequences over a single
 * character alphabet: a literal pushes a two state automaton,
 * <code>'.'</code> concatenates the top two, <code>'|'</code> alternates
 * them and <code>'*'</code> applies Kleene closure to the top one. As
 * strings, tokens may be separated by blanks: <code>"a b . *"</code> is
 * <code>(ab)*</code>. There are no parentheses, precedence, character
 * classes, anchors or escapes; a front end wanting any of those resolves
 * them into a token list first.
 * <p>
 * <strong>Stages.</strong> {@link #compile(CharSequence)} builds an
 * {@link NFA} by Thompson construction, {@link #determinize(NFA)} turns it
 * into a {@link DFA} by subset construction, and {@link #minimize(DFA)}
 * merges indistinguishable states. Each stage returns a new immutable
 * automaton and keeps no state of its own, so independent pipelines may run
 * on different threads without synchronization.
 * <p>
 * <strong>Errors</strong> are unchecked: {@link MalformedExpressionException}
 * from the compiler, {@link InvalidAutomatonException} when a hand built
 * automaton is structurally unsound. Neither ever yields a partial result.
 */
public final class Automata {

    private Automata() {
    } // never instantiated

    public static NFA compile(CharSequence postfix) {
        return new Compiler().compile(postfix);
    }

    public static NFA compile(List<Token> tokens) {
        return new Compiler().compile(tokens);
    }

    public static DFA determinize(NFA nfa) {
        return new Determinizer().determinize(nfa);
    }

    public static DFA minimize(DFA dfa) {
        return new Minimizer().minimize(dfa);
    }

    /**
     * All three stages in a row.
     *
     * @return the minimal DFA for <code>postfix</code>.
     */
    public static DFA build(CharSequence postfix) {
        return minimize(determinize(compile(postfix)));
    }

    public static DFA build(List<Token> tokens) {
        return minimize(determinize(compile(tokens)));
    }

    /**
     * One-shot convenience, as {@link java.util.regex.Pattern#matches}.
     */
    public static boolean matches(CharSequence postfix, CharSequence input) {
        return build(postfix).accepts(input);
    }

    public static boolean matches(List<Token> tokens, CharSequence input) {
        return build(tokens).accepts(input);
    }
}
