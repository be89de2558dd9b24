/* @LICENSE@  
 */
package org.xtrms.automata;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The steps of the pipeline, each usable as a factory for a
 * {@link Recognizer} of a postfix expression. All stages accept the same
 * language; they differ only in the automaton doing the recognizing.
 */
public enum Stage {

    /**
     * The Thompson NFA, run by epsilon-closure simulation.
     */
    COMPILED {
        @Override
        NFA build(List<Token> tokens) {
            return Automata.compile(tokens);
        }
    },

    /**
     * The subset construction DFA.
     */
    DETERMINIZED {
        @Override
        DFA build(List<Token> tokens) {
            return Automata.determinize(Automata.compile(tokens));
        }
    },

    /**
     * The minimal DFA.
     */
    MINIMIZED {
        @Override
        DFA build(List<Token> tokens) {
            return Automata.minimize(Automata.determinize(Automata.compile(tokens)));
        }
    };

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    abstract Recognizer build(List<Token> tokens);

    /**
     * @throws MalformedExpressionException if the tokens do not form one
     *         expression.
     */
    public Recognizer recognizerFor(List<Token> tokens) {
        Recognizer ret = build(tokens);
        if (logger.isLoggable(level)) {
            logger.log(level, "Stage " + this + ": " + ret.size() + " states");
        }
        return ret;
    }

    public Recognizer recognizerFor(CharSequence postfix) {
        return recognizerFor(Token.parse(postfix));
    }
}
