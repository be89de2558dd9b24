/* @LICENSE@
 */
package org.xtrms.automata;

import java.util.LinkedList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thompson construction: evaluates a postfix token sequence over a stack of
 * NFA fragments, each with exactly one start and one accept state.
 * <p>
 * Every state of one compilation comes from a single {@link NFA.Builder},
 * so fragments built independently and merged later can never share an
 * identifier. Instances hold no state between calls and may be shared.
 */
public final class Compiler {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINE;

    private static final class Fragment {

        final int start;
        final int accept;

        Fragment(int start, int accept) {
            this.start = start;
            this.accept = accept;
        }
    }

    public NFA compile(CharSequence postfix) {
        return compile(Token.parse(postfix));
    }

    /**
     * @return an NFA accepting exactly the language of <code>tokens</code>.
     * @throws MalformedExpressionException if an operator lacks operands, or
     *         the tokens leave other than one fragment on the stack.
     */
    public NFA compile(List<Token> tokens) {

        final NFA.Builder arena = new NFA.Builder();
        final LinkedList<Fragment> stack = new LinkedList<Fragment>();

        int index = 0;
        for (Token token : tokens) {
            if (stack.size() < token.kind().arity()) {
                throw malformed(
                    "operator " + token.symbol() + " needs "
                    + token.kind().arity() + " operand(s), found " + stack.size(),
                    tokens, index);
            }
            Fragment a, b;
            switch (token.kind()) {
            case LITERAL:
                stack.push(literal(arena, token.symbol()));
                break;
            case CAT:
                b = stack.pop();
                a = stack.pop();
                stack.push(cat(arena, a, b));
                break;
            case ALT:
                b = stack.pop();
                a = stack.pop();
                stack.push(alt(arena, a, b));
                break;
            case STAR:
                a = stack.pop();
                stack.push(star(arena, a));
                break;
            default:
                throw new AssertionError(token);
            }
            ++index;
        }

        if (stack.isEmpty()) {
            throw malformed("empty expression", tokens, tokens.size());
        }
        if (stack.size() > 1) {
            throw malformed(
                stack.size() + " unconnected fragments, missing operator",
                tokens, tokens.size());
        }
        Fragment f = stack.pop();
        return arena.start(f.start).accept(f.accept).build();
    }

    private static Fragment literal(NFA.Builder arena, char c) {
        int start = arena.newState();
        int accept = arena.newState();
        arena.arc(start, c, accept);
        return new Fragment(start, accept);
    }

    /*
     * no new states; the operands keep their identifiers
     */
    private static Fragment cat(NFA.Builder arena, Fragment a, Fragment b) {
        arena.epsilon(a.accept, b.start);
        return new Fragment(a.start, b.accept);
    }

    private static Fragment alt(NFA.Builder arena, Fragment a, Fragment b) {
        int start = arena.newState();
        int accept = arena.newState();
        arena.epsilon(start, a.start);
        arena.epsilon(start, b.start);
        arena.epsilon(a.accept, accept);
        arena.epsilon(b.accept, accept);
        return new Fragment(start, accept);
    }

    private static Fragment star(NFA.Builder arena, Fragment a) {
        int start = arena.newState();
        int accept = arena.newState();
        arena.epsilon(start, a.start);
        arena.epsilon(start, accept);       // zero times
        arena.epsilon(a.accept, accept);
        arena.epsilon(a.accept, a.start);   // again
        return new Fragment(start, accept);
    }

    private static MalformedExpressionException malformed(
            String desc, List<Token> tokens, int index) {
        MalformedExpressionException e =
            new MalformedExpressionException(desc, Token.toString(tokens), index);
        logger.log(level, e.getMessage(), e);
        return e;
    }
}
