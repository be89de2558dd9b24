/* @LICENSE@  
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.LS;

/**
 * Thrown by the {@link Compiler} when a postfix token sequence does not
 * denote exactly one automaton: an operator finds too few operands on the
 * construction stack, or the input ends with zero or several fragments left.
 * Modeled on {@link java.util.regex.PatternSyntaxException}.
 */
public class MalformedExpressionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String desc;
    private final String expression;
    private final int index;

    /**
     * @param desc what went wrong
     * @param expression the token sequence, rendered as postfix text with
     *        one space between tokens
     * @param index the offending token, or the token count when the error
     *        is detected at end of input
     */
    public MalformedExpressionException(String desc, String expression, int index) {
        this.desc = desc;
        this.expression = expression;
        this.index = index;
    }

    public String getDescription() {
        return desc;
    }

    public String getExpression() {
        return expression;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(desc);
        if (index >= 0) {
            sb.append(" near token ").append(index);
        }
        sb.append(LS).append(expression);
        if (index >= 0) {
            sb.append(LS);
            for (int i = 0; i < 2 * index; ++i) sb.append(' ');
            sb.append('^');
        }
        return sb.toString();
    }
}
