/* @LICENSE@  
 */
package org.xtrms.automata;

/**
 * A runtime exception thrown when an automaton handed to a pipeline stage (or
 * assembled by one of the builders) breaks a structural precondition: no
 * states, a start state outside the state set, an arc or accept state that
 * names an unknown state, or a DFA with two destinations for one symbol.
 */
public class InvalidAutomatonException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidAutomatonException(String msg) {
        super(msg);
    }
}
