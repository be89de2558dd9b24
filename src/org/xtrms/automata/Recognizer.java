/* @LICENSE@  
 */
package org.xtrms.automata;

/**
 * Something that decides membership of whole strings in a regular language.
 * Implemented by both {@link NFA} and {@link DFA}, so one input can be run
 * through every {@link Stage} of the pipeline.
 */
public interface Recognizer {

    /**
     * @return true iff the whole of <code>input</code> is in the language.
     *         A symbol with no transition rejects; it is never an error.
     */
    boolean accepts(CharSequence input);

    /**
     * @return the number of states.
     */
    int size();
}
