/*
 * @LICENSE@
 */

/**
 * <h3><b>xtrms-automata</b> - regular expressions to minimal finite automata.</h3>
 * <p>
 * <h4>Pipeline.</h4>
 * <p>
 * Three stages, each a pure function from one immutable automaton to a new
 * one:
 * <ol>
 * <li>{@link org.xtrms.automata.Compiler} - a postfix expression over
 * literals, concatenation (<code>.</code>), alternation (<code>|</code>)
 * and Kleene star (<code>*</code>) becomes an {@link org.xtrms.automata.NFA}
 * with epsilon arcs, by Thompson construction. All states of one compilation
 * are numbered by one arena, so merging fragments never renumbers anything.</li>
 * <li>{@link org.xtrms.automata.Determinizer} - subset construction over
 * epsilon-closures, yielding a {@link org.xtrms.automata.DFA} whose states
 * are labelled with the NFA states they stand for. Empty moves produce no
 * arc: the dead state stays implicit.</li>
 * <li>{@link org.xtrms.automata.Minimizer} - table filling over pairs of
 * states, a union-find over the pairs left unmarked, and a rebuild with one
 * state per class. Unreachable states are dropped first.</li>
 * </ol>
 * {@link org.xtrms.automata.Automata} strings the stages together;
 * {@link org.xtrms.automata.Stage} hands out a
 * {@link org.xtrms.automata.Recognizer} for any one of them.
 * <p>
 * <h4>Scope.</h4>
 * <p>
 * The package does no infix parsing, has no character classes or anchors,
 * and does not render automata beyond the plain text dumps written to the
 * <code>org.xtrms.automata</code> logger at <code>FINER</code> and below.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>For the theory behind regular expressions and their implementation
 * as automata, see the first chapters of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book.</a></li>
 * <li>Russ Cox, <a href="http://swtch.com/~rsc/regexp/regexp1.html">Regular
 * Expression Matching Can Be Simple And Fast</a>, for Thompson's
 * construction.</li>
 * <li>Hopcroft, Motwani and Ullman, <em>Introduction to Automata Theory,
 * Languages, and Computation</em>, for the table filling algorithm.</li>
 * </ul>
 *
 * @author <a href="mailto:nicholas.d.wade@gmail.com">Nick Wade</a>, Panavista
 *         Technologies LLC.
 */
package org.xtrms.automata;
