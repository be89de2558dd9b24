/* @LICENSE@
 */
package org.xtrms.automata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.automata.DFA.Arc;
import org.xtrms.automata.DFA.State;
import org.xtrms.automata.Misc.BreadthFirstVisitor;

/**
 * Subset construction. Each DFA state is the epsilon-closure of a set of NFA
 * states; the start state is the closure of the NFA start state and gets
 * identifier 0, the others are numbered in breadth first discovery order.
 * A symbol whose move is empty gets no arc.
 */
public final class Determinizer {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    /**
     * @throws InvalidAutomatonException if the NFA has no states or its start
     *         state is not one of them.
     */
    public DFA determinize(final NFA nfa) {

        if (nfa.size() == 0) {
            throw invalid("NFA has no states");
        }
        if (nfa.state(nfa.start()) == null) {
            throw invalid("NFA start state " + nfa.start() + " is not one of its states");
        }

        final class StateFactory {

            private final Map<SortedSet<Integer>, State> map =
                new LinkedHashMap<SortedSet<Integer>, State>();

            private State stateFrom(SortedSet<Integer> closure) {
                State state = map.get(closure);
                if (state == null) {
                    state = new State(map.size(), closure, intersects(closure));
                    map.put(state.members(), state);
                }
                return state;
            }

            private boolean intersects(SortedSet<Integer> closure) {
                for (Integer id : closure) {
                    if (nfa.isAccept(id)) return true;
                }
                return false;
            }
        }
        final StateFactory factory = new StateFactory();

        /*
         * Subset construction as breadth first search
         */
        final State init = factory.stateFrom(nfa.closure(nfa.start()));
        new BreadthFirstVisitor<State, Arc>() {

            final List<Arc> arcs = new ArrayList<Arc>();

            /*
             * Create all the arcs for the state already discovered.
             */
            @Override
            protected void visit(State state) {
                arcs.clear();
                for (Character c : nfa.alphabet()) {
                    SortedSet<Integer> next =
                        nfa.closure(nfa.move(state.members(), c));
                    if (!next.isEmpty()) {
                        arcs.add(new Arc(c, factory.stateFrom(next)));
                    }
                }
                state.arcs(arcs.toArray(new Arc[arcs.size()]));
            }
        }.start(init);

        DFA dfa = new DFA(init, factory.map.values(), nfa.alphabet());
        if (logger.isLoggable(level)) {
            logger.log(level, "dfa unminimized: " + dfa.toString(), dfa);
        }
        return dfa;
    }

    private static InvalidAutomatonException invalid(String msg) {
        InvalidAutomatonException e = new InvalidAutomatonException(msg);
        logger.log(Level.FINE, msg, e);
        return e;
    }
}
