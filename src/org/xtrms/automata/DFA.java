/* @LICENSE@
 */


package org.xtrms.automata;


import static org.xtrms.automata.Misc.LS;
import static org.xtrms.automata.Misc.clear;
import static org.xtrms.automata.Misc.frozen;
import static org.xtrms.automata.Misc.labelFrom;
import static org.xtrms.automata.Misc.symbolString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.xtrms.automata.Misc.Edge;
import org.xtrms.automata.Misc.Vertex;


/**
 * An immutable deterministic finite automaton. Each state carries an integer
 * identifier and a <em>members</em> label: the NFA states it stands for when
 * built by the {@link Determinizer}, the prior DFA states it merges when built
 * by the {@link Minimizer}, or just its own identifier when built by hand.
 * <p>
 * The transition function is partial. A missing (state, symbol) entry is an
 * implicit, non-accepting dead state and is never materialized.
 */
public final class DFA implements Recognizer {

    /**
     * An entry in the transition table: a symbol mapped to a next state.
     */
    public static final class Arc implements Edge<State> {

        final char symbol;
        final State ns;

        Arc(char symbol, State ns) {
            this.symbol = symbol;
            this.ns = ns;
        }

        public char symbol() {
            return symbol;
        }
        public State target() {
            return ns;
        }
        public State vertex() {
            return ns;
        }
        @Override
        public String toString() {
            return symbolString(symbol) + " -> " + ns.id;
        }
    }


    public static final class State implements Vertex<Arc> {

        private static final Arc[] NO_ARCS = new Arc[0];

        final int id;
        private final SortedSet<Integer> members;
        final boolean accept;
        /* private */ Arc[] arcs = NO_ARCS;   // ascending by symbol, at most one per symbol

        State(int id, Collection<Integer> members, boolean accept) {
            this.id = id;
            this.members = frozen(members);
            this.accept = accept;
        }

        void arcs(Arc[] arcs) {
            assert new Object() {
                boolean test(Arc[] arcs) {
                    for (int i = 1; i < arcs.length; ++i) {
                        if (arcs[i - 1].symbol >= arcs[i].symbol) return false;
                    }
                    return true;
                }
            }.test(arcs) : Arrays.toString(arcs);
            this.arcs = arcs;
        }

        public int id() {
            return id;
        }

        public SortedSet<Integer> members() {
            return members;
        }

        public boolean isAccept() {
            return accept;
        }

        public List<Arc> arcs() {
            return Collections.unmodifiableList(Arrays.asList(arcs));
        }

        public Iterable<Arc> edges() {
            return arcs();
        }

        /**
         * @return the next state on <code>c</code>, or null for the implicit
         *         dead state.
         */
        public State next(char c) {
            int lo = 0;
            int hi = arcs.length - 1;
            while (lo <= hi) {
                int m = (lo + hi) >>> 1;
                char s = arcs[m].symbol;
                if (s < c) {
                    lo = m + 1;
                } else if (s > c) {
                    hi = m - 1;
                } else {
                    return arcs[m].ns;
                }
            }
            return null;
        }

        String toLabel() {
            return id + "=" + labelFrom(members);
        }

        @Override
        public String toString() {
            return "state: " + toLabel();
        }
    }

    /**
     * Assembles a {@link DFA} by hand, one state per identifier. Each state's
     * members label is its own identifier.
     */
    public static final class Builder {

        private final SortedSet<Integer> ids = new TreeSet<Integer>();
        private final SortedSet<Integer> accept = new TreeSet<Integer>();
        private final SortedSet<Character> alphabet = new TreeSet<Character>();
        private final SortedMap<Integer, SortedMap<Character, Integer>> delta =
            new TreeMap<Integer, SortedMap<Character, Integer>>();
        private Integer start = null;

        public Builder state(int id) {
            ids.add(id);
            return this;
        }

        public Builder start(int id) {
            start = id;
            return this;
        }

        public Builder accept(int id) {
            accept.add(id);
            return this;
        }

        /**
         * Declares a symbol even if no arc uses it.
         */
        public Builder symbol(char c) {
            alphabet.add(c);
            return this;
        }

        /**
         * @throws InvalidAutomatonException if <code>from</code> already has
         *         a different destination on <code>symbol</code>.
         */
        public Builder arc(int from, char symbol, int to) {
            SortedMap<Character, Integer> out = delta.get(from);
            if (out == null) {
                delta.put(from, out = new TreeMap<Character, Integer>());
            }
            Integer prior = out.get(symbol);
            if (prior != null && prior != to) {
                throw new InvalidAutomatonException(
                    "DFA state " + from + " has two destinations on "
                    + symbolString(symbol) + ": " + prior + ", " + to);
            }
            out.put(symbol, to);
            alphabet.add(symbol);
            return this;
        }

        /**
         * @throws InvalidAutomatonException if there are no states, the start
         *         state is unset or unknown, or an accept state or arc
         *         endpoint is unknown.
         */
        public DFA build() {
            if (ids.isEmpty()) {
                throw new InvalidAutomatonException("DFA has no states");
            }
            if (start == null) {
                throw new InvalidAutomatonException("DFA start state not set");
            }
            if (!ids.contains(start)) {
                throw new InvalidAutomatonException(
                    "DFA start state " + start + " is not one of its states");
            }
            for (Integer id : accept) {
                if (!ids.contains(id)) {
                    throw new InvalidAutomatonException(
                        "DFA accept state " + id + " is not one of its states");
                }
            }
            SortedMap<Integer, State> states = new TreeMap<Integer, State>();
            for (Integer id : ids) {
                states.put(id, new State(id, Collections.singleton(id), accept.contains(id)));
            }
            for (Map.Entry<Integer, SortedMap<Character, Integer>> e : delta.entrySet()) {
                State state = states.get(e.getKey());
                List<Arc> arcs = new ArrayList<Arc>();
                for (Map.Entry<Character, Integer> arc : e.getValue().entrySet()) {
                    State ns = states.get(arc.getValue());
                    if (state == null || ns == null) {
                        throw new InvalidAutomatonException(
                            "DFA arc " + e.getKey() + " " + symbolString(arc.getKey())
                            + " -> " + arc.getValue()
                            + " has an endpoint outside the state set");
                    }
                    arcs.add(new Arc(arc.getKey(), ns));
                }
                state.arcs(arcs.toArray(new Arc[arcs.size()]));
            }
            return new DFA(states.get(start), states.values(), alphabet);
        }
    }

    final State init;
    private final SortedMap<Integer, State> states;
    private final SortedSet<Integer> ids;
    private final SortedSet<Integer> accept;
    private final SortedSet<Character> alphabet;

    /*
     * arcs of every state are already in place
     */
    DFA(State init, Collection<State> states, Collection<Character> alphabet) {
        SortedMap<Integer, State> byId = new TreeMap<Integer, State>();
        SortedSet<Integer> accept = new TreeSet<Integer>();
        for (State state : states) {
            State prior = byId.put(state.id, state);
            assert prior == null : state;
            if (state.accept) accept.add(state.id);
        }
        assert byId.get(init.id) == init;
        this.init = init;
        this.states = Collections.unmodifiableSortedMap(byId);
        this.ids = frozen(byId.keySet());
        this.accept = Collections.unmodifiableSortedSet(accept);
        this.alphabet = Collections.unmodifiableSortedSet(
            new TreeSet<Character>(alphabet));
    }

    public SortedSet<Integer> states() {
        return ids;
    }

    /**
     * @return the state with the given identifier, or null.
     */
    public State state(int id) {
        return states.get(id);
    }

    public int start() {
        return init.id;
    }

    public State init() {
        return init;
    }

    public SortedSet<Integer> accept() {
        return accept;
    }

    public SortedSet<Character> alphabet() {
        return alphabet;
    }

    public int size() {
        return states.size();
    }

    /**
     * @return the destination of (<code>id</code>, <code>c</code>), or null
     *         when the transition is undefined.
     * @throws IllegalArgumentException if there is no state <code>id</code>.
     */
    public Integer next(int id, char c) {
        State state = states.get(id);
        if (state == null) {
            throw new IllegalArgumentException("no such DFA state: " + id);
        }
        State ns = state.next(c);
        return ns == null ? null : ns.id;
    }

    /**
     * Walks the transition function from the start state; the first missing
     * transition rejects.
     */
    public boolean accepts(CharSequence input) {
        State state = init;
        for (int i = 0; i < input.length(); ++i) {
            state = state.next(input.charAt(i));
            if (state == null) return false;
        }
        return state.accept;
    }

    private static final String INDENT = "    ";

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int nArcs = 0;
        for (State state : states.values()) nArcs += state.arcs.length;
        sb
            .append("total states: ").append(size())
            .append(" total arcs ").append(nArcs)
            .append(" alphabet ").append(alphabet)
            .append(LS);
        StringBuilder line = new StringBuilder();
        for (State state : states.values()) {
            clear(line);
            line.append(state);
            if (state == init)  line.append(" (start)");
            if (state.accept)   line.append(" (accept)");
            sb.append(line).append(LS);
            for (Arc arc : state.arcs) {
                sb.append(INDENT).append(arc).append(LS);
            }
        }
        return sb.toString();
    }
}
