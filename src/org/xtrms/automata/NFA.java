/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata, with epsilon arcs.
 */
package org.xtrms.automata;

import static org.xtrms.automata.Misc.LS;
import static org.xtrms.automata.Misc.clear;
import static org.xtrms.automata.Misc.frozen;
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
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.automata.Misc.DepthFirstVisitor;
import org.xtrms.automata.Misc.Edge;
import org.xtrms.automata.Misc.Vertex;


/**
 * An immutable nondeterministic finite automaton: a set of integer state
 * identifiers, an alphabet of <code>char</code> symbols, one start state, a
 * set of accept states, and a transition relation from (state, symbol) to
 * sets of states. Epsilon arcs carry the reserved symbol {@link #EPSILON},
 * which is never part of the {@linkplain #alphabet() alphabet}.
 * <p>
 * Instances are assembled with a {@link Builder}; the {@link Compiler} is the
 * usual client.
 */
public final class NFA implements Recognizer {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINER;

    /**
     * The symbol on an arc taken without consuming input.
     */
    public static final int EPSILON = Misc.EPSILON;

    public static final class Arc implements Edge<State> {

        final int symbol;
        final State ns;     // next state

        private Arc(int symbol, State ns) {
            this.symbol = symbol;
            this.ns = ns;
        }
        /**
         * @return the <code>char</code> labelling the arc, or
         *         {@link NFA#EPSILON}.
         */
        public int symbol() {
            return symbol;
        }
        public boolean isEpsilon() {
            return symbol == EPSILON;
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
        private Arc[] arcs = NO_ARCS;

        private State(int id) {
            this.id = id;
        }
        private void arcs(Arc[] arcs) {
            this.arcs = arcs;
        }
        public int id() {
            return id;
        }
        /**
         * @return the outgoing arcs, ordered by symbol (epsilon first), then
         *         by target.
         */
        public List<Arc> arcs() {
            return Collections.unmodifiableList(Arrays.asList(arcs));
        }
        public Iterable<Arc> edges() {
            return arcs();
        }
        @Override
        public String toString() {
            return "state: " + id;
        }
    }

    /**
     * Assembles an {@link NFA}. The builder is also the identifier arena of
     * a construction: {@link #newState()} hands out strictly increasing ids,
     * and never one that is already taken, however the states are later
     * wired together. Not thread safe; use one builder per construction.
     */
    public static final class Builder {

        private int nextId = 0;
        private final SortedMap<Integer, SortedMap<Integer, SortedSet<Integer>>> relation =
            new TreeMap<Integer, SortedMap<Integer, SortedSet<Integer>>>();
        private final List<int[]> pending = new ArrayList<int[]>();
        private final SortedSet<Integer> accept = new TreeSet<Integer>();
        private Integer start = null;

        /**
         * Allocates a fresh state.
         *
         * @return its identifier, greater than any identifier used so far.
         */
        public int newState() {
            int id = nextId++;
            relation.put(id, new TreeMap<Integer, SortedSet<Integer>>());
            return id;
        }

        /**
         * Adds a state with a caller chosen identifier; later
         * {@link #newState()} calls allocate above it.
         */
        public Builder state(int id) {
            if (id < 0) {
                throw new IllegalArgumentException("negative state id: " + id);
            }
            if (!relation.containsKey(id)) {
                relation.put(id, new TreeMap<Integer, SortedSet<Integer>>());
            }
            nextId = Math.max(nextId, id + 1);
            return this;
        }

        public Builder arc(int from, char symbol, int to) {
            pending.add(new int[] {from, symbol, to});
            return this;
        }

        public Builder epsilon(int from, int to) {
            pending.add(new int[] {from, EPSILON, to});
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
         * @throws InvalidAutomatonException if there are no states, the start
         *         state is unset or unknown, or an accept state or arc
         *         endpoint is unknown.
         */
        public NFA build() {
            if (relation.isEmpty()) {
                throw new InvalidAutomatonException("NFA has no states");
            }
            if (start == null) {
                throw new InvalidAutomatonException("NFA start state not set");
            }
            if (!relation.containsKey(start)) {
                throw new InvalidAutomatonException(
                    "NFA start state " + start + " is not one of its states");
            }
            for (Integer id : accept) {
                if (!relation.containsKey(id)) {
                    throw new InvalidAutomatonException(
                        "NFA accept state " + id + " is not one of its states");
                }
            }
            for (int[] arc : pending) {
                if (!relation.containsKey(arc[0]) || !relation.containsKey(arc[2])) {
                    throw new InvalidAutomatonException(
                        "NFA arc " + arc[0] + " " + symbolString(arc[1]) + " -> "
                        + arc[2] + " has an endpoint outside the state set");
                }
                SortedMap<Integer, SortedSet<Integer>> out = relation.get(arc[0]);
                SortedSet<Integer> targets = out.get(arc[1]);
                if (targets == null) {
                    out.put(arc[1], targets = new TreeSet<Integer>());
                }
                targets.add(arc[2]);
            }
            pending.clear();
            return new NFA(relation, start, accept);
        }
    }

    private final SortedMap<Integer, State> states;
    private final SortedSet<Integer> ids;
    private final State start;
    private final SortedSet<Integer> accept;
    private final SortedSet<Character> alphabet;

    private NFA(SortedMap<Integer, SortedMap<Integer, SortedSet<Integer>>> relation,
            int start, SortedSet<Integer> accept) {

        SortedMap<Integer, State> states = new TreeMap<Integer, State>();
        for (Integer id : relation.keySet()) {
            states.put(id, new State(id));
        }
        SortedSet<Character> alphabet = new TreeSet<Character>();
        for (Map.Entry<Integer, SortedMap<Integer, SortedSet<Integer>>> e
                : relation.entrySet()) {
            List<Arc> arcs = new ArrayList<Arc>();
            for (Map.Entry<Integer, SortedSet<Integer>> out : e.getValue().entrySet()) {
                int symbol = out.getKey();
                if (symbol != EPSILON) alphabet.add((char) symbol);
                for (Integer target : out.getValue()) {
                    arcs.add(new Arc(symbol, states.get(target)));
                }
            }
            states.get(e.getKey()).arcs(arcs.toArray(new Arc[arcs.size()]));
        }
        this.states = Collections.unmodifiableSortedMap(states);
        this.ids = frozen(states.keySet());
        this.start = states.get(start);
        this.accept = frozen(accept);
        this.alphabet = Collections.unmodifiableSortedSet(alphabet);

        if (logger.isLoggable(level)) {
            logger.log(level, "nfa: " + toString(), this);
        }
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
        return start.id;
    }

    public SortedSet<Integer> accept() {
        return accept;
    }

    public boolean isAccept(int id) {
        return accept.contains(id);
    }

    public SortedSet<Character> alphabet() {
        return alphabet;
    }

    public int size() {
        return states.size();
    }

    /**
     * @param symbol a <code>char</code>, or {@link #EPSILON}
     * @return the states one <code>symbol</code> arc away from
     *         <code>id</code>; empty if there are none.
     */
    public SortedSet<Integer> next(int id, int symbol) {
        SortedSet<Integer> ret = new TreeSet<Integer>();
        for (Arc arc : stateFrom(id).arcs) {
            if (arc.symbol == symbol) ret.add(arc.ns.id);
        }
        return ret;
    }

    /**
     * @return the union of {@link #next(int, int)} over <code>ids</code>.
     */
    public SortedSet<Integer> move(Collection<Integer> ids, char symbol) {
        SortedSet<Integer> ret = new TreeSet<Integer>();
        for (Integer id : ids) {
            for (Arc arc : stateFrom(id).arcs) {
                if (arc.symbol == symbol) ret.add(arc.ns.id);
            }
        }
        return ret;
    }

    /**
     * @return the epsilon-closure of a single state; always contains it.
     */
    public SortedSet<Integer> closure(int id) {
        return closure(Collections.singleton(id));
    }

    /**
     * The epsilon-closure of a set of states: everything reachable from one
     * of them along zero or more epsilon arcs. Closing a closure changes
     * nothing.
     */
    public SortedSet<Integer> closure(Collection<Integer> ids) {
        List<State> seeds = new ArrayList<State>(ids.size());
        for (Integer id : ids) {
            seeds.add(stateFrom(id));
        }
        final SortedSet<Integer> ret = new TreeSet<Integer>();
        new DepthFirstVisitor<State, Arc>() {
            @Override
            protected boolean visit(Arc arc, boolean tree, boolean back) {
                return arc.isEpsilon();
            }
            @Override
            protected void visit(State state) {
                ret.add(state.id);
            }
        }.start(seeds);
        return ret;
    }

    /**
     * Simulates the automaton on the closure of the current state set.
     */
    public boolean accepts(CharSequence input) {
        SortedSet<Integer> current = closure(start.id);
        for (int i = 0; i < input.length(); ++i) {
            current = closure(move(current, input.charAt(i)));
            if (current.isEmpty()) return false;
        }
        for (Integer id : current) {
            if (accept.contains(id)) return true;
        }
        return false;
    }

    private State stateFrom(int id) {
        State state = states.get(id);
        if (state == null) {
            throw new IllegalArgumentException("no such NFA state: " + id);
        }
        return state;
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
            if (state == start)             line.append(" (start)");
            if (accept.contains(state.id))  line.append(" (accept)");
            sb.append(line).append(LS);
            for (Arc arc : state.arcs) {
                sb.append(INDENT).append(arc).append(LS);
            }
        }
        return sb.toString();
    }
}
