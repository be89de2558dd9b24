/* @LICENSE@
 */
package org.xtrms.automata;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.automata.DFA.Arc;
import org.xtrms.automata.DFA.State;
import org.xtrms.automata.Misc.BreadthFirstVisitor;

/**
 * Table filling minimization.
 * <p>
 * States are indexed in ascending identifier order, plus one extra index for
 * the implicit dead state which every missing transition goes to. A pair is
 * marked distinguishable when exactly one side accepts, then, pass after
 * pass, when some symbol leads it to a marked pair; the loop stops after a
 * pass which marks nothing. The unmarked pairs are fed to a union-find whose
 * roots are always the smallest index, so each class is represented by its
 * smallest original identifier whatever order the pairs come in.
 * <p>
 * Each class becomes one state, with the accept flag and transitions of its
 * representative. Real states equivalent to the dead state, such as an
 * explicit sink, form an ordinary class. Only the virtual dead state itself
 * is never materialized: a representative's missing transition stays
 * missing.
 */
public final class Minimizer {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    /**
     * @return a DFA with the fewest states accepting the language of
     *         <code>dfa</code>. Each state's members are the identifiers of
     *         the <code>dfa</code> states it merges.
     * @throws InvalidAutomatonException if <code>dfa</code> has no states or
     *         its start state is not one of them.
     */
    public DFA minimize(DFA dfa) {

        if (dfa.size() == 0) {
            throw invalid("DFA has no states");
        }
        if (dfa.state(dfa.start()) != dfa.init()) {
            throw invalid("DFA start state " + dfa.start() + " is not one of its states");
        }

        final List<State> live = reachable(dfa);
        if (live.size() < dfa.size() && logger.isLoggable(Level.FINE)) {
            logger.fine("dropping " + (dfa.size() - live.size())
                + " unreachable state(s)");
        }

        final int n = live.size();
        final int dead = n;
        final char[] sigma = new char[dfa.alphabet().size()];
        int k = 0;
        for (Character c : dfa.alphabet()) sigma[k++] = c;

        Map<State, Integer> index = new IdentityHashMap<State, Integer>();
        for (int i = 0; i < n; ++i) {
            index.put(live.get(i), i);
        }
        final int[][] delta = new int[n + 1][sigma.length];
        final boolean[] accept = new boolean[n + 1];
        for (int i = 0; i < n; ++i) {
            State state = live.get(i);
            accept[i] = state.accept;
            for (int a = 0; a < sigma.length; ++a) {
                State ns = state.next(sigma[a]);
                delta[i][a] = ns == null ? dead : index.get(ns);
            }
        }
        for (int a = 0; a < sigma.length; ++a) {
            delta[dead][a] = dead;
        }

        boolean[][] marked = distinguish(delta, accept);
        int[] parent = partition(marked);

        /*
         * one class per root; a root is the smallest index of its class, so
         * ascending root order is ascending representative identifier order.
         * The virtual dead state has the largest index, so it never roots a
         * class that holds a real state, and it gets no class of its own.
         */
        List<List<Integer>> classes = new ArrayList<List<Integer>>();
        int[] classOf = new int[n + 1];
        Arrays.fill(classOf, -1);
        for (int i = 0; i < n; ++i) {
            int root = find(parent, i);
            if (root == i) {
                classOf[i] = classes.size();
                classes.add(new ArrayList<Integer>());
            } else {
                classOf[i] = classOf[root];
            }
            classes.get(classOf[i]).add(i);
        }
        if (find(parent, dead) != dead && logger.isLoggable(Level.FINE)) {
            logger.fine("class " + classOf[find(parent, dead)]
                + " can never accept");
        }

        List<State> states = new ArrayList<State>(classes.size());
        for (int c = 0; c < classes.size(); ++c) {
            SortedSet<Integer> members = new TreeSet<Integer>();
            for (Integer i : classes.get(c)) {
                members.add(live.get(i).id);
            }
            int rep = classes.get(c).get(0);
            states.add(new State(c, members, accept[rep]));
        }
        for (int c = 0; c < classes.size(); ++c) {
            int rep = classes.get(c).get(0);
            List<Arc> arcs = new ArrayList<Arc>();
            for (int a = 0; a < sigma.length; ++a) {
                int t = classOf[delta[rep][a]];
                if (t >= 0) {
                    arcs.add(new Arc(sigma[a], states.get(t)));
                }
            }
            states.get(c).arcs(arcs.toArray(new Arc[arcs.size()]));
        }

        DFA ret = new DFA(states.get(classOf[index.get(dfa.init())]),
            states, dfa.alphabet());
        if (logger.isLoggable(level)) {
            logger.log(level, "dfa minimized: " + ret.toString(), ret);
        }
        return ret;
    }

    /*
     * marked[i][j], i < j: states i and j are distinguishable
     */
    static boolean[][] distinguish(int[][] delta, boolean[] accept) {
        final int size = accept.length;
        final boolean[][] marked = new boolean[size][size];
        for (int i = 0; i < size; ++i) {
            for (int j = i + 1; j < size; ++j) {
                marked[i][j] = accept[i] != accept[j];
            }
        }
        boolean changed;
        int passes = 0;
        do {
            changed = false;
            ++passes;
            for (int i = 0; i < size; ++i) {
                for (int j = i + 1; j < size; ++j) {
                    if (marked[i][j]) continue;
                    for (int a = 0; a < delta[i].length; ++a) {
                        int p = Math.min(delta[i][a], delta[j][a]);
                        int q = Math.max(delta[i][a], delta[j][a]);
                        if (p != q && marked[p][q]) {
                            marked[i][j] = true;
                            changed = true;
                            break;
                        }
                    }
                }
            }
        } while (changed);
        if (logger.isLoggable(level)) {
            logger.log(level, "table filled after " + passes + " pass(es)");
        }
        return marked;
    }

    /*
     * union-find over the unmarked pairs; union keeps the smaller root
     */
    static int[] partition(boolean[][] marked) {
        int[] parent = new int[marked.length];
        for (int i = 0; i < parent.length; ++i) {
            parent[i] = i;
        }
        for (int i = 0; i < marked.length; ++i) {
            for (int j = i + 1; j < marked.length; ++j) {
                if (!marked[i][j]) {
                    int ri = find(parent, i);
                    int rj = find(parent, j);
                    if (ri < rj) parent[rj] = ri;
                    else if (rj < ri) parent[ri] = rj;
                }
            }
        }
        return parent;
    }

    static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    /*
     * ascending identifier order
     */
    private static List<State> reachable(DFA dfa) {
        List<State> ret = new ArrayList<State>(
            new BreadthFirstVisitor<State, Arc>(){}.start(dfa.init()).visited());
        Collections.sort(ret, new Comparator<State>() {
            public int compare(State lhs, State rhs) {
                return lhs.id < rhs.id ? -1 : lhs.id == rhs.id ? 0 : 1;
            }
        });
        return ret;
    }

    private static InvalidAutomatonException invalid(String msg) {
        InvalidAutomatonException e = new InvalidAutomatonException(msg);
        logger.log(Level.FINE, msg, e);
        return e;
    }
}
