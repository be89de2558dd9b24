/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.AbstractQueue;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Queue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * outside the char range, so it can never collide with a real symbol
     */
    public static final int EPSILON = -1;

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    static SortedSet<Integer> frozen(Collection<Integer> ids) {
        return Collections.unmodifiableSortedSet(new TreeSet<Integer>(ids));
    }

    static String labelFrom(Iterable<Integer> ids) {
        StringBuilder sb = new StringBuilder();
        for (Integer id : ids) {
            sb.append(sb.length() == 0 ? '{' : ',').append(id);
        }
        if (sb.length() == 0) sb.append('{');
        return sb.append('}').toString();
    }

    /**
     * Printable form of a symbol for the debug dumps: epsilon as
     * <code>eps</code>, control and non-ASCII chars as \\u escapes.
     */
    static String symbolString(int c) {
        if (c == EPSILON) return "eps";
        StringBuilder sb = new StringBuilder();
        if (c < 32 || 126 < c) {
            sb.append(Integer.toHexString(c));
            while (sb.length() < 4) {
                sb.insert(0, "0");
            }
            sb.insert(0, "\\u");
        } else {
            sb.append('\'').append((char) c).append('\'');
        }
        return sb.toString();
    }

    static final class IdentitySetQueue<E> extends AbstractQueue<E> {

        final Map<E, Void> map = new IdentityHashMap<E, Void>();
        final LinkedList<E> list = new LinkedList<E>();

        public IdentitySetQueue() {
            super();
        }
        /*
         * remove() drops the element from both views
         */
        @Override
        public Iterator<E> iterator() {
            final Iterator<E> it = list.iterator();
            return new Iterator<E>() {
                E last;
                public boolean hasNext() {
                    return it.hasNext();
                }
                public E next() {
                    return last = it.next();
                }
                public void remove() {
                    it.remove();
                    map.remove(last);
                }
            };
        }

        @Override
        public int size() {
            assert list.size() == map.size();
            return map.size();
        }

        public boolean offer(E o) {
            if (o == null || map.containsKey(o)) return false;
            map.put(o, null);
            return list.offer(o);
        }

        public E peek() {
            return list.peek();
        }

        public E poll() {
            if (isEmpty()) return null;
            E ret = list.poll();
            assert map.containsKey(ret);
            map.remove(ret);
            return ret;
        }
    }

    /*
     * gray set of the depth first search: a stack with O(1) membership
     */
    static final class IdentitySetStack<E> {

        final Map<E, Void> map = new IdentityHashMap<E, Void>();
        final LinkedList<E> list = new LinkedList<E>();

        public boolean push(E e) {
            if (map.containsKey(e)) return false;
            map.put(e, null);
            list.addFirst(e);
            return true;
        }
        public E pop() {
            if (isEmpty()) throw new NoSuchElementException();
            E e = list.removeFirst();
            assert map.containsKey(e);
            map.remove(e);
            return e;
        }
        public boolean contains(Object e) {
            assert map.containsKey(e) == list.contains(e);
            return map.containsKey(e);
        }
        public void clear() {
            map.clear(); list.clear();
        }
        public boolean isEmpty() {
            assert map.isEmpty() == list.isEmpty();
            return map.isEmpty();
        }
        @Override
        public String toString() {
            return list.toString();
        }
    }

    /*
     * Generic digraph visitors
     */
    private interface SimpleVertex {
        Iterable<? extends SimpleEdge> edges();
    }
    private interface SimpleEdge {
        SimpleVertex vertex();
    }
    interface Vertex<E extends SimpleEdge> extends SimpleVertex {
        Iterable<E> edges();
    }
    interface Edge<V extends SimpleVertex> extends SimpleEdge {
         V vertex();
    }

    static abstract class BreadthFirstVisitor<V extends Vertex<E>, E extends Edge<V>> {

        final Map<V, Void> black = new IdentityHashMap<V, Void>();
        final Queue<V> gray = new IdentitySetQueue<V>();
        V vertex;

        final BreadthFirstVisitor<V, E> start(V init) {
            black.clear(); gray.clear();
            visitFrom(init);
            return this;
        }

        final Set<V> visited() {
            return Collections.unmodifiableSet(black.keySet());
        }

        private void visitFrom(V init) {
            gray.offer(init);
            while (!gray.isEmpty()) {
                black.put(vertex = gray.remove(), null);
                visit(vertex);
                for (E edge : vertex.edges()) {
                    if (!black.containsKey(edge.vertex())) {
                        gray.offer(edge.vertex());
                    }
                }
            }
        }
        protected void visit(V vertex) {}
    }

    static abstract class DepthFirstVisitor<V extends Vertex<E>, E extends Edge<V>> {

        private Map<V, Void> black = new IdentityHashMap<V, Void>();
        private IdentitySetStack<V> gray = new IdentitySetStack<V>();
        private LinkedList<Iterator<E>> eiDeq = new LinkedList<Iterator<E>>();

        public final DepthFirstVisitor<V, E> start(Iterable<V> inits) {
            black.clear(); gray.clear(); eiDeq.clear();
            for (V init : inits) if (!black.containsKey(init)) visitFrom(init);
            return this;
        }

        private void visitFrom(V init) {

            V vertex;
            E edge;
            Iterator<E> ei;
            boolean tree, back, a;

            gray.push(init);
            eiDeq.addFirst(init.edges().iterator());
            while (!eiDeq.isEmpty()) {
                if ((ei = eiDeq.getFirst()).hasNext()) {
                    edge = ei.next();
                    tree = !black.containsKey(edge.vertex())
                         & !(back = gray.contains(edge.vertex()));
                    if (visit(edge, tree, back) && tree) {
                        gray.push(edge.vertex());
                        eiDeq.addFirst(edge.vertex().edges().iterator());
                    }
                } else {
                    eiDeq.removeFirst();
                    a = !black.containsKey(vertex = gray.pop());
                    black.put(vertex, null);
                    assert a;
                    visit(vertex);
                }
            }
            assert  gray.isEmpty() : gray;
        }

        /*
         * return false to keep the traversal from descending along edge
         */
        protected boolean visit(E edge, boolean tree, boolean back) {
            return true;
        }
        protected void visit(V vertex) {}
    }
}
