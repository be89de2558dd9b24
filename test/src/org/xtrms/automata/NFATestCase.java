/* @LICENSE@  
 */

package org.xtrms.automata;

import java.util.SortedSet;

public class NFATestCase extends AbstractAutomataTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(NFATestCase.class);
    }

    public NFATestCase(String name) {
        super(name);
    }

    public void testClosure() {
        NFA nfa = nfa("a *");
        assertEquals(ids(0, 2, 3), nfa.closure(2));
        assertEquals(ids(0, 1, 3), nfa.closure(1));
        assertEquals(ids(3), nfa.closure(3));
        assertEquals(ids(0), nfa.closure(0));
        assertEquals(ids(0, 1, 2, 3), nfa.closure(ids(1, 2)));
        assertTrue(nfa.closure(ids()).isEmpty());
    }

    public void testClosureIdempotent() {
        for (String postfix : new String[] {"a *", "a b | *", "a * b * . *", "a b . c |"}) {
            NFA nfa = nfa(postfix);
            for (Integer id : nfa.states()) {
                SortedSet<Integer> closure = nfa.closure(id);
                assertTrue(closure.contains(id));
                assertEquals(postfix + " @" + id, closure, nfa.closure(closure));
            }
        }
    }

    public void testClosureCycle() {
        NFA nfa = new NFA.Builder()
            .state(0).state(1).state(2).state(3)
            .epsilon(0, 1).epsilon(1, 2).epsilon(2, 0)
            .arc(2, 'x', 3)
            .start(0).accept(3)
            .build();
        assertEquals(ids(0, 1, 2), nfa.closure(1));
        assertTrue(nfa.accepts("x"));
        assertFalse(nfa.accepts(""));
        assertFalse(nfa.accepts("xx"));
    }

    public void testMove() {
        NFA nfa = nfa("a b |");
        assertEquals(ids(1), nfa.move(nfa.closure(nfa.start()), 'a'));
        assertEquals(ids(3), nfa.move(nfa.closure(nfa.start()), 'b'));
        assertTrue(nfa.move(nfa.closure(nfa.start()), 'c').isEmpty());
    }

    public void testBuilderArena() {
        NFA.Builder b = new NFA.Builder();
        assertEquals(0, b.newState());
        b.state(5);
        assertEquals(6, b.newState());
        assertEquals(7, b.newState());
        try {
            b.state(-1);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testBuilderInvalid() {
        assertInvalid(new NFA.Builder());
        assertInvalid(new NFA.Builder().state(0));                      // no start
        assertInvalid(new NFA.Builder().state(0).start(1));             // foreign start
        assertInvalid(new NFA.Builder().state(0).start(0).accept(2));
        assertInvalid(new NFA.Builder().state(0).start(0).arc(0, 'a', 1));
        assertInvalid(new NFA.Builder().state(0).start(0).epsilon(3, 0));
    }

    private static void assertInvalid(NFA.Builder b) {
        try {
            b.build();
            fail("should throw");
        } catch (InvalidAutomatonException e) {}
    }

    public void testImmutable() {
        NFA nfa = nfa("a b .");
        try {
            nfa.states().add(99);
            fail("should throw");
        } catch (UnsupportedOperationException e) {}
        try {
            nfa.alphabet().add('z');
            fail("should throw");
        } catch (UnsupportedOperationException e) {}
        try {
            nfa.state(0).arcs().clear();
            fail("should throw");
        } catch (UnsupportedOperationException e) {}
    }

    public void testUnknownState() {
        try {
            nfa("a").closure(7);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
        assertNull(nfa("a").state(7));
    }

    public void testToString() {
        String s = nfa("a b .").toString();
        assertTrue(s, s.startsWith("total states: 4 total arcs 3"));
        assertTrue(s, s.contains("state: 0 (start)"));
        assertTrue(s, s.contains("state: 3 (accept)"));
        assertTrue(s, s.contains("eps -> 2"));
        assertTrue(s, s.contains("'a' -> 1"));
    }
}
