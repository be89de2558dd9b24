/* @LICENSE@  
 */

package org.xtrms.automata;

import static org.xtrms.automata.AutomataAssert.*;

public class DeterminizerTestCase extends AbstractAutomataTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(DeterminizerTestCase.class);
    }

    public DeterminizerTestCase(String name) {
        super(name);
    }

    public void testCat() {
        DFA dfa = dfa("a b .");
        assertEquals(3, dfa.size());
        assertEquals(0, dfa.start());
        assertEquals(ids(0), dfa.state(0).members());
        assertEquals(ids(1, 2), dfa.state(1).members());
        assertEquals(ids(3), dfa.state(2).members());
        assertEquals(ids(2), dfa.accept());
        assertEquals(Integer.valueOf(1), dfa.next(0, 'a'));
        assertEquals(Integer.valueOf(2), dfa.next(1, 'b'));
        assertNull(dfa.next(0, 'b'));       // implicit dead state
        assertNull(dfa.next(2, 'a'));
    }

    public void testAlt() {
        DFA dfa = dfa("a b |");
        assertEquals(3, dfa.size());
        assertEquals(ids(0, 2, 4), dfa.init().members());
        assertEquals(ids(1, 5), dfa.state(1).members());
        assertEquals(ids(3, 5), dfa.state(2).members());
        assertEquals(ids(1, 2), dfa.accept());
    }

    public void testStar() {
        DFA dfa = dfa("a *");
        assertEquals(2, dfa.size());
        assertEquals(ids(0, 2, 3), dfa.init().members());
        assertEquals(ids(0, 1, 3), dfa.state(1).members());
        assertEquals(ids(0, 1), dfa.accept());
        assertEquals(Integer.valueOf(1), dfa.next(1, 'a'));
    }

    /*
     * discovery order is breadth first, symbols ascending
     */
    public void testNumbering() {
        DFA dfa = dfa("a b | *");
        assertEquals(3, dfa.size());
        assertEquals(Integer.valueOf(1), dfa.next(0, 'a'));
        assertEquals(Integer.valueOf(2), dfa.next(0, 'b'));
        assertEquals(Integer.valueOf(1), dfa.next(2, 'a'));
        assertEquals(Integer.valueOf(2), dfa.next(1, 'b'));
        assertEquals(dfa.toString(), dfa("a b | *").toString());
    }

    public void testDeterministic() {
        for (String postfix : new String[] {
                "a", "a b .", "a b |", "a *", "a b | * a .", 
                "a a . a b . |", "a * a .", "a b | * a . b | b |"}) {
            DFA dfa = dfa(postfix);
            assertDeterministic(dfa);
            assertEquals(nfa(postfix).alphabet(), dfa.alphabet());
        }
    }

    /*
     * (a|b)*a(a|b) needs the NFA's "one back" state in every DFA state
     */
    public void testSubsets() {
        DFA dfa = dfa("a b | * a . a b | .");
        assertDeterministic(dfa);
        assertTrue(dfa.accepts("aa"));
        assertTrue(dfa.accepts("bbab"));
        assertFalse(dfa.accepts("ba"));
        assertFalse(dfa.accepts("abb"));
        assertEquals(4, new Minimizer().minimize(dfa).size());
    }

    public void testHandBuiltNFA() {
        // 0 -eps-> 1 -x-> 2, 0 -x-> 3 -eps-> 2; 2 accepts
        NFA nfa = new NFA.Builder()
            .state(0).state(1).state(2).state(3)
            .epsilon(0, 1).arc(1, 'x', 2)
            .arc(0, 'x', 3).epsilon(3, 2)
            .start(0).accept(2)
            .build();
        DFA dfa = new Determinizer().determinize(nfa);
        assertEquals(2, dfa.size());
        assertEquals(ids(0, 1), dfa.init().members());
        assertEquals(ids(2, 3), dfa.state(1).members());
        assertTrue(dfa.accepts("x"));
        assertFalse(dfa.accepts("xx"));
    }

    public void testNoAccept() {
        NFA nfa = new NFA.Builder().state(0).state(1).arc(0, 'q', 1).start(0).build();
        DFA dfa = new Determinizer().determinize(nfa);
        assertEquals(2, dfa.size());
        assertTrue(dfa.accept().isEmpty());
        assertFalse(dfa.accepts("q"));
    }
}
