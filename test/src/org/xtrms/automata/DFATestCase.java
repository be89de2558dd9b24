/* @LICENSE@  
 */

package org.xtrms.automata;

public class DFATestCase extends AbstractAutomataTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(DFATestCase.class);
    }

    public DFATestCase(String name) {
        super(name);
    }

    /*
     * the example from the table filling write-ups: q1 accepts
     */
    static DFA threeStates() {
        return new DFA.Builder()
            .state(0).state(1).state(2)
            .start(0).accept(1)
            .arc(0, 'a', 1).arc(0, 'b', 2)
            .arc(1, 'a', 0).arc(1, 'b', 2)
            .arc(2, 'a', 2).arc(2, 'b', 1)
            .build();
    }

    public void testBuilder() {
        DFA dfa = threeStates();
        assertEquals(3, dfa.size());
        assertEquals(ids(0, 1, 2), dfa.states());
        assertEquals(ids(1), dfa.accept());
        assertEquals(ids(2), dfa.state(2).members());
        assertEquals(2, dfa.alphabet().size());
        assertEquals(Integer.valueOf(2), dfa.next(0, 'b'));
        assertTrue(dfa.state(1).isAccept());
        assertEquals(2, dfa.state(0).arcs().size());
    }

    public void testAccepts() {
        DFA dfa = threeStates();
        assertTrue(dfa.accepts("a"));
        assertTrue(dfa.accepts("bb"));
        assertTrue(dfa.accepts("aaa"));
        assertFalse(dfa.accepts(""));
        assertFalse(dfa.accepts("aa"));
        assertFalse(dfa.accepts("ac"));     // no such symbol: rejected, not an error
    }

    public void testPartial() {
        DFA dfa = new DFA.Builder()
            .state(7).state(9).start(7).accept(9).arc(7, 'z', 9)
            .build();
        assertTrue(dfa.accepts("z"));
        assertFalse(dfa.accepts("zz"));
        assertNull(dfa.next(9, 'z'));
        assertNull(dfa.state(9).next('z'));
        try {
            dfa.next(8, 'z');
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testDeclaredSymbol() {
        DFA dfa = new DFA.Builder().state(0).start(0).symbol('k').build();
        assertEquals(1, dfa.alphabet().size());
        assertTrue(dfa.state(0).arcs().isEmpty());
    }

    public void testNondeterministicArc() {
        DFA.Builder b = new DFA.Builder().state(0).state(1).state(2).arc(0, 'a', 1);
        b.arc(0, 'a', 1);   // same again is fine
        try {
            b.arc(0, 'a', 2);
            fail("should throw");
        } catch (InvalidAutomatonException e) {}
    }

    public void testBuilderInvalid() {
        assertInvalid(new DFA.Builder());
        assertInvalid(new DFA.Builder().state(0));
        assertInvalid(new DFA.Builder().state(0).start(3));
        assertInvalid(new DFA.Builder().state(0).start(0).accept(1));
        assertInvalid(new DFA.Builder().state(0).start(0).arc(0, 'a', 1));
        assertInvalid(new DFA.Builder().state(0).start(0).arc(1, 'a', 0));
    }

    private static void assertInvalid(DFA.Builder b) {
        try {
            b.build();
            fail("should throw");
        } catch (InvalidAutomatonException e) {}
    }

    public void testToString() {
        String s = threeStates().toString();
        assertTrue(s, s.startsWith("total states: 3 total arcs 6"));
        assertTrue(s, s.contains("state: 0={0} (start)"));
        assertTrue(s, s.contains("state: 1={1} (accept)"));
        assertTrue(s, s.contains("'b' -> 2"));
    }
}
