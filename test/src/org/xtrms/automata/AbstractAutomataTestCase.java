/* @LICENSE@  
 */

package org.xtrms.automata;

import java.util.Arrays;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import junit.framework.TestCase;

public abstract class AbstractAutomataTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.xtrms.automata.test");
    protected static final Level level = Level.FINEST; 
    
    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    } 

    public AbstractAutomataTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(this.getClass().getSimpleName(), this.getName());
    }

    protected void tearDown() throws Exception {
        logger.exiting(this.getClass().getSimpleName(), this.getName());
        super.tearDown();
    }

    /*
     * shortcuts for the pipeline stages
     */
    protected static NFA nfa(String postfix) {
        return new Compiler().compile(postfix);
    }

    protected static DFA dfa(String postfix) {
        return new Determinizer().determinize(nfa(postfix));
    }

    protected static DFA minimal(String postfix) {
        return new Minimizer().minimize(dfa(postfix));
    }

    protected static SortedSet<Integer> ids(Integer... ids) {
        return new TreeSet<Integer>(Arrays.asList(ids));
    }
}
