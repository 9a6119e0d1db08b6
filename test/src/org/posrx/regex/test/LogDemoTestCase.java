/*@LICENSE@
 */
package org.posrx.regex.test;

import org.posrx.regex.AbstractRxTestCase;
import org.posrx.regex.Pattern;

/**
 * Writes the engine's FINEST output for a few patterns under log/, for
 * reading rather than asserting.
 */
public class LogDemoTestCase extends AbstractRxTestCase {

    public LogDemoTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logRxToFile();
    }

    public void testAlternation() {
        assertTrue(Pattern.search("(P|p|c)ython", "cython"));
    }

    public void testNestedStar() {
        assertTrue(Pattern.search("((a|b)c)+d", "acbcd"));
    }

    public void testCounted() {
        assertFalse(Pattern.search("Hap{2,4}y Days", "Happpppy Days"));
    }

    public void testCharClass() {
        assertTrue(Pattern.search("[A-Z]nt[0-9]", "Ant8"));
    }
}
