/* @LICENSE@  
 */

package org.posrx.regex;

import static org.posrx.regex.Misc.FS;

import java.io.File;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import junit.framework.TestCase;

public abstract class AbstractRxTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.posrx.regex.test");
    protected static final Level level = Level.FINEST; 
    
    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    } 

    public AbstractRxTestCase(String name) {
        super(name);
    }

    private Logger rxLogger = Logger.getLogger("org.posrx.regex");
    private Handler rxHandler = null;
    private Level rxLevel = null;
    
    private void mkdirs() {
        File logDir = new File(
                "log" + FS + 
                getClass().getSimpleName());
        if (!logDir.exists()) {
            logDir.mkdirs();
        }
    }
    
    /**
     * Sends the engine's log output for the current test to
     * log/&lt;TestClass&gt;/&lt;testName&gt;.log.
     */
    protected void logRxToFile(Level level) {
        if (rxHandler != null) return;
        mkdirs();
        try {
            rxHandler = new LogFileHandler(
                    this.getClass().getSimpleName(),
                    getName());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        rxHandler.setLevel(level);
        rxHandler.setFormatter(new SimpleFormatter());
        rxLevel = rxLogger.getLevel();
        rxLogger.setLevel(level);
        rxLogger.addHandler(rxHandler);
    }
    protected void logRxToFile() {
        logRxToFile(level);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(this.getClass().getSimpleName(), this.getName());
    }

    protected void tearDown() throws Exception {
        if (rxHandler != null) {
            rxHandler.flush();
            rxHandler.close();
            rxLogger.removeHandler(rxHandler);
            rxLogger.setLevel(rxLevel);
            rxHandler = null;
        }
        logger.exiting(this.getClass().getSimpleName(), this.getName());
        super.tearDown();
    }
    
    protected static BitSet pos(Integer... integers) {
        BitSet ret = new BitSet();
        for (int i : integers) {
            ret.set(i);
        }
        return ret;
    }
    
    /**
     * Tokenizes a pattern the way {@link Pattern#compile(String)} does.
     */
    protected static List<Token> tokensOf(String regex) {
        return new Tokenizer().tokenize(Tokenizer.wrap(regex));
    }

    protected static NFA nfaOf(String regex) {
        return Pattern.compile(regex).automaton();
    }
}
