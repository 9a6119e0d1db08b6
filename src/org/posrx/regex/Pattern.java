/*
 * @LICENSE@
 */

package org.posrx.regex;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A compiled representation of a regular expression; analog to the
 * {@link java.util.regex.Pattern} class. Like the Pattern class of the standard
 * library, instances of this Pattern class are immutable and thread safe.
 * <p>
 * The accepted syntax is small:
 * <ul>
 * <li>literal characters; <code>\</code> makes the next character literal,
 * metacharacters included;</li>
 * <li><code>.</code> matches any character;</li>
 * <li><code>[...]</code> character classes, with <code>a-z</code> ranges and
 * a leading <code>^</code> for negation;</li>
 * <li><code>(...)</code> grouping and <code>|</code> alternation;</li>
 * <li>the quantifiers <code>*</code>, <code>+</code>, <code>?</code>,
 * <code>{m}</code>, <code>{m,}</code> and <code>{m,n}</code> (with
 * <code>m &gt;= 1</code>).</li>
 * </ul>
 * <strong>Back References</strong>, lookaround, and POSIX classes are
 * <em>not</em> supported.
 * <p>
 * Compilation produces an {@link NFA} whose states are the positions of the
 * pattern's tokens; {@link #automaton()} exposes it read-only for renderers.
 * Searching asks whether the automaton accepts some prefix of the input (see
 * {@link Matcher}).
 */
public final class Pattern {

    private static final Logger logger = Logger.getLogger("org.posrx.regex");
    private static final Level level = Level.FINEST;

    final String regex;
    final NFA nfa;

    private Pattern(String regex) {
        this.regex = regex;
        logger.log(level, "regex: " + regex);
        List<Token> tokens = new Tokenizer().tokenize(Tokenizer.wrap(regex));
        logger.log(level, "tokens: " + tokens.size());
        this.nfa = NFA.build(tokens);
    }

    /**
     * Compiles the given regular expression into a pattern.
     * 
     * @param regex
     *            the expression to be compiled
     * @return the pattern
     * @throws RegexSyntaxException
     *             if the expression's syntax is invalid
     */
    public static Pattern compile(String regex) {
        if (regex == null) {
            throw new NullPointerException("regex");
        }
        return new Pattern(regex);
    }

    /**
     * Compiles <code>regex</code> and searches <code>input</code> with it.
     * 
     * @return true if the pattern accepts some prefix of the input.
     */
    public static boolean search(String regex, CharSequence input) {
        return compile(regex).search(input);
    }

    /**
     * @return true if this pattern accepts some prefix of the input.
     */
    public boolean search(CharSequence input) {
        return matcher(input).lookingAt();
    }

    public Matcher matcher(CharSequence csq) {
        return new Matcher(this, csq);
    }

    /**
     * @return the automaton this pattern compiled to.
     */
    public NFA automaton() {
        return nfa;
    }

    public String pattern() {
        return regex;
    }

    @Override
    public String toString() {
        return regex;
    }
}
