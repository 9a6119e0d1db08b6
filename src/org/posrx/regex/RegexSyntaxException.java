/*
 * @LICENSE@
 */

package org.posrx.regex;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown by {@link Pattern#compile(String)} when a regular expression cannot
 * be compiled. In addition to the description, pattern and index carried by
 * {@link PatternSyntaxException}, each instance reports the {@link Kind} of
 * the error. The index refers to the pattern as the client wrote it, or is -1
 * if no single position is to blame.
 */
public class RegexSyntaxException extends PatternSyntaxException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /**
         * A <code>)</code> without a matching <code>(</code>, or the reverse.
         */
        UNBALANCED_PARENTHESIS,
        /**
         * A <code>[</code> never closed by <code>]</code>.
         */
        UNBALANCED_BRACKET,
        /**
         * A <code>|</code> outside of any group.
         */
        UNBALANCED_ALTERNATION,
        /**
         * A <code>{m,n}</code> with non-numeric bounds, <code>m &lt; 1</code>,
         * <code>n &lt; m</code>, or nothing suitable to repeat.
         */
        MALFORMED_REPETITION,
        /**
         * A class range whose start is greater than its stop.
         */
        INVALID_RANGE,
        /**
         * A <code>\</code> at the very end of the pattern.
         */
        DANGLING_ESCAPE;
    }

    private final Kind kind;

    public RegexSyntaxException(Kind kind, String desc, String regex, int index) {
        super(desc, regex, index);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
