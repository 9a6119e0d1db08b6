/*
 * @LICENSE@
 */

package org.posrx.regex;

/**
 * An atomic unit of a compiled pattern. A token's position in the token list
 * is also its state identifier in the {@link NFA}; there is no separate state
 * table. Instances are immutable.
 */
public final class Token {

    /**
     * The closed set of token kinds.
     */
    public enum Kind {
        LITERAL(true, false),
        WILDCARD(true, false),
        CHAR_CLASS(true, false),
        GROUP_OPEN(false, true),
        GROUP_CLOSE(false, true),
        CLASS_OPEN(false, true),
        CLASS_CLOSE(false, true),
        /*
         * not structural: what follows a '|' belongs to the next alternative,
         * so the only way out of a '|' is the join edge to the group close.
         */
        ALTERNATE(false, false),
        STAR(false, true),
        PLUS(false, true),
        OPTIONAL(false, true);

        private final boolean consuming;
        private final boolean structural;

        Kind(boolean consuming, boolean structural) {
            this.consuming = consuming;
            this.structural = structural;
        }

        /**
         * @return true if a state of this kind consumes one input symbol.
         */
        public boolean isConsuming() {
            return consuming;
        }

        /**
         * @return true if a state of this kind has the default epsilon edge to
         *         the next position.
         */
        public boolean isStructural() {
            return structural;
        }

        /**
         * @return true for the repetition operators <code>* + ?</code>.
         */
        public boolean isQuantifier() {
            return this == STAR || this == PLUS || this == OPTIONAL;
        }
    }

    static final Token WILDCARD = new Token(Kind.WILDCARD, '.', null);
    static final Token GROUP_OPEN = new Token(Kind.GROUP_OPEN, '(', null);
    static final Token GROUP_CLOSE = new Token(Kind.GROUP_CLOSE, ')', null);
    static final Token CLASS_OPEN = new Token(Kind.CLASS_OPEN, '[', null);
    static final Token CLASS_CLOSE = new Token(Kind.CLASS_CLOSE, ']', null);
    static final Token ALTERNATE = new Token(Kind.ALTERNATE, '|', null);
    static final Token STAR = new Token(Kind.STAR, '*', null);
    static final Token PLUS = new Token(Kind.PLUS, '+', null);
    static final Token OPTIONAL = new Token(Kind.OPTIONAL, '?', null);

    private final Kind kind;
    private final char c;
    private final CharClass cc;

    private Token(Kind kind, char c, CharClass cc) {
        this.kind = kind;
        this.c = c;
        this.cc = cc;
    }

    public static Token literal(char c) {
        return new Token(Kind.LITERAL, c, null);
    }

    public static Token charClass(CharClass cc) {
        if (cc == null) throw new NullPointerException("cc");
        return new Token(Kind.CHAR_CLASS, '\0', cc);
    }

    /**
     * Factory for the tokens which carry no payload.
     * 
     * @param kind
     *            any kind except LITERAL and CHAR_CLASS
     * @return the shared token instance for the kind.
     */
    public static Token of(Kind kind) {
        switch (kind) {
        case WILDCARD:      return WILDCARD;
        case GROUP_OPEN:    return GROUP_OPEN;
        case GROUP_CLOSE:   return GROUP_CLOSE;
        case CLASS_OPEN:    return CLASS_OPEN;
        case CLASS_CLOSE:   return CLASS_CLOSE;
        case ALTERNATE:     return ALTERNATE;
        case STAR:          return STAR;
        case PLUS:          return PLUS;
        case OPTIONAL:      return OPTIONAL;
        default:
            throw new IllegalArgumentException(kind + " tokens carry a payload");
        }
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the character of a LITERAL token.
     */
    public char literal() {
        if (kind != Kind.LITERAL) throw new IllegalStateException(kind.toString());
        return c;
    }

    /**
     * @return the class of a CHAR_CLASS token.
     */
    public CharClass charClass() {
        if (kind != Kind.CHAR_CLASS) throw new IllegalStateException(kind.toString());
        return cc;
    }

    /**
     * Tests one input symbol against a consuming token. Non-consuming tokens
     * match nothing.
     */
    boolean accepts(int symbol) {
        switch (kind) {
        case LITERAL:
            return symbol == c;
        case WILDCARD:
            return true;
        case CHAR_CLASS:
            return cc.contains(symbol);
        default:
            return false;
        }
    }

    /**
     * @return the label a renderer puts on this token's state.
     */
    public String label() {
        return kind == Kind.CHAR_CLASS ? cc.spec() : String.valueOf(c);
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + (cc != null ? cc.hashCode() : c);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        if (kind != t.kind || c != t.c) return false;
        return cc == null ? t.cc == null : cc.equals(t.cc);
    }

    @Override
    public String toString() {
        switch (kind) {
        case LITERAL:
            return "'" + c + "'";
        case CHAR_CLASS:
            return cc.toString();
        default:
            return kind.toString();
        }
    }
}
