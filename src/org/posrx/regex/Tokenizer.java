/*
 * @LICENSE@
 */

package org.posrx.regex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import org.posrx.regex.RegexSyntaxException.Kind;

/**
 * Converts a pattern string into the flat token list the {@link NFA} is built
 * over. The input must already be wrapped in one enclosing group (see
 * {@link #wrap(String)}); that group becomes tokens 0 and n-1.
 * <p>
 * Counted repetition is eliminated here: <code>x{m,n}</code> is rewritten as
 * <code>m</code> copies of <code>x</code> followed by <code>n-m</code> copies
 * of <code>x?</code>, so state identifiers are assigned only after every
 * rewrite has happened.
 */
final class Tokenizer {

    /*
     * bounds larger than this are more likely typos than intent, and each
     * copy costs states.
     */
    static final int MAX_REPETITION = 1000;

    private String regex;           // wrapped
    private List<Token> tokens;
    private Deque<Integer> openGroups;
    private boolean repeated;       // last operand came out of a {m,n}

    static String wrap(String regex) {
        return "(" + regex + ")";
    }

    List<Token> tokenize(String wrapped) {
        if (wrapped.length() < 2 || wrapped.charAt(0) != '('
                || wrapped.charAt(wrapped.length() - 1) != ')') {
            throw new IllegalArgumentException("pattern not wrapped: " + wrapped);
        }
        regex = wrapped;
        tokens = new ArrayList<Token>(wrapped.length() + 4);
        openGroups = new ArrayDeque<Integer>();
        repeated = false;

        final int last = regex.length() - 1;
        for (int i = 0; i <= last; ++i) {
            char c = regex.charAt(i);
            switch (c) {
            case '\\':
                if (i + 1 >= last) {
                    syntaxError(Kind.DANGLING_ESCAPE, "dangling escape", i);
                }
                emit(Token.literal(regex.charAt(++i)));
                break;
            case '[':
                i = scanCharClass(i);
                break;
            case '(':
                openGroups.push(i);
                emit(Token.GROUP_OPEN);
                break;
            case ')':
                if (openGroups.size() == 1 && i != last) {
                    syntaxError(Kind.UNBALANCED_PARENTHESIS, "unbalanced parenthesis", i);
                }
                if (i == last && openGroups.size() != 1) {
                    syntaxError(Kind.UNBALANCED_PARENTHESIS, "unclosed group", openGroups.peek());
                }
                openGroups.pop();
                emit(Token.GROUP_CLOSE);
                break;
            case '|':
                emit(Token.ALTERNATE);
                break;
            case '*':
                checkNotRepeated(i);
                emit(Token.STAR);
                break;
            case '+':
                checkNotRepeated(i);
                emit(Token.PLUS);
                break;
            case '?':
                checkNotRepeated(i);
                emit(Token.OPTIONAL);
                break;
            case '.':
                emit(Token.WILDCARD);
                break;
            case '{':
                i = expandRepetition(i);
                break;
            default:
                emit(Token.literal(c));
                break;
            }
        }
        assert openGroups.isEmpty() : openGroups;  // the wrapper closes last

        List<Token> ret = Collections.unmodifiableList(tokens);
        tokens = null;
        openGroups = null;
        return ret;
    }

    private void emit(Token token) {
        tokens.add(token);
        repeated = false;
    }

    /*
     * a quantifier after {m,n} would bind to the last copy only.
     */
    private void checkNotRepeated(int i) {
        if (repeated) {
            syntaxError(Kind.MALFORMED_REPETITION,
                "quantifier following counted repetition", i);
        }
    }

    /*
     * returns the index of the closing ']'
     */
    private int scanCharClass(int open) {
        final int last = regex.length() - 1;
        int j = open + 1;
        if (j < last && regex.charAt(j) == '^') ++j;
        if (j < last && regex.charAt(j) == ']') ++j;   // not meta if first
        int close = regex.indexOf(']', j);
        if (close < 0 || close >= last) {
            syntaxError(Kind.UNBALANCED_BRACKET, "char class missing end bracket", open);
        }
        String spec = regex.substring(open + 1, close);
        CharClass cc = null;
        try {
            cc = CharClass.parse(spec);
        } catch (IllegalArgumentException e) {
            syntaxError(Kind.INVALID_RANGE, e.getMessage(), open);
        }
        emit(Token.CLASS_OPEN);
        emit(Token.charClass(cc));
        emit(Token.CLASS_CLOSE);
        return close;
    }

    /*
     * returns the index of the closing '}'
     */
    private int expandRepetition(int open) {
        final int close = regex.indexOf('}', open);
        if (close < 0 || close >= regex.length() - 1) {
            syntaxError(Kind.MALFORMED_REPETITION, "unclosed counted repetition", open);
        }
        if (repeated || tokens.get(tokens.size() - 1).kind().isQuantifier()) {
            syntaxError(Kind.MALFORMED_REPETITION,
                "counted repetition of an already quantified operand", open);
        }
        final int start = operandStart(open);

        String body = regex.substring(open + 1, close);
        int comma = body.indexOf(',');
        int lower, upper;
        boolean unbounded = false;
        if (comma < 0) {
            lower = upper = bound(body, open);
        } else {
            lower = bound(body.substring(0, comma), open);
            if (comma == body.length() - 1) {
                unbounded = true;
                upper = lower;
            } else {
                upper = bound(body.substring(comma + 1), open);
            }
        }
        if (lower < 1) {
            syntaxError(Kind.MALFORMED_REPETITION,
                "lower repetition bound must be at least 1", open);
        }
        if (upper < lower) {
            syntaxError(Kind.MALFORMED_REPETITION,
                "upper repetition bound less than lower bound", open);
        }

        List<Token> span = new ArrayList<Token>(tokens.subList(start, tokens.size()));
        for (int k = 1; k < lower; ++k) {
            tokens.addAll(span);
        }
        if (unbounded) {
            tokens.addAll(span);
            tokens.add(Token.STAR);
        } else {
            for (int k = lower; k < upper; ++k) {
                tokens.addAll(span);
                tokens.add(Token.OPTIONAL);
            }
        }
        repeated = true;
        return close;
    }

    /*
     * start (in the token list) of the operand just before a '{': one
     * literal or wildcard, a whole class span, or a whole group.
     */
    private int operandStart(int open) {
        final int n = tokens.size();
        switch (tokens.get(n - 1).kind()) {
        case LITERAL:
        case WILDCARD:
            return n - 1;
        case CLASS_CLOSE:
            assert tokens.get(n - 3).kind() == Token.Kind.CLASS_OPEN;
            return n - 3;
        case GROUP_CLOSE:
            int depth = 0;
            for (int k = n - 1; k >= 0; --k) {
                Token.Kind kind = tokens.get(k).kind();
                if (kind == Token.Kind.GROUP_CLOSE) {
                    ++depth;
                } else if (kind == Token.Kind.GROUP_OPEN && --depth == 0) {
                    return k;
                }
            }
            syntaxError(Kind.UNBALANCED_PARENTHESIS,
                "no group start for counted repetition", open);
            return -1;
        default:
            syntaxError(Kind.MALFORMED_REPETITION,
                "nothing to repeat before counted repetition", open);
            return -1;
        }
    }

    private int bound(String s, int open) {
        String t = s.trim();
        boolean digits = t.length() > 0;
        for (int k = 0; k < t.length(); ++k) {
            digits &= Character.isDigit(t.charAt(k)) && t.charAt(k) < 0x80;
        }
        if (!digits || t.length() > 4 || Integer.parseInt(t) > MAX_REPETITION) {
            syntaxError(Kind.MALFORMED_REPETITION,
                "malformed repetition bound: '" + s + "'", open);
        }
        return Integer.parseInt(t);
    }

    private void syntaxError(Kind kind, String msg, int index) {
        throw new RegexSyntaxException(kind, msg,
            regex.substring(1, regex.length() - 1), index < 0 ? -1 : index - 1);
    }
}
