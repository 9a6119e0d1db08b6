/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata - built directly over token positions.
 */
package org.posrx.regex;

import static org.posrx.regex.Misc.LS;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.posrx.regex.RegexSyntaxException.Kind;

/**
 * An immutable nondeterministic finite automaton whose states are the
 * positions of a token list, plus one accepting state numbered
 * <code>tokens().size()</code>. Two relations are kept:
 * <ul>
 * <li>the <em>match</em> relation: each consuming state <code>i</code> (a
 * literal, wildcard or class) moves to <code>i+1</code> on a symbol it
 * accepts;</li>
 * <li>the <em>epsilon</em> relation: state to states reachable without
 * consuming input.</li>
 * </ul>
 * Every edge is also recorded under an {@link EdgeKind} describing which
 * construct produced it. The per-kind tables carry no matching semantics;
 * they exist for renderers and traces, which read them through
 * {@link #edges(EdgeKind)}.
 */
public final class NFA {

    private static final Logger logger = Logger.getLogger("org.posrx.regex");
    private static final Level level = Level.FINER;

    /**
     * The construct an edge was created for.
     */
    public enum EdgeKind {
        /** consume one symbol, advance one position */
        MATCH,
        /** move past a control token */
        NEXT,
        /** zero repetitions of a <code>*</code> operand */
        STAR_SKIP,
        /** back to the start of a <code>*</code> operand */
        STAR_LOOP,
        /** back to the start of a <code>+</code> operand */
        PLUS_LOOP,
        /** past a <code>?</code> operand and the <code>?</code> itself */
        OPTIONAL_SKIP,
        /** from a group start into one of its alternatives */
        GROUP_ENTER,
        /** from the end of an alternative to the group close */
        ALT_JOIN;

        public boolean isEpsilon() {
            return this != MATCH;
        }
    }

    /**
     * An immutable directed edge between two states.
     */
    public static final class Edge {

        private final int tail;
        private final int head;
        private final EdgeKind kind;

        Edge(int tail, int head, EdgeKind kind) {
            this.tail = tail;
            this.head = head;
            this.kind = kind;
        }

        public int tail() {
            return tail;
        }

        public int head() {
            return head;
        }

        public EdgeKind kind() {
            return kind;
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = 1;
            result = prime * result + head;
            result = prime * result + kind.hashCode();
            result = prime * result + tail;
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (!(obj instanceof Edge))
                return false;
            final Edge other = (Edge) obj;
            return tail == other.tail && head == other.head && kind == other.kind;
        }

        @Override
        public String toString() {
            return tail + "->" + head + ':' + kind;
        }
    }

    /**
     * Accumulates both relations during the single construction scan, then
     * freezes them into an {@link NFA}. A Builder is good for one
     * {@link #build()}.
     */
    static final class Builder {

        private final List<Token> tokens;
        private final int[] match;
        private final List<List<Integer>> epsilon;
        private final List<List<EdgeKind>> epsilonKinds;
        private final Map<EdgeKind, List<Edge>> edges =
            new EnumMap<EdgeKind, List<Edge>>(EdgeKind.class);
        private boolean built = false;

        Builder(List<Token> tokens) {
            final int n = tokens.size();
            if (n < 2 || tokens.get(0).kind() != Token.Kind.GROUP_OPEN
                    || tokens.get(n - 1).kind() != Token.Kind.GROUP_CLOSE) {
                throw new IllegalArgumentException(
                    "token list must be wrapped in a group: " + tokens);
            }
            this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
            this.match = new int[n + 1];
            Arrays.fill(match, -1);
            this.epsilon = new ArrayList<List<Integer>>(n + 1);
            this.epsilonKinds = new ArrayList<List<EdgeKind>>(n + 1);
            for (int i = 0; i <= n; ++i) {
                epsilon.add(new ArrayList<Integer>(2));
                epsilonKinds.add(new ArrayList<EdgeKind>(2));
            }
            for (EdgeKind kind : EdgeKind.values()) {
                edges.put(kind, new ArrayList<Edge>());
            }
        }

        NFA build() {
            if (built) throw new IllegalStateException("already built");
            built = true;

            final int n = tokens.size();
            final Deque<Integer> ops = new ArrayDeque<Integer>();

            for (int i = 0; i < n; ++i) {
                final Token.Kind kind = tokens.get(i).kind();
                int left = i;

                switch (kind) {
                case GROUP_OPEN:
                case ALTERNATE:
                    ops.push(i);
                    break;
                case GROUP_CLOSE:
                    left = closeGroup(i, ops);
                    break;
                case CLASS_CLOSE:
                    if (i < 2 || tokens.get(i - 2).kind() != Token.Kind.CLASS_OPEN) {
                        throw new IllegalArgumentException(
                            "class close at " + i + " without class open");
                    }
                    left = i - 2;
                    break;
                default:
                    break;
                }

                final Token.Kind next = i + 1 < n ? tokens.get(i + 1).kind() : null;
                if (next == Token.Kind.STAR) {
                    epsilon(left, i + 1, EdgeKind.STAR_SKIP);
                    epsilon(i + 1, left, EdgeKind.STAR_LOOP);
                } else if (next == Token.Kind.PLUS) {
                    epsilon(i + 1, left, EdgeKind.PLUS_LOOP);
                } else if (next == Token.Kind.OPTIONAL) {
                    epsilon(left, i + 2, EdgeKind.OPTIONAL_SKIP);
                }

                if (kind.isStructural()) {
                    epsilon(i, i + 1, EdgeKind.NEXT);
                } else if (kind.isConsuming()) {
                    match[i] = i + 1;
                    edges.get(EdgeKind.MATCH).add(new Edge(i, i + 1, EdgeKind.MATCH));
                }
            }

            if (!ops.isEmpty()) {
                if (tokens.get(ops.peek()).kind() == Token.Kind.ALTERNATE) {
                    syntaxError(Kind.UNBALANCED_ALTERNATION,
                        "alternation outside of any group");
                }
                syntaxError(Kind.UNBALANCED_PARENTHESIS, "unclosed group");
            }
            return new NFA(this);
        }

        /*
         * pops back to the matching group open, wiring each alternative in
         * and out; returns the position of the group open.
         */
        private int closeGroup(int close, Deque<Integer> ops) {
            final List<Integer> alts = new ArrayList<Integer>(2);
            while (true) {
                if (ops.isEmpty()) {
                    syntaxError(Kind.UNBALANCED_PARENTHESIS, "unbalanced parenthesis");
                }
                final int op = ops.pop();
                if (tokens.get(op).kind() == Token.Kind.ALTERNATE) {
                    alts.add(op);
                } else {
                    assert tokens.get(op).kind() == Token.Kind.GROUP_OPEN;
                    for (int alt : alts) {
                        epsilon(op, alt + 1, EdgeKind.GROUP_ENTER);
                    }
                    for (int alt : alts) {
                        epsilon(alt, close, EdgeKind.ALT_JOIN);
                    }
                    return op;
                }
            }
        }

        private void epsilon(int tail, int head, EdgeKind kind) {
            edges.get(kind).add(new Edge(tail, head, kind));
            final List<Integer> heads = epsilon.get(tail);
            if (!heads.contains(head)) {
                heads.add(head);
                epsilonKinds.get(tail).add(kind);
            }
        }

        private void syntaxError(Kind kind, String msg) {
            throw new RegexSyntaxException(kind, msg, patternOf(tokens), -1);
        }
    }

    /**
     * Recreates pattern text from a token list, without the enclosing group.
     * Used for error messages when the builder is fed tokens directly.
     */
    static String patternOf(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < tokens.size() - 1; ++i) {
            Token t = tokens.get(i);
            if (t.kind() == Token.Kind.LITERAL && "()[]|*+?.{\\".indexOf(t.literal()) >= 0) {
                sb.append('\\');
            }
            sb.append(t.label());
        }
        return sb.toString();
    }

    private final List<Token> tokens;
    private final int[] match;
    private final int[][] epsilon;
    private final EdgeKind[][] epsilonKinds;
    private final Map<EdgeKind, List<Edge>> edges;

    private NFA(Builder b) {
        this.tokens = b.tokens;
        this.match = b.match;
        final int states = b.epsilon.size();
        this.epsilon = new int[states][];
        this.epsilonKinds = new EdgeKind[states][];
        for (int s = 0; s < states; ++s) {
            List<Integer> heads = b.epsilon.get(s);
            epsilon[s] = new int[heads.size()];
            for (int j = 0; j < heads.size(); ++j) {
                epsilon[s][j] = heads.get(j);
            }
            List<EdgeKind> kinds = b.epsilonKinds.get(s);
            epsilonKinds[s] = kinds.toArray(new EdgeKind[kinds.size()]);
        }
        Map<EdgeKind, List<Edge>> frozen = new EnumMap<EdgeKind, List<Edge>>(EdgeKind.class);
        for (Map.Entry<EdgeKind, List<Edge>> e : b.edges.entrySet()) {
            frozen.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
        }
        this.edges = Collections.unmodifiableMap(frozen);
        if (logger.isLoggable(level)) {
            logger.log(level, "NFA: " + LS + this);
        }
    }

    /**
     * Builds the automaton for a token list.
     * 
     * @throws RegexSyntaxException
     *             if groups or alternations do not balance.
     */
    static NFA build(List<Token> tokens) {
        return new Builder(tokens).build();
    }

    public List<Token> tokens() {
        return tokens;
    }

    public Token token(int state) {
        return tokens.get(state);
    }

    /**
     * @return the number of states, including the accepting state.
     */
    public int stateCount() {
        return tokens.size() + 1;
    }

    public int acceptState() {
        return tokens.size();
    }

    /**
     * @return the text a renderer shows for a state; empty for the accepting
     *         state.
     */
    public String label(int state) {
        return state == acceptState() ? "" : tokens.get(state).label();
    }

    /**
     * @return the successor of a consuming state, -1 for any other state.
     */
    public int matchNext(int state) {
        return match[state];
    }

    /**
     * @return the epsilon successors of a state, in the order they were added.
     */
    public List<Integer> epsilonNext(int state) {
        List<Integer> ret = new ArrayList<Integer>(epsilon[state].length);
        for (int head : epsilon[state]) ret.add(head);
        return Collections.unmodifiableList(ret);
    }

    /*
     * raw tables for the closure engine - not to be modified.
     */
    int[] epsilon(int state) {
        return epsilon[state];
    }

    EdgeKind epsilonKind(int state, int j) {
        return epsilonKinds[state][j];
    }

    /**
     * @return every edge of one kind, in the order construction created them.
     */
    public List<Edge> edges(EdgeKind kind) {
        return edges.get(kind);
    }

    public List<Edge> matchEdges() {
        return edges(EdgeKind.MATCH);
    }

    /**
     * @return every epsilon edge, grouped by kind in {@link EdgeKind} order.
     *         Pairs produced by more than one construct appear once per kind.
     */
    public List<Edge> epsilonEdges() {
        List<Edge> ret = new ArrayList<Edge>();
        for (EdgeKind kind : EdgeKind.values()) {
            if (kind.isEpsilon()) ret.addAll(edges(kind));
        }
        return Collections.unmodifiableList(ret);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode() * 31 + edges.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NFA)) return false;
        NFA nfa = (NFA) o;
        return tokens.equals(nfa.tokens) && edges.equals(nfa.edges);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int s = 0; s < stateCount(); ++s) {
            sb.append(s).append('\t')
              .append(s == acceptState() ? "ACCEPT" : tokens.get(s).toString());
            if (match[s] != -1) {
                sb.append("\tmatch->").append(match[s]);
            }
            if (epsilon[s].length != 0) {
                sb.append("\teps->");
                for (int j = 0; j < epsilon[s].length; ++j) {
                    sb.append(j == 0 ? "" : ",").append(epsilon[s][j]);
                }
            }
            sb.append(LS);
        }
        return sb.toString();
    }
}
