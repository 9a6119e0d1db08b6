/*
 * @LICENSE@
 */
package org.posrx.regex;

import static org.posrx.regex.Misc.EOF;
import static org.posrx.regex.Misc.statesStringFrom;
import static org.posrx.regex.Misc.symbolStringFrom;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.posrx.regex.Matcher.Outcome;
import org.posrx.regex.NFA.Edge;

/**
 * Runs an {@link NFA} over input text by keeping the full set of active
 * states, one symbol at a time. There is no backtracking: every alternative
 * the automaton could be in is already in the active set, so a run costs
 * O(text length * automaton size) time and O(automaton size) space.
 * <p>
 * The run succeeds as soon as the accepting state turns up in the active set,
 * i.e. on the shortest prefix of the text the pattern accepts. Each
 * {@link Matcher} owns its simulator, since the closure scratch space must
 * not be shared between runs in flight.
 */
final class NFAsimulator {

    private static final Logger logger = Logger.getLogger("org.posrx.regex");
    private static final Level level = Level.FINEST;

    private static final BitSet NONE = new BitSet(0);

    private final NFA nfa;
    private final EpsilonClosure closure;

    NFAsimulator(NFA nfa) {
        this.nfa = nfa;
        this.closure = new EpsilonClosure(nfa);
    }

    NFA nfa() {
        return nfa;
    }

    /**
     * Evaluates the matcher's input, leaving the outcome and end position in
     * the matcher.
     */
    void eval(Matcher m) {

        final CharSequence csq = m.csq;
        final Tracer tracer = m.tracer;
        final int accept = nfa.acceptState();
        final boolean logging = logger.isLoggable(level);

        final List<Edge> used = tracer != null ? new ArrayList<Edge>() : null;
        final List<Edge> consumed = tracer != null ? new ArrayList<Edge>() : null;

        BitSet active = new BitSet(nfa.stateCount());
        closure.expand(0, active, used);
        boolean accepted = active.get(accept);

        if (logging) {
            logger.log(level, "States before scanning: " + statesStringFrom(active));
        }
        if (tracer != null) {
            tracer.step(new Step(-1, EOF, active, NONE,
                Collections.<Edge>emptyList(), used, accepted));
        }
        if (accepted) {
            finish(m, Outcome.MATCH, 0);
            return;
        }

        final BitSet matched = new BitSet(nfa.stateCount());
        final BitSet next = new BitSet(nfa.stateCount());

        for (int i = 0; i < csq.length(); ++i) {

            if (m.isCancelled()) {
                if (logging) logger.log(level, "cancelled at index " + i);
                finish(m, Outcome.CANCELLED, -1);
                return;
            }

            final char c = csq.charAt(i);
            matched.clear();
            next.clear();
            if (tracer != null) {
                used.clear();
                consumed.clear();
            }

            for (int s = active.nextSetBit(0); s >= 0; s = active.nextSetBit(s + 1)) {
                assert s != accept;
                if (nfa.token(s).accepts(c)) {
                    final int ns = nfa.matchNext(s);
                    assert ns != -1 : s;
                    matched.set(s);
                    next.set(ns);
                    if (tracer != null) {
                        consumed.add(new Edge(s, ns, NFA.EdgeKind.MATCH));
                    }
                }
            }

            active = closure.of(next, used);
            accepted = active.get(accept);

            if (logging) {
                logger.log(level, "Letter: " + symbolStringFrom(c)
                    + " Matched States: " + statesStringFrom(matched)
                    + " Match Transitions: " + statesStringFrom(next)
                    + " Epsilon Transitions: " + statesStringFrom(active));
            }
            if (tracer != null) {
                tracer.step(new Step(i, c, active, matched, consumed, used, accepted));
            }

            if (accepted) {
                finish(m, Outcome.MATCH, i + 1);
                return;
            }
            if (active.isEmpty()) {
                break;      // nothing left alive; the rest can't match
            }
        }
        finish(m, Outcome.NO_MATCH, -1);
    }

    private static void finish(Matcher m, Outcome outcome, int end) {
        m.outcome = outcome;
        m.end = end;
        if (logger.isLoggable(level)) {
            logger.log(level, "outcome: " + outcome + (end != -1 ? " end=" + end : ""));
        }
    }
}
