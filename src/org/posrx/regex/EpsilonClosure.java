/*
 * @LICENSE@
 */

package org.posrx.regex;

import java.util.BitSet;
import java.util.List;

import org.posrx.regex.NFA.Edge;

/**
 * Computes epsilon closures over an {@link NFA}: every state reachable from a
 * start state by zero or more epsilon edges, the start included.
 * <p>
 * The walk is depth first over an explicit stack. A state is marked when it
 * is pushed and a marked state is never pushed again, so the loops created by
 * <code>*</code> and <code>+</code> terminate, and the stack never holds more
 * than one entry per state. Instances hold scratch space and belong to one
 * simulation run; they are not thread safe.
 */
final class EpsilonClosure {

    private final NFA nfa;
    private final int[] stack;

    EpsilonClosure(NFA nfa) {
        this.nfa = nfa;
        this.stack = new int[nfa.stateCount()];
    }

    /**
     * @return the closure of a single state.
     */
    BitSet of(int start) {
        BitSet ret = new BitSet(nfa.stateCount());
        expand(start, ret, null);
        return ret;
    }

    /**
     * @param starts
     *            the states to close over
     * @param used
     *            if not null, receives each epsilon edge followed
     * @return the union of the closures of all <code>starts</code>.
     */
    BitSet of(BitSet starts, List<Edge> used) {
        BitSet ret = new BitSet(nfa.stateCount());
        for (int s = starts.nextSetBit(0); s >= 0; s = starts.nextSetBit(s + 1)) {
            expand(s, ret, used);
        }
        return ret;
    }

    /*
     * adds the closure of start to closure; states already in closure are
     * taken as already expanded.
     */
    void expand(int start, BitSet closure, List<Edge> used) {
        if (closure.get(start)) return;
        closure.set(start);
        int sp = 0;
        stack[sp++] = start;
        while (sp > 0) {
            final int s = stack[--sp];
            final int[] heads = nfa.epsilon(s);
            for (int j = 0; j < heads.length; ++j) {
                final int h = heads[j];
                if (used != null) {
                    used.add(new Edge(s, h, nfa.epsilonKind(s, j)));
                }
                if (!closure.get(h)) {
                    closure.set(h);
                    assert sp < stack.length;
                    stack[sp++] = h;
                }
            }
        }
    }
}
