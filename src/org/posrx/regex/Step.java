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

import org.posrx.regex.NFA.Edge;

/**
 * An immutable snapshot of one simulation step, handed to a {@link Tracer}.
 * The initial step, taken before any input is consumed, has index -1 and
 * symbol {@link #NO_SYMBOL}, and no matched states or consumed edges.
 */
public final class Step {

    public static final int NO_SYMBOL = EOF;

    private final int index;
    private final int symbol;
    private final BitSet active;
    private final BitSet matched;
    private final List<Edge> consumed;
    private final List<Edge> epsilonUsed;
    private final boolean accepting;

    Step(int index, int symbol, BitSet active, BitSet matched,
            List<Edge> consumed, List<Edge> epsilonUsed, boolean accepting) {
        this.index = index;
        this.symbol = symbol;
        this.active = (BitSet) active.clone();
        this.matched = (BitSet) matched.clone();
        this.consumed = Collections.unmodifiableList(new ArrayList<Edge>(consumed));
        this.epsilonUsed = Collections.unmodifiableList(new ArrayList<Edge>(epsilonUsed));
        this.accepting = accepting;
    }

    /**
     * @return the offset in the input of the symbol consumed by this step.
     */
    public int index() {
        return index;
    }

    public int symbol() {
        return symbol;
    }

    /**
     * @return the active-state set after this step (a copy).
     */
    public BitSet activeStates() {
        return (BitSet) active.clone();
    }

    /**
     * @return the states whose token accepted the symbol (a copy).
     */
    public BitSet matchedStates() {
        return (BitSet) matched.clone();
    }

    public List<Edge> consumedEdges() {
        return consumed;
    }

    public List<Edge> epsilonEdgesUsed() {
        return epsilonUsed;
    }

    /**
     * @return true if the accepting state is among the active states.
     */
    public boolean isAccepting() {
        return accepting;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("{i=").append(index).append(',')
          .append("c=").append(symbolStringFrom(symbol)).append(',')
          .append("matched=").append(statesStringFrom(matched)).append(',')
          .append("active=").append(statesStringFrom(active))
          .append(accepting ? ",ACCEPT}" : "}");
        return sb.toString();
    }
}
