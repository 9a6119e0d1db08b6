/*
 * @LICENSE@
 */
package org.posrx.regex;

import static org.posrx.regex.Misc.LS;
import static org.posrx.regex.Misc.clear;

import java.util.concurrent.CancellationException;

/**
 * Runs a compiled {@link Pattern} against one input sequence. Note that like
 * the analagous {@link java.util.regex.Matcher} class of the standard regex
 * package, instances of this class are <em>not</em> thread safe - it is the
 * responsibility of the client to ensure that the methods of an instance are
 * not re-entered. The one exception is {@link #cancel()}, which may be called
 * from any thread.
 * <p>
 * A search asks whether the pattern accepts some prefix of the input: the
 * match is anchored at the start of the input but need not reach its end.
 */
public final class Matcher {

    /**
     * The result of a {@link Matcher#search()}.
     */
    public enum Outcome {
        /** the accepting state was reached on some prefix of the input */
        MATCH,
        /** the input was exhausted, or every state died, without acceptance */
        NO_MATCH,
        /** {@link Matcher#cancel()} was seen before the search finished */
        CANCELLED;
    }

    private Pattern pattern;
    private NFAsimulator simulator;

    /*
     * read and written by NFAsimulator.eval()
     */
    CharSequence csq;
    Tracer tracer = null;
    Outcome outcome = null;
    int end = -1;

    private volatile boolean cancelled = false;
    private final StringBuilder sb = new StringBuilder();

    Matcher(Pattern pattern, CharSequence csq) {
        usePattern(pattern);
        reset(csq);
    }

    public Pattern pattern() {
        return pattern;
    }

    /**
     * Runs the automaton over the input.
     * 
     * @return the outcome, also available afterwards from {@link #outcome()}.
     */
    public Outcome search() {
        outcome = null;
        end = -1;
        simulator.eval(this);
        assert outcome != null;
        return outcome;
    }

    /**
     * @return true if the pattern accepts some prefix of the input.
     * @throws CancellationException
     *             if the search was cancelled before it could decide.
     */
    public boolean lookingAt() {
        switch (search()) {
        case MATCH:
            return true;
        case NO_MATCH:
            return false;
        default:
            throw new CancellationException("search cancelled: " + pattern);
        }
    }

    /**
     * @return the outcome of the last search, or null if there has been none
     *         since the last reset.
     */
    public Outcome outcome() {
        return outcome;
    }

    /**
     * @return the offset just past the shortest accepted prefix.
     * @throws IllegalStateException
     *             if the last search did not match.
     */
    public int end() {
        if (outcome != Outcome.MATCH) {
            throw new IllegalStateException("no match");
        }
        return end;
    }

    /**
     * Attaches a tracer which receives a {@link Step} per symbol consumed;
     * null detaches.
     * 
     * @return this Matcher (useful for invocation chaining)
     */
    public Matcher useTracer(Tracer tracer) {
        this.tracer = tracer;
        return this;
    }

    /**
     * Sets a new Pattern for the Matcher to use. The input and tracer are
     * kept; the last outcome is discarded.
     * 
     * @param newPattern
     *            the pattern to attach this Matcher to.
     * @return this Matcher (useful for invocation chaining)
     */
    public Matcher usePattern(Pattern newPattern) {
        if (newPattern == null) {
            throw new IllegalArgumentException("newPattern is null");
        }
        pattern = newPattern;
        simulator = new NFAsimulator(newPattern.nfa);
        outcome = null;
        end = -1;
        return this;
    }

    /**
     * Asks a running or future search to stop before its next symbol. The
     * request stays in force until {@link #reset()}.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Matcher reset() {
        return reset(csq);
    }

    public Matcher reset(CharSequence csq) {
        if (csq == null) {
            throw new NullPointerException("csq");
        }
        this.csq = csq;
        outcome = null;
        end = -1;
        cancelled = false;
        return this;
    }

    @Override
    public String toString() {
        clear(sb);
        sb.append("pattern=").append(pattern).append(LS)
          .append("input=").append(csq).append(LS)
          .append("outcome=").append(outcome).append(LS)
          .append("end=").append(end).append(LS);
        return sb.toString();
    }
}
