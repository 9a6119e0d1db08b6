/*
 * @LICENSE@
 */
package org.posrx.regex;

/**
 * Receives a {@link Step} snapshot from a running {@link Matcher}: once for
 * the initial closure, then once per input symbol consumed. Renderers and
 * animators attach one through {@link Matcher#useTracer(Tracer)}; the
 * outcome of a search never depends on whether one is attached.
 * <p>
 * A tracer may call {@link Matcher#cancel()} to stop the run after the
 * current step.
 */
public interface Tracer {

    void step(Step step);
}
