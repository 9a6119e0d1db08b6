/*
 * @LICENSE@
 */

/**
 * <h3><b>posrx</b> - a small regex engine whose NFA states are the positions
 * of the pattern's tokens.</h3>
 * <p>
 * <h4>How it works.</h4>
 * <p>
 * A pattern is wrapped in one enclosing group and split into tokens; counted
 * repetition (<code>{m,n}</code>) is rewritten into plain copies along the
 * way. A single left-to-right scan over the tokens then produces two
 * relations over token positions: a <em>match</em> relation (consume one
 * symbol, advance one position) and an <em>epsilon</em> relation (move
 * without consuming input) built with a stack of open groups and
 * alternations. No syntax tree is built. The position one past the last token
 * is the accepting state.
 * <p>
 * Matching keeps the whole set of states the automaton could be in and
 * advances all of them together, one input symbol at a time. Since every
 * alternative is tracked at once there is no backtracking, and the well
 * known "pathalogical patterns" which hang backtracking engines run in time
 * linear in the input.
 * <p>
 * <h4>Observing a run.</h4>
 * <p>
 * The automaton's state and edge tables are available read-only from
 * {@link org.posrx.regex.Pattern#automaton()}, each edge tagged with the
 * construct that produced it. A {@link org.posrx.regex.Tracer} attached to a
 * {@link org.posrx.regex.Matcher} receives a {@link org.posrx.regex.Step}
 * snapshot per symbol, which is everything a graph renderer or animator needs.
 * Internals log to the <code>org.posrx.regex</code> logger at FINER and
 * FINEST.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>Russ Cox's <a href="http://swtch.com/~rsc/regexp/regexp1.html">article</a>
 * on finite automata regex matching, and the case for it over backtracking.</li>
 * <li>Sedgewick and Wayne, <i>Algorithms</i>, 4th ed., section 5.4, for the
 * construction of the NFA over the characters of the pattern.</li>
 * </ul>
 */
package org.posrx.regex;
