/*
 * @LICENSE@
 */

package org.posrx.regex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An immutable value class representing the contents of a bracketed
 * character class, e.g. <code>[A-Za-z_]</code>. (Not to be confused with
 * <code>class Character</code> - we're talking the regex sense of the term
 * "character class" here.)
 * <p>
 * The set of characters is held as a sorted array of disjoint, inclusive
 * {@link Interval}s which the {@link Builder} keeps in canonical form. The
 * raw interior text the client wrote is kept as well, so that renderers can
 * label the state with exactly what the pattern said.
 */
public final class CharClass {

    static final class Interval implements Comparable<Interval> {

        final char first;
        final char last;    // inclusive

        Interval(char first, char last) {
            assert first <= last : first + ">" + last;
            this.first = first;
            this.last = last;
        }

        boolean contains(int c) {
            return first <= c && c <= last;
        }

        public int compareTo(Interval ci) {
            return first != ci.first ? first - ci.first : last - ci.last;
        }

        @Override
        public int hashCode() {
            return (first << 16) | last;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Interval)) return false;
            Interval ci = (Interval) o;
            return first == ci.first && last == ci.last;
        }

        @Override
        public String toString() {
            return first == last ? String.valueOf(first) : first + "-" + last;
        }
    }

    /**
     * Accumulates characters and ranges; adjacent and overlapping intervals
     * are merged when the CharClass is built.
     */
    static final class Builder {

        private final List<Interval> cil = new ArrayList<Interval>();
        private boolean negated = false;

        Builder add(char c) {
            return add(c, c);
        }

        Builder add(char first, char last) {
            if (first > last) {
                throw new IllegalArgumentException(
                    "non-ascending range: " + first + '-' + last);
            }
            cil.add(new Interval(first, last));
            return this;
        }

        Builder negate() {
            negated = !negated;
            return this;
        }

        boolean isEmpty() {
            return cil.isEmpty();
        }

        CharClass build(String spec) {
            Collections.sort(cil);
            List<Interval> merged = new ArrayList<Interval>(cil.size());
            Interval prev = null;
            for (Interval ci : cil) {
                if (prev != null && ci.first <= prev.last + 1) {
                    if (ci.last > prev.last) {
                        prev = new Interval(prev.first, ci.last);
                        merged.set(merged.size() - 1, prev);
                    }
                } else {
                    merged.add(ci);
                    prev = ci;
                }
            }
            return new CharClass(spec, negated,
                merged.toArray(new Interval[merged.size()]));
        }
    }

    private final String spec;
    private final boolean negated;
    private final Interval[] cia;

    private CharClass(String spec, boolean negated, Interval[] cia) {
        this.spec = spec;
        this.negated = negated;
        this.cia = cia;
    }

    /**
     * Parses the interior of a bracket expression (the text between
     * <code>[</code> and <code>]</code>). A leading <code>^</code> negates
     * the class. A <code>-</code> between two characters denotes an
     * inclusive range; at either end it is just another member.
     * 
     * @param spec
     *            the interior text
     * @return the character class
     * @throws IllegalArgumentException
     *             if a range is non-ascending
     */
    static CharClass parse(String spec) {
        Builder ccb = new Builder();
        int i = 0;
        if (spec.length() > 1 && spec.charAt(0) == '^') {
            ccb.negate();
            i = 1;
        }
        for (; i < spec.length(); ++i) {
            char c = spec.charAt(i);
            if (i + 2 < spec.length() && spec.charAt(i + 1) == '-') {
                ccb.add(c, spec.charAt(i + 2));
                i += 2;
            } else {
                ccb.add(c);
            }
        }
        return ccb.build(spec);
    }

    /**
     * @return the raw interior text this class was parsed from.
     */
    public String spec() {
        return spec;
    }

    public boolean isNegated() {
        return negated;
    }

    public boolean contains(int c) {
        int lo = 0;
        int hi = cia.length;
        boolean ret = false;
        while (lo < hi) {
            int m = (lo + hi) >>> 1;
            if (cia[m].last < c) {
                lo = m + 1;
            } else if (c < cia[m].first) {
                hi = m;
            } else {
                ret = true;
                break;
            }
        }
        return ret != negated;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cia) * 31 + (negated ? 1 : 0);
    }

    /**
     * Two classes are equal if they contain the same characters; the raw
     * spec is not compared, so <code>[a-c]</code> equals <code>[cba]</code>.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharClass)) return false;
        CharClass cc = (CharClass) o;
        return negated == cc.negated && Arrays.equals(cia, cc.cia);
    }

    @Override
    public String toString() {
        return '[' + spec + ']';
    }
}
