/*
 * @LICENSE@
 */

package org.posrx.regex;

import java.util.BitSet;

/**
 * A few miscelaneous static constants and helpers shared by the package.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");
    public static final String FS = System.getProperty("file.separator");
    public static final int EOF = -1; // end of char sequence marker

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    /*
     * labels a state set the way the trace output prints it: [0, 1, 4]
     */
    static String statesStringFrom(BitSet states) {
        StringBuilder sb = new StringBuilder();
        sb.append('[');
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            sb.append(sb.length() == 1 ? "" : ", ").append(s);
        }
        sb.append(']');
        return sb.toString();
    }

    /*
     * printable form of a single input symbol for log output
     */
    static String symbolStringFrom(int c) {
        if (c == EOF) return "EOF";
        if (c < 0x20 || c == 0x7f) {
            return String.format("\\u%04x", c);
        }
        return "'" + (char) c + "'";
    }
}
