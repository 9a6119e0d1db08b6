/* @LICENSE@  
 */

package org.posrx.regex.test;

import static org.posrx.regex.RegexAssert.*;

import org.posrx.regex.AbstractRxTestCase;
import org.posrx.regex.Matcher;
import org.posrx.regex.Pattern;
import org.posrx.regex.RegexSyntaxException;
import org.posrx.regex.RegexSyntaxException.Kind;

public class MatcherTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(MatcherTestCase.class);
    }

    public MatcherTestCase(String name) {
        super(name);
    }

    public void testLiteral() {
        assertSearch("Python", "Python");
        assertNoSearch("Python", "python");
        assertSearch("", "");
        assertSearch("", "anything");
        assertNoSearch("abc", "ab");
    }

    public void testPrefixAnchored() {
        assertSearch("ab", "abc");
        assertNoSearch("ab", "xab");
        assertEquals(2, endOf("ab", "abcabc"));
    }

    public void testAlternation() {
        assertSearch("(P|p)ython", "Python");
        assertSearch("(P|p)ython", "python");
        assertNoSearch("(P|p)ython", "Pp");
        assertNoSearch("(P|p)ython", "ython");
        assertSearch("(P|p|c)ython", "cython");
        assertNoSearch("(P|p|c)ython", "mython");
        assertSearch("cat|dog", "dog");
        assertSearch("cat|dog", "catalog");
        assertNoSearch("cat|dog", "cow");
    }

    public void testStar() {
        assertSearch("s*nake", "snake");
        assertSearch("s*nake", "sssnake");
        assertSearch("s*nake", "nake");
        assertNoSearch("s*nake", "ake");
        assertNoSearch("s*nake", "shake");
        assertSearch("(Green)*Snake", "GreenGreenSnake");
        assertSearch("(Green)*Snake", "Snake");
        assertNoSearch("(Green)*Snake", "GreeSnake");
    }

    public void testPlus() {
        assertSearch("No+", "No");
        assertSearch("No+", "Nooooo");
        assertSearch("No+", "Nooooooo");
        assertNoSearch("No+", "N");
        assertSearch("((a|b)c)+d", "acbcd");
        assertSearch("((a|b)c)+d", "acd");
        assertNoSearch("((a|b)c)+d", "d");
    }

    public void testOptional() {
        assertSearch("(Doctor)?Smith", "DoctorSmith");
        assertSearch("(Doctor)?Smith", "Smith");
        assertNoSearch("(Doctor)?Smith", "DocSmith");
        assertNoSearch("(Doctor)?Smith", "DoctorDoctorSmith");
    }

    public void testWildcard() {
        assertSearch(".*orange.*", "I like orange juice");
        assertNoSearch(".*orange.*", "I like apples");
        assertSearch(".*X...Xii", "hi my name is XÆA-Xii");
        assertSearch("a.c", "a\nc");
    }

    public void testCharClass() {
        assertSearch("[A-Z]nt[0-9]", "Ant8");
        assertNoSearch("[A-Z]nt[0-9]", "ant8");
        assertSearch("[^0-9]x", "ax");
        assertNoSearch("[^0-9]x", "1x");
        assertSearch("[^a]", "^");
        assertNoSearch("[^a]", "a");
        assertSearch("[a^]", "^");
        assertSearch("\\^", "^");
        assertSearch("[a-]+b", "-a-b");
        assertSearch("[]]", "]");
        assertSearch("[.*]+", "*.*");
        assertNoSearch("[.*]", "a");
    }

    public void testCountedRepetition() {
        assertSearch("Hap{2,7}y Days", "Happpy Days");
        assertSearch("Hap{2,7}y Days", "Happppppy Days");
        assertNoSearch("Hap{2,7}y Days", "Hapy Days");
        assertNoSearch("Hap{2,4}y Days", "Happpppy Days");
        assertSearch("x{3}", "xxx");
        assertNoSearch("x{3}", "xx");
        assertSearch("ab{2,}c", "abbbbc");
        assertNoSearch("ab{2,}c", "abc");
        assertSearch("(ab){2,3}c", "ababc");
        assertSearch("(ab){2,3}c", "abababc");
        assertNoSearch("(ab){2,3}c", "abc");
        assertNoSearch("(ab){2,3}c", "ababababc");
        assertNoSearch("xa{2}y", "xaaay");
        assertSearch("x(a{2})*y", "xaaaay");
        assertNoSearch("x(a{2})*y", "xaaay");
        assertSearch("[0-9]{4}-[0-9]{2}", "2026-10");
    }

    public void testEscapes() {
        assertSearch("a\\*b", "a*b");
        assertNoSearch("a\\*b", "aab");
        assertSearch("\\(x\\)", "(x)");
        assertSearch("\\\\", "\\");
        assertSearch("1\\.5", "1.5");
        assertNoSearch("1\\.5", "125");
        assertSearch("a\\{b", "a{b");
    }

    public void testShortestPrefix() {
        assertEquals(1, endOf("a+", "aaaa"));
        assertEquals(0, endOf("a*", "aaaa"));
        assertEquals(2, endOf("(ab|abc)d?", "abcd"));
        assertEquals(4, endOf("(ab|abc)d", "abcd"));
    }

    public void testLongInput() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 100000; ++i) {
            sb.append(i % 2 == 0 ? 'a' : 'b');
        }
        String ab = sb.toString();
        assertNoSearch("(a|b)*c", ab);
        assertSearch("(a|b)*c", ab + "c");
        // would take exponential time with a backtracking engine
        assertNoSearch("(a*)*c", "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa");
    }

    public void testJavaAgrees() {
        String[] regexes = {
            "foo", "fo*", "fo+", "fo?o?", "x|y?", "(ab)*a", "foo|bar",
            "(a|b)(a|b)(a|b)", "[a-c]+d", "[^a-c]+d", "a{2,3}b", "(ab){2}",
            "(a|bc)+d", "(x+x+)+y",
        };
        String[] inputs = {
            "", "a", "foobar", "zbarfoo", "x", "y", "ab", "aab", "abcd",
            "xyzd", "aaab", "abab", "bcad", "xxxxy", "xxxx",
        };
        for (String regex : regexes) {
            for (String csq : inputs) {
                assertJavaLookingAt(regex, csq);
            }
        }
    }

    public void testIndependentMatchers() {
        Pattern p = Pattern.compile("a+b");
        Matcher m0 = p.matcher("aaab");
        Matcher m1 = p.matcher("aaac");
        assertTrue(m0.lookingAt());
        assertFalse(m1.lookingAt());
        assertEquals(4, m0.end());
        assertSame(p, m1.pattern());
    }

    public void testSyntaxErrors() {
        assertSyntaxError(Kind.UNBALANCED_PARENTHESIS, "(ab");
        assertSyntaxError(Kind.UNBALANCED_PARENTHESIS, "ab)");
        assertSyntaxError(Kind.UNBALANCED_BRACKET, "[ab");
        assertSyntaxError(Kind.MALFORMED_REPETITION, "a{2");
        assertSyntaxError(Kind.MALFORMED_REPETITION, "a{3,2}");
        assertSyntaxError(Kind.INVALID_RANGE, "[z-a]");
        assertSyntaxError(Kind.DANGLING_ESCAPE, "ab\\");
        RegexSyntaxException e = assertSyntaxError(Kind.UNBALANCED_BRACKET, "x[ab");
        assertEquals(1, e.getIndex());
    }

    public void testNull() {
        try {
            Pattern.compile(null);
            fail("should throw");
        } catch (NullPointerException e) {}
        try {
            Pattern.compile("a").matcher(null);
            fail("should throw");
        } catch (NullPointerException e) {}
    }

    private static int endOf(String regex, String csq) {
        Matcher m = Pattern.compile(regex).matcher(csq);
        assertTrue(m.lookingAt());
        return m.end();
    }
}
