package ctxform.cli;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import ctxform.engine.Logic;

public class MainTest {

    private static List<String> run(String input, String... args) throws IOException {
        final Main main = new Main();
        main.parseArguments(args);

        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final PrintStream out = new PrintStream(bytes, true, "UTF-8");
        main.run(new BufferedReader(new StringReader(input)), out, false);
        out.flush();

        return Arrays.asList(new String(bytes.toByteArray(), StandardCharsets.UTF_8).split("\\R"));
    }

    private static void assertInvalidArguments(String message, String... args) {
        try {
            new Main().parseArguments(args);
            fail();
        } catch (IllegalArgumentException e) {
            assertEquals(message, e.getMessage());
        }
    }

    @Test
    public void testEquivalent() throws IOException {
        final List<String> lines = run("c[p] & c[q]\nc[p & q]\n", "-l", "bool");
        assertEquals(Arrays.asList("c[p] & c[q] =? c[p & q]", "yes"), lines);
    }

    @Test
    public void testIncomparable() throws IOException {
        final List<String> lines = run("p\nq\n", "--logic", "bool");
        assertEquals(Arrays.asList("p =? q", "The two formulas are incomparable.", " ├ Not in R: p ∧ ¬ q",
                " └ Not in L: q ∧ ¬ p"), lines);
    }

    @Test
    public void testCovered() throws IOException {
        final List<String> lines = run("p & q\np\n", "-l", "bool");
        assertEquals("The first formula is covered by the second one (L → R).", lines.get(1));
        assertEquals(" └ Not in L: p ∧ ¬ q", lines.get(2));
        assertEquals(3, lines.size());
    }

    @Test
    public void testWitnesses() throws IOException {
        final List<String> lines = run("c[p]\nc[q]\n", "-l", "bool");
        assertEquals("The two formulas are incomparable.", lines.get(1));
        assertEquals("Witnesses:", lines.get(lines.size() - 2));
        assertEquals(" └ c   ≔  🕳", lines.get(lines.size() - 1));
    }

    @Test
    public void testCheckWithCanonical() throws IOException {
        final List<String> lines = run("c[p]\nc[q]\n", "-l", "bool", "--no-simplify", "--check-with-canonical");
        assertTrue(lines.contains("Witnesses:"));
        assertTrue(lines.get(lines.size() - 1).startsWith(" └ c   ≔  "));
        for (String line : lines)
            assertFalse(line, line.startsWith("warning"));
    }

    @Test
    public void testAlwaysShowWitnesses() throws IOException {
        final List<String> lines = run("c[p] | c[q]\nc[q] | c[p]\n", "-l", "bool", "-w", "yes");
        assertEquals("yes", lines.get(1));
        assertEquals("Witnesses:", lines.get(2));
        assertEquals(" └ c   ≔  ((🕳 → p) → \"c[p]\") ∧ ((🕳 → q) → \"c[q]\")", lines.get(3));
    }

    @Test
    public void testNeverShowWitnesses() throws IOException {
        final List<String> lines = run("c[p]\nc[q]\n", "-l", "bool", "-w", "no");
        assertFalse(lines.contains("Witnesses:"));
    }

    @Test
    public void testGeneratedFormula() throws IOException {
        final List<String> lines = run("c[p]\np\n", "-v", "-l", "bool", "-w", "no");
        assertEquals("Generated formula:", lines.get(1));
        assertEquals("| L = \"c[p]\"", lines.get(2));
        assertEquals("| R = p", lines.get(3));
        assertEquals("| C = true", lines.get(4));
    }

    @Test
    public void testLinearTime() throws IOException {
        final List<String> lines = run("c[p U q] | c[q]\nc[p U q]\nF c[p]\nc[F p]\n");
        assertEquals("c[p U q] | c[q] =? c[p U q]", lines.get(0));
        assertEquals("Could not determine equivalence: no counterexample with at most 8 states.", lines.get(1));
        assertEquals("F c[p] =? c[F p]", lines.get(2));
        assertEquals("The two formulas are incomparable.", lines.get(3));
        assertTrue(lines.get(4).startsWith(" ├ Not in R: "));
        assertTrue(lines.get(5).startsWith(" └ Not in L: "));
    }

    @Test
    public void testBoundedCoverage() throws IOException {
        final List<String> lines = run("p U q\nq\n", "-b", "3", "-w", "no");
        assertEquals("The second formula is covered by the first one (R → L) up to 3 states.", lines.get(1));
        assertTrue(lines.get(2).startsWith(" └ Not in R: "));
        assertEquals(3, lines.size());
    }

    @Test
    public void testSyntaxError() throws IOException {
        final List<String> lines = run("p &\nq\np\nq | \n", "-l", "bool");
        assertEquals(Arrays.asList("left formula: error: unexpected end of formula (column 4)",
                "right formula: error: unexpected end of formula (column 5)"), lines);
    }

    @Test
    public void testInvalidFormula() throws IOException {
        final List<String> lines = run("X p\nq\n", "-l", "bool");
        assertEquals("error: left equation is not valid: not a Boolean formula: X", lines.get(1));
    }

    @Test
    public void testArguments() {
        final Main main = new Main();
        main.parseArguments(new String[] {"-a", "-t", "5", "-l", "BOOL", "--no-simplify", "--bound", "4"});

        assertEquals(Logic.BOOL, main.logic());
        assertFalse(main.options().monotonic());
        assertEquals(5, main.options().timeout());
        assertFalse(main.options().simplify());
        assertEquals(4, main.options().maxTraceLength());
    }

    @Test
    public void testInvalidArguments() {
        assertInvalidArguments("invalid logic: foo", "-l", "foo");
        assertInvalidArguments("invalid witness mode: maybe", "-w", "maybe");
        assertInvalidArguments("invalid timeout: x", "-t", "x");
        assertInvalidArguments("timeout must be positive: 0", "--timeout", "0");
        assertInvalidArguments("invalid bound: many", "-b", "many");
        assertInvalidArguments("trace length must be at least 1: 0", "--bound", "0");
        assertInvalidArguments("missing value for -l", "-l");
        assertInvalidArguments("unknown argument: --bogus", "--bogus");
    }
}
