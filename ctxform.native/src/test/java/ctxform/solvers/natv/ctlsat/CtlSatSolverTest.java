package ctxform.solvers.natv.ctlsat;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assume.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ctxform.engine.AbortedException;
import ctxform.engine.SolverTimeoutException;

public class CtlSatSolverTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private CtlSatSolver script(String body) throws IOException {
        assumeTrue(!System.getProperty("os.name").toLowerCase().startsWith("windows"));
        final File file = folder.newFile("ctl-sat");
        Files.write(file.toPath(), ("#!/bin/sh\n" + body + "\n").getBytes(StandardCharsets.UTF_8));
        assumeTrue(file.setExecutable(true));
        return new CtlSatSolver(file);
    }

    @Test
    public void testParseSatisfiable() {
        assertEquals(Boolean.TRUE, CtlSatSolver.parse("Parsing formula\nThe formula is satisfable\n"));
    }

    @Test
    public void testParseUnsatisfiable() {
        assertEquals(Boolean.FALSE, CtlSatSolver.parse("Parsing formula\nThe formula is NOT satisfable\n"));
    }

    @Test
    public void testParseUnexpected() {
        assertNull(CtlSatSolver.parse("Segmentation fault\n"));
        assertNull(CtlSatSolver.parse(""));
        // the verdict must be on the penultimate line
        assertNull(CtlSatSolver.parse("satisfable\nsomething else\n"));
    }

    @Test
    public void testRunSatisfiable() throws IOException {
        final CtlSatSolver solver = script("echo \"$1\"\necho 'The formula is satisfable'");
        assertTrue(solver.satisfiable("(# ^ (~ $))", 10));
    }

    @Test
    public void testRunUnsatisfiable() throws IOException {
        final CtlSatSolver solver = script("echo 'The formula is NOT satisfable'");
        assertFalse(solver.satisfiable("(# ^ ~ #)", 10));
    }

    @Test(expected = AbortedException.class)
    public void testNonZeroExit() throws IOException {
        script("echo 'The formula is satisfable'\nexit 3").satisfiable("#", 10);
    }

    @Test(expected = AbortedException.class)
    public void testUnexpectedOutput() throws IOException {
        script("echo 'syntax error'").satisfiable("#", 10);
    }

    @Test(expected = SolverTimeoutException.class)
    public void testTimeout() throws IOException {
        script("sleep 10").satisfiable("#", 1);
    }
}
