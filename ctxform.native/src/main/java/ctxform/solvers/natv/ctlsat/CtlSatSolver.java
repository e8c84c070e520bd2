package ctxform.solvers.natv.ctlsat;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import ctxform.engine.AbortedException;
import ctxform.engine.SolverTimeoutException;
import ctxform.engine.config.AbstractReporter;
import ctxform.engine.config.Reporter;
import ctxform.engine.ctl.CTLSolver;

/**
 * Runs the ctl-sat executable (https://github.com/nicolaprezza/CTLSAT) on a
 * formula given as its only argument. The verdict is read from the
 * penultimate line of its output, which contains "satisfable" or "NOT
 * satisfable" (sic).
 */
public final class CtlSatSolver implements CTLSolver {

    /** System property with the path of the executable. */
    public static final String PATH_PROPERTY = "ctxform.ctlsat";

    /** Name of the executable looked up in the PATH. */
    public static final String EXECUTABLE    = "ctl-sat";

    private final File                        executable;
    private final Reporter                    reporter;

    public CtlSatSolver(File executable, Reporter reporter) {
        if (executable == null || reporter == null)
            throw new NullPointerException();
        this.executable = executable;
        this.reporter = reporter;
    }

    public CtlSatSolver(File executable) {
        this(executable, AbstractReporter.SILENT);
    }

    /**
     * Looks for the executable at the path given by the
     * {@value #PATH_PROPERTY} system property, in the bin directory of the
     * working directory, and then in the directories of the PATH.
     */
    public static Optional<File> locate() {
        final String configured = System.getProperty(PATH_PROPERTY);
        if (configured != null) {
            final File file = new File(configured);
            return file.canExecute() ? Optional.of(file) : Optional.empty();
        }

        final List<File> candidates = new ArrayList<>();
        candidates.add(new File("bin", EXECUTABLE));
        final String path = System.getenv("PATH");
        if (path != null) {
            for (String dir : path.split(File.pathSeparator))
                candidates.add(new File(dir, EXECUTABLE));
        }

        for (File candidate : candidates) {
            if (candidate.isFile() && candidate.canExecute())
                return Optional.of(candidate);
        }
        return Optional.empty();
    }

    public File executable() {
        return executable;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean satisfiable(String formula, int timeout) {
        Process process = null;
        String output = null;
        Exception exception = null;
        int exitCode = Integer.MAX_VALUE;
        final List<String> args = new ArrayList<>();
        args.add(executable.getAbsolutePath());
        args.add(formula);

        File out = null;
        try {
            out = File.createTempFile("ctlsat", ".out");
            final ProcessBuilder processBuilder = new ProcessBuilder(args);
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectOutput(out);
            reporter.debug("starting ctl-sat process with : " + args);

            process = processBuilder.start();
            if (!process.waitFor(timeout, TimeUnit.SECONDS))
                throw new SolverTimeoutException(timeout);

            exitCode = process.exitValue();
            output = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);

            if (exitCode == 0) {
                final Boolean verdict = parse(output);
                if (verdict != null)
                    return verdict;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exception = e;
        } catch (IOException e) {
            exception = e;
        } finally {
            if (process != null)
                process.destroyForcibly();
            if (out != null && !out.delete())
                out.deleteOnExit();
        }

        final String report = "ctl-sat exit code: " + exitCode + ":\n  args=" + String.join(" ", args) + "\n  output=" + output;
        reporter.debug(report);
        throw exception == null ? new AbortedException(report) : new AbortedException(report, exception);
    }

    /**
     * Returns the verdict of the given output of ctl-sat, or null if it has
     * no verdict line.
     */
    static Boolean parse(String output) {
        final String[] lines = output.split("\n", -1);
        if (lines.length < 2)
            return null;

        final String verdict = lines[lines.length - 2];
        if (!verdict.contains("satisfable"))
            return null;

        return !verdict.contains("NOT satisfable");
    }

    @Override
    public String toString() {
        return "ctl-sat (" + executable + ")";
    }
}
