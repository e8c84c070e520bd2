package ctxform.cli;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

import ctxform.ast.Formula;
import ctxform.engine.AbortedException;
import ctxform.engine.InvalidFormulaException;
import ctxform.engine.Logic;
import ctxform.engine.Problem;
import ctxform.engine.Solution;
import ctxform.engine.WitnessCheck;
import ctxform.engine.Witnesses;
import ctxform.engine.config.ConsoleReporter;
import ctxform.engine.config.Options;
import ctxform.engine.ctl.TooManyVariablesException;
import ctxform.parser.ErrorSyntax;
import ctxform.parser.FormulaParser;
import ctxform.solvers.natv.ctlsat.CtlSatSolver;

/**
 * Interactive front end: reads pairs of lines with the left and right
 * formulas and tells whether they are equivalent for every (monotonic)
 * choice of their contexts, showing counterexamples and witnesses when they
 * are not.
 */
public final class Main {

    enum Witness {
        YES,
        NO,
        AUTO
    }

    private final Options options = new Options();
    private Logic         logic   = Logic.LTL;
    private Witness       witness = Witness.AUTO;
    private int           verbosity;
    private boolean       checkWithCanonical;
    private File          ctlSat;

    Main() {}

    public static void main(String[] args) {
        final Main main = new Main();
        try {
            main.parseArguments(args);
        } catch (IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            usage(System.err);
            System.exit(2);
            return;
        }

        final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            main.run(in, System.out, System.console() != null);
        } catch (IOException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        }
    }

    static void usage(PrintStream out) {
        out.println("usage: ctxform [-v] [-a] [-l {ltl,bool,ctl}] [-w {yes,no,auto}] [-t SECONDS]");
        out.println("               [-b STATES] [--no-simplify] [--check-with-canonical] [--ctl-sat PATH]");
        out.println();
        out.println("Check equivalence of formulas in LTL/CTL with contexts");
        out.println();
        out.println("  -v                      increase verbosity");
        out.println("  -a, --any-formula       check the equivalence for any formula, not just monotonic ones");
        out.println("  -l, --logic LOGIC       restrict to the given logic (ltl, bool, ctl)");
        out.println("  -w, --witness WHEN      when to show the context witness of non-equivalence");
        out.println("  -t, --timeout SECONDS   timeout of every solver call");
        out.println("  -b, --bound STATES      longest lasso searched for LTL counterexamples");
        out.println("  --no-simplify           avoid simplifying the canonical context");
        out.println("  --check-with-canonical  check equivalence with the canonical instantiation too");
        out.println("  --ctl-sat PATH          path of the ctl-sat executable");
    }

    /**
     * @throws IllegalArgumentException the arguments are not valid
     */
    void parseArguments(String[] args) {
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            switch (arg) {
                case "-v" :
                    verbosity++;
                    break;
                case "-vv" :
                    verbosity += 2;
                    break;
                case "-a" :
                case "--any-formula" :
                    options.setMonotonic(false);
                    break;
                case "-l" :
                case "--logic" : {
                    final String name = value(args, ++i, arg);
                    try {
                        logic = Logic.forName(name);
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("invalid logic: " + name);
                    }
                    break;
                }
                case "-w" :
                case "--witness" : {
                    final String mode = value(args, ++i, arg);
                    try {
                        witness = Witness.valueOf(mode.toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("invalid witness mode: " + mode);
                    }
                    break;
                }
                case "-t" :
                case "--timeout" : {
                    final String seconds = value(args, ++i, arg);
                    try {
                        options.setTimeout(Integer.parseInt(seconds));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("invalid timeout: " + seconds);
                    }
                    break;
                }
                case "-b" :
                case "--bound" : {
                    final String states = value(args, ++i, arg);
                    try {
                        options.setMaxTraceLength(Integer.parseInt(states));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("invalid bound: " + states);
                    }
                    break;
                }
                case "--no-simplify" :
                    options.setSimplify(false);
                    break;
                case "--check-with-canonical" :
                    checkWithCanonical = true;
                    break;
                case "--ctl-sat" :
                    ctlSat = new File(value(args, ++i, arg));
                    break;
                case "-h" :
                case "--help" :
                    usage(System.out);
                    System.exit(0);
                    break;
                default :
                    throw new IllegalArgumentException("unknown argument: " + arg);
            }
        }

        if (verbosity >= 2)
            options.setReporter(new ConsoleReporter());

        if (logic == Logic.CTL) {
            final File executable = ctlSat != null ? ctlSat : CtlSatSolver.locate().orElse(null);
            if (executable != null)
                options.setCTLSolver(new CtlSatSolver(executable, options.reporter()));
        }
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length)
            throw new IllegalArgumentException("missing value for " + flag);
        return args[i];
    }

    Options options() {
        return options;
    }

    Logic logic() {
        return logic;
    }

    /**
     * Reads pairs of formulas until the end of the input and reports on each.
     */
    void run(BufferedReader in, PrintStream out, boolean interactive) throws IOException {
        final FormulaParser parser = new FormulaParser(logic == Logic.CTL);

        while (true) {
            if (interactive)
                out.print("(L)> ");
            final String leftText = in.readLine();
            if (leftText == null)
                return;
            if (interactive)
                out.print("(R)> ");
            final String rightText = in.readLine();
            if (rightText == null)
                return;

            String side = "left";
            final Formula left, right;
            try {
                left = parser.parse(leftText);
                side = "right";
                right = parser.parse(rightText);
            } catch (ErrorSyntax e) {
                out.println(side + " formula: error: " + e.getMessage() + " (column " + e.column + ")");
                continue;
            }

            if (!interactive)
                out.println(leftText + " =? " + rightText);

            check(left, right, out);
        }
    }

    /**
     * Checks and reports on a single pair of formulas.
     */
    void check(Formula left, Formula right, PrintStream out) {
        final Problem problem;
        final Solution solution;
        try {
            problem = logic.problem(left, right, options);
            if (verbosity >= 1) {
                out.println("Generated formula:");
                out.println("| L = " + problem.translation().left());
                out.println("| R = " + problem.translation().right());
                out.println("| C = " + problem.translation().condition());
            }
            solution = problem.solve();
        } catch (InvalidFormulaException | TooManyVariablesException | AbortedException e) {
            out.println("error: " + e.getMessage());
            return;
        }

        if (solution.equivalent()) {
            if (solution.bounded())
                out.println("Could not determine equivalence: no counterexample with at most " + solution.bound() + " states.");
            else
                out.println("yes");
        } else {
            if (solution.leftNotRight() == null)
                out.println("The first formula is covered by the second one (L → R)" + upTo(solution) + ".");
            else if (solution.rightNotLeft() == null)
                out.println("The second formula is covered by the first one (R → L)" + upTo(solution) + ".");
            else
                out.println("The two formulas are incomparable.");

            if (solution.leftNotRight() != null)
                out.println(" " + (solution.rightNotLeft() != null ? "├" : "└") + " Not in R: " + solution.leftNotRight());
            if (solution.rightNotLeft() != null)
                out.println(" └ Not in L: " + solution.rightNotLeft());
        }

        if (witness == Witness.YES || (witness == Witness.AUTO && !solution.equivalent())) {
            final Witnesses witnesses;
            boolean holds = solution.equivalent();

            try {
                if (checkWithCanonical) {
                    final WitnessCheck check = problem.solveWithContext(options.simplify());
                    witnesses = check.witnesses();
                    holds = check.equivalent();
                } else {
                    witnesses = problem.canonicalContext(options.simplify());
                }
            } catch (AbortedException e) {
                out.println("error: " + e.getMessage());
                return;
            }

            if (!witnesses.context().isEmpty()) {
                if (witnesses.isSplit()) {
                    showWitnesses(" for L → R", witnesses.context(), out);
                    showWitnesses(" for R → L", witnesses.alternative(), out);
                } else {
                    showWitnesses("", witnesses.context(), out);
                }
                if (holds != solution.equivalent())
                    out.println("warning: the result with the substitution method (" + holds + ") does not coincide.");
            }
        }
    }

    private static String upTo(Solution solution) {
        return solution.bounded() ? " up to " + solution.bound() + " states" : "";
    }

    private static void showWitnesses(String title, Map<String,Formula> context, PrintStream out) {
        out.println("Witnesses" + title + ":");
        int k = 0;
        for (Map.Entry<String,Formula> entry : context.entrySet()) {
            final String marker = ++k == context.size() ? " └" : " ├";
            out.println(String.format("%s %-3s ≔  %s", marker, entry.getKey(), entry.getValue()));
        }
    }
}
