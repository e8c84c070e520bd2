/* 
 * ctxform -- Copyright (c) 2023-present, the ctxform developers
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package ctxform.engine.ltl;

import ctxform.ast.Formula;
import ctxform.ast.PathFormula;
import ctxform.ast.visitor.AbstractDetector;
import ctxform.engine.Counterexample;
import ctxform.engine.InvalidFormulaException;
import ctxform.engine.Logic;
import ctxform.engine.Problem;
import ctxform.engine.SolverTimeoutException;
import ctxform.engine.bool.BooleanFactory;
import ctxform.engine.config.Options;
import ctxform.engine.config.Reporter;
import ctxform.engine.satlab.SATAbortedException;
import ctxform.engine.satlab.SATSolver;

/**
 * Equivalence problem of LTL formulas with contexts. Counterexamples are
 * searched among the lassos of increasing length up to
 * {@link Options#maxTraceLength()}, and for each length among all loop
 * starts, so the shortest counterexample is found first. The verdict is
 * bounded: when a direction has no counterexample up to the bound, the
 * resulting {@link ctxform.engine.Solution} says so.
 */
public final class LTLProblem extends Problem {

	/**
	 * @throws InvalidFormulaException left or right have path quantifiers
	 */
	public LTLProblem(Formula left, Formula right, Options options) {
		super(check(left, "left"), check(right, "right"), Logic.LTL, options);
	}

	private static Formula check(Formula formula, String side) {
		final Boolean branching = formula.accept(new AbstractDetector() {
			@Override
			public Boolean visit(PathFormula pathFormula) {
				return Boolean.TRUE;
			}
		});
		if (branching)
			throw new InvalidFormulaException(side, new InvalidFormulaException("path quantifiers are not LTL"));
		return formula;
	}

	@Override
	protected Counterexample counterexample(Formula positive, Formula condition, Formula negative) {
		final Reporter reporter = options.reporter();
		final long deadline = System.currentTimeMillis() + options.timeout() * 1000L;

		for (int length = 1; length <= options.maxTraceLength(); length++) {
			for (int loop = 0; loop < length; loop++) {
				final int remaining = (int) ((deadline - System.currentTimeMillis() + 999) / 1000);
				if (remaining <= 0)
					throw new SolverTimeoutException(options.timeout());

				reporter.boundedSearch(loop, length - loop);

				final SATSolver solver = options.solver().instance(remaining);
				try {
					final BooleanFactory factory = new BooleanFactory(solver);
					final LassoTranslator translator = new LassoTranslator(factory, loop, length - loop);

					factory.assertTrue(translator.translate(positive)[0]);
					factory.assertTrue(translator.translate(condition)[0]);
					factory.assertTrue(factory.not(translator.translate(negative)[0]));

					reporter.solvingCNF(translator.propositions() * length, solver.numberOfVariables(),
							solver.numberOfClauses());

					if (solver.solve())
						return translator.lasso();
				} catch (SATAbortedException e) {
					throw new SolverTimeoutException(options.timeout(), e);
				} finally {
					solver.free();
				}
			}
		}

		reporter.warning("no counterexample with at most " + options.maxTraceLength() + " states");
		return null;
	}

	@Override
	protected int bound() {
		return options.maxTraceLength();
	}
}
