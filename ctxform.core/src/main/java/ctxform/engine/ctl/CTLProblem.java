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
package ctxform.engine.ctl;

import java.util.Map;

import ctxform.ast.Formula;
import ctxform.engine.AbortedException;
import ctxform.engine.Counterexample;
import ctxform.engine.InvalidFormulaException;
import ctxform.engine.Logic;
import ctxform.engine.Problem;
import ctxform.engine.config.Options;

/**
 * Equivalence problem of CTL formulas with contexts, decided by the external
 * {@link CTLSolver} of the options. The formulas are checked and adapted to
 * the operators of ctl-sat before their contexts are eliminated. The solver
 * gives no model, so counterexamples carry no information and witnesses are
 * never simplified.
 */
public final class CTLProblem extends Problem {

	/** The counterexample of every non-equivalence. */
	private static final Counterexample NO_INFO = new Counterexample() {
		@Override
		public Map<String, Boolean> valuation() {
			return null;
		}

		@Override
		public String toString() {
			return "no more info";
		}
	};

	private final CTLEncoder encoder = new CTLEncoder();

	/**
	 * @throws InvalidFormulaException left or right are not in the CTL
	 *             fragment ctl-sat accepts
	 */
	public CTLProblem(Formula left, Formula right, Options options) {
		super(prepare(left, "left"), prepare(right, "right"), Logic.CTL, options);
	}

	private static Formula prepare(Formula formula, String side) {
		try {
			CTLChecker.check(formula);
		} catch (InvalidFormulaException e) {
			throw new InvalidFormulaException(side, e);
		}
		return CTLAdapter.adapt(formula);
	}

	@Override
	protected Counterexample counterexample(Formula positive, Formula condition, Formula negative) {
		final CTLSolver solver = options.ctlSolver();
		if (solver == null)
			throw new AbortedException("no CTL satisfiability checker configured");

		// the condition of arbitrary contexts has equivalences
		final String query = "(" + encode(positive) + ") ^ (" + encode(condition) + ") ^ (~ " + encode(negative) + ")";
		options.reporter().debug("ctl-sat query: " + query);

		return solver.satisfiable(query, options.timeout()) ? NO_INFO : null;
	}

	private String encode(Formula formula) {
		return encoder.encode(CTLAdapter.adapt(formula));
	}

	@Override
	protected boolean simplifiable() {
		return false;
	}

	/**
	 * Returns the characters the propositions have been encoded with so far.
	 */
	public Map<String, Character> encoding() {
		return encoder.variables();
	}
}
