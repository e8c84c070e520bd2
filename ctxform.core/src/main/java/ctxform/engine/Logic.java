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
package ctxform.engine;

import java.util.Locale;

import ctxform.ast.Formula;
import ctxform.engine.bool.BoolProblem;
import ctxform.engine.config.Options;
import ctxform.engine.ctl.CTLProblem;
import ctxform.engine.ltl.LTLProblem;

/**
 * The logics whose formulas can be checked for equivalence. Each logic wraps
 * the premises of consistency clauses so that they are required in every
 * state the contexts may be evaluated at.
 */
public enum Logic implements PremiseWrapper {

	/** Propositional logic: premises are taken as they are. */
	BOOL {
		@Override
		public Formula wrap(Formula premise) {
			return premise;
		}

		@Override
		public Problem problem(Formula left, Formula right, Options options) {
			return new BoolProblem(left, right, options);
		}
	},

	/** Linear temporal logic: premises must hold globally. */
	LTL {
		@Override
		public Formula wrap(Formula premise) {
			return premise.always();
		}

		@Override
		public Problem problem(Formula left, Formula right, Options options) {
			return new LTLProblem(left, right, options);
		}
	},

	/** Computation tree logic: premises must hold globally in every path. */
	CTL {
		@Override
		public Formula wrap(Formula premise) {
			return premise.always().forAll();
		}

		@Override
		public Problem problem(Formula left, Formula right, Options options) {
			return new CTLProblem(left, right, options);
		}
	};

	/**
	 * Creates the equivalence problem of the given formulas in this logic.
	 *
	 * @throws InvalidFormulaException left or right are not formulas of this
	 *             logic
	 */
	public abstract Problem problem(Formula left, Formula right, Options options);

	/**
	 * Returns the logic with the given case-insensitive name.
	 *
	 * @throws IllegalArgumentException no logic has that name
	 */
	public static Logic forName(String name) {
		return valueOf(name.toUpperCase(Locale.ROOT));
	}
}
