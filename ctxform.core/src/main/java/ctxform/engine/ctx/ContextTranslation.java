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
package ctxform.engine.ctx;

import java.util.LinkedHashMap;
import java.util.Map;

import ctxform.ast.Formula;
import ctxform.engine.PremiseWrapper;
import ctxform.engine.simp.Simplifier;

/**
 * The result of eliminating the contexts of a pair of formulas: the
 * context-free formulas, their consistency condition and the occurrence
 * table from which witnesses for the context variables are built.
 *
 * @specfield left, right, condition: Formula
 * @specfield table: OccurrenceTable
 * @specfield monotonic: boolean
 */
public final class ContextTranslation {

	private final Formula left, right, condition;
	private final OccurrenceTable table;
	private final PremiseWrapper wrapper;
	private final boolean monotonic;

	ContextTranslation(Formula left, Formula right, Formula condition, OccurrenceTable table, PremiseWrapper wrapper,
			boolean monotonic) {
		this.left = left;
		this.right = right;
		this.condition = condition;
		this.table = table;
		this.wrapper = wrapper;
		this.monotonic = monotonic;
	}

	/**
	 * Returns the context-free version of the left formula.
	 */
	public Formula left() {
		return left;
	}

	/**
	 * Returns the context-free version of the right formula.
	 */
	public Formula right() {
		return right;
	}

	/**
	 * Returns the consistency condition, true if there is nothing to require.
	 */
	public Formula condition() {
		return condition;
	}

	/**
	 * Returns the table of context occurrences of both formulas.
	 */
	public OccurrenceTable occurrences() {
		return table;
	}

	/**
	 * Whether the contexts were assumed to be monotonic.
	 */
	public boolean monotonic() {
		return monotonic;
	}

	/**
	 * Builds the canonical context of each context variable: the conjunction,
	 * over its occurrences <code>c[φ]</code> with proposition <code>p</code>,
	 * of <code>W(🕳 → φ) → p</code> (<code>W(🕳 ↔ φ) → p</code> for arbitrary
	 * contexts). Instantiating the original formulas with these definitions
	 * yields a sound choice for the contexts.
	 *
	 * @return map from context variables to formulas with holes, in order of
	 *         first occurrence
	 */
	public Map<String, Formula> canonicalContext() {
		final Map<String, Formula> replacements = new LinkedHashMap<>();

		for (Map.Entry<String, Map<Formula, String>> entry : table.occurrences().entrySet()) {
			Formula formula = null;

			for (Map.Entry<Formula, String> occurrence : entry.getValue().entrySet()) {
				final Formula premise = wrapper.wrap(ContextTranslator.relation(Formula.HOLE, occurrence.getKey(), monotonic));
				final Formula clause = premise.implies(Formula.proposition(occurrence.getValue()));

				formula = formula == null ? clause : formula.and(clause);
			}

			replacements.put(entry.getKey(), formula);
		}

		return replacements;
	}

	/**
	 * Simplifies every formula of the given context map with the given
	 * valuation.
	 *
	 * @see Simplifier#simplify(Formula, Map)
	 */
	public Map<String, Formula> simplifyContext(Map<String, Formula> context, Map<String, Boolean> valuation) {
		final Map<String, Formula> simplified = new LinkedHashMap<>();

		for (Map.Entry<String, Formula> entry : context.entrySet())
			simplified.put(entry.getKey(), Simplifier.simplify(entry.getValue(), valuation));

		return simplified;
	}
}
