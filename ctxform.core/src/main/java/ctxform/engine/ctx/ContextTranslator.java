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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ctxform.ast.ContextFormula;
import ctxform.ast.Formula;
import ctxform.ast.Hole;
import ctxform.ast.Proposition;
import ctxform.ast.visitor.AbstractReplacer;
import ctxform.engine.PremiseWrapper;

/**
 * Eliminates contexts from a pair of formulas. Every application
 * <code>c[φ]</code> is replaced by a fresh atomic proposition, shared by the
 * applications of <code>c</code> to structurally equal arguments, and the
 * constraints that the denotation of <code>c</code> must satisfy are
 * collected in a consistency condition:
 * <ul>
 * <li>monotonic contexts: for every ordered pair of distinct occurrences,
 * <code>W(W(φ → ψ) → (c[φ] → c[ψ]))</code>;</li>
 * <li>arbitrary contexts: for every unordered pair,
 * <code>W(W(φ ↔ ψ) → (c[φ] ↔ c[ψ]))</code>;</li>
 * </ul>
 * where <code>W</code> is the premise wrapper of the logic.
 *
 * <p>
 * A translator is used for a single pair of formulas; its state is handed
 * over to the resulting {@link ContextTranslation}.
 * </p>
 */
public final class ContextTranslator extends AbstractReplacer {

	private final OccurrenceTable table;

	private ContextTranslator(Set<String> propositions) {
		this.table = new OccurrenceTable(propositions);
	}

	/**
	 * Translates the given formulas into context-free ones and builds their
	 * consistency condition.
	 *
	 * @param left the left formula of the equivalence
	 * @param right the right formula of the equivalence
	 * @param wrapper the premise wrapper of the logic
	 * @param monotonic whether contexts are assumed to be monotonic
	 * @return the translation of the formulas, which owns the occurrence table
	 * @throws IllegalStateException left or right contain a hole
	 */
	public static ContextTranslation translate(Formula left, Formula right, PremiseWrapper wrapper, boolean monotonic) {
		final Set<String> propositions = new HashSet<>();
		final AbstractReplacer collector = new AbstractReplacer() {
			@Override
			public Formula visit(Proposition proposition) {
				propositions.add(proposition.name());
				return proposition;
			}
		};
		left.accept(collector);
		right.accept(collector);

		// fresh propositions must not capture the ones written by the user
		final ContextTranslator translator = new ContextTranslator(propositions);

		final Formula leftTrans = left.accept(translator);
		final Formula rightTrans = right.accept(translator);
		final Formula condition = consistencyCondition(translator.table, wrapper, monotonic);

		return new ContextTranslation(leftTrans, rightTrans, condition, translator.table, wrapper, monotonic);
	}

	@Override
	public Formula visit(ContextFormula context) {
		// arguments first, so that nested contexts are registered before
		final Formula argument = context.argument().accept(this);
		return Formula.proposition(table.propositionFor(context.name(), argument));
	}

	@Override
	public Formula visit(Hole hole) {
		throw new IllegalStateException("cannot eliminate contexts from a formula with holes");
	}

	/**
	 * Builds the conjunction of the monotonicity (or functionality) clauses for
	 * every context variable in the table.
	 */
	private static Formula consistencyCondition(OccurrenceTable table, PremiseWrapper wrapper, boolean monotonic) {
		Formula formula = null;

		for (Map<Formula, String> arguments : table.occurrences().values()) {
			final List<Map.Entry<Formula, String>> entries = new ArrayList<>(arguments.entrySet());

			for (int i = 0; i < entries.size(); i++) {
				// ordered pairs for implications, unordered ones for equivalences
				for (int j = monotonic ? 0 : i + 1; j < entries.size(); j++) {
					if (i == j)
						continue;

					final Map.Entry<Formula, String> p = entries.get(i), q = entries.get(j);

					final Formula premise = wrapper.wrap(relation(p.getKey(), q.getKey(), monotonic));
					final Formula conclusion = relation(Formula.proposition(p.getValue()),
							Formula.proposition(q.getValue()), monotonic);
					final Formula clause = wrapper.wrap(premise.implies(conclusion));

					formula = formula == null ? clause : formula.and(clause);
				}
			}
		}

		return formula == null ? Formula.TRUE : formula;
	}

	/**
	 * Returns the relation between two arguments or two propositions that the
	 * context assumption requires.
	 */
	static Formula relation(Formula left, Formula right, boolean monotonic) {
		return monotonic ? left.implies(right) : left.iff(right);
	}
}
