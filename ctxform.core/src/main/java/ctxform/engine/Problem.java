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

import java.util.Map;

import ctxform.ast.Formula;
import ctxform.engine.config.Options;
import ctxform.engine.ctx.ContextTranslation;
import ctxform.engine.ctx.ContextTranslator;
import ctxform.engine.ctx.Instantiator;

/**
 * An equivalence problem between two formulas with contexts. The contexts
 * are eliminated when the problem is created; the resulting context-free
 * formulas and their consistency condition are then given to the oracle of
 * the logic. The formulas are equivalent for every choice of the contexts
 * iff neither of them, together with the condition, is satisfiable along
 * with the negation of the other.
 *
 * <p>
 * A problem remembers the counterexamples of the last check, which are used
 * to simplify witnesses.
 * </p>
 *
 * @specfield left, right: Formula
 * @specfield translation: ContextTranslation
 * @specfield options: Options
 */
public abstract class Problem {

	private final Formula left, right;
	private final ContextTranslation translation;
	protected final Options options;

	private Counterexample leftNotRight, rightNotLeft;

	/**
	 * Creates a problem and eliminates the contexts of its formulas.
	 *
	 * @throws IllegalStateException left or right contain a hole
	 */
	protected Problem(Formula left, Formula right, PremiseWrapper wrapper, Options options) {
		this.left = left;
		this.right = right;
		this.options = options;
		this.translation = ContextTranslator.translate(left, right, wrapper, options.monotonic());

		options.reporter().translatingContexts(translation.left(), translation.right(), translation.condition(),
				translation.occurrences().size());
	}

	/**
	 * Returns a model of positive ∧ condition ∧ ¬negative, or null if there is
	 * none.
	 *
	 * @throws AbortedException the oracle failed or ran out of time
	 */
	protected abstract Counterexample counterexample(Formula positive, Formula condition, Formula negative);

	/**
	 * Returns the number of states up to which {@link #counterexample} looks
	 * for models, or 0 if a null result means that there is none at all.
	 */
	protected int bound() {
		return 0;
	}

	/**
	 * Whether the counterexamples of this logic can be used to simplify
	 * witnesses.
	 */
	protected boolean simplifiable() {
		return true;
	}

	public Formula left() {
		return left;
	}

	public Formula right() {
		return right;
	}

	/**
	 * Returns the context-free formulas and the consistency condition.
	 */
	public ContextTranslation translation() {
		return translation;
	}

	/**
	 * Decides whether the formulas are equivalent for every choice of the
	 * contexts (every monotonic one unless the options say otherwise).
	 *
	 * @throws AbortedException the oracle failed or ran out of time
	 */
	public Solution solve() {
		return check(translation.left(), translation.right(), translation.condition());
	}

	/**
	 * Returns the canonical contexts of the formulas, simplified with the
	 * counterexamples of the last check if requested.
	 */
	public Witnesses canonicalContext(boolean simplified) {
		return witnesses(translation.canonicalContext(), simplified);
	}

	/**
	 * Instantiates the formulas with their canonical contexts and checks
	 * whether the instances are equivalent.
	 *
	 * @throws AbortedException the oracle failed or ran out of time
	 */
	public WitnessCheck solveWithContext(boolean simplify) {
		final Map<String, Formula> canonical = translation.canonicalContext();

		final Formula leftInst = Instantiator.instantiateFormula(left, canonical);
		final Formula rightInst = Instantiator.instantiateFormula(right, canonical);

		final Solution solution = check(leftInst, rightInst, Formula.TRUE);

		return new WitnessCheck(witnesses(canonical, simplify), solution);
	}

	private Solution check(Formula left, Formula right, Formula condition) {
		leftNotRight = counterexample(left, condition, right);
		rightNotLeft = counterexample(right, condition, left);
		return new Solution(leftNotRight, rightNotLeft, bound());
	}

	private Witnesses witnesses(Map<String, Formula> canonical, boolean simplified) {
		if (!simplified || !simplifiable())
			return new Witnesses(canonical, null);

		final Map<String, Boolean> lnr = leftNotRight == null ? null : leftNotRight.valuation();
		final Map<String, Boolean> rnl = rightNotLeft == null ? null : rightNotLeft.valuation();

		if (lnr == null && rnl == null)
			return new Witnesses(canonical, null);
		if (lnr == null)
			return new Witnesses(translation.simplifyContext(canonical, rnl), null);

		final Map<String, Formula> lnrContext = translation.simplifyContext(canonical, lnr);

		if (rnl == null)
			return new Witnesses(lnrContext, null);

		final Map<String, Formula> rnlContext = translation.simplifyContext(canonical, rnl);

		return lnrContext.equals(rnlContext) ? new Witnesses(lnrContext, null) : new Witnesses(lnrContext, rnlContext);
	}
}
