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

import ctxform.ast.BinaryFormula;
import ctxform.ast.BinaryTempFormula;
import ctxform.ast.Formula;
import ctxform.ast.NotFormula;
import ctxform.ast.PathFormula;
import ctxform.ast.UnaryTempFormula;
import ctxform.ast.operator.PathQuantifier;
import ctxform.ast.visitor.AbstractReplacer;

/**
 * Rewrites CTL formulas accepted by {@link CTLChecker} into the operators
 * ctl-sat supports: negation, conjunction, disjunction and implication, the
 * path quantifiers, and X, F, G and U. Equivalence and exclusive disjunction
 * are expanded, and the release and weak until operators are expressed with
 * until:
 * <pre>
 * Q (a R b) = Q ¬(¬a U ¬b)
 * Q (a W b) = Q ¬(¬b U (¬a ∧ ¬b))
 * Q (a M b) = Q (b U (b ∧ a))
 * </pre>
 */
public final class CTLAdapter extends AbstractReplacer {

	private CTLAdapter() {}

	/**
	 * Returns the adapted version of the given formula.
	 */
	public static Formula adapt(Formula formula) {
		return formula.accept(new CTLAdapter());
	}

	private static Formula negate(Formula formula) {
		return formula instanceof NotFormula ? ((NotFormula) formula).formula() : formula.not();
	}

	@Override
	public Formula visit(BinaryFormula binFormula) {
		final Formula left = binFormula.left().accept(this);
		final Formula right = binFormula.right().accept(this);

		switch (binFormula.op()) {
		case IFF:
			return left.implies(right).and(right.implies(left));
		case XOR:
			return left.and(negate(right)).or(right.and(negate(left)));
		default:
			return left == binFormula.left() && right == binFormula.right() ? binFormula
					: Formula.compose(binFormula.op(), left, right);
		}
	}

	@Override
	public Formula visit(PathFormula pathFormula) {
		final PathQuantifier quantifier = pathFormula.quantifier();
		Formula body = pathFormula.formula();
		boolean negated = false;

		if (body instanceof NotFormula) {
			body = ((NotFormula) body).formula();
			negated = true;
		}

		if (body instanceof UnaryTempFormula) {
			final UnaryTempFormula temp = (UnaryTempFormula) body;
			return quantify(quantifier, Formula.compose(temp.op(), temp.formula().accept(this)), negated);
		}

		if (body instanceof BinaryTempFormula) {
			final BinaryTempFormula temp = (BinaryTempFormula) body;
			final Formula a = temp.left().accept(this);
			final Formula b = temp.right().accept(this);

			switch (temp.op()) {
			case UNTIL:
				return quantify(quantifier, a.until(b), negated);
			case RELEASE:
				return quantify(quantifier, negate(a).until(negate(b)), !negated);
			case WEAK_UNTIL:
				return quantify(quantifier, negate(b).until(negate(a).and(negate(b))), !negated);
			case STRONG_RELEASE:
				return quantify(quantifier, b.until(b.and(a)), negated);
			default:
				throw new IllegalArgumentException("not a binary temporal operator: " + temp.op());
			}
		}

		// a state formula under a quantifier is the formula itself
		final Formula state = body.accept(this);
		return negated ? negate(state) : state;
	}

	private static Formula quantify(PathQuantifier quantifier, Formula path, boolean negated) {
		return Formula.compose(quantifier, negated ? path.not() : path);
	}
}
