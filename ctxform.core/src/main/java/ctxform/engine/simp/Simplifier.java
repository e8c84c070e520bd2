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
package ctxform.engine.simp;

import java.util.Collections;
import java.util.Map;

import ctxform.ast.BinaryFormula;
import ctxform.ast.BinaryTempFormula;
import ctxform.ast.ConstantFormula;
import ctxform.ast.Formula;
import ctxform.ast.NotFormula;
import ctxform.ast.PathFormula;
import ctxform.ast.Proposition;
import ctxform.ast.UnaryTempFormula;
import ctxform.ast.visitor.AbstractReplacer;

/**
 * Simplifies formulas with the local identities of Boolean and temporal
 * operators, after replacing the propositions of a partial valuation by
 * constants. The children of a node are simplified first and then the
 * first applicable rule of the node is applied once; the result is not
 * simplified again, so the output need not be minimal.
 */
public final class Simplifier extends AbstractReplacer {

	private final Map<String, Boolean> valuation;

	private Simplifier(Map<String, Boolean> valuation) {
		this.valuation = valuation;
	}

	/**
	 * Returns a formula equivalent to the given one under the given partial
	 * valuation.
	 *
	 * @param formula the formula to simplify, which may contain holes
	 * @param valuation values of some propositions, possibly empty
	 */
	public static Formula simplify(Formula formula, Map<String, Boolean> valuation) {
		return formula.accept(new Simplifier(valuation == null ? Collections.<String, Boolean>emptyMap() : valuation));
	}

	private static boolean isTrue(Formula formula) {
		return formula instanceof ConstantFormula && ((ConstantFormula) formula).booleanValue();
	}

	private static boolean isFalse(Formula formula) {
		return formula instanceof ConstantFormula && !((ConstantFormula) formula).booleanValue();
	}

	/**
	 * Negates the given formula, removing its negation if it has one.
	 */
	static Formula negate(Formula formula) {
		return formula instanceof NotFormula ? ((NotFormula) formula).formula() : formula.not();
	}

	@Override
	public Formula visit(Proposition proposition) {
		final Boolean value = valuation.get(proposition.name());
		return value == null ? proposition : Formula.constant(value);
	}

	@Override
	public Formula visit(NotFormula not) {
		final Formula formula = not.formula().accept(this);

		if (formula instanceof ConstantFormula)
			return Formula.constant(!((ConstantFormula) formula).booleanValue());
		if (formula instanceof NotFormula)
			return ((NotFormula) formula).formula();

		return formula == not.formula() ? not : formula.not();
	}

	@Override
	public Formula visit(BinaryFormula binFormula) {
		final Formula left = binFormula.left().accept(this);
		final Formula right = binFormula.right().accept(this);

		switch (binFormula.op()) {
		case OR:
			if (isTrue(left) || isTrue(right))
				return Formula.TRUE;
			if (isFalse(left))
				return right;
			if (isFalse(right) || left.equals(right))
				return left;
			break;
		case AND:
			if (isFalse(left) || isFalse(right))
				return Formula.FALSE;
			if (isTrue(left))
				return right;
			if (isTrue(right) || left.equals(right))
				return left;
			break;
		case IMPLIES:
			if (isFalse(left) || isTrue(right))
				return Formula.TRUE;
			if (isTrue(left))
				return right;
			if (isFalse(right))
				return negate(left);
			break;
		case IFF:
			if (isTrue(left))
				return right;
			if (isTrue(right))
				return left;
			if (isFalse(left))
				return negate(right);
			if (isFalse(right))
				return negate(left);
			break;
		case XOR:
			if (isTrue(left))
				return negate(right);
			if (isTrue(right))
				return negate(left);
			if (isFalse(left))
				return right;
			if (isFalse(right))
				return left;
			break;
		default:
			throw new IllegalArgumentException("unknown operator: " + binFormula.op());
		}

		return left == binFormula.left() && right == binFormula.right() ? binFormula
				: Formula.compose(binFormula.op(), left, right);
	}

	@Override
	public Formula visit(UnaryTempFormula tempFormula) {
		final Formula formula = tempFormula.formula().accept(this);

		if (formula instanceof ConstantFormula)
			return formula;
		if (formula instanceof NotFormula)
			return Formula.compose(tempFormula.op().dual(), ((NotFormula) formula).formula()).not();

		return formula == tempFormula.formula() ? tempFormula : Formula.compose(tempFormula.op(), formula);
	}

	@Override
	public Formula visit(PathFormula pathFormula) {
		final Formula formula = pathFormula.formula().accept(this);

		if (formula instanceof ConstantFormula)
			return formula;
		if (formula instanceof NotFormula)
			return Formula.compose(pathFormula.quantifier().dual(), ((NotFormula) formula).formula()).not();

		return formula == pathFormula.formula() ? pathFormula : Formula.compose(pathFormula.quantifier(), formula);
	}

	@Override
	public Formula visit(BinaryTempFormula tempFormula) {
		final Formula left = tempFormula.left().accept(this);
		final Formula right = tempFormula.right().accept(this);

		switch (tempFormula.op()) {
		case UNTIL:
			if (isTrue(right))
				return Formula.TRUE;
			if (isFalse(right))
				return Formula.FALSE;
			if (isFalse(left))
				return right;
			if (isTrue(left))
				return right.eventually();
			break;
		case WEAK_UNTIL:
			if (isTrue(left) || isTrue(right))
				return Formula.TRUE;
			if (isFalse(right))
				return left.always();
			if (isFalse(left))
				return right;
			break;
		case RELEASE:
			if (isTrue(left) || isTrue(right))
				return Formula.TRUE;
			if (isFalse(left))
				return right.always();
			if (isFalse(right))
				return Formula.FALSE;
			break;
		case STRONG_RELEASE:
			if (isFalse(left) || isFalse(right))
				return Formula.FALSE;
			if (isTrue(left))
				return right;
			if (isTrue(right))
				return left.eventually();
			break;
		default:
			throw new IllegalArgumentException("not a binary temporal operator: " + tempFormula.op());
		}

		return left == tempFormula.left() && right == tempFormula.right() ? tempFormula
				: Formula.compose(tempFormula.op(), left, right);
	}
}
