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
package ctxform.ast;

import ctxform.ast.operator.FormulaOperator;
import ctxform.ast.operator.PathQuantifier;
import ctxform.ast.operator.TemporalOperator;
import ctxform.ast.visitor.ReturnVisitor;
import ctxform.util.nodes.PrettyPrinter;

/**
 * A propositional, linear-time or branching-time formula, possibly with
 * contexts and holes. Formulas are immutable and compared structurally:
 * two formulas are equal iff they have the same shape and the same leaves.
 *
 * @specfield children: Formula[]
 * @invariant no hole appears outside a context definition, except in
 *            canonical context formulas
 */
public abstract class Formula {

	/** Constant formula true. */
	public static final ConstantFormula TRUE = new ConstantFormula(true);

	/** Constant formula false. */
	public static final ConstantFormula FALSE = new ConstantFormula(false);

	/** The hole of a context definition. */
	public static final Hole HOLE = new Hole();

	Formula() {}

	/**
	 * Returns the constant formula with the given value.
	 * @return {f: ConstantFormula | f.booleanValue() = value}
	 */
	public static ConstantFormula constant(boolean value) {
		return value ? TRUE : FALSE;
	}

	/**
	 * Returns the atomic proposition with the given name.
	 * @throws NullPointerException name = null
	 */
	public static Proposition proposition(String name) {
		return new Proposition(name);
	}

	/**
	 * Returns the application of the context variable with the given name to
	 * the given argument.
	 * @throws NullPointerException name = null || argument = null
	 */
	public static ContextFormula context(String name, Formula argument) {
		return new ContextFormula(name, argument);
	}

	/**
	 * Returns the composition of the given formulas using the given operator.
	 * @return {f: BinaryFormula | f.left = left && f.right = right && f.op = op}
	 */
	public static Formula compose(FormulaOperator op, Formula left, Formula right) {
		return new BinaryFormula(left, op, right);
	}

	/**
	 * Returns the composition of the given formulas using the given binary
	 * temporal operator.
	 * @throws IllegalArgumentException !op.binary()
	 */
	public static Formula compose(TemporalOperator op, Formula left, Formula right) {
		return new BinaryTempFormula(left, op, right);
	}

	/**
	 * Returns the application of the given unary temporal operator to the
	 * given formula.
	 * @throws IllegalArgumentException op.binary()
	 */
	public static Formula compose(TemporalOperator op, Formula formula) {
		return new UnaryTempFormula(op, formula);
	}

	/**
	 * Returns the given formula preceded by the given path quantifier.
	 */
	public static Formula compose(PathQuantifier quantifier, Formula formula) {
		return new PathFormula(quantifier, formula);
	}

	/**
	 * Returns the conjunction of this and the specified formula.
	 */
	public final Formula and(Formula formula) {
		return compose(FormulaOperator.AND, this, formula);
	}

	/**
	 * Returns the disjunction of this and the specified formula.
	 */
	public final Formula or(Formula formula) {
		return compose(FormulaOperator.OR, this, formula);
	}

	/**
	 * Returns the implication of the specified formula by this.
	 */
	public final Formula implies(Formula formula) {
		return compose(FormulaOperator.IMPLIES, this, formula);
	}

	/**
	 * Returns a formula that equates this and the specified formula.
	 */
	public final Formula iff(Formula formula) {
		return compose(FormulaOperator.IFF, this, formula);
	}

	/**
	 * Returns the exclusive disjunction of this and the specified formula.
	 */
	public final Formula xor(Formula formula) {
		return compose(FormulaOperator.XOR, this, formula);
	}

	/**
	 * Returns the negation of this formula.
	 */
	public final Formula not() {
		return new NotFormula(this);
	}

	public final Formula next() {
		return compose(TemporalOperator.NEXT, this);
	}

	public final Formula always() {
		return compose(TemporalOperator.ALWAYS, this);
	}

	public final Formula eventually() {
		return compose(TemporalOperator.EVENTUALLY, this);
	}

	public final Formula until(Formula formula) {
		return compose(TemporalOperator.UNTIL, this, formula);
	}

	public final Formula weakUntil(Formula formula) {
		return compose(TemporalOperator.WEAK_UNTIL, this, formula);
	}

	public final Formula releases(Formula formula) {
		return compose(TemporalOperator.RELEASE, this, formula);
	}

	public final Formula strongReleases(Formula formula) {
		return compose(TemporalOperator.STRONG_RELEASE, this, formula);
	}

	public final Formula forAll() {
		return compose(PathQuantifier.FORALL, this);
	}

	public final Formula exists() {
		return compose(PathQuantifier.EXISTS, this);
	}

	/**
	 * Accepts the given visitor and returns the result.
	 * @see ctxform.ast.visitor.ReturnVisitor
	 */
	public abstract <T> T accept(ReturnVisitor<T> visitor);

	/**
	 * Returns a string representation of this formula in the surface syntax.
	 */
	@Override
	public String toString() {
		return PrettyPrinter.print(this);
	}
}
