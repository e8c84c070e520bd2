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

import java.util.Objects;

import ctxform.ast.operator.TemporalOperator;
import ctxform.ast.visitor.ReturnVisitor;

/**
 * A unary temporal formula: next, always or eventually.
 *
 * @specfield formula: Formula
 * @specfield op: TemporalOperator
 * @invariant !op.binary()
 */
public final class UnaryTempFormula extends Formula {

	private final Formula formula;
	private final TemporalOperator op;

	/**
	 * @throws NullPointerException op = null || formula = null
	 * @throws IllegalArgumentException op.binary()
	 */
	UnaryTempFormula(TemporalOperator op, Formula formula) {
		if (op.binary())
			throw new IllegalArgumentException("Not a unary temporal operator: " + op.name());
		this.op = op;
		this.formula = Objects.requireNonNull(formula, "formula");
	}

	public Formula formula() {
		return formula;
	}

	public TemporalOperator op() {
		return op;
	}

	@Override
	public <T> T accept(ReturnVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof UnaryTempFormula))
			return false;
		final UnaryTempFormula other = (UnaryTempFormula) obj;
		return op == other.op && formula.equals(other.formula);
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, formula);
	}
}
