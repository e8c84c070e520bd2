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
 * A binary temporal formula: until, weak until, release or strong release.
 *
 * @specfield left: Formula
 * @specfield right: Formula
 * @specfield op: TemporalOperator
 * @invariant op.binary()
 */
public final class BinaryTempFormula extends Formula {

	private final Formula left;
	private final Formula right;
	private final TemporalOperator op;

	/**
	 * @throws NullPointerException left = null || op = null || right = null
	 * @throws IllegalArgumentException !op.binary()
	 */
	BinaryTempFormula(Formula left, TemporalOperator op, Formula right) {
		if (!op.binary())
			throw new IllegalArgumentException("Not a binary temporal operator: " + op.name());
		this.left = Objects.requireNonNull(left, "left");
		this.op = op;
		this.right = Objects.requireNonNull(right, "right");
	}

	public Formula left() {
		return left;
	}

	public Formula right() {
		return right;
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
		if (!(obj instanceof BinaryTempFormula))
			return false;
		final BinaryTempFormula other = (BinaryTempFormula) obj;
		return op == other.op && left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, left, right);
	}
}
