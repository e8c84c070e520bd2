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
package ctxform.ast.operator;

/**
 * Enumerates the linear-time temporal operators.
 */
public enum TemporalOperator {
	/** Next state. */
	NEXT("X", false),
	/** Globally. */
	ALWAYS("G", false),
	/** Finally. */
	EVENTUALLY("F", false),
	/** Strong until. */
	UNTIL("U", true),
	/** Weak until. */
	WEAK_UNTIL("W", true),
	/** Weak release. */
	RELEASE("R", true),
	/** Strong release. */
	STRONG_RELEASE("M", true);

	private final String symbol;
	private final boolean binary;

	private TemporalOperator(String symbol, boolean binary) {
		this.symbol = symbol;
		this.binary = binary;
	}

	/**
	 * Returns true if this operator takes two arguments.
	 * @return true if this is a binary temporal operator
	 */
	public boolean binary() {
		return binary;
	}

	/**
	 * Returns the dual unary operator, i.e. op' such that op(¬x) = ¬op'(x).
	 * @return the dual of this unary operator
	 * @throws UnsupportedOperationException this.binary()
	 */
	public TemporalOperator dual() {
		switch (this) {
		case ALWAYS:
			return EVENTUALLY;
		case EVENTUALLY:
			return ALWAYS;
		case NEXT:
			return NEXT;
		default:
			throw new UnsupportedOperationException("no unary dual for " + name());
		}
	}

	@Override
	public String toString() {
		return symbol;
	}
}
