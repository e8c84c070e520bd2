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
 * Enumerates the binary Boolean connectives.
 */
public enum FormulaOperator {
	/** Conjunction. */
	AND("∧", 3),
	/** Disjunction. */
	OR("∨", 2),
	/** Material implication. */
	IMPLIES("→", 0),
	/** Bi-implication. */
	IFF("↔", 0),
	/** Exclusive disjunction. */
	XOR("⊕", 1);

	private final String symbol;
	private final int priority;

	private FormulaOperator(String symbol, int priority) {
		this.symbol = symbol;
		this.priority = priority;
	}

	/**
	 * Returns the binding priority of this operator, higher binds tighter.
	 * @return the priority used when printing formulas with this operator
	 */
	public int priority() {
		return priority;
	}

	/**
	 * Returns the symbol used to print this operator.
	 */
	@Override
	public String toString() {
		return symbol;
	}
}
