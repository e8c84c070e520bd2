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

/**
 * The outcome of an equivalence check: the formulas are equivalent iff there
 * is no counterexample in either direction. Oracles that only search models
 * up to a number of states give a bounded outcome, where a missing
 * counterexample means that none exists within the bound.
 *
 * @specfield leftNotRight: lone Counterexample // satisfies left but not right
 * @specfield rightNotLeft: lone Counterexample // satisfies right but not left
 * @specfield bound: int // 0 if the missing counterexamples do not exist at all
 */
public final class Solution {

	private final Counterexample leftNotRight, rightNotLeft;
	private final int bound;

	/**
	 * Creates the outcome of a complete check.
	 */
	public Solution(Counterexample leftNotRight, Counterexample rightNotLeft) {
		this(leftNotRight, rightNotLeft, 0);
	}

	/**
	 * Creates the outcome of a check whose missing counterexamples were only
	 * searched up to the given number of states, or of a complete one if the
	 * bound is 0.
	 *
	 * @throws IllegalArgumentException bound < 0
	 */
	public Solution(Counterexample leftNotRight, Counterexample rightNotLeft, int bound) {
		if (bound < 0)
			throw new IllegalArgumentException("bound < 0: " + bound);
		this.leftNotRight = leftNotRight;
		this.rightNotLeft = rightNotLeft;
		this.bound = leftNotRight != null && rightNotLeft != null ? 0 : bound;
	}

	/**
	 * Returns true if no counterexample was found in either direction. When
	 * the outcome is {@link #bounded() bounded} this does not prove the
	 * equivalence.
	 */
	public boolean equivalent() {
		return leftNotRight == null && rightNotLeft == null;
	}

	/**
	 * Returns true if some direction has no counterexample only within
	 * {@link #bound()} states.
	 */
	public boolean bounded() {
		return bound > 0;
	}

	/**
	 * Returns the number of states up to which counterexamples were
	 * searched, or 0 if the outcome is not bounded.
	 */
	public int bound() {
		return bound;
	}

	/**
	 * Returns a model of the left formula that does not satisfy the right one,
	 * or null.
	 */
	public Counterexample leftNotRight() {
		return leftNotRight;
	}

	/**
	 * Returns a model of the right formula that does not satisfy the left one,
	 * or null.
	 */
	public Counterexample rightNotLeft() {
		return rightNotLeft;
	}

	@Override
	public String toString() {
		if (equivalent())
			return bounded() ? "EQUIVALENT UP TO " + bound + " STATES" : "EQUIVALENT";
		final StringBuilder b = new StringBuilder("NOT EQUIVALENT");
		if (leftNotRight != null)
			b.append("\n left and not right: ").append(leftNotRight);
		if (rightNotLeft != null)
			b.append("\n right and not left: ").append(rightNotLeft);
		return b.toString();
	}
}
