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
 * The result of instantiating both formulas with their canonical contexts and
 * checking the instances for equivalence. If the context-free check says the
 * formulas are equivalent for every context, the instances must be
 * equivalent too.
 */
public final class WitnessCheck {

	private final Witnesses witnesses;
	private final Solution solution;

	WitnessCheck(Witnesses witnesses, Solution solution) {
		this.witnesses = witnesses;
		this.solution = solution;
	}

	/**
	 * Returns the contexts the formulas were instantiated with, simplified if
	 * requested.
	 */
	public Witnesses witnesses() {
		return witnesses;
	}

	/**
	 * Whether the instantiated formulas are equivalent.
	 */
	public boolean equivalent() {
		return solution.equivalent();
	}

	/**
	 * Returns the outcome of the check of the instantiated formulas.
	 */
	public Solution solution() {
		return solution;
	}

	@Override
	public String toString() {
		return witnesses + "\n" + (equivalent() ? "instances are equivalent" : "instances are not equivalent");
	}
}
