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
package ctxform.engine.bool;

import ctxform.engine.satlab.SATSolver;

/**
 * Builds gates over the variables of a SAT solver with the Tseitin encoding.
 * Gates are identified by literals: positive integers are variables and
 * their negation is the negated literal. Constants are the two literals of a
 * variable asserted to be true; gates over constants are folded.
 *
 * @specfield solver: SATSolver
 */
public final class BooleanFactory {

	private final SATSolver solver;
	private final int trueLiteral;

	/**
	 * Creates a factory that adds its variables and clauses to the given
	 * solver.
	 */
	public BooleanFactory(SATSolver solver) {
		this.solver = solver;
		this.trueLiteral = variable();
		solver.addClause(new int[] { trueLiteral });
	}

	/**
	 * Returns the solver this factory writes to.
	 */
	public SATSolver solver() {
		return solver;
	}

	/**
	 * Returns a fresh variable.
	 */
	public int variable() {
		solver.addVariables(1);
		return solver.numberOfVariables();
	}

	public int constant(boolean value) {
		return value ? trueLiteral : -trueLiteral;
	}

	public boolean isTrue(int literal) {
		return literal == trueLiteral;
	}

	public boolean isFalse(int literal) {
		return literal == -trueLiteral;
	}

	public int not(int literal) {
		return -literal;
	}

	public int and(int left, int right) {
		if (isFalse(left) || isFalse(right) || left == -right)
			return constant(false);
		if (isTrue(left) || left == right)
			return right;
		if (isTrue(right))
			return left;

		final int gate = variable();
		solver.addClause(new int[] { -gate, left });
		solver.addClause(new int[] { -gate, right });
		solver.addClause(new int[] { gate, -left, -right });
		return gate;
	}

	public int or(int left, int right) {
		return -and(-left, -right);
	}

	public int implies(int left, int right) {
		return or(-left, right);
	}

	public int iff(int left, int right) {
		if (left == right)
			return constant(true);
		if (left == -right)
			return constant(false);
		if (isTrue(left))
			return right;
		if (isTrue(right))
			return left;
		if (isFalse(left))
			return -right;
		if (isFalse(right))
			return -left;

		final int gate = variable();
		solver.addClause(new int[] { -gate, -left, right });
		solver.addClause(new int[] { -gate, left, -right });
		solver.addClause(new int[] { gate, left, right });
		solver.addClause(new int[] { gate, -left, -right });
		return gate;
	}

	public int xor(int left, int right) {
		return -iff(left, right);
	}

	/**
	 * Requires the given literal to be true in every model.
	 */
	public void assertTrue(int literal) {
		solver.addClause(new int[] { literal });
	}
}
