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
package ctxform.engine.satlab;

/**
 * Provides an interface to a SAT solver over clauses in DIMACS style: a
 * variable is a positive integer and a literal is a non-zero integer whose
 * sign gives its polarity.
 *
 * @specfield literals: set int
 * @specfield clauses: set Clause
 * @invariant all i: [2..) | i in literals => i-1 in literals
 */
public interface SATSolver {

	/**
	 * Returns the size of this solver's vocabulary.
	 *
	 * @return #this.literals
	 */
	public int numberOfVariables();

	/**
	 * Returns the number of clauses added to the solver so far.
	 */
	public int numberOfClauses();

	/**
	 * Adds the specified number of new variables to the solver's vocabulary.
	 *
	 * @throws IllegalArgumentException numVars < 0
	 */
	public void addVariables(int numVars);

	/**
	 * Ensures that the given clause is among this.clauses. The array is not
	 * retained by the solver.
	 *
	 * @return true if the clause was added, false if it was redundant
	 * @throws IllegalArgumentException some lit of the clause is zero or out
	 *             of the solver's vocabulary
	 */
	public boolean addClause(int[] lits);

	/**
	 * Returns true if there is a satisfying assignment for this.clauses.
	 *
	 * @throws SATAbortedException the call was interrupted or timed out
	 */
	public boolean solve() throws SATAbortedException;

	/**
	 * Returns the value of the given variable in the satisfying assignment
	 * found by the last call to {@link #solve()}.
	 *
	 * @throws IllegalArgumentException variable not in this.literals
	 * @throws IllegalStateException the last call to solve() returned false
	 */
	public boolean valueOf(int variable);

	/**
	 * Releases the resources held by this solver.
	 */
	public void free();
}
