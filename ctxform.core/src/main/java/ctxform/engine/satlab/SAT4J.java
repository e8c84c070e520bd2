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

import org.sat4j.core.VecInt;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;

/**
 * A wrapper class that provides access to the basic functionality of the
 * SAT4J solvers.
 */
final class SAT4J implements SATSolver {

	private ISolver solver;
	private Boolean sat;
	private int vars, clauses;

	/**
	 * Constructs a wrapper for the given instance of ISolver.
	 *
	 * @throws NullPointerException solver = null
	 */
	SAT4J(ISolver solver, int timeout) {
		if (solver == null)
			throw new NullPointerException("solver");
		this.solver = solver;
		this.solver.setTimeout(timeout);
		this.sat = null;
		this.vars = this.clauses = 0;
	}

	public int numberOfVariables() {
		return vars;
	}

	public int numberOfClauses() {
		return clauses;
	}

	public void addVariables(int numVars) {
		if (numVars < 0)
			throw new IllegalArgumentException("numVars < 0: " + numVars);
		else if (numVars > 0) {
			vars += numVars;
			solver.newVar(vars);
		}
	}

	public boolean addClause(int[] lits) {
		for (int lit : lits) {
			if (lit == 0 || Math.abs(lit) > vars)
				throw new IllegalArgumentException("literal out of range: " + lit);
		}
		try {
			if (!Boolean.FALSE.equals(sat)) {
				clauses++;
				solver.addClause(new VecInt(lits.clone()));
				return true;
			}
		} catch (ContradictionException e) {
			sat = Boolean.FALSE;
		}
		return false;
	}

	public boolean solve() {
		try {
			if (!Boolean.FALSE.equals(sat))
				sat = Boolean.valueOf(solver.isSatisfiable());
			return sat;
		} catch (TimeoutException e) {
			sat = null;
			throw new SATAbortedException("Timed out or interrupted.", e);
		}
	}

	public boolean valueOf(int variable) {
		if (!Boolean.TRUE.equals(sat))
			throw new IllegalStateException();
		if (variable < 1 || variable > vars)
			throw new IllegalArgumentException(variable + " !in [1.." + vars + "]");
		return solver.model(variable);
	}

	public synchronized final void free() {
		solver = null;
	}

	@Override
	public String toString() {
		return solver == null ? "SAT4J (freed)" : solver.toString();
	}
}
