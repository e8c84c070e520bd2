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
 * Produces SAT4J solvers whose calls to solve either abort, as a solver
 * running out of time does, or take at least a given delay before answering.
 */
public final class StallingSATFactory extends SATFactory {

	private final boolean abort;
	private final long delay;
	private int calls;

	private StallingSATFactory(boolean abort, long delay) {
		this.abort = abort;
		this.delay = delay;
	}

	/**
	 * Returns a factory whose solvers always abort.
	 */
	public static StallingSATFactory aborting() {
		return new StallingSATFactory(true, 0);
	}

	/**
	 * Returns a factory whose solvers answer after the given number of
	 * milliseconds.
	 */
	public static StallingSATFactory delaying(long delay) {
		return new StallingSATFactory(false, delay);
	}

	/**
	 * Returns the number of calls to solve so far.
	 */
	public int calls() {
		return calls;
	}

	@Override
	public SATSolver instance(int timeout) {
		final SATSolver solver = DEFAULT.instance(timeout);

		return new SATSolver() {
			public int numberOfVariables() {
				return solver.numberOfVariables();
			}

			public int numberOfClauses() {
				return solver.numberOfClauses();
			}

			public void addVariables(int numVars) {
				solver.addVariables(numVars);
			}

			public boolean addClause(int[] lits) {
				return solver.addClause(lits);
			}

			public boolean solve() throws SATAbortedException {
				calls++;
				if (abort)
					throw new SATAbortedException("Timed out or interrupted.");
				try {
					Thread.sleep(delay);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new SATAbortedException(e);
				}
				return solver.solve();
			}

			public boolean valueOf(int variable) {
				return solver.valueOf(variable);
			}

			public void free() {
				solver.free();
			}
		};
	}

	@Override
	public String toString() {
		return abort ? "aborting" : "delaying " + delay + "ms";
	}
}
