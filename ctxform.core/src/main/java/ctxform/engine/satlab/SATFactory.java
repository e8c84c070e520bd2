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

import org.sat4j.minisat.SolverFactory;

/**
 * A factory for generating SATSolver instances of a given type.
 */
public abstract class SATFactory {

	/**
	 * The factory that produces instances of the default SAT4J solver.
	 */
	public static final SATFactory DefaultSAT4J = new SATFactory() {

		@Override
		public SATSolver instance(int timeout) {
			return new SAT4J(SolverFactory.newDefault(), timeout);
		}

		@Override
		public String toString() {
			return "DefaultSAT4J";
		}
	};

	/** The default factory. */
	public static final SATFactory DEFAULT = DefaultSAT4J;

	protected SATFactory() {}

	/**
	 * Returns an instance of a SATSolver produced by this factory whose calls
	 * to solve fail after the given number of seconds.
	 *
	 * @return a fresh solver with an empty vocabulary and no clauses
	 */
	public abstract SATSolver instance(int timeout);
}
