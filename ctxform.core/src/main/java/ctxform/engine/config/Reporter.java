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
package ctxform.engine.config;

import ctxform.ast.Formula;

/**
 * An object that receives information about the progress of an equivalence
 * check. The methods are called by the engine and the oracle adapters; a
 * reporter must not modify the objects it is given.
 */
public interface Reporter {

	/**
	 * Reports that the contexts of a problem have been eliminated.
	 *
	 * @param left the context-free left formula
	 * @param right the context-free right formula
	 * @param condition the consistency condition
	 * @param occurrences number of distinct context occurrences
	 */
	public void translatingContexts(Formula left, Formula right, Formula condition, int occurrences);

	/**
	 * Reports that a formula of the given size is being handed to a SAT solver.
	 *
	 * @param primaryVars number of variables standing for propositions
	 * @param vars total number of variables
	 * @param clauses number of clauses
	 */
	public void solvingCNF(int primaryVars, int vars, int clauses);

	/**
	 * Reports that lassos with the given prefix and cycle lengths are being
	 * searched for a counterexample.
	 */
	public void boundedSearch(int prefixLength, int cycleLength);

	/**
	 * Reports a condition that does not prevent an answer but may affect it.
	 */
	public void warning(String message);

	/**
	 * Reports debugging information.
	 */
	public void debug(String message);
}
