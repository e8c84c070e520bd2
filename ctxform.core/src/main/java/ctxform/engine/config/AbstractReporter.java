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
 * A skeleton implementation of the {@link Reporter} interface whose methods
 * do nothing.
 */
public abstract class AbstractReporter implements Reporter {

	/**
	 * A reporter that ignores every message.
	 */
	public static final Reporter SILENT = new AbstractReporter() {};

	protected AbstractReporter() {}

	@Override
	public void translatingContexts(Formula left, Formula right, Formula condition, int occurrences) {}

	@Override
	public void solvingCNF(int primaryVars, int vars, int clauses) {}

	@Override
	public void boundedSearch(int prefixLength, int cycleLength) {}

	@Override
	public void warning(String message) {}

	@Override
	public void debug(String message) {}
}
