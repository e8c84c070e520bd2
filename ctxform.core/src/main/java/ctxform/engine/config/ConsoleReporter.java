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

import java.io.PrintStream;

import ctxform.ast.Formula;

/**
 * A {@link Reporter} that prints messages to a stream, standard error by
 * default. Debug messages are only printed when {@link Options#isDebug()}.
 */
public final class ConsoleReporter implements Reporter {

	private final PrintStream out;

	public ConsoleReporter() {
		this(System.err);
	}

	public ConsoleReporter(PrintStream out) {
		if (out == null)
			throw new NullPointerException();
		this.out = out;
	}

	@Override
	public void translatingContexts(Formula left, Formula right, Formula condition, int occurrences) {
		out.println("translating contexts: " + occurrences + " occurrence(s)");
		out.println("  L = " + left);
		out.println("  R = " + right);
		out.println("  C = " + condition);
	}

	@Override
	public void solvingCNF(int primaryVars, int vars, int clauses) {
		out.println("solving p cnf " + vars + " " + clauses + " (" + primaryVars + " primary)");
	}

	@Override
	public void boundedSearch(int prefixLength, int cycleLength) {
		out.println("searching lassos with prefix " + prefixLength + " and cycle " + cycleLength);
	}

	@Override
	public void warning(String message) {
		out.println("warning: " + message);
	}

	@Override
	public void debug(String message) {
		if (Options.isDebug())
			out.println("debug: " + message);
	}
}
