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
package ctxform.engine.ctx;

import ctxform.ast.Formula;

/**
 * An application of a context variable to an argument, together with the
 * fresh proposition that stands for it in context-free formulas.
 *
 * @specfield context: String
 * @specfield argument: Formula
 * @specfield proposition: String
 */
public final class Occurrence {

	private final String context;
	private final Formula argument;
	private final String proposition;

	Occurrence(String context, Formula argument, String proposition) {
		this.context = context;
		this.argument = argument;
		this.proposition = proposition;
	}

	/**
	 * @return this.context
	 */
	public String context() {
		return context;
	}

	/**
	 * Returns the argument of the application, already free of contexts.
	 * @return this.argument
	 */
	public Formula argument() {
		return argument;
	}

	/**
	 * @return this.proposition
	 */
	public String proposition() {
		return proposition;
	}

	@Override
	public String toString() {
		return proposition + " = " + context + "[" + argument + "]";
	}
}
