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
package ctxform.ast;

import java.util.Objects;

import ctxform.ast.visitor.ReturnVisitor;

/**
 * The application of a context variable to a formula, written
 * <code>name[argument]</code>.
 *
 * @specfield name: String
 * @specfield argument: Formula
 */
public final class ContextFormula extends Formula {

	private final String name;
	private final Formula argument;

	/**
	 * @throws NullPointerException name = null || argument = null
	 */
	ContextFormula(String name, Formula argument) {
		this.name = Objects.requireNonNull(name, "name");
		this.argument = Objects.requireNonNull(argument, "argument");
	}

	/**
	 * @return this.name
	 */
	public String name() {
		return name;
	}

	/**
	 * @return this.argument
	 */
	public Formula argument() {
		return argument;
	}

	@Override
	public <T> T accept(ReturnVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ContextFormula))
			return false;
		final ContextFormula other = (ContextFormula) obj;
		return name.equals(other.name) && argument.equals(other.argument);
	}

	@Override
	public int hashCode() {
		return 31 * name.hashCode() + argument.hashCode();
	}
}
