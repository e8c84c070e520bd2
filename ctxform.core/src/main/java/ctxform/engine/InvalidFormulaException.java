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
package ctxform.engine;

/**
 * Indicates that a formula uses an operator the selected logic does not
 * support, or violates one of its well-formedness rules.
 */
public final class InvalidFormulaException extends RuntimeException {

	private static final long serialVersionUID = 3864823175417208916L;

	private final String side;

	public InvalidFormulaException(String message) {
		super(message);
		this.side = null;
	}

	/**
	 * Constructs an exception for the given side of the equation ("left" or
	 * "right"), extending the message of the given cause.
	 */
	public InvalidFormulaException(String side, InvalidFormulaException cause) {
		super(side + " equation is not valid: " + cause.getMessage(), cause);
		this.side = side;
	}

	/**
	 * Returns the side of the equation where the offending formula was found,
	 * or null if unknown.
	 */
	public String side() {
		return side;
	}
}
