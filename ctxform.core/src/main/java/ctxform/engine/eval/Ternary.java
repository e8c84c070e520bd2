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
package ctxform.engine.eval;

/**
 * Truth values of Kleene's three-valued logic.
 */
public enum Ternary {
	TRUE('1'),
	FALSE('0'),
	UNKNOWN('?');

	private final char symbol;

	private Ternary(char symbol) {
		this.symbol = symbol;
	}

	/**
	 * Returns the truth value of the given Boolean, UNKNOWN for null.
	 */
	public static Ternary of(Boolean value) {
		return value == null ? UNKNOWN : (value ? TRUE : FALSE);
	}

	/**
	 * Returns the truth value of the given boolean.
	 */
	public static Ternary of(boolean value) {
		return value ? TRUE : FALSE;
	}

	/**
	 * Returns the Boolean this value stands for, null if unknown.
	 */
	public Boolean toBoolean() {
		return this == UNKNOWN ? null : Boolean.valueOf(this == TRUE);
	}

	public Ternary not() {
		switch (this) {
		case TRUE:
			return FALSE;
		case FALSE:
			return TRUE;
		default:
			return UNKNOWN;
		}
	}

	public Ternary and(Ternary other) {
		if (this == FALSE || other == FALSE)
			return FALSE;
		return this == TRUE && other == TRUE ? TRUE : UNKNOWN;
	}

	public Ternary or(Ternary other) {
		if (this == TRUE || other == TRUE)
			return TRUE;
		return this == FALSE && other == FALSE ? FALSE : UNKNOWN;
	}

	public Ternary implies(Ternary other) {
		return not().or(other);
	}

	public Ternary iff(Ternary other) {
		if (this == UNKNOWN || other == UNKNOWN)
			return UNKNOWN;
		return of(this == other);
	}

	public Ternary xor(Ternary other) {
		return iff(other).not();
	}

	/**
	 * Returns the character used to print this value in a table.
	 */
	public char symbol() {
		return symbol;
	}
}
