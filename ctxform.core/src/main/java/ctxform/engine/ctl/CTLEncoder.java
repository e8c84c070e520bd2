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
package ctxform.engine.ctl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import ctxform.ast.BinaryFormula;
import ctxform.ast.BinaryTempFormula;
import ctxform.ast.ConstantFormula;
import ctxform.ast.ContextFormula;
import ctxform.ast.Formula;
import ctxform.ast.Hole;
import ctxform.ast.NotFormula;
import ctxform.ast.PathFormula;
import ctxform.ast.Proposition;
import ctxform.ast.UnaryTempFormula;
import ctxform.ast.visitor.ReturnVisitor;
import ctxform.engine.InvalidFormulaException;

/**
 * Encodes adapted CTL formulas in the syntax of ctl-sat, where propositions
 * are single characters. Each proposition gets the first printable ASCII
 * character after the last one given that is not reserved by the syntax.
 * The same encoder must be used for all the formulas of a query so that
 * their propositions agree.
 */
public final class CTLEncoder {

	/** Characters of the ctl-sat syntax. */
	public static final String RESERVED = "^v~->()TAEUFGX$";

	/** Character standing for the hole. */
	public static final char HOLE = '!';

	/** Characters before the first proposition. */
	private static final char FIRST = '"';

	/** Last character a proposition may take. */
	public static final char LAST = '~';

	private final Map<String, Character> variables = new LinkedHashMap<>();
	private char next = FIRST;

	/**
	 * Returns the encoding of the given formula.
	 *
	 * @throws InvalidFormulaException formula has operators that ctl-sat does
	 *             not support
	 * @throws TooManyVariablesException the characters for propositions ran out
	 * @throws IllegalStateException formula has contexts
	 */
	public String encode(Formula formula) {
		return formula.accept(new Encoder());
	}

	/**
	 * Returns the characters assigned so far.
	 */
	public Map<String, Character> variables() {
		return Collections.unmodifiableMap(variables);
	}

	/**
	 * Returns the number of propositions that an encoder can handle.
	 */
	public static int capacity() {
		int count = 0;
		for (char c = FIRST + 1; c <= LAST; c++) {
			if (RESERVED.indexOf(c) < 0)
				count++;
		}
		return count;
	}

	private char character(String name) {
		Character c = variables.get(name);
		if (c == null) {
			do {
				next++;
			} while (RESERVED.indexOf(next) >= 0);

			if (next > LAST)
				throw new TooManyVariablesException(capacity());

			c = next;
			variables.put(name, c);
		}
		return c;
	}

	private final class Encoder implements ReturnVisitor<String> {

		public String visit(ConstantFormula constant) {
			return constant.booleanValue() ? "T" : "(~T)";
		}

		public String visit(Proposition proposition) {
			return String.valueOf(character(proposition.name()));
		}

		public String visit(ContextFormula context) {
			throw new IllegalStateException("cannot encode context " + context.name());
		}

		public String visit(Hole hole) {
			return String.valueOf(HOLE);
		}

		public String visit(NotFormula not) {
			return "~ " + not.formula().accept(this);
		}

		public String visit(BinaryFormula binFormula) {
			final String left = binFormula.left().accept(this);
			final String right = binFormula.right().accept(this);

			switch (binFormula.op()) {
			case OR:
				return "(" + left + " v " + right + ")";
			case AND:
				return "(" + left + " ^ " + right + ")";
			case IMPLIES:
				return "(" + left + " -> " + right + ")";
			default:
				throw new InvalidFormulaException("not a valid CTL formula: " + binFormula.op().name());
			}
		}

		public String visit(UnaryTempFormula tempFormula) {
			return tempFormula.op() + " " + tempFormula.formula().accept(this);
		}

		public String visit(BinaryTempFormula tempFormula) {
			switch (tempFormula.op()) {
			case UNTIL:
				return "(" + tempFormula.left().accept(this) + " U " + tempFormula.right().accept(this) + ")";
			default:
				throw new InvalidFormulaException("not a valid CTL formula: " + tempFormula.op().name());
			}
		}

		public String visit(PathFormula pathFormula) {
			return "(" + pathFormula.quantifier() + " " + pathFormula.formula().accept(this) + ")";
		}
	}
}
