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
package ctxform.util.nodes;

import java.util.Set;
import java.util.regex.Pattern;

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

/**
 * Prints formulas in the Spot-like surface syntax, inserting the parentheses
 * required by operator priorities.
 */
public final class PrettyPrinter {

	/** The symbol used for the hole of a context. */
	public static final String HOLE_SYMBOL = "🕳";

	private static final int ATOM = 6, PREFIX = 5, TEMPORAL = 4;

	/** Names that must be quoted because they read as operators or literals. */
	private static final Set<String> KEYWORDS = Set.of("true", "false", "xor", "U", "W", "R", "V", "M");
	private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

	private PrettyPrinter() {}

	/**
	 * Returns a string representation of the given formula.
	 * @return a string that the surface grammar parses back to the formula
	 */
	public static String print(Formula formula) {
		return formula.accept(new Printer()).text;
	}

	/**
	 * Returns the given proposition name, quoted unless it is a plain
	 * identifier of the surface syntax.
	 */
	public static String name(String name) {
		if (IDENTIFIER.matcher(name).matches() && !KEYWORDS.contains(name) && "FGXAE".indexOf(name.charAt(0)) < 0)
			return name;
		return '"' + name.replace("\"", "") + '"';
	}

	/** A printed formula with the priority of its outermost operator. */
	private static final class Printed {
		final String text;
		final int priority;

		Printed(String text, int priority) {
			this.text = text;
			this.priority = priority;
		}

		String within(int outer) {
			return priority <= outer ? "(" + text + ")" : text;
		}
	}

	private static final class Printer implements ReturnVisitor<Printed> {

		public Printed visit(ConstantFormula constant) {
			return new Printed(constant.booleanValue() ? "true" : "false", ATOM);
		}

		public Printed visit(Proposition proposition) {
			return new Printed(name(proposition.name()), ATOM);
		}

		public Printed visit(ContextFormula context) {
			return new Printed(context.name() + "[" + context.argument().accept(this).text + "]", ATOM);
		}

		public Printed visit(Hole hole) {
			return new Printed(HOLE_SYMBOL, ATOM);
		}

		public Printed visit(NotFormula not) {
			return new Printed("¬" + not.formula().accept(this).within(TEMPORAL), PREFIX);
		}

		public Printed visit(BinaryFormula binFormula) {
			final int priority = binFormula.op().priority();
			return new Printed(binFormula.left().accept(this).within(priority) + " " + binFormula.op() + " "
					+ binFormula.right().accept(this).within(priority), priority);
		}

		public Printed visit(UnaryTempFormula tempFormula) {
			return new Printed(tempFormula.op() + tempFormula.formula().accept(this).within(TEMPORAL), PREFIX);
		}

		public Printed visit(BinaryTempFormula tempFormula) {
			return new Printed(tempFormula.left().accept(this).within(TEMPORAL) + " " + tempFormula.op() + " "
					+ tempFormula.right().accept(this).within(TEMPORAL), TEMPORAL);
		}

		public Printed visit(PathFormula pathFormula) {
			return new Printed(pathFormula.quantifier() + pathFormula.formula().accept(this).within(TEMPORAL), PREFIX);
		}
	}
}
