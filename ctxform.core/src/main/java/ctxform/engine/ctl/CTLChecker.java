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
 * Checks that a formula belongs to the fragment of CTL that ctl-sat accepts:
 * every temporal operator is directly below a path quantifier, possibly
 * with a single negation in between, and every operand of a temporal
 * operator is a state formula. Contexts stand for state formulas.
 */
public final class CTLChecker implements ReturnVisitor<Void> {

	/** A state formula is expected. */
	private static final int STATE = 0;
	/** A path formula is expected, below a quantifier. */
	private static final int PATH = 1;
	/** A path formula is expected, below a quantifier and a negation. */
	private static final int NEGATED_PATH = 2;

	private int level = STATE;

	private CTLChecker() {}

	/**
	 * Checks the given formula.
	 *
	 * @throws InvalidFormulaException formula is not in the fragment
	 */
	public static void check(Formula formula) {
		formula.accept(new CTLChecker());
	}

	private Void visitAt(Formula formula, int level) {
		final int saved = this.level;
		this.level = level;
		try {
			return formula.accept(this);
		} finally {
			this.level = saved;
		}
	}

	public Void visit(ConstantFormula constant) {
		return null;
	}

	public Void visit(Proposition proposition) {
		return null;
	}

	public Void visit(Hole hole) {
		return null;
	}

	public Void visit(ContextFormula context) {
		if (level != STATE)
			throw new InvalidFormulaException("context cannot appear as path formula");
		return visitAt(context.argument(), STATE);
	}

	public Void visit(NotFormula not) {
		if (level == NEGATED_PATH)
			throw new InvalidFormulaException("double negation is not supported");
		return visitAt(not.formula(), level == PATH ? NEGATED_PATH : level);
	}

	public Void visit(PathFormula pathFormula) {
		if (level != STATE)
			throw new InvalidFormulaException("double quantification");
		return visitAt(pathFormula.formula(), PATH);
	}

	public Void visit(BinaryFormula binFormula) {
		if (level != STATE)
			throw new InvalidFormulaException("unexpected " + binFormula.op().name() + " operator");
		visitAt(binFormula.left(), STATE);
		return visitAt(binFormula.right(), STATE);
	}

	public Void visit(UnaryTempFormula tempFormula) {
		if (level == STATE)
			throw new InvalidFormulaException("unexpected " + tempFormula.op().name() + " operator");
		return visitAt(tempFormula.formula(), STATE);
	}

	public Void visit(BinaryTempFormula tempFormula) {
		if (level == STATE)
			throw new InvalidFormulaException("unexpected " + tempFormula.op().name() + " operator");
		visitAt(tempFormula.left(), STATE);
		return visitAt(tempFormula.right(), STATE);
	}
}
