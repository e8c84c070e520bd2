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
package ctxform.ast.visitor;

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

/**
 * A depth first replacer. The default implementation of each visit method
 * returns the node itself if none of its children changed, and a copy of the
 * node over the replaced children otherwise. Leaves are returned unchanged.
 */
public abstract class AbstractReplacer implements ReturnVisitor<Formula> {

	protected AbstractReplacer() {}

	public Formula visit(ConstantFormula constant) {
		return constant;
	}

	public Formula visit(Proposition proposition) {
		return proposition;
	}

	public Formula visit(Hole hole) {
		return hole;
	}

	public Formula visit(ContextFormula context) {
		final Formula argument = context.argument().accept(this);
		return argument == context.argument() ? context : Formula.context(context.name(), argument);
	}

	public Formula visit(NotFormula not) {
		final Formula formula = not.formula().accept(this);
		return formula == not.formula() ? not : formula.not();
	}

	public Formula visit(BinaryFormula binFormula) {
		final Formula left = binFormula.left().accept(this);
		final Formula right = binFormula.right().accept(this);
		return left == binFormula.left() && right == binFormula.right() ? binFormula
				: Formula.compose(binFormula.op(), left, right);
	}

	public Formula visit(UnaryTempFormula tempFormula) {
		final Formula formula = tempFormula.formula().accept(this);
		return formula == tempFormula.formula() ? tempFormula : Formula.compose(tempFormula.op(), formula);
	}

	public Formula visit(BinaryTempFormula tempFormula) {
		final Formula left = tempFormula.left().accept(this);
		final Formula right = tempFormula.right().accept(this);
		return left == tempFormula.left() && right == tempFormula.right() ? tempFormula
				: Formula.compose(tempFormula.op(), left, right);
	}

	public Formula visit(PathFormula pathFormula) {
		final Formula formula = pathFormula.formula().accept(this);
		return formula == pathFormula.formula() ? pathFormula : Formula.compose(pathFormula.quantifier(), formula);
	}
}
