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
import ctxform.ast.Hole;
import ctxform.ast.NotFormula;
import ctxform.ast.PathFormula;
import ctxform.ast.Proposition;
import ctxform.ast.UnaryTempFormula;

/**
 * Detects whether a formula has some property. By default, leaves do not have
 * the property and an inner node has it iff one of its children has it.
 * Subclasses override the visit methods of the nodes that carry the property.
 */
public abstract class AbstractDetector implements ReturnVisitor<Boolean> {

	protected AbstractDetector() {}

	public Boolean visit(ConstantFormula constant) {
		return Boolean.FALSE;
	}

	public Boolean visit(Proposition proposition) {
		return Boolean.FALSE;
	}

	public Boolean visit(Hole hole) {
		return Boolean.FALSE;
	}

	public Boolean visit(ContextFormula context) {
		return context.argument().accept(this);
	}

	public Boolean visit(NotFormula not) {
		return not.formula().accept(this);
	}

	public Boolean visit(BinaryFormula binFormula) {
		return binFormula.left().accept(this) || binFormula.right().accept(this);
	}

	public Boolean visit(UnaryTempFormula tempFormula) {
		return tempFormula.formula().accept(this);
	}

	public Boolean visit(BinaryTempFormula tempFormula) {
		return tempFormula.left().accept(this) || tempFormula.right().accept(this);
	}

	public Boolean visit(PathFormula pathFormula) {
		return pathFormula.formula().accept(this);
	}
}
