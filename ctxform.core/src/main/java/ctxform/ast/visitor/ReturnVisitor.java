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
 * A visitor that visits every node in a formula and returns an object of
 * type T.
 *
 * @param <T> the type of the value returned by this visitor
 */
public interface ReturnVisitor<T> {

	public T visit(ConstantFormula constant);

	public T visit(Proposition proposition);

	public T visit(ContextFormula context);

	public T visit(Hole hole);

	public T visit(NotFormula not);

	public T visit(BinaryFormula binFormula);

	public T visit(UnaryTempFormula tempFormula);

	public T visit(BinaryTempFormula tempFormula);

	public T visit(PathFormula pathFormula);
}
