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
package ctxform.engine.bool;

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
 * Translates context-free propositional formulas to gates of a
 * {@link BooleanFactory}, allocating one variable per proposition.
 */
final class BooleanTranslator implements ReturnVisitor<Integer> {

	private final BooleanFactory factory;
	private final Map<String, Integer> variables = new LinkedHashMap<>();

	BooleanTranslator(BooleanFactory factory) {
		this.factory = factory;
	}

	/**
	 * Returns the literal of the given formula.
	 *
	 * @throws InvalidFormulaException formula has temporal operators
	 */
	int translate(Formula formula) {
		return formula.accept(this);
	}

	/**
	 * Returns the variables of the propositions met so far.
	 */
	Map<String, Integer> variables() {
		return variables;
	}

	public Integer visit(ConstantFormula constant) {
		return factory.constant(constant.booleanValue());
	}

	public Integer visit(Proposition proposition) {
		return variables.computeIfAbsent(proposition.name(), name -> factory.variable());
	}

	public Integer visit(ContextFormula context) {
		throw new IllegalStateException("cannot encode context " + context.name());
	}

	public Integer visit(Hole hole) {
		throw new IllegalStateException("cannot encode a hole");
	}

	public Integer visit(NotFormula not) {
		return factory.not(not.formula().accept(this));
	}

	public Integer visit(BinaryFormula binFormula) {
		final int left = binFormula.left().accept(this);
		final int right = binFormula.right().accept(this);

		switch (binFormula.op()) {
		case AND:
			return factory.and(left, right);
		case OR:
			return factory.or(left, right);
		case IMPLIES:
			return factory.implies(left, right);
		case IFF:
			return factory.iff(left, right);
		case XOR:
			return factory.xor(left, right);
		default:
			throw new IllegalArgumentException("unknown operator: " + binFormula.op());
		}
	}

	public Integer visit(UnaryTempFormula tempFormula) {
		throw new InvalidFormulaException("not a Boolean formula: " + tempFormula.op());
	}

	public Integer visit(BinaryTempFormula tempFormula) {
		throw new InvalidFormulaException("not a Boolean formula: " + tempFormula.op());
	}

	public Integer visit(PathFormula pathFormula) {
		throw new InvalidFormulaException("not a Boolean formula: " + pathFormula.quantifier());
	}
}
