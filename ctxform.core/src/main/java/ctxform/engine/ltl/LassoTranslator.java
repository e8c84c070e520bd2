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
package ctxform.engine.ltl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
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
import ctxform.engine.bool.BooleanFactory;
import ctxform.engine.eval.Lasso;

/**
 * Translates context-free LTL formulas to gates evaluated over a lasso of
 * fixed shape: positions 0 to length - 1, where the successor of the last
 * position is the loop start. Each formula is translated into one literal
 * per position, which holds iff the formula holds at that position of the
 * infinite word the lasso unrolls to. Subformulas are translated once.
 *
 * @specfield loop: int // first position of the cycle
 * @specfield length: int // number of positions
 * @invariant 0 <= loop < length
 */
final class LassoTranslator implements ReturnVisitor<int[]> {

	private final BooleanFactory factory;
	private final int loop, length;
	private final Map<String, int[]> variables = new LinkedHashMap<>();
	private final Map<Formula, int[]> cache = new HashMap<>();

	/**
	 * @throws IllegalArgumentException prefixLength < 0 || cycleLength < 1
	 */
	LassoTranslator(BooleanFactory factory, int prefixLength, int cycleLength) {
		if (prefixLength < 0 || cycleLength < 1)
			throw new IllegalArgumentException("invalid lasso shape: " + prefixLength + "|" + cycleLength);
		this.factory = factory;
		this.loop = prefixLength;
		this.length = prefixLength + cycleLength;
	}

	/**
	 * Returns the literals of the given formula at every position.
	 *
	 * @throws InvalidFormulaException formula has path quantifiers
	 * @throws IllegalStateException formula has contexts or holes
	 */
	int[] translate(Formula formula) {
		return formula.accept(this);
	}

	/**
	 * Returns the number of propositions met so far.
	 */
	int propositions() {
		return variables.size();
	}

	/**
	 * Reads the lasso of the last model of the solver, with the values of
	 * the propositions met so far.
	 */
	Lasso lasso() {
		final List<Map<String, Boolean>> steps = new ArrayList<>(length);
		for (int i = 0; i < length; i++) {
			final Map<String, Boolean> step = new LinkedHashMap<>();
			for (Map.Entry<String, int[]> entry : variables.entrySet())
				step.put(entry.getKey(), factory.solver().valueOf(entry.getValue()[i]));
			steps.add(step);
		}
		return new Lasso(steps.subList(0, loop), steps.subList(loop, length));
	}

	private int successor(int position) {
		return position == length - 1 ? loop : position + 1;
	}

	private int[] cached(Formula formula, int[] literals) {
		cache.put(formula, literals);
		return literals;
	}

	private int[] constant(boolean value) {
		final int[] literals = new int[length];
		Arrays.fill(literals, factory.constant(value));
		return literals;
	}

	private int[] not(int[] operand) {
		final int[] literals = new int[length];
		for (int i = 0; i < length; i++)
			literals[i] = factory.not(operand[i]);
		return literals;
	}

	private int[] and(int[] left, int[] right) {
		final int[] literals = new int[length];
		for (int i = 0; i < length; i++)
			literals[i] = factory.and(left[i], right[i]);
		return literals;
	}

	private int[] or(int[] left, int[] right) {
		final int[] literals = new int[length];
		for (int i = 0; i < length; i++)
			literals[i] = factory.or(left[i], right[i]);
		return literals;
	}

	/**
	 * Encodes left U right. The cycle is unrolled twice: the first copy
	 * decides whether right is reached before the end of the cycle, the
	 * second one continues from the loop start into the first copy, so every
	 * position sees each cycle position once.
	 */
	private int[] until(int[] left, int[] right) {
		final int last = length - 1;

		final int[] inner = new int[length];
		inner[last] = right[last];
		for (int i = last - 1; i >= loop; i--)
			inner[i] = factory.or(right[i], factory.and(left[i], inner[i + 1]));

		final int[] literals = new int[length];
		literals[last] = factory.or(right[last], factory.and(left[last], inner[loop]));
		for (int i = last - 1; i >= 0; i--)
			literals[i] = factory.or(right[i], factory.and(left[i], literals[i + 1]));

		return literals;
	}

	private int[] always(int[] operand) {
		return not(until(constant(true), not(operand)));
	}

	public int[] visit(ConstantFormula constant) {
		return constant(constant.booleanValue());
	}

	public int[] visit(Proposition proposition) {
		int[] literals = variables.get(proposition.name());
		if (literals == null) {
			literals = new int[length];
			for (int i = 0; i < length; i++)
				literals[i] = factory.variable();
			variables.put(proposition.name(), literals);
		}
		return literals;
	}

	public int[] visit(ContextFormula context) {
		throw new IllegalStateException("cannot encode context " + context.name());
	}

	public int[] visit(Hole hole) {
		throw new IllegalStateException("cannot encode a hole");
	}

	public int[] visit(NotFormula not) {
		final int[] literals = cache.get(not);
		return literals != null ? literals : cached(not, not(not.formula().accept(this)));
	}

	public int[] visit(BinaryFormula binFormula) {
		int[] literals = cache.get(binFormula);
		if (literals != null)
			return literals;

		final int[] left = binFormula.left().accept(this);
		final int[] right = binFormula.right().accept(this);
		literals = new int[length];

		for (int i = 0; i < length; i++) {
			switch (binFormula.op()) {
			case AND:
				literals[i] = factory.and(left[i], right[i]);
				break;
			case OR:
				literals[i] = factory.or(left[i], right[i]);
				break;
			case IMPLIES:
				literals[i] = factory.implies(left[i], right[i]);
				break;
			case IFF:
				literals[i] = factory.iff(left[i], right[i]);
				break;
			case XOR:
				literals[i] = factory.xor(left[i], right[i]);
				break;
			default:
				throw new IllegalArgumentException("unknown operator: " + binFormula.op());
			}
		}

		return cached(binFormula, literals);
	}

	public int[] visit(UnaryTempFormula tempFormula) {
		int[] literals = cache.get(tempFormula);
		if (literals != null)
			return literals;

		final int[] operand = tempFormula.formula().accept(this);

		switch (tempFormula.op()) {
		case NEXT:
			literals = new int[length];
			for (int i = 0; i < length; i++)
				literals[i] = operand[successor(i)];
			break;
		case EVENTUALLY:
			literals = until(constant(true), operand);
			break;
		case ALWAYS:
			literals = always(operand);
			break;
		default:
			throw new IllegalArgumentException("not a unary temporal operator: " + tempFormula.op());
		}

		return cached(tempFormula, literals);
	}

	public int[] visit(BinaryTempFormula tempFormula) {
		int[] literals = cache.get(tempFormula);
		if (literals != null)
			return literals;

		final int[] left = tempFormula.left().accept(this);
		final int[] right = tempFormula.right().accept(this);

		switch (tempFormula.op()) {
		case UNTIL:
			literals = until(left, right);
			break;
		case WEAK_UNTIL:
			literals = or(until(left, right), always(left));
			break;
		case RELEASE:
			literals = not(until(not(left), not(right)));
			break;
		case STRONG_RELEASE:
			literals = until(right, and(left, right));
			break;
		default:
			throw new IllegalArgumentException("not a binary temporal operator: " + tempFormula.op());
		}

		return cached(tempFormula, literals);
	}

	public int[] visit(PathFormula pathFormula) {
		throw new InvalidFormulaException("not an LTL formula: " + pathFormula.quantifier());
	}
}
