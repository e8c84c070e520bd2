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

import ctxform.ast.BinaryTempFormula;
import ctxform.ast.Formula;
import ctxform.ast.PathFormula;
import ctxform.ast.UnaryTempFormula;
import ctxform.ast.visitor.AbstractDetector;
import ctxform.engine.Counterexample;
import ctxform.engine.InvalidFormulaException;
import ctxform.engine.Logic;
import ctxform.engine.Problem;
import ctxform.engine.SolverTimeoutException;
import ctxform.engine.config.Options;
import ctxform.engine.satlab.SATAbortedException;
import ctxform.engine.satlab.SATSolver;

/**
 * Equivalence problem of propositional formulas with contexts, decided by a
 * SAT solver.
 */
public final class BoolProblem extends Problem {

	/**
	 * @throws InvalidFormulaException left or right have temporal operators or
	 *             path quantifiers
	 */
	public BoolProblem(Formula left, Formula right, Options options) {
		super(check(left, "left"), check(right, "right"), Logic.BOOL, options);
	}

	private static Formula check(Formula formula, String side) {
		final TemporalDetector detector = new TemporalDetector();
		if (formula.accept(detector))
			throw new InvalidFormulaException(side,
					new InvalidFormulaException("not a Boolean formula: " + detector.operator));
		return formula;
	}

	@Override
	protected Counterexample counterexample(Formula positive, Formula condition, Formula negative) {
		final SATSolver solver = options.solver().instance(options.timeout());

		try {
			final BooleanFactory factory = new BooleanFactory(solver);
			final BooleanTranslator translator = new BooleanTranslator(factory);

			factory.assertTrue(translator.translate(positive));
			factory.assertTrue(translator.translate(condition));
			factory.assertTrue(factory.not(translator.translate(negative)));

			options.reporter().solvingCNF(translator.variables().size(), solver.numberOfVariables(),
					solver.numberOfClauses());

			if (!solver.solve())
				return null;

			final Map<String, Boolean> values = new LinkedHashMap<>();
			for (Map.Entry<String, Integer> entry : translator.variables().entrySet())
				values.put(entry.getKey(), solver.valueOf(entry.getValue()));

			return new BooleanModel(values);
		} catch (SATAbortedException e) {
			throw new SolverTimeoutException(options.timeout(), e);
		} finally {
			solver.free();
		}
	}

	/**
	 * Finds the first temporal operator or path quantifier of a formula.
	 */
	private static final class TemporalDetector extends AbstractDetector {

		private Object operator;

		@Override
		public Boolean visit(UnaryTempFormula tempFormula) {
			operator = tempFormula.op();
			return Boolean.TRUE;
		}

		@Override
		public Boolean visit(BinaryTempFormula tempFormula) {
			operator = tempFormula.op();
			return Boolean.TRUE;
		}

		@Override
		public Boolean visit(PathFormula pathFormula) {
			operator = pathFormula.quantifier();
			return Boolean.TRUE;
		}
	}
}
