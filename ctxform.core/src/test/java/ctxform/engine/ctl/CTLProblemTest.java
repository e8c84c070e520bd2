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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import ctxform.ast.Formula;
import ctxform.engine.AbortedException;
import ctxform.engine.InvalidFormulaException;
import ctxform.engine.Logic;
import ctxform.engine.Problem;
import ctxform.engine.Solution;
import ctxform.engine.SolverTimeoutException;
import ctxform.engine.config.Options;

public class CTLProblemTest {

	private static final Formula p = Formula.proposition("p"), q = Formula.proposition("q");

	private Options options;
	private List<String> queries;

	@Before
	public void setUp() {
		options = new Options();
		queries = new ArrayList<>();
	}

	/** Answers the queries in order, recording them. */
	private void answer(final boolean... answers) {
		options.setCTLSolver((formula, timeout) -> {
			assertEquals(options.timeout(), timeout);
			queries.add(formula);
			return answers[queries.size() - 1];
		});
	}

	@Test
	public void testQueries() {
		answer(false, false);
		final Solution solution = new CTLProblem(p.always().forAll(), p.not().eventually().exists().not(), options)
				.solve();

		assertTrue(solution.equivalent());
		assertEquals(2, queries.size());
		assertEquals("((A G #)) ^ (T) ^ (~ ~ (E F ~ #))", queries.get(0));
		assertEquals("(~ (E F ~ #)) ^ (T) ^ (~ (A G #))", queries.get(1));
	}

	@Test
	public void testNoModel() {
		answer(true, false);
		final Solution solution = new CTLProblem(p.eventually().forAll(), p, options).solve();

		assertFalse(solution.equivalent());
		assertNull(solution.rightNotLeft());
		assertNull(solution.leftNotRight().valuation());
		assertEquals("no more info", solution.leftNotRight().toString());
	}

	@Test
	public void testContexts() {
		answer(true, true);
		final Problem problem = Logic.CTL.problem(Formula.context("c", p), Formula.context("c", q), options);
		problem.solve();

		// c[p], p, q and c[q], in order of first encoding
		assertEquals(4, ((CTLProblem) problem).encoding().size());
		assertEquals("(#) ^ (((A G ((A G (% -> &)) -> (# -> '))) ^ (A G ((A G (& -> %)) -> (' -> #))))) ^ (~ ')",
				queries.get(0));

		// witnesses are never simplified
		assertEquals(problem.translation().canonicalContext(), problem.canonicalContext(true).context());
		assertFalse(problem.canonicalContext(true).isSplit());
	}

	@Test
	public void testAdaptation() {
		final Problem problem = new CTLProblem(p.releases(q).forAll(), p.iff(q), options);
		assertEquals(p.not().until(q.not()).not().forAll(), problem.left());
		assertEquals(p.implies(q).and(q.implies(p)), problem.right());
	}

	@Test
	public void testInvalidFormula() {
		try {
			new CTLProblem(p, q.always(), options);
			fail();
		} catch (InvalidFormulaException e) {
			assertEquals("right", e.side());
			assertEquals("right equation is not valid: unexpected ALWAYS operator", e.getMessage());
		}
	}

	@Test(expected = AbortedException.class)
	public void testNoSolver() {
		new CTLProblem(p, q, options).solve();
	}

	@Test(expected = SolverTimeoutException.class)
	public void testTimeout() {
		options.setCTLSolver((formula, timeout) -> {
			throw new SolverTimeoutException(timeout);
		});
		new CTLProblem(p, q, options).solve();
	}
}
