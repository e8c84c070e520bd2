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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import ctxform.engine.satlab.SATFactory;
import ctxform.engine.satlab.SATSolver;

public class BooleanFactoryTest {

	private SATSolver solver;
	private BooleanFactory factory;

	@Before
	public void setUp() {
		solver = SATFactory.DEFAULT.instance(10);
		factory = new BooleanFactory(solver);
	}

	@After
	public void tearDown() {
		solver.free();
	}

	@Test
	public void testConstantFolding() {
		final int a = factory.variable(), T = factory.constant(true), F = factory.constant(false);
		final int vars = solver.numberOfVariables();

		assertEquals(F, factory.and(a, F));
		assertEquals(a, factory.and(T, a));
		assertEquals(a, factory.and(a, a));
		assertEquals(F, factory.and(a, -a));
		assertEquals(T, factory.or(a, -a));
		assertEquals(T, factory.implies(F, a));
		assertEquals(-a, factory.iff(a, F));
		assertEquals(T, factory.iff(a, a));
		assertEquals(a, factory.xor(F, a));
		// nothing was added for the folded gates
		assertEquals(vars, solver.numberOfVariables());
	}

	@Test
	public void testExclusiveDisjunction() {
		final int a = factory.variable(), b = factory.variable();
		factory.assertTrue(factory.xor(a, b));
		factory.assertTrue(a);

		assertTrue(solver.solve());
		assertTrue(solver.valueOf(a));
		assertFalse(solver.valueOf(b));
	}

	@Test
	public void testUnsatisfiable() {
		final int a = factory.variable(), b = factory.variable();
		factory.assertTrue(factory.iff(a, b));
		factory.assertTrue(factory.and(a, -b));

		assertFalse(solver.solve());
	}
}
