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
package ctxform.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;

import org.junit.Test;

import ctxform.ast.operator.FormulaOperator;
import ctxform.ast.operator.TemporalOperator;

public class FormulaTest {

	private static final Formula p = Formula.proposition("p"), q = Formula.proposition("q");

	@Test
	public void testStructuralEquality() {
		assertEquals(Formula.proposition("p"), p);
		assertEquals(p.and(q).until(q), Formula.proposition("p").and(Formula.proposition("q")).until(q));
		assertEquals(p.and(q).hashCode(), Formula.proposition("p").and(q).hashCode());
		assertEquals(Formula.context("c", p.not()), Formula.context("c", p.not()));

		assertNotEquals(p.and(q), q.and(p));
		assertNotEquals(p.and(q), p.or(q));
		assertNotEquals(p.until(q), p.weakUntil(q));
		assertNotEquals(Formula.context("c", p), Formula.context("d", p));
		assertNotEquals(p.forAll(), p.exists());
		assertNotEquals(Formula.TRUE, Formula.FALSE);
	}

	@Test
	public void testConstants() {
		assertSame(Formula.TRUE, Formula.constant(true));
		assertSame(Formula.FALSE, Formula.constant(false));
	}

	@Test
	public void testCompose() {
		assertEquals(p.iff(q), Formula.compose(FormulaOperator.IFF, p, q));
		assertEquals(p.strongReleases(q), Formula.compose(TemporalOperator.STRONG_RELEASE, p, q));
		assertEquals(p.next(), Formula.compose(TemporalOperator.NEXT, p));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnaryWithBinaryOperator() {
		Formula.compose(TemporalOperator.UNTIL, p);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBinaryWithUnaryOperator() {
		Formula.compose(TemporalOperator.ALWAYS, p, q);
	}

	@Test(expected = NullPointerException.class)
	public void testNullProposition() {
		Formula.proposition(null);
	}
}
