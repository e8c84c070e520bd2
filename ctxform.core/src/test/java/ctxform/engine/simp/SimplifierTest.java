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
package ctxform.engine.simp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import ctxform.ast.Formula;

public class SimplifierTest {

	private static final Formula p = Formula.proposition("p"), q = Formula.proposition("q"),
			r = Formula.proposition("r");
	private static final Formula T = Formula.TRUE, F = Formula.FALSE;

	private static Formula simplify(Formula formula) {
		return Simplifier.simplify(formula, Collections.<String, Boolean>emptyMap());
	}

	@Test
	public void testLiterals() {
		assertSame(T, simplify(T));
		assertSame(F, simplify(F));
		assertSame(p, simplify(p));
		assertEquals(simplify(p.or(F)), simplify(T.and(p.or(F))));
	}

	@Test
	public void testValuation() {
		final Map<String, Boolean> valuation = new HashMap<>();
		valuation.put("p", true);
		valuation.put("q", false);

		assertSame(T, Simplifier.simplify(p, valuation));
		assertSame(F, Simplifier.simplify(q, valuation));
		assertSame(r, Simplifier.simplify(r, valuation));
		assertEquals(r, Simplifier.simplify(p.and(r).or(q), valuation));
		assertEquals(r.not(), Simplifier.simplify(r.implies(q), valuation));
		assertEquals(p.and(r), Simplifier.simplify(p.and(r), null));
	}

	@Test
	public void testNegation() {
		assertSame(F, simplify(T.not()));
		assertSame(T, simplify(F.not()));
		assertEquals(p, simplify(p.not().not()));
		assertEquals(p.not(), simplify(p.not().not().not()));
	}

	@Test
	public void testDisjunction() {
		assertSame(T, simplify(p.or(T)));
		assertSame(T, simplify(T.or(p)));
		assertEquals(q, simplify(F.or(q)));
		assertEquals(p, simplify(p.or(F)));
		assertEquals(p.and(q), simplify(p.and(q).or(p.and(q))));
		assertEquals(p.or(q), simplify(p.or(q)));
	}

	@Test
	public void testConjunction() {
		assertSame(F, simplify(p.and(F)));
		assertSame(F, simplify(F.and(T)));
		assertEquals(q, simplify(T.and(q)));
		assertEquals(p, simplify(p.and(T)));
		assertEquals(p, simplify(p.and(p)));
	}

	@Test
	public void testImplication() {
		assertSame(T, simplify(F.implies(p)));
		assertSame(T, simplify(p.implies(T)));
		assertEquals(q, simplify(T.implies(q)));
		assertEquals(p.not(), simplify(p.implies(F)));
		assertEquals(p, simplify(p.not().implies(F)));
	}

	@Test
	public void testEquivalence() {
		assertEquals(q, simplify(T.iff(q)));
		assertEquals(p, simplify(p.iff(T)));
		assertEquals(q.not(), simplify(F.iff(q)));
		assertEquals(p.not(), simplify(p.iff(F)));
		assertSame(F, simplify(T.iff(F)));
	}

	@Test
	public void testExclusion() {
		assertEquals(q.not(), simplify(T.xor(q)));
		assertEquals(p.not(), simplify(p.xor(T)));
		assertEquals(q, simplify(F.xor(q)));
		assertEquals(p, simplify(p.xor(F)));
	}

	@Test
	public void testUnaryOperators() {
		assertSame(T, simplify(T.always()));
		assertSame(F, simplify(F.eventually()));
		assertSame(T, simplify(T.next()));
		assertSame(F, simplify(F.forAll()));
		assertEquals(p.eventually().not(), simplify(p.not().always()));
		assertEquals(p.always().not(), simplify(p.not().eventually()));
		assertEquals(p.next().not(), simplify(p.not().next()));
		assertEquals(p.exists().not(), simplify(p.not().forAll()));
		assertEquals(p.forAll().not(), simplify(p.not().exists()));
		assertEquals(p.eventually().always(), simplify(p.eventually().always()));
	}

	@Test
	public void testUntil() {
		assertSame(T, simplify(p.until(T)));
		assertSame(F, simplify(p.until(F)));
		assertSame(F, simplify(T.until(F)));
		assertEquals(q, simplify(F.until(q)));
		assertEquals(q.eventually(), simplify(T.until(q)));
	}

	@Test
	public void testWeakUntil() {
		assertSame(T, simplify(T.weakUntil(q)));
		assertSame(T, simplify(p.weakUntil(T)));
		assertEquals(p.always(), simplify(p.weakUntil(F)));
		assertEquals(q, simplify(F.weakUntil(q)));
	}

	@Test
	public void testRelease() {
		assertSame(T, simplify(T.releases(q)));
		assertSame(T, simplify(p.releases(T)));
		assertEquals(q.always(), simplify(F.releases(q)));
		assertSame(F, simplify(p.releases(F)));
	}

	@Test
	public void testStrongRelease() {
		assertSame(F, simplify(F.strongReleases(q)));
		assertSame(F, simplify(p.strongReleases(F)));
		assertEquals(q, simplify(T.strongReleases(q)));
		assertEquals(p.eventually(), simplify(p.strongReleases(T)));
	}

	@Test
	public void testFirstRuleWins() {
		// a = false and b = false both apply to weak until
		assertEquals(F.always(), simplify(F.weakUntil(F)));
		// b = false wins over a = true for strong release
		assertSame(F, simplify(T.strongReleases(F)));
	}

	@Test
	public void testSinglePass() {
		// the rewritten node is not simplified again
		assertEquals(F.always(), simplify(F.weakUntil(F)));
		assertSame(F, simplify(simplify(F.weakUntil(F))));
	}

	@Test
	public void testContextArguments() {
		final Formula context = Formula.context("c", p.and(T));
		assertEquals(Formula.context("c", p), simplify(context));
	}

	@Test
	public void testHoles() {
		final Formula witness = Formula.HOLE.implies(p).always().implies(q).and(Formula.HOLE.implies(r).always().implies(p));
		final Map<String, Boolean> valuation = Collections.singletonMap("p", true);

		assertEquals(q, Simplifier.simplify(witness, valuation));
	}

	@Test
	public void testNegate() {
		assertEquals(p, Simplifier.negate(p.not()));
		assertEquals(p.not(), Simplifier.negate(p));
	}
}
