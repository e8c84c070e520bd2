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
package ctxform.engine.ctx;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import ctxform.ast.Formula;

public class InstantiatorTest {

	private static final Formula p = Formula.proposition("p"), q = Formula.proposition("q"),
			r = Formula.proposition("r");

	@Test
	public void testInstantiateContext() {
		final Formula context = Formula.HOLE.always().implies(q);
		assertEquals(p.and(r).always().implies(q), Instantiator.instantiateContext(context, p.and(r)));
	}

	@Test
	public void testInstantiateContextLeaves() {
		assertSame(p, Instantiator.instantiateContext(p, q));
		assertSame(Formula.TRUE, Instantiator.instantiateContext(Formula.TRUE, q));
		assertEquals(q, Instantiator.instantiateContext(Formula.HOLE, q));
	}

	@Test
	public void testInstantiateContextEveryHole() {
		// canonical contexts mention the hole once per occurrence
		final Formula context = Formula.HOLE.implies(p).and(Formula.HOLE.implies(q));
		assertEquals(r.implies(p).and(r.implies(q)), Instantiator.instantiateContext(context, r));
	}

	@Test
	public void testInstantiateContextNested() {
		final Formula context = Formula.context("d", Formula.HOLE.or(p));
		assertEquals(Formula.context("d", q.or(p)), Instantiator.instantiateContext(context, q));
	}

	@Test
	public void testSubstitutionSoundness() {
		final Formula[] formulas = { p, p.and(q).until(r), p.next().not(), Formula.context("d", p).eventually() };
		final Formula[] replacements = { q, Formula.HOLE.implies(r), Formula.HOLE.always().or(Formula.HOLE) };

		for (Formula f : formulas) {
			for (Formula replacement : replacements) {
				final Map<String, Formula> map = Collections.singletonMap("c", replacement);
				assertEquals(Instantiator.instantiateContext(replacement, f),
						Instantiator.instantiateFormula(Formula.context("c", f), map));
			}
		}
	}

	@Test
	public void testPartialReplacements() {
		final Map<String, Formula> map = new HashMap<>();
		map.put("c", Formula.HOLE.not());

		final Formula formula = Formula.context("d", Formula.context("c", p)).and(Formula.context("c", q));
		assertEquals(Formula.context("d", p.not()).and(q.not()), Instantiator.instantiateFormula(formula, map));
	}

	@Test
	public void testNestedInstantiation() {
		final Map<String, Formula> map = new HashMap<>();
		map.put("c", Formula.HOLE.always());
		map.put("d", Formula.HOLE.or(r));

		final Formula formula = Formula.context("c", Formula.context("d", p));
		assertEquals(p.or(r).always(), Instantiator.instantiateFormula(formula, map));
	}

	@Test(expected = IllegalStateException.class)
	public void testHoleInFormula() {
		Instantiator.instantiateFormula(p.and(Formula.HOLE), Collections.<String, Formula>emptyMap());
	}
}
