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
import static org.junit.Assert.fail;

import org.junit.Test;

import ctxform.ast.Formula;
import ctxform.engine.InvalidFormulaException;

public class CTLCheckerTest {

	private static final Formula p = Formula.proposition("p"), q = Formula.proposition("q");

	private static void assertInvalid(Formula formula, String message) {
		try {
			CTLChecker.check(formula);
			fail(formula + " should be rejected");
		} catch (InvalidFormulaException e) {
			assertEquals(message, e.getMessage());
		}
	}

	@Test
	public void testValid() {
		CTLChecker.check(p.implies(q.eventually().exists()).always().forAll());
		CTLChecker.check(p.until(q).not().forAll());
		CTLChecker.check(Formula.context("c", p.always().forAll()).and(q.next().exists()));
		CTLChecker.check(p.forAll().not());
		CTLChecker.check(p.not().exists());
		CTLChecker.check(Formula.context("c", Formula.HOLE.releases(q).exists()));
	}

	@Test
	public void testTemporalWithoutQuantifier() {
		assertInvalid(p.always(), "unexpected ALWAYS operator");
		assertInvalid(p.and(p.until(q)), "unexpected UNTIL operator");
		assertInvalid(p.eventually().always().forAll(), "unexpected EVENTUALLY operator");
	}

	@Test
	public void testBooleanAsPathFormula() {
		assertInvalid(p.and(q).forAll(), "unexpected AND operator");
		assertInvalid(p.implies(q).not().exists(), "unexpected IMPLIES operator");
	}

	@Test
	public void testDoubleNegation() {
		assertInvalid(p.always().not().not().forAll(), "double negation is not supported");
	}

	@Test
	public void testDoubleQuantification() {
		assertInvalid(p.always().exists().forAll(), "double quantification");
		assertInvalid(p.next().forAll().not().exists(), "double quantification");
	}

	@Test
	public void testContextAsPathFormula() {
		assertInvalid(Formula.context("c", p).forAll(), "context cannot appear as path formula");
		assertInvalid(Formula.context("c", p).not().exists(), "context cannot appear as path formula");
	}
}
