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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

import ctxform.ast.Formula;
import ctxform.engine.InvalidFormulaException;

public class CTLEncoderTest {

	private static final Formula p = Formula.proposition("p"), q = Formula.proposition("q");

	@Test
	public void testEncode() {
		final CTLEncoder encoder = new CTLEncoder();

		assertEquals("(A G (# -> (E F %)))", encoder.encode(p.implies(q.eventually().exists()).always().forAll()));
		assertEquals("((# ^ ~ %) v (A (# U X %)))", encoder.encode(p.and(q.not()).or(p.until(q.next()).forAll())));
		assertEquals("(T -> (~T))", encoder.encode(Formula.TRUE.implies(Formula.FALSE)));
		assertEquals("(! -> #)", encoder.encode(Formula.HOLE.implies(p)));

		assertEquals(2, encoder.variables().size());
		assertEquals(Character.valueOf('#'), encoder.variables().get("p"));
		assertEquals(Character.valueOf('%'), encoder.variables().get("q"));
	}

	@Test
	public void testSharedEncoding() {
		final CTLEncoder encoder = new CTLEncoder();
		encoder.encode(q);
		assertEquals("(# ^ %)", encoder.encode(q.and(p)));
	}

	@Test
	public void testReservedCharacters() {
		final CTLEncoder encoder = new CTLEncoder();
		final Set<Character> used = new HashSet<>();

		for (int i = 0; i < CTLEncoder.capacity(); i++) {
			final String encoded = encoder.encode(Formula.proposition("p" + i));
			assertEquals(1, encoded.length());

			final char c = encoded.charAt(0);
			assertTrue(CTLEncoder.RESERVED.indexOf(c) < 0);
			assertTrue(c > CTLEncoder.HOLE && c <= CTLEncoder.LAST);
			assertTrue(used.add(c));
		}
	}

	@Test
	public void testCapacity() {
		assertEquals(77, CTLEncoder.capacity());

		final CTLEncoder encoder = new CTLEncoder();
		for (int i = 0; i < 77; i++)
			encoder.encode(Formula.proposition("p" + i));
		// known propositions keep their characters
		encoder.encode(Formula.proposition("p0"));

		try {
			encoder.encode(Formula.proposition("p77"));
			fail();
		} catch (TooManyVariablesException e) {
			assertEquals("too many variables: only 77 propositions can be encoded", e.getMessage());
		}
	}

	@Test
	public void testUnsupportedOperators() {
		final CTLEncoder encoder = new CTLEncoder();

		try {
			encoder.encode(p.iff(q));
			fail();
		} catch (InvalidFormulaException e) {
			assertEquals("not a valid CTL formula: IFF", e.getMessage());
		}

		try {
			encoder.encode(p.releases(q).forAll());
			fail();
		} catch (InvalidFormulaException e) {
			assertEquals("not a valid CTL formula: RELEASE", e.getMessage());
		}
	}

	@Test(expected = IllegalStateException.class)
	public void testContext() {
		new CTLEncoder().encode(Formula.context("c", p));
	}
}
