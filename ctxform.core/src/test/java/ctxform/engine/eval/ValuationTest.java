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
package ctxform.engine.eval;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import ctxform.ast.Formula;
import ctxform.engine.InvalidFormulaException;

public class ValuationTest {

	private static final Formula p = Formula.proposition("p"), q = Formula.proposition("q");

	/** Reads a trace written as in {@link Trace#toString()}. */
	static Trace trace(String text) {
		final int bar = text.indexOf('|');
		return new Trace(values(text.substring(0, bar)), values(text.substring(bar + 1)));
	}

	private static Ternary[] values(String text) {
		final Ternary[] values = new Ternary[text.length()];
		for (int i = 0; i < values.length; i++)
			values[i] = text.charAt(i) == '1' ? Ternary.TRUE : text.charAt(i) == '0' ? Ternary.FALSE : Ternary.UNKNOWN;
		return values;
	}

	private static Valuation valuation(String p, String q) {
		final Map<String, Trace> traces = new HashMap<>();
		traces.put("p", trace(p));
		if (q != null)
			traces.put("q", trace(q));
		final Trace shape = trace(p);
		return new Valuation(shape.prefixLength(), shape.cycleLength(), traces);
	}

	@Test
	public void testKleeneConnectives() {
		final Valuation valuation = valuation("01?|1", "???|0");

		assertEquals("0??|0", valuation.evaluate(p.and(q)).toString());
		assertEquals("?1?|1", valuation.evaluate(p.or(q)).toString());
		assertEquals("1??|0", valuation.evaluate(p.implies(q)).toString());
		assertEquals("???|1", valuation.evaluate(p.xor(q)).toString());
		assertEquals("10?|0", valuation.evaluate(p.not()).toString());
	}

	@Test
	public void testUnknownProposition() {
		final Valuation valuation = valuation("1|01", null);
		assertEquals("?|??", valuation.evaluate(q).toString());
		assertEquals("1|?1", valuation.evaluate(p.or(q)).toString());
	}

	@Test
	public void testNext() {
		assertEquals("1?|?", valuation("01|?", null).evaluate(p.next()).toString());
		assertEquals("|100", valuation("|010", null).evaluate(p.next()).toString());
	}

	@Test
	public void testEventually() {
		assertEquals("?|??", valuation("0|?0", null).evaluate(p.eventually()).toString());
		assertEquals("1|11", valuation("?|01", null).evaluate(p.eventually()).toString());
		assertEquals("1?|??", valuation("1?|0?", null).evaluate(p.eventually()).toString());
	}

	@Test
	public void testAlways() {
		assertEquals("?|??", valuation("1|1?", null).evaluate(p.always()).toString());
		assertEquals("0|00", valuation("?|10", null).evaluate(p.always()).toString());
		assertEquals("01|11", valuation("01|11", null).evaluate(p.always()).toString());
	}

	@Test
	public void testUntil() {
		assertEquals("?|?", valuation("1|1", "?|?").evaluate(p.until(q)).toString());
		assertEquals("0|0", valuation("1|0", "0|0").evaluate(p.until(q)).toString());
		assertEquals("1|11", valuation("1|10", "0|01").evaluate(p.until(q)).toString());
		// q is only reached by wrapping around the cycle
		assertEquals("1|111", valuation("1|011", "0|100").evaluate(p.until(q)).toString());
	}

	@Test
	public void testDerivedOperators() {
		final Valuation valuation = valuation("1|1", "0|0");
		assertEquals("1|1", valuation.evaluate(p.weakUntil(q)).toString());
		assertEquals("0|0", valuation.evaluate(p.until(q)).toString());
		assertEquals("0|0", valuation.evaluate(q.releases(q)).toString());
		assertEquals("1|1", valuation.evaluate(q.releases(p)).toString());
		assertEquals("0|0", valuation.evaluate(q.strongReleases(p)).toString());
		assertEquals("1|1", valuation.evaluate(p.strongReleases(p)).toString());
	}

	@Test
	public void testContextNodes() {
		final Formula context = Formula.context("c", p);
		final Valuation valuation = valuation("1|0", null);

		assertEquals("?|?", valuation.evaluate(context).toString());
		assertEquals("0|1", valuation.withNode(context, trace("1|0")).evaluate(context.not()).toString());
		assertEquals("?|?", valuation.withNode(context, trace("1|0")).evaluate(Formula.context("c", q)).toString());
	}

	@Test
	public void testFromTrace() {
		final Map<String, Boolean> first = new HashMap<>(), second = new HashMap<>();
		first.put("p", true);
		first.put("q", false);
		second.put("p", false);

		final List<Map<String, Boolean>> prefix = Collections.singletonList(first);
		final List<Map<String, Boolean>> cycle = Arrays.asList(second, first);
		final Valuation valuation = Valuation.fromTrace(prefix, cycle);

		assertEquals(1, valuation.prefixLength());
		assertEquals(2, valuation.cycleLength());
		assertEquals(trace("1|01"), valuation.values("p"));
		assertEquals(trace("0|?0"), valuation.values("q"));
		assertEquals("1|01 ← p\n0|?0 ← q", valuation.toString());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testShapeMismatch() {
		valuation("1|01", "1|0");
	}

	@Test(expected = IllegalStateException.class)
	public void testHole() {
		valuation("1|0", null).evaluate(p.and(Formula.HOLE));
	}

	@Test(expected = InvalidFormulaException.class)
	public void testPathQuantifier() {
		valuation("1|0", null).evaluate(p.always().forAll());
	}
}
