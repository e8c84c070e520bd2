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

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collection;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import ctxform.ast.Formula;
import ctxform.engine.config.Options;

/**
 * A set of LTL identities, with and without contexts, that the bounded
 * search must confirm, and some non-identities it must refute.
 */
@RunWith(Parameterized.class)
public class LTLIdentitiesTests {

	static private final Formula p = Formula.proposition("p"), q = Formula.proposition("q"),
			r = Formula.proposition("r"), tt = Formula.TRUE, ff = Formula.FALSE;

	@Rule
	public Timeout globalTimeout = Timeout.seconds(60);

	private final Formula v1, v2;
	private final boolean v3;

	public LTLIdentitiesTests(Formula v1, Formula v2, boolean v3) {
		this.v1 = v1;
		this.v2 = v2;
		this.v3 = v3;
	}

	private static Formula c(Formula argument) {
		return Formula.context("c", argument);
	}

	@Parameters(name = "{0} = {1} {2}")
	public static Collection<Object[]> data() {
		Object[][] data = new Object[][] {
			{ p.next().always(),							p.always().next(),								true },
			{ p.always(),									p.not().eventually().not(),						true },
			{ ff.next(),									ff,												true },
			{ tt.until(p),									p.eventually(),									true },
			{ p.until(p),									p,												true },
			{ p.next().until(q.next()),						p.until(q).next(),								true },
			{ p.releases(q),								p.not().until(q.not()).not(),					true },
			{ ff.releases(p),								p.always(),										true },
			{ p.releases(q),								q.and(p.or(p.releases(q).next())),				true },
			{ p.weakUntil(q),								p.until(q).or(p.always()),						true },
			{ p.strongReleases(q),							q.until(p.and(q)),								true },
			{ p.always().eventually().next(),				p.always().eventually(),						true },
			{ p.until(q).eventually(),						q.eventually(),									true },
			{ p.until(q).and(r.until(q)),					p.and(r).until(q),								true },
			{ p.releases(q).and(p.releases(r)),				p.releases(q.and(r)),							true },
			{ p.until(q),									q.until(p),										false },
			{ p.eventually().always(),						p.always().eventually(),						false },
			{ p.next().next(),								p.next(),										false },
			// contexts
			{ c(p).and(c(p)),								c(p),											true },
			{ c(p.until(q)).or(c(q)),						c(p.until(q)),									true },
			{ c(p.and(q)).implies(c(p)),					tt,												true },
			{ c(p).always(),								c(p.always()),									false },
			{ c(p).eventually(),							c(p.eventually()),								false },
			{ c(p).and(c(q)),								c(p.and(q)),									false },
			{ c(p.or(q)).or(c(p)),							c(p).or(c(q)).or(c(p.or(q))),					true },
		};
		return Arrays.asList(data);
	}

	@Test
	public void test() {
		final Options options = new Options();
		options.setMaxTraceLength(5);

		assertEquals(v3, new LTLProblem(v1, v2, options).solve().equivalent());
	}
}
