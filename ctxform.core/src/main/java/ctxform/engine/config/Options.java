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
package ctxform.engine.config;

import ctxform.engine.ctl.CTLSolver;
import ctxform.engine.satlab.SATFactory;

/**
 * Stores information about the oracles and the engine settings used for an
 * equivalence check.
 *
 * @specfield monotonic: boolean // whether contexts are assumed monotonic
 * @specfield timeout: int // oracle deadline in seconds
 * @specfield maxTraceLength: int // bound of the lasso search for LTL
 * @specfield solver: SATFactory
 * @specfield ctlSolver: CTLSolver
 * @specfield reporter: Reporter
 * @specfield simplify: boolean // whether witnesses are simplified
 */
public final class Options {

	private boolean monotonic = true;
	private int timeout = 20;
	private int maxTraceLength = 8;
	private SATFactory solver = SATFactory.DEFAULT;
	private CTLSolver ctlSolver = null;
	private Reporter reporter = AbstractReporter.SILENT;
	private boolean simplify = true;

	/**
	 * Constructs an Options object initialized with default values.
	 *
	 * @ensures this.monotonic' = true && this.timeout' = 20 &&
	 *          this.maxTraceLength' = 8 && this.solver' = SATFactory.DEFAULT &&
	 *          this.ctlSolver' = null && this.reporter' = AbstractReporter.SILENT &&
	 *          this.simplify' = true
	 */
	public Options() {}

	/**
	 * Whether debugging output was requested through the <code>debug</code>
	 * system property.
	 */
	public static boolean isDebug() {
		return Boolean.getBoolean("debug");
	}

	/**
	 * @return this.monotonic
	 */
	public boolean monotonic() {
		return monotonic;
	}

	/**
	 * Sets whether contexts are assumed to be monotonic. When false, contexts
	 * may stand for any formula and only functionality is assumed.
	 *
	 * @ensures this.monotonic' = monotonic
	 */
	public void setMonotonic(boolean monotonic) {
		this.monotonic = monotonic;
	}

	/**
	 * @return this.timeout
	 */
	public int timeout() {
		return timeout;
	}

	/**
	 * Sets the deadline in seconds of every oracle call.
	 *
	 * @ensures this.timeout' = timeout
	 * @throws IllegalArgumentException timeout <= 0
	 */
	public void setTimeout(int timeout) {
		if (timeout <= 0)
			throw new IllegalArgumentException("timeout must be positive: " + timeout);
		this.timeout = timeout;
	}

	/**
	 * @return this.maxTraceLength
	 */
	public int maxTraceLength() {
		return maxTraceLength;
	}

	/**
	 * Sets the maximum length of the lassos searched for LTL counterexamples.
	 *
	 * @ensures this.maxTraceLength' = maxTraceLength
	 * @throws IllegalArgumentException maxTraceLength < 1
	 */
	public void setMaxTraceLength(int maxTraceLength) {
		if (maxTraceLength < 1)
			throw new IllegalArgumentException("trace length must be at least 1: " + maxTraceLength);
		this.maxTraceLength = maxTraceLength;
	}

	/**
	 * @return this.solver
	 */
	public SATFactory solver() {
		return solver;
	}

	/**
	 * @ensures this.solver' = solver
	 * @throws NullPointerException solver = null
	 */
	public void setSolver(SATFactory solver) {
		if (solver == null)
			throw new NullPointerException();
		this.solver = solver;
	}

	/**
	 * Returns the external decision procedure for CTL, or null if none has
	 * been configured.
	 *
	 * @return this.ctlSolver
	 */
	public CTLSolver ctlSolver() {
		return ctlSolver;
	}

	/**
	 * @ensures this.ctlSolver' = ctlSolver
	 */
	public void setCTLSolver(CTLSolver ctlSolver) {
		this.ctlSolver = ctlSolver;
	}

	/**
	 * @return this.reporter
	 */
	public Reporter reporter() {
		return reporter;
	}

	/**
	 * @ensures this.reporter' = reporter
	 * @throws NullPointerException reporter = null
	 */
	public void setReporter(Reporter reporter) {
		if (reporter == null)
			throw new NullPointerException();
		this.reporter = reporter;
	}

	/**
	 * @return this.simplify
	 */
	public boolean simplify() {
		return simplify;
	}

	/**
	 * @ensures this.simplify' = simplify
	 */
	public void setSimplify(boolean simplify) {
		this.simplify = simplify;
	}

	@Override
	public String toString() {
		final StringBuilder b = new StringBuilder();
		b.append("Options:");
		b.append("\n monotonic: ");
		b.append(monotonic);
		b.append("\n timeout: ");
		b.append(timeout);
		b.append("\n maxTraceLength: ");
		b.append(maxTraceLength);
		b.append("\n solver: ");
		b.append(solver);
		b.append("\n ctlSolver: ");
		b.append(ctlSolver);
		b.append("\n simplify: ");
		b.append(simplify);
		return b.toString();
	}
}
