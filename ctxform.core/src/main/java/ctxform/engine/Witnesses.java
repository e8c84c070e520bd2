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
package ctxform.engine;

import java.util.Collections;
import java.util.Map;

import ctxform.ast.Formula;

/**
 * Formulas with a hole for each context variable. After simplification with
 * the counterexamples of both directions the two results may differ, in
 * which case both are kept.
 */
public final class Witnesses {

	private final Map<String, Formula> primary, alternative;

	Witnesses(Map<String, Formula> primary, Map<String, Formula> alternative) {
		this.primary = Collections.unmodifiableMap(primary);
		this.alternative = alternative == null ? null : Collections.unmodifiableMap(alternative);
	}

	/**
	 * Returns the witnesses, simplified with the left-not-right counterexample
	 * if split.
	 */
	public Map<String, Formula> context() {
		return primary;
	}

	/**
	 * Returns the witnesses simplified with the right-not-left counterexample
	 * if they differ from {@link #context()}, null otherwise.
	 */
	public Map<String, Formula> alternative() {
		return alternative;
	}

	public boolean isSplit() {
		return alternative != null;
	}

	@Override
	public String toString() {
		final StringBuilder b = new StringBuilder();
		append(b, primary);
		if (alternative != null) {
			b.append("\nor\n");
			append(b, alternative);
		}
		return b.toString();
	}

	private static void append(StringBuilder b, Map<String, Formula> context) {
		boolean first = true;
		for (Map.Entry<String, Formula> entry : context.entrySet()) {
			if (!first)
				b.append('\n');
			b.append(entry.getKey()).append(" = ").append(entry.getValue());
			first = false;
		}
	}
}
