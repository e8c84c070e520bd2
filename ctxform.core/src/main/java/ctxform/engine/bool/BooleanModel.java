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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import ctxform.engine.Counterexample;
import ctxform.util.nodes.PrettyPrinter;

/**
 * A satisfying assignment of the propositions of a propositional formula.
 */
public final class BooleanModel implements Counterexample {

	private final Map<String, Boolean> values;

	BooleanModel(Map<String, Boolean> values) {
		this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}

	/**
	 * Returns the value of every proposition of the formula.
	 */
	@Override
	public Map<String, Boolean> valuation() {
		return values;
	}

	/**
	 * Prints the model as a conjunction of literals, or true if it assigns
	 * nothing.
	 */
	@Override
	public String toString() {
		if (values.isEmpty())
			return "true";
		final StringBuilder b = new StringBuilder();
		for (Map.Entry<String, Boolean> entry : values.entrySet()) {
			if (b.length() > 0)
				b.append(" ∧ ");
			if (!entry.getValue())
				b.append("¬ ");
			b.append(PrettyPrinter.name(entry.getKey()));
		}
		return b.toString();
	}
}
