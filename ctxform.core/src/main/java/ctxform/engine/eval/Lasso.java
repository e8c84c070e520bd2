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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ctxform.engine.Counterexample;
import ctxform.util.nodes.PrettyPrinter;

/**
 * An ultimately periodic word, given as a finite prefix and a non-empty
 * cycle of steps. Each step is a partial assignment of propositions; those
 * it does not mention are unknown at that step.
 *
 * @specfield prefix: seq Map<String, Boolean>
 * @specfield cycle: seq Map<String, Boolean>
 * @invariant #cycle > 0
 */
public final class Lasso implements Counterexample {

	private final List<Map<String, Boolean>> prefix, cycle;

	/**
	 * @throws IllegalArgumentException cycle.isEmpty()
	 */
	public Lasso(List<Map<String, Boolean>> prefix, List<Map<String, Boolean>> cycle) {
		if (cycle.isEmpty())
			throw new IllegalArgumentException("empty cycle");
		this.prefix = copy(prefix);
		this.cycle = copy(cycle);
	}

	private static List<Map<String, Boolean>> copy(List<Map<String, Boolean>> steps) {
		final List<Map<String, Boolean>> copy = new ArrayList<>(steps.size());
		for (Map<String, Boolean> step : steps)
			copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(step)));
		return Collections.unmodifiableList(copy);
	}

	public List<Map<String, Boolean>> prefix() {
		return prefix;
	}

	public List<Map<String, Boolean>> cycle() {
		return cycle;
	}

	/**
	 * Returns the propositions whose value is the same at every step of the
	 * prefix and the cycle where they are assigned. Propositions assigned
	 * different values at two steps are left out.
	 */
	public Map<String, Boolean> invariants() {
		final Map<String, Boolean> invariants = new LinkedHashMap<>();
		final Set<String> conflicting = new HashSet<>();

		for (List<Map<String, Boolean>> segment : List.of(prefix, cycle)) {
			for (Map<String, Boolean> step : segment) {
				for (Map.Entry<String, Boolean> entry : step.entrySet()) {
					final String name = entry.getKey();
					if (conflicting.contains(name) || entry.getValue() == null)
						continue;

					final Boolean old = invariants.putIfAbsent(name, entry.getValue());
					if (old != null && !old.equals(entry.getValue())) {
						invariants.remove(name);
						conflicting.add(name);
					}
				}
			}
		}

		return invariants;
	}

	/**
	 * Returns the three-valued valuation of this word.
	 */
	public Valuation toValuation() {
		return Valuation.fromTrace(prefix, cycle);
	}

	/**
	 * {@inheritDoc} For a lasso these are its {@linkplain #invariants()
	 * invariants}.
	 */
	@Override
	public Map<String, Boolean> valuation() {
		return invariants();
	}

	/**
	 * Prints the word as its prefix steps followed by the cycle in braces,
	 * e.g. <code>p ∧ ¬q; cycle{¬p}</code>.
	 */
	@Override
	public String toString() {
		final StringBuilder b = new StringBuilder();
		for (Map<String, Boolean> step : prefix)
			b.append(step(step)).append("; ");
		b.append("cycle{");
		for (int i = 0; i < cycle.size(); i++) {
			if (i > 0)
				b.append("; ");
			b.append(step(cycle.get(i)));
		}
		return b.append('}').toString();
	}

	private static String step(Map<String, Boolean> step) {
		final StringBuilder b = new StringBuilder();
		for (Map.Entry<String, Boolean> entry : step.entrySet()) {
			if (entry.getValue() == null)
				continue;
			if (b.length() > 0)
				b.append(" ∧ ");
			if (!entry.getValue())
				b.append('¬');
			b.append(PrettyPrinter.name(entry.getKey()));
		}
		return b.length() == 0 ? "true" : b.toString();
	}
}
