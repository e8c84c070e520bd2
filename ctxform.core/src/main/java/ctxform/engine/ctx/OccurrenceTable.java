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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import ctxform.ast.Formula;
import ctxform.util.nodes.PrettyPrinter;

/**
 * Associates each context variable with the distinct arguments it is applied
 * to, and each of those applications with a fresh atomic proposition. Two
 * applications of the same variable share their proposition iff their
 * arguments are structurally equal. Iteration follows insertion order.
 *
 * @specfield table: String -> Formula -> String
 * @specfield reverse: String -> Occurrence
 */
public final class OccurrenceTable {

	private final Map<String, Map<Formula, String>> table = new LinkedHashMap<>();
	private final Map<String, Occurrence> reverse = new LinkedHashMap<>();
	private final Set<String> reserved;

	/**
	 * Creates an empty table whose propositions avoid the given names.
	 */
	OccurrenceTable(Set<String> reserved) {
		this.reserved = reserved;
	}

	/**
	 * Returns the proposition standing for the application of the given
	 * context to the given argument, creating it if it is new. The name is
	 * the context followed by the printed argument in brackets, primed until
	 * it differs from every reserved name and every proposition already in
	 * the table.
	 */
	String propositionFor(String context, Formula argument) {
		final Map<Formula, String> arguments = table.computeIfAbsent(context, k -> new LinkedHashMap<>());
		String proposition = arguments.get(argument);

		if (proposition == null) {
			proposition = context + "[" + PrettyPrinter.print(argument).replace("\"", "") + "]";
			// different arguments may print alike once quotes are removed
			while (reverse.containsKey(proposition) || reserved.contains(proposition))
				proposition = proposition + "'";

			arguments.put(argument, proposition);
			reverse.put(proposition, new Occurrence(context, argument, proposition));
		}

		return proposition;
	}

	/**
	 * Returns the context variables in order of first occurrence.
	 */
	public Set<String> contexts() {
		return Collections.unmodifiableSet(table.keySet());
	}

	/**
	 * Returns the whole table, from context variables to their arguments and
	 * propositions.
	 */
	public Map<String, Map<Formula, String>> occurrences() {
		return Collections.unmodifiableMap(table);
	}

	/**
	 * Returns the arguments of the given context variable mapped to their
	 * propositions, in order of first occurrence, or an empty map if the
	 * variable does not occur.
	 */
	public Map<Formula, String> occurrences(String context) {
		final Map<Formula, String> arguments = table.get(context);
		return arguments == null ? Collections.emptyMap() : Collections.unmodifiableMap(arguments);
	}

	/**
	 * Returns the occurrence the given proposition stands for, or null if it
	 * is not a proposition introduced for a context.
	 */
	public Occurrence occurrence(String proposition) {
		return reverse.get(proposition);
	}

	/**
	 * Returns every occurrence in order of creation.
	 */
	public Iterable<Occurrence> all() {
		return Collections.unmodifiableCollection(reverse.values());
	}

	/**
	 * Returns the number of distinct occurrences.
	 */
	public int size() {
		return reverse.size();
	}

	@Override
	public String toString() {
		return reverse.values().toString();
	}
}
