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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import ctxform.ast.BinaryFormula;
import ctxform.ast.BinaryTempFormula;
import ctxform.ast.ConstantFormula;
import ctxform.ast.ContextFormula;
import ctxform.ast.Formula;
import ctxform.ast.Hole;
import ctxform.ast.NotFormula;
import ctxform.ast.PathFormula;
import ctxform.ast.Proposition;
import ctxform.ast.UnaryTempFormula;
import ctxform.ast.visitor.ReturnVisitor;
import ctxform.engine.InvalidFormulaException;
import ctxform.util.nodes.PrettyPrinter;

/**
 * A three-valued valuation over an ultimately periodic trace. Propositions
 * without a trace, and propositions whose value is missing at some step,
 * are unknown there. Linear-time formulas are evaluated at every position
 * of the trace with Kleene's logic.
 *
 * @specfield prefixLength, cycleLength: int
 * @specfield propositions: String -> Trace
 * @specfield nodes: Formula -> Trace
 * @invariant all t: propositions[String] + nodes[Formula] |
 *            t.prefixLength = prefixLength && t.cycleLength = cycleLength
 */
public final class Valuation {

	private final int prefixLength, cycleLength;
	private final Map<String, Trace> propositions;
	private final Map<Formula, Trace> nodes;

	/**
	 * Creates a valuation of the given propositions.
	 *
	 * @throws IllegalArgumentException cycleLength < 1 || some trace has
	 *             other lengths
	 */
	public Valuation(int prefixLength, int cycleLength, Map<String, Trace> propositions) {
		this(prefixLength, cycleLength, propositions, Collections.<Formula, Trace>emptyMap());
	}

	private Valuation(int prefixLength, int cycleLength, Map<String, Trace> propositions, Map<Formula, Trace> nodes) {
		if (prefixLength < 0 || cycleLength < 1)
			throw new IllegalArgumentException("invalid lasso shape: " + prefixLength + "|" + cycleLength);
		this.prefixLength = prefixLength;
		this.cycleLength = cycleLength;
		this.propositions = new LinkedHashMap<>(propositions);
		this.nodes = new LinkedHashMap<>(nodes);
		for (Trace trace : this.propositions.values())
			checkShape(trace);
		for (Trace trace : this.nodes.values())
			checkShape(trace);
	}

	private void checkShape(Trace trace) {
		if (trace.prefixLength() != prefixLength || trace.cycleLength() != cycleLength)
			throw new IllegalArgumentException("trace " + trace + " does not fit " + prefixLength + "|" + cycleLength);
	}

	/**
	 * Builds the valuation of a lasso given as its prefix and cycle steps,
	 * each a partial assignment of propositions.
	 *
	 * @throws IllegalArgumentException cycle is empty
	 */
	public static Valuation fromTrace(List<Map<String, Boolean>> prefix, List<Map<String, Boolean>> cycle) {
		final Map<String, Trace> traces = new LinkedHashMap<>();

		for (String name : names(prefix, cycle)) {
			final Ternary[] p = new Ternary[prefix.size()], c = new Ternary[cycle.size()];
			for (int i = 0; i < p.length; i++)
				p[i] = Ternary.of(prefix.get(i).get(name));
			for (int i = 0; i < c.length; i++)
				c[i] = Ternary.of(cycle.get(i).get(name));
			traces.put(name, new Trace(p, c));
		}

		return new Valuation(prefix.size(), cycle.size(), traces);
	}

	private static Set<String> names(List<Map<String, Boolean>> prefix, List<Map<String, Boolean>> cycle) {
		final Set<String> names = new LinkedHashSet<>();
		for (Map<String, Boolean> step : prefix)
			names.addAll(step.keySet());
		for (Map<String, Boolean> step : cycle)
			names.addAll(step.keySet());
		return names;
	}

	/**
	 * Returns a copy of this valuation where the given node, typically a
	 * context application, has the given values.
	 */
	public Valuation withNode(Formula node, Trace trace) {
		final Map<Formula, Trace> extended = new LinkedHashMap<>(nodes);
		extended.put(node, trace);
		return new Valuation(prefixLength, cycleLength, propositions, extended);
	}

	public int prefixLength() {
		return prefixLength;
	}

	public int cycleLength() {
		return cycleLength;
	}

	/**
	 * Returns the names of the propositions with a trace.
	 */
	public Set<String> propositions() {
		return Collections.unmodifiableSet(propositions.keySet());
	}

	/**
	 * Returns the values of the given proposition, unknown everywhere if it
	 * has no trace.
	 */
	public Trace values(String proposition) {
		final Trace trace = propositions.get(proposition);
		return trace == null ? Trace.constant(Ternary.UNKNOWN, prefixLength, cycleLength) : trace;
	}

	/**
	 * Evaluates the given formula at every position of the trace.
	 *
	 * @throws InvalidFormulaException formula contains a path quantifier
	 * @throws IllegalStateException formula contains a hole
	 */
	public Trace evaluate(Formula formula) {
		return formula.accept(new Evaluator());
	}

	/**
	 * Returns a table with a row of values for every proposition and node,
	 * sorted by name.
	 */
	@Override
	public String toString() {
		final Map<String, Trace> rows = new TreeMap<>();
		for (Map.Entry<String, Trace> entry : propositions.entrySet())
			rows.put(entry.getKey(), entry.getValue());
		for (Map.Entry<Formula, Trace> entry : nodes.entrySet())
			rows.put(PrettyPrinter.print(entry.getKey()), entry.getValue());

		final StringBuilder b = new StringBuilder();
		for (Map.Entry<String, Trace> row : rows.entrySet()) {
			if (b.length() > 0)
				b.append('\n');
			b.append(row.getValue()).append(" ← ").append(row.getKey());
		}
		return b.toString();
	}

	/*----------------------------------------------------------------------*/

	private interface Connective {
		Ternary apply(Ternary left, Ternary right);
	}

	private static Trace pointwise(Trace left, Trace right, Connective connective) {
		final Ternary[] prefix = new Ternary[left.prefixLength()], cycle = new Ternary[left.cycleLength()];
		for (int i = 0; i < prefix.length; i++)
			prefix[i] = connective.apply(left.prefix(i), right.prefix(i));
		for (int i = 0; i < cycle.length; i++)
			cycle[i] = connective.apply(left.cycle(i), right.cycle(i));
		return new Trace(prefix, cycle);
	}

	private static Trace not(Trace trace) {
		final Ternary[] prefix = trace.prefixArray(), cycle = trace.cycleArray();
		for (int i = 0; i < prefix.length; i++)
			prefix[i] = prefix[i].not();
		for (int i = 0; i < cycle.length; i++)
			cycle[i] = cycle[i].not();
		return new Trace(prefix, cycle);
	}

	static Trace next(Trace trace) {
		final int p = trace.prefixLength(), c = trace.cycleLength();
		final Ternary[] prefix = new Ternary[p], cycle = new Ternary[c];
		for (int i = 0; i < p; i++)
			prefix[i] = trace.at(i + 1);
		for (int i = 0; i < c; i++)
			cycle[i] = trace.cycle((i + 1) % c);
		return new Trace(prefix, cycle);
	}

	static Trace eventually(Trace trace) {
		final int p = trace.prefixLength(), c = trace.cycleLength();
		final Ternary[] prefix = new Ternary[p], cycle = new Ternary[c];

		// every cycle position sees the whole cycle
		Ternary value = Ternary.FALSE;
		for (int i = 0; i < c; i++)
			value = value.or(trace.cycle(i));
		Arrays.fill(cycle, value);

		for (int i = p - 1; i >= 0; i--) {
			value = trace.prefix(i).or(value);
			prefix[i] = value;
		}

		return new Trace(prefix, cycle);
	}

	static Trace always(Trace trace) {
		return not(eventually(not(trace)));
	}

	/**
	 * Evaluates until as the least fixpoint of u = b ∨ (a ∧ X u), separately
	 * on the lower and upper two-valued readings of the operands.
	 */
	static Trace until(Trace a, Trace b) {
		final int p = a.prefixLength(), c = a.cycleLength();
		final boolean[] must = until(a, b, p, c, Ternary.TRUE);
		final boolean[] may = until(a, b, p, c, Ternary.UNKNOWN);

		final Ternary[] prefix = new Ternary[p], cycle = new Ternary[c];
		for (int i = 0; i < p + c; i++) {
			final Ternary value = must[i] ? Ternary.TRUE : (may[i] ? Ternary.UNKNOWN : Ternary.FALSE);
			if (i < p)
				prefix[i] = value;
			else
				cycle[i - p] = value;
		}
		return new Trace(prefix, cycle);
	}

	/**
	 * Two-valued until where a value holds iff it is at least the given
	 * threshold (TRUE for the lower reading, UNKNOWN for the upper one).
	 * Positions are numbered as in {@link Trace#at(int)}.
	 */
	private static boolean[] until(Trace a, Trace b, int p, int c, Ternary threshold) {
		final boolean[] result = new boolean[p + c];

		// the second pass corrects the positions that reach b by wrapping
		boolean next = false;
		for (int pass = 0; pass < 2; pass++) {
			for (int i = p + c - 1; i >= p; i--) {
				result[i] = holds(b.at(i), threshold) || (holds(a.at(i), threshold) && next);
				next = result[i];
			}
		}

		for (int i = p - 1; i >= 0; i--) {
			result[i] = holds(b.at(i), threshold) || (holds(a.at(i), threshold) && next);
			next = result[i];
		}

		return result;
	}

	private static boolean holds(Ternary value, Ternary threshold) {
		return threshold == Ternary.TRUE ? value == Ternary.TRUE : value != Ternary.FALSE;
	}

	/**
	 * Evaluates each node bottom-up.
	 */
	private final class Evaluator implements ReturnVisitor<Trace> {

		@Override
		public Trace visit(ConstantFormula constant) {
			return Trace.constant(Ternary.of(constant.booleanValue()), prefixLength, cycleLength);
		}

		@Override
		public Trace visit(Proposition proposition) {
			return values(proposition.name());
		}

		@Override
		public Trace visit(ContextFormula context) {
			final Trace trace = nodes.get(context);
			return trace == null ? Trace.constant(Ternary.UNKNOWN, prefixLength, cycleLength) : trace;
		}

		@Override
		public Trace visit(Hole hole) {
			throw new IllegalStateException("cannot evaluate a hole");
		}

		@Override
		public Trace visit(NotFormula not) {
			return not(not.formula().accept(this));
		}

		@Override
		public Trace visit(BinaryFormula binFormula) {
			final Trace left = binFormula.left().accept(this);
			final Trace right = binFormula.right().accept(this);

			switch (binFormula.op()) {
			case AND:
				return pointwise(left, right, Ternary::and);
			case OR:
				return pointwise(left, right, Ternary::or);
			case IMPLIES:
				return pointwise(left, right, Ternary::implies);
			case IFF:
				return pointwise(left, right, Ternary::iff);
			case XOR:
				return pointwise(left, right, Ternary::xor);
			default:
				throw new IllegalArgumentException("unknown operator: " + binFormula.op());
			}
		}

		@Override
		public Trace visit(UnaryTempFormula tempFormula) {
			final Trace trace = tempFormula.formula().accept(this);

			switch (tempFormula.op()) {
			case NEXT:
				return next(trace);
			case ALWAYS:
				return always(trace);
			case EVENTUALLY:
				return eventually(trace);
			default:
				throw new IllegalArgumentException("not a unary temporal operator: " + tempFormula.op());
			}
		}

		@Override
		public Trace visit(BinaryTempFormula tempFormula) {
			final Trace left = tempFormula.left().accept(this);
			final Trace right = tempFormula.right().accept(this);

			switch (tempFormula.op()) {
			case UNTIL:
				return until(left, right);
			case WEAK_UNTIL:
				return pointwise(until(left, right), always(left), Ternary::or);
			case RELEASE:
				return pointwise(until(right, pointwise(left, right, Ternary::and)), always(right), Ternary::or);
			case STRONG_RELEASE:
				return until(right, pointwise(left, right, Ternary::and));
			default:
				throw new IllegalArgumentException("not a binary temporal operator: " + tempFormula.op());
			}
		}

		@Override
		public Trace visit(PathFormula pathFormula) {
			throw new InvalidFormulaException("path quantifiers cannot be evaluated on a single trace");
		}
	}
}
