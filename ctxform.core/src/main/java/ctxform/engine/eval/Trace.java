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

/**
 * The values of a formula along an ultimately periodic trace: a finite
 * prefix followed by a cycle repeated forever. Position k of the trace is
 * the k-th prefix value if k is less than the prefix length, and the cycle
 * value at (k - prefixLength) mod cycleLength otherwise.
 *
 * @specfield prefix: Ternary[]
 * @specfield cycle: Ternary[]
 * @invariant #cycle > 0
 */
public final class Trace {

	private final Ternary[] prefix, cycle;

	/**
	 * @throws IllegalArgumentException cycle.length = 0
	 */
	public Trace(Ternary[] prefix, Ternary[] cycle) {
		if (cycle.length == 0)
			throw new IllegalArgumentException("empty cycle");
		this.prefix = prefix.clone();
		this.cycle = cycle.clone();
	}

	/**
	 * Returns the trace with the given value everywhere.
	 */
	public static Trace constant(Ternary value, int prefixLength, int cycleLength) {
		final Ternary[] prefix = new Ternary[prefixLength], cycle = new Ternary[cycleLength];
		Arrays.fill(prefix, value);
		Arrays.fill(cycle, value);
		return new Trace(prefix, cycle);
	}

	public int prefixLength() {
		return prefix.length;
	}

	public int cycleLength() {
		return cycle.length;
	}

	/**
	 * Returns the value at the given prefix position.
	 */
	public Ternary prefix(int index) {
		return prefix[index];
	}

	/**
	 * Returns the value at the given cycle position.
	 */
	public Ternary cycle(int index) {
		return cycle[index];
	}

	/**
	 * Returns the value at the given position of the unrolled trace.
	 *
	 * @throws IndexOutOfBoundsException position < 0
	 */
	public Ternary at(int position) {
		if (position < 0)
			throw new IndexOutOfBoundsException("negative position: " + position);
		return position < prefix.length ? prefix[position] : cycle[(position - prefix.length) % cycle.length];
	}

	Ternary[] prefixArray() {
		return prefix.clone();
	}

	Ternary[] cycleArray() {
		return cycle.clone();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Trace))
			return false;
		final Trace other = (Trace) obj;
		return Arrays.equals(prefix, other.prefix) && Arrays.equals(cycle, other.cycle);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(prefix) + Arrays.hashCode(cycle);
	}

	/**
	 * Returns the values as a string of 1, 0 and ?, with a bar between prefix
	 * and cycle.
	 */
	@Override
	public String toString() {
		final StringBuilder b = new StringBuilder();
		for (Ternary value : prefix)
			b.append(value.symbol());
		b.append('|');
		for (Ternary value : cycle)
			b.append(value.symbol());
		return b.toString();
	}
}
