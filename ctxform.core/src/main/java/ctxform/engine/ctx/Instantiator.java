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

import java.util.Map;

import ctxform.ast.ContextFormula;
import ctxform.ast.Formula;
import ctxform.ast.Hole;
import ctxform.ast.visitor.AbstractReplacer;

/**
 * Substitution of holes and contexts.
 */
public final class Instantiator {

	private Instantiator() {}

	/**
	 * Instantiates the given context definition with the given replacement,
	 * i.e. returns <code>context</code> with its hole replaced by
	 * <code>replacement</code>. The hole is a single bound variable, so every
	 * occurrence of it is replaced, including those inside nested context
	 * applications.
	 */
	public static Formula instantiateContext(Formula context, Formula replacement) {
		return context.accept(new AbstractReplacer() {
			@Override
			public Formula visit(Hole hole) {
				return replacement;
			}
		});
	}

	/**
	 * Instantiates the contexts of the given formula. The replacements are a
	 * partial map from context variables to context definitions; applications
	 * of variables not in the map are left in place, with their argument
	 * instantiated.
	 *
	 * @throws IllegalStateException formula contains a hole
	 */
	public static Formula instantiateFormula(Formula formula, Map<String, Formula> replacements) {
		return formula.accept(new AbstractReplacer() {

			@Override
			public Formula visit(ContextFormula context) {
				final Formula argument = context.argument().accept(this);
				final Formula definition = replacements.get(context.name());

				if (definition != null)
					return instantiateContext(definition, argument);

				return argument == context.argument() ? context : Formula.context(context.name(), argument);
			}

			@Override
			public Formula visit(Hole hole) {
				throw new IllegalStateException("formula to be instantiated contains a hole");
			}
		});
	}
}
