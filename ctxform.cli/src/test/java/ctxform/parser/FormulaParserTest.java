package ctxform.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import ctxform.ast.Formula;

public class FormulaParserTest {

    private static final Formula p = Formula.proposition("p"), q = Formula.proposition("q"), r = Formula.proposition("r");

    private final FormulaParser ltl = new FormulaParser(false);
    private final FormulaParser ctl = new FormulaParser(true);

    private static Formula c(Formula argument) {
        return Formula.context("c", argument);
    }

    private void assertError(String text, int column, String message) {
        try {
            ltl.parse(text);
            fail(text + " should not parse");
        } catch (ErrorSyntax e) {
            assertEquals(column, e.column);
            assertEquals(message, e.getMessage());
        }
    }

    @Test
    public void testBooleanPrecedence() throws ErrorSyntax {
        assertEquals(p.and(q).or(r), ltl.parse("p & q | r"));
        assertEquals(p.or(q.and(r)), ltl.parse("p ∨ q ∧ r"));
        assertEquals(p.implies(q.implies(r)), ltl.parse("p -> q -> r"));
        assertEquals(p.iff(q.or(r)), ltl.parse("p <-> q || r"));
        assertEquals(p.or(q).xor(r), ltl.parse("p + q xor r"));
        assertEquals(p.and(q).and(r), ltl.parse("p && q /\\ r"));
        assertEquals(Formula.TRUE.xor(Formula.FALSE), ltl.parse("true ^ 0"));
        assertEquals(p.not().not(), ltl.parse("!~p"));
    }

    @Test
    public void testTemporalPrecedence() throws ErrorSyntax {
        assertEquals(p.until(q.until(r)), ltl.parse("p U q U r"));
        assertEquals(p.and(q.until(r)), ltl.parse("p & q U r"));
        assertEquals(p.not().until(q), ltl.parse("!p U q"));
        assertEquals(p.weakUntil(q).or(p.releases(q)), ltl.parse("p W q | p R q"));
        assertEquals(p.releases(q).and(p.strongReleases(q)), ltl.parse("p V q & (p M q)"));
        assertEquals(p.eventually().always(), ltl.parse("□◇p"));
        assertEquals(p.next().next(), ltl.parse("() X p"));
    }

    @Test
    public void testGluedOperators() throws ErrorSyntax {
        assertEquals(p.eventually().always(), ltl.parse("GFp"));
        assertEquals(Formula.proposition("foo").next(), ltl.parse("Xfoo"));
        assertEquals(Formula.proposition("X1").and(p.next()), ltl.parse("X1 & X p"));
        assertEquals(Formula.proposition("Up"), ltl.parse("Up"));
        assertEquals(Formula.proposition("Alice"), ltl.parse("Alice"));
    }

    @Test
    public void testQuotedIdentifiers() throws ErrorSyntax {
        assertEquals(Formula.proposition("c[p]").or(q), ltl.parse("\"c[p]\" | q"));
        assertEquals(Formula.proposition("G p"), ltl.parse("\"G p\""));
    }

    @Test
    public void testContexts() throws ErrorSyntax {
        assertEquals(c(p.and(q)).implies(c(p)), ltl.parse("c[p & q] -> c[p]"));
        assertEquals(c(Formula.context("d", p).until(q)).eventually(), ltl.parse("F c[d[p] U q]"));
    }

    @Test
    public void testQuantifiers() throws ErrorSyntax {
        assertEquals(p.implies(q.eventually().exists()).always().forAll(), ctl.parse("AG(p -> EF q)"));
        assertEquals(p.until(q).not().forAll(), ctl.parse("∀¬(p U q)"));
        assertEquals(Formula.proposition("Alice"), ltl.parse("Alice"));
        assertEquals(Formula.proposition("lice").forAll(), ctl.parse("Alice"));
    }

    @Test
    public void testQuantifierInLTL() {
        assertError("∀ G p", 1, "path quantifiers are only allowed in CTL");
    }

    @Test
    public void testErrors() {
        assertError("p & ", 5, "unexpected end of formula");
        assertError("p $ q", 3, "unexpected character '$'");
        assertError("(p & q", 7, "expected ')'");
        assertError("c[p", 4, "expected ']' after the context argument");
        assertError("p q", 3, "unexpected input after the formula");
        assertError("\"p", 1, "unterminated quoted identifier");
        assertError("p & )", 5, "expected a proposition, a context or '('");
    }
}
