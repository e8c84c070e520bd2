package ctxform.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import ctxform.ast.Formula;
import ctxform.ast.operator.FormulaOperator;
import ctxform.ast.operator.PathQuantifier;
import ctxform.ast.operator.TemporalOperator;

/**
 * Recursive descent parser for formulas with contexts in a Spot-like syntax.
 * From the loosest to the tightest binding, the operators are implication
 * and equivalence (right associative), exclusive disjunction, disjunction,
 * conjunction, the binary temporal operators (right associative) and the
 * prefix operators. A context is an identifier followed by its argument in
 * brackets.
 *
 * <p>
 * Identifiers are words of letters, digits and underscores, or any text
 * between double quotes. A word that starts with F, G or X (or A and E in
 * CTL) is read as that operator applied to the rest of the word, so
 * <code>GFp</code> is <code>G F p</code>, except for X followed by digits.
 * </p>
 */
public final class FormulaParser {

    private enum Kind {
        LITERAL, IDENTIFIER, NOT, AND, OR, XOR, IMPLIES, IFF, UNARY, BINARY, QUANTIFIER, LPAREN, RPAREN, LBRACKET, RBRACKET, EOF
    }

    private static final class Token {

        final Kind   kind;
        final Object value;
        final int    column;

        Token(Kind kind, Object value, int column) {
            this.kind = kind;
            this.value = value;
            this.column = column;
        }
    }

    private static final Pattern      NUMBERED_NEXT = Pattern.compile("X[0-9]+");

    /** Symbolic tokens, longer ones first. */
    private static final List<Symbol> SYMBOLS = new ArrayList<>();

    static {
        symbol("<-->", Kind.IFF, null);
        symbol("-->", Kind.IMPLIES, null);
        symbol("<->", Kind.IFF, null);
        symbol("<=>", Kind.IFF, null);
        symbol("->", Kind.IMPLIES, null);
        symbol("=>", Kind.IMPLIES, null);
        symbol("||", Kind.OR, null);
        symbol("\\/", Kind.OR, null);
        symbol("&&", Kind.AND, null);
        symbol("/\\", Kind.AND, null);
        symbol("()", Kind.UNARY, TemporalOperator.NEXT);
        symbol("<>", Kind.UNARY, TemporalOperator.EVENTUALLY);
        symbol("[]", Kind.UNARY, TemporalOperator.ALWAYS);
        symbol("!", Kind.NOT, null);
        symbol("~", Kind.NOT, null);
        symbol("¬", Kind.NOT, null);
        symbol("|", Kind.OR, null);
        symbol("+", Kind.OR, null);
        symbol("∨", Kind.OR, null);
        symbol("∪", Kind.OR, null);
        symbol("&", Kind.AND, null);
        symbol("*", Kind.AND, null);
        symbol("∧", Kind.AND, null);
        symbol("∩", Kind.AND, null);
        symbol("→", Kind.IMPLIES, null);
        symbol("⟶", Kind.IMPLIES, null);
        symbol("⇒", Kind.IMPLIES, null);
        symbol("⟹", Kind.IMPLIES, null);
        symbol("^", Kind.XOR, null);
        symbol("⊕", Kind.XOR, null);
        symbol("↔", Kind.IFF, null);
        symbol("⇔", Kind.IFF, null);
        symbol("○", Kind.UNARY, TemporalOperator.NEXT);
        symbol("◯", Kind.UNARY, TemporalOperator.NEXT);
        symbol("◇", Kind.UNARY, TemporalOperator.EVENTUALLY);
        symbol("⋄", Kind.UNARY, TemporalOperator.EVENTUALLY);
        symbol("♢", Kind.UNARY, TemporalOperator.EVENTUALLY);
        symbol("□", Kind.UNARY, TemporalOperator.ALWAYS);
        symbol("⬜", Kind.UNARY, TemporalOperator.ALWAYS);
        symbol("◻", Kind.UNARY, TemporalOperator.ALWAYS);
        symbol("∀", Kind.QUANTIFIER, PathQuantifier.FORALL);
        symbol("∃", Kind.QUANTIFIER, PathQuantifier.EXISTS);
        symbol("(", Kind.LPAREN, null);
        symbol(")", Kind.RPAREN, null);
        symbol("[", Kind.LBRACKET, null);
        symbol("]", Kind.RBRACKET, null);
    }

    private static final class Symbol {

        final String text;
        final Kind   kind;
        final Object value;

        Symbol(String text, Kind kind, Object value) {
            this.text = text;
            this.kind = kind;
            this.value = value;
        }
    }

    private static void symbol(String text, Kind kind, Object value) {
        SYMBOLS.add(new Symbol(text, kind, value));
    }

    private final boolean           branching;

    private List<Token>             tokens;
    private int                     index;

    /**
     * Creates a parser for linear-time formulas, or for branching-time ones
     * if the argument is true.
     */
    public FormulaParser(boolean branching) {
        this.branching = branching;
    }

    /**
     * Parses the given text.
     *
     * @throws ErrorSyntax the text is not a well-formed formula
     */
    public Formula parse(String text) throws ErrorSyntax {
        tokens = tokenize(text);
        index = 0;
        final Formula formula = formula0();
        if (peek().kind != Kind.EOF)
            throw new ErrorSyntax(peek().column, "unexpected input after the formula");
        return formula;
    }

    /*------------------------------------------------------------------------*/

    private List<Token> tokenize(String text) throws ErrorSyntax {
        final List<Token> list = new ArrayList<>();
        int i = 0;

        outer: while (i < text.length()) {
            final char c = text.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (c == '"') {
                final int end = text.indexOf('"', i + 1);
                if (end < 0)
                    throw new ErrorSyntax(i + 1, "unterminated quoted identifier");
                if (end == i + 1)
                    throw new ErrorSyntax(i + 1, "empty quoted identifier");
                list.add(new Token(Kind.IDENTIFIER, text.substring(i + 1, end), i + 1));
                i = end + 1;
                continue;
            }

            if (isWordChar(c)) {
                int end = i;
                while (end < text.length() && isWordChar(text.charAt(end)))
                    end++;
                i = word(text.substring(i, end), i, list);
                continue;
            }

            for (Symbol symbol : SYMBOLS) {
                if (text.startsWith(symbol.text, i)) {
                    list.add(new Token(symbol.kind, symbol.value, i + 1));
                    i += symbol.text.length();
                    continue outer;
                }
            }

            throw new ErrorSyntax(i + 1, "unexpected character '" + c + "'");
        }

        list.add(new Token(Kind.EOF, null, text.length() + 1));
        return list;
    }

    private static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    /**
     * Classifies the word starting at the given position and returns the
     * position after the characters consumed.
     */
    private int word(String word, int start, List<Token> list) {
        final int column = start + 1;

        switch (word) {
            case "true" :
            case "1" :
                list.add(new Token(Kind.LITERAL, Boolean.TRUE, column));
                return start + word.length();
            case "false" :
            case "0" :
                list.add(new Token(Kind.LITERAL, Boolean.FALSE, column));
                return start + word.length();
            case "xor" :
                list.add(new Token(Kind.XOR, null, column));
                return start + word.length();
            case "U" :
                list.add(new Token(Kind.BINARY, TemporalOperator.UNTIL, column));
                return start + 1;
            case "W" :
                list.add(new Token(Kind.BINARY, TemporalOperator.WEAK_UNTIL, column));
                return start + 1;
            case "R" :
            case "V" :
                list.add(new Token(Kind.BINARY, TemporalOperator.RELEASE, column));
                return start + 1;
            case "M" :
                list.add(new Token(Kind.BINARY, TemporalOperator.STRONG_RELEASE, column));
                return start + 1;
            default :
                break;
        }

        if (NUMBERED_NEXT.matcher(word).matches()) {
            list.add(new Token(Kind.IDENTIFIER, word, column));
            return start + word.length();
        }

        // a prefix operator glued to the rest of the word
        switch (word.charAt(0)) {
            case 'F' :
                list.add(new Token(Kind.UNARY, TemporalOperator.EVENTUALLY, column));
                return start + 1;
            case 'G' :
                list.add(new Token(Kind.UNARY, TemporalOperator.ALWAYS, column));
                return start + 1;
            case 'X' :
                list.add(new Token(Kind.UNARY, TemporalOperator.NEXT, column));
                return start + 1;
            case 'A' :
                if (branching) {
                    list.add(new Token(Kind.QUANTIFIER, PathQuantifier.FORALL, column));
                    return start + 1;
                }
                break;
            case 'E' :
                if (branching) {
                    list.add(new Token(Kind.QUANTIFIER, PathQuantifier.EXISTS, column));
                    return start + 1;
                }
                break;
            default :
                break;
        }

        list.add(new Token(Kind.IDENTIFIER, word, column));
        return start + word.length();
    }

    /*------------------------------------------------------------------------*/

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        return tokens.get(index++);
    }

    private Token expect(Kind kind, String what) throws ErrorSyntax {
        final Token token = next();
        if (token.kind != kind)
            throw new ErrorSyntax(token.column, "expected " + what);
        return token;
    }

    /** Implication and equivalence. */
    private Formula formula0() throws ErrorSyntax {
        final Formula left = formula1();
        final Kind kind = peek().kind;
        if (kind == Kind.IMPLIES || kind == Kind.IFF) {
            next();
            final Formula right = formula0();
            return Formula.compose(kind == Kind.IMPLIES ? FormulaOperator.IMPLIES : FormulaOperator.IFF, left, right);
        }
        return left;
    }

    /** Exclusive disjunction. */
    private Formula formula1() throws ErrorSyntax {
        Formula formula = formula2();
        while (peek().kind == Kind.XOR) {
            next();
            formula = formula.xor(formula2());
        }
        return formula;
    }

    /** Disjunction. */
    private Formula formula2() throws ErrorSyntax {
        Formula formula = formula3();
        while (peek().kind == Kind.OR) {
            next();
            formula = formula.or(formula3());
        }
        return formula;
    }

    /** Conjunction. */
    private Formula formula3() throws ErrorSyntax {
        Formula formula = formula4();
        while (peek().kind == Kind.AND) {
            next();
            formula = formula.and(formula4());
        }
        return formula;
    }

    /** Binary temporal operators. */
    private Formula formula4() throws ErrorSyntax {
        final Formula left = formula5();
        if (peek().kind == Kind.BINARY) {
            final TemporalOperator op = (TemporalOperator) next().value;
            return Formula.compose(op, left, formula4());
        }
        return left;
    }

    /** Prefix operators. */
    private Formula formula5() throws ErrorSyntax {
        final Token token = peek();
        switch (token.kind) {
            case NOT :
                next();
                return formula5().not();
            case UNARY :
                next();
                return Formula.compose((TemporalOperator) token.value, formula5());
            case QUANTIFIER :
                if (!branching)
                    throw new ErrorSyntax(token.column, "path quantifiers are only allowed in CTL");
                next();
                return Formula.compose((PathQuantifier) token.value, formula5());
            default :
                return formula6();
        }
    }

    /** Atoms, contexts and parenthesized formulas. */
    private Formula formula6() throws ErrorSyntax {
        final Token token = next();
        switch (token.kind) {
            case LITERAL :
                return Formula.constant((Boolean) token.value);
            case IDENTIFIER :
                if (peek().kind == Kind.LBRACKET) {
                    next();
                    final Formula argument = formula0();
                    expect(Kind.RBRACKET, "']' after the context argument");
                    return Formula.context((String) token.value, argument);
                }
                return Formula.proposition((String) token.value);
            case LPAREN :
                final Formula formula = formula0();
                expect(Kind.RPAREN, "')'");
                return formula;
            case EOF :
                throw new ErrorSyntax(token.column, "unexpected end of formula");
            default :
                throw new ErrorSyntax(token.column, "expected a proposition, a context or '('");
        }
    }
}
