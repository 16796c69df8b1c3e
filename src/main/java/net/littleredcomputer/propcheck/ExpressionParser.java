package net.littleredcomputer.propcheck;

import com.google.common.base.CharMatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Recursive descent parser for one line of propositional logic:
 * <pre>
 *   variable        [name]
 *   implication     ( [A] => [B] )   ( [A] implies [B] )   ( [A] then [B] )
 *   reverse impl.   ( [A] <= [B] )   ( [A] if [B] )
 *   biconditional   ( [A] <=> [B] )  ( [A] iff [B] )
 *   and             ( [A] & [B] )    ( [A] and [B] )
 *   or              ( [A] | [B] )    ( [A] or [B] )
 *   xor             ( [A] ^ [B] )    ( [A] xor [B] )
 *   not             ![A]             not [A]
 *   constants       T  true  F  false
 * </pre>
 * Every binary operation must be parenthesized, except that a whole line which
 * fails to parse is retried once with a pair of parentheses around it, so
 * {@code [A] and [B]} is accepted at top level.
 * <p>
 * Variable names are resolved through this parser's {@link VariableRegistry}, which
 * therefore accumulates the variables of every line parsed.
 */
public class ExpressionParser {
    private static final Logger log = LogManager.getFormatterLogger(ExpressionParser.class);
    // The C locale isspace() set.
    static final CharMatcher whitespace = CharMatcher.anyOf(" \t\n\u000b\f\r");

    private final VariableRegistry registry;

    public ExpressionParser() {
        this(new VariableRegistry());
    }

    public ExpressionParser(VariableRegistry registry) {
        this.registry = registry;
    }

    public VariableRegistry registry() { return registry; }

    /** A successful partial parse: the tree, and the position just past the text it consumed. */
    static final class Match {
        final int end;
        final Expr expr;

        Match(int end, Expr expr) {
            this.end = end;
            this.expr = expr;
        }
    }

    /**
     * Parse a complete line. The expression must account for all of the line apart from
     * surrounding whitespace.
     * @throws SyntaxException if neither the line nor the parenthesized line parses
     * @throws TooManyVariablesException if the line introduces a 33rd variable
     */
    public Expr parseLine(String line) {
        Optional<Expr> e;
        try {
            e = parseWhole(line);
            if (!e.isPresent()) e = parseWhole("(" + line + ")");
        } catch (StackOverflowError soe) {
            log.debug("nesting too deep for this thread's stack: %s", line);
            throw new SyntaxException(line, soe);
        }
        Expr expr = e.orElseThrow(() -> new SyntaxException(line));
        log.debug("parsed %s as %s", line, expr);
        return expr;
    }

    private Optional<Expr> parseWhole(String s) {
        return parseExpr(s, 0)
                .filter(m -> skipWhitespace(s, m.end) == s.length())
                .map(m -> m.expr);
    }

    Optional<Match> parseExpr(String s, int start) {
        int i = skipWhitespace(s, start);
        Optional<Match> m = parseTrue(s, i);
        if (!m.isPresent()) m = parseFalse(s, i);
        if (!m.isPresent()) m = parseVariable(s, i);
        if (!m.isPresent()) m = parseNot(s, i);
        if (!m.isPresent()) m = parseBinary(s, i);
        return m;
    }

    private static Optional<Match> parseTrue(String s, int i) {
        if (i < s.length() && s.charAt(i) == 'T') return Optional.of(new Match(i + 1, Expr.TRUE));
        if (s.startsWith("true", i)) return Optional.of(new Match(i + 4, Expr.TRUE));
        return Optional.empty();
    }

    private static Optional<Match> parseFalse(String s, int i) {
        if (i < s.length() && s.charAt(i) == 'F') return Optional.of(new Match(i + 1, Expr.FALSE));
        if (s.startsWith("false", i)) return Optional.of(new Match(i + 5, Expr.FALSE));
        return Optional.empty();
    }

    private Optional<Match> parseVariable(String s, int i) {
        if (i >= s.length() || s.charAt(i) != '[') return Optional.empty();
        final int start = skipWhitespace(s, i + 1);
        final int close = s.indexOf(']', start);
        if (close < 0) return Optional.empty();
        int end = close;
        while (end > start && whitespace.matches(s.charAt(end - 1))) --end;
        int ix = registry.resolve(s.substring(start, end));
        return Optional.of(new Match(close + 1, Expr.variable(ix)));
    }

    /** Length of the negation token at i, or 0 if there is none. */
    private static int negation(String s, int i) {
        if (s.startsWith("!", i)) return 1;
        if (s.startsWith("not", i)) return 3;
        return 0;
    }

    private Optional<Match> parseNot(String s, int i) {
        int k = negation(s, i);
        if (k == 0) return Optional.empty();
        // The whole run of negations is consumed here, without recursing.
        int count = 0;
        int j = i;
        do {
            ++count;
            j = skipWhitespace(s, j + k);
            k = negation(s, j);
        } while (k > 0);
        final int n = count;
        return parseExpr(s, j).map(m -> {
            Expr e = m.expr;
            for (int c = 0; c < n; ++c) e = Expr.not(e);
            return new Match(m.end, e);
        });
    }

    private Optional<Match> parseBinary(String s, int i) {
        i = skipWhitespace(s, i);
        if (i >= s.length() || s.charAt(i) != '(') return Optional.empty();
        Optional<Match> left = parseExpr(s, i + 1);
        if (!left.isPresent()) return Optional.empty();

        // The operator is whatever lies between the operands: scan up to something that could begin one.
        int j = skipWhitespace(s, left.get().end);
        final int opStart = j;
        while (j < s.length() && !endsOperator(s, j)) ++j;
        final String op = s.substring(opStart, j);

        Optional<Match> right = parseExpr(s, j);
        if (!right.isPresent()) return Optional.empty();
        j = skipWhitespace(s, right.get().end);
        if (j >= s.length() || s.charAt(j) != ')') return Optional.empty();
        final int end = j + 1;
        return combine(op, left.get().expr, right.get().expr).map(e -> new Match(end, e));
    }

    private static boolean endsOperator(String s, int i) {
        char c = s.charAt(i);
        char d = i + 1 < s.length() ? s.charAt(i + 1) : '\0';
        switch (c) {
            case '!': case '(': case '[': case 'T': case 'F':
                return true;
            case 'f': return d == 'a';  // false
            case 't': return d == 'r';  // true
            case 'n': return d == 'o';  // not
            default: return whitespace.matches(c);
        }
    }

    private static Optional<Expr> combine(String op, Expr l, Expr r) {
        switch (op) {
            case "and": case "&":
                return Optional.of(Expr.and(l, r));
            case "or": case "|":
                return Optional.of(Expr.or(l, r));
            case "xor": case "^":
                return Optional.of(Expr.xor(l, r));
            case "then": case "implies": case "=>":
                return Optional.of(Expr.implies(l, r));
            case "if": case "<=":
                return Optional.of(Expr.implies(r, l));
            case "iff": case "<=>":
                return Optional.of(Expr.iff(l, r));
            default:
                return Optional.empty();
        }
    }

    private static int skipWhitespace(String s, int i) {
        while (i < s.length() && whitespace.matches(s.charAt(i))) ++i;
        return i;
    }
}
