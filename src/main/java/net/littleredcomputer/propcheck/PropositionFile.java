package net.littleredcomputer.propcheck;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * A list of propositions read from text, one per line. Lines starting with {@code //}
 * and lines containing only whitespace are ignored. Every proposition but the last is
 * an axiom; the last is the theorem.
 */
public class PropositionFile {
    private static final Logger log = LogManager.getFormatterLogger(PropositionFile.class);

    private final ImmutableList<Expr> propositions;
    private final ImmutableList<Integer> lineNumbers;
    private final VariableRegistry registry;

    private PropositionFile(ImmutableList<Expr> propositions, ImmutableList<Integer> lineNumbers, VariableRegistry registry) {
        this.propositions = propositions;
        this.lineNumbers = lineNumbers;
        this.registry = registry;
    }

    public static PropositionFile parseFrom(String s) {
        try {
            return parseFrom(new StringReader(s));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parse every proposition line of r, in order.
     * @throws SyntaxException carrying the 1-based number of the first line that does not parse
     * @throws TooManyVariablesException if more than 32 distinct variables appear
     * @throws IOException if r cannot be read
     */
    public static PropositionFile parseFrom(Reader r) throws IOException {
        ExpressionParser parser = new ExpressionParser();
        ImmutableList.Builder<Expr> ps = ImmutableList.builder();
        ImmutableList.Builder<Integer> ns = ImmutableList.builder();
        BufferedReader br = new BufferedReader(r);
        int lineNumber = 0;
        for (String line = br.readLine(); line != null; line = br.readLine()) {
            ++lineNumber;
            if (isComment(line) || isBlank(line)) continue;
            try {
                ps.add(parser.parseLine(line));
            } catch (SyntaxException e) {
                throw e.atLine(lineNumber);
            }
            ns.add(lineNumber);
        }
        PropositionFile p = new PropositionFile(ps.build(), ns.build(), parser.registry());
        log.debug("read %d propositions over %d variables from %d lines", p.size(), p.registry.size(), lineNumber);
        return p;
    }

    static boolean isComment(String line) { return line.startsWith("//"); }

    static boolean isBlank(String line) { return ExpressionParser.whitespace.matchesAllOf(line); }

    public int size() { return propositions.size(); }

    public boolean isEmpty() { return propositions.isEmpty(); }

    public ImmutableList<Expr> propositions() { return propositions; }

    public List<Expr> axioms() {
        return isEmpty() ? ImmutableList.of() : propositions.subList(0, size() - 1);
    }

    public Expr theorem() {
        if (isEmpty()) throw new IllegalStateException("no theorem");
        return propositions.get(size() - 1);
    }

    /** Source line of the i-th proposition, counting from 1 and including skipped lines. */
    public int lineNumber(int i) { return lineNumbers.get(i); }

    public VariableRegistry registry() { return registry; }

    public EntailmentChecker checker() {
        return new EntailmentChecker(propositions, registry);
    }
}
