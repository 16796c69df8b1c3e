package net.littleredcomputer.propcheck;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

/**
 * propcheck [-loginterval PT1S] [-parallel] file
 * <p>
 * Every proposition in the file except the last is an axiom; the last is the theorem to
 * prove. Exits with status 0 if the theorem is verified or the axioms are inconsistent,
 * and 1 if the theorem is false or the input cannot be processed.
 */
public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);

    private static Options options() {
        return new Options()
                .addOption("parallel", false, "evaluate blocks of assignments in parallel")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    /** Stack size of the thread that parses and checks; formulas may nest very deeply. */
    static final long stackSize = 256L << 20;

    private static Reader utf8(InputStream in) {
        // The decoder reports malformed input instead of substituting U+FFFD, which could
        // merge distinct variable names.
        return new InputStreamReader(in, StandardCharsets.UTF_8.newDecoder());
    }

    private static PropositionFile problem(String p) throws IOException {
        if (p.equals("-")) {
            // Standard input belongs to the caller and stays open.
            return PropositionFile.parseFrom(utf8(System.in));
        }
        try (Reader r = utf8(Files.newInputStream(Paths.get(p)))) {
            return PropositionFile.parseFrom(r);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    static void report(Verdict v, PrintStream out) {
        switch (v.outcome()) {
            case VERIFIED:
                out.println("Theorem has been verified!");
                break;
            case INCONSISTENT:
                out.println("Axioms are not consistent!");
                break;
            case FALSIFIED:
                out.println("Theorem is false!");
                Map<String, Boolean> witness = v.witness();
                if (!witness.isEmpty()) {
                    out.println("Counterexample:");
                    out.printf("%40s Value%n", "Proposition");
                }
                witness.forEach((name, value) -> out.printf("%40s %s%n", name, value ? "True" : "False"));
                break;
        }
    }

    /**
     * Run the check described by args, writing the report to out. The work is done on a
     * fresh thread with a {@link #stackSize} stack.
     * @return process exit status
     */
    static int run(String[] args, PrintStream out) {
        FutureTask<Integer> task = new FutureTask<>(() -> execute(args, out));
        Thread t = new Thread(null, task, "propcheck", stackSize);
        t.start();
        try {
            return task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted", e);
            return 1;
        } catch (ExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw new IllegalStateException(e.getCause());
        }
    }

    private static int execute(String[] args, PrintStream out) {
        CommandLine cmd;
        Duration interval;
        try {
            cmd = new DefaultParser().parse(options(), args);
            interval = logInterval(cmd);
        } catch (ParseException | DateTimeParseException e) {
            log.debug("bad command line", e);
            out.println("Usage: propcheck <filename>");
            return 1;
        }
        List<String> files = cmd.getArgList();
        if (files.isEmpty()) {
            out.println("Usage: propcheck <filename>");
            return 1;
        }
        final String filename = files.get(0);

        PropositionFile p;
        try {
            p = problem(filename);
        } catch (CharacterCodingException e) {
            log.debug("cannot decode %s", filename, e);
            out.printf("Error: Cannot decode %s as UTF-8%n", filename);
            return 1;
        } catch (IOException | UncheckedIOException e) {
            log.debug("cannot read %s", filename, e);
            out.printf("Error: Cannot open %s%n", filename);
            return 1;
        } catch (SyntaxException e) {
            log.debug("syntax error", e);
            out.printf("Error: Syntax Error line %d in %s%n", e.getLineNumber(), filename);
            return 1;
        } catch (TooManyVariablesException e) {
            log.debug("variable limit", e);
            out.printf("error: over %d propositional variables, exiting.%n", VariableRegistry.MAX_VARIABLES);
            return 1;
        }
        if (p.isEmpty()) {
            out.printf("Error: No theorem to check in %s%n", filename);
            return 1;
        }

        Stopwatch sw = Stopwatch.createStarted();
        EntailmentChecker checker = p.checker().setLogInterval(interval);
        Verdict v;
        try {
            v = cmd.hasOption("parallel") ? checker.checkParallel() : checker.check();
        } catch (StackOverflowError e) {
            log.debug("evaluation exhausted the stack", e);
            out.printf("Error: Propositions nested too deeply in %s%n", filename);
            return 1;
        }
        sw.stop();
        log.info("%s: %d propositions, %d variables, %s", filename, p.size(), p.registry().size(), sw);
        report(v, out);
        return v.isFalsified() ? 1 : 0;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }
}
