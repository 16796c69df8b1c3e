package net.littleredcomputer.propcheck;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.LongStream;

/**
 * Decides whether the last of a list of propositions (the theorem) follows from the
 * others (the axioms) by trying every assignment of the registered variables, in
 * ascending numeric order. The first model of the axioms that falsifies the theorem
 * is the reported counterexample.
 */
public class EntailmentChecker {
    private static final Logger log = LogManager.getFormatterLogger(EntailmentChecker.class);
    static final int logCheckSteps = 10000;
    /** Assignments handed to the parallel stream at a time. */
    static final int parallelBlockSize = 1 << 16;

    private final ImmutableList<Expr> axioms;
    private final Expr theorem;
    private final ImmutableList<String> variables;
    private final long nAssignments;

    long stepCount;
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    /**
     * @param propositions axioms followed by the theorem; must not be empty
     * @param variables names of the variables the propositions refer to, by index
     */
    public EntailmentChecker(List<Expr> propositions, List<String> variables) {
        Preconditions.checkArgument(!propositions.isEmpty(), "no theorem to check");
        Preconditions.checkArgument(variables.size() <= VariableRegistry.MAX_VARIABLES, "too many variables");
        this.axioms = ImmutableList.copyOf(propositions.subList(0, propositions.size() - 1));
        this.theorem = propositions.get(propositions.size() - 1);
        this.variables = ImmutableList.copyOf(variables);
        this.nAssignments = 1L << this.variables.size();
    }

    public EntailmentChecker(List<Expr> propositions, VariableRegistry registry) {
        this(propositions, registry.names());
    }

    public EntailmentChecker setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    private boolean axiomsHold(int x) {
        for (Expr a : axioms) {
            if (!Evaluator.evaluate(a, x)) return false;
        }
        return true;
    }

    public Verdict check() {
        start();
        boolean consistent = false;
        for (long x = 0; x < nAssignments; ++x) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(x);
            final int a = (int) x;
            if (!axiomsHold(a)) continue;
            consistent = true;
            if (!Evaluator.evaluate(theorem, a)) return finish(Verdict.falsified(a, variables));
        }
        return finish(consistent ? Verdict.verified(variables) : Verdict.inconsistent(variables));
    }

    /**
     * As {@link #check()}, but evaluates blocks of assignments on the common fork/join pool.
     * Blocks are examined in ascending order and the least counterexample within the
     * first block having any is reported, so the verdict is the same as that of check().
     */
    public Verdict checkParallel() {
        start();
        final AtomicBoolean consistent = new AtomicBoolean();
        for (long lo = 0; lo < nAssignments; lo += parallelBlockSize) {
            final long hi = Math.min(nAssignments, lo + parallelBlockSize);
            OptionalLong c = LongStream.range(lo, hi).parallel().filter(x -> {
                final int a = (int) x;
                if (!axiomsHold(a)) return false;
                consistent.set(true);
                return !Evaluator.evaluate(theorem, a);
            }).min();
            stepCount += hi - lo;
            maybeReportProgress(hi - 1);
            if (c.isPresent()) return finish(Verdict.falsified((int) c.getAsLong(), variables));
        }
        return finish(consistent.get() ? Verdict.verified(variables) : Verdict.inconsistent(variables));
    }

    private void start() {
        stepCount = 0;
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    private Verdict finish(Verdict v) {
        stopwatch.stop();
        log.info("%s after %d of %d assignments in %s", v.outcome(), stepCount, nAssignments, stopwatch);
        return v;
    }

    private String assignmentToString(long x) {
        if (variables.isEmpty()) return "";
        // Variable 0 is the rightmost digit.
        return Strings.padStart(Long.toBinaryString(x), variables.size(), '0');
    }

    private void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%d of %d assignments %s %.0f/sec %s",
                stepCount, nAssignments, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    private void maybeReportProgress(long x) {
        maybeReportProgress(() -> assignmentToString(x));
    }
}
