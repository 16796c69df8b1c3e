package net.littleredcomputer.propcheck;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Outcome of an entailment check. A falsified theorem carries the assignment that
 * witnesses it, together with the names of the variables so that the witness can be
 * reported.
 */
public final class Verdict {
    public enum Outcome {
        /** Every model of the axioms satisfies the theorem, and there is at least one model. */
        VERIFIED,
        /** No assignment satisfies all the axioms. */
        INCONSISTENT,
        /** Some model of the axioms falsifies the theorem. */
        FALSIFIED,
    }

    private final Outcome outcome;
    private final int counterexample;
    private final ImmutableList<String> variables;

    private Verdict(Outcome outcome, int counterexample, ImmutableList<String> variables) {
        this.outcome = outcome;
        this.counterexample = counterexample;
        this.variables = variables;
    }

    static Verdict verified(ImmutableList<String> variables) {
        return new Verdict(Outcome.VERIFIED, 0, variables);
    }

    static Verdict inconsistent(ImmutableList<String> variables) {
        return new Verdict(Outcome.INCONSISTENT, 0, variables);
    }

    static Verdict falsified(int assignment, ImmutableList<String> variables) {
        return new Verdict(Outcome.FALSIFIED, assignment, variables);
    }

    public Outcome outcome() { return outcome; }

    public boolean isFalsified() { return outcome == Outcome.FALSIFIED; }

    /** The first falsifying assignment in ascending order, present only when the theorem is false. */
    public OptionalInt counterexample() {
        return isFalsified() ? OptionalInt.of(counterexample) : OptionalInt.empty();
    }

    /**
     * The counterexample as variable name to truth value, in registration order.
     * @throws IllegalStateException if the theorem was not falsified
     */
    public ImmutableMap<String, Boolean> witness() {
        Preconditions.checkState(isFalsified(), "no counterexample: %s", outcome);
        ImmutableMap.Builder<String, Boolean> b = ImmutableMap.builder();
        for (int i = 0; i < variables.size(); ++i) b.put(variables.get(i), ((counterexample >>> i) & 1) != 0);
        return b.build();
    }

    public ImmutableList<String> variables() { return variables; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Verdict v = (Verdict) o;
        return outcome == v.outcome && counterexample == v.counterexample && variables.equals(v.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outcome, counterexample, variables);
    }

    @Override
    public String toString() {
        return isFalsified() ? outcome + " " + witness() : outcome.toString();
    }
}
