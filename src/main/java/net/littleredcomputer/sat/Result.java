package net.littleredcomputer.sat;

import com.google.common.base.MoreObjects;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The verdict of a solve together with the statistics gathered on the way.
 * Only a satisfiable result carries an assignment; only an unknown or invalid
 * result carries a reason.
 */
public final class Result {
    public enum Status {
        SATISFIABLE,
        UNSATISFIABLE,
        UNKNOWN,        // the decision or time budget ran out
        INVALID_INPUT   // the formula mentions a variable it does not declare
    }

    public static final String DEADLINE_EXCEEDED = "deadline-exceeded";

    private final Status status;
    private final boolean[] assignment;
    private final String reason;
    private final Statistics statistics;

    private Result(Status status, boolean[] assignment, String reason, Statistics statistics) {
        this.status = status;
        this.assignment = assignment;
        this.reason = reason;
        this.statistics = new Statistics(statistics);
    }

    static Result satisfiable(boolean[] assignment, Statistics s) {
        return new Result(Status.SATISFIABLE, assignment.clone(), null, s);
    }

    static Result unsatisfiable(Statistics s) {
        return new Result(Status.UNSATISFIABLE, null, null, s);
    }

    static Result unknown(String reason, Statistics s) {
        return new Result(Status.UNKNOWN, null, reason, s);
    }

    static Result invalidInput(String reason, Statistics s) {
        return new Result(Status.INVALID_INPUT, null, reason, s);
    }

    public Status status() { return status; }
    public boolean isSatisfiable() { return status == Status.SATISFIABLE; }
    public boolean isUnsatisfiable() { return status == Status.UNSATISFIABLE; }

    /**
     * The satisfying assignment, if there is one. Element v-1 holds the value of
     * variable v; every declared variable has a value.
     */
    public Optional<boolean[]> assignment() {
        return assignment == null ? Optional.empty() : Optional.of(assignment.clone());
    }

    /** The value of one (one-based) variable in the satisfying assignment. */
    public Optional<Boolean> valueOf(int variable) {
        if (assignment == null) return Optional.empty();
        checkArgument(variable >= 1 && variable <= assignment.length, "no such variable: %s", variable);
        return Optional.of(assignment[variable - 1]);
    }

    public Optional<String> reason() { return Optional.ofNullable(reason); }
    public Statistics statistics() { return statistics; }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("status", status)
                .add("reason", reason)
                .add("statistics", statistics)
                .toString();
    }
}
