package net.littleredcomputer.sat;

import com.google.common.base.MoreObjects;

/**
 * Counters accumulated during one solve. The solvers update the fields directly;
 * a {@link Result} carries a copy that no longer changes.
 */
public final class Statistics {
    long decisions;
    long conflicts;
    long propagations;
    long learnedClauses;
    long restarts;
    long deletedClauses;
    long reductions;
    long minimizedLiterals;
    int maxDecisionLevel;

    Statistics() {}

    Statistics(Statistics s) {
        decisions = s.decisions;
        conflicts = s.conflicts;
        propagations = s.propagations;
        learnedClauses = s.learnedClauses;
        restarts = s.restarts;
        deletedClauses = s.deletedClauses;
        reductions = s.reductions;
        minimizedLiterals = s.minimizedLiterals;
        maxDecisionLevel = s.maxDecisionLevel;
    }

    public long decisions() { return decisions; }
    public long conflicts() { return conflicts; }
    /** Literals forced by a clause, including unit clauses of the input. */
    public long propagations() { return propagations; }
    public long learnedClauses() { return learnedClauses; }
    public long restarts() { return restarts; }
    public long deletedClauses() { return deletedClauses; }
    public long reductions() { return reductions; }
    /** Literals removed from learned clauses by minimization. */
    public long minimizedLiterals() { return minimizedLiterals; }
    public int maxDecisionLevel() { return maxDecisionLevel; }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("decisions", decisions)
                .add("conflicts", conflicts)
                .add("propagations", propagations)
                .add("learnedClauses", learnedClauses)
                .add("restarts", restarts)
                .add("deletedClauses", deletedClauses)
                .add("reductions", reductions)
                .add("minimizedLiterals", minimizedLiterals)
                .add("maxDecisionLevel", maxDecisionLevel)
                .toString();
    }
}
