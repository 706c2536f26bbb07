package net.littleredcomputer.sat;

import com.google.common.base.MoreObjects;

import java.time.Duration;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Tunable parameters of a solve. The defaults are the usual MiniSat-era values; they
 * affect how fast a formula is decided, never the verdict.
 */
public final class SolverConfig {
    public enum Polarity {
        TRUE,   // branch on the positive literal first
        FALSE,  // branch on the negative literal first
        SAVED   // reuse the value the variable held before it was last unassigned
    }

    public static final SolverConfig DEFAULT = builder().build();

    private final Polarity decisionPolarityDefault;
    private final double activityBumpIncrement;
    private final double activityDecayFactor;
    private final double clauseDecayFactor;
    private final RestartStrategy restartStrategy;
    private final int restartInitialThreshold;
    private final double restartGrowthFactor;
    private final int clauseReductionInterval;
    private final double clauseReductionFraction;
    private final int glueLbd;
    private final boolean minimizeLearnedClauses;
    private final long maxDecisions;
    private final Duration timeLimit;  // null: no wall-clock budget
    private final Duration logInterval;

    private SolverConfig(Builder b) {
        decisionPolarityDefault = b.decisionPolarityDefault;
        activityBumpIncrement = b.activityBumpIncrement;
        activityDecayFactor = b.activityDecayFactor;
        clauseDecayFactor = b.clauseDecayFactor;
        restartStrategy = b.restartStrategy;
        restartInitialThreshold = b.restartInitialThreshold;
        restartGrowthFactor = b.restartGrowthFactor;
        clauseReductionInterval = b.clauseReductionInterval;
        clauseReductionFraction = b.clauseReductionFraction;
        glueLbd = b.glueLbd;
        minimizeLearnedClauses = b.minimizeLearnedClauses;
        maxDecisions = b.maxDecisions;
        timeLimit = b.timeLimit;
        logInterval = b.logInterval;
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .decisionPolarityDefault(decisionPolarityDefault)
                .activityBumpIncrement(activityBumpIncrement)
                .activityDecayFactor(activityDecayFactor)
                .clauseDecayFactor(clauseDecayFactor)
                .restartStrategy(restartStrategy)
                .restartInitialThreshold(restartInitialThreshold)
                .restartGrowthFactor(restartGrowthFactor)
                .clauseReductionInterval(clauseReductionInterval)
                .clauseReductionFraction(clauseReductionFraction)
                .glueLbd(glueLbd)
                .minimizeLearnedClauses(minimizeLearnedClauses)
                .maxDecisions(maxDecisions)
                .timeLimit(timeLimit)
                .logInterval(logInterval);
    }

    public Polarity decisionPolarityDefault() { return decisionPolarityDefault; }
    public double activityBumpIncrement() { return activityBumpIncrement; }
    public double activityDecayFactor() { return activityDecayFactor; }
    public double clauseDecayFactor() { return clauseDecayFactor; }
    public RestartStrategy restartStrategy() { return restartStrategy; }
    public int restartInitialThreshold() { return restartInitialThreshold; }
    public double restartGrowthFactor() { return restartGrowthFactor; }
    public int clauseReductionInterval() { return clauseReductionInterval; }
    public double clauseReductionFraction() { return clauseReductionFraction; }
    /** Learned clauses whose LBD is at most this value survive every reduction. */
    public int glueLbd() { return glueLbd; }
    public boolean minimizeLearnedClauses() { return minimizeLearnedClauses; }
    public long maxDecisions() { return maxDecisions; }
    public Optional<Duration> timeLimit() { return Optional.ofNullable(timeLimit); }
    public Duration logInterval() { return logInterval; }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("polarity", decisionPolarityDefault)
                .add("bump", activityBumpIncrement)
                .add("decay", activityDecayFactor)
                .add("clauseDecay", clauseDecayFactor)
                .add("restart", restartStrategy)
                .add("restartThreshold", restartInitialThreshold)
                .add("restartGrowth", restartGrowthFactor)
                .add("reductionInterval", clauseReductionInterval)
                .add("reductionFraction", clauseReductionFraction)
                .add("glueLbd", glueLbd)
                .add("minimize", minimizeLearnedClauses)
                .add("maxDecisions", maxDecisions)
                .add("timeLimit", timeLimit)
                .toString();
    }

    public static final class Builder {
        private Polarity decisionPolarityDefault = Polarity.SAVED;
        private double activityBumpIncrement = 1.0;
        private double activityDecayFactor = 0.95;
        private double clauseDecayFactor = 0.999;
        private RestartStrategy restartStrategy = RestartStrategy.GEOMETRIC;
        private int restartInitialThreshold = 100;
        private double restartGrowthFactor = 1.5;
        private int clauseReductionInterval = 2000;
        private double clauseReductionFraction = 0.5;
        private int glueLbd = 2;
        private boolean minimizeLearnedClauses = true;
        private long maxDecisions = Long.MAX_VALUE;
        private Duration timeLimit = null;
        private Duration logInterval = Duration.ofMillis(1000);

        private Builder() {}

        public Builder decisionPolarityDefault(Polarity p) {
            decisionPolarityDefault = checkNotNull(p);
            return this;
        }

        public Builder activityBumpIncrement(double d) {
            checkArgument(d > 0, "activity bump must be positive: %s", d);
            activityBumpIncrement = d;
            return this;
        }

        public Builder activityDecayFactor(double d) {
            checkArgument(d > 0 && d <= 1, "activity decay factor must lie in (0, 1]: %s", d);
            activityDecayFactor = d;
            return this;
        }

        public Builder clauseDecayFactor(double d) {
            checkArgument(d > 0 && d <= 1, "clause decay factor must lie in (0, 1]: %s", d);
            clauseDecayFactor = d;
            return this;
        }

        public Builder restartStrategy(RestartStrategy s) {
            restartStrategy = checkNotNull(s);
            return this;
        }

        public Builder restartInitialThreshold(int n) {
            checkArgument(n > 0, "restart threshold must be positive: %s", n);
            restartInitialThreshold = n;
            return this;
        }

        public Builder restartGrowthFactor(double f) {
            checkArgument(f >= 1, "restart growth factor must be at least 1: %s", f);
            restartGrowthFactor = f;
            return this;
        }

        public Builder clauseReductionInterval(int n) {
            checkArgument(n > 0, "clause reduction interval must be positive: %s", n);
            clauseReductionInterval = n;
            return this;
        }

        public Builder clauseReductionFraction(double f) {
            checkArgument(f >= 0 && f <= 1, "clause reduction fraction must lie in [0, 1]: %s", f);
            clauseReductionFraction = f;
            return this;
        }

        public Builder glueLbd(int n) {
            checkArgument(n >= 0, "glue LBD must not be negative: %s", n);
            glueLbd = n;
            return this;
        }

        public Builder minimizeLearnedClauses(boolean b) {
            minimizeLearnedClauses = b;
            return this;
        }

        public Builder maxDecisions(long n) {
            checkArgument(n >= 0, "decision budget must not be negative: %s", n);
            maxDecisions = n;
            return this;
        }

        public Builder timeLimit(Duration d) {
            checkArgument(d == null || !d.isNegative(), "time limit must not be negative: %s", d);
            timeLimit = d;
            return this;
        }

        public Builder logInterval(Duration d) {
            logInterval = checkNotNull(d);
            return this;
        }

        public SolverConfig build() { return new SolverConfig(this); }
    }
}
