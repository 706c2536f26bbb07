package net.littleredcomputer.sat;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * What every solver shares: the formula and configuration, input validation, the
 * decision and time budget, and periodic progress logging.
 */
public abstract class AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSATSolver.class);
    final int logCheckSteps = 10000;
    final Formula formula;
    final SolverConfig config;
    long stepCount;
    private long lastStepCount;
    private final String name;
    private Instant lastLogTime = Instant.EPOCH;
    final Stopwatch stopwatch = Stopwatch.createUnstarted();

    AbstractSATSolver(String name, Formula formula, SolverConfig config) {
        this.name = name;
        this.formula = formula;
        this.config = config;
    }

    /** Begin a solve. The time limit counts from here, not from any earlier solve. */
    void start() {
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    private final static int initialStateSegment = 81;
    private final static int finalStateSegment = 16;
    private String stateToString(int[] state) {
        StringBuilder s = new StringBuilder();
        if (state.length > 100) {
            for (int i = 0; i < initialStateSegment; ++i)  s.append(state[i]);
            s.append("...");
            for (int i = state.length-finalStateSegment; i < state.length; ++i) s.append(state[i]);
        } else {
            for (int aState : state) s.append(aState);
        }
        return s.toString();
    }

    void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(config.logInterval()) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    void maybeReportProgress(int[] m) {
        maybeReportProgress(() -> stateToString(m));
    }

    /** True once the decision budget is spent or the wall-clock budget has run out. */
    boolean deadlineExceeded(long decisions) {
        if (decisions >= config.maxDecisions()) return true;
        Optional<Duration> limit = config.timeLimit();
        return limit.isPresent() && stopwatch.elapsed().compareTo(limit.get()) >= 0;
    }

    /**
     * Describes the first literal that is zero or names a variable the formula does
     * not declare. An empty clause is not an input error.
     */
    Optional<String> inputError() {
        final int n = formula.nVariables();
        for (int i = 0; i < formula.nClauses(); ++i) {
            for (int l : formula.clause(i)) {
                if (l == 0 || l > n || l < -n) {
                    return Optional.of(String.format("clause %d: literal %d outside variables 1..%d", i + 1, l, n));
                }
            }
        }
        return Optional.empty();
    }

    String name() { return name; }

    public abstract Result solve();
}
