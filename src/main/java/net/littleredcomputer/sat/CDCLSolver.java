package net.littleredcomputer.sat;

import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static net.littleredcomputer.sat.Literals.encode;
import static net.littleredcomputer.sat.Literals.not;

/**
 * Conflict-driven clause learning. The search alternates unit propagation with
 * decisions; every conflict is analyzed into a learned clause, the search backjumps
 * to the level where that clause becomes unit, and propagation resumes from there.
 * A conflict at level 0 refutes the formula; a complete assignment without conflict
 * satisfies it.
 *
 * <p>An instance may be solved more than once; each call starts from scratch.</p>
 */
public class CDCLSolver extends AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger();

    // The state of the most recent solve, kept for inspection.
    SearchContext context;
    Trail trail;
    WatchIndex watches;
    ClauseDatabase clauses;
    Propagator propagator;
    ConflictAnalyzer analyzer;

    boolean trackLearned = false;
    final List<int[]> learnedClauses = new ArrayList<>();  // in DIMACS form
    boolean trackBackjumps = false;
    final TIntArrayList backjumps = new TIntArrayList();  // (conflict level, backjump level) pairs
    boolean trackDecisions = false;
    final TIntArrayList decisionTrace = new TIntArrayList();  // (new level, conflicts, restarts) per decision

    public CDCLSolver(Formula formula) {
        this(formula, SolverConfig.DEFAULT);
    }

    public CDCLSolver(Formula formula, SolverConfig config) {
        super("CDCL", formula, config);
    }

    @Override
    public Result solve() {
        context = new SearchContext(formula.nVariables(), config);
        learnedClauses.clear();
        backjumps.clear();
        decisionTrace.clear();
        final Statistics statistics = context.statistics;
        Optional<String> error = inputError();
        if (error.isPresent()) {
            log.warn("%s: invalid input: %s", name(), error.get());
            return Result.invalidInput(error.get(), statistics);
        }
        start();
        log.debug("%s: %s %s", name(), formula, config);
        final Result result = load() ? search() : Result.unsatisfiable(statistics);
        stopwatch.stop();
        log.debug("%s: %s after %s: %s", name(), result.status(), stopwatch, result.statistics());
        return result;
    }

    /**
     * Build the clause database from the formula and assert its unit clauses at level 0.
     * Returns false if that alone refutes the formula.
     */
    private boolean load() {
        final int n = formula.nVariables();
        final Statistics statistics = context.statistics;
        trail = new Trail(n, context.order::onUnassign);
        watches = new WatchIndex(n);
        clauses = new ClauseDatabase(trail, watches, config.clauseDecayFactor());
        propagator = new Propagator(trail, watches, clauses, statistics);
        analyzer = new ConflictAnalyzer(trail, clauses, context.order, statistics, config.minimizeLearnedClauses());
        if (formula.hasEmptyClause()) return false;

        final TIntArrayList units = new TIntArrayList();
        for (int i = 0; i < formula.nClauses(); ++i) {
            final int[] c = normalize(formula.clause(i));
            if (c == null) continue;
            final int h = clauses.addOriginal(c);
            if (c.length == 1) units.add(h);
        }
        for (int i = 0; i < units.size(); ++i) {
            final int h = units.getQuick(i);
            final int l = clauses.get(h).literals[0];
            if (trail.value(l) == Trail.FALSE) return false;
            if (trail.assign(l, h)) ++statistics.propagations;
        }
        return true;
    }

    /**
     * The clause as sorted, encoded literals without repetitions, or null if the clause
     * contains a literal and its complement.
     */
    static int[] normalize(int[] dimacs) {
        final int[] c = new int[dimacs.length];
        for (int i = 0; i < c.length; ++i) c[i] = encode(dimacs[i]);
        Arrays.sort(c);
        int j = 0;
        for (int i = 0; i < c.length; ++i) {
            if (j > 0 && c[i] == c[j-1]) continue;
            // After sorting, x and its complement are adjacent.
            if (j > 0 && c[i] == not(c[j-1])) return null;
            c[j++] = c[i];
        }
        return j == c.length ? c : Arrays.copyOf(c, j);
    }

    private Result search() {
        final Statistics statistics = context.statistics;
        final VariableOrder order = context.order;
        while (true) {
            final int conflict = propagator.propagate();
            if (conflict != Propagator.NO_CONFLICT) {
                ++statistics.conflicts;
                ++context.conflictsSinceRestart;
                Optional<LearnedClause> learned = analyzer.analyze(conflict);
                if (!learned.isPresent()) return Result.unsatisfiable(statistics);
                learn(learned.get());
                order.decay();
                clauses.decayActivity();
                if (statistics.conflicts % context.config.clauseReductionInterval() == 0) reduce();
                continue;
            }
            if (trail.isComplete()) {
                final boolean[] model = trail.model();
                if (!formula.evaluate(model)) throw new InvariantViolation("complete assignment does not satisfy the formula");
                return Result.satisfiable(model, statistics);
            }
            if (deadlineExceeded(statistics.decisions)) {
                log.debug("%s: budget exhausted after %d decisions, %s", name(), statistics.decisions, stopwatch);
                return Result.unknown(Result.DEADLINE_EXCEEDED, statistics);
            }
            if (context.restarts.shouldRestart(context.conflictsSinceRestart)) restart();
            final int l = order.pickBranchingLiteral(trail);
            if (l == Literals.NO_LITERAL) throw new InvariantViolation("no unassigned variable on an incomplete trail");
            trail.newDecisionLevel();
            trail.assign(l, Trail.NO_REASON);
            ++statistics.decisions;
            if (trackDecisions) {
                decisionTrace.add(trail.currentLevel());
                decisionTrace.add((int) statistics.conflicts);
                decisionTrace.add((int) statistics.restarts);
            }
            if (trail.currentLevel() > statistics.maxDecisionLevel) statistics.maxDecisionLevel = trail.currentLevel();
            if (++stepCount % logCheckSteps == 0) {
                maybeReportProgress(() -> String.format("level %d trail %d conflicts %d learned %d",
                        trail.currentLevel(), trail.size(), statistics.conflicts, clauses.learnedCount()));
            }
        }
    }

    /** Backjump, record the learned clause, and assert its first literal. */
    private void learn(LearnedClause learned) {
        final int level = trail.currentLevel();
        if (learned.backjumpLevel() >= level) {
            throw new InvariantViolation(String.format("backjump level %d is not below conflict level %d",
                    learned.backjumpLevel(), level));
        }
        if (trackBackjumps) {
            backjumps.add(level);
            backjumps.add(learned.backjumpLevel());
        }
        if (trackLearned) learnedClauses.add(Literals.decode(learned.literals()));
        trail.undoToLevel(learned.backjumpLevel());
        final int h = clauses.addLearned(learned);
        ++context.statistics.learnedClauses;
        trail.assign(learned.asserting(), h);
        ++context.statistics.propagations;
    }

    private void reduce() {
        final Statistics statistics = context.statistics;
        final int deleted = clauses.reduce(context.config.clauseReductionFraction(), context.config.glueLbd());
        statistics.deletedClauses += deleted;
        ++statistics.reductions;
        log.trace("%s: reduction %d deleted %d, %d learned clauses remain",
                name(), statistics.reductions, deleted, clauses.learnedCount());
    }

    /** Undo every decision. Learned clauses, activities and saved phases survive. */
    void restart() {
        trail.undoToLevel(0);
        context.restarts.onRestart();
        context.conflictsSinceRestart = 0;
        ++context.statistics.restarts;
        log.trace("%s: restart %d, next after %.0f conflicts",
                name(), context.statistics.restarts, context.restarts.threshold());
    }
}
