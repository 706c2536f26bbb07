package net.littleredcomputer.sat;

import gnu.trove.list.array.TIntArrayList;
import org.junit.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.function.Function;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class CDCLSolverTest extends SATTestBase {
    private final Function<Formula, AbstractSATSolver> C = CDCLSolver::new;
    private final Function<Formula, AbstractSATSolver> luby =
            f -> new CDCLSolver(f, SolverConfig.builder().restartStrategy(RestartStrategy.LUBY).restartInitialThreshold(32).build());

    @Test public void ex6() { testEx6With(C); }
    @Test public void ex7() { testEx7With(C); }

    @Test public void w3_3() { assertThat(waerden(3, 3, C), is(9)); }
    @Test public void w3_4() { assertThat(waerden(3, 4, C), is(18)); }
    @Test public void w4_3() { assertThat(waerden(4, 3, C), is(18)); }
    @Test public void w4_4() { assertThat(waerden(4, 4, C), is(35)); }
    @Test public void w4_4Luby() { assertThat(waerden(4, 4, luby), is(35)); }

    @Test public void langford() { testLangfordWith(C); }
    @Test public void hole6() { testHole6With(C); }
    @Test public void queens8() { testQueens8With(C); }

    @Test
    public void twoClausesForceY() {
        Result r = new CDCLSolver(Formula.of(2, new int[]{1, 2}, new int[]{-1, 2})).solve();
        assertThat(r.status(), is(Result.Status.SATISFIABLE));
        assertThat(r.valueOf(2), isPresentAndIs(true));
    }

    @Test
    public void pigeonholeIsRefutedByLearning() {
        Result r = new CDCLSolver(TestProblems.pigeonhole(5, 4)).solve();
        assertThat(r.status(), is(Result.Status.UNSATISFIABLE));
        assertThat(r.statistics().conflicts(), greaterThan(0L));
        assertThat(r.statistics().learnedClauses(), greaterThan(0L));
        assertThat(r.assignment(), isEmpty());
    }

    @Test
    public void emptyClauseNeedsNoDecisions() {
        Result r = new CDCLSolver(Formula.of(3, new int[]{1, 2}, new int[]{}, new int[]{-3})).solve();
        assertThat(r.status(), is(Result.Status.UNSATISFIABLE));
        assertThat(r.statistics().decisions(), is(0L));
    }

    @Test
    public void unitClauseIsPropagated() {
        Result r = new CDCLSolver(Formula.of(1, new int[]{1})).solve();
        assertThat(r.status(), is(Result.Status.SATISFIABLE));
        assertThat(r.valueOf(1), isPresentAndIs(true));
        assertThat(r.statistics().propagations(), greaterThanOrEqualTo(1L));
        assertThat(r.statistics().decisions(), is(0L));
    }

    @Test
    public void exactlyOneOfThree() {
        Result r = new CDCLSolver(Formula.of(3,
                new int[]{1, 2, 3}, new int[]{-1, -2}, new int[]{-1, -3}, new int[]{-2, -3})).solve();
        assertThat(r.status(), is(Result.Status.SATISFIABLE));
        boolean[] a = r.assignment().get();
        int trueCount = 0;
        for (boolean b : a) if (b) ++trueCount;
        assertThat(trueCount, is(1));
    }

    @Test
    public void conflictingUnitsAreUnsatisfiable() {
        Result r = new CDCLSolver(Formula.of(2, new int[]{1}, new int[]{2, 1}, new int[]{-1})).solve();
        assertThat(r.status(), is(Result.Status.UNSATISFIABLE));
        assertThat(r.statistics().decisions(), is(0L));
    }

    @Test
    public void noClausesIsSatisfiable() {
        Result r = new CDCLSolver(Formula.of(3)).solve();
        assertThat(r.status(), is(Result.Status.SATISFIABLE));
        assertThat(r.assignment().get().length, is(3));
    }

    @Test
    public void tautologiesAndRepeatsAreHarmless() {
        Formula f = Formula.of(2, new int[]{1, -1}, new int[]{2, 2, 2}, new int[]{-1, 2, -1});
        Result r = new CDCLSolver(f).solve();
        assertThat(r.status(), is(Result.Status.SATISFIABLE));
        assertThat(r.valueOf(2), isPresentAndIs(true));
        assertTrue(f.evaluate(r.assignment().get()));
    }

    @Test
    public void normalizeSortsAndDropsRepeats() {
        assertArrayEquals(new int[]{2, 5, 6}, CDCLSolver.normalize(new int[]{3, -2, 1, 3, -2}));
        assertNull(CDCLSolver.normalize(new int[]{4, 1, -4}));
    }

    @Test
    public void invalidLiteralIsReportedNotThrown() {
        Result r = new CDCLSolver(Formula.of(2, new int[]{1, 3})).solve();
        assertThat(r.status(), is(Result.Status.INVALID_INPUT));
        assertTrue(r.reason().isPresent());
        assertThat(r.statistics().decisions(), is(0L));
        assertThat(new CDCLSolver(Formula.of(2, new int[]{1, 0, 2})).solve().status(), is(Result.Status.INVALID_INPUT));
    }

    @Test
    public void decisionBudget() {
        Result r = new CDCLSolver(TestProblems.pigeonhole(9, 8), SolverConfig.builder().maxDecisions(50).build()).solve();
        assertThat(r.status(), is(Result.Status.UNKNOWN));
        assertThat(r.reason(), isPresentAndIs(Result.DEADLINE_EXCEEDED));
        assertThat(r.statistics().decisions(), is(50L));
        assertThat(r.assignment(), isEmpty());
    }

    @Test
    public void timeBudget() {
        Result r = new CDCLSolver(TestProblems.pigeonhole(9, 8), SolverConfig.builder().timeLimit(Duration.ZERO).build()).solve();
        assertThat(r.status(), is(Result.Status.UNKNOWN));
        assertThat(r.reason(), isPresentAndIs(Result.DEADLINE_EXCEEDED));
    }

    @Test
    public void agreesWithBacktracking() {
        for (long seed = 0; seed < 40; ++seed) {
            Formula f = TestProblems.random(3, 85, 20, seed);
            Result c = new CDCLSolver(f).solve();
            Result b = new BacktrackingSolver(f).solve();
            assertEquals("seed " + seed, b.status(), c.status());
            if (c.isSatisfiable()) assertTrue(f.evaluate(c.assignment().get()));
        }
    }

    @Test
    public void everyPolarityAndRestartStrategyAgrees() {
        for (SolverConfig.Polarity p : SolverConfig.Polarity.values()) {
            for (RestartStrategy s : RestartStrategy.values()) {
                SolverConfig config = SolverConfig.builder()
                        .decisionPolarityDefault(p)
                        .restartStrategy(s)
                        .restartInitialThreshold(10)
                        .clauseReductionInterval(50)
                        .build();
                assertThat(new CDCLSolver(hole6, config).solve().status(), is(Result.Status.UNSATISFIABLE));
                assertSAT(queens8, f -> new CDCLSolver(f, config));
                assertThat(new CDCLSolver(TestProblems.pigeonhole(6, 6), config).solve().status(), is(Result.Status.SATISFIABLE));
            }
        }
    }

    @Test
    public void withoutMinimization() {
        SolverConfig config = SolverConfig.builder().minimizeLearnedClauses(false).build();
        Result r = new CDCLSolver(hole6, config).solve();
        assertThat(r.status(), is(Result.Status.UNSATISFIABLE));
        assertThat(r.statistics().minimizedLiterals(), is(0L));
    }

    @Test
    public void reductionDeletesClauses() {
        SolverConfig config = SolverConfig.builder().clauseReductionInterval(20).glueLbd(0).build();
        Result r = new CDCLSolver(hole6, config).solve();
        assertThat(r.status(), is(Result.Status.UNSATISFIABLE));
        assertThat(r.statistics().reductions(), greaterThan(0L));
        assertThat(r.statistics().deletedClauses(), greaterThan(0L));
    }

    @Test
    public void learnedClausesAreImpliedByTheFormula() {
        int learned = 0;
        for (long seed = 0; seed < 30; ++seed) {
            Formula f = TestProblems.random(3, 52, 12, seed);
            CDCLSolver s = new CDCLSolver(f);
            s.trackLearned = true;
            s.solve();
            for (int[] c : s.learnedClauses) {
                ++learned;
                assertTrue("seed " + seed + " learned " + Arrays.toString(c), implied(f, c));
            }
        }
        assertThat(learned, greaterThan(0));
    }

    // True if every model of f satisfies the clause.
    private static boolean implied(Formula f, int[] clause) {
        final int n = f.nVariables();
        boolean[] p = new boolean[n];
        ASSIGNMENT:
        for (int bits = 0; bits < 1 << n; ++bits) {
            for (int v = 0; v < n; ++v) p[v] = (bits & 1 << v) != 0;
            if (!f.evaluate(p)) continue;
            for (int l : clause) if (p[Math.abs(l) - 1] == l > 0) continue ASSIGNMENT;
            return false;
        }
        return true;
    }

    @Test
    public void backjumpsGoBelowTheConflictLevel() {
        CDCLSolver s = new CDCLSolver(hole6);
        s.trackBackjumps = true;
        assertThat(s.solve().status(), is(Result.Status.UNSATISFIABLE));
        TIntArrayList b = s.backjumps;
        assertThat(b.size(), greaterThan(0));
        for (int i = 0; i < b.size(); i += 2) assertThat(b.get(i + 1), lessThan(b.get(i)));
    }

    @Test
    public void decisionsClimbOneLevelAtATime() {
        CDCLSolver s = new CDCLSolver(hole6, SolverConfig.builder()
                .restartStrategy(RestartStrategy.LUBY).restartInitialThreshold(4).build());
        s.trackDecisions = true;
        assertThat(s.solve().status(), is(Result.Status.UNSATISFIABLE));
        TIntArrayList d = s.decisionTrace;
        assertThat(d.size(), is(3 * (int) s.context.statistics.decisions));
        assertThat(d.get(0), is(1));
        int climbs = 0, drops = 0;
        for (int i = 3; i < d.size(); i += 3) {
            int level = d.get(i), previous = d.get(i - 3);
            if (d.get(i + 1) == d.get(i - 2) && d.get(i + 2) == d.get(i - 1)) {
                // No conflict and no restart since the previous decision.
                assertThat("decision " + i / 3, level, is(previous + 1));
                ++climbs;
            } else {
                assertThat("decision " + i / 3, level, lessThanOrEqualTo(previous));
                ++drops;
            }
        }
        assertThat(climbs, greaterThan(0));
        assertThat(drops, greaterThan(0));
        assertThat(s.context.statistics.restarts, greaterThan(0L));
    }

    @Test
    public void timeLimitCountsFromEachSolve() throws InterruptedException {
        CDCLSolver s = new CDCLSolver(TestProblems.pigeonhole(6, 6),
                SolverConfig.builder().timeLimit(Duration.ofSeconds(1)).build());
        assertThat(s.solve().status(), is(Result.Status.SATISFIABLE));
        assertThat(s.stopwatch.isRunning(), is(false));
        Thread.sleep(1200);
        Result second = s.solve();
        assertThat(second.status(), is(Result.Status.SATISFIABLE));
        assertThat(second.statistics().decisions(), greaterThan(0L));
    }

    @Test
    public void watchesAreConsistentAtFixpoint() {
        CDCLSolver s = new CDCLSolver(queens8);
        assertThat(s.solve().status(), is(Result.Status.SATISFIABLE));
        assertThat(s.propagator.checkWatchInvariant(), isEmpty());

        CDCLSolver t = new CDCLSolver(TestProblems.pigeonhole(9, 8), SolverConfig.builder().maxDecisions(300).build());
        assertThat(t.solve().status(), is(Result.Status.UNKNOWN));
        assertThat(t.propagator.checkWatchInvariant(), isEmpty());
    }

    @Test
    public void restartOnlyResetsTheTrail() {
        CDCLSolver s = new CDCLSolver(TestProblems.pigeonhole(9, 8), SolverConfig.builder().maxDecisions(200).build());
        assertThat(s.solve().status(), is(Result.Status.UNKNOWN));
        TIntArrayList handles = s.clauses.learnedHandles();
        double[] activity = s.context.order.activitySnapshot();
        int level0 = 0;
        while (level0 < s.trail.size() && s.trail.levelOf(Literals.thevar(s.trail.get(level0))) == 0) ++level0;

        s.restart();

        assertThat(s.trail.currentLevel(), is(0));
        assertThat(s.trail.size(), is(level0));
        assertThat(s.clauses.learnedHandles(), is(handles));
        assertArrayEquals(activity, s.context.order.activitySnapshot(), 0.0);
        assertThat(s.propagator.checkWatchInvariant(), isEmpty());
        for (int v = 1; v <= s.formula.nVariables(); ++v) {
            assertThat(s.trail.isAssigned(v) || s.context.order.inHeap(v), is(true));
        }
    }

    @Test
    public void solveCanBeRepeated() {
        CDCLSolver s = new CDCLSolver(TestProblems.pigeonhole(5, 4));
        Result first = s.solve();
        Result second = s.solve();
        assertThat(second.status(), is(first.status()));
        assertThat(second.statistics().conflicts(), is(first.statistics().conflicts()));
    }

    @Test
    public void solverKindsDispatch() {
        assertThat(SolverKind.CDCL.newSolver(ex7, SolverConfig.DEFAULT), instanceOf(CDCLSolver.class));
        assertThat(SolverKind.CDCL.solve(ex6).status(), is(Result.Status.UNSATISFIABLE));
        assertThat(SolverKind.BACKTRACKING.solve(ex7).assignment().map(ex7::evaluate), isPresentAndIs(true));
        assertThat(Arrays.asList(SolverKind.values()), contains(SolverKind.CDCL, SolverKind.BACKTRACKING));
    }
}
