package net.littleredcomputer.sat;

import org.junit.Test;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.Assert.assertArrayEquals;

public class ConflictAnalyzerTest {

    @Test
    public void decisionIsTheUip() {
        EngineFixture e = new EngineFixture(3);
        e.add(-1, 2);
        e.add(-1, 3);
        int conflict = e.add(-2, -3);
        assertThat(e.decide(1), is(conflict));
        LearnedClause c = e.analyzer.analyze(conflict).get();
        assertArrayEquals(new int[]{-1}, Literals.decode(c.literals()));
        assertThat(c.backjumpLevel(), is(0));
        assertThat(c.lbd(), is(1));
    }

    @Test
    public void backjumpToTheSecondHighestLevel() {
        EngineFixture e = new EngineFixture(5);
        e.add(-1, 2);
        e.add(-1, -4, 3);
        int conflict = e.add(-2, -3);
        assertThat(e.decide(5), is(Propagator.NO_CONFLICT));
        assertThat(e.decide(4), is(Propagator.NO_CONFLICT));
        assertThat(e.decide(1), is(conflict));
        LearnedClause c = e.analyzer.analyze(conflict).get();
        assertArrayEquals(new int[]{-1, -4}, Literals.decode(c.literals()));
        assertThat(c.asserting(), is(Literals.encode(-1)));
        assertThat(c.backjumpLevel(), is(2));
        assertThat(c.lbd(), is(2));
        // Every variable met during resolution was bumped; the unrelated decision was not.
        for (int v = 1; v <= 4; ++v) assertThat(e.order.activity(v), greaterThan(0.0));
        assertThat(e.order.activity(5), is(0.0));
    }

    @Test
    public void uipBelowTheDecision() {
        // Decide 1; 1 implies 2; 2 implies 3 and 4, which clash. The UIP is 2, not 1.
        EngineFixture e = new EngineFixture(5);
        e.add(-5, -1, 2);
        e.add(-2, 3);
        e.add(-2, 4);
        int conflict = e.add(-3, -4);
        e.decide(5);
        assertThat(e.decide(1), is(conflict));
        LearnedClause c = e.analyzer.analyze(conflict).get();
        assertArrayEquals(new int[]{-2}, Literals.decode(c.literals()));
        assertThat(c.backjumpLevel(), is(0));
    }

    @Test
    public void redundantLiteralsAreMinimized() {
        // Level 1: 1, which implies 2. Level 2: 3, which implies 4; then (-3 -1 -4) fails.
        // Resolution gives (-3 -1 -2), and -2 is implied by -1.
        int[][] clauses = {{-1, 2}, {-3, -2, 4}, {-3, -1, -4}};
        EngineFixture e = new EngineFixture(4);
        for (int[] c : clauses) e.add(c);
        e.decide(1);
        int conflict = e.decide(3);
        assertThat(conflict, is(not(Propagator.NO_CONFLICT)));
        LearnedClause c = e.analyzer.analyze(conflict).get();
        assertArrayEquals(new int[]{-3, -1}, Literals.decode(c.literals()));
        assertThat(c.backjumpLevel(), is(1));
        assertThat(e.statistics.minimizedLiterals, is(1L));

        EngineFixture f = new EngineFixture(4, SolverConfig.builder().minimizeLearnedClauses(false).build());
        for (int[] d : clauses) f.add(d);
        f.decide(1);
        LearnedClause g = f.analyzer.analyze(f.decide(3)).get();
        assertThat(g.size(), is(3));
        assertThat(g.asserting(), is(Literals.encode(-3)));
        assertThat(f.statistics.minimizedLiterals, is(0L));
    }

    @Test
    public void levelZeroConflictRefutes() {
        EngineFixture e = new EngineFixture(2);
        int u = e.add(1);
        e.add(-1, 2);
        int conflict = e.add(-1, -2);
        e.trail.assign(e.clauses.get(u).literals[0], u);
        assertThat(e.propagator.propagate(), is(conflict));
        assertThat(e.analyzer.analyze(conflict), isEmpty());
    }

    @Test
    public void analysisLeavesNoMarks() {
        // Two conflicts in a row must not see each other's bookkeeping.
        EngineFixture e = new EngineFixture(5);
        e.add(-1, 2);
        e.add(-1, -4, 3);
        int conflict = e.add(-2, -3);
        e.decide(4);
        e.decide(1);
        LearnedClause first = e.analyzer.analyze(conflict).get();
        LearnedClause second = e.analyzer.analyze(conflict).get();
        assertArrayEquals(first.literals(), second.literals());
    }

    @Test
    public void learnedClauseActivityIsBumped() {
        EngineFixture e = new EngineFixture(3);
        e.add(-1, 2);
        e.add(-1, 3);
        e.add(-2, -3);
        e.decide(1);
        // Learn (-2 -3 ...) by hand as a clause that will be the conflict.
        int h = e.clauses.addLearned(new LearnedClause(new int[]{Literals.encode(-3), Literals.encode(-2)}, 0, 1));
        double before = e.clauses.get(h).activity;
        e.analyzer.analyze(h);
        assertThat(e.clauses.get(h).activity, greaterThan(before));
    }
}
