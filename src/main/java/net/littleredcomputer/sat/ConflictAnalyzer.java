package net.littleredcomputer.sat;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.Optional;

import static net.littleredcomputer.sat.Literals.not;
import static net.littleredcomputer.sat.Literals.thevar;

/**
 * First-UIP conflict analysis. Starting from a falsified clause, resolve away the
 * current-level literals in reverse trail order until exactly one remains: that
 * literal is the unique implication point, and its complement asserts the learned
 * clause after the backjump.
 */
final class ConflictAnalyzer {
    private final Trail trail;
    private final ClauseDatabase clauses;
    private final VariableOrder order;
    private final Statistics statistics;
    private final boolean minimize;

    private final boolean[] seen;
    private final int[] levelStamp;
    private int stamp = 0;
    private final TIntArrayList learned = new TIntArrayList();
    private final TIntArrayList toClear = new TIntArrayList();
    private final TIntArrayStack stack = new TIntArrayStack();

    ConflictAnalyzer(Trail trail, ClauseDatabase clauses, VariableOrder order, Statistics statistics, boolean minimize) {
        this.trail = trail;
        this.clauses = clauses;
        this.order = order;
        this.statistics = statistics;
        this.minimize = minimize;
        seen = new boolean[trail.nVariables() + 1];
        levelStamp = new int[trail.nVariables() + 1];
    }

    /**
     * Derive the clause to learn from the conflict with the given handle. Empty when
     * the conflict is at decision level 0, where the formula is refuted.
     */
    Optional<LearnedClause> analyze(int conflict) {
        final int conflictLevel = trail.currentLevel();
        if (conflictLevel == 0) return Optional.empty();

        learned.resetQuick();
        learned.add(Literals.NO_LITERAL);  // room for the asserting literal
        int pathCount = 0;
        int p = Literals.NO_LITERAL;
        int index = trail.size() - 1;
        int reason = conflict;
        do {
            final Clause c = clauses.get(reason);
            if (c.learned) clauses.bumpActivity(reason);
            for (int q : c.literals) {
                final int v = thevar(q);
                if (p != Literals.NO_LITERAL && v == thevar(p)) continue;
                if (seen[v] || trail.levelOf(v) == 0) continue;
                seen[v] = true;
                order.bump(v);
                if (trail.levelOf(v) >= conflictLevel) ++pathCount;
                else learned.add(q);
            }
            if (pathCount == 0) {
                throw new InvariantViolation("conflict clause " + c + " has no literal at level " + conflictLevel);
            }
            while (!seen[thevar(trail.get(index))]) --index;
            p = trail.get(index--);
            reason = trail.reasonOf(thevar(p));
            seen[thevar(p)] = false;
            --pathCount;
        } while (pathCount > 0);
        learned.set(0, not(p));

        toClear.resetQuick();
        toClear.addAll(learned);
        if (minimize) minimize();
        for (int i = 0; i < toClear.size(); ++i) seen[thevar(toClear.getQuick(i))] = false;

        final int[] literals = learned.toArray();
        int backjumpLevel = 0;
        if (literals.length > 1) {
            int max = 1;
            for (int i = 2; i < literals.length; ++i) {
                if (trail.levelOf(thevar(literals[i])) > trail.levelOf(thevar(literals[max]))) max = i;
            }
            final int t = literals[1];
            literals[1] = literals[max];
            literals[max] = t;
            backjumpLevel = trail.levelOf(thevar(literals[1]));
        }
        return Optional.of(new LearnedClause(literals, backjumpLevel, lbd(literals)));
    }

    /** Number of distinct decision levels among the literals. */
    int lbd(int[] literals) {
        ++stamp;
        int n = 0;
        for (int l : literals) {
            final int level = trail.levelOf(thevar(l));
            if (levelStamp[level] != stamp) {
                levelStamp[level] = stamp;
                ++n;
            }
        }
        return n;
    }

    // Drop every literal implied by the rest of the clause.
    private void minimize() {
        int abstractLevels = 0;
        for (int i = 1; i < learned.size(); ++i) abstractLevels |= abstractLevel(thevar(learned.getQuick(i)));
        int j = 1;
        for (int i = 1; i < learned.size(); ++i) {
            final int l = learned.getQuick(i);
            if (trail.reasonOf(thevar(l)) == Trail.NO_REASON || !redundant(l, abstractLevels)) {
                learned.setQuick(j++, l);
            }
        }
        statistics.minimizedLiterals += learned.size() - j;
        learned.remove(j, learned.size() - j);
    }

    /**
     * True if the literal is implied by literals already marked seen, following
     * antecedents through the implication graph. Marks made during a failed search
     * are withdrawn.
     */
    private boolean redundant(int literal, int abstractLevels) {
        stack.clear();
        stack.push(literal);
        final int top = toClear.size();
        while (stack.size() > 0) {
            final int q = stack.pop();
            final Clause c = clauses.get(trail.reasonOf(thevar(q)));
            for (int l : c.literals) {
                final int v = thevar(l);
                if (v == thevar(q) || seen[v] || trail.levelOf(v) == 0) continue;
                if (trail.reasonOf(v) != Trail.NO_REASON && (abstractLevel(v) & abstractLevels) != 0) {
                    seen[v] = true;
                    stack.push(l);
                    toClear.add(l);
                } else {
                    for (int k = top; k < toClear.size(); ++k) seen[thevar(toClear.getQuick(k))] = false;
                    toClear.remove(top, toClear.size() - top);
                    return false;
                }
            }
        }
        return true;
    }

    private int abstractLevel(int v) {
        return 1 << (trail.levelOf(v) & 31);
    }
}
