package net.littleredcomputer.sat;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;
import java.util.function.IntConsumer;

import static net.littleredcomputer.sat.Literals.negated;
import static net.littleredcomputer.sat.Literals.thevar;

/**
 * The assignment stack. Literals appear in the order they became true, which is a
 * topological order of the implication graph; levelStart[k-1] is the trail index of
 * the decision that opened level k. This is the only place that knows whether a
 * literal is currently true, false or unassigned.
 */
final class Trail {
    static final int FALSE = 0;
    static final int TRUE = 1;
    static final int UNDEFINED = -1;
    static final int NO_REASON = -1;

    private final int nVariables;
    private final int[] val;     // per variable: UNDEFINED, or 1 (true) or 0 (false)
    private final int[] level;
    private final int[] reason;  // clause handle, or NO_REASON for decisions
    private final int[] lits;
    private int size = 0;
    private final TIntArrayList levelStart = new TIntArrayList();
    private final IntConsumer onUnassign;
    int head = 0;  // lits[head..size) have not been propagated yet

    Trail(int nVariables, IntConsumer onUnassign) {
        this.nVariables = nVariables;
        this.onUnassign = onUnassign;
        val = new int[nVariables + 1];
        level = new int[nVariables + 1];
        reason = new int[nVariables + 1];
        lits = new int[nVariables];
        Arrays.fill(val, UNDEFINED);
        Arrays.fill(reason, NO_REASON);
    }

    /** TRUE, FALSE or UNDEFINED. */
    int value(int literal) {
        final int v = val[thevar(literal)];
        return v == UNDEFINED ? UNDEFINED : v ^ (literal & 1);
    }

    int nVariables() { return nVariables; }
    boolean isAssigned(int variable) { return val[variable] != UNDEFINED; }
    int levelOf(int variable) { return level[variable]; }
    int reasonOf(int variable) { return reason[variable]; }
    int currentLevel() { return levelStart.size(); }
    int size() { return size; }
    int get(int i) { return lits[i]; }
    boolean isComplete() { return size == nVariables; }

    void newDecisionLevel() {
        levelStart.add(size);
    }

    /**
     * Make literal true at the current decision level, forced by the clause with the given
     * handle (NO_REASON for a decision). Returns false if the literal was already true.
     */
    boolean assign(int literal, int antecedent) {
        final int v = thevar(literal);
        switch (value(literal)) {
            case TRUE: return false;
            case FALSE:
                throw new InvariantViolation(String.format("cannot assign %s: variable %d is already %s at level %d",
                        Literals.toString(literal), v, val[v] == 1, level[v]));
            default:
                val[v] = negated(literal) ? 0 : 1;
                level[v] = currentLevel();
                reason[v] = antecedent;
                lits[size++] = literal;
                return true;
        }
    }

    /**
     * Unassign, latest first, every literal set above the given level. Each one is handed
     * to the unassignment listener so the decision heuristic can take the variable back.
     */
    void undoToLevel(int target) {
        if (target < 0) throw new InvariantViolation("negative decision level " + target);
        if (target >= currentLevel()) return;
        final int bound = levelStart.get(target);
        for (int i = size - 1; i >= bound; --i) {
            final int l = lits[i];
            final int v = thevar(l);
            val[v] = UNDEFINED;
            reason[v] = NO_REASON;
            onUnassign.accept(l);
        }
        size = bound;
        if (head > size) head = size;
        levelStart.remove(target, levelStart.size() - target);
    }

    /** The current values as a boolean vector, element v-1 for variable v. Unassigned reads false. */
    boolean[] model() {
        boolean[] m = new boolean[nVariables];
        for (int v = 1; v <= nVariables; ++v) m[v - 1] = val[v] == 1;
        return m;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0, k = 0; i < size; ++i) {
            while (k < levelStart.size() && levelStart.get(k) == i) {
                sb.append(" |");
                ++k;
            }
            sb.append(' ').append(Literals.toString(lits[i]));
        }
        return sb.toString().trim();
    }
}
