package net.littleredcomputer.sat;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntBinaryOperator;
import java.util.stream.IntStream;

import static net.littleredcomputer.sat.Literals.thevar;

/**
 * Owns every clause, original and learned, in an arena addressed by int handles. A
 * handle stays valid until its clause is deleted; the slot is then recycled. Only
 * learned clauses are ever deleted, and never while they are the reason for a literal
 * on the trail.
 */
final class ClauseDatabase {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final double RESCALE_LIMIT = 1e20;

    private final List<Clause> arena = new ArrayList<>();
    private final TIntStack free = new TIntArrayStack();
    private final TIntArrayList learned = new TIntArrayList();
    private final Trail trail;
    private final WatchIndex watches;
    private final double decayFactor;
    private double increment = 1.0;

    ClauseDatabase(Trail trail, WatchIndex watches, double decayFactor) {
        this.trail = trail;
        this.watches = watches;
        this.decayFactor = decayFactor;
    }

    Clause get(int handle) {
        Clause c = handle >= 0 && handle < arena.size() ? arena.get(handle) : null;
        if (c == null) throw new InvariantViolation("dangling clause handle " + handle);
        return c;
    }

    /** The literals must be distinct and non-complementary. */
    int addOriginal(int[] literals) {
        return store(new Clause(literals, false, 0));
    }

    int addLearned(LearnedClause lc) {
        final int h = store(new Clause(lc.literals().clone(), true, lc.lbd()));
        learned.add(h);
        bumpActivity(h);
        return h;
    }

    private int store(Clause c) {
        final int h;
        if (free.size() > 0) {
            h = free.pop();
            arena.set(h, c);
        } else {
            h = arena.size();
            arena.add(c);
        }
        // A unit clause has nothing to watch: its literal is asserted at level 0.
        if (c.size() >= 2) watches.attach(h, c.literals);
        return h;
    }

    /** True if the clause is the reason for a literal currently on the trail. */
    boolean isLocked(int handle) {
        final int first = get(handle).literals[0];
        return trail.value(first) == Trail.TRUE && trail.reasonOf(thevar(first)) == handle;
    }

    void delete(int handle) {
        release(handle);
        learned.remove(handle);
    }

    // Frees the slot but leaves the handle in the learned list.
    private void release(int handle) {
        final Clause c = get(handle);
        if (!c.learned) throw new InvariantViolation("original clause " + handle + " cannot be deleted");
        if (isLocked(handle)) throw new InvariantViolation("clause " + handle + " is the reason for " + Literals.toString(c.literals[0]));
        if (c.size() >= 2) watches.detach(handle, c.literals);
        arena.set(handle, null);
        free.push(handle);
    }

    /**
     * Delete the given fraction of the learned clauses, worst first: highest LBD, and
     * among equal LBD the least active. Locked clauses and glue clauses (LBD at most
     * glueLbd) are never candidates, so fewer may go. Returns the number deleted.
     */
    int reduce(double fraction, int glueLbd) {
        final int target = (int) (fraction * learned.size());
        final TIntArrayList candidates = new TIntArrayList();
        learned.forEach(h -> {
            if (arena.get(h).lbd > glueLbd && !isLocked(h)) candidates.add(h);
            return true;
        });
        final int nCandidates = candidates.size();
        final IntBinaryOperator worse = (a, b) -> {
            final Clause x = arena.get(a), y = arena.get(b);
            if (x.lbd != y.lbd) return Integer.compare(x.lbd, y.lbd);
            if (x.activity != y.activity) return Double.compare(y.activity, x.activity);
            return Integer.compare(b, a);
        };
        heapify(candidates, worse);
        final int n = Math.min(target, nCandidates);
        for (int i = 0; i < n; ++i) release(pop(candidates, worse));
        // Survivors keep the order in which they were learned.
        final TIntArrayList survivors = new TIntArrayList(learned.size() - n);
        learned.forEach(h -> {
            if (arena.get(h) != null) survivors.add(h);
            return true;
        });
        learned.resetQuick();
        learned.addAll(survivors);
        log.trace("reduce: deleted %d of %d learned clauses (%d candidates)", n, learned.size() + n, nCandidates);
        return n;
    }

    // A max-heap over a, the worst clause on top.
    private static void heapify(TIntArrayList a, IntBinaryOperator compare) {
        for (int start = (a.size() - 2) / 2; start >= 0; --start) siftDown(a, start, a.size() - 1, compare);
    }

    private static void siftDown(TIntArrayList a, int root, int end, IntBinaryOperator compare) {
        int child;
        while ((child = 2*root+1) <= end) {
            int top = root;
            if (compare.applyAsInt(a.getQuick(top), a.getQuick(child)) < 0) top = child;
            if (child+1 <= end && compare.applyAsInt(a.getQuick(top), a.getQuick(child+1)) < 0) top = child+1;
            if (top == root) return;
            final int tmp = a.getQuick(root);
            a.setQuick(root, a.getQuick(top));
            a.setQuick(top, tmp);
            root = top;
        }
    }

    private static int pop(TIntArrayList a, IntBinaryOperator compare) {
        final int top = a.getQuick(0);
        final int last = a.removeAt(a.size() - 1);
        if (a.size() > 0) {
            a.setQuick(0, last);
            siftDown(a, 0, a.size() - 1, compare);
        }
        return top;
    }

    void bumpActivity(int handle) {
        final Clause c = get(handle);
        if ((c.activity += increment) > RESCALE_LIMIT) {
            learned.forEach(h -> {
                arena.get(h).activity /= RESCALE_LIMIT;
                return true;
            });
            increment /= RESCALE_LIMIT;
        }
    }

    void decayActivity() { increment /= decayFactor; }

    int learnedCount() { return learned.size(); }

    /** A copy of the handles of the live learned clauses, in the order they were learned. */
    TIntArrayList learnedHandles() { return new TIntArrayList(learned); }

    /** Handles of all live clauses. */
    IntStream handles() {
        return IntStream.range(0, arena.size()).filter(h -> arena.get(h) != null);
    }
}
