package net.littleredcomputer.sat;

import gnu.trove.list.array.TIntArrayList;

import javax.annotation.CheckReturnValue;
import java.util.Optional;

import static net.littleredcomputer.sat.Literals.not;

/**
 * Unit propagation with two watched literals. Every literal on the trail past the
 * queue head is processed once: the clauses watching its complement either find a
 * new watch, become unit and force their other watch, or are falsified.
 */
final class Propagator {
    static final int NO_CONFLICT = -1;

    private final Trail trail;
    private final WatchIndex watches;
    private final ClauseDatabase clauses;
    private final Statistics statistics;

    Propagator(Trail trail, WatchIndex watches, ClauseDatabase clauses, Statistics statistics) {
        this.trail = trail;
        this.watches = watches;
        this.clauses = clauses;
        this.statistics = statistics;
    }

    /**
     * Propagate to fixpoint or to the first conflict.
     * @return the handle of a clause all of whose literals are false, or NO_CONFLICT
     */
    @CheckReturnValue
    int propagate() {
        while (trail.head < trail.size()) {
            final int p = trail.get(trail.head++);
            final int falseLit = not(p);
            final TIntArrayList ws = watches.of(falseLit);
            final int n = ws.size();
            int i = 0, j = 0;
            WATCHERS:
            while (i < n) {
                final int h = ws.getQuick(i++);
                final int[] c = clauses.get(h).literals;
                // Keep the false literal in position 1.
                if (c[0] == falseLit) {
                    c[0] = c[1];
                    c[1] = falseLit;
                }
                if (trail.value(c[0]) == Trail.TRUE) {
                    ws.setQuick(j++, h);
                    continue;
                }
                for (int k = 2; k < c.length; ++k) {
                    if (trail.value(c[k]) != Trail.FALSE) {
                        c[1] = c[k];
                        c[k] = falseLit;
                        watches.watch(c[1], h);
                        continue WATCHERS;
                    }
                }
                // No replacement: the clause is unit or falsified, and keeps watching falseLit.
                ws.setQuick(j++, h);
                if (trail.value(c[0]) == Trail.FALSE) {
                    while (i < n) ws.setQuick(j++, ws.getQuick(i++));
                    if (j < n) ws.remove(j, n - j);
                    trail.head = trail.size();
                    return h;
                }
                trail.assign(c[0], h);
                ++statistics.propagations;
            }
            if (j < n) ws.remove(j, n - j);
        }
        return NO_CONFLICT;
    }

    /**
     * Every clause of two or more literals must be watched by exactly its first two
     * literals, and, once propagation is complete, a clause with a false watch must
     * have its other watch true or be entirely false apart from it (no missed units).
     * Returns a description of the first violation found.
     */
    Optional<String> checkWatchInvariant() {
        return clauses.handles()
                .mapToObj(h -> checkClause(h, clauses.get(h)))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst();
    }

    private Optional<String> checkClause(int h, Clause c) {
        if (c.size() < 2) return Optional.empty();
        final int[] ls = c.literals;
        for (int w = 0; w < 2; ++w) {
            final int count = count(watches.of(ls[w]), h);
            if (count != 1) return Optional.of(String.format("clause %d %s is in the watch list of %s %d times",
                    h, c, Literals.toString(ls[w]), count));
        }
        for (int k = 2; k < ls.length; ++k) {
            if (count(watches.of(ls[k]), h) != 0) {
                return Optional.of(String.format("clause %d %s is watched by unwatched literal %s", h, c, Literals.toString(ls[k])));
            }
        }
        if (trail.head < trail.size()) return Optional.empty();
        for (int w = 0; w < 2; ++w) {
            if (trail.value(ls[w]) != Trail.FALSE) continue;
            final int other = ls[1 - w];
            if (trail.value(other) == Trail.TRUE) continue;
            for (int k = 2; k < ls.length; ++k) {
                if (trail.value(ls[k]) != Trail.FALSE) {
                    return Optional.of(String.format("clause %d %s watches false %s while %s is not false",
                            h, c, Literals.toString(ls[w]), Literals.toString(ls[k])));
                }
            }
        }
        return Optional.empty();
    }

    private static int count(TIntArrayList list, int h) {
        int n = 0;
        for (int i = 0; i < list.size(); ++i) if (list.getQuick(i) == h) ++n;
        return n;
    }
}
