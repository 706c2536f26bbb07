package net.littleredcomputer.sat;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;

/**
 * For each literal, the handles of the clauses that hold it in one of their two watched
 * positions (0 and 1). The lists refer to clauses; they never own them.
 */
final class WatchIndex {
    private final TIntArrayList[] watchers;

    WatchIndex(int nVariables) {
        watchers = new TIntArrayList[2 * nVariables + 2];
        Arrays.setAll(watchers, i -> new TIntArrayList());
    }

    TIntArrayList of(int literal) { return watchers[literal]; }

    void watch(int literal, int handle) { watchers[literal].add(handle); }

    void attach(int handle, int[] literals) {
        watch(literals[0], handle);
        watch(literals[1], handle);
    }

    void detach(int handle, int[] literals) {
        if (!watchers[literals[0]].remove(handle) || !watchers[literals[1]].remove(handle)) {
            throw new InvariantViolation("clause " + handle + " was not watched by its first two literals");
        }
    }
}
