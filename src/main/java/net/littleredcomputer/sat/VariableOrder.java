package net.littleredcomputer.sat;

import java.util.Arrays;

import static net.littleredcomputer.sat.Literals.neglit;
import static net.littleredcomputer.sat.Literals.negated;
import static net.littleredcomputer.sat.Literals.poslit;
import static net.littleredcomputer.sat.Literals.thevar;

/**
 * VSIDS branching. The variables live in a binary max-heap keyed on activity, with
 * ties going to the smaller variable, and an index from variable to heap slot so that
 * a bumped variable can be sifted up in place. Assigned variables are removed lazily
 * when they reach the top; unassignment puts them back.
 */
final class VariableOrder {
    private static final double RESCALE_LIMIT = 1e100;

    private final int nVariables;
    private final double[] activity;
    private final boolean[] savedPhase;  // true: last held value was true
    private final int[] heap;
    private final int[] position;        // slot of each variable in heap, or -1
    private int heapSize;
    private final SolverConfig.Polarity polarity;
    private final double decayFactor;
    private double increment;

    VariableOrder(int nVariables, SolverConfig config) {
        this.nVariables = nVariables;
        this.polarity = config.decisionPolarityDefault();
        this.decayFactor = config.activityDecayFactor();
        this.increment = config.activityBumpIncrement();
        activity = new double[nVariables + 1];
        savedPhase = new boolean[nVariables + 1];
        heap = new int[nVariables];
        position = new int[nVariables + 1];
        Arrays.fill(position, -1);
        // With all activities zero, ascending variable order is already a heap.
        for (int v = 1; v <= nVariables; ++v) {
            heap[heapSize] = v;
            position[v] = heapSize++;
        }
    }

    /**
     * The literal to decide on next, or NO_LITERAL if every variable is assigned.
     */
    int pickBranchingLiteral(Trail trail) {
        while (heapSize > 0) {
            final int v = pop();
            if (trail.isAssigned(v)) continue;
            switch (polarity) {
                case TRUE: return poslit(v);
                case FALSE: return neglit(v);
                default: return savedPhase[v] ? poslit(v) : neglit(v);
            }
        }
        return Literals.NO_LITERAL;
    }

    /** Called by the trail for each literal it unassigns. */
    void onUnassign(int literal) {
        final int v = thevar(literal);
        savedPhase[v] = !negated(literal);
        if (position[v] < 0) insert(v);
    }

    void bump(int v) {
        if ((activity[v] += increment) > RESCALE_LIMIT) {
            for (int u = 1; u <= nVariables; ++u) activity[u] *= 1 / RESCALE_LIMIT;
            increment *= 1 / RESCALE_LIMIT;
        }
        if (position[v] >= 0) siftUp(position[v]);
    }

    /** Decays every activity at once by growing the amount of future bumps. */
    void decay() { increment /= decayFactor; }

    double activity(int v) { return activity[v]; }

    double[] activitySnapshot() { return activity.clone(); }

    boolean inHeap(int v) { return position[v] >= 0; }

    // a ranks above b
    private boolean before(int a, int b) {
        return activity[a] > activity[b] || (activity[a] == activity[b] && a < b);
    }

    private void insert(int v) {
        heap[heapSize] = v;
        position[v] = heapSize;
        siftUp(heapSize++);
    }

    private int pop() {
        final int top = heap[0];
        position[top] = -1;
        if (--heapSize > 0) {
            heap[0] = heap[heapSize];
            position[heap[0]] = 0;
            siftDown(0);
        }
        return top;
    }

    private void siftUp(int i) {
        final int v = heap[i];
        while (i > 0) {
            final int parent = (i - 1) / 2;
            if (!before(v, heap[parent])) break;
            heap[i] = heap[parent];
            position[heap[i]] = i;
            i = parent;
        }
        heap[i] = v;
        position[v] = i;
    }

    private void siftDown(int root) {
        int child;
        while ((child = 2*root+1) < heapSize) {
            int swap = root;
            if (before(heap[child], heap[swap])) swap = child;
            if (child+1 < heapSize && before(heap[child+1], heap[swap])) swap = child+1;
            if (swap == root) return;
            final int tmp = heap[root];
            heap[root] = heap[swap];
            heap[swap] = tmp;
            position[heap[root]] = root;
            position[heap[swap]] = swap;
            root = swap;
        }
    }
}
