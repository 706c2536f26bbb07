package net.littleredcomputer.sat;

/**
 * Decides when the search should abandon its current decisions. Restarts keep
 * everything learned; they only undo the trail to level 0.
 */
final class RestartPolicy {
    private final RestartStrategy strategy;
    private final int initialThreshold;
    private final double growthFactor;
    private double threshold;
    private int restarts = 0;

    RestartPolicy(SolverConfig config) {
        this.strategy = config.restartStrategy();
        this.initialThreshold = config.restartInitialThreshold();
        this.growthFactor = config.restartGrowthFactor();
        this.threshold = initialThreshold;
    }

    boolean shouldRestart(long conflictsSinceRestart) {
        return strategy != RestartStrategy.NEVER && conflictsSinceRestart >= threshold;
    }

    void onRestart() {
        ++restarts;
        switch (strategy) {
            case GEOMETRIC:
                threshold *= growthFactor;
                break;
            case LUBY:
                threshold = (double) initialThreshold * luby(restarts + 1);
                break;
            default:
                break;
        }
    }

    /** Conflicts allowed before the next restart. */
    double threshold() { return threshold; }

    /**
     * The i-th (one-based) term of the Luby sequence 1, 1, 2, 1, 1, 2, 4, 1, 1, 2, ...
     */
    static long luby(int i) {
        if (i < 1) throw new IllegalArgumentException("Luby sequence is one-based: " + i);
        // Find the complete subsequence of length 2^k - 1 containing i.
        int k = 1;
        while ((1L << k) - 1 < i) ++k;
        long index = i;
        while (true) {
            if (index == (1L << k) - 1) return 1L << (k - 1);
            if (index >= 1L << (k - 1)) {
                index -= (1L << (k - 1)) - 1;
            }
            --k;
        }
    }
}
