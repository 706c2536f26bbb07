package net.littleredcomputer.sat;

/**
 * The mutable state of one solve that outlives individual conflicts: counters,
 * variable activities, and the restart schedule. A fresh one is made for each
 * call to {@link CDCLSolver#solve()}.
 */
final class SearchContext {
    final SolverConfig config;
    final Statistics statistics = new Statistics();
    final VariableOrder order;
    final RestartPolicy restarts;
    long conflictsSinceRestart = 0;

    SearchContext(int nVariables, SolverConfig config) {
        this.config = config;
        this.order = new VariableOrder(nVariables, config);
        this.restarts = new RestartPolicy(config);
    }
}
