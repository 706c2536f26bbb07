package net.littleredcomputer.sat;

import java.util.function.BiFunction;

/** The solvers available behind the common {@link AbstractSATSolver} interface. */
public enum SolverKind {
    CDCL(CDCLSolver::new),
    BACKTRACKING(BacktrackingSolver::new);

    private final BiFunction<Formula, SolverConfig, AbstractSATSolver> factory;

    SolverKind(BiFunction<Formula, SolverConfig, AbstractSATSolver> factory) {
        this.factory = factory;
    }

    public AbstractSATSolver newSolver(Formula formula, SolverConfig config) {
        return factory.apply(formula, config);
    }

    public Result solve(Formula formula, SolverConfig config) {
        return newSolver(formula, config).solve();
    }

    public Result solve(Formula formula) {
        return solve(formula, SolverConfig.DEFAULT);
    }
}
