package net.littleredcomputer.sat;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Chronological backtracking with one watched literal per clause and no learning
 * (Knuth's Algorithm 7.2.2.2B). Variables are set in order 1..n; a clause only has to
 * move its watch when the watched literal becomes false. It is exponentially slower
 * than {@link CDCLSolver} on hard formulas, and so simple that it serves as an
 * independent check on it.
 */
public class BacktrackingSolver extends AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger();

    public BacktrackingSolver(Formula formula) {
        this(formula, SolverConfig.DEFAULT);
    }

    public BacktrackingSolver(Formula formula, SolverConfig config) {
        super("Backtracking", formula, config);
    }

    @Override
    public Result solve() {
        final Statistics statistics = new Statistics();
        Optional<String> error = inputError();
        if (error.isPresent()) {
            log.warn("%s: invalid input: %s", name(), error.get());
            return Result.invalidInput(error.get(), statistics);
        }
        if (formula.hasEmptyClause()) return Result.unsatisfiable(statistics);
        start();
        final Result result = search(statistics);
        stopwatch.stop();
        log.debug("%s: %s after %s: %s", name(), result.status(), stopwatch, result.statistics());
        return result;
    }

    private Result search(Statistics statistics) {
        final int nVariables = formula.nVariables();
        final List<int[]> clauses = new ArrayList<>();
        int nLiterals = 0;
        for (int i = 0; i < formula.nClauses(); ++i) {
            int[] c = CDCLSolver.normalize(formula.clause(i));
            if (c == null) continue;
            clauses.add(c);
            nLiterals += c.length;
        }
        final int nClauses = clauses.size();

        // m[d] is the move at depth d: 0 or 1 sets variable d true or false on the
        // first try, 2 or 3 on the second try after the other value failed.
        int[] m = new int[nVariables + 1];
        int[] START = new int[nClauses + 1];
        int[] L = new int[nLiterals];
        int[] W = new int[2 * nVariables + 2];  // head of the list of clauses watching each literal
        int[] LINK = new int[nClauses + 1];

        int c = 0;
        for (int j = nClauses; j >= 1; --j) {
            int[] clause = clauses.get(j - 1);
            START[j] = c;
            LINK[j] = W[clause[0]];
            W[clause[0]] = j;
            for (int l : clause) L[c++] = l;
        }
        START[0] = L.length;

        int d = 1;
        int l = 0;
        int state = 2;

        // The states are the step numbers of Knuth's Algorithm B (TAOCP 7.2.2.2), kept
        // in his order and with his array names so the two can be read side by side.

        STEP: while (true) {
            switch (state) {
                case 2:  // Rejoice or choose.
                    if (d > nVariables) {
                        boolean[] model = new boolean[nVariables];
                        for (int v = 1; v <= nVariables; ++v) model[v-1] = (m[v] & 1) == 0;
                        if (!formula.evaluate(model)) throw new InvariantViolation("backtracking produced a non-model");
                        return Result.satisfiable(model, statistics);
                    }
                    if (deadlineExceeded(statistics.decisions)) return Result.unknown(Result.DEADLINE_EXCEEDED, statistics);
                    // Prefer the value whose complement no clause is watching.
                    m[d] = (W[2*d] == 0 || W[2*d+1] != 0) ? 1 : 0;
                    l = 2*d + m[d];
                    ++statistics.decisions;
                    if (d > statistics.maxDecisionLevel) statistics.maxDecisionLevel = d;
                    if (++stepCount % logCheckSteps == 0) maybeReportProgress(m);
                case 3: {  // Move the watches off the newly false literal, if possible.
                    for (int j = W[l^1]; j != 0; ) {
                        int i = START[j];
                        int ii = START[j-1];
                        int jj = LINK[j];
                        int k;
                        for (k = i+1; k < ii; ++k) {
                            int ll = L[k];
                            // ll is unset, or set true
                            if ((ll >> 1) > d || (ll + m[ll >> 1]) % 2 == 0) {
                                L[i] = ll;
                                L[k] = l^1;
                                LINK[j] = W[ll];
                                W[ll] = j;
                                j = jj;
                                break;
                            }
                        }
                        if (k == ii) {
                            // Every other literal of clause j is false.
                            ++statistics.conflicts;
                            W[l^1] = j;
                            state = 5;
                            continue STEP;
                        }
                    }
                }
                /* case 4: */  // Advance.
                W[l^1] = 0;
                ++d;
                state = 2;
                continue;
                case 5:  // Try again.
                    if (m[d] < 2) {
                        m[d] = 3 - m[d];
                        l = 2*d + (m[d] & 1);
                        state = 3;
                        continue;
                    }
                case 6:  // Backtrack.
                    if (d == 1) return Result.unsatisfiable(statistics);
                    --d;
                    state = 5;
            }
        }
    }
}
