package net.littleredcomputer.sat;

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.StreamSupport;

/**
 * An immutable formula in conjunctive normal form. Clauses are kept exactly as they
 * were supplied, as signed (DIMACS) variable numbers; nothing is checked against the
 * declared variable count here. The solvers do that before they search, and report
 * a bad literal as {@link Result.Status#INVALID_INPUT}.
 */
public final class Formula {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.on(CharMatcher.whitespace()).trimResults().omitEmptyStrings();
    private final int nVariables;
    private final ImmutableList<int[]> clauses;
    private final int nLiterals;
    private final int width;

    private Formula(int nVariables, List<int[]> clauses) {
        this.nVariables = nVariables;
        this.clauses = ImmutableList.copyOf(clauses);
        int n = 0, w = 0;
        for (int[] c : clauses) {
            n += c.length;
            if (c.length > w) w = c.length;
        }
        this.nLiterals = n;
        this.width = w;
    }

    public static Builder builder(int nVariables) { return new Builder(nVariables); }

    /** Convenience for small formulas: each array is one clause of signed variable numbers. */
    public static Formula of(int nVariables, int[]... clauses) {
        Builder b = builder(nVariables);
        for (int[] c : clauses) b.addClause(c);
        return b.build();
    }

    public int nVariables() { return nVariables; }
    public int nClauses() { return clauses.size(); }
    public int nLiterals() { return nLiterals; }

    /** Length of the longest clause. */
    public int width() { return width; }

    public List<Integer> getClause(int i) {
        return Ints.asList(clauses.get(i).clone());
    }

    // Callers must not modify the returned array.
    int[] clause(int i) { return clauses.get(i); }

    public boolean hasEmptyClause() {
        return clauses.stream().anyMatch(c -> c.length == 0);
    }

    /**
     * Evaluate the boolean function represented by the formula's clauses at the specified point
     * @param p point (i.e., vector of booleans, p[v-1] giving the value of variable v) at which to evaluate
     * @return the truth value of this formula at p
     */
    public boolean evaluate(boolean[] p) {
        Preconditions.checkArgument(p.length >= nVariables, "need %s values, got %s", nVariables, p.length);
        CLAUSE:
        for (int[] clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (p[Math.abs(literal) - 1] == (literal > 0)) continue CLAUSE;
            }
            return false;  // Any false clause is enough to spoil satisfaction.
        }
        return true;
    }

    public static Formula parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Reads DIMACS cnf. Comment lines begin with "c". A 0 with no literals before it
     * denotes the empty clause, which is kept: the formula is then unsatisfiable.
     */
    public static Formula parseFrom(Reader r) {
        List<Integer> literals = new ArrayList<>();
        Iterator<String> ls = new BufferedReader(r).lines()
                .filter(s -> !s.startsWith("c") && !s.trim().isEmpty())
                .iterator();
        if (!ls.hasNext()) throw new IllegalArgumentException("Missing SAT instance data");
        Matcher m = pLineRe.matcher(ls.next().trim());
        if (!m.matches()) throw new IllegalArgumentException("invalid p line");
        int nVar = Integer.parseInt(m.group(1));
        int nClause = Integer.parseInt(m.group(2));
        Builder b = builder(nVar);
        ls.forEachRemaining(line -> StreamSupport.stream(splitter.split(line).spliterator(), false)
                .mapToInt(Integer::parseInt)
                .forEach(l -> {
                    if (l == 0) {
                        b.addClause(literals);
                        literals.clear();
                    } else {
                        if (l > nVar || l < -nVar) throw new IllegalArgumentException("literal out of declared bounds");
                        literals.add(l);
                    }
                }));
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (b.clauses.size() != nClause) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        return b.build();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("variables", nVariables)
                .add("clauses", clauses.size())
                .add("literals", nLiterals)
                .toString();
    }

    public static final class Builder {
        private final int nVariables;
        private final List<int[]> clauses = new ArrayList<>();

        private Builder(int nVariables) {
            if (nVariables < 0) throw new IllegalArgumentException("Variable count must not be negative");
            this.nVariables = nVariables;
        }

        public Builder addClause(int... literals) {
            clauses.add(literals.clone());
            return this;
        }

        public Builder addClause(Iterable<Integer> literals) {
            clauses.add(Ints.toArray(ImmutableList.copyOf(literals)));
            return this;
        }

        public Formula build() {
            return new Formula(nVariables, clauses);
        }
    }
}
