package net.littleredcomputer.sat;

import java.util.Arrays;
import java.util.stream.Collectors;

final class Clause {
    // Positions 0 and 1 are watched. While the clause is the reason for a literal,
    // that literal sits at position 0.
    final int[] literals;
    final boolean learned;
    final int lbd;  // literal block distance at the time of learning; 0 for original clauses
    double activity = 0;

    Clause(int[] literals, boolean learned, int lbd) {
        this.literals = literals;
        this.learned = learned;
        this.lbd = lbd;
    }

    int size() { return literals.length; }

    @Override
    public String toString() {
        return Arrays.stream(literals).mapToObj(Literals::toString).collect(Collectors.joining(" ", "(", ")"))
                + (learned ? "*" + lbd : "");
    }
}
