package net.littleredcomputer.sat;

/**
 * Output of conflict analysis. literals[0] is the asserting literal (the complement of
 * the first UIP); when there is more than one literal, literals[1] belongs to the
 * backjump level, which is the highest level among literals[1..].
 */
final class LearnedClause {
    private final int[] literals;
    private final int backjumpLevel;
    private final int lbd;

    LearnedClause(int[] literals, int backjumpLevel, int lbd) {
        this.literals = literals;
        this.backjumpLevel = backjumpLevel;
        this.lbd = lbd;
    }

    int[] literals() { return literals; }
    int asserting() { return literals[0]; }
    int backjumpLevel() { return backjumpLevel; }
    int lbd() { return lbd; }
    int size() { return literals.length; }
}
