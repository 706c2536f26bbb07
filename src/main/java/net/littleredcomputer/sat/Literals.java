package net.littleredcomputer.sat;

/**
 * Literal arithmetic shared by the solvers. Variables are one-based; the literal
 * for variable v is 2v and its complement is 2v+1, so that literals index arrays
 * of size 2n+2 directly (see the encoding of 7.2.2.2 (57)).
 */
final class Literals {
    static final int NO_LITERAL = 0;

    private Literals() {}

    static int thevar(int literal) { return literal >> 1; }
    static int poslit(int variable) { return 2*variable; }
    static int neglit(int variable) { return 2*variable+1; }
    static int not(int l) { return l^1; }
    static boolean negated(int l) { return (l & 1) != 0; }

    /**
     * @param literal A positive or negative (DIMACS) variable number
     * @return The [2n|2n+1]-encoded value
     */
    static int encode(int literal) {
        return literal > 0 ? 2 * literal : -2 * literal + 1;
    }

    static int decode(int literal) {
        int sign = ((literal & 1) == 0) ? 1 : -1;
        return sign * (literal >> 1);
    }

    static int[] decode(int[] literals) {
        int[] d = new int[literals.length];
        for (int i = 0; i < literals.length; ++i) d[i] = decode(literals[i]);
        return d;
    }

    static String toString(int l) {
        return (negated(l) ? "~" : "") + thevar(l);
    }
}
