package net.littleredcomputer.sat;

/**
 * Thrown when the engine finds its own bookkeeping inconsistent. This is a defect,
 * never a consequence of the input, and continuing could produce an unsound verdict.
 */
public class InvariantViolation extends IllegalStateException {
    public InvariantViolation(String message) {
        super(message);
    }
}
