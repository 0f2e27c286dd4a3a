package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;

/**
 * Immutable instruction value. The set of subclasses is closed: consumers dispatch
 * through {@link InstructionVisitor}.
 */
public abstract class Instruction {

    public abstract Opcode opCode();

    /**
     * Render the instruction in Quil syntax.
     */
    public abstract String toQuil();

    public abstract <T> T accept(InstructionVisitor<T> visitor);

    public boolean isTerminator() {
        return opCode().isTerminator();
    }

    public boolean isClassical() {
        return opCode().isClassical();
    }

    // instructions are values: same kind and same rendered operands
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return toQuil().equals(((Instruction) obj).toQuil());
    }

    @Override
    public int hashCode() {
        return toQuil().hashCode();
    }

    @Override
    public String toString() {
        return toQuil();
    }

    static String blockingPrefix(boolean blocking) {
        return blocking ? "" : "NONBLOCKING ";
    }
}
