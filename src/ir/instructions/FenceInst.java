package ir.instructions;

import exception.ProgramGraphException;
import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.Qubit;

import java.util.HashSet;
import java.util.List;

/**
 * {@code FENCE q..} orders everything on the frames of the listed qubits;
 * a bare {@code FENCE} covers every frame.
 */
public class FenceInst extends Instruction {
    private final List<Qubit> qubits;

    public FenceInst(List<Qubit> qubits) {
        if (new HashSet<>(qubits).size() != qubits.size()) {
            throw ProgramGraphException.malformedFrame("FENCE repeats a qubit");
        }
        this.qubits = List.copyOf(qubits);
    }

    public static FenceInst all() {
        return new FenceInst(List.of());
    }

    @Override
    public Opcode opCode() {
        return Opcode.FENCE;
    }

    public List<Qubit> getQubits() {
        return qubits;
    }

    public boolean isFenceAll() {
        return qubits.isEmpty();
    }

    @Override
    public String toQuil() {
        StringBuilder sb = new StringBuilder("FENCE");
        for (Qubit q : qubits) {
            sb.append(' ').append(q);
        }
        return sb.toString();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
