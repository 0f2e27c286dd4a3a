package ir.instructions;

import exception.ProgramGraphException;
import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.Qubit;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * {@code DELAY q.. ["name"..] duration}. Without frame names the delay covers every
 * frame defined on exactly the listed qubits.
 */
public class DelayInst extends Instruction {
    private final List<Qubit> qubits;
    private final List<String> frameNames;
    private final String duration;

    public DelayInst(List<Qubit> qubits, List<String> frameNames, String duration) {
        if (qubits == null || qubits.isEmpty()) {
            throw ProgramGraphException.malformedFrame("DELAY names no qubit");
        }
        if (new HashSet<>(qubits).size() != qubits.size()) {
            throw ProgramGraphException.malformedFrame("DELAY repeats a qubit");
        }
        this.qubits = List.copyOf(qubits);
        this.frameNames = List.copyOf(frameNames);
        this.duration = Objects.requireNonNull(duration, "duration");
    }

    @Override
    public Opcode opCode() {
        return Opcode.DELAY;
    }

    public List<Qubit> getQubits() {
        return qubits;
    }

    public List<String> getFrameNames() {
        return frameNames;
    }

    public String getDuration() {
        return duration;
    }

    @Override
    public String toQuil() {
        StringBuilder sb = new StringBuilder("DELAY");
        for (Qubit q : qubits) {
            sb.append(' ').append(q);
        }
        for (String name : frameNames) {
            sb.append(" \"").append(name).append('"');
        }
        return sb.append(' ').append(duration).toString();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
