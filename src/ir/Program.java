package ir;

import ir.instructions.Instruction;
import ir.operand.FrameIdentifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A parsed Quil-T program: the flat instruction sequence plus the frames declared with
 * DEFFRAME. Immutable once built.
 */
public class Program {
    private final String name;
    private final List<Instruction> instructions;
    private final Set<FrameIdentifier> declaredFrames;

    private Program(String name, List<Instruction> instructions, Set<FrameIdentifier> declaredFrames) {
        this.name = name;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.declaredFrames = Collections.unmodifiableSet(new TreeSet<>(declaredFrames));
    }

    public static Program of(List<Instruction> instructions) {
        return new Program("program", instructions, Set.of());
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public Set<FrameIdentifier> getDeclaredFrames() {
        return declaredFrames;
    }

    public int size() {
        return instructions.size();
    }

    public String toQuil() {
        StringBuilder sb = new StringBuilder();
        for (FrameIdentifier frame : declaredFrames) {
            sb.append("DEFFRAME ").append(frame.toQuil()).append('\n');
        }
        for (Instruction inst : instructions) {
            sb.append(inst.toQuil()).append('\n');
        }
        return sb.toString();
    }

    public static class Builder {
        private final String name;
        private final List<Instruction> instructions = new ArrayList<>();
        private final Set<FrameIdentifier> declaredFrames = new TreeSet<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder add(Instruction inst) {
            instructions.add(inst);
            return this;
        }

        public Builder addAll(List<? extends Instruction> insts) {
            instructions.addAll(insts);
            return this;
        }

        public Builder declareFrame(FrameIdentifier frame) {
            declaredFrames.add(frame);
            return this;
        }

        public Program build() {
            return new Program(name, instructions, declaredFrames);
        }
    }
}
