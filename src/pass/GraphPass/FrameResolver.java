package pass.GraphPass;

import ir.InstructionVisitor;
import ir.Program;
import ir.instructions.*;
import ir.operand.FrameIdentifier;
import ir.operand.Qubit;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Frames an instruction touches. DELAY without frame names and FENCE are resolved
 * against the frames known to the program; everything else names its frames.
 * Results are sorted so that edges are always added in the same order.
 */
public class FrameResolver implements InstructionVisitor<SortedSet<FrameIdentifier>> {
    private static final SortedSet<FrameIdentifier> NONE = Collections.unmodifiableSortedSet(new TreeSet<>());

    private final SortedSet<FrameIdentifier> knownFrames;

    public FrameResolver(Set<FrameIdentifier> knownFrames) {
        this.knownFrames = Collections.unmodifiableSortedSet(new TreeSet<>(knownFrames));
    }

    /**
     * Frames declared with DEFFRAME plus every frame an instruction names explicitly.
     */
    public static SortedSet<FrameIdentifier> knownFrames(Program program) {
        SortedSet<FrameIdentifier> frames = new TreeSet<>(program.getDeclaredFrames());
        // 空的已知集合下只剩显式引用的帧
        FrameResolver explicit = new FrameResolver(Set.of());
        for (Instruction inst : program.getInstructions()) {
            frames.addAll(explicit.framesOf(inst));
        }
        return Collections.unmodifiableSortedSet(frames);
    }

    public SortedSet<FrameIdentifier> getKnownFrames() {
        return knownFrames;
    }

    public SortedSet<FrameIdentifier> framesOf(Instruction inst) {
        return inst.accept(this);
    }

    @Override
    public SortedSet<FrameIdentifier> visit(PulseInst inst) {
        return single(inst.getFrame());
    }

    @Override
    public SortedSet<FrameIdentifier> visit(CaptureInst inst) {
        return single(inst.getFrame());
    }

    @Override
    public SortedSet<FrameIdentifier> visit(RawCaptureInst inst) {
        return single(inst.getFrame());
    }

    @Override
    public SortedSet<FrameIdentifier> visit(DelayInst inst) {
        SortedSet<FrameIdentifier> frames = new TreeSet<>();
        if (inst.getFrameNames().isEmpty()) {
            Set<Qubit> qubits = new HashSet<>(inst.getQubits());
            for (FrameIdentifier frame : knownFrames) {
                if (frame.hasQubitSet(qubits)) {
                    frames.add(frame);
                }
            }
        } else {
            for (String name : inst.getFrameNames()) {
                frames.add(FrameIdentifier.of(inst.getQubits(), name));
            }
        }
        return frames;
    }

    @Override
    public SortedSet<FrameIdentifier> visit(FenceInst inst) {
        if (inst.isFenceAll()) {
            return knownFrames;
        }
        List<Qubit> qubits = inst.getQubits();
        SortedSet<FrameIdentifier> frames = new TreeSet<>();
        for (FrameIdentifier frame : knownFrames) {
            if (frame.usesAnyOf(qubits)) {
                frames.add(frame);
            }
        }
        return frames;
    }

    @Override
    public SortedSet<FrameIdentifier> visit(FrameUpdateInst inst) {
        return single(inst.getFrame());
    }

    @Override
    public SortedSet<FrameIdentifier> visit(SwapPhasesInst inst) {
        SortedSet<FrameIdentifier> frames = new TreeSet<>();
        frames.add(inst.getFirst());
        frames.add(inst.getSecond());
        return frames;
    }

    @Override
    public SortedSet<FrameIdentifier> visit(LabelInst inst) {
        return NONE;
    }

    @Override
    public SortedSet<FrameIdentifier> visit(JumpInst inst) {
        return NONE;
    }

    @Override
    public SortedSet<FrameIdentifier> visit(JumpWhenInst inst) {
        return NONE;
    }

    @Override
    public SortedSet<FrameIdentifier> visit(JumpUnlessInst inst) {
        return NONE;
    }

    @Override
    public SortedSet<FrameIdentifier> visit(HaltInst inst) {
        return NONE;
    }

    @Override
    public SortedSet<FrameIdentifier> visit(ClassicalInst inst) {
        return NONE;
    }

    private static SortedSet<FrameIdentifier> single(FrameIdentifier frame) {
        SortedSet<FrameIdentifier> frames = new TreeSet<>();
        frames.add(frame);
        return frames;
    }
}
