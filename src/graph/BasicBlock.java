package graph;

import ir.instructions.Instruction;
import ir.operand.Label;

import java.util.List;
import java.util.Objects;

/**
 * Maximal straight-line run of non-control instructions and the terminator that ends
 * it. Identified by its position in program order; may have an empty body.
 */
public final class BasicBlock {
    private final int index;
    private final Label label;
    private final List<Instruction> instructions;
    private final BlockTerminator terminator;

    public BasicBlock(int index, Label label, List<Instruction> instructions, BlockTerminator terminator) {
        this.index = index;
        this.label = label;
        this.instructions = List.copyOf(instructions);
        this.terminator = Objects.requireNonNull(terminator, "terminator");
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return the label opening the block, or null for an unlabelled block
     */
    public Label getLabel() {
        return label;
    }

    /**
     * Label name, or {@code block_<index>} when the block has no label.
     */
    public String getName() {
        return label != null ? label.getName() : "block_" + index;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public BlockTerminator getTerminator() {
        return terminator;
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BasicBlock)) return false;
        BasicBlock that = (BasicBlock) obj;
        return index == that.index && Objects.equals(label, that.label)
                && instructions.equals(that.instructions) && terminator.equals(that.terminator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, label, instructions, terminator);
    }

    @Override
    public String toString() {
        return getName() + " (" + instructions.size() + " instructions, " + terminator + ")";
    }
}
