package ir.instructions;

import ir.InstructionVisitor;
import ir.Opcode;
import ir.operand.MemoryReference;
import ir.operand.Operand;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classical memory instruction (MOVE, EXCHANGE, arithmetic, logic, comparison).
 * The first operand is always the destination.
 */
public class ClassicalInst extends Instruction {
    private final Opcode opcode;
    private final List<Operand> operands;

    public ClassicalInst(Opcode opcode, List<Operand> operands) {
        if (!opcode.isClassical()) {
            throw new IllegalArgumentException(opcode + " is not a classical instruction");
        }
        int arity = opcode.isUnary() ? 1 : opcode.isComparison() ? 3 : 2;
        if (operands.size() != arity) {
            throw new IllegalArgumentException(opcode.getMnemonic() + " expects " + arity
                    + " operands but got " + operands.size());
        }
        if (!operands.get(0).isMemoryReference()) {
            throw new IllegalArgumentException(opcode.getMnemonic() + " destination must be a memory reference");
        }
        if (opcode == Opcode.EXCHANGE && !operands.get(1).isMemoryReference()) {
            throw new IllegalArgumentException("EXCHANGE operands must both be memory references");
        }
        this.opcode = opcode;
        this.operands = List.copyOf(operands);
    }

    public ClassicalInst(Opcode opcode, Operand... operands) {
        this(opcode, List.of(operands));
    }

    @Override
    public Opcode opCode() {
        return opcode;
    }

    public List<Operand> getOperands() {
        return operands;
    }

    public MemoryReference getDestination() {
        return (MemoryReference) operands.get(0);
    }

    /**
     * Memory cells whose value this instruction reads.
     */
    public Set<MemoryReference> reads() {
        Set<MemoryReference> reads = new LinkedHashSet<>();
        // MOVE 和比较指令不读目的操作数
        int from = (opcode == Opcode.MOVE || opcode.isComparison()) ? 1 : 0;
        for (Operand op : operands.subList(from, operands.size())) {
            if (op.isMemoryReference()) {
                reads.add((MemoryReference) op);
            }
        }
        return reads;
    }

    /**
     * Memory cells this instruction writes.
     */
    public Set<MemoryReference> writes() {
        Set<MemoryReference> writes = new LinkedHashSet<>();
        writes.add(getDestination());
        if (opcode == Opcode.EXCHANGE) {
            writes.add((MemoryReference) operands.get(1));
        }
        return writes;
    }

    @Override
    public String toQuil() {
        List<String> parts = new ArrayList<>();
        parts.add(opcode.getMnemonic());
        for (Operand op : operands) {
            parts.add(op.toString());
        }
        return parts.stream().collect(Collectors.joining(" "));
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
