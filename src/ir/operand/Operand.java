package ir.operand;

/**
 * 操作数基类
 * Operands of classical instructions: memory references or numeric literals.
 */
public abstract class Operand {

    /**
     * Quil text of the operand.
     */
    @Override
    public abstract String toString();

    public boolean isMemoryReference() {
        return false;
    }

    public boolean isImmediate() {
        return false;
    }
}
