package ir;

/**
 * Opcodes of every instruction kind the graph builder understands.
 */
public enum Opcode {
    // 帧操作
    PULSE("PULSE"),
    CAPTURE("CAPTURE"),
    RAW_CAPTURE("RAW-CAPTURE"),
    DELAY("DELAY"),
    FENCE("FENCE"),
    SET_FREQUENCY("SET-FREQUENCY"),
    SHIFT_FREQUENCY("SHIFT-FREQUENCY"),
    SET_PHASE("SET-PHASE"),
    SHIFT_PHASE("SHIFT-PHASE"),
    SET_SCALE("SET-SCALE"),
    SWAP_PHASES("SWAP-PHASES"),

    // 控制流
    LABEL("LABEL"),
    JUMP("JUMP"),
    JUMP_WHEN("JUMP-WHEN"),
    JUMP_UNLESS("JUMP-UNLESS"),
    HALT("HALT"),

    // 经典运算
    MOVE("MOVE"),
    EXCHANGE("EXCHANGE"),
    NEG("NEG"),
    NOT("NOT"),
    ADD("ADD"),
    SUB("SUB"),
    MUL("MUL"),
    DIV("DIV"),
    AND("AND"),
    IOR("IOR"),
    XOR("XOR"),
    EQ("EQ"),
    GT("GT"),
    GE("GE"),
    LT("LT"),
    LE("LE"),
    ;

    private final String mnemonic;

    Opcode(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    /**
     * 判断操作码是否为终结指令
     */
    public boolean isTerminator() {
        return this == JUMP || this == JUMP_WHEN || this == JUMP_UNLESS || this == HALT;
    }

    public boolean isFrameUpdate() {
        return this == SET_FREQUENCY || this == SHIFT_FREQUENCY || this == SET_PHASE
                || this == SHIFT_PHASE || this == SET_SCALE;
    }

    public boolean isClassical() {
        return ordinal() >= MOVE.ordinal();
    }

    public boolean isUnary() {
        return this == NEG || this == NOT;
    }

    public boolean isComparison() {
        return this == EQ || this == GT || this == GE || this == LT || this == LE;
    }

    public static Opcode fromMnemonic(String mnemonic) {
        for (Opcode op : values()) {
            if (op.mnemonic.equals(mnemonic)) {
                return op;
            }
        }
        throw new IllegalArgumentException("unknown opcode " + mnemonic);
    }
}
