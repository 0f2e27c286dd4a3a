package ir.operand;

import java.util.Objects;

/**
 * 立即数操作数, kept as the literal text it was written with.
 */
public class Imm extends Operand {
    private final String literal;

    public Imm(String literal) {
        if (literal == null || literal.isBlank()) {
            throw new IllegalArgumentException("empty literal");
        }
        this.literal = literal.trim();
    }

    public static Imm of(long value) {
        return new Imm(Long.toString(value));
    }

    public static Imm of(double value) {
        return new Imm(Double.toString(value));
    }

    public String getLiteral() {
        return literal;
    }

    @Override
    public boolean isImmediate() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return literal.equals(((Imm) obj).literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(literal);
    }

    @Override
    public String toString() {
        return literal;
    }
}
