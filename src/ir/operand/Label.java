package ir.operand;

import java.util.Objects;

/**
 * 标签操作数
 * Jump target or block label, written {@code @name} in Quil.
 */
public class Label {
    private final String name;

    public Label(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("label name must not be blank");
        }
        this.name = name.startsWith("@") ? name.substring(1) : name;
    }

    public static Label named(String name) {
        return new Label(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return name.equals(((Label) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "@" + name;
    }
}
