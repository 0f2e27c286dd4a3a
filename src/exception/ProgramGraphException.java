package exception;

/**
 * Raised when a program graph cannot be built. The first failure aborts the whole
 * build, so a caller never sees a partially constructed graph.
 */
public class ProgramGraphException extends RuntimeException {

    public enum Kind {
        UNDEFINED_LABEL,
        DUPLICATE_LABEL,
        MALFORMED_FRAME_REFERENCE,
        UNSUPPORTED_TERMINATOR,
        /* internal invariant violation, never caused by well-formed input */
        CYCLIC_DEPENDENCY_DETECTED,
    }

    private final Kind kind;

    public ProgramGraphException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return true when the failure points at a defect in the builder rather than at its input
     */
    public boolean isInternal() {
        return kind == Kind.CYCLIC_DEPENDENCY_DETECTED;
    }

    public static ProgramGraphException undefinedLabel(String label) {
        return new ProgramGraphException(Kind.UNDEFINED_LABEL, "Undefined label: @" + label);
    }

    public static ProgramGraphException duplicateLabel(String label) {
        return new ProgramGraphException(Kind.DUPLICATE_LABEL, "Duplicate label: @" + label);
    }

    public static ProgramGraphException malformedFrame(String msg) {
        return new ProgramGraphException(Kind.MALFORMED_FRAME_REFERENCE, "Malformed frame reference: " + msg);
    }

    public static ProgramGraphException unsupportedTerminator(String msg) {
        return new ProgramGraphException(Kind.UNSUPPORTED_TERMINATOR, "Unsupported terminator: " + msg);
    }

    public static ProgramGraphException cyclicDependency(String block) {
        return new ProgramGraphException(Kind.CYCLIC_DEPENDENCY_DETECTED,
                "Cyclic dependency detected in block " + block + " (internal error)");
    }
}
