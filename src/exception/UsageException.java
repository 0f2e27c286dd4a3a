package exception;

public class UsageException extends RuntimeException {
    public UsageException(String message) {
        super(message);
    }

    public static UsageException noArgs() {
        return new UsageException("need an input .quil file to process");
    }

    public static UsageException wrongArgs(String msg) {
        return new UsageException("Unexpected args: " + msg);
    }
}
