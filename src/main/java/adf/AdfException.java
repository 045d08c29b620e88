package adf;

public class AdfException extends RuntimeException {

    public AdfException(String message) {
        super(message);
    }

    public AdfException(String message, Throwable cause) {
        super(message, cause);
    }
}
