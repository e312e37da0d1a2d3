package deskgate.core.port.out;

/**
 * Raised by counter store adapters when the store cannot serve a command.
 */
public class CounterStoreException extends RuntimeException {

    private final String operation;

    public CounterStoreException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public CounterStoreException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Returns the store operation that failed. */
    public String getOperation() {
        return operation;
    }
}
