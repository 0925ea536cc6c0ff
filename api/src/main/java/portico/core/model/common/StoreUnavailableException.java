package portico.core.model.common;

/**
 * The shared key-value store could not complete an operation.
 *
 * <p>Adapters wrap connection errors and timeouts in this exception so that core
 * services can apply their fail-open or fail-closed policy without knowing the store.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Store operation failed: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
