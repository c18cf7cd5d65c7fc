package fleetmon.monitoring.store;

/**
 * A monitoring record could not be encoded to JSON.
 */
public class SerializationException extends RuntimeException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
