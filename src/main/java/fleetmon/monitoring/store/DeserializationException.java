package fleetmon.monitoring.store;

/**
 * A stored monitoring record could not be decoded.
 */
public class DeserializationException extends RuntimeException {

    private final String key;

    public DeserializationException(String key, Throwable cause) {
        super("Failed to decode record at " + key + ": " + cause.getMessage(), cause);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
