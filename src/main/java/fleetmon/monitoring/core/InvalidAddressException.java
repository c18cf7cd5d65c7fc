package fleetmon.monitoring.core;

/**
 * Thrown when a node address is not a dotted-decimal IPv4 address.
 * The store is left untouched when an upsert fails with this exception.
 */
public class InvalidAddressException extends IllegalArgumentException {

    private final String address;

    public InvalidAddressException(String address) {
        super("Invalid IP address format: " + address);
        this.address = address;
    }

    public String address() {
        return address;
    }
}
