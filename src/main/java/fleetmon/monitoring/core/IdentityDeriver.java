package fleetmon.monitoring.core;

import fleetmon.monitoring.model.HierarchyId;

/**
 * Derives the physical hierarchy of a node from its IPv4 address.
 *
 * Nodes sharing the first three octets are grouped by the last octet:
 * - SoC: bands of ten (200-209, 210-219, ...)
 * - Board: bands of one hundred (200-299, ...)
 *
 * A SoC id is itself a valid address, so {@code boardId(socId(ip)) == boardId(ip)}.
 */
public final class IdentityDeriver {

    private static final int SOC_BAND = 10;
    private static final int BOARD_BAND = 100;

    private IdentityDeriver() {
    }

    /**
     * Derive both identifiers in one parse.
     *
     * @param ip dotted-decimal IPv4 address
     * @return SoC and board identifiers
     * @throws InvalidAddressException if the address does not parse
     */
    public static HierarchyId derive(String ip) {
        int[] octets = parseOctets(ip);
        return new HierarchyId(group(octets, SOC_BAND), group(octets, BOARD_BAND));
    }

    public static String socId(String ip) {
        return group(parseOctets(ip), SOC_BAND);
    }

    public static String boardId(String ip) {
        return group(parseOctets(ip), BOARD_BAND);
    }

    private static String group(int[] octets, int band) {
        int bucket = (octets[3] / band) * band;
        return octets[0] + "." + octets[1] + "." + octets[2] + "." + bucket;
    }

    /**
     * Strict parser: four decimal octets 0-255, no leading zeros, no
     * whitespace. Host names are never resolved.
     */
    static int[] parseOctets(String ip) {
        if (ip == null || ip.isEmpty()) {
            throw new InvalidAddressException(ip);
        }
        String[] parts = ip.split("\\.", -1);
        if (parts.length != 4) {
            throw new InvalidAddressException(ip);
        }

        int[] octets = new int[4];
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3) {
                throw new InvalidAddressException(ip);
            }
            if (part.length() > 1 && part.charAt(0) == '0') {
                throw new InvalidAddressException(ip);
            }
            int value = 0;
            for (int j = 0; j < part.length(); j++) {
                char c = part.charAt(j);
                if (c < '0' || c > '9') {
                    throw new InvalidAddressException(ip);
                }
                value = value * 10 + (c - '0');
            }
            if (value > 255) {
                throw new InvalidAddressException(ip);
            }
            octets[i] = value;
        }
        return octets;
    }
}
