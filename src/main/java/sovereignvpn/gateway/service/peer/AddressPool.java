package sovereignvpn.gateway.service.peer;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import sovereignvpn.gateway.exception.AddressPoolExhaustedException;

/**
 * Host addresses of an IPv4 subnet handed out to tunnel peers.
 * The network address, the first host (the server) and the broadcast address are never
 * allocated, so a /24 yields 253 addresses. Allocation is first fit, starting after the
 * most recent hand-out and wrapping around.
 *
 * <p>Not thread-safe; {@link PeerManager} guards every call with its lock.
 */
public class AddressPool {

    private static final int MIN_PREFIX = 8;
    private static final int MAX_PREFIX = 30;

    private final int firstHost;
    private final int prefixLength;
    private final int capacity;
    private final BitSet allocated;
    private int cursor;

    public AddressPool(String cidr) {
        if (cidr == null || !cidr.contains("/")) {
            throw new IllegalArgumentException("Subnet must be in CIDR notation: " + cidr);
        }
        String[] parts = cidr.trim().split("/");
        int prefix;
        try {
            prefix = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid prefix length in " + cidr, e);
        }
        if (prefix < MIN_PREFIX || prefix > MAX_PREFIX) {
            throw new IllegalArgumentException("Prefix length must be between " + MIN_PREFIX + " and " + MAX_PREFIX
                + ": " + cidr);
        }
        int mask = (int) (0xFFFFFFFFL << (32 - prefix));
        int network = parseIpv4(parts[0]) & mask;
        this.prefixLength = prefix;
        this.firstHost = network + 2;
        this.capacity = (1 << (32 - prefix)) - 3;
        this.allocated = new BitSet(capacity);
        this.cursor = 0;
    }

    /**
     * @throws AddressPoolExhaustedException when every address is in use
     */
    public String allocate() {
        for (int i = 0; i < capacity; i++) {
            int offset = (cursor + i) % capacity;
            if (!allocated.get(offset)) {
                allocated.set(offset);
                cursor = (offset + 1) % capacity;
                return formatIpv4(firstHost + offset);
            }
        }
        throw new AddressPoolExhaustedException("IP pool exhausted");
    }

    /**
     * @return true if the address was allocated and is now free
     */
    public boolean release(String address) {
        int offset = offsetOf(address);
        if (offset < 0 || !allocated.get(offset)) {
            return false;
        }
        allocated.clear(offset);
        return true;
    }

    public boolean isAllocated(String address) {
        int offset = offsetOf(address);
        return offset >= 0 && allocated.get(offset);
    }

    public List<String> allocatedAddresses() {
        List<String> addresses = new ArrayList<>(allocated.cardinality());
        allocated.stream().forEach(offset -> addresses.add(formatIpv4(firstHost + offset)));
        return addresses;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getAllocatedCount() {
        return allocated.cardinality();
    }

    public int getAvailableCount() {
        return capacity - allocated.cardinality();
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    private int offsetOf(String address) {
        int value;
        try {
            value = parseIpv4(address);
        } catch (IllegalArgumentException e) {
            return -1;
        }
        long offset = Integer.toUnsignedLong(value) - Integer.toUnsignedLong(firstHost);
        return offset >= 0 && offset < capacity ? (int) offset : -1;
    }

    static int parseIpv4(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Missing IPv4 address");
        }
        String[] octets = address.trim().split("\\.");
        if (octets.length != 4) {
            throw new IllegalArgumentException("Invalid IPv4 address: " + address);
        }
        int value = 0;
        for (String octet : octets) {
            int part;
            try {
                part = Integer.parseInt(octet);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid IPv4 address: " + address, e);
            }
            if (part < 0 || part > 255) {
                throw new IllegalArgumentException("Invalid IPv4 address: " + address);
            }
            value = (value << 8) | part;
        }
        return value;
    }

    static String formatIpv4(int value) {
        return ((value >>> 24) & 0xFF) + "." + ((value >>> 16) & 0xFF) + "." + ((value >>> 8) & 0xFF) + "."
            + (value & 0xFF);
    }
}
