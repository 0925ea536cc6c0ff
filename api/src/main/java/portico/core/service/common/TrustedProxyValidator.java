package portico.core.service.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

/**
 * Decides whether a socket peer is a proxy whose forwarding headers may be believed.
 *
 * <p>Entries are IP literals or CIDR ranges such as {@code 10.0.0.0/8}. With no entries
 * nothing is trusted. Hostnames are never resolved.
 */
public final class TrustedProxyValidator {

    private static final Logger LOG = Logger.getLogger(TrustedProxyValidator.class);

    private final List<Network> networks;

    private record Network(byte[] address, int prefixLength) {

        boolean contains(byte[] candidate) {
            if (candidate.length != address.length) {
                return false;
            }
            var fullBytes = prefixLength / 8;
            for (var i = 0; i < fullBytes; i++) {
                if (candidate[i] != address[i]) {
                    return false;
                }
            }
            var remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            var mask = (byte) (0xFF << (8 - remainingBits));
            return (candidate[fullBytes] & mask) == (address[fullBytes] & mask);
        }
    }

    public TrustedProxyValidator(List<String> proxies) {
        var parsed = new ArrayList<Network>();
        for (var entry : proxies) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            var network = parseNetwork(entry.trim());
            if (network == null) {
                throw new IllegalArgumentException("Invalid trusted proxy entry: " + entry);
            }
            parsed.add(network);
        }
        this.networks = List.copyOf(parsed);
    }

    public static TrustedProxyValidator none() {
        return new TrustedProxyValidator(List.of());
    }

    /**
     * @param socketIp the remote address of the direct connection
     * @return true if forwarding headers from this peer should be used
     */
    public boolean isTrusted(String socketIp) {
        if (networks.isEmpty()) {
            return false;
        }
        var candidate = parseLiteral(socketIp);
        if (candidate == null) {
            return false;
        }
        for (var network : networks) {
            if (network.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return networks.isEmpty();
    }

    private static Network parseNetwork(String entry) {
        var slash = entry.indexOf('/');
        var address = parseLiteral(slash < 0 ? entry : entry.substring(0, slash));
        if (address == null) {
            return null;
        }
        if (slash < 0) {
            return new Network(address, address.length * 8);
        }
        try {
            var prefixLength = Integer.parseInt(entry.substring(slash + 1));
            if (prefixLength < 0 || prefixLength > address.length * 8) {
                LOG.warnf("Prefix length out of range in trusted proxy entry: %s", entry);
                return null;
            }
            return new Network(address, prefixLength);
        } catch (NumberFormatException e) {
            LOG.warnf("Invalid prefix length in trusted proxy entry: %s", entry);
            return null;
        }
    }

    private static byte[] parseLiteral(String ip) {
        if (ip == null || ip.isEmpty() || !isIpLiteral(ip)) {
            return null;
        }
        try {
            // Only literals get here, so this never performs a DNS lookup
            return InetAddress.getByName(ip).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static boolean isIpLiteral(String value) {
        if (value.contains(":")) {
            return true;
        }
        if (!Character.isDigit(value.charAt(0))) {
            return false;
        }
        for (var i = 0; i < value.length(); i++) {
            var c = value.charAt(i);
            if (c != '.' && !Character.isDigit(c)) {
                return false;
            }
        }
        return true;
    }
}
