package com.pocketapps.common.net;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Dns;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Server-Side Request Forgery (SSRF) protection.
 * Validates hostnames and IP addresses to keep outbound fetches away from
 * private/internal networks.
 * <p>
 * Address checks work on parsed {@link InetAddress} values matched against a
 * table of reserved CIDR blocks. IPv4-mapped IPv6 addresses are decoded back to
 * IPv4 before matching.
 */
@Slf4j
public final class SsrfGuard {

    private SsrfGuard() {
    }

    // ── Exception ───────────────────────────────────────────────────────

    /**
     * Thrown when a request is blocked by SSRF policy.
     */
    public static class SsrfBlockedError extends RuntimeException {
        public SsrfBlockedError(String message) {
            super(message);
        }
    }

    // ── Policy ──────────────────────────────────────────────────────────

    /**
     * SSRF policy configuration.
     *
     * @param allowPrivateNetwork whether to allow access to private/internal IPs
     * @param allowedHostnames    hostnames exempt from the address checks
     *                            (normalized)
     */
    public record Policy(boolean allowPrivateNetwork, Set<String> allowedHostnames) {

        /** Default: block private networks, no custom allowlist. */
        public static final Policy DEFAULT = new Policy(false, Set.of());

        public Policy {
            allowedHostnames = allowedHostnames != null
                    ? Collections.unmodifiableSet(normalizeHostnameSet(allowedHostnames))
                    : Set.of();
        }

        boolean exempts(String normalizedHostname) {
            return allowPrivateNetwork || allowedHostnames.contains(normalizedHostname);
        }
    }

    // ── Reserved ranges ─────────────────────────────────────────────────

    /**
     * One reserved CIDR block.
     */
    record AddressBlock(String cidr, String label, byte[] network, int prefixLength) {

        static AddressBlock of(String cidr, String label) {
            int slash = cidr.indexOf('/');
            byte[] network = literalBytes(cidr.substring(0, slash));
            return new AddressBlock(cidr, label, network, Integer.parseInt(cidr.substring(slash + 1)));
        }

        boolean contains(byte[] address) {
            if (address.length != network.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (address[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (address[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }

    // must be initialized before RESERVED_BLOCKS, which parses through it
    private static final Pattern IPV4_LITERAL = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private static final List<AddressBlock> RESERVED_BLOCKS = List.of(
            AddressBlock.of("0.0.0.0/8", "this-network"),
            AddressBlock.of("10.0.0.0/8", "private"),
            AddressBlock.of("100.64.0.0/10", "carrier-grade NAT"),
            AddressBlock.of("127.0.0.0/8", "loopback"),
            AddressBlock.of("169.254.0.0/16", "link-local"),
            AddressBlock.of("172.16.0.0/12", "private"),
            AddressBlock.of("192.168.0.0/16", "private"),
            AddressBlock.of("224.0.0.0/4", "multicast"),
            AddressBlock.of("255.255.255.255/32", "broadcast"),
            AddressBlock.of("::/128", "unspecified"),
            AddressBlock.of("::1/128", "loopback"),
            AddressBlock.of("fc00::/7", "unique-local"),
            AddressBlock.of("fe80::/10", "link-local"),
            AddressBlock.of("fec0::/10", "site-local"),
            AddressBlock.of("ff00::/8", "multicast"));

    // ── Blocked hostnames ───────────────────────────────────────────────

    private static final Set<String> BLOCKED_HOSTNAMES = Set.of(
            "localhost",
            "metadata.google.internal");

    // ── Hostname normalization ──────────────────────────────────────────

    /**
     * Normalize a hostname (lowercase, strip trailing dot, unwrap brackets).
     */
    public static String normalizeHostname(String hostname) {
        if (hostname == null) {
            return "";
        }
        String normalized = hostname.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.startsWith("[") && normalized.endsWith("]")) {
            normalized = normalized.substring(1, normalized.length() - 1);
        }
        return normalized;
    }

    static Set<String> normalizeHostnameSet(Set<String> hostnames) {
        Set<String> result = new HashSet<>();
        for (String h : hostnames) {
            String n = normalizeHostname(h);
            if (!n.isEmpty()) {
                result.add(n);
            }
        }
        return result;
    }

    // ── Address parsing ─────────────────────────────────────────────────

    /**
     * Parse a hostname as an IP literal without touching DNS.
     *
     * @return the address, or empty if the hostname is not an IP literal
     */
    public static Optional<InetAddress> parseIpLiteral(String hostname) {
        String normalized = normalizeHostname(hostname);
        if (!IPV4_LITERAL.matcher(normalized).matches() && !normalized.contains(":")) {
            return Optional.empty();
        }
        try {
            return Optional.of(InetAddress.getByAddress(literalBytes(normalized)));
        } catch (IllegalArgumentException | UnknownHostException e) {
            return Optional.empty();
        }
    }

    /**
     * Decode an IPv4-mapped IPv6 address (::ffff:a.b.c.d) to its IPv4 form.
     * Any other address is returned unchanged.
     */
    public static InetAddress unmapIpv4(InetAddress address) {
        byte[] bytes = address.getAddress();
        if (bytes.length != 16) {
            return address;
        }
        for (int i = 0; i < 10; i++) {
            if (bytes[i] != 0) {
                return address;
            }
        }
        if ((bytes[10] & 0xFF) != 0xFF || (bytes[11] & 0xFF) != 0xFF) {
            return address;
        }
        try {
            return InetAddress.getByAddress(Arrays.copyOfRange(bytes, 12, 16));
        } catch (UnknownHostException e) {
            return address;
        }
    }

    private static byte[] literalBytes(String literal) {
        if (IPV4_LITERAL.matcher(literal).matches()) {
            String[] parts = literal.split("\\.");
            byte[] bytes = new byte[4];
            for (int i = 0; i < 4; i++) {
                int octet = Integer.parseInt(parts[i]);
                if (octet > 255) {
                    throw new IllegalArgumentException("Invalid IPv4 literal: " + literal);
                }
                bytes[i] = (byte) octet;
            }
            return bytes;
        }
        if (!literal.contains(":")) {
            throw new IllegalArgumentException("Not an IP literal: " + literal);
        }
        try {
            // Literal IPv6 strings are parsed locally, no lookup is made.
            InetAddress parsed = InetAddress.getByName(literal);
            byte[] bytes = parsed.getAddress();
            if (bytes.length == 4) {
                // The JDK already decoded an IPv4-mapped literal; keep the mapped form.
                byte[] mapped = new byte[16];
                mapped[10] = (byte) 0xFF;
                mapped[11] = (byte) 0xFF;
                System.arraycopy(bytes, 0, mapped, 12, 4);
                return mapped;
            }
            return bytes;
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid IPv6 literal: " + literal, e);
        }
    }

    // ── Private IP detection ────────────────────────────────────────────

    /**
     * Find the reserved block containing an address.
     */
    static Optional<AddressBlock> reservedBlockOf(InetAddress address) {
        byte[] bytes = unmapIpv4(address).getAddress();
        return RESERVED_BLOCKS.stream()
                .filter(block -> block.contains(bytes))
                .findFirst();
    }

    /**
     * Check if an IP address is private/internal.
     */
    public static boolean isPrivateIpAddress(InetAddress address) {
        return reservedBlockOf(address).isPresent();
    }

    /**
     * Check if an IP literal string represents a private address.
     * Strings that are not IP literals return {@code false}.
     */
    public static boolean isPrivateIpAddress(String address) {
        return parseIpLiteral(address).map(SsrfGuard::isPrivateIpAddress).orElse(false);
    }

    /**
     * Check if a hostname should be blocked (localhost, .local, .internal, etc.).
     */
    public static boolean isBlockedHostname(String hostname) {
        String normalized = normalizeHostname(hostname);
        if (normalized.isEmpty()) {
            return false;
        }
        if (BLOCKED_HOSTNAMES.contains(normalized)) {
            return true;
        }
        return normalized.endsWith(".localhost")
                || normalized.endsWith(".local")
                || normalized.endsWith(".internal");
    }

    // ── Validation ──────────────────────────────────────────────────────

    /**
     * Validate a hostname against SSRF policy without DNS resolution.
     *
     * @throws SsrfBlockedError if the hostname is blocked
     */
    public static void validateHostname(String hostname, Policy policy) {
        if (policy == null) {
            policy = Policy.DEFAULT;
        }
        String normalized = normalizeHostname(hostname);
        if (normalized.isEmpty()) {
            throw new SsrfBlockedError("Invalid hostname");
        }
        if (policy.exempts(normalized)) {
            return;
        }
        if (isBlockedHostname(normalized)) {
            throw new SsrfBlockedError("Blocked hostname: " + hostname);
        }
        Optional<AddressBlock> block = parseIpLiteral(normalized).flatMap(SsrfGuard::reservedBlockOf);
        if (block.isPresent()) {
            throw new SsrfBlockedError("Blocked " + block.get().label() + " address: " + normalized);
        }
    }

    /**
     * Resolve a hostname now and validate every returned address.
     * The first address is returned so the caller can connect to it directly
     * instead of resolving the name a second time.
     *
     * @throws SsrfBlockedError     if any resolved address is private/internal
     * @throws UnknownHostException if the hostname does not resolve
     */
    public static InetAddress resolvePinned(String hostname, Policy policy, Dns resolver)
            throws UnknownHostException {
        validateHostname(hostname, policy);
        if (policy == null) {
            policy = Policy.DEFAULT;
        }
        String normalized = normalizeHostname(hostname);

        List<InetAddress> addresses = resolver.lookup(normalized);
        if (addresses.isEmpty()) {
            throw new UnknownHostException("No addresses for hostname: " + hostname);
        }
        if (!policy.exempts(normalized)) {
            for (InetAddress addr : addresses) {
                Optional<AddressBlock> block = reservedBlockOf(addr);
                if (block.isPresent()) {
                    log.warn("Hostname {} resolved to {} address {}", hostname,
                            block.get().label(), addr.getHostAddress());
                    throw new SsrfBlockedError("Blocked: " + hostname + " resolves to "
                            + block.get().label() + " address");
                }
            }
        }
        return addresses.get(0);
    }
}
