package com.pocketapps.common.net;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SsrfGuardTest {

    @Nested
    class PrivateIpDetection {

        @ParameterizedTest
        @ValueSource(strings = {
                "0.0.0.0", "0.1.2.3", "127.0.0.1", "127.255.0.1", "10.0.0.5", "172.16.0.1",
                "172.31.255.255", "192.168.1.1", "169.254.169.254", "100.64.0.1",
                "100.127.255.254", "224.0.0.1", "239.1.2.3", "255.255.255.255" })
        void reservedIpv4IsPrivate(String address) {
            assertTrue(SsrfGuard.isPrivateIpAddress(address), address);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "::", "::1", "fc00::1", "fd12:3456::1", "fe80::1", "febf::1", "ff02::1",
                "::ffff:127.0.0.1", "::ffff:10.0.0.5", "::ffff:a9fe:a9fe", "[::1]" })
        void reservedIpv6IsPrivate(String address) {
            assertTrue(SsrfGuard.isPrivateIpAddress(address), address);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "8.8.8.8", "1.1.1.1", "172.32.0.1", "100.128.0.1", "192.169.0.1",
                "2606:4700:4700::1111", "::ffff:8.8.8.8" })
        void publicIsNotPrivate(String address) {
            assertFalse(SsrfGuard.isPrivateIpAddress(address), address);
        }

        @Test
        void reservedTableInitializes() throws Exception {
            assertDoesNotThrow(() -> Class.forName(SsrfGuard.class.getName(), true,
                    SsrfGuard.class.getClassLoader()));
            assertEquals("carrier-grade NAT",
                    SsrfGuard.reservedBlockOf(InetAddress.getByName("100.64.0.1")).orElseThrow().label());
            assertEquals("site-local",
                    SsrfGuard.reservedBlockOf(InetAddress.getByName("fec0::1")).orElseThrow().label());
        }

        @Test
        void hostnamesAreNotLiterals() {
            assertTrue(SsrfGuard.parseIpLiteral("example.com").isEmpty());
            assertFalse(SsrfGuard.isPrivateIpAddress("example.com"));
        }

        @Test
        void mappedAddressIsDecoded() throws Exception {
            byte[] mapped = new byte[16];
            mapped[10] = (byte) 0xFF;
            mapped[11] = (byte) 0xFF;
            mapped[12] = 10;
            mapped[15] = 7;
            InetAddress decoded = SsrfGuard.unmapIpv4(InetAddress.getByAddress(mapped));
            assertEquals("10.0.0.7", decoded.getHostAddress());
        }
    }

    @Nested
    class HostnameBlocking {
        @Test
        void localhostIsBlocked() {
            assertTrue(SsrfGuard.isBlockedHostname("localhost"));
            assertTrue(SsrfGuard.isBlockedHostname("LOCALHOST"));
            assertTrue(SsrfGuard.isBlockedHostname("app.localhost"));
        }

        @Test
        void internalSuffixesAreBlocked() {
            assertTrue(SsrfGuard.isBlockedHostname("metadata.google.internal"));
            assertTrue(SsrfGuard.isBlockedHostname("printer.local"));
        }

        @Test
        void normalHostnameNotBlocked() {
            assertFalse(SsrfGuard.isBlockedHostname("example.com"));
        }
    }

    @Nested
    class HostnameNormalization {
        @Test
        void stripsTrailingDot() {
            assertEquals("example.com", SsrfGuard.normalizeHostname("example.com."));
        }

        @Test
        void stripsIpv6Brackets() {
            assertEquals("::1", SsrfGuard.normalizeHostname("[::1]"));
        }

        @Test
        void lowercases() {
            assertEquals("example.com", SsrfGuard.normalizeHostname("Example.COM"));
        }
    }

    @Nested
    class Resolution {

        @Test
        void privateLiteralRejectedWithoutLookup() {
            AtomicInteger lookups = new AtomicInteger();
            assertThrows(SsrfGuard.SsrfBlockedError.class, () -> SsrfGuard.resolvePinned("10.0.0.5",
                    SsrfGuard.Policy.DEFAULT, host -> {
                        lookups.incrementAndGet();
                        return List.of(InetAddress.getByName("10.0.0.5"));
                    }));
            assertEquals(0, lookups.get());
        }

        @Test
        void privateResolutionRejected() {
            assertThrows(SsrfGuard.SsrfBlockedError.class, () -> SsrfGuard.resolvePinned("rebind.example",
                    SsrfGuard.Policy.DEFAULT,
                    host -> List.of(InetAddress.getByName("93.184.216.34"), InetAddress.getByName("192.168.0.10"))));
        }

        @Test
        void mappedResolutionRejected() {
            assertThrows(SsrfGuard.SsrfBlockedError.class, () -> SsrfGuard.resolvePinned("mapped.example",
                    SsrfGuard.Policy.DEFAULT,
                    host -> List.of(InetAddress.getByName("::ffff:169.254.169.254"))));
        }

        @Test
        void publicResolutionReturnsFirstAddress() throws Exception {
            InetAddress pinned = SsrfGuard.resolvePinned("api.example", SsrfGuard.Policy.DEFAULT,
                    host -> List.of(InetAddress.getByName("93.184.216.34"), InetAddress.getByName("93.184.216.35")));
            assertEquals("93.184.216.34", pinned.getHostAddress());
        }

        @Test
        void emptyResolutionIsUnknownHost() {
            assertThrows(UnknownHostException.class, () -> SsrfGuard.resolvePinned("nothing.example",
                    SsrfGuard.Policy.DEFAULT, host -> List.of()));
        }

        @Test
        void allowedHostnamesBypassCheck() {
            var policy = new SsrfGuard.Policy(false, Set.of("Mirror.Example"));
            assertDoesNotThrow(() -> SsrfGuard.resolvePinned("mirror.example", policy,
                    host -> List.of(InetAddress.getByName("10.1.2.3"))));
        }

        @Test
        void localhostBlockedByDefault() {
            assertThrows(SsrfGuard.SsrfBlockedError.class,
                    () -> SsrfGuard.validateHostname("localhost", SsrfGuard.Policy.DEFAULT));
        }
    }
}
