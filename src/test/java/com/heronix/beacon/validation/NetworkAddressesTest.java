package com.heronix.beacon.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NetworkAddresses
 */
class NetworkAddressesTest {

    @ParameterizedTest
    @ValueSource(strings = {"00:1A:2B:3C:4D:5E", "aa:bb:cc:dd:ee:ff", "Aa:0b:C1:d2:E3:f4"})
    @DisplayName("Six colon-separated hex octets are hardware addresses")
    void testValidHardwareAddresses(String value) {
        assertTrue(NetworkAddresses.isHardwareAddress(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "00:1A:2B:3C:4D", "00-1A-2B-3C-4D-5E", "001A.2B3C.4D5E",
            "00:1A:2B:3C:4D:5G", "00:1A:2B:3C:4D:5E:6F", "0:1A:2B:3C:4D:5E", "not-a-mac"})
    @DisplayName("Anything else is not a hardware address")
    void testInvalidHardwareAddresses(String value) {
        assertFalse(NetworkAddresses.isHardwareAddress(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"192.168.1.10", "0.0.0.0", "255.255.255.255", "10.0.0.1",
            "::1", "::", "fe80::1", "2001:db8::8a2e:370:7334", "::ffff:192.168.1.1",
            "2001:0db8:0000:0000:0000:ff00:0042:8329"})
    @DisplayName("IPv4 and IPv6 literals are accepted")
    void testValidIpLiterals(String value) {
        assertTrue(NetworkAddresses.isIpLiteral(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "256.1.1.1", "192.168.1", "192.168.01.1", "1.2.3.4.5",
            "localhost", "router.lan", "example.com", "2001:db8:::1", "1.2.3.4:", ".:", "fe80::g"})
    @DisplayName("Host names and malformed literals are rejected")
    void testInvalidIpLiterals(String value) {
        assertFalse(NetworkAddresses.isIpLiteral(value));
    }

    @Test
    @DisplayName("Hardware addresses are stored upper-case")
    void testCanonicalHardwareAddress() {
        assertEquals("AA:BB:CC:00:11:22", NetworkAddresses.canonicalHardwareAddress("aa:bb:cc:00:11:22"));
        assertNull(NetworkAddresses.canonicalHardwareAddress(null));
    }
}
