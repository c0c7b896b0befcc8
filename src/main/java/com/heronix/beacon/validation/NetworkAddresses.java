package com.heronix.beacon.validation;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Syntax checks and canonical forms for MAC and IP addresses.
 */
public final class NetworkAddresses {

    private static final Pattern MAC_PATTERN =
            Pattern.compile("^([0-9A-Fa-f]{2}:){5}[0-9A-Fa-f]{2}$");

    private static final Pattern IPV4_PATTERN =
            Pattern.compile("^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");

    // hex groups, colons and an optional embedded IPv4 tail
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9A-Fa-f:][0-9A-Fa-f:.]*$");

    private NetworkAddresses() {
    }

    public static boolean isHardwareAddress(String value) {
        return value != null && MAC_PATTERN.matcher(value).matches();
    }

    /**
     * Check for an IPv4 or IPv6 literal without ever resolving a host name.
     */
    public static boolean isIpLiteral(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        if (IPV4_PATTERN.matcher(value).matches()) {
            return true;
        }
        if (value.indexOf(':') < 0 || !IPV6_CHARS.matcher(value).matches()) {
            return false;
        }
        try {
            // a string containing ':' is parsed as an IPv6 literal, no lookup happens
            InetAddress.getByName(value);
            return true;
        } catch (UnknownHostException e) {
            return false;
        }
    }

    /**
     * Canonical stored form of a MAC address (upper case), or null.
     */
    public static String canonicalHardwareAddress(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
