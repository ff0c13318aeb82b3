package com.callplatform.guardsvc.shared.http;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Literal IP address validation and private-range classification. Never performs DNS lookups.
 */
public final class IpAddresses {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:]{2,39}$");

    private IpAddresses() {
    }

    public static boolean isValid(String ip) {
        return parseIpv4(ip) != null || isIpv6(ip);
    }

    /**
     * True for loopback, RFC 1918, link-local, CGNAT and IPv6 unique-local/link-local ranges.
     */
    public static boolean isPrivateOrLoopback(String ip) {
        int[] octets = parseIpv4(ip);
        if (octets != null) {
            int a = octets[0];
            int b = octets[1];
            return a == 10
                    || a == 127
                    || a == 0
                    || (a == 172 && b >= 16 && b <= 31)
                    || (a == 192 && b == 168)
                    || (a == 169 && b == 254)
                    || (a == 100 && b >= 64 && b <= 127);
        }
        if (isIpv6(ip)) {
            String lower = ip.toLowerCase(Locale.ROOT);
            return lower.equals("::1")
                    || lower.startsWith("fc")
                    || lower.startsWith("fd")
                    || lower.startsWith("fe80");
        }
        return false;
    }

    /**
     * True when {@code ip} equals {@code rangeOrAddress}, or falls inside it when it is an IPv4 CIDR block
     * such as {@code 10.0.0.0/8}.
     */
    public static boolean matches(String ip, String rangeOrAddress) {
        if (ip == null || rangeOrAddress == null || rangeOrAddress.isBlank()) {
            return false;
        }
        String range = rangeOrAddress.trim();
        int slash = range.indexOf('/');
        if (slash < 0) {
            return range.equalsIgnoreCase(ip.trim());
        }
        int[] address = parseIpv4(ip);
        int[] network = parseIpv4(range.substring(0, slash));
        if (address == null || network == null) {
            return false;
        }
        int prefix;
        try {
            prefix = Integer.parseInt(range.substring(slash + 1));
        } catch (NumberFormatException e) {
            return false;
        }
        if (prefix < 0 || prefix > 32) {
            return false;
        }
        long mask = prefix == 0 ? 0L : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
        return (toLong(address) & mask) == (toLong(network) & mask);
    }

    private static long toLong(int[] octets) {
        return ((long) octets[0] << 24) | ((long) octets[1] << 16) | ((long) octets[2] << 8) | octets[3];
    }

    private static boolean isIpv6(String ip) {
        return ip != null && ip.indexOf(':') >= 0 && IPV6.matcher(ip).matches();
    }

    private static int[] parseIpv4(String ip) {
        if (ip == null) {
            return null;
        }
        var matcher = IPV4.matcher(ip.trim());
        if (!matcher.matches()) {
            return null;
        }
        int[] octets = new int[4];
        for (int i = 0; i < 4; i++) {
            int value = Integer.parseInt(matcher.group(i + 1));
            if (value > 255) {
                return null;
            }
            octets[i] = value;
        }
        return octets;
    }
}
