package com.secops.riskengine.util;

import org.springframework.util.StringUtils;

import java.util.Locale;

public class IpAddresses {

    private IpAddresses() {
    }

    /**
     * True for loopback, private-range and link-local addresses, which have no public geolocation.
     * Works on the textual form only; never resolves host names.
     */
    public static boolean isNonRoutable(String ip) {
        if (!StringUtils.hasText(ip)) {
            return true;
        }
        String value = ip.trim().toLowerCase(Locale.ROOT);
        if (value.equals("localhost") || value.equals("::1") || value.equals("0:0:0:0:0:0:0:1")) {
            return true;
        }
        if (value.contains(":")) {
            return value.startsWith("fe80:") || value.startsWith("fc") || value.startsWith("fd");
        }
        if (value.startsWith("10.") || value.startsWith("127.")
                || value.startsWith("192.168.") || value.startsWith("169.254.")) {
            return true;
        }
        if (value.startsWith("172.")) {
            String[] octets = value.split("\\.");
            if (octets.length > 1) {
                try {
                    int second = Integer.parseInt(octets[1]);
                    return second >= 16 && second <= 31;
                } catch (NumberFormatException e) {
                    return false;
                }
            }
        }
        return false;
    }

    /**
     * Absent and placeholder addresses ("unknown") are treated as no address.
     */
    public static boolean isKnown(String ip) {
        return StringUtils.hasText(ip) && !"unknown".equalsIgnoreCase(ip.trim());
    }
}
