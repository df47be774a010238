package com.streamity.telemetry.model;

import java.util.regex.Pattern;

/**
 * Caller identity used to key rate limiting, derived from the peer network address.
 */
public record ClientIdentity(String value) {

    public static final String UNKNOWN = "unknown";

    // IPv4, IPv6 (with optional zone id) and host-like tokens only
    private static final Pattern ADDRESS = Pattern.compile("[0-9A-Za-z.:%_\\-\\[\\]]{1,64}");

    public static ClientIdentity of(String address) {
        if (address == null) {
            return new ClientIdentity(UNKNOWN);
        }
        String trimmed = address.trim();
        if (!ADDRESS.matcher(trimmed).matches()) {
            return new ClientIdentity(UNKNOWN);
        }
        return new ClientIdentity(trimmed);
    }

    public boolean isUnknown() {
        return UNKNOWN.equals(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
