package com.coverwise.insurance.domain;

/**
 * Client details recorded with each claim history row.
 */
public record RequestMetadata(
    String ipAddress,
    String userAgent
) {
    /**
     * Width of the history ip_address column; an IPv6 address with zone fits.
     */
    public static final int MAX_IP_ADDRESS_LENGTH = 45;

    private static final RequestMetadata NONE = new RequestMetadata(null, null);

    public static RequestMetadata none() {
        return NONE;
    }

    /**
     * Resolves the client IP from the first X-Forwarded-For entry, falling back to the
     * socket address. The address is cut to {@link #MAX_IP_ADDRESS_LENGTH} and the user agent
     * to {@code maxUserAgentLength}.
     */
    public static RequestMetadata from(String forwardedFor, String remoteAddress, String userAgent,
                                       int maxUserAgentLength) {
        String ip = remoteAddress;
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                ip = first;
            }
        }
        return new RequestMetadata(truncate(ip, MAX_IP_ADDRESS_LENGTH), truncate(userAgent, maxUserAgentLength));
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
