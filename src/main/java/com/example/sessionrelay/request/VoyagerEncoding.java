package com.example.sessionrelay.request;

import java.nio.charset.StandardCharsets;

/**
 * The one percent-encoding table used for every value embedded in an upstream query.
 * RFC 3986 unreserved characters pass through; every other byte becomes {@code %XX} with upper-case hex.
 */
public final class VoyagerEncoding {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    private static final boolean[] UNRESERVED = new boolean[128];

    static {
        for (char c = 'A'; c <= 'Z'; c++) UNRESERVED[c] = true;
        for (char c = 'a'; c <= 'z'; c++) UNRESERVED[c] = true;
        for (char c = '0'; c <= '9'; c++) UNRESERVED[c] = true;
        UNRESERVED['-'] = true;
        UNRESERVED['.'] = true;
        UNRESERVED['_'] = true;
        UNRESERVED['~'] = true;
    }

    private VoyagerEncoding() {}

    public static String encodeComponent(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length + 16);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (c < 128 && UNRESERVED[c]) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    /** {@code urn:li:fsd_profile:<id>}, encoded. */
    public static String profileUrn(String profileId) {
        return encodeComponent("urn:li:fsd_profile:" + profileId);
    }
}
