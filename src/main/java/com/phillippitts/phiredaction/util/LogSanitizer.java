package com.phillippitts.phiredaction.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Utility for privacy-safe logging: text is described, never printed. */
public final class LogSanitizer {

    private static final int FINGERPRINT_HEX_CHARS = 12;

    private LogSanitizer() {}

    /**
     * Returns a description of the text that reveals only its length and a short SHA-256 prefix,
     * e.g. {@code len=31 sha=3f1c0a9d2b7e}. Returns {@code len=0} for null or empty input.
     */
    public static String describe(String s) {
        if (s == null || s.isEmpty()) {
            return "len=0";
        }
        return "len=" + s.length() + " sha=" + fingerprint(s);
    }

    /**
     * Short hex fingerprint used to correlate identical text across log lines without revealing it.
     */
    public static String fingerprint(String s) {
        if (s == null) {
            return "";
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, FINGERPRINT_HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
