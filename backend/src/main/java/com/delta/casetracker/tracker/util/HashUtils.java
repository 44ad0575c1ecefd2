package com.delta.casetracker.tracker.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

public final class HashUtils {
    private static final char FIELD_SEPARATOR = '\u001f';

    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Digest over an ordered list of field values. Null fields hash differently from empty strings.
     */
    public static String sha256HexOfFields(List<String> fields) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                joined.append(FIELD_SEPARATOR);
            }
            String field = fields.get(i);
            joined.append(field == null ? "\u0000" : field);
        }
        return sha256Hex(joined.toString());
    }
}
