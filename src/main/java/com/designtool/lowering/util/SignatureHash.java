package com.designtool.lowering.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Short, stable content hash used for style and structure signatures.
 */
public class SignatureHash {

    private SignatureHash() {
        // Utility class
    }

    public static String hashString(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(input.getBytes(StandardCharsets.UTF_8));
            // First 16 hex characters are enough to tell signatures apart
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            return String.format("%016x", input.hashCode() & 0xFFFFFFFFL);
        }
    }
}
