package de.htwsaar.urlmap.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Digests {

    private Digests() {}

    /**
     * Digest einer Zuordnung: SHA-256 über die Verkettung von Site und kanonischem Pfad.
     *
     * @param site Site-Domain
     * @param path kanonischer Pfad
     * @return 64-stelliger Hex-String
     */
    public static String mappingDigest(String site, String path) {
        return sha256Hex(site + path);
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute SHA-256", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
