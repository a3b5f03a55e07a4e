package ch.so.arp.pdfrag.ingest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Computes the content fingerprint of a whole document. The text is whitespace
 * normalized (case preserved) before hashing, so the same content always maps to
 * the same fingerprint regardless of filename, upload time or layout noise.
 */
public class ContentFingerprinter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    /**
     * @return the lowercase hex encoded SHA-256 of the normalized text
     */
    public String fingerprint(String text) {
        return HexFormat.of().formatHex(sha256(normalize(text)));
    }

    private byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }
}
