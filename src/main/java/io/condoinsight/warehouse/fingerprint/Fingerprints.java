package io.condoinsight.warehouse.fingerprint;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Stable hashes used for audit and deduplication:
 * <ul>
 *   <li>file fingerprint: full SHA-256 of the file bytes</li>
 *   <li>header fingerprint: 16 hex chars over the sorted, lower-cased header set</li>
 *   <li>row hash: 32 hex chars over the normalised natural-key values</li>
 * </ul>
 * All of them are reproducible across runs and machines.
 */
public final class Fingerprints {

    private static final int BUFFER = 8192;

    private Fingerprints() {
    }

    public static String sha256Hex(byte[] bytes) {
        return HexFormat.of().formatHex(sha256().digest(bytes));
    }

    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String fileSha256(Path file) {
        MessageDigest digest = sha256();
        byte[] buffer = new byte[BUFFER];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot fingerprint " + file, e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String headerFingerprint(List<String> headers) {
        String joined = headers.stream()
                .map(h -> h == null ? "" : h.trim().toLowerCase(Locale.ROOT))
                .sorted()
                .collect(Collectors.joining("|"));
        return sha256Hex(joined).substring(0, 16);
    }

    /**
     * Hash of the natural key. Values must be supplied in the contract's
     * natural-key order.
     */
    public static String rowHash(List<?> naturalKeyValues) {
        String joined = naturalKeyValues.stream()
                .map(Fingerprints::normalise)
                .collect(Collectors.joining("|"));
        return sha256Hex(joined).substring(0, 32);
    }

    /**
     * Single fingerprint for a whole set of files, independent of listing order.
     */
    public static String batchFingerprint(Map<String, String> fileFingerprints) {
        String joined = new TreeMap<>(fileFingerprints).entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue())
                .collect(Collectors.joining("|"));
        return sha256Hex(joined).substring(0, 16);
    }

    static String normalise(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) ? "" : normalise(BigDecimal.valueOf(d));
        }
        if (value instanceof Number number) {
            return normalise(new BigDecimal(number.toString()));
        }
        if (value instanceof LocalDate date) {
            return date.toString();
        }
        return value.toString().trim().toLowerCase(Locale.ROOT);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
