package io.condoinsight.warehouse.fingerprint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Fingerprints Unit Tests")
class FingerprintsTest {

    @Test
    @DisplayName("Should hash the natural key regardless of case, padding and decimal scale")
    void shouldNormaliseRowHashInputs() {
        // Given
        List<Object> a = Arrays.asList("The Sail @ Marina Bay", LocalDate.of(2023, 10, 1),
                new BigDecimal("1500000.00"), new BigDecimal("1023.0"), "21 to 25");
        List<Object> b = Arrays.asList("  the sail @ marina bay ", LocalDate.of(2023, 10, 1),
                new BigDecimal("1500000"), new BigDecimal("1023"), "21 TO 25");

        // When / Then
        assertThat(Fingerprints.rowHash(a)).hasSize(32).isEqualTo(Fingerprints.rowHash(b));
    }

    @Test
    @DisplayName("Should distinguish keys that differ in any field")
    void shouldDistinguishDifferentKeys() {
        List<Object> a = Arrays.asList("A", LocalDate.of(2023, 10, 1), new BigDecimal("1"), new BigDecimal("2"), null);
        List<Object> b = Arrays.asList("A", LocalDate.of(2023, 11, 1), new BigDecimal("1"), new BigDecimal("2"), null);

        assertThat(Fingerprints.rowHash(a)).isNotEqualTo(Fingerprints.rowHash(b));
    }

    @Test
    @DisplayName("Should normalise values the same way across types")
    void shouldNormaliseValues() {
        assertThat(Fingerprints.normalise(null)).isEmpty();
        assertThat(Fingerprints.normalise(new BigDecimal("0.00"))).isEqualTo("0");
        assertThat(Fingerprints.normalise(new BigDecimal("1E+3"))).isEqualTo("1000");
        assertThat(Fingerprints.normalise(1500.50d)).isEqualTo("1500.5");
        assertThat(Fingerprints.normalise(Double.NaN)).isEmpty();
        assertThat(Fingerprints.normalise(42)).isEqualTo("42");
        assertThat(Fingerprints.normalise(LocalDate.of(2024, 2, 1))).isEqualTo("2024-02-01");
    }

    @Test
    @DisplayName("Should fingerprint headers independent of order and case")
    void shouldFingerprintHeaderSet() {
        String a = Fingerprints.headerFingerprint(List.of("Project Name", "Sale Date", "Price"));
        String b = Fingerprints.headerFingerprint(List.of(" price", "project name", "SALE DATE"));

        assertThat(a).hasSize(16).isEqualTo(b);
    }

    @Test
    @DisplayName("Should hash file bytes with full SHA-256")
    void shouldHashFiles(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("a.csv"), "abc");

        assertThat(Fingerprints.fileSha256(file))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("Should fingerprint a batch independent of file order")
    void shouldFingerprintBatch() {
        Map<String, String> forward = new LinkedHashMap<>();
        forward.put("a.csv", "111");
        forward.put("b.csv", "222");
        Map<String, String> reverse = new LinkedHashMap<>();
        reverse.put("b.csv", "222");
        reverse.put("a.csv", "111");

        assertThat(Fingerprints.batchFingerprint(forward)).isEqualTo(Fingerprints.batchFingerprint(reverse));
    }
}
