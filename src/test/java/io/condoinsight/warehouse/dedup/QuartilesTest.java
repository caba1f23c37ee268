package io.condoinsight.warehouse.dedup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Quartiles Unit Tests")
class QuartilesTest {

    @Test
    @DisplayName("Should interpolate linearly between closest ranks")
    void shouldInterpolate() {
        // When
        Quartiles q = Quartiles.of(new double[]{7, 1, 3, 5});

        // Then
        assertThat(q.getQ1()).isCloseTo(2.5, within(1e-9));
        assertThat(q.getMedian()).isCloseTo(4.0, within(1e-9));
        assertThat(q.getQ3()).isCloseTo(5.5, within(1e-9));
        assertThat(q.iqr()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    @DisplayName("Should return exact ranks for an odd-sized sample")
    void shouldHandleOddSample() {
        Quartiles q = Quartiles.of(new double[]{1, 2, 3, 4, 5});

        assertThat(q.getQ1()).isEqualTo(2.0);
        assertThat(q.getMedian()).isEqualTo(3.0);
        assertThat(q.getQ3()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Should collapse to the single value")
    void shouldHandleSingleValue() {
        Quartiles q = Quartiles.of(new double[]{42});

        assertThat(q.getMedian()).isEqualTo(42.0);
        assertThat(q.iqr()).isZero();
    }

    @Test
    @DisplayName("Should reject an empty sample")
    void shouldRejectEmpty() {
        assertThatThrownBy(() -> Quartiles.of(new double[0])).isInstanceOf(IllegalArgumentException.class);
    }
}
