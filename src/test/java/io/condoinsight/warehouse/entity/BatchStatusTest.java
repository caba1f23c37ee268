package io.condoinsight.warehouse.entity;

import io.condoinsight.warehouse.entity.converter.BatchStatusConverter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BatchStatus Unit Tests")
class BatchStatusTest {

    @Test
    @DisplayName("Should follow the forward lifecycle")
    void shouldAllowForwardLifecycle() {
        assertThat(BatchStatus.STAGING.canTransitionTo(BatchStatus.VALIDATING)).isTrue();
        assertThat(BatchStatus.VALIDATING.canTransitionTo(BatchStatus.READY)).isTrue();
        assertThat(BatchStatus.READY.canTransitionTo(BatchStatus.PROMOTING)).isTrue();
        assertThat(BatchStatus.PROMOTING.canTransitionTo(BatchStatus.COMPLETED)).isTrue();
        assertThat(BatchStatus.COMPLETED.canTransitionTo(BatchStatus.ROLLED_BACK)).isTrue();
    }

    @Test
    @DisplayName("Should refuse to skip stages or move backwards")
    void shouldRefuseIllegalTransitions() {
        assertThat(BatchStatus.STAGING.canTransitionTo(BatchStatus.READY)).isFalse();
        assertThat(BatchStatus.READY.canTransitionTo(BatchStatus.COMPLETED)).isFalse();
        assertThat(BatchStatus.COMPLETED.canTransitionTo(BatchStatus.FAILED)).isFalse();
        assertThat(BatchStatus.FAILED.allowedTargets()).isEmpty();
        assertThat(BatchStatus.ROLLED_BACK.allowedTargets()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = BatchStatus.class, names = {"STAGING", "VALIDATING", "READY", "PROMOTING"})
    @DisplayName("Should allow every non-terminal status to fail")
    void shouldAllowFailureFromNonTerminal(BatchStatus status) {
        assertThat(status.isTerminal()).isFalse();
        assertThat(status.canTransitionTo(BatchStatus.FAILED)).isTrue();
    }

    @Test
    @DisplayName("Should round-trip the stored code through the converter")
    void shouldConvertCodes() {
        BatchStatusConverter converter = new BatchStatusConverter();

        assertThat(converter.convertToDatabaseColumn(BatchStatus.ROLLED_BACK)).isEqualTo("rolled_back");
        assertThat(converter.convertToEntityAttribute("completed")).isEqualTo(BatchStatus.COMPLETED);
        assertThatThrownBy(() -> BatchStatus.fromCode("archived"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("archived");
    }
}
