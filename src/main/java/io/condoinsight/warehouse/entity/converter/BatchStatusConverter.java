package io.condoinsight.warehouse.entity.converter;

import io.condoinsight.warehouse.entity.BatchStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link BatchStatus} as its lower-case code.
 */
@Converter(autoApply = true)
public class BatchStatusConverter implements AttributeConverter<BatchStatus, String> {

    @Override
    public String convertToDatabaseColumn(BatchStatus status) {
        return status == null ? null : status.getCode();
    }

    @Override
    public BatchStatus convertToEntityAttribute(String code) {
        return code == null ? null : BatchStatus.fromCode(code);
    }
}
