package io.condoinsight.warehouse.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import io.condoinsight.warehouse.validation.ValidationIssue;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class ValidationIssueListConverter extends JsonAttributeConverter<List<ValidationIssue>> {

    public ValidationIssueListConverter() {
        super(new TypeReference<>() { });
    }
}
