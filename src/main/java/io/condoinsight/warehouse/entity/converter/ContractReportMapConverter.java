package io.condoinsight.warehouse.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import io.condoinsight.warehouse.contract.ContractReport;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class ContractReportMapConverter extends JsonAttributeConverter<Map<String, ContractReport>> {

    public ContractReportMapConverter() {
        super(new TypeReference<>() { });
    }
}
