package io.condoinsight.warehouse.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import io.condoinsight.warehouse.config.PipelineProperties;
import io.condoinsight.warehouse.exception.ContractException;
import io.condoinsight.warehouse.exception.ErrorCategory;
import io.condoinsight.warehouse.exception.PipelineStage;
import io.condoinsight.warehouse.fingerprint.Fingerprints;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the contract JSON named by {@code etl.contract-location}.
 *
 * <p>The contract hash is taken over the raw file bytes, so any edit to the file,
 * including whitespace, shows up in the batch audit trail.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaContractLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ResourceLoader resourceLoader;
    private final PipelineProperties properties;

    public SchemaContract load() {
        String location = properties.getContractLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ContractException(PipelineStage.CONTRACT, ErrorCategory.SYSTEM,
                    "Contract file missing: " + location);
        }
        byte[] bytes;
        try (InputStream in = resource.getInputStream()) {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            throw new ContractException(PipelineStage.CONTRACT, ErrorCategory.SYSTEM,
                    "Contract file unreadable: " + location, e);
        }
        SchemaContract contract = parse(bytes, location);
        log.info("[CONTRACT] loaded {} v{} hash={} ({} columns, natural key {})",
                contract.getName(), contract.getSchemaVersion(), contract.getContractHash(),
                contract.getColumns().size(), contract.getNaturalKeyFields());
        return contract;
    }

    public static SchemaContract parse(byte[] bytes, String source) {
        ContractDocument doc;
        try {
            doc = MAPPER.readValue(bytes, ContractDocument.class);
        } catch (JsonProcessingException e) {
            throw new ContractException(PipelineStage.CONTRACT, ErrorCategory.SYSTEM,
                    "Contract " + source + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ContractException(PipelineStage.CONTRACT, ErrorCategory.SYSTEM,
                    "Contract " + source + " could not be read: " + e.getMessage(), e);
        }
        if (doc.getColumns().isEmpty()) {
            throw invalid(source, "no columns declared");
        }
        if (doc.getColumns().stream().noneMatch(ColumnDefinition::isRequired)) {
            throw invalid(source, "no required columns declared");
        }
        if (doc.getNaturalKeyFields().isEmpty()) {
            throw invalid(source, "natural_key_fields is empty");
        }
        try {
            return SchemaContract.of(doc.getName(), doc.getVersion(),
                    Fingerprints.sha256Hex(bytes).substring(0, 16),
                    doc.getColumns(), doc.getNaturalKeyFields());
        } catch (IllegalArgumentException e) {
            throw invalid(source, e.getMessage());
        }
    }

    private static ContractException invalid(String source, String reason) {
        return new ContractException(PipelineStage.CONTRACT, ErrorCategory.SYSTEM,
                "Contract " + source + " is invalid: " + reason);
    }

    @Data
    static class ContractDocument {
        private String name = "transactions";
        private String version = "unknown";
        private List<ColumnDefinition> columns = new ArrayList<>();
        private List<String> naturalKeyFields = new ArrayList<>();
    }
}
