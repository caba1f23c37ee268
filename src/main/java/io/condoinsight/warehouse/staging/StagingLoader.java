package io.condoinsight.warehouse.staging;

import io.condoinsight.warehouse.config.PipelineProperties;
import io.condoinsight.warehouse.contract.ContractReport;
import io.condoinsight.warehouse.contract.SchemaContract;
import io.condoinsight.warehouse.entity.EtlBatch;
import io.condoinsight.warehouse.entity.StagingTransaction;
import io.condoinsight.warehouse.repository.StagingTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes every record of a batch's files into {@code transactions_staging}.
 *
 * <p>Files are read one after another and rows are saved in chunks of
 * {@code etl.staging.chunk-size}; nothing written here is visible outside the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StagingLoader {

    static final String RAW_LINE = "_raw_line";

    private final CsvFileReader csvFileReader;
    private final TransactionRowMapper rowMapper;
    private final StagingTransactionRepository stagingRepository;
    private final PipelineProperties properties;

    public StagingResult stage(EtlBatch batch, List<Path> files, SchemaContract contract,
                               Map<String, ContractReport> reports) {
        StagingResult result = StagingResult.builder().build();
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            ContractReport report = reports.get(fileName);
            long before = result.getRowsLoaded();
            stageFile(batch.getBatchId(), file, fileName, report, contract, result);
            result.getRowsPerFile().put(fileName, result.getRowsLoaded() - before);
        }
        log.info("[STAGING] batch={} loaded={} rejected={} skipped={} psfReconciled={}/{}",
                batch.getBatchId(), result.getRowsLoaded(), result.getRowsRejected(), result.getRowsSkipped(),
                result.getPsfReconciled(), result.getPsfCompared());
        return result;
    }

    private void stageFile(String batchId, Path file, String fileName, ContractReport report,
                           SchemaContract contract, StagingResult result) {
        List<String> headers = report.getHeaders();
        String[] canonicalByIndex = canonicalByIndex(headers, report.getResolvedMapping());
        int chunkSize = properties.getStaging().getChunkSize();
        List<StagingTransaction> chunk = new ArrayList<>(chunkSize);

        csvFileReader.read(file, record -> {
            if (record.isBlank()) {
                result.setRowsSkipped(result.getRowsSkipped() + 1);
                return;
            }
            StagingTransaction row = record.isMalformed()
                    ? malformed(record)
                    : rowMapper.map(canonicalValues(record, canonicalByIndex),
                                    extras(record, headers, canonicalByIndex), contract);
            row.setBatchId(batchId);
            row.setSourceFile(fileName);
            row.setSourceLine(record.getLineNumber());
            count(row, result);
            chunk.add(row);
            if (chunk.size() >= chunkSize) {
                flush(batchId, chunk, result);
            }
        });
        flush(batchId, chunk, result);
        log.info("[STAGING] batch={} file={} done, {} rows so far", batchId, fileName, result.getRowsLoaded());
    }

    private void flush(String batchId, List<StagingTransaction> chunk, StagingResult result) {
        if (chunk.isEmpty()) {
            return;
        }
        stagingRepository.saveAll(chunk);
        log.debug("[STAGING] batch={} wrote chunk of {} ({} total)", batchId, chunk.size(), result.getRowsLoaded());
        chunk.clear();
    }

    private static void count(StagingTransaction row, StagingResult result) {
        result.setRowsLoaded(result.getRowsLoaded() + 1);
        if (!Boolean.TRUE.equals(row.getIsValid())) {
            result.setRowsRejected(result.getRowsRejected() + 1);
        }
        row.getOversizedColumns().forEach(column -> result.getOversizedValues().merge(column, 1L, Long::sum));
        if (row.getPsfSource() != null && row.getPsfCalc() != null) {
            result.setPsfCompared(result.getPsfCompared() + 1);
            if (Boolean.TRUE.equals(row.getPsfReconciled())) {
                result.setPsfReconciled(result.getPsfReconciled() + 1);
            }
        }
    }

    private static StagingTransaction malformed(CsvRecord record) {
        Map<String, String> extras = new LinkedHashMap<>();
        extras.put(RAW_LINE, record.getRawLine());
        StagingTransaction row = StagingTransaction.builder().rawExtras(extras).build();
        row.reject("malformed line: " + record.getError());
        return row;
    }

    /**
     * Canonical column per header position; null for unknown headers and for a
     * repeated header of a column that is already claimed.
     */
    static String[] canonicalByIndex(List<String> headers, Map<String, String> resolved) {
        String[] canonical = new String[headers.size()];
        Map<String, Boolean> claimed = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String column = resolved.get(headers.get(i));
            if (column != null && claimed.putIfAbsent(column, Boolean.TRUE) == null) {
                canonical[i] = column;
            }
        }
        return canonical;
    }

    private static Map<String, String> canonicalValues(CsvRecord record, String[] canonicalByIndex) {
        Map<String, String> values = new HashMap<>();
        List<String> cells = record.getValues();
        for (int i = 0; i < canonicalByIndex.length && i < cells.size(); i++) {
            if (canonicalByIndex[i] != null) {
                values.put(canonicalByIndex[i], cells.get(i));
            }
        }
        return values;
    }

    private static Map<String, String> extras(CsvRecord record, List<String> headers, String[] canonicalByIndex) {
        Map<String, String> extras = new LinkedHashMap<>();
        List<String> cells = record.getValues();
        for (int i = 0; i < cells.size(); i++) {
            if (i < canonicalByIndex.length && canonicalByIndex[i] != null) {
                continue;
            }
            String header = i < headers.size() && !headers.get(i).isEmpty() ? headers.get(i) : "_column_" + (i + 1);
            if (extras.containsKey(header)) {
                header = header + "_" + (i + 1);
            }
            extras.put(header, cells.get(i));
        }
        return extras;
    }
}
