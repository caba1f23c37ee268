package io.condoinsight.warehouse.staging;

import io.condoinsight.warehouse.config.PipelineProperties;
import io.condoinsight.warehouse.exception.ErrorCategory;
import io.condoinsight.warehouse.exception.PipelineException;
import io.condoinsight.warehouse.exception.PipelineStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.FlatFileParseException;
import org.springframework.batch.item.file.LineMapper;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.item.file.mapping.DefaultLineMapper;
import org.springframework.batch.item.file.mapping.PassThroughFieldSetMapper;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Thin wrapper over Spring Batch's {@link FlatFileItemReader} for comma separated
 * exports with a single header line.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvFileReader {

    private static final String BOM = "\uFEFF";

    private final PipelineProperties properties;

    /**
     * Header cells of a file, trimmed and without a leading byte order mark.
     * An empty file yields an empty list.
     */
    public List<String> readHeader(Path file) {
        AtomicReference<String> header = new AtomicReference<>();
        FlatFileItemReader<CsvRecord> reader = build(file, header);
        open(reader, file);
        reader.close();
        return splitHeader(header.get());
    }

    /**
     * Streams every record after the header to {@code consumer}, including blank and
     * malformed ones so the caller can count them.
     */
    public void read(Path file, Consumer<CsvRecord> consumer) {
        FlatFileItemReader<CsvRecord> reader = build(file, new AtomicReference<>());
        open(reader, file);
        try {
            while (true) {
                CsvRecord record;
                try {
                    record = reader.read();
                } catch (FlatFileParseException e) {
                    log.warn("[STAGING] {} line {} is malformed: {}", file.getFileName(), e.getLineNumber(), e.getMessage());
                    record = CsvRecord.malformed(e.getLineNumber(), e.getInput(), e.getMessage());
                }
                if (record == null) {
                    break;
                }
                consumer.accept(record);
            }
        } catch (PipelineException e) {
            throw e;
        } catch (Exception e) {
            throw new PipelineException(PipelineStage.STAGING, ErrorCategory.SYSTEM,
                    "Failed reading " + file.getFileName() + ": " + e.getMessage(), e);
        } finally {
            reader.close();
        }
    }

    private FlatFileItemReader<CsvRecord> build(Path file, AtomicReference<String> header) {
        FlatFileItemReader<CsvRecord> reader = new FlatFileItemReaderBuilder<CsvRecord>()
                .name("csv-" + file.getFileName())
                .resource(new FileSystemResource(file))
                .encoding(properties.getStaging().getEncoding())
                .linesToSkip(1)
                .skippedLinesCallback(header::set)
                .lineMapper(recordMapper())
                .saveState(false)
                .build();
        // A project name may start with '#'; no line is a comment.
        reader.setComments(new String[0]);
        return reader;
    }

    private LineMapper<CsvRecord> recordMapper() {
        DefaultLineMapper<FieldSet> fields = new DefaultLineMapper<>();
        fields.setLineTokenizer(tokenizer());
        fields.setFieldSetMapper(new PassThroughFieldSetMapper());
        return (line, lineNumber) -> {
            if (line.isBlank()) {
                return CsvRecord.blank(lineNumber);
            }
            String[] values = fields.mapLine(line, lineNumber).getValues();
            return CsvRecord.of(lineNumber, line, trimmed(values));
        };
    }

    private static DelimitedLineTokenizer tokenizer() {
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();
        tokenizer.setStrict(false);
        return tokenizer;
    }

    private static List<String> splitHeader(String line) {
        if (line == null || line.isBlank()) {
            return List.of();
        }
        if (line.startsWith(BOM)) {
            line = line.substring(BOM.length());
        }
        return trimmed(tokenizer().tokenize(line).getValues());
    }

    private static List<String> trimmed(String[] values) {
        List<String> out = new ArrayList<>(values.length);
        Arrays.stream(values).forEach(v -> out.add(v == null ? null : v.trim()));
        return out;
    }

    private static void open(FlatFileItemReader<CsvRecord> reader, Path file) {
        try {
            reader.open(new ExecutionContext());
        } catch (ItemStreamException e) {
            throw new PipelineException(PipelineStage.STAGING, ErrorCategory.INPUT,
                    "Cannot open " + file + ": " + e.getMessage(), e);
        }
    }
}
