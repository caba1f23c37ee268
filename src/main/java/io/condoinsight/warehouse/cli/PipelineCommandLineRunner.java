package io.condoinsight.warehouse.cli;

import io.condoinsight.warehouse.entity.RunMode;
import io.condoinsight.warehouse.exception.ErrorCategory;
import io.condoinsight.warehouse.pipeline.IngestionPipeline;
import io.condoinsight.warehouse.pipeline.PipelineResult;
import io.condoinsight.warehouse.pipeline.RunOptions;
import io.condoinsight.warehouse.promotion.PromotionPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command line entry point.
 *
 * <pre>
 *   java -jar condo-warehouse-etl.jar [run] [flags] &lt;csv file or directory&gt;...
 *
 *   --plan                 stage, validate and report the promotion diff only
 *   --staging-only         stage and validate, leave the batch ready
 *   --publish              promote a ready batch (--batch-id=... or the latest)
 *   --rollback             revert the most recent completed batch
 *   --maintenance          re-run the post-promotion tasks
 *   --unlock               clear a run lock left behind by a killed process
 *   --allow-future-dates   keep rows dated after the current month
 *   --triggered-by=NAME    audit label, default "manual"
 * </pre>
 *
 * Exit codes: 0 success, 1 bad input, 2 usage, 3 run lock held, 4 system fault.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "etl.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_USAGE = 2;

    static final String USAGE = "usage: condo-warehouse-etl [run] [--plan|--staging-only|--publish [--batch-id=ID]"
            + "|--rollback|--maintenance|--unlock] [--allow-future-dates] [--triggered-by=NAME] <csv file or directory>...";

    private static final Set<String> KNOWN_OPTIONS = Set.of(
            "plan", "staging-only", "publish", "rollback", "maintenance", "unlock",
            "allow-future-dates", "triggered-by", "batch-id");

    private final IngestionPipeline pipeline;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        RunOptions options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            log.error("[CLI] {}", e.getMessage());
            log.error("[CLI] {}", USAGE);
            exitCode = EXIT_USAGE;
            return;
        }
        try {
            PipelineResult result = pipeline.execute(options);
            report(result);
            exitCode = result.getExitCode();
        } catch (RuntimeException e) {
            log.error("[CLI] unexpected failure", e);
            exitCode = ErrorCategory.SYSTEM.getExitCode();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static RunOptions parse(ApplicationArguments args) {
        for (String option : args.getOptionNames()) {
            if (!KNOWN_OPTIONS.contains(option)) {
                throw new IllegalArgumentException("Unknown option --" + option);
            }
        }

        List<RunMode> modes = new ArrayList<>();
        if (args.containsOption("plan")) {
            modes.add(RunMode.PLAN);
        }
        if (args.containsOption("staging-only")) {
            modes.add(RunMode.STAGING_ONLY);
        }
        if (args.containsOption("publish")) {
            modes.add(RunMode.PUBLISH);
        }
        if (args.containsOption("rollback")) {
            modes.add(RunMode.ROLLBACK);
        }
        if (args.containsOption("maintenance")) {
            modes.add(RunMode.MAINTENANCE);
        }
        if (args.containsOption("unlock")) {
            modes.add(RunMode.UNLOCK);
        }
        if (modes.size() > 1) {
            throw new IllegalArgumentException("Options " + modes.stream()
                    .map(m -> "--" + m.name().toLowerCase(Locale.ROOT).replace('_', '-'))
                    .collect(Collectors.joining(", ")) + " are mutually exclusive");
        }
        RunMode mode = modes.isEmpty() ? RunMode.RUN : modes.get(0);

        List<String> positional = new ArrayList<>(args.getNonOptionArgs());
        if (!positional.isEmpty() && positional.get(0).equals("run")) {
            positional.remove(0);
        }

        String batchId = single(args, "batch-id");
        if (batchId != null && mode != RunMode.PUBLISH) {
            throw new IllegalArgumentException("--batch-id only applies to --publish");
        }

        List<Path> files = expand(positional);
        boolean ingest = mode == RunMode.RUN || mode == RunMode.PLAN || mode == RunMode.STAGING_ONLY;
        if (ingest && files.isEmpty()) {
            throw new IllegalArgumentException("No input CSV files given");
        }
        if (!ingest && !positional.isEmpty()) {
            throw new IllegalArgumentException("--" + mode.name().toLowerCase(Locale.ROOT).replace('_', '-')
                    + " does not take input files");
        }

        String triggeredBy = single(args, "triggered-by");
        return RunOptions.builder()
                .mode(mode)
                .files(files)
                .batchId(batchId)
                .allowFutureDates(args.containsOption("allow-future-dates"))
                .triggeredBy(triggeredBy == null || triggeredBy.isBlank() ? "manual" : triggeredBy)
                .build();
    }

    /**
     * Files as given, directories replaced by the {@code .csv} files directly inside them.
     */
    static List<Path> expand(List<String> arguments) {
        List<Path> files = new ArrayList<>();
        for (String argument : arguments) {
            Path path = Paths.get(argument);
            if (Files.isDirectory(path)) {
                try (Stream<Path> listing = Files.list(path)) {
                    listing.filter(p -> Files.isRegularFile(p)
                                    && p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                            .sorted()
                            .forEach(files::add);
                } catch (IOException e) {
                    throw new UncheckedIOException("Cannot list " + path, e);
                }
            } else if (Files.isRegularFile(path)) {
                files.add(path);
            } else {
                throw new IllegalArgumentException("No such file or directory: " + argument);
            }
        }
        return files;
    }

    private static String single(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + option + " given more than once");
        }
        return values.get(0);
    }

    private static void report(PipelineResult result) {
        String status = result.getStatus() == null ? "-" : result.getStatus().getCode();
        if (result.isSuccess()) {
            log.info("[CLI] {} batch={} status={}: {}", result.getMode(), result.getBatchId(), status, result.getMessage());
        } else {
            log.error("[CLI] {} batch={} status={} exit={}: {}",
                    result.getMode(), result.getBatchId(), status, result.getExitCode(), result.getMessage());
        }
        PromotionPlan plan = result.getPlan();
        if (plan != null) {
            log.info("[CLI] plan: {} new row(s), {} hash collision(s), {} outlier(s) among new rows",
                    plan.getNewRows(), plan.getHashCollisions(), plan.getOutliersInNewRows());
            log.info("[CLI] plan: date window {} .. {}", plan.getWindowStart(), plan.getWindowEnd());
            plan.getNewRowsByDistrict().forEach((district, count) ->
                    log.info("[CLI] plan:   {} +{}", district, count));
            if (!plan.getNewDistricts().isEmpty()) {
                log.info("[CLI] plan: districts new to production {}", plan.getNewDistricts());
            }
        }
    }
}
