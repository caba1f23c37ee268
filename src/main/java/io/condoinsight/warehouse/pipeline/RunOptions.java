package io.condoinsight.warehouse.pipeline;

import io.condoinsight.warehouse.entity.RunMode;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything one invocation asked for.
 */
@Value
@Builder
public class RunOptions {

    @Builder.Default
    RunMode mode = RunMode.RUN;

    @Builder.Default
    List<Path> files = List.of();

    /** Batch to publish; null means the most recent ready batch. */
    String batchId;

    boolean allowFutureDates;

    @Builder.Default
    String triggeredBy = "manual";
}
