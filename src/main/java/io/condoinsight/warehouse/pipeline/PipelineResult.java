package io.condoinsight.warehouse.pipeline;

import io.condoinsight.warehouse.entity.BatchStatus;
import io.condoinsight.warehouse.entity.RunMode;
import io.condoinsight.warehouse.exception.PipelineStage;
import io.condoinsight.warehouse.promotion.PromotionPlan;
import io.condoinsight.warehouse.promotion.PromotionResult;
import io.condoinsight.warehouse.promotion.RollbackResult;
import lombok.Builder;
import lombok.Data;

/**
 * What a run did, for the command line and for tests.
 */
@Data
@Builder
public class PipelineResult {

    private RunMode mode;

    private String batchId;

    private BatchStatus status;

    private int exitCode;

    private String message;

    /** Stage that failed, for non-zero exit codes. */
    private PipelineStage failedStage;

    private PromotionPlan plan;

    private PromotionResult promotion;

    private RollbackResult rollback;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
