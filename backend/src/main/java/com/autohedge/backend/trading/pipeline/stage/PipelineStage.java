package com.autohedge.backend.trading.pipeline.stage;

import com.autohedge.backend.trading.pipeline.PipelineStageName;

/**
 * One step of the per-stock pipeline. Implementations never retry; a failed call surfaces as
 * {@link com.autohedge.backend.exception.StageUnavailableException} and an unusable answer as
 * {@link com.autohedge.backend.exception.StageParseException}.
 */
public interface PipelineStage<I, O> {

    PipelineStageName name();

    O run(I input);
}
