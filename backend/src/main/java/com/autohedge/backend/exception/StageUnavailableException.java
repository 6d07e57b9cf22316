package com.autohedge.backend.exception;

import com.autohedge.backend.trading.pipeline.PipelineStageName;
import lombok.Getter;

/**
 * The capability call behind a stage failed (network, timeout, quota, open circuit).
 * Terminal for the affected stock only.
 */
@Getter
public class StageUnavailableException extends RuntimeException {

    private final PipelineStageName stage;

    public StageUnavailableException(PipelineStageName stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
