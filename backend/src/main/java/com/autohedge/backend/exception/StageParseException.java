package com.autohedge.backend.exception;

import com.autohedge.backend.trading.pipeline.PipelineStageName;
import lombok.Getter;

@Getter
public class StageParseException extends RuntimeException {

    private final PipelineStageName stage;

    public StageParseException(PipelineStageName stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageParseException(PipelineStageName stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
