package com.autohedge.backend.trading.agent;

public class AgentResponseException extends RuntimeException {
    public AgentResponseException(String message) {
        super(message);
    }
}
