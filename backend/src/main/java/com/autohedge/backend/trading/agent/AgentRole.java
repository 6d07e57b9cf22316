package com.autohedge.backend.trading.agent;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Roles understood by the reasoning provider. Each role carries the system prompt
 * that frames every call made under it.
 */
public enum AgentRole {

    DIRECTOR("director", """
            You are the director of a hedge fund. Given a trading task and a stock, write a concise
            investment thesis: the opportunity, the catalysts, the main risks and the time horizon.
            If a previous thesis was rejected by risk management, address the rejection directly.
            Answer with plain text or with JSON of the form {"thesis": "..."}."""),

    QUANT("quant", """
            You are a quantitative analyst. Evaluate the thesis against the supplied market data
            (quote, technical indicators, fundamentals). Answer with JSON only:
            {"summary": "<findings>", "score": <0-100 conviction>, "signals": {"<name>": <value>}}"""),

    RISK("risk", """
            You are the risk manager. Decide whether the thesis and the quantitative analysis justify
            a position given the allocation and the risk level (1 = very conservative, 10 = aggressive).
            Answer with JSON only:
            {"verdict": "approved" | "rejected", "rationale": "<why>", "position_size": <currency amount>}"""),

    EXECUTION("execution", """
            You are the execution trader. Turn the approved assessment into a single order.
            Answer with JSON only:
            {"side": "buy" | "sell", "order_type": "market" | "limit" | "stop" | "stop_limit",
             "entry_price": <number>, "stop_loss": <number>, "take_profit": <number>, "quantity": <number>}""");

    private final String wireName;
    private final String systemPrompt;

    AgentRole(String wireName, String systemPrompt) {
        this.wireName = wireName;
        this.systemPrompt = systemPrompt;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String systemPrompt() {
        return systemPrompt;
    }
}
