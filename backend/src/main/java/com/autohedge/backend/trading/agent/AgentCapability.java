package com.autohedge.backend.trading.agent;

import java.util.Map;

/**
 * Uniform entry point to the external reasoning provider. Implementations may be swapped
 * without touching the pipeline.
 */
public interface AgentCapability {

    /**
     * @param role    which agent persona answers
     * @param prompt  the task-specific instruction
     * @param context structured data the agent may rely on; serialised by the implementation
     * @return the raw textual answer
     * @throws AgentUnavailableException when the provider cannot be reached or refuses the call
     * @throws AgentResponseException    when the provider answers with something unusable
     */
    String invoke(AgentRole role, String prompt, Map<String, Object> context);

    default boolean isAvailable() {
        return true;
    }
}
