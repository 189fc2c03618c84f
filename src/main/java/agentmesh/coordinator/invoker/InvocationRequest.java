package agentmesh.coordinator.invoker;

import agentmesh.coordinator.model.AgentDescriptor;

import java.time.Duration;
import java.util.Map;

/**
 * One dispatch of a task to an agent.
 *
 * @param attempt 1 for the first dispatch, incremented on every retry
 */
public record InvocationRequest(
        String taskId,
        String contextId,
        String capabilityId,
        AgentDescriptor agent,
        String payload,
        Map<String, String> metadata,
        Duration timeout,
        int attempt) {
}
