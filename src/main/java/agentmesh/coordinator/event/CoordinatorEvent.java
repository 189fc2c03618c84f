package agentmesh.coordinator.event;

import java.time.Instant;

/**
 * Structured lifecycle event published on the {@link EventBus}.
 */
public sealed interface CoordinatorEvent permits TaskEvent, AgentEvent {

    Instant timestamp();
}
