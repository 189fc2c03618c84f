package agentmesh.coordinator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Writes every lifecycle event to the log in key=value form.
 * Anomalies go to WARN, terminal failures to INFO, the rest to DEBUG.
 */
public final class EventLogger implements Consumer<CoordinatorEvent> {

    private static final Logger log = LoggerFactory.getLogger("agentmesh.events");

    @Override
    public void accept(CoordinatorEvent event) {
        if (event instanceof TaskEvent e) {
            logTask(e);
        } else if (event instanceof AgentEvent e) {
            logAgent(e);
        }
    }

    private void logTask(TaskEvent e) {
        switch (e.type()) {
            case ANOMALY -> log.warn("event=task.anomaly task={} state={} detail=\"{}\"",
                    e.taskId(), e.state(), e.detail());
            case FAILED, RETRY_SCHEDULED -> log.info("event=task.{} task={} context={} retries={} error=\"{}\"",
                    e.type().name().toLowerCase(), e.taskId(), e.contextId(), e.retryCount(),
                    e.error() != null ? e.error().message() : null);
            default -> log.debug("event=task.{} task={} context={} state={} agent={}",
                    e.type().name().toLowerCase(), e.taskId(), e.contextId(), e.state(), e.agentId());
        }
    }

    private void logAgent(AgentEvent e) {
        if (e.type() == AgentEventType.HEALTH_CHANGED) {
            log.info("event=agent.health agent={} from={} to={}", e.agentId(), e.previousHealth(), e.health());
        } else {
            log.info("event=agent.{} agent={}", e.type().name().toLowerCase(), e.agentId());
        }
    }
}
