package agentmesh.coordinator.invoker;

import agentmesh.coordinator.model.AgentDescriptor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Transport boundary to remote agents. The scheduler depends only on this
 * interface; one implementation exists per wire protocol.
 *
 * Both methods must return quickly and complete the future asynchronously.
 * Cancelling a returned future is the cancellation signal: implementations
 * should abort the remote call on a best-effort basis, and the coordinator
 * never waits for that to happen.
 */
public interface AgentInvoker {

    /**
     * Run a task on the given agent.
     */
    CompletableFuture<InvocationResult> invoke(InvocationRequest request);

    /**
     * Health-check the given agent. Called only by the health monitor, which
     * bounds the call with {@code timeout} on its side as well.
     */
    CompletableFuture<HealthSample> probe(AgentDescriptor agent, Duration timeout);
}
