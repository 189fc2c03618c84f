package agentmesh.coordinator.error;

import agentmesh.coordinator.model.ErrorKind;

/**
 * No live agent declares the requested capability.
 */
public class NoAgentAvailableException extends TaskExecutionException {

    private final String capabilityId;

    public NoAgentAvailableException(String capabilityId) {
        super("no live agent for capability " + capabilityId);
        this.capabilityId = capabilityId;
    }

    public String capabilityId() {
        return capabilityId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NO_AGENT;
    }
}
