package agentmesh.coordinator.event;

/**
 * Handle returned by {@link EventBus#subscribe}. Closing it stops delivery;
 * closing twice is harmless.
 */
public interface Subscription extends AutoCloseable {

    boolean isClosed();

    @Override
    void close();
}
