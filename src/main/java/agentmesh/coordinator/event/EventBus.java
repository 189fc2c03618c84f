package agentmesh.coordinator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-process event bus for task and agent lifecycle events.
 *
 * Delivery is asynchronous on a single thread, so listeners see events in
 * exactly the order they were published and a slow listener never holds up
 * the publisher. A failing listener is logged and skipped.
 */
public final class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Registration<?>> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService dispatcher;
    private volatile boolean closed = false;

    public EventBus() {
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "agentmesh-events");
            t.setDaemon(true);
            return t;
        });
    }

    public Subscription subscribe(Consumer<? super CoordinatorEvent> listener) {
        return subscribe(CoordinatorEvent.class, e -> true, listener);
    }

    public <E extends CoordinatorEvent> Subscription subscribe(Class<E> type, Consumer<? super E> listener) {
        return subscribe(type, e -> true, listener);
    }

    public <E extends CoordinatorEvent> Subscription subscribe(Class<E> type, Predicate<? super E> filter,
            Consumer<? super E> listener) {
        Registration<E> registration = new Registration<>(type, filter, listener);
        listeners.add(registration);
        return registration;
    }

    /**
     * Queue an event for delivery to every matching listener.
     */
    public void publish(CoordinatorEvent event) {
        enqueue(() -> {
            for (Registration<?> r : listeners) {
                r.offer(event);
            }
        });
    }

    /**
     * Queue an event for one subscription only, in order with everything
     * published before it.
     */
    public void publishTo(Subscription subscription, CoordinatorEvent event) {
        if (subscription instanceof Registration<?> r) {
            enqueue(() -> r.offer(event));
        }
    }

    /**
     * Wait until everything published so far has been delivered.
     *
     * @return false if the timeout elapsed first
     */
    public boolean flush(Duration timeout) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        enqueue(latch::countDown);
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int listenerCount() {
        return listeners.size();
    }

    private void enqueue(Runnable delivery) {
        if (closed) {
            return;
        }
        try {
            dispatcher.execute(delivery);
        } catch (RejectedExecutionException e) {
            log.debug("Event dropped, bus is shutting down");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
                log.warn("Event bus forcefully stopped");
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        listeners.clear();
    }

    private final class Registration<E extends CoordinatorEvent> implements Subscription {
        private final Class<E> type;
        private final Predicate<? super E> filter;
        private final Consumer<? super E> listener;
        private volatile boolean active = true;

        Registration(Class<E> type, Predicate<? super E> filter, Consumer<? super E> listener) {
            this.type = type;
            this.filter = filter;
            this.listener = listener;
        }

        void offer(CoordinatorEvent event) {
            if (!active || !type.isInstance(event)) {
                return;
            }
            E typed = type.cast(event);
            try {
                if (filter.test(typed)) {
                    listener.accept(typed);
                }
            } catch (RuntimeException e) {
                log.warn("Event listener failed on {}", event, e);
            }
        }

        @Override
        public boolean isClosed() {
            return !active;
        }

        @Override
        public void close() {
            active = false;
            listeners.remove(this);
        }
    }
}
