package agentmesh.coordinator.scheduler;

import agentmesh.coordinator.config.CoordinatorConfig;
import agentmesh.coordinator.error.CycleException;
import agentmesh.coordinator.error.DependencyFailedException;
import agentmesh.coordinator.error.DispatchException;
import agentmesh.coordinator.error.NoAgentAvailableException;
import agentmesh.coordinator.error.ResourceExhaustedException;
import agentmesh.coordinator.error.TaskExecutionException;
import agentmesh.coordinator.error.TaskNotFoundException;
import agentmesh.coordinator.error.TaskTimeoutException;
import agentmesh.coordinator.error.ValidationException;
import agentmesh.coordinator.event.EventBus;
import agentmesh.coordinator.event.Subscription;
import agentmesh.coordinator.event.TaskEvent;
import agentmesh.coordinator.event.TaskEventType;
import agentmesh.coordinator.invoker.AgentInvoker;
import agentmesh.coordinator.invoker.InvocationRequest;
import agentmesh.coordinator.invoker.InvocationResult;
import agentmesh.coordinator.model.AgentDescriptor;
import agentmesh.coordinator.model.CancelResult;
import agentmesh.coordinator.model.ManagerStats;
import agentmesh.coordinator.model.Priority;
import agentmesh.coordinator.model.Task;
import agentmesh.coordinator.model.TaskError;
import agentmesh.coordinator.model.TaskRequest;
import agentmesh.coordinator.model.TaskState;
import agentmesh.coordinator.registry.CapabilityRouter;
import agentmesh.coordinator.util.ExponentialBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Priority-laned, dependency-aware task scheduler.
 *
 * <p>All scheduling state (records, lanes, graph, running count) lives behind
 * one lock and every state transition, together with the event it
 * publishes, happens inside it. A single loop thread drains wake signals and
 * dispatches while fewer than {@code maxConcurrentTasks} tasks are running.
 * Invocations are submitted on a fixed worker pool; their completion,
 * failure or timeout is applied only if it belongs to the task's current
 * attempt, anything older is discarded as an anomaly.
 *
 * <p>Invocation futures are always cancelled outside the lock, because
 * cancelling a {@link CompletableFuture} runs its callbacks on the calling
 * thread.
 */
public class TaskManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskManager.class);

    private static final Duration LONGEST_TIMER = Duration.ofMillis(Long.MAX_VALUE);

    private enum Wake {
        CREATED, STARTED, COMPLETED, FAILED, CANCELLED, RETRY_DUE, TIMEOUT, SHUTDOWN
    }

    private final CapabilityRouter router;
    private final AgentInvoker invoker;
    private final EventBus eventBus;
    private final Clock clock;
    private final int maxConcurrentTasks;
    private final int defaultMaxRetries;
    private final Duration defaultTimeout;
    private final Duration maxTimeout;
    private final ExponentialBackoff retryBackoff;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, TaskRecord> records = new LinkedHashMap<>();
    private final PriorityLanes lanes;
    private final DependencyGraph graph = new DependencyGraph();
    private int running = 0;
    private long completedCount = 0;
    private long queuedToCompletedTotalMs = 0;

    private final LinkedBlockingQueue<Wake> wakeups = new LinkedBlockingQueue<>();
    private final ExecutorService workers;
    private final ScheduledExecutorService timers;
    private final Thread loopThread;

    private volatile boolean started = false;
    private volatile boolean closed = false;

    public TaskManager(CapabilityRouter router, AgentInvoker invoker, EventBus eventBus, Clock clock,
            CoordinatorConfig config) {
        this.router = router;
        this.invoker = invoker;
        this.eventBus = eventBus;
        this.clock = clock;
        if (config.maxConcurrentTasks() <= 0) {
            throw new IllegalArgumentException("maxConcurrentTasks must be positive");
        }
        this.maxConcurrentTasks = config.maxConcurrentTasks();
        this.defaultMaxRetries = config.defaultMaxRetries();
        this.defaultTimeout = config.defaultTaskTimeout();
        this.maxTimeout = config.maxTaskTimeout();
        if (!isPositive(maxTimeout) || !isPositive(defaultTimeout) || defaultTimeout.compareTo(maxTimeout) > 0) {
            throw new IllegalArgumentException("task timeout must be positive and at most " + maxTimeout);
        }
        this.retryBackoff = new ExponentialBackoff(config.retryBaseDelay(), config.retryMaxDelay());
        this.lanes = new PriorityLanes(config.laneCapacity());

        AtomicInteger workerSeq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(maxConcurrentTasks, r -> {
            Thread t = new Thread(r, "agentmesh-worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.timers = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentmesh-timers");
            t.setDaemon(true);
            return t;
        });
        this.loopThread = new Thread(this::runLoop, "agentmesh-scheduler");
        this.loopThread.setDaemon(true);
    }

    // ===== lifecycle =====

    public void start() {
        if (started) {
            log.warn("Task manager already started");
            return;
        }
        started = true;
        loopThread.start();
        signal(Wake.STARTED);
        log.info("Task manager started (maxConcurrentTasks={}, laneCapacity={})", maxConcurrentTasks,
                lanes.capacity());
    }

    public boolean isRunning() {
        return started && !closed;
    }

    /**
     * Stop the loop, the timers and the worker pool, cancelling in-flight
     * invocations. Task states are left as they are.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        wakeups.offer(Wake.SHUTDOWN);

        List<CompletableFuture<?>> inFlight = new ArrayList<>();
        lock.lock();
        try {
            for (TaskRecord r : records.values()) {
                cancelTimers(r);
                if (r.inFlight != null && r.state == TaskState.RUNNING) {
                    inFlight.add(r.inFlight);
                }
            }
        } finally {
            lock.unlock();
        }

        try {
            if (started) {
                loopThread.join(5000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        timers.shutdownNow();
        cancelAll(inFlight);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
                log.warn("Task workers forcefully stopped");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Task manager stopped ({} in-flight invocations cancelled)", inFlight.size());
    }

    // ===== commands =====

    public String createTask(String capabilityId, String contextId, Priority priority) {
        return createTask(TaskRequest.builder(capabilityId, contextId, priority).build());
    }

    /**
     * Admit a task. It starts BLOCKED when a dependency is incomplete, QUEUED
     * otherwise, or directly FAILED when a dependency already failed or was
     * cancelled.
     *
     * @return the task id
     * @throws ValidationException        malformed request, duplicate id or unknown dependency
     * @throws CycleException             the dependencies would close a cycle
     * @throws ResourceExhaustedException the target lane is full
     */
    public String createTask(TaskRequest request) {
        validate(request);
        List<String> dependencies = request.dependencyList();
        Duration timeout = request.timeout() != null ? request.timeout() : defaultTimeout;
        int maxRetries = request.maxRetries() != null ? request.maxRetries() : defaultMaxRetries;

        String taskId;
        TaskState initial;
        lock.lock();
        try {
            taskId = request.taskId() != null ? request.taskId() : UUID.randomUUID().toString();
            if (records.containsKey(taskId)) {
                throw new ValidationException("duplicate task id: " + taskId);
            }
            List<String> cycle = graph.findCycle(taskId, dependencies);
            if (!cycle.isEmpty()) {
                throw new CycleException(cycle);
            }

            String failedSource = null;
            boolean allCompleted = true;
            for (String dep : dependencies) {
                TaskRecord d = records.get(dep);
                if (d == null) {
                    throw new ValidationException("unknown dependency: " + dep);
                }
                if (failedSource == null && (d.state == TaskState.FAILED || d.state == TaskState.CANCELLED)) {
                    failedSource = dep;
                }
                if (d.state != TaskState.COMPLETED) {
                    allCompleted = false;
                }
            }

            if (failedSource != null) {
                initial = TaskState.FAILED;
            } else if (allCompleted) {
                initial = TaskState.QUEUED;
                if (!lanes.hasCapacity(request.priority())) {
                    throw new ResourceExhaustedException(request.priority(), lanes.capacity());
                }
            } else {
                initial = TaskState.BLOCKED;
            }

            Instant now = clock.instant();
            TaskRecord r = new TaskRecord(taskId, request.contextId(), request.capabilityId(), request.priority(),
                    dependencies, request.payload(), request.metadata(), request.routing(), now, maxRetries, timeout);
            r.state = initial;
            records.put(taskId, r);
            graph.add(taskId, dependencies);

            if (initial == TaskState.FAILED) {
                r.error = new DependencyFailedException(failedSource).toTaskError();
                r.completedAt = now;
            } else if (initial == TaskState.QUEUED) {
                r.firstQueuedAt = now;
                lanes.offer(r.priority, taskId);
                r.inLane = true;
            }
            publish(r, TaskEventType.CREATED, null);
        } finally {
            lock.unlock();
        }

        log.info("Created task {} ({}, {}, context={}) in state {}", taskId, request.capabilityId(),
                request.priority(), request.contextId(), initial);
        if (initial == TaskState.QUEUED) {
            signal(Wake.CREATED);
        }
        return taskId;
    }

    /**
     * Add a dependency edge to a task that has never been dispatched.
     *
     * @return the updated task
     * @throws TaskNotFoundException unknown task
     * @throws ValidationException   unknown dependency, or the task was already dispatched
     * @throws CycleException        the edge would close a cycle; nothing changed
     */
    public Task addDependency(String taskId, String dependencyId) {
        if (dependencyId == null || dependencyId.isBlank()) {
            throw new ValidationException("dependency id is required");
        }
        lock.lock();
        try {
            TaskRecord r = require(taskId);
            TaskRecord dep = records.get(dependencyId);
            if (dep == null) {
                throw new ValidationException("unknown dependency: " + dependencyId);
            }
            requireNeverDispatched(r);
            if (r.dependencies.contains(dependencyId)) {
                return snapshot(r);
            }
            List<String> cycle = graph.findCycle(taskId, List.of(dependencyId));
            if (!cycle.isEmpty()) {
                throw new CycleException(cycle);
            }

            graph.addEdge(taskId, dependencyId);
            r.dependencies.add(dependencyId);
            log.info("Task {} now depends on {}", taskId, dependencyId);

            if (dep.state == TaskState.FAILED || dep.state == TaskState.CANCELLED) {
                leaveLane(r);
                failLocked(r, new DependencyFailedException(dependencyId).toTaskError(), new ArrayList<>());
            } else if (dep.state != TaskState.COMPLETED && r.state == TaskState.QUEUED) {
                leaveLane(r);
                r.state = TaskState.BLOCKED;
                publish(r, TaskEventType.BLOCKED, "waiting for " + dependencyId);
            }
            return snapshot(r);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop a dependency edge from a task that has never been dispatched. A
     * BLOCKED task whose remaining dependencies are all COMPLETED moves to
     * the tail of its lane. Removing an edge that does not exist changes
     * nothing.
     *
     * @return the updated task
     * @throws TaskNotFoundException unknown task
     * @throws ValidationException   the task was already dispatched or finished
     */
    public Task removeDependency(String taskId, String dependencyId) {
        if (dependencyId == null || dependencyId.isBlank()) {
            throw new ValidationException("dependency id is required");
        }
        lock.lock();
        try {
            TaskRecord r = require(taskId);
            requireNeverDispatched(r);
            if (!r.dependencies.remove(dependencyId)) {
                return snapshot(r);
            }
            graph.removeEdge(taskId, dependencyId);
            log.info("Task {} no longer depends on {}", taskId, dependencyId);

            if (r.state == TaskState.BLOCKED && dependenciesCompleted(r)) {
                enqueueLocked(r);
            }
            return snapshot(r);
        } finally {
            lock.unlock();
        }
    }

    private static void requireNeverDispatched(TaskRecord r) {
        boolean pending = r.state == TaskState.QUEUED || r.state == TaskState.BLOCKED;
        if (!pending || r.everDispatched || r.retryCount > 0) {
            throw new ValidationException("task " + r.id + " has already been dispatched or finished");
        }
    }

    /**
     * Cancel a task and every dependent that has not started.
     *
     * @return ALREADY_TERMINAL when the task had already finished
     * @throws TaskNotFoundException unknown task
     */
    public CancelResult cancelTask(String taskId) {
        List<CompletableFuture<?>> toCancel = new ArrayList<>();
        int cascaded = 0;
        lock.lock();
        try {
            TaskRecord r = require(taskId);
            if (r.isTerminal()) {
                return CancelResult.ALREADY_TERMINAL;
            }
            cancelLocked(r, TaskError.cancelled(), toCancel);
            for (String id : graph.transitiveDependents(taskId)) {
                TaskRecord d = records.get(id);
                if (!d.isTerminal() && d.state != TaskState.RUNNING) {
                    cancelLocked(d, TaskError.dependencyCancelled(taskId), toCancel);
                    cascaded++;
                }
            }
        } finally {
            lock.unlock();
        }

        cancelAll(toCancel);
        log.info("Cancelled task {} ({} dependents cancelled)", taskId, cascaded);
        signal(Wake.CANCELLED);
        return CancelResult.CANCELLED;
    }

    // ===== queries =====

    /**
     * @throws TaskNotFoundException unknown task
     */
    public Task getTask(String taskId) {
        lock.lock();
        try {
            return snapshot(require(taskId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<Task> findTask(String taskId) {
        lock.lock();
        try {
            TaskRecord r = records.get(taskId);
            return r == null ? Optional.empty() : Optional.of(snapshot(r));
        } finally {
            lock.unlock();
        }
    }

    /** Tasks of a context, in creation order */
    public List<Task> findByContext(String contextId) {
        lock.lock();
        try {
            List<Task> result = new ArrayList<>();
            for (TaskRecord r : records.values()) {
                if (r.contextId.equals(contextId)) {
                    result.add(snapshot(r));
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Tasks in a state, in creation order */
    public List<Task> findByState(TaskState state) {
        lock.lock();
        try {
            List<Task> result = new ArrayList<>();
            for (TaskRecord r : records.values()) {
                if (r.state == state) {
                    result.add(snapshot(r));
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public ManagerStats managerStats() {
        lock.lock();
        try {
            Map<TaskState, Integer> byState = new EnumMap<>(TaskState.class);
            for (TaskState s : TaskState.values()) {
                byState.put(s, 0);
            }
            Map<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
            for (Priority p : Priority.values()) {
                byPriority.put(p, 0);
            }
            int retried = 0;
            for (TaskRecord r : records.values()) {
                byState.merge(r.state, 1, Integer::sum);
                byPriority.merge(r.priority, 1, Integer::sum);
                if (r.retryCount > 0) {
                    retried++;
                }
            }
            Double meanMs = completedCount == 0 ? null : (double) queuedToCompletedTotalMs / completedCount;
            double retryRate = records.isEmpty() ? 0.0 : (double) retried / records.size();
            return new ManagerStats(records.size(), byState, byPriority, lanes.depths(), running,
                    maxConcurrentTasks, meanMs, retryRate);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Follow a task: the listener first receives a SNAPSHOT of its current
     * state, then every change in order. The subscription closes itself after
     * the terminal event; closing it earlier stops delivery.
     *
     * @throws TaskNotFoundException unknown task
     */
    public Subscription streamStatus(String taskId, Consumer<TaskEvent> listener) {
        lock.lock();
        try {
            TaskRecord r = require(taskId);
            StatusStream stream = new StatusStream(listener);
            Subscription subscription = eventBus.subscribe(TaskEvent.class, e -> e.taskId().equals(taskId), stream);
            stream.bind(subscription);
            eventBus.publishTo(subscription, event(r, TaskEventType.SNAPSHOT, null));
            return subscription;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Events already queued when the subscription was made are skipped until
     * the snapshot arrives, so the listener sees a consistent sequence.
     */
    private static final class StatusStream implements Consumer<TaskEvent> {
        private final Consumer<TaskEvent> listener;
        private volatile Subscription subscription;
        private boolean primed = false;

        StatusStream(Consumer<TaskEvent> listener) {
            this.listener = listener;
        }

        void bind(Subscription subscription) {
            this.subscription = subscription;
        }

        @Override
        public void accept(TaskEvent e) {
            if (!primed) {
                if (e.type() != TaskEventType.SNAPSHOT) {
                    return;
                }
                primed = true;
            } else if (e.type() == TaskEventType.SNAPSHOT) {
                return;
            }
            try {
                listener.accept(e);
            } finally {
                if (e.isTerminal()) {
                    subscription.close();
                }
            }
        }
    }

    // ===== scheduling loop =====

    private void signal(Wake reason) {
        wakeups.offer(reason);
    }

    private void runLoop() {
        List<Wake> batch = new ArrayList<>();
        while (!closed) {
            try {
                batch.add(wakeups.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            wakeups.drainTo(batch);
            if (closed || batch.contains(Wake.SHUTDOWN)) {
                break;
            }
            batch.clear();
            try {
                dispatchReady();
            } catch (RuntimeException e) {
                log.error("Scheduling loop error", e);
            }
        }
        log.debug("Scheduling loop exited");
    }

    private record Dispatch(String taskId, long attempt, InvocationRequest request) {
    }

    private void dispatchReady() {
        List<Dispatch> ready = new ArrayList<>();
        lock.lock();
        try {
            while (running < maxConcurrentTasks) {
                String taskId = lanes.poll();
                if (taskId == null) {
                    break;
                }
                TaskRecord r = records.get(taskId);
                r.inLane = false;
                r.everDispatched = true;
                if (r.state != TaskState.QUEUED) {
                    log.warn("Task {} was in a lane while {}", taskId, r.state);
                    continue;
                }

                AgentDescriptor agent;
                try {
                    agent = router.route(r.capabilityId, r.routing);
                } catch (NoAgentAvailableException e) {
                    handleFailureLocked(r, e, new ArrayList<>());
                    continue;
                }

                // arm the timer before touching any state; it cannot fire while we hold the lock
                long attempt = r.attempt + 1;
                ScheduledFuture<?> timer;
                try {
                    timer = schedule(() -> onTimeout(taskId, attempt), r.timeout);
                } catch (RuntimeException e) {
                    log.error("Cannot arm timeout for task {}", taskId, e);
                    handleFailureLocked(r, new DispatchException("cannot arm timeout: " + describe(e), e),
                            new ArrayList<>());
                    continue;
                }

                r.attempt = attempt;
                r.state = TaskState.RUNNING;
                r.startedAt = clock.instant();
                r.completedAt = null;
                r.assignedAgent = agent.agentId();
                r.inFlight = null;
                r.timeoutTimer = timer;
                running++;
                publish(r, TaskEventType.STARTED, "attempt " + attempt);
                ready.add(new Dispatch(taskId, attempt, new InvocationRequest(taskId, r.contextId,
                        r.capabilityId, agent, r.payload, r.metadata, r.timeout, (int) attempt)));
            }
        } finally {
            lock.unlock();
        }

        for (Dispatch d : ready) {
            log.debug("Dispatching task {} attempt {} to {}", d.taskId(), d.attempt(), d.request().agent().agentId());
            try {
                workers.execute(() -> invoke(d));
            } catch (RejectedExecutionException e) {
                onAttemptFinished(d.taskId(), d.attempt(), null, new DispatchException("worker pool is shut down", e));
            }
        }
    }

    private void invoke(Dispatch d) {
        CompletableFuture<InvocationResult> future;
        try {
            future = invoker.invoke(d.request());
            if (future == null) {
                future = CompletableFuture.failedFuture(new DispatchException("invoker returned no future"));
            }
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        boolean current;
        lock.lock();
        try {
            TaskRecord r = records.get(d.taskId());
            current = isCurrentAttempt(r, d.attempt());
            if (current) {
                r.inFlight = future;
            }
        } finally {
            lock.unlock();
        }
        if (!current) {
            // cancelled or timed out before the invoker returned
            future.cancel(true);
        }
        future.whenComplete((result, error) -> onAttemptFinished(d.taskId(), d.attempt(), result, error));
    }

    // ===== attempt outcomes =====

    private void onAttemptFinished(String taskId, long attempt, InvocationResult result, Throwable error) {
        Throwable cause = unwrap(error);
        TaskExecutionException failure = null;
        if (cause != null) {
            failure = cause instanceof TaskExecutionException te
                    ? te
                    : new DispatchException(describe(cause), cause);
        } else if (result == null || !result.success()) {
            failure = new DispatchException(result == null ? "agent returned no result" : result.error());
        }

        boolean stale;
        lock.lock();
        try {
            TaskRecord r = records.get(taskId);
            stale = !isCurrentAttempt(r, attempt);
            if (stale) {
                if (r != null && !(cause instanceof CancellationException)) {
                    publish(r, TaskEventType.ANOMALY, "discarded " + (failure == null ? "completion" : "failure")
                            + " of stale attempt " + attempt);
                }
            } else {
                running--;
                cancelTimers(r);
                r.inFlight = null;
                if (failure == null) {
                    completeLocked(r, result.output());
                } else {
                    handleFailureLocked(r, failure, new ArrayList<>());
                }
            }
        } finally {
            lock.unlock();
        }

        if (stale) {
            if (cause instanceof CancellationException) {
                log.debug("Invocation of task {} attempt {} cancelled", taskId, attempt);
            } else {
                log.warn("Discarded late {} of task {} attempt {}", failure == null ? "completion" : "failure",
                        taskId, attempt);
            }
            return;
        }
        signal(failure == null ? Wake.COMPLETED : Wake.FAILED);
    }

    private void onTimeout(String taskId, long attempt) {
        CompletableFuture<?> inFlight = null;
        boolean stale;
        lock.lock();
        try {
            TaskRecord r = records.get(taskId);
            stale = !isCurrentAttempt(r, attempt);
            if (stale) {
                if (r != null) {
                    publish(r, TaskEventType.ANOMALY, "discarded timeout of stale attempt " + attempt);
                }
            } else {
                running--;
                inFlight = r.inFlight;
                r.inFlight = null;
                r.timeoutTimer = null;
                handleFailureLocked(r, new TaskTimeoutException(taskId, r.timeout), new ArrayList<>());
            }
        } finally {
            lock.unlock();
        }

        if (stale) {
            log.warn("Discarded timeout of task {} attempt {}", taskId, attempt);
            return;
        }
        log.info("Task {} attempt {} timed out", taskId, attempt);
        if (inFlight != null) {
            inFlight.cancel(true);
        }
        signal(Wake.TIMEOUT);
    }

    private void onRetryDue(String taskId) {
        lock.lock();
        try {
            TaskRecord r = records.get(taskId);
            if (r == null || r.state != TaskState.QUEUED || r.inLane) {
                return;
            }
            r.retryTimer = null;
            lanes.offer(r.priority, taskId);
            r.inLane = true;
            publish(r, TaskEventType.QUEUED, "retry " + r.retryCount);
        } finally {
            lock.unlock();
        }
        signal(Wake.RETRY_DUE);
    }

    // ===== transitions (caller holds the lock) =====

    private boolean isCurrentAttempt(TaskRecord r, long attempt) {
        return r != null && r.state == TaskState.RUNNING && r.attempt == attempt;
    }

    private void completeLocked(TaskRecord r, String output) {
        Instant now = clock.instant();
        r.state = TaskState.COMPLETED;
        r.completedAt = now;
        r.result = output;
        r.error = null;
        completedCount++;
        if (r.firstQueuedAt != null) {
            queuedToCompletedTotalMs += Duration.between(r.firstQueuedAt, now).toMillis();
        }
        publish(r, TaskEventType.COMPLETED, null);
        log.info("Task {} completed by {} (attempt {})", r.id, r.assignedAgent, r.attempt);

        for (String id : graph.dependentsOf(r.id)) {
            TaskRecord d = records.get(id);
            if (d.state == TaskState.BLOCKED && dependenciesCompleted(d)) {
                enqueueLocked(d);
            }
        }
    }

    private boolean dependenciesCompleted(TaskRecord r) {
        for (String dep : graph.dependenciesOf(r.id)) {
            if (records.get(dep).state != TaskState.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    // promotion is never refused by lane capacity
    private void enqueueLocked(TaskRecord r) {
        r.state = TaskState.QUEUED;
        if (r.firstQueuedAt == null) {
            r.firstQueuedAt = clock.instant();
        }
        lanes.offer(r.priority, r.id);
        r.inLane = true;
        publish(r, TaskEventType.QUEUED, null);
        signal(Wake.COMPLETED);
    }

    private void handleFailureLocked(TaskRecord r, TaskExecutionException failure, List<CompletableFuture<?>> toCancel) {
        r.error = failure.toTaskError();
        if (failure.kind().retryable() && r.canRetry()) {
            r.retryCount++;
            r.state = TaskState.QUEUED;
            Duration delay = retryBackoff.delay(r.retryCount);
            String taskId = r.id;
            r.retryTimer = schedule(() -> onRetryDue(taskId), delay);
            publish(r, TaskEventType.RETRY_SCHEDULED, "retry " + r.retryCount + "/" + r.maxRetries + " in "
                    + delay.toMillis() + "ms");
            log.info("Task {} failed ({}: {}), retry {}/{} in {}ms", taskId, failure.kind(), failure.getMessage(),
                    r.retryCount, r.maxRetries, delay.toMillis());
            return;
        }
        log.warn("Task {} failed permanently after {} retries: {}", r.id, r.retryCount, failure.getMessage());
        failLocked(r, r.error, toCancel);
    }

    /**
     * Mark the task FAILED, then every transitive dependent FAILED with
     * DEPENDENCY_FAILED in the same critical section.
     */
    private void failLocked(TaskRecord r, TaskError error, List<CompletableFuture<?>> toCancel) {
        terminate(r, TaskState.FAILED, error, toCancel);
        publish(r, TaskEventType.FAILED, null);

        TaskError cascade = new DependencyFailedException(r.id).toTaskError();
        int cascaded = 0;
        for (String id : graph.transitiveDependents(r.id)) {
            TaskRecord d = records.get(id);
            if (!d.isTerminal()) {
                terminate(d, TaskState.FAILED, cascade, toCancel);
                publish(d, TaskEventType.FAILED, null);
                cascaded++;
            }
        }
        if (cascaded > 0) {
            log.info("Failure of task {} cascaded to {} dependents", r.id, cascaded);
        }
    }

    private void cancelLocked(TaskRecord r, TaskError error, List<CompletableFuture<?>> toCancel) {
        terminate(r, TaskState.CANCELLED, error, toCancel);
        publish(r, TaskEventType.CANCELLED, null);
    }

    private void terminate(TaskRecord r, TaskState state, TaskError error, List<CompletableFuture<?>> toCancel) {
        if (r.state == TaskState.RUNNING) {
            running--;
            if (r.inFlight != null) {
                toCancel.add(r.inFlight);
            }
        }
        leaveLane(r);
        cancelTimers(r);
        r.inFlight = null;
        r.state = state;
        r.error = error;
        r.completedAt = clock.instant();
    }

    private void leaveLane(TaskRecord r) {
        if (r.inLane) {
            lanes.remove(r.priority, r.id);
            r.inLane = false;
        }
    }

    private void cancelTimers(TaskRecord r) {
        if (r.timeoutTimer != null) {
            r.timeoutTimer.cancel(false);
            r.timeoutTimer = null;
        }
        if (r.retryTimer != null) {
            r.retryTimer.cancel(false);
            r.retryTimer = null;
        }
    }

    private void publish(TaskRecord r, TaskEventType type, String detail) {
        eventBus.publish(event(r, type, detail));
    }

    private TaskEvent event(TaskRecord r, TaskEventType type, String detail) {
        return new TaskEvent(type, r.id, r.contextId, r.state, r.retryCount, r.assignedAgent, r.error, detail,
                clock.instant());
    }

    private TaskRecord require(String taskId) {
        TaskRecord r = taskId == null ? null : records.get(taskId);
        if (r == null) {
            throw new TaskNotFoundException(taskId);
        }
        return r;
    }

    private Task snapshot(TaskRecord r) {
        return r.toSnapshot(new ArrayList<>(graph.dependentsOf(r.id)));
    }

    // ===== helpers =====

    private void validate(TaskRequest request) {
        if (request == null) {
            throw new ValidationException("request is required");
        }
        if (request.capabilityId() == null || request.capabilityId().isBlank()) {
            throw new ValidationException("capabilityId is required");
        }
        if (request.contextId() == null || request.contextId().isBlank()) {
            throw new ValidationException("contextId is required");
        }
        if (request.priority() == null) {
            throw new ValidationException("priority is required");
        }
        if (request.taskId() != null && request.taskId().isBlank()) {
            throw new ValidationException("taskId must not be blank");
        }
        if (request.timeout() != null && !isPositive(request.timeout())) {
            throw new ValidationException("timeout must be positive");
        }
        if (request.timeout() != null && request.timeout().compareTo(maxTimeout) > 0) {
            throw new ValidationException("timeout must not exceed " + maxTimeout);
        }
        if (request.maxRetries() != null && request.maxRetries() < 0) {
            throw new ValidationException("maxRetries must not be negative");
        }
        for (String dep : request.dependencyList()) {
            if (dep == null || dep.isBlank()) {
                throw new ValidationException("dependency ids must not be blank");
            }
        }
        for (Map.Entry<String, String> entry : request.metadata().entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new ValidationException("metadata keys and values must not be null");
            }
        }
        if (request.routing().tags().stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("preferred tags must not be null");
        }
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }

    private ScheduledFuture<?> schedule(Runnable action, Duration delay) {
        try {
            return timers.schedule(action, saturatedMillis(delay), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Timer not scheduled, task manager is closed");
            return null;
        }
    }

    private static long saturatedMillis(Duration delay) {
        return delay.compareTo(LONGEST_TIMER) >= 0 ? Long.MAX_VALUE : delay.toMillis();
    }

    private static void cancelAll(List<CompletableFuture<?>> futures) {
        for (CompletableFuture<?> f : futures) {
            f.cancel(true);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
