package agentmesh.coordinator.config;

import agentmesh.coordinator.api.internal.v1.AgentRegistrationController;
import agentmesh.coordinator.api.v1.AgentController;
import agentmesh.coordinator.api.v1.HealthController;
import agentmesh.coordinator.api.v1.StatsController;
import agentmesh.coordinator.api.v1.TaskController;
import agentmesh.coordinator.api.v1.TaskEventsController;
import agentmesh.coordinator.event.EventBus;
import agentmesh.coordinator.event.EventLogger;
import agentmesh.coordinator.event.Subscription;
import agentmesh.coordinator.health.HealthMonitor;
import agentmesh.coordinator.invoker.AgentInvoker;
import agentmesh.coordinator.registry.CapabilityRegistry;
import agentmesh.coordinator.registry.CapabilityRouter;
import agentmesh.coordinator.scheduler.TaskManager;
import agentmesh.coordinator.server.RouterHandler;
import agentmesh.coordinator.simulation.SimulatedAgentInvoker;
import agentmesh.coordinator.simulation.SimulationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all coordinator components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.load());
 * deps.start(); // task manager loop, health probes, simulation
 * TaskManager tasks = deps.taskManager();
 * // ... use components ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Clock clock;
    private final EventBus eventBus;
    private final Subscription eventLog;
    private final AgentInvoker invoker;
    private final SimulatedAgentInvoker ownedInvoker;
    private final CapabilityRegistry registry;
    private final CapabilityRouter router;
    private final HealthMonitor healthMonitor;
    private final TaskManager taskManager;
    private final SimulationService simulationService;

    // Controllers
    private final TaskController taskController;
    private final TaskEventsController taskEventsController;
    private final AgentController agentController;
    private final HealthController healthController;
    private final StatsController statsController;
    private final AgentRegistrationController agentRegistrationController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(CoordinatorConfig config, AgentInvoker invoker, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        this.eventBus = new EventBus();
        this.eventLog = eventBus.subscribe(new EventLogger());

        if (invoker == null) {
            this.ownedInvoker = new SimulatedAgentInvoker(config.simulationDelayMinMs(),
                    config.simulationDelayMaxMs(), config.simulationFailRate());
            this.invoker = ownedInvoker;
        } else {
            this.ownedInvoker = null;
            this.invoker = invoker;
        }

        // Core
        this.registry = new CapabilityRegistry(eventBus, clock, config.latencyEmaWeight());
        this.router = new CapabilityRouter(registry, config.confidenceWeight(), config.latencyWeight(),
                config.preferredTagBonus(), config.preferredVersionBonus());
        this.healthMonitor = new HealthMonitor(registry, this.invoker, eventBus, clock, config);
        this.taskManager = new TaskManager(router, this.invoker, eventBus, clock, config);
        this.simulationService = new SimulationService(registry);

        // Controllers (public API)
        this.taskController = new TaskController(taskManager);
        this.taskEventsController = new TaskEventsController(taskManager);
        this.agentController = new AgentController(registry, router);
        this.healthController = new HealthController(registry, taskManager);
        this.statsController = new StatsController(registry, taskManager);

        // Controllers (internal API)
        this.agentRegistrationController = new AgentRegistrationController(registry);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies backed by the in-process simulated invoker.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, null, Clock.systemUTC());
    }

    /**
     * Create dependencies with a caller-owned invoker (a real transport, or a test fake).
     */
    public static Dependencies create(CoordinatorConfig config, AgentInvoker invoker) {
        return new Dependencies(config, invoker, Clock.systemUTC());
    }

    public static Dependencies create(CoordinatorConfig config, AgentInvoker invoker, Clock clock) {
        return new Dependencies(config, invoker, clock);
    }

    /**
     * Start the task manager loop, periodic health probes and, when
     * configured, the simulated agents.
     */
    public void start() {
        if (config.simulatedAgents() > 0) {
            simulationService.start(config.simulatedAgents(), config.simulatedCapabilities());
        }
        taskManager.start();
        healthMonitor.start();
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public AgentInvoker invoker() {
        return invoker;
    }

    public CapabilityRegistry registry() {
        return registry;
    }

    public CapabilityRouter router() {
        return router;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public TaskManager taskManager() {
        return taskManager;
    }

    public SimulationService simulationService() {
        return simulationService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * The events controller goes before the task controller so the more
     * specific path wins.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(statsController)
                    .registerController(taskEventsController)
                    .registerController(taskController)
                    .registerController(agentController)
                    .registerController(agentRegistrationController);
            log.info("RouterHandler created with {} controllers", 6);
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        simulationService.stop();
        healthMonitor.close();
        taskManager.close();
        if (ownedInvoker != null) {
            ownedInvoker.close();
        }
        eventLog.close();
        eventBus.close();
        log.info("Dependencies closed");
    }
}
