package agentmesh.coordinator.api.v1;

import agentmesh.coordinator.api.Controller;
import agentmesh.coordinator.api.v1.dto.AddDependencyRequest;
import agentmesh.coordinator.api.v1.dto.CancelResponse;
import agentmesh.coordinator.api.v1.dto.CreateTaskRequest;
import agentmesh.coordinator.api.v1.dto.CreateTaskResponse;
import agentmesh.coordinator.api.v1.dto.TaskResponse;
import agentmesh.coordinator.model.CancelResult;
import agentmesh.coordinator.model.Task;
import agentmesh.coordinator.model.TaskState;
import agentmesh.coordinator.scheduler.TaskManager;
import agentmesh.coordinator.server.RouterHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task submission and inspection (public API).
 *
 * POST /api/v1/tasks - Submit a task
 * GET  /api/v1/tasks?contextId=..|state=.. - List tasks
 * GET  /api/v1/tasks/{taskId} - Get task
 * POST /api/v1/tasks/{taskId}/cancel - Cancel task and its pending dependents
 * POST /api/v1/tasks/{taskId}/dependencies - Add a dependency to a pending task
 * DELETE /api/v1/tasks/{taskId}/dependencies/{dependencyId} - Drop a dependency from a pending task
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern CANCEL_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/cancel$");
    private static final Pattern DEPENDENCIES_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/dependencies$");
    private static final Pattern DEPENDENCY_PATTERN =
            Pattern.compile("^/api/v1/tasks/([^/]+)/dependencies/([^/]+)$");

    private final TaskManager taskManager;

    public TaskController(TaskManager taskManager) {
        this.taskManager = taskManager;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches()
                    || CANCEL_PATTERN.matcher(path).matches()
                    || DEPENDENCIES_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASKS_PATTERN.matcher(path).matches() || TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return DEPENDENCY_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            boolean post = req.method().equals(HttpMethod.POST);

            if (TASKS_PATTERN.matcher(path).matches()) {
                return post ? handleCreate(req) : handleList(req);
            }

            Matcher cancel = CANCEL_PATTERN.matcher(path);
            if (post && cancel.matches()) {
                return handleCancel(cancel.group(1));
            }

            Matcher deps = DEPENDENCIES_PATTERN.matcher(path);
            if (post && deps.matches()) {
                return handleAddDependency(deps.group(1), req);
            }

            Matcher dep = DEPENDENCY_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.DELETE) && dep.matches()) {
                Task task = taskManager.removeDependency(dep.group(1), dep.group(2));
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
            }

            Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                Task task = taskManager.getTask(byId.group(1));
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (JsonProcessingException e) {
            log.debug("Malformed JSON on {}: {}", path, e.getOriginalMessage());
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * POST /api/v1/tasks
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateTaskRequest request = RouterHandler.mapper().readValue(body, CreateTaskRequest.class);
        if (request == null) {
            return ControllerResponse.badRequest("request body is required");
        }
        request.validate();

        String taskId = taskManager.createTask(request.toTaskRequest());
        Task task = taskManager.getTask(taskId);

        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(new CreateTaskResponse(taskId, task.state())));
    }

    /**
     * GET /api/v1/tasks?contextId=... or ?state=...
     */
    private ControllerResponse handleList(FullHttpRequest req) throws JsonProcessingException {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        String contextId = first(params, "contextId");
        String state = first(params, "state");

        List<Task> tasks;
        if (contextId != null) {
            tasks = taskManager.findByContext(contextId);
            if (state != null) {
                TaskState wanted = parseState(state);
                tasks = tasks.stream().filter(t -> t.state() == wanted).toList();
            }
        } else if (state != null) {
            tasks = taskManager.findByState(parseState(state));
        } else {
            return ControllerResponse.badRequest("contextId or state query parameter is required");
        }

        List<TaskResponse> items = tasks.stream().map(TaskResponse::from).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("count", items.size(), "tasks", items)));
    }

    /**
     * POST /api/v1/tasks/{taskId}/cancel
     */
    private ControllerResponse handleCancel(String taskId) throws JsonProcessingException {
        CancelResult result = taskManager.cancelTask(taskId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(new CancelResponse(taskId, result)));
    }

    /**
     * POST /api/v1/tasks/{taskId}/dependencies
     */
    private ControllerResponse handleAddDependency(String taskId, FullHttpRequest req)
            throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        AddDependencyRequest request = RouterHandler.mapper().readValue(body, AddDependencyRequest.class);
        if (request == null) {
            return ControllerResponse.badRequest("request body is required");
        }
        request.validate();

        Task task = taskManager.addDependency(taskId, request.dependsOn());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }

    private static TaskState parseState(String value) {
        try {
            return TaskState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown state: " + value);
        }
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
