package agentswarm.cloud.fly;

import agentswarm.cloud.ProvisionResult;
import agentswarm.cloud.ProvisionerFailure;
import agentswarm.cloud.ResourceConfig;
import agentswarm.cloud.ResourceFilter;
import agentswarm.cloud.ResourceProvisioner;
import agentswarm.coordinator.config.CoordinatorConfig;
import agentswarm.coordinator.model.Resource;
import agentswarm.coordinator.model.ResourceState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Provisioner backed by the Fly Machines REST API.
 *
 * POST   /apps/{app}/machines             - create
 * GET    /apps/{app}/machines             - list (filtered client-side)
 * POST   /apps/{app}/machines/{id}/stop   - stop
 * DELETE /apps/{app}/machines/{id}?force=true - destroy
 */
public class FlyMachinesProvisioner implements ResourceProvisioner {

    private static final Logger log = LoggerFactory.getLogger(FlyMachinesProvisioner.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String appName;
    private final String apiToken;
    private final Duration requestTimeout;
    private final HttpClient http;

    public FlyMachinesProvisioner(String baseUrl, String appName, String apiToken, Duration requestTimeout) {
        this(baseUrl, appName, apiToken, requestTimeout, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    public FlyMachinesProvisioner(String baseUrl, String appName, String apiToken, Duration requestTimeout,
            HttpClient http) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl is required"));
        this.appName = requireText(appName, "Fly app name (FLY_APP_NAME)");
        this.apiToken = requireText(apiToken, "Fly API token (FLY_API_TOKEN)");
        this.requestTimeout = requestTimeout;
        this.http = http;
    }

    public static FlyMachinesProvisioner fromConfig(CoordinatorConfig config) {
        return new FlyMachinesProvisioner(
                config.flyApiBaseUrl(),
                config.flyAppName(),
                config.flyApiToken(),
                config.provisionerRequestTimeout());
    }

    @Override
    public ProvisionResult<Resource> create(String name, ResourceConfig config) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("name", name);

        ObjectNode machine = body.putObject("config");
        machine.put("image", config.image());
        machine.put("auto_destroy", config.autoDestroy());
        machine.putObject("restart").put("policy", "no");

        ObjectNode stopConfig = machine.putObject("stop_config");
        stopConfig.put("timeout", config.stopTimeout().toSeconds() + "s");
        stopConfig.put("signal", config.stopSignal());

        ObjectNode guest = machine.putObject("guest");
        guest.put("cpu_kind", config.cpuKind());
        guest.put("cpus", config.cpus());
        guest.put("memory_mb", config.memoryMb());

        ObjectNode env = machine.putObject("env");
        config.env().forEach(env::put);

        if (config.idleStopTimeout() != null) {
            machine.putObject("metadata").put("idle_stop_timeout", config.idleStopTimeout().toSeconds() + "s");
        }

        HttpRequest request;
        try {
            request = baseRequest(machinesPath())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            return ProvisionResult.failure(new ProvisionerFailure(
                    ProvisionerFailure.Kind.FATAL, "create", name, 0, "cannot encode request: " + e.getMessage()));
        }

        ProvisionResult<JsonNode> response = send("create", name, request);
        if (!response.isSuccess()) {
            return ProvisionResult.failure(response.failure());
        }
        Resource resource = toResource(response.value());
        log.info("Created machine {} ({}) state={}", resource.id(), resource.name(), resource.state().wire());
        return ProvisionResult.success(resource);
    }

    @Override
    public ProvisionResult<List<Resource>> list(ResourceFilter filter) {
        HttpRequest request = baseRequest(machinesPath()).GET().build();

        ProvisionResult<JsonNode> response = send("list", null, request);
        if (!response.isSuccess()) {
            return ProvisionResult.failure(response.failure());
        }

        List<Resource> resources = new ArrayList<>();
        JsonNode array = response.value();
        if (array != null && array.isArray()) {
            for (JsonNode node : array) {
                if (!node.hasNonNull("id")) {
                    continue;
                }
                Resource resource = toResource(node);
                if (filter == null || filter.matches(resource)) {
                    resources.add(resource);
                }
            }
        }
        return ProvisionResult.success(resources);
    }

    @Override
    public ProvisionResult<Void> stop(String resourceId) {
        HttpRequest request = baseRequest(machinesPath() + "/" + encode(resourceId) + "/stop")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build();

        ProvisionResult<JsonNode> response = send("stop", resourceId, request);
        return response.isSuccess() ? ProvisionResult.done() : ProvisionResult.failure(response.failure());
    }

    @Override
    public ProvisionResult<Void> destroy(String resourceId) {
        HttpRequest request = baseRequest(machinesPath() + "/" + encode(resourceId) + "?force=true")
                .DELETE()
                .build();

        ProvisionResult<JsonNode> response = send("destroy", resourceId, request);
        return response.isSuccess() ? ProvisionResult.done() : ProvisionResult.failure(response.failure());
    }

    private ProvisionResult<JsonNode> send(String operation, String resourceId, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("Fly {} request failed{}: {}", operation, resourceId != null ? " for " + resourceId : "",
                    e.toString());
            return ProvisionResult.failure(ProvisionerFailure.retryable(operation, resourceId, e.toString()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProvisionResult.failure(ProvisionerFailure.retryable(operation, resourceId, "interrupted"));
        }

        int status = response.statusCode();
        String body = response.body() == null ? "" : response.body();
        if (status < 200 || status >= 300) {
            ProvisionerFailure failure = new ProvisionerFailure(
                    ProvisionerFailure.classify(status), operation, resourceId, status, abbreviate(body));
            log.debug("Fly {} rejected: {}", operation, failure);
            return ProvisionResult.failure(failure);
        }

        if (body.isBlank()) {
            return ProvisionResult.success(null);
        }
        try {
            return ProvisionResult.success(MAPPER.readTree(body));
        } catch (JsonProcessingException e) {
            return ProvisionResult.failure(new ProvisionerFailure(ProvisionerFailure.Kind.RETRYABLE,
                    operation, resourceId, status, "unparseable response: " + abbreviate(body)));
        }
    }

    private HttpRequest.Builder baseRequest(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + apiToken);
    }

    private String machinesPath() {
        return "/apps/" + encode(appName) + "/machines";
    }

    static Resource toResource(JsonNode node) {
        return new Resource(
                node.path("id").asText(),
                node.path("name").asText(""),
                ResourceState.fromWire(node.path("state").asText(null)));
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " is required");
        }
        return value;
    }

    private static String abbreviate(String body) {
        return body.length() <= 300 ? body : body.substring(0, 297) + "...";
    }
}
