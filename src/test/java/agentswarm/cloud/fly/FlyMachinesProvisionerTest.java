package agentswarm.cloud.fly;

import agentswarm.cloud.ProvisionResult;
import agentswarm.cloud.ProvisionerFailure;
import agentswarm.cloud.ResourceConfig;
import agentswarm.cloud.ResourceFilter;
import agentswarm.coordinator.model.Resource;
import agentswarm.coordinator.model.ResourceState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Fly Machines provisioner against a local stub of the API.
 */
class FlyMachinesProvisionerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private boolean serverStopped;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private volatile int status = 200;
    private volatile String responseBody = "{}";
    private volatile String lastBody;
    private volatile String lastAuth;
    private FlyMachinesProvisioner provisioner;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        provisioner = new FlyMachinesProvisioner(
                "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/",
                "agents", "secret-token", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (!serverStopped) {
            server.stop(0);
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI());
        lastAuth = exchange.getRequestHeaders().getFirst("Authorization");
        lastBody = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void createSendsMachineConfig() throws Exception {
        responseBody = "{\"id\":\"m-1\",\"name\":\"agent-session-s1\",\"state\":\"created\"}";
        ResourceConfig config = ResourceConfig.builder()
                .image("registry.fly.io/agent:1")
                .stopTimeout(Duration.ofSeconds(30))
                .guest("shared", 2, 2048)
                .env("SESSION_ID", "s1")
                .build();

        ProvisionResult<Resource> result = provisioner.create("agent-session-s1", config);

        assertTrue(result.isSuccess());
        assertEquals(new Resource("m-1", "agent-session-s1", ResourceState.CREATED), result.value());
        assertEquals("POST /v1/apps/agents/machines", requests.get(0));
        assertEquals("Bearer secret-token", lastAuth);

        JsonNode body = MAPPER.readTree(lastBody);
        assertEquals("agent-session-s1", body.get("name").asText());
        JsonNode machine = body.get("config");
        assertEquals("registry.fly.io/agent:1", machine.get("image").asText());
        assertTrue(machine.get("auto_destroy").asBoolean());
        assertEquals("no", machine.get("restart").get("policy").asText());
        assertEquals("30s", machine.get("stop_config").get("timeout").asText());
        assertEquals("SIGTERM", machine.get("stop_config").get("signal").asText());
        assertEquals(2048, machine.get("guest").get("memory_mb").asInt());
        assertEquals("s1", machine.get("env").get("SESSION_ID").asText());
    }

    @Test
    void listFiltersClientSide() {
        responseBody = """
                [
                  {"id":"m-1","name":"agent-session-a","state":"started"},
                  {"id":"m-2","name":"agent-session-b","state":"stopped"},
                  {"id":"m-3","name":"web","state":"started"},
                  {"id":"m-4","name":"agent-session-c","state":"hibernating"}
                ]
                """;

        List<Resource> live = provisioner.list(ResourceFilter.live()).value();

        assertEquals(List.of("m-1", "m-3"), live.stream().map(Resource::id).toList());

        List<Resource> named = provisioner.list(ResourceFilter.named("agent-session-c")).value();
        assertEquals(ResourceState.UNKNOWN, named.get(0).state());
    }

    @Test
    void stopAndDestroyUseMachineEndpoints() {
        assertTrue(provisioner.stop("m-1").isSuccess());
        assertTrue(provisioner.destroy("m-1").isSuccess());

        assertEquals(List.of(
                "POST /v1/apps/agents/machines/m-1/stop",
                "DELETE /v1/apps/agents/machines/m-1?force=true"), requests);
    }

    @Test
    void statusCodesMapToFailureKinds() {
        status = 404;
        responseBody = "{\"error\":\"machine not found\"}";
        ProvisionResult<Void> missing = provisioner.stop("m-9");
        assertEquals(ProvisionerFailure.Kind.NOT_FOUND, missing.failure().kind());
        assertTrue(missing.isSuccessOrGone());

        status = 409;
        assertEquals(ProvisionerFailure.Kind.CONFLICT,
                provisioner.create("agent-session-s1",
                        ResourceConfig.builder().image("img").build()).failure().kind());

        status = 503;
        assertTrue(provisioner.list(ResourceFilter.live()).failure().isRetryable());

        status = 422;
        ProvisionResult<Void> invalid = provisioner.destroy("m-1");
        assertEquals(ProvisionerFailure.Kind.FATAL, invalid.failure().kind());
        assertEquals(422, invalid.failure().status());
    }

    @Test
    void unreachableApiIsRetryable() {
        server.stop(0);
        serverStopped = true;

        ProvisionResult<Void> result = provisioner.stop("m-1");

        assertTrue(result.failure().isRetryable());
        assertEquals(0, result.failure().status());
    }

    @Test
    void missingCredentialsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new FlyMachinesProvisioner("https://api.machines.dev/v1", "agents", " ", Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new FlyMachinesProvisioner("https://api.machines.dev/v1", null, "t", Duration.ofSeconds(1)));
    }
}
