package agentswarm.coordinator.api.v1;

import agentswarm.coordinator.api.Controller;
import agentswarm.coordinator.api.v1.dto.CreateSessionRequest;
import agentswarm.coordinator.api.v1.dto.OperationResponse;
import agentswarm.coordinator.model.SessionInfo;
import agentswarm.coordinator.model.SessionMapping;
import agentswarm.coordinator.server.RouterHandler;
import agentswarm.coordinator.service.SessionOrchestrator;
import agentswarm.coordinator.service.SessionRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for session lifecycle (public API).
 *
 * POST /api/v1/sessions - Create or join a session
 * GET /api/v1/sessions/{id} - Get session status
 * DELETE /api/v1/sessions/{id} - Destroy a session
 */
public class SessionController implements Controller {

    private static final Pattern SESSIONS_PATTERN = Pattern.compile("^/api/v1/sessions$");
    private static final Pattern SESSION_BY_ID_PATTERN = Pattern.compile("^/api/v1/sessions/([^/]+)$");

    private final SessionOrchestrator orchestrator;
    private final Clock clock;

    public SessionController(SessionOrchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return SESSIONS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE)) {
            return SESSION_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.POST)) {
            return handleCreate(req);
        }

        Matcher matcher = SESSION_BY_ID_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown session endpoint");
        }
        String sessionId = matcher.group(1);

        if (req.method().equals(HttpMethod.DELETE)) {
            boolean destroyed = orchestrator.destroySession(sessionId);
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(OperationResponse.destroyed(destroyed)));
        }

        SessionInfo info = orchestrator.getSessionStatus(sessionId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(info));
    }

    /**
     * POST /api/v1/sessions - Create or join a session
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateSessionRequest request;
        try {
            request = RouterHandler.mapper().readValue(body, CreateSessionRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("request body must be a JSON object with a prompt", e);
        }
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }

        // Validate
        request.validate();

        SessionMapping mapping = orchestrator.getOrCreateSession(
                request.sessionIdOr(clock.millis()),
                new SessionRequest(request.prompt(), request.env()));

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(mapping));
    }
}
