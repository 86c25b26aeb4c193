package agentswarm.coordinator.server;

import agentswarm.cloud.ProvisionerException;
import agentswarm.coordinator.api.Controller;
import agentswarm.coordinator.api.Controller.ControllerResponse;
import agentswarm.coordinator.config.CoordinatorConfig;
import agentswarm.coordinator.registry.RegistryUnavailableException;
import agentswarm.coordinator.service.SessionNotFoundException;
import agentswarm.coordinator.service.SessionTimeoutException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles /api/v1/* endpoints; everything else returns 404.
 * When an API key is configured every request must carry it in X-Swarm-Key.
 *
 * Exceptions from controllers map onto status codes:
 * IllegalArgumentException 400, SessionNotFoundException 404, ProvisionerException 502,
 * RegistryUnavailableException 503, SessionTimeoutException 504, anything else 500.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    public static final String API_KEY_HEADER = "X-Swarm-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final CoordinatorConfig config;

    public RouterHandler(CoordinatorConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req)) {
                log.warn("Auth failed for {} {}", method, path);
                writeSafe(ctx, FORBIDDEN, "application/json", "{\"error\":\"forbidden\"}");
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            writeError(ctx, BAD_REQUEST, e.getMessage());
        } catch (SessionNotFoundException e) {
            writeError(ctx, NOT_FOUND, e.getMessage());
        } catch (ProvisionerException e) {
            log.warn("Provisioner error on {} {}: {}", method, path, e.getMessage());
            writeError(ctx, BAD_GATEWAY, e.getMessage());
        } catch (RegistryUnavailableException e) {
            log.warn("Registry unavailable on {} {}: {}", method, path, e.getMessage());
            writeError(ctx, SERVICE_UNAVAILABLE, "registry unavailable");
        } catch (SessionTimeoutException e) {
            writeError(ctx, GATEWAY_TIMEOUT, e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            writeError(ctx, INTERNAL_SERVER_ERROR, "internal error");
        }
    }

    /**
     * Check if request passes auth. No key configured means open access.
     */
    private boolean checkAuth(FullHttpRequest req) {
        if (!config.hasApiKey()) {
            return true;
        }
        String providedKey = req.headers().get(API_KEY_HEADER);
        return config.apiKey().equals(providedKey);
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        writeSafe(ctx, status, "application/json",
                "{\"error\":\"" + ControllerResponse.escapeJson(message) + "\"}");
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Exception e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeError(ctx, INTERNAL_SERVER_ERROR, "channel error");
        } finally {
            ctx.close();
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
