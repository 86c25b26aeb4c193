package agentswarm.coordinator.api.v1;

import agentswarm.coordinator.api.Controller;
import agentswarm.coordinator.api.v1.dto.HealthResponse;
import agentswarm.coordinator.scheduler.Reaper;
import agentswarm.coordinator.server.RouterHandler;
import agentswarm.coordinator.service.SessionOrchestrator;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final String VERSION = "1.0.0";

    private final SessionOrchestrator orchestrator;
    private final Reaper reaper;

    public HealthController(SessionOrchestrator orchestrator, Reaper reaper) {
        this.orchestrator = orchestrator;
        this.reaper = reaper;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (!orchestrator.isRegistryHealthy()) {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("unreachable")));
        }
        HealthResponse response = HealthResponse.healthy(reaper.isRunning(), formatUptime(), VERSION);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
