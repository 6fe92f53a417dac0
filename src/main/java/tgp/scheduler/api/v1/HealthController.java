package tgp.scheduler.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import tgp.scheduler.api.Controller;
import tgp.scheduler.api.v1.dto.HealthResponse;
import tgp.scheduler.model.ClusterStatus;
import tgp.scheduler.server.RouterHandler;
import tgp.scheduler.service.SchedulerService;
import tgp.scheduler.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "0.1.0";

    private final Database database;
    private final SchedulerService schedulerService;

    public HealthController(Database database, SchedulerService schedulerService) {
        this.database = database;
        this.schedulerService = schedulerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unavailable("connection failed");
            }

            ClusterStatus status = schedulerService.clusterStatus();
            HealthResponse response = HealthResponse.healthy(formatUptime(), VERSION, status.activeNodes(),
                    status.totalJobs(), status.runningJobs());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("Health check failed", e);
            return unavailable(e.getMessage());
        }
    }

    private static ControllerResponse unavailable(String reason) {
        try {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(reason)));
        } catch (JsonProcessingException e) {
            return ControllerResponse.errorJson(HttpResponseStatus.SERVICE_UNAVAILABLE, reason);
        }
    }

    private static String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
