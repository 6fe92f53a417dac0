package tgp.scheduler.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import tgp.scheduler.api.Controller;
import tgp.scheduler.api.v1.dto.ClusterStatusResponse;
import tgp.scheduler.api.v1.dto.NodeResponse;
import tgp.scheduler.server.RouterHandler;
import tgp.scheduler.service.SchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Controller for cluster views (public API).
 *
 * GET /api/v1/cluster/status - Node and job counters
 * GET /api/v1/cluster/nodes - All known nodes
 */
public class ClusterController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ClusterController.class);

    private static final String STATUS_PATH = "/api/v1/cluster/status";
    private static final String NODES_PATH = "/api/v1/cluster/nodes";

    private final SchedulerService schedulerService;

    public ClusterController(SchedulerService schedulerService) {
        this.schedulerService = schedulerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && (STATUS_PATH.equals(path) || NODES_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (STATUS_PATH.equals(path)) {
                ClusterStatusResponse response = ClusterStatusResponse.from(schedulerService.clusterStatus());
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
            }

            List<NodeResponse> nodes = schedulerService.listNodes().stream().map(NodeResponse::from).toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("nodes", nodes, "count", nodes.size())));
        } catch (Exception e) {
            log.error("Cluster controller error on {}", path, e);
            return ControllerResponse.error("internal error: " + e.getClass().getSimpleName());
        }
    }
}
