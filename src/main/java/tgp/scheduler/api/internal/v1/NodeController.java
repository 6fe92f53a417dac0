package tgp.scheduler.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import tgp.scheduler.api.Controller;
import tgp.scheduler.api.internal.v1.dto.HeartbeatRequest;
import tgp.scheduler.api.internal.v1.dto.OperationResponse;
import tgp.scheduler.api.internal.v1.dto.RegisterNodeRequest;
import tgp.scheduler.api.internal.v1.dto.RegisterNodeResponse;
import tgp.scheduler.config.SchedulerConfig;
import tgp.scheduler.exception.UnknownNodeException;
import tgp.scheduler.server.RouterHandler;
import tgp.scheduler.service.SchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Controller for node registration and liveness (internal API).
 * POST /internal/v1/nodes/register - Register or refresh a node
 * POST /internal/v1/heartbeat - Node heartbeat; 404 tells the worker to register again
 */
public class NodeController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(NodeController.class);

    private static final String REGISTER_PATH = "/internal/v1/nodes/register";
    private static final String HEARTBEAT_PATH = "/internal/v1/heartbeat";

    private final SchedulerService schedulerService;
    private final SchedulerConfig config;

    public NodeController(SchedulerService schedulerService, SchedulerConfig config) {
        this.schedulerService = schedulerService;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && (REGISTER_PATH.equals(path) || HEARTBEAT_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            if (REGISTER_PATH.equals(path)) {
                return handleRegister(ctx, body);
            }
            return handleHeartbeat(body);
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (UnknownNodeException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (Exception e) {
            log.error("Node controller error on {}", path, e);
            return ControllerResponse.error("internal error: " + e.getClass().getSimpleName());
        }
    }

    private ControllerResponse handleRegister(ChannelHandlerContext ctx, String body) throws Exception {
        RegisterNodeRequest request = RouterHandler.mapper().readValue(body, RegisterNodeRequest.class);
        request.validate();

        String nodeId = schedulerService.registerNode(request.toSpec(clientHost(ctx)));

        RegisterNodeResponse response = new RegisterNodeResponse(nodeId, config.heartbeatTimeout().toSeconds());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleHeartbeat(String body) throws Exception {
        HeartbeatRequest request = RouterHandler.mapper().readValue(body, HeartbeatRequest.class);
        request.validate();

        if (!schedulerService.heartbeat(request.nodeId(), request.reportedFree())) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.error("unknown node")));
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
    }

    private static String clientHost(ChannelHandlerContext ctx) {
        SocketAddress address = ctx.channel().remoteAddress();
        if (address instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return null;
    }
}
