package tgp.scheduler.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import tgp.scheduler.api.Controller;
import tgp.scheduler.api.internal.v1.dto.ClaimDispatchesRequest;
import tgp.scheduler.api.internal.v1.dto.ClaimDispatchesResponse;
import tgp.scheduler.api.internal.v1.dto.JobReportRequest;
import tgp.scheduler.api.internal.v1.dto.OperationResponse;
import tgp.scheduler.exception.UnknownNodeException;
import tgp.scheduler.executor.Dispatch;
import tgp.scheduler.executor.QueueingJobExecutor;
import tgp.scheduler.model.ExecutionOutcome;
import tgp.scheduler.model.ReportResult;
import tgp.scheduler.server.RouterHandler;
import tgp.scheduler.service.SchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the worker side of execution (internal API).
 * POST /internal/v1/dispatches/claim - Pull jobs dispatched to a node
 * POST /internal/v1/jobs/{jobId}/started - Report the container started
 * POST /internal/v1/jobs/{jobId}/complete - Report success (idempotent)
 * POST /internal/v1/jobs/{jobId}/fail - Report failure (idempotent)
 */
public class DispatchController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    private static final Pattern CLAIM_PATTERN = Pattern.compile("^/internal/v1/dispatches/claim$");
    private static final Pattern REPORT_PATTERN = Pattern
            .compile("^/internal/v1/jobs/([^/]+)/(started|complete|fail)$");

    private final SchedulerService schedulerService;
    private final QueueingJobExecutor executor;

    public DispatchController(SchedulerService schedulerService, QueueingJobExecutor executor) {
        this.schedulerService = schedulerService;
        this.executor = executor;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return CLAIM_PATTERN.matcher(path).matches() || REPORT_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);

            if (CLAIM_PATTERN.matcher(path).matches()) {
                return handleClaim(body);
            }

            Matcher reportMatcher = REPORT_PATTERN.matcher(path);
            if (reportMatcher.matches()) {
                return handleReport(body, reportMatcher.group(1), outcomeOf(reportMatcher.group(2)));
            }

            return ControllerResponse.notFound("unknown dispatch endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (UnknownNodeException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (Exception e) {
            log.error("Dispatch controller error on {}", path, e);
            return ControllerResponse.error("internal error: " + e.getClass().getSimpleName());
        }
    }

    private ControllerResponse handleClaim(String body) throws Exception {
        ClaimDispatchesRequest request = RouterHandler.mapper().readValue(body, ClaimDispatchesRequest.class);
        request.validate();

        List<Dispatch> claimed = executor.claim(request.nodeId(), request.maxJobs());
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(new ClaimDispatchesResponse(claimed)));
    }

    private ControllerResponse handleReport(String body, String jobId, ExecutionOutcome outcome) throws Exception {
        JobReportRequest request = RouterHandler.mapper().readValue(body, JobReportRequest.class);
        request.validate();

        ReportResult result = schedulerService.reportNodeResult(request.toReport(jobId, outcome));
        String json = RouterHandler.mapper().writeValueAsString(OperationResponse.of(result));

        return switch (result) {
            case APPLIED, ALREADY_TERMINAL -> ControllerResponse.json(json);
            case NOT_FOUND -> ControllerResponse.json(HttpResponseStatus.NOT_FOUND, json);
            case WRONG_NODE, INVALID_TRANSITION -> ControllerResponse.json(HttpResponseStatus.CONFLICT, json);
        };
    }

    private static ExecutionOutcome outcomeOf(String action) {
        return switch (action) {
            case "started" -> ExecutionOutcome.STARTED;
            case "complete" -> ExecutionOutcome.COMPLETED;
            case "fail" -> ExecutionOutcome.FAILED;
            default -> throw new IllegalArgumentException("unknown report action: " + action);
        };
    }
}
