package tgp.scheduler.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import tgp.scheduler.api.Controller;
import tgp.scheduler.api.v1.dto.JobResponse;
import tgp.scheduler.api.v1.dto.SubmitJobRequest;
import tgp.scheduler.api.v1.dto.SubmitJobResponse;
import tgp.scheduler.exception.DuplicateJobException;
import tgp.scheduler.exception.InvalidCostInputException;
import tgp.scheduler.model.CostBreakdown;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.SubmissionResult;
import tgp.scheduler.server.RouterHandler;
import tgp.scheduler.service.SchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for jobs (public API).
 *
 * POST /api/v1/jobs - Submit a job
 * GET /api/v1/jobs?limit=N - Recent jobs
 * GET /api/v1/jobs/{jobId} - Job status
 * GET /api/v1/jobs/{jobId}/cost - Cost breakdown of the placement
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_COST_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/cost$");

    private static final int DEFAULT_LIMIT = 100;

    private final SchedulerService schedulerService;

    public JobController(SchedulerService schedulerService) {
        this.schedulerService = schedulerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (method.equals(HttpMethod.GET)) {
            return JOB_BY_ID_PATTERN.matcher(path).matches() || JOB_COST_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (JOBS_PATTERN.matcher(path).matches()) {
                return req.method().equals(HttpMethod.POST) ? handleSubmit(req) : handleList(req);
            }

            Matcher costMatcher = JOB_COST_PATTERN.matcher(path);
            if (costMatcher.matches()) {
                return handleGetCost(costMatcher.group(1));
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (jobMatcher.matches()) {
                return handleGetJob(jobMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException | InvalidCostInputException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (DuplicateJobException e) {
            return ControllerResponse.conflict(e.getMessage());
        } catch (Exception e) {
            log.error("Job controller error on {}", path, e);
            return ControllerResponse.error("internal error: " + e.getClass().getSimpleName());
        }
    }

    /**
     * POST /api/v1/jobs
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SubmitJobRequest request = RouterHandler.mapper().readValue(body, SubmitJobRequest.class);
        request.validate();

        Job job = request.toJob(schedulerService.generateJobId());
        SubmissionResult result = schedulerService.submit(job);

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(SubmitJobResponse.from(result)));
    }

    /**
     * GET /api/v1/jobs
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        int limit = DEFAULT_LIMIT;
        List<String> limitParam = query.parameters().get("limit");
        if (limitParam != null && !limitParam.isEmpty()) {
            try {
                limit = Integer.parseInt(limitParam.get(0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be an integer");
            }
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
        }

        List<JobResponse> jobs = schedulerService.listJobs(limit).stream().map(JobResponse::from).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("jobs", jobs, "count", jobs.size())));
    }

    /**
     * GET /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleGetJob(String jobId) throws Exception {
        Optional<Job> job = schedulerService.getStatus(jobId);
        if (job.isEmpty()) {
            return ControllerResponse.notFound("job not found: " + jobId);
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResponse.from(job.get())));
    }

    /**
     * GET /api/v1/jobs/{jobId}/cost
     */
    private ControllerResponse handleGetCost(String jobId) throws Exception {
        Optional<CostBreakdown> cost = schedulerService.getCost(jobId);
        if (cost.isEmpty()) {
            return ControllerResponse.notFound("no cost for job: " + jobId);
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(cost.get()));
    }
}
