package tgp.scheduler.api.internal.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import tgp.scheduler.model.ExecutionOutcome;
import tgp.scheduler.model.ExecutionReport;
import tgp.scheduler.model.NodeSpec;
import tgp.scheduler.model.ReportResult;
import tgp.scheduler.model.Resources;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InternalDtoTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void registerNodeRequestDeserialization() throws Exception {
        String json = """
                {
                  "nodeId": "gpu-01",
                  "location": "eu-west",
                  "cpuCores": 32,
                  "memoryGb": 128,
                  "gpuCount": 4,
                  "pricePerHour": 2.5,
                  "idleCostPerHour": 0.8,
                  "onPremise": true
                }
                """;

        RegisterNodeRequest req = mapper.readValue(json, RegisterNodeRequest.class);
        assertDoesNotThrow(req::validate);

        NodeSpec spec = req.toSpec("10.0.0.7");
        assertEquals("gpu-01", spec.id());
        assertEquals("10.0.0.7", spec.hostname());
        assertEquals(Resources.of(32, 128, 4), spec.capacity());
        assertEquals(0.0, spec.transferPricePerGb());
        assertEquals(0.8, spec.idleCostPerHour());
        assertTrue(spec.onPremise());
    }

    @Test
    void registerNodeRequestValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new RegisterNodeRequest("", null, null, 4, 8, 0, 0.1, null, null, false).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new RegisterNodeRequest("n", null, null, 0, 8, 0, 0.1, null, null, false).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new RegisterNodeRequest("n", null, null, 4, 8, 0, -0.1, null, null, false).validate());
    }

    @Test
    void heartbeatRequestFreeCapacity() throws Exception {
        HeartbeatRequest withFree = mapper.readValue(
                "{\"nodeId\":\"n1\",\"freeCpuCores\":3,\"freeMemoryGb\":10}", HeartbeatRequest.class);
        assertDoesNotThrow(withFree::validate);
        assertEquals(Resources.of(3, 10, 0), withFree.reportedFree());

        HeartbeatRequest bare = mapper.readValue("{\"nodeId\":\"n1\"}", HeartbeatRequest.class);
        assertNull(bare.reportedFree());

        assertThrows(IllegalArgumentException.class, () -> new HeartbeatRequest("", null, null, null).validate());
        assertThrows(IllegalArgumentException.class, () -> new HeartbeatRequest("n1", -1, null, null).validate());
    }

    @Test
    void claimDispatchesRequestValidation() {
        assertDoesNotThrow(new ClaimDispatchesRequest("n1", 4)::validate);
        assertThrows(IllegalArgumentException.class, () -> new ClaimDispatchesRequest("n1", 0).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new ClaimDispatchesRequest("n1", ClaimDispatchesRequest.MAX_PER_CLAIM + 1).validate());
        assertThrows(IllegalArgumentException.class, () -> new ClaimDispatchesRequest(null, 1).validate());
    }

    @Test
    void jobReportRequestToReport() throws Exception {
        JobReportRequest req = mapper.readValue("{\"nodeId\":\"n1\",\"exitCode\":0,\"output\":\"hello\"}",
                JobReportRequest.class);
        req.validate();

        ExecutionReport report = req.toReport("job-1", ExecutionOutcome.COMPLETED);
        assertEquals("job-1", report.jobId());
        assertEquals("n1", report.nodeId());
        assertEquals(0, report.exitCode());
        assertEquals("hello", report.output());

        assertThrows(IllegalArgumentException.class, () -> new JobReportRequest(" ", null, null, null).validate());
    }

    @Test
    void operationResponseOkness() {
        assertTrue(OperationResponse.of(ReportResult.APPLIED).ok());
        assertTrue(OperationResponse.of(ReportResult.ALREADY_TERMINAL).ok());
        assertFalse(OperationResponse.of(ReportResult.WRONG_NODE).ok());
        assertFalse(OperationResponse.error("boom").ok());
    }
}
