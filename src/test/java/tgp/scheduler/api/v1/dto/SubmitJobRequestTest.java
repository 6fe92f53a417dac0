package tgp.scheduler.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.JobType;
import tgp.scheduler.model.Resources;
import tgp.scheduler.server.RouterHandler;
import org.junit.jupiter.api.*;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SubmitJobRequestTest {

    private final ObjectMapper mapper = RouterHandler.mapper();

    @Test
    void deserializationAndConversion() throws Exception {
        String json = """
                {
                  "jobId": "train-42",
                  "type": "TRAINING",
                  "cpu": 4,
                  "memoryGb": 16,
                  "gpuCount": 1,
                  "budgetUsd": 12.5,
                  "maxLatencyMs": 250,
                  "deadline": "2026-01-02T00:00:00Z",
                  "estimatedDurationHours": 3.0,
                  "estimatedDataGb": 40,
                  "preferredZone": "zone-b",
                  "image": "pytorch/pytorch:2.3",
                  "command": "python train.py"
                }
                """;

        SubmitJobRequest req = mapper.readValue(json, SubmitJobRequest.class);
        assertDoesNotThrow(req::validate);

        Job job = req.toJob("ignored");
        assertEquals("train-42", job.id());
        assertEquals(JobType.TRAINING, job.type());
        assertEquals(Resources.of(4, 16, 1), job.resources());
        assertEquals(12.5, job.sla().budgetUsd());
        assertEquals(250, job.sla().maxLatencyMs());
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), job.sla().deadline());
        assertEquals(3.0, job.estimatedDurationHours());
        assertEquals(40.0, job.estimatedDataGb());
        assertEquals("zone-b", job.preferredZone());
        assertEquals("pytorch/pytorch:2.3", job.image());
    }

    @Test
    void minimalRequestGetsDefaults() throws Exception {
        SubmitJobRequest req = mapper.readValue("{\"cpu\":1,\"memoryGb\":1,\"maxLatencyMs\":100}",
                SubmitJobRequest.class);
        req.validate();

        Job job = req.toJob("job-generated");
        assertEquals("job-generated", job.id());
        assertEquals(JobType.INFERENCE, job.type());
        assertEquals(0, job.resources().gpuCount());
        assertFalse(job.sla().hasBudget());
        assertEquals(1.0, job.estimatedDurationHours());
        assertEquals(0.0, job.estimatedDataGb());
        assertEquals(Job.DEFAULT_IMAGE, job.image());
    }

    @Test
    void validation() {
        assertThrows(IllegalArgumentException.class,
                () -> new SubmitJobRequest(null, null, null, 1, null, null, 100L, null, null, null, null, null, null)
                        .validate());
        assertThrows(IllegalArgumentException.class,
                () -> new SubmitJobRequest(null, null, 1, 1, null, null, null, null, null, null, null, null, null)
                        .validate());
        assertThrows(IllegalArgumentException.class,
                () -> new SubmitJobRequest(" ", null, 1, 1, null, null, 100L, null, null, null, null, null, null)
                        .validate());
        assertThrows(IllegalArgumentException.class,
                () -> new SubmitJobRequest(null, null, 1, 1, -1, null, 100L, null, null, null, null, null, null)
                        .validate());
        assertThrows(IllegalArgumentException.class,
                () -> new SubmitJobRequest(null, null, 1, 1, null, -0.5, 100L, null, null, null, null, null, null)
                        .validate());
        assertThrows(IllegalArgumentException.class,
                () -> new SubmitJobRequest(null, null, 1, 1, null, null, 100L, null, -1.0, null, null, null, null)
                        .validate());
    }

    @Test
    void unknownJobTypeIsRejected() {
        assertThrows(Exception.class, () -> mapper.readValue(
                "{\"type\":\"MINING\",\"cpu\":1,\"memoryGb\":1,\"maxLatencyMs\":100}", SubmitJobRequest.class));
    }
}
