package tgp.scheduler.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerConfigTest {

    @Test
    void defaults() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertEquals(8080, config.serverPort());
        assertFalse(config.hasAgentKey());
        assertEquals(Duration.ofSeconds(30), config.heartbeatTimeout());
        assertEquals(Duration.ofSeconds(15), config.suspectAfter());
        assertEquals(3, config.placementRetries());
        assertEquals(1, config.maxRequeues());
        assertEquals(1.0, config.utilizationFactor());
        assertEquals(Duration.ofSeconds(60), config.pendingTimeout());
        assertEquals(50, config.baseLatencyMs());
        assertEquals(100, config.loadPenaltyMs());
        assertEquals(40, config.zonePenaltyMs());
        assertEquals(0, config.coldStartPenaltyMs());
        assertTrue(config.databaseUrl().startsWith("jdbc:h2:mem:"));
    }

    @Test
    void iniOverridesDefaults(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("tgp-scheduler.ini");
        Files.writeString(ini, """
                [server]
                port = 9090
                agent_key = s3cret

                [nodes]
                heartbeat_timeout_sec = 60
                suspect_after_sec = 20

                [scheduler]
                placement_retries = 5
                max_requeues = 2
                result_timeout_sec = 600
                pending_timeout_sec = 120

                [cost]
                utilization_factor = 0.8
                zone_penalty_ms = 75
                """);

        SchedulerConfig config = SchedulerConfig.fromIni(ini);

        assertEquals(9090, config.serverPort());
        assertEquals("s3cret", config.agentKey());
        assertEquals(Duration.ofSeconds(60), config.heartbeatTimeout());
        assertEquals(Duration.ofSeconds(20), config.suspectAfter());
        assertEquals(5, config.placementRetries());
        assertEquals(2, config.maxRequeues());
        assertEquals(Duration.ofMinutes(10), config.resultTimeout());
        assertEquals(Duration.ofMinutes(2), config.pendingTimeout());
        assertEquals(0.8, config.utilizationFactor());
        assertEquals(75, config.zonePenaltyMs());
        assertEquals(50, config.baseLatencyMs(), "keys not in the file keep their defaults");
    }

    @Test
    void missingIniFileIsAnError(@TempDir Path dir) {
        assertThrows(IllegalArgumentException.class, () -> SchedulerConfig.fromIni(dir.resolve("missing.ini")));
    }

    @Test
    void environmentOverridesIni(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("tgp.ini");
        Files.writeString(ini, "[server]\nport = 9090\n");

        SchedulerConfig config = SchedulerConfig.fromIni(ini)
                .applyEnv(Map.of("TGP_PORT", "7070", "TGP_AGENT_KEY", "k", "TGP_PLACEMENT_RETRIES", "1",
                        "TGP_PENDING_TIMEOUT_SEC", "300"));

        assertEquals(7070, config.serverPort());
        assertEquals("k", config.agentKey());
        assertEquals(1, config.placementRetries());
        assertEquals(Duration.ofMinutes(5), config.pendingTimeout());
    }

    @Test
    void utilizationFactorMustBeNonNegative(@TempDir Path dir) throws Exception {
        assertThrows(IllegalArgumentException.class, () -> SchedulerConfig.defaults().withUtilizationFactor(-0.5));
        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.defaults().withUtilizationFactor(Double.NaN));
        assertEquals(0.0, SchedulerConfig.defaults().withUtilizationFactor(0.0).utilizationFactor());

        Path ini = dir.resolve("bad.ini");
        Files.writeString(ini, "[cost]\nutilization_factor = -1\n");
        assertThrows(IllegalArgumentException.class, () -> SchedulerConfig.fromIni(ini));
    }

    @Test
    void blankEnvironmentValuesAreIgnored() {
        SchedulerConfig config = SchedulerConfig.defaults().applyEnv(Map.of("TGP_PORT", " ", "TGP_AGENT_KEY", ""));
        assertEquals(8080, config.serverPort());
        assertFalse(config.hasAgentKey());
    }
}
