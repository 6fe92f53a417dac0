package tgp.scheduler.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for scheduler settings.
 * All settings have sensible defaults; an INI file and then environment
 * variables override them.
 */
public final class SchedulerConfig {

    public static final String DEFAULT_INI_FILE = "tgp-scheduler.ini";

    // Database settings
    private String databaseUrl = "jdbc:h2:mem:tgp;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String agentKey = null; // If set, workers must provide X-Tgp-Key header

    // Node liveness
    private Duration heartbeatTimeout = Duration.ofSeconds(30);
    private Duration suspectAfter = Duration.ofSeconds(15);
    private Duration nodeReaperInterval = Duration.ofSeconds(5);

    // Job lifecycle
    private Duration resultTimeout = Duration.ofHours(24);
    private Duration jobReaperInterval = Duration.ofSeconds(30);
    private Duration pendingTimeout = Duration.ofSeconds(60);
    private int placementRetries = 3;
    private int maxRequeues = 1;

    // Cost and latency model
    private double utilizationFactor = 1.0;
    private long baseLatencyMs = 50;
    private long loadPenaltyMs = 100;
    private long zonePenaltyMs = 40;
    private long coldStartPenaltyMs = 0;

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    /**
     * Defaults, then the INI file named by {@code TGP_CONFIG} (or
     * {@value #DEFAULT_INI_FILE} if present), then environment variables.
     */
    public static SchedulerConfig load() {
        SchedulerConfig config = new SchedulerConfig();
        String path = System.getenv("TGP_CONFIG");
        Path ini = path != null && !path.isBlank() ? Path.of(path) : Path.of(DEFAULT_INI_FILE);
        if (Files.isRegularFile(ini)) {
            config.applyIni(ini);
        }
        config.applyEnv(System.getenv());
        return config;
    }

    public static SchedulerConfig fromEnv() {
        SchedulerConfig config = new SchedulerConfig();
        config.applyEnv(System.getenv());
        return config;
    }

    public static SchedulerConfig fromIni(Path iniFile) {
        SchedulerConfig config = new SchedulerConfig();
        config.applyIni(iniFile);
        return config;
    }

    /**
     * Read sections [server], [database], [scheduler], [nodes], [cost].
     * Missing sections and keys keep their current values.
     */
    public SchedulerConfig applyIni(Path iniFile) {
        Ini ini;
        try {
            ini = new Ini(iniFile.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + iniFile, e);
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            serverHost = str(server, "host", serverHost);
            serverPort = integer(server, "port", serverPort);
            agentKey = str(server, "agent_key", agentKey);
        }

        Profile.Section database = ini.get("database");
        if (database != null) {
            databaseUrl = str(database, "url", databaseUrl);
            databasePoolSize = integer(database, "pool_size", databasePoolSize);
        }

        Profile.Section nodes = ini.get("nodes");
        if (nodes != null) {
            heartbeatTimeout = seconds(nodes, "heartbeat_timeout_sec", heartbeatTimeout);
            suspectAfter = seconds(nodes, "suspect_after_sec", suspectAfter);
            nodeReaperInterval = seconds(nodes, "reaper_interval_sec", nodeReaperInterval);
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            resultTimeout = seconds(scheduler, "result_timeout_sec", resultTimeout);
            jobReaperInterval = seconds(scheduler, "reaper_interval_sec", jobReaperInterval);
            pendingTimeout = seconds(scheduler, "pending_timeout_sec", pendingTimeout);
            placementRetries = integer(scheduler, "placement_retries", placementRetries);
            maxRequeues = integer(scheduler, "max_requeues", maxRequeues);
        }

        Profile.Section cost = ini.get("cost");
        if (cost != null) {
            utilizationFactor = checkUtilizationFactor(dbl(cost, "utilization_factor", utilizationFactor));
            baseLatencyMs = lng(cost, "base_latency_ms", baseLatencyMs);
            loadPenaltyMs = lng(cost, "load_penalty_ms", loadPenaltyMs);
            zonePenaltyMs = lng(cost, "zone_penalty_ms", zonePenaltyMs);
            coldStartPenaltyMs = lng(cost, "cold_start_penalty_ms", coldStartPenaltyMs);
        }
        return this;
    }

    SchedulerConfig applyEnv(Map<String, String> env) {
        String dbUrl = env.get("TGP_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String port = env.get("TGP_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port.trim());
        }

        String key = env.get("TGP_AGENT_KEY");
        if (key != null && !key.isBlank()) {
            agentKey = key;
        }

        String timeout = env.get("TGP_HEARTBEAT_TIMEOUT_SEC");
        if (timeout != null && !timeout.isBlank()) {
            heartbeatTimeout = Duration.ofSeconds(Long.parseLong(timeout.trim()));
        }

        String resultTimeoutSec = env.get("TGP_RESULT_TIMEOUT_SEC");
        if (resultTimeoutSec != null && !resultTimeoutSec.isBlank()) {
            resultTimeout = Duration.ofSeconds(Long.parseLong(resultTimeoutSec.trim()));
        }

        String pendingTimeoutSec = env.get("TGP_PENDING_TIMEOUT_SEC");
        if (pendingTimeoutSec != null && !pendingTimeoutSec.isBlank()) {
            pendingTimeout = Duration.ofSeconds(Long.parseLong(pendingTimeoutSec.trim()));
        }

        String retries = env.get("TGP_PLACEMENT_RETRIES");
        if (retries != null && !retries.isBlank()) {
            placementRetries = Integer.parseInt(retries.trim());
        }
        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    public Duration suspectAfter() {
        return suspectAfter;
    }

    public Duration nodeReaperInterval() {
        return nodeReaperInterval;
    }

    public Duration resultTimeout() {
        return resultTimeout;
    }

    public Duration jobReaperInterval() {
        return jobReaperInterval;
    }

    /**
     * How long a job may sit PENDING before the job reaper fails it.
     */
    public Duration pendingTimeout() {
        return pendingTimeout;
    }

    public int placementRetries() {
        return placementRetries;
    }

    public int maxRequeues() {
        return maxRequeues;
    }

    public double utilizationFactor() {
        return utilizationFactor;
    }

    public long baseLatencyMs() {
        return baseLatencyMs;
    }

    public long loadPenaltyMs() {
        return loadPenaltyMs;
    }

    public long zonePenaltyMs() {
        return zonePenaltyMs;
    }

    public long coldStartPenaltyMs() {
        return coldStartPenaltyMs;
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public SchedulerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public SchedulerConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public SchedulerConfig withHeartbeatTimeout(Duration timeout) {
        this.heartbeatTimeout = timeout;
        return this;
    }

    public SchedulerConfig withSuspectAfter(Duration suspectAfter) {
        this.suspectAfter = suspectAfter;
        return this;
    }

    public SchedulerConfig withNodeReaperInterval(Duration interval) {
        this.nodeReaperInterval = interval;
        return this;
    }

    public SchedulerConfig withResultTimeout(Duration timeout) {
        this.resultTimeout = timeout;
        return this;
    }

    public SchedulerConfig withJobReaperInterval(Duration interval) {
        this.jobReaperInterval = interval;
        return this;
    }

    public SchedulerConfig withPendingTimeout(Duration timeout) {
        this.pendingTimeout = timeout;
        return this;
    }

    public SchedulerConfig withPlacementRetries(int retries) {
        this.placementRetries = retries;
        return this;
    }

    public SchedulerConfig withMaxRequeues(int maxRequeues) {
        this.maxRequeues = maxRequeues;
        return this;
    }

    public SchedulerConfig withUtilizationFactor(double factor) {
        this.utilizationFactor = checkUtilizationFactor(factor);
        return this;
    }

    public SchedulerConfig withLatencyModel(long baseMs, long loadPenaltyMs, long zonePenaltyMs,
            long coldStartPenaltyMs) {
        this.baseLatencyMs = baseMs;
        this.loadPenaltyMs = loadPenaltyMs;
        this.zonePenaltyMs = zonePenaltyMs;
        this.coldStartPenaltyMs = coldStartPenaltyMs;
        return this;
    }

    // ===== helpers =====
    private static double checkUtilizationFactor(double factor) {
        if (!Double.isFinite(factor) || factor < 0) {
            throw new IllegalArgumentException("utilization_factor must be a non-negative number, got " + factor);
        }
        return factor;
    }

    private static String str(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static int integer(Profile.Section s, String key, int def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : Integer.parseInt(v.trim());
    }

    private static long lng(Profile.Section s, String key, long def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : Long.parseLong(v.trim());
    }

    private static double dbl(Profile.Section s, String key, double def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : Double.parseDouble(v.trim());
    }

    private static Duration seconds(Profile.Section s, String key, Duration def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : Duration.ofSeconds(Long.parseLong(v.trim()));
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", heartbeatTimeout=" + heartbeatTimeout +
                ", resultTimeout=" + resultTimeout +
                ", placementRetries=" + placementRetries +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
