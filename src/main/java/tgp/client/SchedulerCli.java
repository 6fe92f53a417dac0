package tgp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Command-line client for the scheduler's public API.
 *
 * <pre>
 * tgp [--scheduler URL] submit-job --job-id ID --cpu N --memory GB --latency MS [--gpu N] [--budget USD]
 *                                  [--duration H] [--data-gb GB] [--image IMG] [--zone Z]
 * tgp [--scheduler URL] get-status JOB_ID
 * tgp [--scheduler URL] get-cost JOB_ID
 * tgp [--scheduler URL] cluster-status
 * tgp [--scheduler URL] list-nodes
 * </pre>
 *
 * Exit codes: 0 success, 1 infeasible placement or job not found, 2 usage
 * error, 3 transport failure.
 */
public final class SchedulerCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_NOT_PLACED = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_TRANSPORT = 3;

    static final String DEFAULT_SCHEDULER = "http://localhost:8080";

    private static final String USAGE = "tgp [--scheduler URL] "
            + "<submit-job|get-status JOB_ID|get-cost JOB_ID|cluster-status|list-nodes> [options]";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient http;
    private final PrintStream out;
    private final PrintStream err;

    public SchedulerCli(PrintStream out, PrintStream err) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), out, err);
    }

    SchedulerCli(HttpClient http, PrintStream out, PrintStream err) {
        this.http = http;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new SchedulerCli(System.out, System.err).run(args));
    }

    static Options options() {
        Options options = new Options();
        options.addOption(Option.builder("s").longOpt("scheduler").hasArg().argName("URL")
                .desc("scheduler base URL (default " + DEFAULT_SCHEDULER + ", or $TGP_SCHEDULER)").build());
        options.addOption(Option.builder().longOpt("job-id").hasArg().argName("ID").desc("job id").build());
        options.addOption(Option.builder().longOpt("cpu").hasArg().argName("N").desc("CPU cores").build());
        options.addOption(Option.builder().longOpt("memory").hasArg().argName("GB").desc("memory in GB").build());
        options.addOption(Option.builder().longOpt("gpu").hasArg().argName("N").desc("GPU count").build());
        options.addOption(Option.builder().longOpt("budget").hasArg().argName("USD").desc("budget ceiling").build());
        options.addOption(Option.builder().longOpt("latency").hasArg().argName("MS")
                .desc("maximum start latency in ms").build());
        options.addOption(Option.builder().longOpt("duration").hasArg().argName("HOURS")
                .desc("estimated duration in hours").build());
        options.addOption(Option.builder().longOpt("data-gb").hasArg().argName("GB")
                .desc("estimated data volume").build());
        options.addOption(Option.builder().longOpt("image").hasArg().argName("IMAGE").desc("container image").build());
        options.addOption(Option.builder().longOpt("zone").hasArg().argName("ZONE").desc("preferred zone").build());
        options.addOption(Option.builder("h").longOpt("help").desc("print this help").build());
        return options;
    }

    /**
     * @return process exit code
     */
    public int run(String[] args) {
        Options options = options();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            err.println("error: " + e.getMessage());
            printUsage(options);
            return EXIT_USAGE;
        }

        List<String> rest = cmd.getArgList();
        if (cmd.hasOption("help") || rest.isEmpty()) {
            printUsage(options);
            return cmd.hasOption("help") ? EXIT_OK : EXIT_USAGE;
        }

        String base = schedulerUrl(cmd);
        String command = rest.get(0);
        try {
            switch (command) {
                case "submit-job":
                    return submitJob(base, cmd);
                case "get-status":
                    return get(base + "/api/v1/jobs/" + jobIdArg(rest, command));
                case "get-cost":
                    return get(base + "/api/v1/jobs/" + jobIdArg(rest, command) + "/cost");
                case "cluster-status":
                    return get(base + "/api/v1/cluster/status");
                case "list-nodes":
                    return get(base + "/api/v1/cluster/nodes");
                default:
                    err.println("error: unknown command " + command);
                    printUsage(options);
                    return EXIT_USAGE;
            }
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("error: cannot reach scheduler at " + base + ": " + e.getMessage());
            return EXIT_TRANSPORT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("error: interrupted");
            return EXIT_TRANSPORT;
        }
    }

    private int submitJob(String base, CommandLine cmd) throws IOException, InterruptedException {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("jobId", required(cmd, "job-id"));
        body.put("cpu", parseInt("cpu", required(cmd, "cpu")));
        body.put("memoryGb", parseInt("memory", required(cmd, "memory")));
        body.put("maxLatencyMs", parseLong("latency", required(cmd, "latency")));
        if (cmd.hasOption("gpu")) {
            body.put("gpuCount", parseInt("gpu", cmd.getOptionValue("gpu")));
        }
        if (cmd.hasOption("budget")) {
            body.put("budgetUsd", parseDouble("budget", cmd.getOptionValue("budget")));
        }
        if (cmd.hasOption("duration")) {
            body.put("estimatedDurationHours", parseDouble("duration", cmd.getOptionValue("duration")));
        }
        if (cmd.hasOption("data-gb")) {
            body.put("estimatedDataGb", parseDouble("data-gb", cmd.getOptionValue("data-gb")));
        }
        if (cmd.hasOption("image")) {
            body.put("image", cmd.getOptionValue("image"));
        }
        if (cmd.hasOption("zone")) {
            body.put("preferredZone", cmd.getOptionValue("zone"));
        }

        HttpRequest request = HttpRequest.newBuilder(URI.create(base + "/api/v1/jobs"))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
                .build();
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

        int code = classify(response);
        if (code != EXIT_OK) {
            return code;
        }
        JsonNode json = MAPPER.readTree(response.body());
        out.println(pretty(json));
        return json.path("scheduled").asBoolean(false) ? EXIT_OK : EXIT_NOT_PLACED;
    }

    private int get(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

        int code = classify(response);
        if (code == EXIT_OK) {
            out.println(pretty(MAPPER.readTree(response.body())));
        }
        return code;
    }

    /**
     * Map an HTTP answer to an exit code, printing the server's error for
     * anything but 2xx.
     */
    private int classify(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return EXIT_OK;
        }
        err.println("error: " + errorMessage(response.body()) + " (HTTP " + status + ")");
        if (status == 404 || status == 409) {
            return EXIT_NOT_PLACED;
        }
        if (status == 400) {
            return EXIT_USAGE;
        }
        return EXIT_TRANSPORT;
    }

    private static String errorMessage(String body) {
        try {
            JsonNode json = MAPPER.readTree(body);
            return json.path("error").asText(body);
        } catch (IOException e) {
            return body;
        }
    }

    private static String pretty(JsonNode json) throws IOException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(json);
    }

    private static String schedulerUrl(CommandLine cmd) {
        String url = cmd.getOptionValue("scheduler");
        if (url == null || url.isBlank()) {
            url = System.getenv("TGP_SCHEDULER");
        }
        if (url == null || url.isBlank()) {
            url = DEFAULT_SCHEDULER;
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String jobIdArg(List<String> rest, String command) {
        if (rest.size() < 2 || rest.get(1).isBlank()) {
            throw new IllegalArgumentException(command + " needs a job id");
        }
        return URLEncoder.encode(rest.get(1), StandardCharsets.UTF_8);
    }

    private static String required(CommandLine cmd, String name) {
        String value = cmd.getOptionValue(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        return value;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer: " + value);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer: " + value);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number: " + value);
        }
    }

    private void printUsage(Options options) {
        PrintWriter writer = new PrintWriter(err, true);
        new HelpFormatter().printHelp(writer, 100, USAGE, null, options, 2, 4, null);
        writer.flush();
    }
}
