package com.tracker.sync.cli;

import com.tracker.sync.adapter.TrackerException;
import com.tracker.sync.adapter.TransientIOException;
import com.tracker.sync.adapter.github.GitHubProjectTargetAdapter;
import com.tracker.sync.adapter.graphql.GraphQlClient;
import com.tracker.sync.adapter.zenhub.ZenHubSourceAdapter;
import com.tracker.sync.api.ConfigurationException;
import com.tracker.sync.api.ReconciliationPass;
import com.tracker.sync.api.SyncOptions;
import com.tracker.sync.metrics.MicrometerSyncMetrics;
import com.tracker.sync.metrics.SyncMetrics;
import com.tracker.sync.reconcile.ReconciliationReport;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "tracker-sync",
        mixinStandardHelpOptions = true,
        version = "tracker-sync 1.0.0",
        description = "Sync ZenHub workspaces into a single GitHub project.",
        footer = {
                "",
                "Source fields: Estimate, Priority, Pipeline, Linked Issues, Epic, Blocked By, Sprint, Position, Workspace.",
                "Special destinations: Status (board column), Position (order within the column),",
                "Text (checklist or values in the issue body), Linked pull requests (adds 'fixes' lines to PR bodies).",
                "Exit status: 0 when everything applied, 1 when some actions failed, 2 on configuration errors."
        }
)
public final class SyncCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SyncCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED_ACTIONS = 1;
    static final int EXIT_CONFIGURATION = 2;

    /**
     * Builds the pass for a set of options. Swapped out in tests.
     */
    @FunctionalInterface
    public interface PassFactory {
        ReconciliationPass create(SyncOptions options, String githubToken, String zenhubToken, SyncMetrics metrics);
    }

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "PROJECT_URL",
            description = "GitHub project URL, e.g. https://github.com/orgs/acme/projects/3")
    String projectUrl;

    @Option(names = {"-w", "--workspace"}, paramLabel = "NAME",
            description = "ZenHub workspace to import, highest priority first. None means all.")
    List<String> workspaces = new ArrayList<>();

    @Option(names = {"-f", "--field"}, paramLabel = "SRC:DST[:CNV]",
            description = "Transfer SRC to DST. CNV is Scale, Exact or Closest (default). 'SRC:' drops SRC.%n"
                    + "Defaults: Estimate:Size:Scale, Priority:Priority, Pipeline:Status, Linked Issues:Text,"
                    + " Epic:Text, Blocked By:Text, Sprint:Iteration, Position:Position")
    List<String> fields = new ArrayList<>();

    @Option(names = {"-x", "--exclude"}, paramLabel = "FIELD:PAT",
            description = "Skip issues whose field matches the glob, e.g. \"Workspace:Private*\", \"Pipeline:Done\".")
    List<String> exclusions = new ArrayList<>();

    @Option(names = "--disable-remove",
            description = "Keep project items that are not in any workspace.")
    boolean disableRemove;

    @Option(names = "--include-linked-prs",
            description = "Also put pull requests that fix an issue on the board.")
    boolean includeLinkedPullRequests;

    @Option(names = "--dry-run", description = "Plan and report without changing anything.")
    boolean dryRun;

    @Option(names = "--status-field", defaultValue = "Status", paramLabel = "NAME",
            description = "Project field holding the board column (default: ${DEFAULT-VALUE}).")
    String statusField;

    @Option(names = "--timeout", defaultValue = "180", paramLabel = "SECONDS",
            description = "How long to wait for the APIs (default: ${DEFAULT-VALUE}).")
    long timeoutSeconds;

    @Option(names = "--concurrency", defaultValue = "4", paramLabel = "N",
            description = "Parallel workspace fetches and project writes (default: ${DEFAULT-VALUE}).")
    int concurrency;

    @Option(names = "--github-token", paramLabel = "TOKEN", description = "Or set GITHUB_TOKEN.")
    String githubToken;

    @Option(names = "--zenhub-token", paramLabel = "TOKEN", description = "Or set ZENHUB_TOKEN.")
    String zenhubToken;

    @Option(names = {"-v", "--verbose"}, description = "Print pass metrics after the summary.")
    boolean verbose;

    private final Map<String, String> environment;
    private final PassFactory passFactory;

    public SyncCommand() {
        this(System.getenv(), SyncCommand::createPass);
    }

    public SyncCommand(Map<String, String> environment, PassFactory passFactory) {
        this.environment = environment;
        this.passFactory = passFactory;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        MeterRegistry registry = new SimpleMeterRegistry();
        try {
            SyncOptions options = toOptions();
            String github = token(githubToken, "GITHUB_TOKEN", "--github-token");
            String zenhub = token(zenhubToken, "ZENHUB_TOKEN", "--zenhub-token");
            ReconciliationPass pass = passFactory.create(options, github, zenhub, new MicrometerSyncMetrics(registry));
            ReconciliationReport report = pass.run();
            out.print(report.summary());
            if (verbose) {
                printMetrics(registry, out);
            }
            out.flush();
            return report.hasFailures() ? EXIT_FAILED_ACTIONS : EXIT_OK;
        } catch (IllegalArgumentException | ConfigurationException e) {
            log.error("cli.configuration error={}", e.getMessage());
            err.println("Configuration error: " + e.getMessage());
            err.flush();
            return EXIT_CONFIGURATION;
        } catch (TrackerException | TransientIOException e) {
            log.error("cli.pass.failed error={}", e.getMessage(), e);
            err.println("Sync failed: " + e.getMessage());
            err.flush();
            return EXIT_FAILED_ACTIONS;
        }
    }

    SyncOptions toOptions() {
        return SyncOptions.builder()
                .projectUrl(projectUrl)
                .workspaces(workspaces)
                .fieldMappings(splitEach(fields))
                .exclusions(exclusions)
                .removeDisabled(disableRemove)
                .skipLinkedPullRequests(!includeLinkedPullRequests)
                .dryRun(dryRun)
                .statusField(statusField)
                .fetchConcurrency(concurrency)
                .applyConcurrency(concurrency)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    /**
     * Accepts comma separated mappings in one argument, as the default list is written.
     */
    private static List<String> splitEach(List<String> specs) {
        List<String> result = new ArrayList<>();
        for (String spec : specs) {
            for (String part : spec.split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    private String token(String explicit, String variable, String option) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        String fromEnvironment = environment.get(variable);
        if (fromEnvironment == null || fromEnvironment.isBlank()) {
            throw new ConfigurationException("Set " + variable + " or pass " + option);
        }
        return fromEnvironment;
    }

    private static void printMetrics(MeterRegistry registry, PrintWriter out) {
        out.println();
        out.println("Metrics");
        registry.getMeters().stream()
                .sorted((a, b) -> a.getId().getName().compareTo(b.getId().getName()))
                .forEach(meter -> out.println("\t" + describe(meter)));
    }

    private static String describe(Meter meter) {
        StringBuilder sb = new StringBuilder(meter.getId().getName());
        meter.getId().getTags().forEach(tag -> sb.append(' ').append(tag.getKey()).append('=').append(tag.getValue()));
        for (Measurement measurement : meter.measure()) {
            sb.append(' ').append(measurement.getStatistic().getTagValueRepresentation())
                    .append('=').append(measurement.getValue());
        }
        return sb.toString();
    }

    private static ReconciliationPass createPass(SyncOptions options, String githubToken, String zenhubToken,
                                                 SyncMetrics metrics) {
        GitHubProjectTargetAdapter github = GitHubProjectTargetAdapter.builder()
                .client(GraphQlClient.builder()
                        .endpoint(GitHubProjectTargetAdapter.ENDPOINT)
                        .token(githubToken)
                        .timeout(options.getTimeout())
                        .build())
                .organization(options.getOrganization())
                .projectNumber(options.getProjectNumber())
                .metrics(metrics)
                .build();
        ZenHubSourceAdapter zenhub = new ZenHubSourceAdapter(GraphQlClient.builder()
                .endpoint(ZenHubSourceAdapter.ENDPOINT)
                .token(zenhubToken)
                .timeout(options.getTimeout())
                .build(), github::isRepositoryArchived);
        return ReconciliationPass.builder()
                .source(zenhub)
                .target(github)
                .options(options)
                .metrics(metrics)
                .build();
    }
}
