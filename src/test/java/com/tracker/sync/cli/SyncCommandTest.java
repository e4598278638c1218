package com.tracker.sync.cli;

import com.tracker.sync.adapter.RawItem;
import com.tracker.sync.adapter.TrackerException;
import com.tracker.sync.adapter.memory.InMemorySourceAdapter;
import com.tracker.sync.adapter.memory.InMemoryTargetAdapter;
import com.tracker.sync.api.ReconciliationPass;
import com.tracker.sync.api.SyncOptions;
import com.tracker.sync.core.model.CanonicalField;
import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.core.model.TargetField;
import com.tracker.sync.core.model.TargetSchema;
import com.tracker.sync.mapping.FieldMappingRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyncCommandTest {

    private static final String PROJECT_URL = "https://github.com/orgs/acme/projects/3";
    private static final Map<String, String> ENV = Map.of("GITHUB_TOKEN", "gh-token", "ZENHUB_TOKEN", "zh-token");

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private InMemorySourceAdapter source;
    private InMemoryTargetAdapter target;
    private String receivedGithubToken;

    @BeforeEach
    void setUp() {
        source = InMemorySourceAdapter.builder()
                .workspace("Team A", List.of(RawItem.builder().owner("acme").repository("api").number(1)
                        .field("pipeline", "Done").build()))
                .build();
        target = new InMemoryTargetAdapter(TargetSchema.of(TargetField.singleSelect("Status", "Todo", "Done")));
    }

    private int run(Map<String, String> env, String... args) {
        SyncCommand.PassFactory factory = (options, githubToken, zenhubToken, metrics) -> {
            receivedGithubToken = githubToken;
            return ReconciliationPass.builder()
                    .source(source)
                    .target(target)
                    .options(options)
                    .metrics(metrics)
                    .build();
        };
        CommandLine commandLine = new CommandLine(new SyncCommand(env, factory));
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    @DisplayName("Should sync and print the summary")
    void testSuccess() {
        int exit = run(ENV, PROJECT_URL);

        assertEquals(SyncCommand.EXIT_OK, exit);
        assertTrue(out.toString().contains("Added: 1, Removed: 0"));
        assertEquals("gh-token", receivedGithubToken);
        assertEquals("Done", target.listItems().get(0).field("Status"));
    }

    @Test
    @DisplayName("Tokens given as options win over the environment")
    void testTokenOption() {
        run(ENV, "--github-token", "explicit", PROJECT_URL);

        assertEquals("explicit", receivedGithubToken);
    }

    @Test
    @DisplayName("A missing token is a configuration error")
    void testMissingToken() {
        int exit = run(Map.of("ZENHUB_TOKEN", "zh-token"), PROJECT_URL);

        assertEquals(SyncCommand.EXIT_CONFIGURATION, exit);
        assertTrue(err.toString().contains("Set GITHUB_TOKEN or pass --github-token"));
    }

    @Test
    @DisplayName("A malformed project URL is a configuration error")
    void testBadUrl() {
        int exit = run(ENV, "https://github.com/acme/projects/3");

        assertEquals(SyncCommand.EXIT_CONFIGURATION, exit);
        assertTrue(err.toString().contains("projectUrl must look like"));
    }

    @Test
    @DisplayName("An unknown field mapping is a configuration error")
    void testBadField() {
        assertEquals(SyncCommand.EXIT_CONFIGURATION, run(ENV, "-f", "Colour:Status", PROJECT_URL));
    }

    @Test
    @DisplayName("Failed actions give exit status 1")
    void testFailedActions() {
        target = new InMemoryTargetAdapter(TargetSchema.of(TargetField.singleSelect("Status", "Todo", "Done"))) {
            @Override
            public synchronized void removeItem(String itemId, IssueKey key) {
                throw new TrackerException("Resource not accessible by integration");
            }
        };
        target.addItem(IssueKey.of("acme", "api", 9), Map.of());

        int exit = run(ENV, PROJECT_URL);

        assertEquals(SyncCommand.EXIT_FAILED_ACTIONS, exit);
        assertTrue(out.toString().contains("Failed"));
    }

    @Test
    @DisplayName("A pass that cannot read its sources gives exit status 1")
    void testPassFailure() {
        int exit = run(ENV, "-w", "Team Z", PROJECT_URL);

        assertEquals(SyncCommand.EXIT_FAILED_ACTIONS, exit);
        assertTrue(err.toString().contains("Sync failed: Unknown workspace 'Team Z'"));
    }

    @Test
    @DisplayName("Dry runs print the plan and change nothing")
    void testDryRun() {
        int exit = run(ENV, "--dry-run", PROJECT_URL);

        assertEquals(SyncCommand.EXIT_OK, exit);
        assertTrue(out.toString().contains("- CREATE acme/api#1"));
        assertEquals(0, target.getWriteCount());
    }

    @Test
    @DisplayName("Verbose output lists the pass metrics")
    void testVerbose() {
        run(ENV, "-v", PROJECT_URL);

        assertTrue(out.toString().contains("Metrics"));
        assertTrue(out.toString().contains("sync.action.applied type=CREATE"));
    }

    @Test
    @DisplayName("Options map onto the pass options")
    void testToOptions() {
        SyncCommand command = new SyncCommand(ENV, (o, g, z, m) -> null);
        new CommandLine(command).parseArgs(
                "-w", "Team A", "-w", "Team B",
                "-f", "Estimate:Points,Epic:",
                "-x", "Pipeline:Done",
                "--disable-remove", "--include-linked-prs",
                "--status-field", "Column", "--timeout", "30", "--concurrency", "2",
                PROJECT_URL);

        SyncOptions options = command.toOptions();

        assertEquals(List.of("Team A", "Team B"), options.getWorkspaces());
        assertTrue(options.getFieldMappings().contains(FieldMappingRule.of(CanonicalField.ESTIMATE, "Points")));
        assertTrue(options.getFieldMappings().stream().noneMatch(r -> r.sourceField() == CanonicalField.EPIC));
        assertEquals(1, options.getExclusions().size());
        assertTrue(options.isRemoveDisabled());
        assertFalse(options.isSkipLinkedPullRequests());
        assertEquals("Column", options.getStatusField());
        assertEquals(Duration.ofSeconds(30), options.getTimeout());
        assertEquals(2, options.getApplyConcurrency());
    }

    @Test
    @DisplayName("Unknown options are usage errors")
    void testUsageError() {
        assertEquals(2, run(ENV, "--frobnicate", PROJECT_URL));
    }
}
