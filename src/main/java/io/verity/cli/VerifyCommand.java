package io.verity.cli;

import io.verity.config.VerityConfig;
import io.verity.errors.VerityException;
import io.verity.model.Depth;
import io.verity.model.IssueStatus;
import io.verity.runtime.ExitCodes;
import io.verity.runtime.RunReport;
import io.verity.runtime.RunRequest;
import io.verity.runtime.VerificationEngine;
import io.verity.scenario.ScenarioRunRequest;
import io.verity.util.Jsons;
import io.verity.verify.ConsolePromptChannel;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "verify",
        mixinStandardHelpOptions = true,
        version = "verity 0.1.0",
        description = "Track machine, human and scenario verification of command behaviors",
        subcommands = {
                VerifyCommand.RunCommand.class,
                VerifyCommand.ScenarioCommand.class,
                VerifyCommand.BadgesCommand.class,
                VerifyCommand.IssuesCommand.class,
                VerifyCommand.StatsCommand.class,
                VerifyCommand.CheckCommand.class,
                VerifyCommand.LogCommand.class,
                VerifyCommand.AutoLogCommand.class,
                VerifyCommand.PromptCommand.class,
                VerifyCommand.ConsentCommand.class,
                VerifyCommand.HistoryCommand.class
        }
)
public final class VerifyCommand implements Runnable {
    @Option(names = {"--root"}, description = "Verification data directory", defaultValue = VerityConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--target"}, description = "Target substituted for {site} and {target} in commands")
    String target;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | scenario | badges | issues | stats | check | log | autolog | prompt | consent | history");
    }

    VerificationEngine engine() {
        VerificationEngine engine = new VerificationEngine(VerityConfig.fromRoot(root), target);
        engine.init();
        return engine;
    }

    /**
     * Maps engine errors to the documented exit codes instead of picocli's
     * generic failure code.
     */
    public static CommandLine.IExecutionExceptionHandler executionExceptionHandler() {
        return (ex, commandLine, parseResult) -> {
            if (ex instanceof VerityException) {
                VerityException error = (VerityException) ex;
                System.err.println("ERROR " + error.kind().name().toLowerCase(Locale.ROOT) + ": " + error.getMessage());
                return ExitCodes.of(error.kind());
            }
            if (ex instanceof IllegalArgumentException) {
                System.err.println("ERROR " + ex.getMessage());
                return ExitCodes.CONFIGURATION;
            }
            throw ex;
        };
    }

    @Command(name = "run", description = "Run machine checks")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        VerifyCommand parent;

        @Option(names = {"--depth"}, defaultValue = "standard", description = "basic|standard|thorough|paranoid")
        String depth;

        @Option(names = {"--feature"}, description = "Only this feature")
        String featureId;

        @Option(names = {"--item"}, description = "Only this item")
        String itemId;

        @Option(names = {"--affected"}, description = "Only features whose sources changed")
        boolean affected;

        @Override
        public Integer call() {
            VerificationEngine engine = parent.engine();
            RunReport report = engine.run(new RunRequest(Depth.fromString(depth), featureId, itemId, affected));
            System.out.println(Jsons.toJson(report));
            return report.exitCode();
        }
    }

    @Command(
            name = "scenario",
            description = "Integration scenarios",
            subcommands = {ScenarioCommand.ScenarioRunCommand.class, ScenarioCommand.ScenarioListCommand.class}
    )
    static final class ScenarioCommand implements Runnable {
        @ParentCommand
        VerifyCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: run | list");
        }

        @Command(name = "run", description = "Run scenarios in dependency order")
        static final class ScenarioRunCommand implements Callable<Integer> {
            @ParentCommand
            ScenarioCommand scenario;

            @Option(names = {"--id"}, description = "Run only this scenario")
            String id;

            @Option(names = {"--from"}, description = "Run this scenario and everything depending on it")
            String from;

            @Option(names = {"--resume"}, description = "Continue the interrupted run")
            boolean resume;

            @Option(names = {"--keep-checkpoint"}, description = "Never archive the checkpoint")
            boolean keepCheckpoint;

            @Override
            public Integer call() {
                VerificationEngine engine = scenario.parent.engine();
                VerificationEngine.ScenarioRunOutcome outcome = engine.runScenarios(
                        new ScenarioRunRequest(blankToNull(id), blankToNull(from), resume, keepCheckpoint));
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("runId", outcome.report().runId());
                out.put("passed", outcome.report().passed());
                out.put("failed", outcome.report().failed());
                out.put("skipped", outcome.report().skipped());
                out.put("averageConfidence", outcome.report().averageConfidence());
                out.put("scenarioCoverage", outcome.scenarioCoverage());
                out.put("gateFailed", outcome.report().gateFailed());
                out.put("archived", outcome.report().archived());
                out.put("scenarios", outcome.report().records());
                out.put("findings", outcome.report().findings());
                out.put("newPeaks", outcome.newPeaks());
                out.put("exitCode", outcome.exitCode());
                System.out.println(Jsons.toJson(out));
                return outcome.exitCode();
            }
        }

        @Command(name = "list", description = "List scenarios with their last known status")
        static final class ScenarioListCommand implements Callable<Integer> {
            @ParentCommand
            ScenarioCommand scenario;

            @Override
            public Integer call() {
                System.out.println(Jsons.toJson(scenario.parent.engine().listScenarios()));
                return 0;
            }
        }
    }

    @Command(name = "badges", description = "Print coverage badges")
    static final class BadgesCommand implements Callable<Integer> {
        @ParentCommand
        VerifyCommand parent;

        @Option(names = {"--extended"}, description = "Add scenario, confidence, class ratio and peak badges")
        boolean extended;

        @Option(names = {"--write"}, description = "Also write .badges.json")
        boolean write;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().badges(extended, write)));
            return 0;
        }
    }

    @Command(
            name = "issues",
            description = "Issues raised against items",
            subcommands = {
                    IssuesCommand.ListCommand.class,
                    IssuesCommand.ShowCommand.class,
                    IssuesCommand.ResolveCommand.class,
                    IssuesCommand.SubmitCommand.class
            }
    )
    static final class IssuesCommand implements Runnable {
        @ParentCommand
        VerifyCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: list | show | resolve | submit");
        }

        @Command(name = "list", description = "List issues")
        static final class ListCommand implements Callable<Integer> {
            @ParentCommand
            IssuesCommand issues;

            @Option(names = {"--status"}, description = "Only issues in this status")
            String status;

            @Override
            public Integer call() {
                IssueStatus filter = status == null || status.isBlank() ? null : IssueStatus.fromString(status);
                System.out.println(Jsons.toJson(issues.parent.engine().listIssues(filter)));
                return 0;
            }
        }

        @Command(name = "show", description = "Show one issue")
        static final class ShowCommand implements Callable<Integer> {
            @ParentCommand
            IssuesCommand issues;

            @Parameters(index = "0", description = "Issue id")
            String issueId;

            @Override
            public Integer call() {
                System.out.println(Jsons.toJson(issues.parent.engine().showIssue(issueId)));
                return 0;
            }
        }

        @Command(name = "resolve", description = "Move an issue to another status")
        static final class ResolveCommand implements Callable<Integer> {
            @ParentCommand
            IssuesCommand issues;

            @Parameters(index = "0", description = "Issue id")
            String issueId;

            @Option(names = {"--status"}, required = true, description = "Target status")
            String status;

            @Option(names = {"--note"}, description = "Remediation note (required for fixed, wontfix, duplicate)")
            String note;

            @Option(names = {"--actor"}, defaultValue = "cli", description = "Who made the change")
            String actor;

            @Override
            public Integer call() {
                System.out.println(Jsons.toJson(issues.parent.engine()
                        .resolveIssue(issueId, IssueStatus.fromString(status), note, actor)));
                return 0;
            }
        }

        @Command(name = "submit", description = "Open an issue for an item")
        static final class SubmitCommand implements Callable<Integer> {
            @ParentCommand
            IssuesCommand issues;

            @Option(names = {"--item"}, required = true, description = "Item id")
            String itemId;

            @Option(names = {"--command"}, required = true, description = "Command that misbehaved")
            String command;

            @Option(names = {"--exit-code"}, description = "Its exit code")
            Integer exitCode;

            @Option(names = {"--description"}, defaultValue = "", description = "What went wrong")
            String description;

            @Option(names = {"--reporter"}, defaultValue = "cli", description = "Reporter identity")
            String reporter;

            @Override
            public Integer call() {
                System.out.println(Jsons.toJson(issues.parent.engine()
                        .submitIssue(reporter, itemId, command, exitCode, description)));
                return 0;
            }
        }
    }

    @Command(name = "stats", description = "Print coverage statistics")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        VerifyCommand parent;

        @Option(names = {"--format"}, defaultValue = "json", description = "json|prometheus")
        String format;

        @Override
        public Integer call() {
            VerificationEngine engine = parent.engine();
            switch (format.trim().toLowerCase(Locale.ROOT)) {
                case "json" -> System.out.println(Jsons.toJson(engine.statistics()));
                case "prometheus" -> System.out.print(engine.metricsText());
                default -> throw new IllegalArgumentException("Unknown format: " + format + " (expected json|prometheus)");
            }
            return 0;
        }
    }

    @Command(name = "check", description = "Invalidate items whose feature sources changed")
    static final class CheckCommand implements Callable<Integer> {
        @ParentCommand
        VerifyCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().check()));
            return 0;
        }
    }

    @Command(name = "log", description = "Record a manual human confirmation")
    static final class LogCommand implements Callable<Integer> {
        @ParentCommand
        VerifyCommand parent;

        @Option(names = {"--item"}, required = true, description = "Item id")
        String itemId;

        @Option(names = {"--identity"}, required = true, description = "Who confirmed it")
        String identity;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().logManual(itemId, identity)));
            return 0;
        }
    }

    @Command(name = "autolog", description = "Confirm the items a successful command exercises")
    static final class AutoLogCommand implements Callable<Integer> {
        @ParentCommand
        VerifyCommand parent;

        @Option(names = {"--identity"}, required = true, description = "Who ran the command")
        String identity;

        @Parameters(arity = "1..*", description = "The command line that succeeded")
        List<String> commandLine;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().autoLog(commandLine, identity)));
            return 0;
        }
    }

    @Command(name = "prompt", description = "Ask on the console whether an item behaved as expected")
    static final class PromptCommand implements Callable<Integer> {
        @ParentCommand
        VerifyCommand parent;

        @Option(names = {"--item"}, required = true, description = "Item id")
        String itemId;

        @Option(names = {"--identity"}, required = true, description = "Who answers")
        String identity;

        @Override
        public Integer call() {
            VerificationEngine engine = parent.engine();
            try (ConsolePromptChannel channel = new ConsolePromptChannel(System.in, System.err)) {
                System.out.println(Jsons.toJson(engine.prompt(itemId, identity, channel)));
            }
            return 0;
        }
    }

    @Command(
            name = "consent",
            description = "Manage auto-logging consent",
            subcommands = {ConsentCommand.GrantCommand.class, ConsentCommand.RevokeCommand.class}
    )
    static final class ConsentCommand implements Runnable {
        @ParentCommand
        VerifyCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: grant | revoke");
        }

        @Command(name = "grant", description = "Allow successful commands to be logged as confirmations")
        static final class GrantCommand implements Callable<Integer> {
            @ParentCommand
            ConsentCommand consent;

            @Option(names = {"--identity"}, required = true, description = "Identity granting consent")
            String identity;

            @Override
            public Integer call() {
                System.out.println(Jsons.toJson(consent.parent.engine().grantConsent(identity)));
                return 0;
            }
        }

        @Command(name = "revoke", description = "Stop auto-logging for an identity")
        static final class RevokeCommand implements Callable<Integer> {
            @ParentCommand
            ConsentCommand consent;

            @Option(names = {"--identity"}, required = true, description = "Identity revoking consent")
            String identity;

            @Override
            public Integer call() {
                System.out.println(Jsons.toJson(consent.parent.engine().revokeConsent(identity)));
                return 0;
            }
        }
    }

    @Command(name = "history", description = "Show recent runs and best-ever coverage")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        VerifyCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Number of runs")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().history(limit)));
            return 0;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
