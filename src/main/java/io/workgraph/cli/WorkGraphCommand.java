package io.workgraph.cli;

import io.workgraph.config.WorkGraphConfig;
import io.workgraph.flow.FlowResult;
import io.workgraph.model.Issue;
import io.workgraph.observability.AuditLogger;
import io.workgraph.runtime.WorkGraphRuntime;
import io.workgraph.storage.StoreUnavailableException;
import io.workgraph.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "workgraph",
        mixinStandardHelpOptions = true,
        description = "Dependency-aware issue coordination CLI",
        subcommands = {
                WorkGraphCommand.InitCommand.class,
                WorkGraphCommand.CreateCommand.class,
                WorkGraphCommand.ShowCommand.class,
                WorkGraphCommand.UpdateCommand.class,
                WorkGraphCommand.CloseCommand.class,
                WorkGraphCommand.ReopenCommand.class,
                WorkGraphCommand.DeferCommand.class,
                WorkGraphCommand.UndeferCommand.class,
                WorkGraphCommand.DeleteCommand.class,
                WorkGraphCommand.DepCommand.class,
                WorkGraphCommand.ChildrenCommand.class,
                WorkGraphCommand.ReparentCommand.class,
                WorkGraphCommand.EpicStatusCommand.class,
                WorkGraphCommand.ReadyCommand.class,
                WorkGraphCommand.BlockedCommand.class,
                WorkGraphCommand.DeferredCommand.class,
                WorkGraphCommand.EventsCommand.class,
                WorkGraphCommand.AuditTailCommand.class,
                WorkGraphCommand.AuditVerifyCommand.class,
                WorkGraphCommand.SchemaMigrationsCommand.class,
                WorkGraphCommand.FlowCommand.class
        }
)
public final class WorkGraphCommand implements Runnable {
    public static final int EXIT_SYSTEM_ERROR = 1;
    public static final int EXIT_INVALID_INPUT = 2;
    public static final int EXIT_STORE_UNAVAILABLE = 5;
    static final String ACTOR_ENV = "WORKGRAPH_ACTOR";

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (separate store per namespace)", defaultValue = "default")
    String namespace;

    @Option(names = {"--actor"}, description = "Acting identity; defaults to $WORKGRAPH_ACTOR, then the OS user")
    String actor;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | create | show | update | close | reopen | defer | undefer | delete | dep | children | reparent | epic-status | ready | blocked | deferred | events | audit-tail | audit-verify | schema-migrations | flow");
    }

    /**
     * Command line with the exit-code mapping for exceptions escaping a subcommand:
     * validation errors exit 2, transient store faults 5, other store faults 1.
     */
    public static CommandLine newCommandLine() {
        CommandLine cli = new CommandLine(new WorkGraphCommand());
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            commandLine.getErr().println("error: " + ex.getMessage());
            if (ex instanceof IllegalArgumentException) {
                return EXIT_INVALID_INPUT;
            }
            if (ex instanceof StoreUnavailableException) {
                return EXIT_STORE_UNAVAILABLE;
            }
            return EXIT_SYSTEM_ERROR;
        });
        return cli;
    }

    WorkGraphRuntime runtime() {
        WorkGraphRuntime runtime = new WorkGraphRuntime(WorkGraphConfig.fromRoot(root, namespace));
        runtime.init();
        return runtime;
    }

    String actor() {
        if (actor != null && !actor.isBlank()) {
            return actor.trim();
        }
        String fromEnv = System.getenv(ACTOR_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        return System.getProperty("user.name", "unknown");
    }

    static int printFlow(FlowResult result) {
        System.out.println(Jsons.toJson(result.toPayload()));
        return result.exitCode();
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Override
        public Integer call() {
            WorkGraphRuntime runtime = parent.runtime();
            System.out.println("Initialized WorkGraph at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "create", description = "Create an issue")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Issue title")
        String title;

        @Option(names = {"-d", "--description"}, description = "Issue description")
        String description;

        @Option(names = {"-t", "--type"}, description = "Issue type: bug|feature|task|epic|chore or a configured custom type")
        String type;

        @Option(names = {"-p", "--priority"}, description = "Priority 0 (most urgent) to 4")
        Integer priority;

        @Option(names = {"-l", "--label"}, description = "Label (repeatable)")
        List<String> labels;

        @Option(names = {"--assignee"}, description = "Initial assignee")
        String assignee;

        @Option(names = {"--parent"}, description = "Parent issue id; the new issue gets a <parent>.<n> id")
        String parentIssue;

        @Option(names = {"--blocked-by"}, split = ",", description = "Issue ids that block the new issue")
        List<String> blockedBy;

        @Option(names = {"--notes"}, description = "Initial notes")
        String notes;

        @Override
        public Integer call() {
            WorkGraphRuntime runtime = parent.runtime();
            Issue issue = runtime.create(new WorkGraphRuntime.CreateRequest(
                    title, description, type, priority, labels, assignee, parentIssue, blockedBy, notes
            ), parent.actor());
            System.out.println(Jsons.toJson(issue));
            return 0;
        }
    }

    @Command(name = "show", description = "Show an issue with its edges and derived status")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Issue id")
        String issueId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().show(issueId)));
            return 0;
        }
    }

    @Command(name = "update", description = "Update issue fields")
    static final class UpdateCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Issue id")
        String issueId;

        @Option(names = {"--title"}, description = "New title")
        String title;

        @Option(names = {"-d", "--description"}, description = "New description")
        String description;

        @Option(names = {"-t", "--type"}, description = "New issue type")
        String type;

        @Option(names = {"-p", "--priority"}, description = "New priority 0..4")
        Integer priority;

        @Option(names = {"--notes"}, description = "Replace notes")
        String notes;

        @Option(names = {"-l", "--label"}, description = "Replace labels (repeatable)")
        List<String> labels;

        @Option(names = {"-s", "--status"}, description = "New status: open|in_progress|deferred")
        String status;

        @Option(names = {"--assignee"}, description = "New assignee")
        String assignee;

        @Option(names = {"--unassign"}, defaultValue = "false", description = "Clear the assignee")
        boolean unassign;

        @Override
        public Integer call() {
            Issue issue = parent.runtime().update(issueId, new WorkGraphRuntime.IssueUpdate(
                    title, description, type, priority, notes, labels, status, assignee, unassign
            ), parent.actor());
            System.out.println(Jsons.toJson(issue));
            return 0;
        }
    }

    @Command(name = "close", description = "Close an issue (refuses while blockers are open unless --force)")
    static final class CloseCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Issue id")
        String issueId;

        @Option(names = {"-r", "--reason"}, description = "Close reason")
        String reason;

        @Option(names = {"--verified"}, description = "Who or what verified the work")
        String verified;

        @Option(names = {"--force"}, defaultValue = "false", description = "Close even with open blockers")
        boolean force;

        @Override
        public Integer call() {
            return printFlow(parent.runtime().close(issueId, reason, verified, force, parent.actor()));
        }
    }

    @Command(name = "reopen", description = "Reopen a closed issue")
    static final class ReopenCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Issue id")
        String issueId;

        @Option(names = {"-r", "--reason"}, description = "Reopen reason")
        String reason;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().reopen(issueId, reason, parent.actor())));
            return 0;
        }
    }

    @Command(name = "defer", description = "Defer an issue, optionally until a time")
    static final class DeferCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Issue id")
        String issueId;

        @Option(names = {"--until"}, description = "ISO-8601 instant, epoch millis, or ISO-8601 duration from now (e.g. P2D)")
        String until;

        @Override
        public Integer call() {
            Long untilMs = until == null || until.isBlank() ? null : parseUntil(until.trim());
            System.out.println(Jsons.toJson(parent.runtime().defer(issueId, untilMs, parent.actor())));
            return 0;
        }

        static long parseUntil(String raw) {
            try {
                if (raw.startsWith("P") || raw.startsWith("p")) {
                    return Instant.now().plus(Duration.parse(raw)).toEpochMilli();
                }
                if (raw.chars().allMatch(Character::isDigit)) {
                    return Long.parseLong(raw);
                }
                return Instant.parse(raw).toEpochMilli();
            } catch (DateTimeParseException | NumberFormatException e) {
                throw new IllegalArgumentException("Invalid --until value: " + raw, e);
            }
        }
    }

    @Command(name = "undefer", description = "Return a deferred issue to open")
    static final class UndeferCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Issue id")
        String issueId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().undefer(issueId, parent.actor())));
            return 0;
        }
    }

    @Command(name = "delete", description = "Delete an issue and its edges")
    static final class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Issue id")
        String issueId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().delete(issueId, parent.actor())));
            return 0;
        }
    }

    @Command(
            name = "dep",
            description = "Manage dependency edges",
            subcommands = {
                    DepCommand.AddCommand.class,
                    DepCommand.RemoveCommand.class,
                    DepCommand.TreeCommand.class,
                    DepCommand.CyclesCommand.class
            }
    )
    static final class DepCommand implements Runnable {
        @ParentCommand
        WorkGraphCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: add | remove | tree | cycles");
        }

        @Command(name = "add", description = "Add an edge: <from> depends on <to>")
        static final class AddCommand implements Callable<Integer> {
            @ParentCommand
            DepCommand dep;

            @Parameters(index = "0", description = "Dependent issue id")
            String fromId;

            @Parameters(index = "1", description = "Dependency issue id")
            String toId;

            @Option(names = {"-t", "--type"}, defaultValue = "blocks",
                    description = "blocks|parent-child|caused-by|validates|tracks|relates-to|discovered-from|supersedes|duplicate-of")
            String type;

            @Option(names = {"--note"}, description = "Note stored on the edge")
            String note;

            @Override
            public Integer call() {
                WorkGraphCommand root = dep.parent;
                System.out.println(Jsons.toJson(root.runtime().addDependency(fromId, toId, type, note, root.actor())));
                return 0;
            }
        }

        @Command(name = "remove", description = "Remove an edge")
        static final class RemoveCommand implements Callable<Integer> {
            @ParentCommand
            DepCommand dep;

            @Parameters(index = "0", description = "Dependent issue id")
            String fromId;

            @Parameters(index = "1", description = "Dependency issue id")
            String toId;

            @Option(names = {"-t", "--type"}, defaultValue = "blocks", description = "Edge type")
            String type;

            @Override
            public Integer call() {
                WorkGraphCommand root = dep.parent;
                root.runtime().removeDependency(fromId, toId, type, root.actor());
                System.out.println(Jsons.toJson(Map.of("removed", true, "from", fromId, "to", toId, "type", type)));
                return 0;
            }
        }

        @Command(name = "tree", description = "Print the dependency tree of an issue")
        static final class TreeCommand implements Callable<Integer> {
            @ParentCommand
            DepCommand dep;

            @Parameters(index = "0", description = "Root issue id")
            String rootId;

            @Option(names = {"--direction"}, defaultValue = "down", description = "down (dependencies) | up (dependents)")
            String direction;

            @Option(names = {"--max-depth"}, description = "Depth bound; defaults to the configured treeMaxDepth")
            Integer maxDepth;

            @Override
            public Integer call() {
                System.out.println(Jsons.toJson(dep.parent.runtime().tree(rootId, direction, maxDepth)));
                return 0;
            }
        }

        @Command(name = "cycles", description = "Audit the blocking graph for cycles")
        static final class CyclesCommand implements Callable<Integer> {
            @ParentCommand
            DepCommand dep;

            @Override
            public Integer call() {
                List<List<String>> cycles = dep.parent.runtime().cycles();
                System.out.println(Jsons.toJson(Map.of("cycles", cycles, "count", cycles.size())));
                return 0;
            }
        }
    }

    @Command(name = "children", description = "List direct children of an issue")
    static final class ChildrenCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Parent issue id")
        String parentId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().children(parentId)));
            return 0;
        }
    }

    @Command(name = "reparent", description = "Move an issue under a new parent")
    static final class ReparentCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Child issue id")
        String childId;

        @Parameters(index = "1", description = "New parent issue id")
        String newParentId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().reparent(childId, newParentId, parent.actor())));
            return 0;
        }
    }

    @Command(name = "epic-status", description = "Child progress of an epic and whether it can be closed")
    static final class EpicStatusCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Epic issue id")
        String epicId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().epicStatus(epicId)));
            return 0;
        }
    }

    @Command(name = "ready", description = "List ready work")
    static final class ReadyCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Max rows; 0 lists all")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().ready(limit)));
            return 0;
        }
    }

    @Command(name = "blocked", description = "List open issues held by unresolved blockers")
    static final class BlockedCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().blocked()));
            return 0;
        }
    }

    @Command(name = "deferred", description = "List deferred issues")
    static final class DeferredCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().deferred()));
            return 0;
        }
    }

    @Command(name = "events", description = "Show the event trail of an issue")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Parameters(index = "0", description = "Issue id")
        String issueId;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Number of latest events")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().events(issueId, limit)));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            var rows = parent.runtime().auditTail(lines);
            for (var row : rows) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Override
        public Integer call() {
            AuditLogger.ChainVerification out = parent.runtime().verifyAudit();
            System.out.println(Jsons.toJson(out));
            return out.valid() ? 0 : EXIT_SYSTEM_ERROR;
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migration versions")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        WorkGraphCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().schemaMigrations(limit)));
            return 0;
        }
    }

    @Command(
            name = "flow",
            description = "Atomic coordination operations with fixed exit codes",
            subcommands = {
                    FlowCommand.ClaimNextCommand.class,
                    FlowCommand.CloseSafeCommand.class,
                    FlowCommand.BlockWithContextCommand.class
            }
    )
    static final class FlowCommand implements Runnable {
        @ParentCommand
        WorkGraphCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: claim-next | close-safe | block-with-context");
        }

        @Command(name = "claim-next", description = "Claim the next ready issue(s) for the actor")
        static final class ClaimNextCommand implements Callable<Integer> {
            @ParentCommand
            FlowCommand flow;

            @Option(names = {"--limit"}, defaultValue = "1", description = "Max issues to claim")
            int limit;

            @Override
            public Integer call() {
                WorkGraphCommand root = flow.parent;
                return printFlow(root.runtime().claimNext(root.actor(), limit));
            }
        }

        @Command(name = "close-safe", description = "Close an issue only if no blockers remain")
        static final class CloseSafeCommand implements Callable<Integer> {
            @ParentCommand
            FlowCommand flow;

            @Parameters(index = "0", description = "Issue id")
            String issueId;

            @Option(names = {"-r", "--reason"}, description = "Close reason")
            String reason;

            @Option(names = {"--verified"}, description = "Who or what verified the work")
            String verified;

            @Option(names = {"--force"}, defaultValue = "false", description = "Close even with open blockers")
            boolean force;

            @Override
            public Integer call() {
                WorkGraphCommand root = flow.parent;
                return printFlow(root.runtime().closeSafe(issueId, reason, verified, force, root.actor()));
            }
        }

        @Command(name = "block-with-context", description = "Block an issue on another, recording why, and release it")
        static final class BlockWithContextCommand implements Callable<Integer> {
            @ParentCommand
            FlowCommand flow;

            @Parameters(index = "0", description = "Issue id")
            String issueId;

            @Option(names = {"--blocker"}, required = true, description = "Blocking issue id")
            String blockerId;

            @Option(names = {"--context"}, required = true, description = "Context pack for whoever picks this up next")
            String context;

            @Override
            public Integer call() {
                WorkGraphCommand root = flow.parent;
                return printFlow(root.runtime().blockWithContext(issueId, blockerId, context, root.actor()));
            }
        }
    }
}
