package io.fleetstate.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.fleetstate.config.FleetStateConfig;
import io.fleetstate.model.CleanupArgs;
import io.fleetstate.model.CleanupKind;
import io.fleetstate.model.CleanupTask;
import io.fleetstate.observability.AuditLogger;
import io.fleetstate.runtime.CleanupRuntime;
import io.fleetstate.state.ModelState;
import io.fleetstate.state.ModelStateProvider;
import io.fleetstate.state.ModelStateProviders;
import io.fleetstate.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "fleetstate",
        mixinStandardHelpOptions = true,
        description = "fleetstate cleanup engine CLI",
        subcommands = {
                FleetStateCommand.InitCommand.class,
                FleetStateCommand.EnqueueCommand.class,
                FleetStateCommand.PendingCommand.class,
                FleetStateCommand.TasksCommand.class,
                FleetStateCommand.RunCommand.class,
                FleetStateCommand.SettingsCommand.class,
                FleetStateCommand.AuditVerifyCommand.class
        }
)
public final class FleetStateCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Runtime namespace (model scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | enqueue | pending | tasks | run | settings | audit-verify");
    }

    FleetStateConfig config() {
        return FleetStateConfig.fromRoot(root, namespace);
    }

    CleanupRuntime runtime() {
        return new CleanupRuntime(config(), null);
    }

    CleanupRuntime runtime(ModelState state) {
        return new CleanupRuntime(config(), state);
    }

    /**
     * Reads each raw argument as JSON; anything that is not valid JSON is taken as a string.
     */
    static CleanupArgs parseArgs(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return CleanupArgs.none();
        }
        List<JsonNode> values = new ArrayList<>(raw.size());
        for (String value : raw) {
            JsonNode node;
            try {
                node = Jsons.readTree(value);
            } catch (RuntimeException e) {
                node = TextNode.valueOf(value);
            }
            values.add(node == null || node.isMissingNode() ? TextNode.valueOf(value) : node);
        }
        return new CleanupArgs(values);
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        FleetStateCommand parent;

        @Override
        public Integer call() {
            CleanupRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println("Initialized fleetstate at: " + parent.config().rootDir());
            return 0;
        }
    }

    @Command(name = "enqueue", description = "Queue a cleanup task")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        FleetStateCommand parent;

        @Option(names = {"--kind"}, required = true, description = "Cleanup kind, e.g. dyingUnit or DYING_UNIT")
        String kind;

        @Option(names = {"--prefix"}, defaultValue = "", description = "Entity the cleanup applies to")
        String prefix;

        @Option(names = {"--arg"}, description = "Handler argument as JSON; repeat in order")
        List<String> args;

        @Option(names = {"--delay-ms"}, defaultValue = "0", description = "Delay before the task becomes due")
        long delayMs;

        @Override
        public Integer call() {
            CleanupKind cleanupKind;
            try {
                cleanupKind = CleanupKind.fromString(kind);
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                return 1;
            }
            CleanupRuntime runtime = parent.runtime();
            runtime.init();
            CleanupArgs cleanupArgs = parseArgs(args);
            CleanupRuntime.EnqueueOutcome out = delayMs > 0
                    ? runtime.enqueueCleanupAt(Instant.now().plusMillis(delayMs), cleanupKind, prefix, cleanupArgs)
                    : runtime.enqueueCleanup(cleanupKind, prefix, cleanupArgs);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "pending", description = "Show how many cleanups are queued and due")
    static final class PendingCommand implements Callable<Integer> {
        @ParentCommand
        FleetStateCommand parent;

        @Override
        public Integer call() {
            CleanupRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.pending()));
            return 0;
        }
    }

    @Command(name = "tasks", description = "List queued cleanups")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        FleetStateCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            CleanupRuntime runtime = parent.runtime();
            runtime.init();
            List<Map<String, Object>> rows = new ArrayList<>();
            for (CleanupTask task : runtime.store().list(limit)) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("cleanupId", task.id());
                row.put("kind", task.kindName());
                row.put("prefix", task.prefix());
                row.put("dueAt", task.dueAt() == null ? null : task.dueAt().toString());
                row.put("args", task.argsJson());
                row.put("knownKind", task.kind().isPresent());
                rows.add(row);
            }
            System.out.println(Jsons.toJson(rows));
            return 0;
        }
    }

    @Command(name = "run", description = "Run one cleanup pass against a model state backend")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        FleetStateCommand parent;

        @Option(names = {"--backend"}, description = "Model state backend name; optional when only one is installed")
        String backend;

        @Override
        public Integer call() {
            ModelStateProvider provider;
            try {
                provider = ModelStateProviders.find(backend);
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                return 1;
            }
            CleanupRuntime runtime = parent.runtime(provider.open(parent.config()));
            runtime.init();
            CleanupRuntime.RunOutcome out = runtime.runCleanup();
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "settings", description = "Show effective cleanup settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        FleetStateCommand parent;

        @Override
        public Integer call() {
            CleanupRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.currentSettings()));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of the cleanup audit log")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        FleetStateCommand parent;

        @Override
        public Integer call() {
            CleanupRuntime runtime = parent.runtime();
            runtime.init();
            AuditLogger.IntegrityOutcome out = runtime.verifyAudit();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }
}
