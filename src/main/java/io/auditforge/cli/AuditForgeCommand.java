package io.auditforge.cli;

import io.auditforge.config.AuditForgeConfig;
import io.auditforge.delta.DeltaReport;
import io.auditforge.model.FindingStatus;
import io.auditforge.model.Phase;
import io.auditforge.model.Severity;
import io.auditforge.model.Tier;
import io.auditforge.observability.AuditLogger;
import io.auditforge.runtime.AuditForgeRuntime;
import io.auditforge.scheduler.PhaseResult;
import io.auditforge.scheduler.PlanFileSelector;
import io.auditforge.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "auditforge",
        mixinStandardHelpOptions = true,
        description = "Multi-phase analysis pipeline orchestrator",
        subcommands = {
                AuditForgeCommand.InitCommand.class,
                AuditForgeCommand.StartCommand.class,
                AuditForgeCommand.RunPhaseCommand.class,
                AuditForgeCommand.StatusCommand.class,
                AuditForgeCommand.DeltaCommand.class,
                AuditForgeCommand.ReclassifiedCommand.class,
                AuditForgeCommand.FindingsCommand.class,
                AuditForgeCommand.HistoryCommand.class,
                AuditForgeCommand.WorkersCommand.class,
                AuditForgeCommand.SettingsCommand.class,
                AuditForgeCommand.JournalVerifyCommand.class
        }
)
public final class AuditForgeCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = AuditForgeConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | start | run-phase | status | delta | reclassified | findings | history | workers | settings | journal-verify");
    }

    AuditForgeRuntime runtime() {
        AuditForgeRuntime runtime = new AuditForgeRuntime(AuditForgeConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Create the data root, phase directories and the finding ledger")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AuditForgeCommand parent;

        @Override
        public Integer call() {
            AuditForgeRuntime runtime = parent.runtime();
            System.out.println("Initialized AuditForge at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "start", description = "Archive the active run and start a new one")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        AuditForgeCommand parent;

        @Option(names = {"--stack"}, description = "Reuse the latest archived run through a file-level delta")
        boolean stack;

        @Option(names = {"--tier"}, description = "quick | standard | deep")
        String tier;

        @Option(names = {"--max-concurrency"}, description = "Upper bound on batch size (0 = tier ceiling)")
        Integer maxConcurrency;

        @Option(names = {"--worker"}, description = "Worker class per phase, e.g. analyze=echo")
        Map<String, String> workers;

        @Override
        public Integer call() {
            Map<Phase, String> workerClasses = new EnumMap<>(Phase.class);
            if (workers != null) {
                for (Map.Entry<String, String> entry : workers.entrySet()) {
                    workerClasses.put(Phase.fromString(entry.getKey()), entry.getValue());
                }
            }
            AuditForgeRuntime.StartOutcome outcome = parent.runtime().startRun(new AuditForgeRuntime.StartRequest(
                    tier == null ? null : Tier.fromString(tier),
                    maxConcurrency,
                    workerClasses,
                    stack
            ));
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "run-phase", description = "Run (or resume) one phase of the active run")
    static final class RunPhaseCommand implements Callable<Integer> {
        @ParentCommand
        AuditForgeCommand parent;

        @Option(names = {"--phase"}, required = true, description = "scan | analyze | synthesize | investigate | report | verify")
        String phase;

        @Option(names = {"--plan"}, description = "Work plan JSON file; optional when resuming")
        Path plan;

        @Override
        public Integer call() {
            PlanFileSelector selector = plan == null ? null : PlanFileSelector.load(plan);
            PhaseResult result = parent.runtime().runPhase(
                    Phase.fromString(phase),
                    selector,
                    selector == null ? null : selector.declaredScope(),
                    null
            );
            System.out.println(Jsons.toJson(result));
            return 0;
        }
    }

    @Command(name = "status", description = "Show current phase, batch progress and the next step")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        AuditForgeCommand parent;

        @Override
        public Integer call() {
            Optional<AuditForgeRuntime.StatusView> status = parent.runtime().status();
            if (status.isEmpty()) {
                System.out.println("{\"error\":\"no active run\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(status.get()));
            return 0;
        }
    }

    @Command(name = "delta", description = "Show the file-level delta of a stacked run")
    static final class DeltaCommand implements Callable<Integer> {
        @ParentCommand
        AuditForgeCommand parent;

        @Option(names = {"--summary"}, description = "Print only the counts")
        boolean summaryOnly;

        @Override
        public Integer call() {
            Optional<DeltaReport> delta = parent.runtime().delta();
            if (delta.isEmpty()) {
                System.out.println("{\"error\":\"active run is not stacked\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(summaryOnly ? delta.get().summary() : delta.get()));
            return 0;
        }
    }

    @Command(name = "reclassified", description = "Show prior findings with their re-check tags")
    static final class ReclassifiedCommand implements Callable<Integer> {
        @ParentCommand
        AuditForgeCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().reclassifiedFindings()));
            return 0;
        }
    }

    @Command(name = "findings", description = "List findings of the current or previous run")
    static final class FindingsCommand implements Callable<Integer> {
        @ParentCommand
        AuditForgeCommand parent;

        @Option(names = {"--severity"}, description = "info | low | medium | high | critical")
        String severity;

        @Option(names = {"--status"}, description = "confirmed | potential | not_vulnerable | needs_review")
        String status;

        @Option(names = {"--run"}, defaultValue = "current", description = "current | previous | latest")
        String run;

        @Override
        public Integer call() {
            AuditForgeRuntime.FindingFilter filter = new AuditForgeRuntime.FindingFilter(
                    severity == null ? null : Severity.fromString(severity),
                    status == null ? null : FindingStatus.fromString(status),
                    run
            );
            System.out.println(Jsons.toJson(parent.runtime().findings(filter)));
            return 0;
        }
    }

    @Command(name = "history", description = "List archived runs")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        AuditForgeCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().history()));
            return 0;
        }
    }

    @Command(name = "workers", description = "List registered worker classes")
    static final class WorkersCommand implements Callable<Integer> {
        @ParentCommand
        AuditForgeCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().workerRegistry().listWorkerIds()));
            return 0;
        }
    }

    @Command(name = "settings", description = "Show effective settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        AuditForgeCommand parent;

        @Override
        public Integer call() {
            AuditForgeRuntime runtime = parent.runtime();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("settingsFile", runtime.config().settingsFile().toString());
            out.put("settings", runtime.settings());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "journal-verify", description = "Verify the hash chain of the orchestration journal")
    static final class JournalVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AuditForgeCommand parent;

        @Override
        public Integer call() {
            AuditLogger.IntegrityOutcome outcome = parent.runtime().verifyJournal();
            System.out.println(Jsons.toJson(outcome));
            return outcome.ok() ? 0 : 1;
        }
    }
}
