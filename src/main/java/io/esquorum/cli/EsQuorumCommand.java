package io.esquorum.cli;

import io.esquorum.config.OperatorConfig;
import io.esquorum.config.OperatorSettings;
import io.esquorum.membership.MembershipStore;
import io.esquorum.observability.AuditLogger;
import io.esquorum.quorum.QuorumCalculator;
import io.esquorum.reconcile.ReconcileOutcome;
import io.esquorum.reconcile.ReconcileTrigger;
import io.esquorum.reconcile.ReconciliationStatus;
import io.esquorum.runtime.OperatorRuntime;
import io.esquorum.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "esquorum",
        mixinStandardHelpOptions = true,
        description = "Search-cluster membership and quorum operator",
        subcommands = {
                EsQuorumCommand.QuorumCommand.class,
                EsQuorumCommand.SeedsCommand.class,
                EsQuorumCommand.ReconcileCommand.class,
                EsQuorumCommand.RenderConfigCommand.class,
                EsQuorumCommand.HealthCommand.class,
                EsQuorumCommand.MetricsCommand.class,
                EsQuorumCommand.StopCommand.class,
                EsQuorumCommand.AuditVerifyCommand.class
        }
)
public final class EsQuorumCommand implements Runnable {
    @Option(names = {"--root"}, description = "Operator data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--app"}, description = "Application name used for seed host names", defaultValue = OperatorConfig.DEFAULT_APP)
    String app;

    @Option(names = {"--cluster-name"}, description = "Override the cluster name from operator-settings.json")
    String clusterName;

    @Override
    public void run() {
        System.out.println("Use subcommands: quorum | seeds | reconcile | render-config | health | metrics | stop | audit-verify");
    }

    OperatorConfig config() {
        return OperatorConfig.fromRoot(root, app);
    }

    OperatorRuntime runtime() {
        OperatorConfig config = config();
        OperatorSettings settings = OperatorSettings.load(config.settingsFile());
        if (clusterName != null && !clusterName.isBlank()) {
            settings = settings.withClusterName(clusterName);
        }
        return new OperatorRuntime(config, settings);
    }

    @Command(name = "quorum", description = "Print the minimum master nodes for a member count")
    static final class QuorumCommand implements Callable<Integer> {
        @Option(names = {"--members"}, required = true, description = "Total members, self included")
        int members;

        @Override
        public Integer call() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("members", members);
            out.put("quorum", QuorumCalculator.idealQuorum(members));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "seeds", description = "Print the deterministic seed host names")
    static final class SeedsCommand implements Callable<Integer> {
        @ParentCommand
        EsQuorumCommand parent;

        @Option(names = {"--size"}, description = "Seed group size (default from operator-settings.json)")
        Integer size;

        @Override
        public Integer call() {
            OperatorConfig config = parent.config();
            int seedSize = size == null
                    ? OperatorSettings.load(config.settingsFile()).seedSize()
                    : Math.max(1, size);
            List<String> hosts = new ArrayList<>(seedSize);
            for (int i = 0; i < seedSize; i++) {
                hosts.add(MembershipStore.seedHostAt(config.app(), i));
            }
            System.out.println(Jsons.toJson(hosts));
            return 0;
        }
    }

    @Command(name = "reconcile", description = "Run reconciliation passes against membership.json and the backend")
    static final class ReconcileCommand implements Callable<Integer> {
        @ParentCommand
        EsQuorumCommand parent;

        @Option(names = {"--trigger"}, defaultValue = "health-tick",
                description = "First pass trigger: peer-joined | peer-changed | health-tick | config-changed")
        String trigger;

        @Option(names = {"--interval-ms"}, description = "Health tick interval (default from operator-settings.json)")
        Long intervalMs;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run one pass and exit")
        boolean once;

        @Override
        public Integer call() throws Exception {
            OperatorRuntime runtime = parent.runtime();
            ReconcileTrigger next = ReconcileTrigger.fromString(trigger);
            long sleepMs = Math.max(1_000L, intervalMs == null ? runtime.settings().healthIntervalMs() : intervalMs);
            while (true) {
                ReconcileOutcome out = runtime.handle(next);
                System.out.println(Jsons.toJson(out));
                if (once) {
                    return out.status() == ReconciliationStatus.DEGRADED ? 1 : 0;
                }
                next = ReconcileTrigger.HEALTH_TICK;
                Thread.sleep(sleepMs);
            }
        }
    }

    @Command(name = "render-config", description = "Re-render elasticsearch.yml after a configuration change")
    static final class RenderConfigCommand implements Callable<Integer> {
        @ParentCommand
        EsQuorumCommand parent;

        @Override
        public Integer call() {
            OperatorRuntime runtime = parent.runtime();
            ReconcileOutcome out = runtime.onConfigChanged();
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("rendered", out.reconfigured());
            view.put("path", runtime.config().renderedConfigFile().toString());
            view.put("seeds", out.observed().seeds());
            view.put("status", out.status().label());
            view.put("message", out.message());
            System.out.println(Jsons.toJson(view));
            return out.reconfigured() || !out.leader() ? 0 : 1;
        }
    }

    @Command(name = "health", description = "Run one health tick and print unit health")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        EsQuorumCommand parent;

        @Override
        public Integer call() {
            OperatorRuntime runtime = parent.runtime();
            runtime.onHealthTick();
            OperatorRuntime.HealthOutcome out = runtime.health();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }

    @Command(name = "metrics", description = "Run one health tick and print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        EsQuorumCommand parent;

        @Override
        public Integer call() {
            OperatorRuntime runtime = parent.runtime();
            runtime.onHealthTick();
            System.out.print(runtime.metricsText());
            return 0;
        }
    }

    @Command(name = "stop", description = "Mark this unit as terminating")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        EsQuorumCommand parent;

        @Override
        public Integer call() {
            OperatorRuntime runtime = parent.runtime();
            runtime.onStop();
            System.out.println(Jsons.toJson(runtime.health()));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        EsQuorumCommand parent;

        @Override
        public Integer call() {
            AuditLogger.VerifyOutcome out = new AuditLogger(parent.config().auditFile(), parent.config().app()).verify();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }
}
