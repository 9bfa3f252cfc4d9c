package io.calcrelay.cli;

import io.calcrelay.bulk.BulkLoader;
import io.calcrelay.config.CalcRelayConfig;
import io.calcrelay.config.RunnerSettings;
import io.calcrelay.error.NotFoundException;
import io.calcrelay.model.ProcessState;
import io.calcrelay.model.ProcessStep;
import io.calcrelay.observability.AuditLogger;
import io.calcrelay.runner.RunOutcome;
import io.calcrelay.runtime.CalcRelayRuntime;
import io.calcrelay.storage.CalcJobFilter;
import io.calcrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "calcrelay",
        mixinStandardHelpOptions = true,
        version = "calcrelay 0.1.0",
        description = "Durable runner for remote calculation jobs",
        subcommands = {
                CalcRelayCommand.InitCommand.class,
                CalcRelayCommand.AddCommand.class,
                CalcRelayCommand.StatusCommand.class,
                CalcRelayCommand.RunCommand.class,
                CalcRelayCommand.ClientCommand.class,
                CalcRelayCommand.CodeCommand.class,
                CalcRelayCommand.CalcJobCommand.class,
                CalcRelayCommand.ObjectCommand.class,
                CalcRelayCommand.AuditTailCommand.class,
                CalcRelayCommand.AuditVerifyCommand.class,
                CalcRelayCommand.SchemaMigrationsCommand.class
        }
)
public final class CalcRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Project directory", defaultValue = CalcRelayConfig.DEFAULT_PROJECT_DIR)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | add | status | run | client | code | calcjob | object | audit-tail | audit-verify | schema-migrations");
    }

    CalcRelayRuntime runtime() {
        return new CalcRelayRuntime(CalcRelayConfig.fromRoot(root));
    }

    /**
     * Opens an existing project; {@code init} is the only command that creates one.
     */
    CalcRelayRuntime existingRuntime() {
        CalcRelayRuntime runtime = runtime();
        if (!runtime.database().isInitialized()) {
            throw new IllegalStateException("No project at " + runtime.config().rootDir() + ", run 'calcrelay init' first");
        }
        runtime.init();
        return runtime;
    }

    static int error(String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        System.out.println(Jsons.toJson(out));
        return 1;
    }

    @Command(name = "init", description = "Create the project directory and database")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        CalcRelayCommand parent;

        @Option(names = {"--add"}, description = "Import file to load after initialising")
        Path add;

        @Override
        public Integer call() {
            CalcRelayRuntime runtime = parent.runtime();
            runtime.init();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("root", runtime.config().rootDir().toString());
            if (add != null) {
                try {
                    out.put("added", runtime.addFromFile(add));
                } catch (IllegalArgumentException | NotFoundException e) {
                    return error(e.getMessage());
                }
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "add", description = "Import objects, clients, codes and calcjobs from a JSON file")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        CalcRelayCommand parent;

        @Parameters(index = "0", description = "Import file")
        Path file;

        @Override
        public Integer call() {
            CalcRelayRuntime runtime = parent.existingRuntime();
            BulkLoader.LoadResult result;
            try {
                result = runtime.addFromFile(file);
            } catch (IllegalArgumentException | NotFoundException e) {
                return error(e.getMessage());
            }
            System.out.println(Jsons.toJson(result));
            return 0;
        }
    }

    @Command(name = "status", description = "Object count, row counts and calcjob states")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        CalcRelayCommand parent;

        @Override
        public Integer call() {
            CalcRelayRuntime runtime = parent.existingRuntime();
            System.out.println(Jsons.toJson(runtime.status()));
            return 0;
        }
    }

    @Command(name = "run", description = "Drive playing calcjobs until none are left, or until stopped with --serve")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        CalcRelayCommand parent;

        @Option(names = {"-n", "--concurrency"}, description = "Calcjobs driven at the same time")
        Integer concurrency;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Maximum calcjobs to drive, 0 for no limit")
        int limit;

        @Option(names = {"--serve"}, defaultValue = "false", description = "Keep selecting new calcjobs until interrupted")
        boolean serve;

        @Option(names = {"--owner"}, description = "Lease owner name, defaults to runner-<pid>")
        String owner;

        @Option(names = {"--max-attempts"}, description = "Attempts per step before a retryable failure excepts the calcjob")
        Integer maxAttempts;

        @Option(names = {"--graceful-timeout-ms"}, defaultValue = "30000",
                description = "How long an interrupt waits for in-flight steps to finish")
        long gracefulTimeoutMs;

        @Override
        public Integer call() {
            CalcRelayRuntime runtime = parent.existingRuntime();
            RunnerSettings settings = runtime.settings();
            if (concurrency != null) {
                settings = settings.withConcurrency(concurrency);
            }
            if (maxAttempts != null) {
                settings = settings.withMaxStepAttempts(maxAttempts);
            }
            CountDownLatch done = new CountDownLatch(1);
            try (CalcRelayRuntime.RunnerHandle handle = runtime.openRunner(settings, limit, owner)) {
                Thread hook = new Thread(() -> {
                    handle.runner().requestStop();
                    try {
                        done.await(Math.max(0L, gracefulTimeoutMs), TimeUnit.MILLISECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }, "calcrelay-shutdown-hook");
                Runtime.getRuntime().addShutdownHook(hook);
                RunOutcome outcome = serve ? handle.runner().serve() : handle.runner().runUntilIdle();
                System.out.println(Jsons.toJson(outcome));
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException ignored) {
                    // JVM is already shutting down; the hook is running.
                }
            } finally {
                done.countDown();
            }
            return 0;
        }
    }

    @Command(name = "client", description = "Inspect clients",
            subcommands = {ClientListCommand.class, ClientShowCommand.class})
    static final class ClientCommand implements Runnable {
        @ParentCommand
        CalcRelayCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: list | show");
        }
    }

    @Command(name = "list", description = "List clients")
    static final class ClientListCommand implements Callable<Integer> {
        @ParentCommand
        ClientCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.parent.existingRuntime().listClients()));
            return 0;
        }
    }

    @Command(name = "show", description = "Show one client by label or pk")
    static final class ClientShowCommand implements Callable<Integer> {
        @ParentCommand
        ClientCommand parent;

        @Parameters(index = "0", description = "Client label or pk")
        String client;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.parent.existingRuntime().showClient(client)));
                return 0;
            } catch (NotFoundException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "code", description = "Inspect codes",
            subcommands = {CodeListCommand.class, CodeShowCommand.class})
    static final class CodeCommand implements Runnable {
        @ParentCommand
        CalcRelayCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: list | show");
        }
    }

    @Command(name = "list", description = "List codes")
    static final class CodeListCommand implements Callable<Integer> {
        @ParentCommand
        CodeCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.parent.existingRuntime().listCodes()));
            return 0;
        }
    }

    @Command(name = "show", description = "Show one code by label or pk")
    static final class CodeShowCommand implements Callable<Integer> {
        @ParentCommand
        CodeCommand parent;

        @Parameters(index = "0", description = "Code label or pk")
        String code;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.parent.existingRuntime().showCode(code)));
                return 0;
            } catch (NotFoundException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "calcjob", description = "Inspect calcjobs",
            subcommands = {CalcJobListCommand.class, CalcJobShowCommand.class})
    static final class CalcJobCommand implements Runnable {
        @ParentCommand
        CalcRelayCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: list | show");
        }
    }

    @Command(name = "list", description = "List calcjobs with their processing state")
    static final class CalcJobListCommand implements Callable<Integer> {
        @ParentCommand
        CalcJobCommand parent;

        @Option(names = {"--state"}, description = "playing|finished|excepted")
        String state;

        @Option(names = {"--step"}, description = "Current step, e.g. polling")
        String step;

        @Option(names = {"--code"}, description = "Code label")
        String code;

        @Option(names = {"--client"}, description = "Client label")
        String client;

        @Option(names = {"--label"}, description = "Calcjob label pattern, % and _ as wildcards")
        String label;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Page size")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Rows to skip")
        int offset;

        @Override
        public Integer call() {
            CalcJobFilter filter;
            try {
                filter = filter();
            } catch (IllegalArgumentException e) {
                return error(e.getMessage());
            }
            System.out.println(Jsons.toJson(parent.parent.existingRuntime().listCalcJobs(filter, limit, offset)));
            return 0;
        }

        CalcJobFilter filter() {
            List<CalcJobFilter> parts = new ArrayList<>();
            if (state != null) {
                parts.add(CalcJobFilter.stateIs(ProcessState.fromString(state)));
            }
            if (step != null) {
                parts.add(CalcJobFilter.stepIs(ProcessStep.fromString(step)));
            }
            if (code != null) {
                parts.add(CalcJobFilter.codeLabelIs(code));
            }
            if (client != null) {
                parts.add(CalcJobFilter.clientLabelIs(client));
            }
            if (label != null) {
                parts.add(CalcJobFilter.labelLike(label));
            }
            return CalcJobFilter.and(parts.toArray(new CalcJobFilter[0]));
        }
    }

    @Command(name = "show", description = "Show one calcjob by pk or uuid")
    static final class CalcJobShowCommand implements Callable<Integer> {
        @ParentCommand
        CalcJobCommand parent;

        @Parameters(index = "0", description = "Calcjob pk or uuid")
        String calcjob;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.parent.existingRuntime().showCalcJob(calcjob)));
                return 0;
            } catch (NotFoundException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "object", description = "Read stored objects", subcommands = {ObjectCatCommand.class})
    static final class ObjectCommand implements Runnable {
        @ParentCommand
        CalcRelayCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: cat");
        }
    }

    @Command(name = "cat", description = "Write an object's bytes to stdout")
    static final class ObjectCatCommand implements Callable<Integer> {
        @ParentCommand
        ObjectCommand parent;

        @Parameters(index = "0", description = "Content key")
        String key;

        @Override
        public Integer call() throws IOException {
            byte[] content;
            try {
                content = parent.parent.existingRuntime().readObject(key);
            } catch (NotFoundException e) {
                return error(e.getMessage());
            }
            PrintStream out = System.out;
            out.write(content);
            out.flush();
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        CalcRelayCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            CalcRelayRuntime runtime = parent.existingRuntime();
            for (var row : runtime.auditTail(lines)) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Check the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        CalcRelayCommand parent;

        @Override
        public Integer call() {
            AuditLogger.IntegrityReport report = parent.existingRuntime().verifyAudit();
            System.out.println(Jsons.toJson(report));
            return report.ok() ? 0 : 2;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        CalcRelayCommand parent;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.existingRuntime().listSchemaMigrations(limit)));
            return 0;
        }
    }
}
