package io.calcrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.calcrelay.bulk.BulkLoader;
import io.calcrelay.config.CalcRelayConfig;
import io.calcrelay.config.RunnerSettings;
import io.calcrelay.engine.OutputClassifier;
import io.calcrelay.engine.ProcessEngine;
import io.calcrelay.engine.RequiredOutputsClassifier;
import io.calcrelay.engine.ScriptRenderer;
import io.calcrelay.engine.StepExecutor;
import io.calcrelay.engine.StopSignal;
import io.calcrelay.error.NotFoundException;
import io.calcrelay.model.CalcJobRow;
import io.calcrelay.model.CalcJobSummary;
import io.calcrelay.model.ClientRow;
import io.calcrelay.model.CodeRow;
import io.calcrelay.model.ProcessingView;
import io.calcrelay.observability.AuditLogger;
import io.calcrelay.remote.GatewayRegistry;
import io.calcrelay.remote.RemoteGatewayFactory;
import io.calcrelay.runner.CalcJobRunner;
import io.calcrelay.runner.RunOutcome;
import io.calcrelay.security.SensitiveDataMasker;
import io.calcrelay.storage.CalcJobFilter;
import io.calcrelay.storage.ContentStore;
import io.calcrelay.storage.Database;
import io.calcrelay.storage.MetadataStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One project directory: database, object store, audit log and runner
 * settings, plus the operations the CLI exposes over them.
 */
public final class CalcRelayRuntime {
    private final CalcRelayConfig config;
    private final Database database;
    private final ContentStore contentStore;
    private final MetadataStore metadataStore;
    private final AuditLogger auditLogger;
    private RunnerSettings settings;

    public CalcRelayRuntime(CalcRelayConfig config) {
        this.config = config;
        this.database = new Database(config);
        this.contentStore = new ContentStore(config);
        this.metadataStore = new MetadataStore(database, contentStore);
        this.auditLogger = new AuditLogger(config.auditFile());
        this.settings = RunnerSettings.defaults();
    }

    public void init() {
        database.init();
        contentStore.init();
        settings = RunnerSettings.load(config);
    }

    public CalcRelayConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ContentStore contentStore() {
        return contentStore;
    }

    public MetadataStore metadataStore() {
        return metadataStore;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public RunnerSettings settings() {
        return settings;
    }

    public BulkLoader.LoadResult addFromFile(Path file) {
        BulkLoader.LoadResult result = new BulkLoader(contentStore, metadataStore).load(file);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("file", file.toAbsolutePath().toString());
        details.put("objects", result.objects().size());
        details.put("clients", result.clients().size());
        details.put("codes", result.codes().size());
        details.put("calcjobs", result.calcjobs().size());
        auditLogger.log(AuditLogger.AuditEvent.global("project.import", "cli", "ok", details));
        return result;
    }

    public StatusSnapshot status() {
        return new StatusSnapshot(
                config.rootDir().toString(),
                contentStore.count(),
                metadataStore.countClients(),
                metadataStore.countCodes(),
                metadataStore.countCalcJobs(CalcJobFilter.all()),
                metadataStore.countByState()
        );
    }

    public List<ClientSummary> listClients() {
        List<ClientSummary> out = new ArrayList<>();
        for (ClientRow row : metadataStore.listClients()) {
            out.add(ClientSummary.of(row));
        }
        return out;
    }

    public ClientSummary showClient(String labelOrPk) {
        Optional<ClientRow> row = metadataStore.findClientByLabel(labelOrPk);
        if (row.isEmpty()) {
            Long pk = parsePk(labelOrPk);
            row = pk == null ? Optional.empty() : metadataStore.getClient(pk);
        }
        return ClientSummary.of(row.orElseThrow(() -> new NotFoundException("No client " + labelOrPk)));
    }

    public List<CodeRow> listCodes() {
        return metadataStore.listCodes();
    }

    public CodeRow showCode(String labelOrPk) {
        Optional<CodeRow> row = metadataStore.findCodeByLabel(labelOrPk);
        if (row.isEmpty()) {
            Long pk = parsePk(labelOrPk);
            row = pk == null ? Optional.empty() : metadataStore.getCode(pk);
        }
        return row.orElseThrow(() -> new NotFoundException("No code " + labelOrPk));
    }

    public CalcJobPage listCalcJobs(CalcJobFilter filter, int limit, int offset) {
        List<CalcJobSummary> rows = metadataStore.listCalcJobs(filter, limit, offset);
        return new CalcJobPage(metadataStore.countCalcJobs(filter), offset, rows);
    }

    /**
     * Accepts either a primary key or a uuid.
     */
    public CalcJobDetail showCalcJob(String pkOrUuid) {
        Optional<CalcJobRow> row = metadataStore.findCalcJobByUuid(pkOrUuid);
        if (row.isEmpty()) {
            Long pk = parsePk(pkOrUuid);
            row = pk == null ? Optional.empty() : metadataStore.getCalcJob(pk);
        }
        CalcJobRow calcjob = row.orElseThrow(() -> new NotFoundException("No calcjob " + pkOrUuid));
        CodeRow code = metadataStore.requireCode(calcjob.codePk());
        ClientRow client = metadataStore.requireClient(code.clientPk());
        ProcessingView processing = metadataStore.requireProcessing(calcjob.pk());
        return new CalcJobDetail(calcjob, code.label(), client.label(), processing);
    }

    public byte[] readObject(String key) {
        return contentStore.get(key);
    }

    public List<JsonNode> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public AuditLogger.IntegrityReport verifyAudit() {
        return auditLogger.verify();
    }

    public List<Database.SchemaMigrationRow> listSchemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    public RunnerHandle openRunner(RunnerSettings runSettings, int limit, String owner) {
        return openRunner(runSettings, RemoteGatewayFactory.byScheme(runSettings.requestTimeoutMs()),
                new RequiredOutputsClassifier(), limit, owner);
    }

    /**
     * Wires a runner with its own stop signal and gateway sessions. Closing
     * the handle closes the sessions.
     */
    public RunnerHandle openRunner(
            RunnerSettings runSettings,
            RemoteGatewayFactory gatewayFactory,
            OutputClassifier classifier,
            int limit,
            String owner
    ) {
        StopSignal stop = new StopSignal();
        GatewayRegistry gateways = new GatewayRegistry(gatewayFactory, runSettings.statusCacheTtlMs());
        StepExecutor executor = new StepExecutor(contentStore, gateways, runSettings, new ScriptRenderer(), classifier, stop);
        ProcessEngine engine = new ProcessEngine(metadataStore, executor, auditLogger);
        CalcJobRunner runner = new CalcJobRunner(metadataStore, engine, runSettings, auditLogger, stop, owner, limit);
        return new RunnerHandle(runner, gateways);
    }

    public RunOutcome runUntilIdle(RunnerSettings runSettings, int limit) {
        try (RunnerHandle handle = openRunner(runSettings, limit, null)) {
            return handle.runner().runUntilIdle();
        }
    }

    private static Long parsePk(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static final class RunnerHandle implements AutoCloseable {
        private final CalcJobRunner runner;
        private final GatewayRegistry gateways;

        RunnerHandle(CalcJobRunner runner, GatewayRegistry gateways) {
            this.runner = runner;
            this.gateways = gateways;
        }

        public CalcJobRunner runner() {
            return runner;
        }

        public GatewayRegistry gateways() {
            return gateways;
        }

        @Override
        public void close() {
            gateways.close();
        }
    }

    public record StatusSnapshot(
            String root,
            int objects,
            long clients,
            long codes,
            long calcjobs,
            Map<String, Long> calcjobsByState
    ) {
    }

    public record ClientSummary(
            long pk,
            String label,
            String clientUrl,
            String clientId,
            String clientSecret,
            String tokenUri,
            String machineName,
            String workDir,
            int smallFileSizeMb,
            long createdAtMs
    ) {
        static ClientSummary of(ClientRow row) {
            return new ClientSummary(
                    row.pk(),
                    row.label(),
                    row.clientUrl(),
                    row.clientId(),
                    SensitiveDataMasker.maskSecret(row.clientSecret()),
                    row.tokenUri(),
                    row.machineName(),
                    row.workDir(),
                    row.smallFileSizeMb(),
                    row.createdAtMs()
            );
        }
    }

    public record CalcJobPage(long total, int offset, List<CalcJobSummary> calcjobs) {
    }

    public record CalcJobDetail(
            CalcJobRow calcjob,
            String codeLabel,
            String clientLabel,
            ProcessingView processing
    ) {
    }
}
