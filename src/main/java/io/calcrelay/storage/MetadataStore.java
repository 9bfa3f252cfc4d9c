package io.calcrelay.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.calcrelay.error.ConcurrencyViolationException;
import io.calcrelay.error.NotFoundException;
import io.calcrelay.model.CalcJobRow;
import io.calcrelay.model.CalcJobSummary;
import io.calcrelay.model.ClientRow;
import io.calcrelay.model.CodeRow;
import io.calcrelay.model.ProcessState;
import io.calcrelay.model.ProcessStep;
import io.calcrelay.model.ProcessingView;
import io.calcrelay.remote.RemotePaths;
import io.calcrelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable rows for clients, codes, calcjobs and their processing records.
 *
 * <p>The processing row is the only mutable record. It changes through
 * {@link #commitTransition} under a lease granted by {@link #tryClaim}.
 */
public final class MetadataStore {
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private static final String CLIENT_COLUMNS =
            "pk,label,client_url,client_id,client_secret,token_uri,machine_name,work_dir,small_file_size_mb,created_at_ms";
    private static final String CODE_COLUMNS = "pk,label,client_pk,script,upload_paths,created_at_ms";
    private static final String CALCJOB_COLUMNS =
            "pk,label,uuid,code_pk,parameters,upload_paths,download_globs,created_at_ms";
    private static final String PROCESSING_COLUMNS = """
            calcjob_pk,state,step,job_id,remote_state,script_key,exception,failed_step,retrieved_paths,
            lease_owner,lease_epoch,created_at_ms,updated_at_ms""";
    private static final String SUMMARY_FROM = """
            FROM calcjobs c
            JOIN processing p ON p.calcjob_pk=c.pk
            JOIN codes co ON co.pk=c.code_pk
            JOIN clients cl ON cl.pk=co.client_pk
            """;

    private final Database database;
    private final ContentStore contentStore;

    /**
     * @param contentStore where upload-path keys must already exist when rows are imported
     */
    public MetadataStore(Database database, ContentStore contentStore) {
        this.database = database;
        this.contentStore = contentStore;
    }

    /**
     * Inserts the batch in one transaction. Upload paths, content keys and
     * calcjob uuids are checked before anything is written; a label that is
     * already taken fails with {@link IllegalArgumentException}.
     */
    public ImportBatch.Result importBatch(ImportBatch batch) {
        for (ImportBatch.NewCode code : batch.codes()) {
            checkUploadPaths("code '" + code.label() + "'", code.uploadPaths());
        }
        for (ImportBatch.NewCalcJob job : batch.calcjobs()) {
            String name = "calcjob '" + job.label() + "'";
            checkUploadPaths(name, job.uploadPaths());
            if (job.uuid() != null && !job.uuid().isBlank()) {
                try {
                    RemotePaths.requireSegment(job.uuid());
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid uuid for " + name + ": " + e.getMessage(), e);
                }
            }
        }
        long nowMs = System.currentTimeMillis();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                Map<String, Long> clientPks = new HashMap<>();
                Map<String, Long> codePks = new HashMap<>();
                List<Long> insertedClients = new ArrayList<>();
                List<Long> insertedCodes = new ArrayList<>();
                List<Long> insertedCalcJobs = new ArrayList<>();

                for (ImportBatch.NewClient client : batch.clients()) {
                    if (clientPks.containsKey(client.label()) || lookupPkByLabel(c, "clients", client.label()).isPresent()) {
                        throw new IllegalArgumentException("Client label already exists: " + client.label());
                    }
                    long pk = insertClient(c, client, nowMs);
                    clientPks.put(client.label(), pk);
                    insertedClients.add(pk);
                }
                for (ImportBatch.NewCode code : batch.codes()) {
                    Long clientPk = clientPks.get(code.clientLabel());
                    if (clientPk == null) {
                        clientPk = lookupPkByLabel(c, "clients", code.clientLabel())
                                .orElseThrow(() -> new NotFoundException("Client not found: " + code.clientLabel()));
                    }
                    if (codePks.containsKey(code.label()) || lookupPkByLabel(c, "codes", code.label()).isPresent()) {
                        throw new IllegalArgumentException("Code label already exists: " + code.label());
                    }
                    long pk = insertCode(c, code, clientPk, nowMs);
                    codePks.put(code.label(), pk);
                    insertedCodes.add(pk);
                }
                for (ImportBatch.NewCalcJob job : batch.calcjobs()) {
                    Long codePk = codePks.get(job.codeLabel());
                    if (codePk == null) {
                        codePk = lookupPkByLabel(c, "codes", job.codeLabel())
                                .orElseThrow(() -> new NotFoundException("Code not found: " + job.codeLabel()));
                    }
                    if (calcJobExists(c, codePk, job.label())) {
                        throw new IllegalArgumentException("Calcjob label already exists for code "
                                + job.codeLabel() + ": " + job.label());
                    }
                    if (job.uuid() != null && !job.uuid().isBlank() && uuidExists(c, job.uuid())) {
                        throw new IllegalArgumentException("Calcjob uuid already exists: " + job.uuid());
                    }
                    insertedCalcJobs.add(insertCalcJob(c, job, codePk, nowMs));
                }
                c.commit();
                return new ImportBatch.Result(insertedClients, insertedCodes, insertedCalcJobs);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to import batch", e);
        }
    }

    public Optional<ClientRow> getClient(long pk) {
        return queryOne("SELECT " + CLIENT_COLUMNS + " FROM clients WHERE pk=?",
                ps -> ps.setLong(1, pk), MetadataStore::readClient, "Failed to read client");
    }

    public Optional<ClientRow> findClientByLabel(String label) {
        return queryOne("SELECT " + CLIENT_COLUMNS + " FROM clients WHERE label=?",
                ps -> ps.setString(1, label), MetadataStore::readClient, "Failed to read client");
    }

    public ClientRow requireClient(long pk) {
        return getClient(pk).orElseThrow(() -> new NotFoundException("Client not found: " + pk));
    }

    public Optional<CodeRow> getCode(long pk) {
        return queryOne("SELECT " + CODE_COLUMNS + " FROM codes WHERE pk=?",
                ps -> ps.setLong(1, pk), MetadataStore::readCode, "Failed to read code");
    }

    public Optional<CodeRow> findCodeByLabel(String label) {
        return queryOne("SELECT " + CODE_COLUMNS + " FROM codes WHERE label=?",
                ps -> ps.setString(1, label), MetadataStore::readCode, "Failed to read code");
    }

    public CodeRow requireCode(long pk) {
        return getCode(pk).orElseThrow(() -> new NotFoundException("Code not found: " + pk));
    }

    public Optional<CalcJobRow> getCalcJob(long pk) {
        return queryOne("SELECT " + CALCJOB_COLUMNS + " FROM calcjobs WHERE pk=?",
                ps -> ps.setLong(1, pk), MetadataStore::readCalcJob, "Failed to read calcjob");
    }

    public Optional<CalcJobRow> findCalcJobByUuid(String uuid) {
        return queryOne("SELECT " + CALCJOB_COLUMNS + " FROM calcjobs WHERE uuid=?",
                ps -> ps.setString(1, uuid), MetadataStore::readCalcJob, "Failed to read calcjob");
    }

    public CalcJobRow requireCalcJob(long pk) {
        return getCalcJob(pk).orElseThrow(() -> new NotFoundException("CalcJob not found: " + pk));
    }

    public Optional<ProcessingView> getProcessing(long calcjobPk) {
        return queryOne("SELECT " + PROCESSING_COLUMNS + " FROM processing WHERE calcjob_pk=?",
                ps -> ps.setLong(1, calcjobPk), MetadataStore::readProcessing, "Failed to read processing");
    }

    public ProcessingView requireProcessing(long calcjobPk) {
        return getProcessing(calcjobPk)
                .orElseThrow(() -> new NotFoundException("Processing not found for calcjob: " + calcjobPk));
    }

    public List<ClientRow> listClients() {
        return queryList("SELECT " + CLIENT_COLUMNS + " FROM clients ORDER BY pk ASC",
                ps -> {
                }, MetadataStore::readClient, "Failed to list clients");
    }

    public List<CodeRow> listCodes() {
        return queryList("SELECT " + CODE_COLUMNS + " FROM codes ORDER BY pk ASC",
                ps -> {
                }, MetadataStore::readCode, "Failed to list codes");
    }

    public List<CalcJobSummary> listCalcJobs(CalcJobFilter filter, int limit, int offset) {
        CalcJobFilter where = filter == null ? CalcJobFilter.all() : filter;
        String sql = """
                SELECT c.pk,c.label,c.uuid,co.label AS code_label,cl.label AS client_label,
                       p.state,p.step,p.job_id,p.exception,p.updated_at_ms
                """ + SUMMARY_FROM + " WHERE " + where.sql() + " ORDER BY c.pk ASC LIMIT ? OFFSET ?";
        return queryList(sql, ps -> {
            int i = bindAll(ps, where.params(), 1);
            ps.setInt(i++, Math.max(1, limit));
            ps.setInt(i, Math.max(0, offset));
        }, rs -> new CalcJobSummary(
                rs.getLong("pk"),
                rs.getString("label"),
                rs.getString("uuid"),
                rs.getString("code_label"),
                rs.getString("client_label"),
                rs.getString("state"),
                rs.getString("step"),
                rs.getString("job_id"),
                rs.getString("exception"),
                rs.getLong("updated_at_ms")
        ), "Failed to list calcjobs");
    }

    public long countCalcJobs(CalcJobFilter filter) {
        CalcJobFilter where = filter == null ? CalcJobFilter.all() : filter;
        String sql = "SELECT COUNT(1) AS n " + SUMMARY_FROM + " WHERE " + where.sql();
        return queryOne(sql, ps -> bindAll(ps, where.params(), 1), rs -> rs.getLong("n"), "Failed to count calcjobs")
                .orElse(0L);
    }

    public long countClients() {
        return countTable("clients");
    }

    public long countCodes() {
        return countTable("codes");
    }

    /**
     * Calcjob counts per coarse state; every state is present, zero included.
     */
    public Map<String, Long> countByState() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (ProcessState state : ProcessState.values()) {
            out.put(state.dbValue(), 0L);
        }
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT state, COUNT(1) AS n FROM processing GROUP BY state")) {
            while (rs.next()) {
                out.put(rs.getString("state"), rs.getLong("n"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count calcjobs by state", e);
        }
    }

    /**
     * Playing calcjobs with no live lease, in primary-key order.
     */
    public List<Long> listClaimable(long nowMs, int limit, Collection<Long> excludePks) {
        StringBuilder sql = new StringBuilder("""
                SELECT calcjob_pk FROM processing
                WHERE state=? AND (lease_token IS NULL OR lease_expires_at_ms IS NULL OR lease_expires_at_ms<=?)
                """);
        List<Long> excluded = excludePks == null ? List.of() : new ArrayList<>(excludePks);
        if (!excluded.isEmpty()) {
            sql.append(" AND calcjob_pk NOT IN (");
            for (int i = 0; i < excluded.size(); i++) {
                sql.append(i == 0 ? "?" : ",?");
            }
            sql.append(')');
        }
        sql.append(" ORDER BY calcjob_pk ASC LIMIT ?");
        return queryList(sql.toString(), ps -> {
            int i = 1;
            ps.setString(i++, ProcessState.PLAYING.dbValue());
            ps.setLong(i++, nowMs);
            for (Long pk : excluded) {
                ps.setLong(i++, pk);
            }
            ps.setInt(i, Math.max(1, limit));
        }, rs -> rs.getLong("calcjob_pk"), "Failed to list claimable calcjobs");
    }

    /**
     * Claims a playing calcjob whose lease is absent or expired. The epoch is
     * bumped on every grant, so writes from a previous holder are fenced out.
     */
    public Optional<Lease> tryClaim(long calcjobPk, String owner, String token, long nowMs, long leaseTimeoutMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement claim = c.prepareStatement("""
                    UPDATE processing
                    SET lease_owner=?,lease_token=?,lease_epoch=lease_epoch+1,lease_expires_at_ms=?
                    WHERE calcjob_pk=? AND state=?
                      AND (lease_token IS NULL OR lease_expires_at_ms IS NULL OR lease_expires_at_ms<=?)
                    """);
                 PreparedStatement readEpoch = c.prepareStatement(
                         "SELECT lease_epoch FROM processing WHERE calcjob_pk=? AND lease_token=?")) {
                claim.setString(1, owner);
                claim.setString(2, token);
                claim.setLong(3, nowMs + leaseTimeoutMs);
                claim.setLong(4, calcjobPk);
                claim.setString(5, ProcessState.PLAYING.dbValue());
                claim.setLong(6, nowMs);
                if (claim.executeUpdate() == 0) {
                    c.commit();
                    return Optional.empty();
                }
                long epoch = 0L;
                readEpoch.setLong(1, calcjobPk);
                readEpoch.setString(2, token);
                try (ResultSet rs = readEpoch.executeQuery()) {
                    if (rs.next()) {
                        epoch = rs.getLong("lease_epoch");
                    }
                }
                c.commit();
                return Optional.of(new Lease(calcjobPk, owner, token, epoch));
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim calcjob " + calcjobPk, e);
        }
    }

    public boolean heartbeat(Lease lease, long nowMs, long leaseTimeoutMs) {
        return exec("UPDATE processing SET lease_expires_at_ms=? WHERE calcjob_pk=? AND lease_token=? AND lease_epoch=?",
                ps -> {
                    ps.setLong(1, nowMs + leaseTimeoutMs);
                    ps.setLong(2, lease.calcjobPk());
                    ps.setString(3, lease.token());
                    ps.setLong(4, lease.epoch());
                }, "Failed heartbeat") == 1;
    }

    public boolean release(Lease lease) {
        return exec("""
                UPDATE processing SET lease_owner=NULL,lease_token=NULL,lease_expires_at_ms=NULL
                WHERE calcjob_pk=? AND lease_token=? AND lease_epoch=?
                """, ps -> {
            ps.setLong(1, lease.calcjobPk());
            ps.setString(2, lease.token());
            ps.setLong(3, lease.epoch());
        }, "Failed to release lease") == 1;
    }

    /**
     * Writes the whole mutable tuple of a processing row in one statement,
     * fenced by lease token, lease epoch and the step the caller executed.
     * Reaching a terminal step also drops the lease.
     *
     * @throws IllegalStateException          if the move is not one step forward or to excepted
     * @throws ConcurrencyViolationException  if the row no longer matches the lease or step
     */
    public ProcessingView commitTransition(Lease lease, ProcessStep expectedStep, ProcessingUpdate update) {
        if (!expectedStep.canAdvanceTo(update.step())) {
            throw new IllegalStateException(
                    "Illegal transition for calcjob " + lease.calcjobPk() + ": "
                            + expectedStep.dbValue() + " -> " + update.step().dbValue());
        }
        boolean terminal = update.step().isTerminal();
        String sql = """
                UPDATE processing
                SET state=?,step=?,job_id=?,remote_state=?,script_key=?,exception=?,failed_step=?,retrieved_paths=?,
                    updated_at_ms=?,
                    lease_owner=CASE WHEN ? THEN NULL ELSE lease_owner END,
                    lease_token=CASE WHEN ? THEN NULL ELSE lease_token END,
                    lease_expires_at_ms=CASE WHEN ? THEN NULL ELSE lease_expires_at_ms END
                WHERE calcjob_pk=? AND step=? AND state=? AND lease_token=? AND lease_epoch=?
                """;
        int changed = exec(sql, ps -> {
            ps.setString(1, update.state().dbValue());
            ps.setString(2, update.step().dbValue());
            setNullableString(ps, 3, update.jobId());
            setNullableString(ps, 4, update.remoteState());
            setNullableString(ps, 5, update.scriptKey());
            setNullableString(ps, 6, update.exception());
            setNullableString(ps, 7, update.failedStep() == null ? null : update.failedStep().dbValue());
            setNullableString(ps, 8, update.retrievedPaths() == null ? null : Jsons.toCompactJson(update.retrievedPaths()));
            ps.setLong(9, System.currentTimeMillis());
            ps.setBoolean(10, terminal);
            ps.setBoolean(11, terminal);
            ps.setBoolean(12, terminal);
            ps.setLong(13, lease.calcjobPk());
            ps.setString(14, expectedStep.dbValue());
            ps.setString(15, ProcessState.PLAYING.dbValue());
            ps.setString(16, lease.token());
            ps.setLong(17, lease.epoch());
        }, "Failed to commit transition");
        if (changed != 1) {
            throw new ConcurrencyViolationException(
                    "Lease or step no longer current for calcjob " + lease.calcjobPk()
                            + " (expected step " + expectedStep.dbValue() + ", epoch " + lease.epoch() + ")");
        }
        return requireProcessing(lease.calcjobPk());
    }

    private long insertClient(Connection c, ImportBatch.NewClient client, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO clients(label,client_url,client_id,client_secret,token_uri,machine_name,work_dir,
                                    small_file_size_mb,created_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, client.label());
            ps.setString(2, client.clientUrl());
            ps.setString(3, nullToEmpty(client.clientId()));
            ps.setString(4, nullToEmpty(client.clientSecret()));
            ps.setString(5, nullToEmpty(client.tokenUri()));
            ps.setString(6, client.machineName());
            ps.setString(7, client.workDir());
            ps.setInt(8, client.smallFileSizeMb());
            ps.setLong(9, nowMs);
            ps.executeUpdate();
            return generatedKey(ps);
        }
    }

    private long insertCode(Connection c, ImportBatch.NewCode code, long clientPk, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO codes(label,client_pk,script,upload_paths,created_at_ms) VALUES(?,?,?,?,?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, code.label());
            ps.setLong(2, clientPk);
            ps.setString(3, code.script());
            ps.setString(4, Jsons.toCompactJson(code.uploadPaths() == null ? Map.of() : code.uploadPaths()));
            ps.setLong(5, nowMs);
            ps.executeUpdate();
            return generatedKey(ps);
        }
    }

    private long insertCalcJob(Connection c, ImportBatch.NewCalcJob job, long codePk, long nowMs) throws SQLException {
        long pk;
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO calcjobs(label,uuid,code_pk,parameters,upload_paths,download_globs,created_at_ms)
                VALUES(?,?,?,?,?,?,?)
                """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, job.label());
            ps.setString(2, job.uuid() == null || job.uuid().isBlank() ? UUID.randomUUID().toString() : job.uuid());
            ps.setLong(3, codePk);
            ps.setString(4, Jsons.toCompactJson(job.parameters() == null ? Map.of() : job.parameters()));
            ps.setString(5, Jsons.toCompactJson(job.uploadPaths() == null ? Map.of() : job.uploadPaths()));
            ps.setString(6, Jsons.toCompactJson(job.downloadGlobs() == null ? List.of() : job.downloadGlobs()));
            ps.setLong(7, nowMs);
            ps.executeUpdate();
            pk = generatedKey(ps);
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO processing(calcjob_pk,state,step,lease_epoch,created_at_ms,updated_at_ms) VALUES(?,?,?,0,?,?)")) {
            ps.setLong(1, pk);
            ps.setString(2, ProcessState.PLAYING.dbValue());
            ps.setString(3, ProcessStep.CREATED.dbValue());
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs);
            ps.executeUpdate();
        }
        return pk;
    }

    private void checkUploadPaths(String owner, Map<String, String> uploadPaths) {
        if (uploadPaths == null) {
            return;
        }
        for (Map.Entry<String, String> entry : uploadPaths.entrySet()) {
            try {
                RemotePaths.requireRelative(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid upload path for " + owner + ": " + e.getMessage(), e);
            }
            String key = entry.getValue();
            if (key != null && !contentStore.exists(key)) {
                throw new IllegalArgumentException("Key '" + key + "' not found in object store for "
                        + owner + " upload path '" + entry.getKey() + "'");
            }
        }
    }

    private boolean calcJobExists(Connection c, long codePk, String label) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM calcjobs WHERE code_pk=? AND label=?")) {
            ps.setLong(1, codePk);
            ps.setString(2, label);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private boolean uuidExists(Connection c, String uuid) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM calcjobs WHERE uuid=?")) {
            ps.setString(1, uuid);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private Optional<Long> lookupPkByLabel(Connection c, String table, String label) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT pk FROM " + table + " WHERE label=?")) {
            ps.setString(1, label);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong("pk")) : Optional.empty();
            }
        }
    }

    private long countTable(String table) {
        return queryOne("SELECT COUNT(1) AS n FROM " + table, ps -> {
        }, rs -> rs.getLong("n"), "Failed to count " + table).orElse(0L);
    }

    private static long generatedKey(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned");
            }
            return keys.getLong(1);
        }
    }

    private static ClientRow readClient(ResultSet rs) throws SQLException {
        return new ClientRow(
                rs.getLong("pk"),
                rs.getString("label"),
                rs.getString("client_url"),
                rs.getString("client_id"),
                rs.getString("client_secret"),
                rs.getString("token_uri"),
                rs.getString("machine_name"),
                rs.getString("work_dir"),
                rs.getInt("small_file_size_mb"),
                rs.getLong("created_at_ms")
        );
    }

    private static CodeRow readCode(ResultSet rs) throws SQLException {
        return new CodeRow(
                rs.getLong("pk"),
                rs.getString("label"),
                rs.getLong("client_pk"),
                rs.getString("script"),
                Jsons.fromJson(rs.getString("upload_paths"), STRING_MAP),
                rs.getLong("created_at_ms")
        );
    }

    private static CalcJobRow readCalcJob(ResultSet rs) throws SQLException {
        return new CalcJobRow(
                rs.getLong("pk"),
                rs.getString("label"),
                rs.getString("uuid"),
                rs.getLong("code_pk"),
                Jsons.fromJson(rs.getString("parameters"), OBJECT_MAP),
                Jsons.fromJson(rs.getString("upload_paths"), STRING_MAP),
                Jsons.fromJson(rs.getString("download_globs"), STRING_LIST),
                rs.getLong("created_at_ms")
        );
    }

    private static ProcessingView readProcessing(ResultSet rs) throws SQLException {
        String failedStep = rs.getString("failed_step");
        String retrieved = rs.getString("retrieved_paths");
        return new ProcessingView(
                rs.getLong("calcjob_pk"),
                ProcessState.fromString(rs.getString("state")),
                ProcessStep.fromString(rs.getString("step")),
                rs.getString("job_id"),
                rs.getString("remote_state"),
                rs.getString("script_key"),
                rs.getString("exception"),
                failedStep == null ? null : ProcessStep.fromString(failedStep),
                retrieved == null ? null : Jsons.fromJson(retrieved, STRING_MAP),
                rs.getString("lease_owner"),
                rs.getLong("lease_epoch"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static int bindAll(PreparedStatement ps, List<Object> params, int start) throws SQLException {
        int i = start;
        for (Object param : params) {
            if (param instanceof Long) {
                ps.setLong(i++, (Long) param);
            } else {
                ps.setString(i++, String.valueOf(param));
            }
        }
        return i;
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private int exec(String sql, Binder binder, String failure) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException(failure, e);
        }
    }

    private <T> Optional<T> queryOne(String sql, Binder binder, RowReader<T> reader, String failure) {
        List<T> rows = queryList(sql, binder, reader, failure);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private <T> List<T> queryList(String sql, Binder binder, RowReader<T> reader, String failure) {
        List<T> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(reader.read(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException(failure, e);
        }
    }

    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private interface RowReader<T> {
        T read(ResultSet rs) throws SQLException;
    }
}
