package com.chatbot.resilience.datastore;

import com.chatbot.resilience.config.DatabaseConfig;
import com.chatbot.resilience.config.DatabaseEndpoint;
import com.chatbot.resilience.degradation.DegradationCoordinator;
import com.chatbot.resilience.model.QueuedWrite;
import com.chatbot.resilience.model.ServiceState;
import com.chatbot.resilience.observability.ResilienceMetrics;
import com.chatbot.resilience.pool.HikariDataSourceFactory;
import com.chatbot.resilience.pool.PoolEvent;
import com.chatbot.resilience.pool.PoolMonitor;
import com.zaxxer.hikari.HikariDataSource;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Relational data access with read-replica routing, retries on transient errors and
 * integration with the {@link DegradationCoordinator}.
 * <p>
 * Reads that are safe for the replica go there when one is configured and healthy;
 * everything else runs on the primary. Transient failures are retried with exponential
 * backoff. Repeated connection errors mark the "database" service unavailable, and the
 * {@code safe*} write helpers then queue their writes until it recovers.
 * <p>
 * Every call is blocking and thread-safe.
 */
public class ResilientDataStore implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(ResilientDataStore.class);
    
    public static final String SERVICE_NAME = DegradationCoordinator.DATABASE;
    static final String PRIMARY_POOL = "primary";
    static final String REPLICA_POOL = "replica";
    private static final int MAX_LOGGED_SQL = 100;
    
    private final DatabaseConfig config;
    private final DataSource primary;
    private final DataSource replica;
    private final DegradationCoordinator coordinator;
    private final ResilienceMetrics metrics;
    private final RetryBackoff backoff;
    private final PoolMonitor poolMonitor;
    private final Map<Integer, Retry> retries = new ConcurrentHashMap<>();
    private final AtomicInteger connectionFailures = new AtomicInteger();
    
    private volatile boolean initialized;
    private volatile boolean connected;
    private volatile boolean replicaEnabled;
    
    /**
     * @param primary the primary data source
     * @param replica the read replica, or null for none
     * @param coordinator receives database health changes and holds queued writes
     * @param metrics query and pool metrics, may be null
     */
    public ResilientDataStore(DatabaseConfig config, DataSource primary, DataSource replica,
                              DegradationCoordinator coordinator, ResilienceMetrics metrics) {
        this(config, primary, replica, coordinator, metrics, new RetryBackoff(config.getRetryPolicy()));
    }
    
    ResilientDataStore(DatabaseConfig config, DataSource primary, DataSource replica,
                       DegradationCoordinator coordinator, ResilienceMetrics metrics, RetryBackoff backoff) {
        this.config = Objects.requireNonNull(config, "config");
        this.primary = Objects.requireNonNull(primary, "primary");
        this.replica = replica;
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.metrics = metrics;
        this.backoff = backoff;
        this.poolMonitor = new PoolMonitor(config.getHighUtilizationThreshold(), metrics);
    }
    
    /**
     * Creates a store backed by Hikari pools for the configured endpoints.
     */
    public static ResilientDataStore create(DatabaseConfig config, DegradationCoordinator coordinator,
                                            ResilienceMetrics metrics) {
        HikariDataSource primary = HikariDataSourceFactory.create(PRIMARY_POOL, config.getPrimary(), config);
        HikariDataSource replica = config.getReplica()
            .map(endpoint -> HikariDataSourceFactory.create(REPLICA_POOL, endpoint, config))
            .orElse(null);
        return new ResilientDataStore(config, primary, replica, coordinator, metrics);
    }
    
    /**
     * Probes the replica (if any) and the primary, registers the database service with the
     * coordinator and starts pool sampling. Calling it again has no effect.
     *
     * @throws DataStoreException.QueryFailedException if the primary cannot be reached
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        
        if (replica != null) {
            initializeReplica();
        }
        
        try {
            probe(primary);
        } catch (SQLException e) {
            logger.error("Connection failed: {}", e.getMessage());
            poolMonitor.notifyListeners(PRIMARY_POOL, PoolEvent.HEALTH_CHECK_FAILED, e.getMessage());
            throw new DataStoreException.QueryFailedException("Database connection failed", e);
        }
        poolMonitor.notifyListeners(PRIMARY_POOL, PoolEvent.HEALTH_CHECK_PASSED, config.getPrimary().toString());
        connected = true;
        initialized = true;
        connectionFailures.set(0);
        logger.info("Connected to database {}", config.getPrimary());
        
        coordinator.initialize();
        coordinator.registerFallback(SERVICE_NAME, (error, options) -> null);
        coordinator.registerWriteProcessor(SERVICE_NAME, this::replay);
        coordinator.markHealthy(SERVICE_NAME);
        
        monitorPool(PRIMARY_POOL, primary);
        if (replicaEnabled) {
            monitorPool(REPLICA_POOL, replica);
        }
        poolMonitor.start(config.getPoolMonitorInterval());
    }
    
    private void initializeReplica() {
        String host = config.getReplica().map(DatabaseEndpoint::getHost).orElse("replica");
        try {
            probe(replica);
            replicaEnabled = true;
            logger.info("Read replica connected: {}", host);
            poolMonitor.notifyListeners(REPLICA_POOL, PoolEvent.HEALTH_CHECK_PASSED, host);
        } catch (SQLException e) {
            replicaEnabled = false;
            logger.warn("Read replica connection failed, using primary only: {}", e.getMessage());
            poolMonitor.notifyListeners(REPLICA_POOL, PoolEvent.HEALTH_CHECK_FAILED, e.getMessage());
        }
    }
    
    private void monitorPool(String poolName, DataSource dataSource) {
        if (dataSource instanceof HikariDataSource) {
            HikariDataSource hikari = (HikariDataSource) dataSource;
            poolMonitor.register(poolName, hikari::getHikariPoolMXBean);
        }
    }
    
    /**
     * Runs a statement, routing it and retrying transient failures as the options allow.
     *
     * @param sql statement text with {@code ?} placeholders
     * @param params values bound to the placeholders, in order
     * @param options routing and retry overrides
     * @return the rows and row count
     * @throws DataStoreException.QueryFailedException when the statement fails for good
     */
    public QueryResult query(String sql, List<?> params, QueryOptions options) {
        requireInitialized();
        QueryOptions opts = options != null ? options : QueryOptions.defaults();
        List<?> bound = params != null ? params : List.of();
        
        QueryRouter.Target target = QueryRouter.route(sql, opts, replicaEnabled);
        DataSource dataSource = target == QueryRouter.Target.REPLICA ? replica : primary;
        String poolName = target == QueryRouter.Target.REPLICA ? REPLICA_POOL : PRIMARY_POOL;
        int maxRetries = opts.isNoRetry() ? 0 : opts.getRetries().orElse(config.getRetryPolicy().getMaxRetries());
        
        QueryResult result;
        try {
            result = retryFor(maxRetries).executeCallable(() -> executeOnce(dataSource, poolName, sql, bound));
        } catch (Exception e) {
            handleQueryError(e);
            if (e instanceof DataStoreException) {
                throw (DataStoreException) e;
            }
            throw new DataStoreException.QueryFailedException("Query failed: " + abbreviate(sql), e);
        }
        
        onQuerySuccess();
        return result;
    }
    
    public QueryResult query(String sql, List<?> params) {
        return query(sql, params, QueryOptions.defaults());
    }
    
    public QueryResult query(String sql, Object... params) {
        return query(sql, Arrays.asList(params), QueryOptions.defaults());
    }
    
    public Optional<Map<String, Object>> getOne(String sql, Object... params) {
        return query(sql, Arrays.asList(params), QueryOptions.defaults()).first();
    }
    
    public Optional<Map<String, Object>> getOne(String sql, List<?> params, QueryOptions options) {
        return query(sql, params, options).first();
    }
    
    public List<Map<String, Object>> getMany(String sql, Object... params) {
        return query(sql, Arrays.asList(params), QueryOptions.defaults()).rows();
    }
    
    public List<Map<String, Object>> getMany(String sql, List<?> params, QueryOptions options) {
        return query(sql, params, options).rows();
    }
    
    /**
     * Inserts a row.
     *
     * @return the inserted row as returned by the database
     */
    public Map<String, Object> insert(String table, Map<String, Object> data) {
        SqlIdentifiers.validateTable(table);
        requireNotEmpty(data, "data");
        SqlIdentifiers.validateIdentifiers(data.keySet());
        
        List<String> columns = new ArrayList<>(data.keySet());
        String sql = String.format("INSERT INTO %s (%s) VALUES (%s) RETURNING *",
            table, String.join(", ", columns), placeholders(columns.size()));
        return query(sql, values(data, columns), QueryOptions.defaults()).first().orElse(Collections.emptyMap());
    }
    
    /**
     * Updates the rows matching every {@code where} condition.
     *
     * @return the first updated row, or empty if nothing matched
     */
    public Optional<Map<String, Object>> update(String table, Map<String, Object> data, Map<String, Object> where) {
        SqlIdentifiers.validateTable(table);
        requireNotEmpty(data, "data");
        requireNotEmpty(where, "where");
        SqlIdentifiers.validateIdentifiers(data.keySet());
        SqlIdentifiers.validateIdentifiers(where.keySet());
        
        List<String> setColumns = new ArrayList<>(data.keySet());
        List<String> whereColumns = new ArrayList<>(where.keySet());
        String sql = String.format("UPDATE %s SET %s WHERE %s RETURNING *",
            table, assignments(setColumns, ", "), assignments(whereColumns, " AND "));
        
        List<Object> params = values(data, setColumns);
        params.addAll(values(where, whereColumns));
        return query(sql, params, QueryOptions.defaults()).first();
    }
    
    /**
     * Inserts a row, or resolves a conflict on {@code conflictKey}. Data holding only the
     * conflict key defaults to {@link UpsertMode#DO_NOTHING}, anything else to
     * {@link UpsertMode#OVERWRITE}.
     */
    public Optional<Map<String, Object>> upsert(String table, Map<String, Object> data, String conflictKey) {
        boolean onlyKey = data != null && data.size() == 1 && data.containsKey(conflictKey);
        return upsert(table, data, conflictKey, onlyKey ? UpsertMode.DO_NOTHING : UpsertMode.OVERWRITE);
    }
    
    /**
     * Inserts a row, or resolves a conflict on {@code conflictKey} as the mode says.
     *
     * @return the inserted or overwritten row; for DO_NOTHING, the row now stored under the key
     */
    public Optional<Map<String, Object>> upsert(String table, Map<String, Object> data, String conflictKey,
                                                UpsertMode mode) {
        SqlIdentifiers.validateTable(table);
        requireNotEmpty(data, "data");
        SqlIdentifiers.validateIdentifiers(data.keySet());
        SqlIdentifiers.validateIdentifier(conflictKey);
        if (!data.containsKey(conflictKey)) {
            throw new IllegalArgumentException("Upsert data must contain the conflict key " + conflictKey);
        }
        
        List<String> columns = new ArrayList<>(data.keySet());
        String insert = String.format("INSERT INTO %s (%s) VALUES (%s) ON CONFLICT (%s)",
            table, String.join(", ", columns), placeholders(columns.size()), conflictKey);
        
        if (mode == UpsertMode.DO_NOTHING) {
            query(insert + " DO NOTHING", values(data, columns), QueryOptions.defaults());
            return getOne(String.format("SELECT * FROM %s WHERE %s = ?", table, conflictKey),
                Collections.singletonList(data.get(conflictKey)), QueryOptions.primary());
        }
        
        List<String> updateColumns = columns.stream()
            .filter(column -> !column.equals(conflictKey))
            .collect(Collectors.toList());
        if (updateColumns.isEmpty()) {
            throw new IllegalArgumentException("OVERWRITE upsert needs at least one column besides " + conflictKey);
        }
        String updateClause = updateColumns.stream()
            .map(column -> column + " = EXCLUDED." + column)
            .collect(Collectors.joining(", "));
        String sql = insert + " DO UPDATE SET " + updateClause + " RETURNING *";
        return query(sql, values(data, columns), QueryOptions.defaults()).first();
    }
    
    /**
     * Deletes the rows matching every {@code where} condition.
     *
     * @return the number of rows deleted
     */
    public int delete(String table, Map<String, Object> where) {
        SqlIdentifiers.validateTable(table);
        requireNotEmpty(where, "where");
        SqlIdentifiers.validateIdentifiers(where.keySet());
        
        List<String> columns = new ArrayList<>(where.keySet());
        String sql = String.format("DELETE FROM %s WHERE %s", table, assignments(columns, " AND "));
        return query(sql, values(where, columns), QueryOptions.defaults()).rowCount();
    }
    
    /**
     * Runs the callback in a transaction on a dedicated primary connection. The transaction
     * commits when the callback returns and rolls back when it throws. The connection is
     * released on every path.
     *
     * @throws DataStoreException.TransactionFailedException if the transaction could not be
     *         started or committed, or the callback threw a checked exception
     */
    public <T> T transaction(TransactionCallback<T> callback) {
        requireInitialized();
        
        Connection connection;
        try {
            connection = primary.getConnection();
        } catch (SQLException e) {
            handleQueryError(e);
            throw new DataStoreException.TransactionFailedException("Could not acquire a connection", e);
        }
        
        boolean autoCommit = true;
        try {
            autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            T result = callback.execute(new TransactionScope(connection, queryTimeoutSeconds()));
            connection.commit();
            return result;
        } catch (Throwable e) {
            // enabling auto-commit in release() would commit the open transaction
            rollback(connection, e);
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            if (e instanceof Error) {
                throw (Error) e;
            }
            throw new DataStoreException.TransactionFailedException("Transaction rolled back", e);
        } finally {
            release(connection, autoCommit);
        }
    }
    
    private void rollback(Connection connection, Throwable cause) {
        try {
            connection.rollback();
            logger.debug("Transaction rolled back: {}", cause.getMessage());
        } catch (SQLException e) {
            cause.addSuppressed(e);
            logger.error("Rollback failed: {}", e.getMessage());
        }
    }
    
    private void release(Connection connection, boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            logger.warn("Could not restore auto-commit on released connection: {}", e.getMessage());
        }
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("Could not release connection: {}", e.getMessage());
        }
    }
    
    /**
     * Inserts a row, or queues the insert while the database is unavailable.
     */
    public SafeWriteResult<Map<String, Object>> safeInsert(String table, Map<String, Object> data) {
        SqlIdentifiers.validateTable(table);
        if (shouldQueueWrites()) {
            return queueWrite(WriteRequest.insert(table, data));
        }
        return SafeWriteResult.executed(WriteOperation.INSERT, table, insert(table, data));
    }
    
    /**
     * Updates rows, or queues the update while the database is unavailable.
     */
    public SafeWriteResult<Map<String, Object>> safeUpdate(String table, Map<String, Object> data,
                                                           Map<String, Object> where) {
        SqlIdentifiers.validateTable(table);
        if (shouldQueueWrites()) {
            return queueWrite(WriteRequest.update(table, data, where));
        }
        return SafeWriteResult.executed(WriteOperation.UPDATE, table, update(table, data, where).orElse(null));
    }
    
    /**
     * Deletes rows, or queues the delete while the database is unavailable.
     */
    public SafeWriteResult<Integer> safeDelete(String table, Map<String, Object> where) {
        SqlIdentifiers.validateTable(table);
        if (shouldQueueWrites()) {
            return queueWrite(WriteRequest.delete(table, where));
        }
        return SafeWriteResult.executed(WriteOperation.DELETE, table, delete(table, where));
    }
    
    private boolean shouldQueueWrites() {
        return !connected
            || coordinator.getServiceState(SERVICE_NAME).orElse(null) == ServiceState.UNAVAILABLE;
    }
    
    private <T> SafeWriteResult<T> queueWrite(WriteRequest request) {
        SqlIdentifiers.validateIdentifiers(request.data().keySet());
        SqlIdentifiers.validateIdentifiers(request.where().keySet());
        String operation = request.operation().operationName();
        coordinator.queueWrite(SERVICE_NAME, operation, request, Map.of("table", request.table()));
        logger.warn("Queued {} on {} for later execution", operation, request.table());
        return SafeWriteResult.queued(request.operation(), request.table());
    }
    
    void replay(QueuedWrite write) {
        if (!(write.payload() instanceof WriteRequest)) {
            throw new IllegalArgumentException("Unsupported queued payload for " + write.operation());
        }
        WriteRequest request = (WriteRequest) write.payload();
        switch (request.operation()) {
            case INSERT -> insert(request.table(), request.data());
            case UPDATE -> update(request.table(), request.data(), request.where());
            case DELETE -> delete(request.table(), request.where());
        }
    }
    
    /**
     * Runs {@code SELECT 1} on the primary without retries.
     *
     * @return true if the primary answered
     */
    public boolean healthCheck() {
        try {
            query("SELECT 1", List.of(), QueryOptions.builder().usePrimary(true).noRetry(true).build());
            return true;
        } catch (DataStoreException e) {
            logger.debug("Health check failed: {}", e.getMessage());
            return false;
        }
    }
    
    public boolean readReplicaHealthCheck() {
        if (replica == null || !replicaEnabled) {
            return false;
        }
        try {
            probe(replica);
            return true;
        } catch (SQLException e) {
            logger.debug("Read replica health check failed: {}", e.getMessage());
            return false;
        }
    }
    
    public DataStoreStatus getStatus() {
        String state = coordinator.getServiceState(SERVICE_NAME)
            .map(s -> s.name().toLowerCase(Locale.ROOT))
            .orElse("unknown");
        int pending = (int) coordinator.getQueuedWrites().stream()
            .filter(write -> write.service().equals(SERVICE_NAME))
            .count();
        return new DataStoreStatus(connected, state, connectionFailures.get(), config.getMaxConnectionFailures(),
            pending, replicaEnabled, config.getReplica().map(DatabaseEndpoint::getHost).orElse(null),
            config.getRetryPolicy());
    }
    
    public boolean isConnected() {
        return connected;
    }
    
    public boolean isReplicaEnabled() {
        return replicaEnabled;
    }
    
    public PoolMonitor getPoolMonitor() {
        return poolMonitor;
    }
    
    /**
     * Stops pool sampling and closes the pools. A closed store cannot be reused.
     */
    @Override
    public synchronized void close() {
        poolMonitor.close();
        if (replica != null) {
            closeDataSource(REPLICA_POOL, replica);
            if (replicaEnabled) {
                logger.info("Read replica pool closed");
            }
        }
        closeDataSource(PRIMARY_POOL, primary);
        replicaEnabled = false;
        connected = false;
        initialized = false;
        logger.info("Connection pool closed");
    }
    
    private void closeDataSource(String poolName, DataSource dataSource) {
        if (dataSource instanceof AutoCloseable) {
            try {
                ((AutoCloseable) dataSource).close();
            } catch (Exception e) {
                logger.warn("Error closing {} pool: {}", poolName, e.getMessage());
            }
        }
        poolMonitor.notifyListeners(poolName, PoolEvent.POOL_CLOSED, "Pool closed");
    }
    
    private QueryResult executeOnce(DataSource dataSource, String poolName, String sql, List<?> params)
            throws SQLException {
        long start = System.nanoTime();
        boolean success = false;
        try (Connection connection = dataSource.getConnection()) {
            QueryResult result = JdbcStatements.execute(connection, sql, params, queryTimeoutSeconds());
            success = true;
            return result;
        } finally {
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            if (metrics != null) {
                metrics.recordQuery(poolName, latency, success);
            }
            if (success && latency.compareTo(config.getSlowQueryThreshold()) > 0) {
                logger.warn("Slow query ({}ms): {}", latency.toMillis(), abbreviate(sql));
            }
        }
    }
    
    private void onQuerySuccess() {
        connectionFailures.set(0);
        connected = true;
        Optional<ServiceState> state = coordinator.getServiceState(SERVICE_NAME);
        if (state.isPresent() && state.get() != ServiceState.HEALTHY) {
            coordinator.markHealthy(SERVICE_NAME);
        }
    }
    
    private void handleQueryError(Throwable error) {
        logger.error("Query error: {}", error.getMessage());
        if (TransientErrorClassifier.isConnectionError(error)) {
            handleConnectionError(error);
        }
    }
    
    private void handleConnectionError(Throwable error) {
        int failures = connectionFailures.incrementAndGet();
        logger.error("Connection error ({}/{}): {}", failures, config.getMaxConnectionFailures(), error.getMessage());
        if (failures >= config.getMaxConnectionFailures()) {
            coordinator.markUnavailable(SERVICE_NAME, "Too many connection failures");
            connected = false;
        }
    }
    
    private Retry retryFor(int maxRetries) {
        return retries.computeIfAbsent(maxRetries, count -> {
            Retry retry = Retry.of("database-" + count,
                backoff.toRetryConfig(count, TransientErrorClassifier::isTransient));
            retry.getEventPublisher()
                .onRetry(event -> {
                    logger.warn("Transient error, retry {}/{} in {}ms: {}", event.getNumberOfRetryAttempts(), count,
                        event.getWaitInterval().toMillis(), event.getLastThrowable().getMessage());
                    if (metrics != null) {
                        metrics.recordQueryRetry();
                    }
                })
                .onSuccess(event -> logger.info("Query succeeded on retry {}", event.getNumberOfRetryAttempts()));
            return retry;
        });
    }
    
    private void probe(DataSource dataSource) throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            JdbcStatements.execute(connection, "SELECT 1", List.of(), queryTimeoutSeconds());
        }
    }
    
    private void requireInitialized() {
        if (!initialized) {
            throw new DataStoreException.NotInitializedException();
        }
    }
    
    private int queryTimeoutSeconds() {
        long seconds = config.getQueryTimeout().toSeconds();
        return (int) Math.min(Math.max(seconds, 1), Integer.MAX_VALUE);
    }
    
    private static void requireNotEmpty(Map<String, Object> values, String name) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
    
    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
    
    private static String assignments(List<String> columns, String separator) {
        return columns.stream().map(column -> column + " = ?").collect(Collectors.joining(separator));
    }
    
    private static List<Object> values(Map<String, Object> source, List<String> columns) {
        List<Object> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            values.add(source.get(column));
        }
        return values;
    }
    
    private static String abbreviate(String sql) {
        String trimmed = sql.trim();
        return trimmed.length() > MAX_LOGGED_SQL ? trimmed.substring(0, MAX_LOGGED_SQL) : trimmed;
    }
}
