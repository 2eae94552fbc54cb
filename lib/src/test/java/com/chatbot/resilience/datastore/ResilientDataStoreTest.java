package com.chatbot.resilience.datastore;

import com.chatbot.resilience.MutableClock;
import com.chatbot.resilience.config.DatabaseConfig;
import com.chatbot.resilience.config.DatabaseEndpoint;
import com.chatbot.resilience.config.DegradationConfig;
import com.chatbot.resilience.config.RetryPolicyConfig;
import com.chatbot.resilience.degradation.DegradationCoordinator;
import com.chatbot.resilience.model.DegradationLevel;
import com.chatbot.resilience.model.ServiceState;
import com.chatbot.resilience.observability.ResilienceMetrics;
import com.chatbot.resilience.pool.PoolEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResilientDataStoreTest {
    
    private static final String GUILD_SELECT = "SELECT * FROM guild_settings WHERE guild_id = ?";
    
    @Mock
    private DataSource primary;
    
    @Mock
    private DataSource replica;
    
    @Mock
    private Connection primaryConnection;
    
    @Mock
    private Connection replicaConnection;
    
    @Mock
    private PreparedStatement primaryStatement;
    
    @Mock
    private PreparedStatement replicaStatement;
    
    private SimpleMeterRegistry meterRegistry;
    private DegradationCoordinator coordinator;
    private ResilientDataStore store;
    
    @BeforeEach
    void setUp() throws SQLException {
        meterRegistry = new SimpleMeterRegistry();
        ResilienceMetrics metrics = new ResilienceMetrics(meterRegistry);
        coordinator = new DegradationCoordinator(DegradationConfig.defaultConfig(), null, metrics,
            new MutableClock(), Runnable::run);
        
        DatabaseConfig config = DatabaseConfig.builder()
            .replica(DatabaseEndpoint.builder().host("replica.db").readOnly(true).build())
            .retryPolicy(RetryPolicyConfig.builder()
                .maxRetries(3)
                .baseDelay(Duration.ofMillis(1))
                .maxDelay(Duration.ofMillis(5))
                .build())
            .maxConnectionFailures(3)
            .build();
        
        lenient().when(primary.getConnection()).thenReturn(primaryConnection);
        lenient().when(replica.getConnection()).thenReturn(replicaConnection);
        lenient().when(primaryConnection.getAutoCommit()).thenReturn(true);
        stubRows(primaryConnection, primaryStatement, List.of(Map.of("id", 1)));
        stubRows(replicaConnection, replicaStatement, List.of(Map.of("id", 2)));
        
        store = new ResilientDataStore(config, primary, replica, coordinator, metrics,
            new RetryBackoff(config.getRetryPolicy(), () -> 0.5));
    }
    
    @AfterEach
    void tearDown() {
        store.close();
        coordinator.close();
    }
    
    private static void stubRows(Connection connection, PreparedStatement statement,
                                 List<Map<String, Object>> rows) throws SQLException {
        lenient().when(connection.prepareStatement(anyString())).thenReturn(statement);
        lenient().when(statement.execute()).thenReturn(true);
        lenient().when(statement.getResultSet()).thenAnswer(invocation -> resultSetOf(rows));
    }
    
    private static ResultSet resultSetOf(List<Map<String, Object>> rows) throws SQLException {
        List<String> columns = rows.isEmpty() ? List.of() : new ArrayList<>(rows.get(0).keySet());
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        lenient().when(metaData.getColumnCount()).thenReturn(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            lenient().when(metaData.getColumnLabel(i + 1)).thenReturn(columns.get(i));
        }
        
        ResultSet resultSet = mock(ResultSet.class);
        AtomicInteger cursor = new AtomicInteger(-1);
        lenient().when(resultSet.getMetaData()).thenReturn(metaData);
        lenient().when(resultSet.next()).thenAnswer(invocation -> cursor.incrementAndGet() < rows.size());
        lenient().when(resultSet.getObject(anyInt())).thenAnswer(invocation ->
            rows.get(cursor.get()).get(columns.get(invocation.<Integer>getArgument(0) - 1)));
        return resultSet;
    }
    
    private PreparedStatement statementFor(String sqlPrefix) throws SQLException {
        PreparedStatement statement = mock(PreparedStatement.class);
        lenient().when(primaryConnection.prepareStatement(startsWith(sqlPrefix))).thenReturn(statement);
        return statement;
    }
    
    @Test
    void testQueryBeforeInitializeFails() {
        assertThrows(DataStoreException.NotInitializedException.class, () -> store.query("SELECT 1"));
    }
    
    @Test
    void testInitializeRegistersHealthyDatabase() {
        store.initialize();
        
        assertTrue(store.isConnected());
        assertTrue(store.isReplicaEnabled());
        assertEquals(Optional.of(ServiceState.HEALTHY), coordinator.getServiceState(ResilientDataStore.SERVICE_NAME));
        assertEquals("healthy", store.getStatus().state());
        assertEquals(Optional.of("replica.db"), store.getStatus().getReplicaHost());
    }
    
    @Test
    void testReplicaFailureFallsBackToPrimaryOnly() throws SQLException {
        when(replica.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));
        
        store.initialize();
        
        assertTrue(store.isConnected());
        assertFalse(store.isReplicaEnabled());
        store.getOne(GUILD_SELECT, "g1");
        verify(primaryConnection).prepareStatement(GUILD_SELECT);
    }
    
    @Test
    void testPrimaryFailureAbortsInitialize() throws SQLException {
        when(primary.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));
        
        DataStoreException.QueryFailedException error =
            assertThrows(DataStoreException.QueryFailedException.class, store::initialize);
        
        assertEquals("Database connection failed", error.getMessage());
        assertFalse(store.isConnected());
        assertThrows(DataStoreException.NotInitializedException.class, () -> store.query("SELECT 1"));
    }
    
    @Test
    void testReadsGoToReplicaAndWritesToPrimary() throws SQLException {
        store.initialize();
        
        Optional<Map<String, Object>> row = store.getOne(GUILD_SELECT, "g1");
        store.query("UPDATE guild_settings SET prefix = ? WHERE guild_id = ?", "!", "g1");
        
        assertEquals(Optional.of(2), row.map(r -> r.get("id")));
        verify(replicaConnection).prepareStatement(GUILD_SELECT);
        verify(primaryConnection, never()).prepareStatement(GUILD_SELECT);
        verify(primaryConnection).prepareStatement(startsWith("UPDATE guild_settings"));
        verify(primaryStatement).setObject(1, "!");
        verify(primaryStatement).setObject(2, "g1");
    }
    
    @Test
    void testUsePrimaryOverridesReplicaRouting() throws SQLException {
        store.initialize();
        
        store.getOne(GUILD_SELECT, List.of("g1"), QueryOptions.primary());
        
        verify(primaryConnection).prepareStatement(GUILD_SELECT);
        verify(replicaConnection, never()).prepareStatement(GUILD_SELECT);
    }
    
    @Test
    void testTransientErrorIsRetried() throws SQLException {
        store.initialize();
        PreparedStatement update = statementFor("UPDATE user_data");
        when(update.execute())
            .thenThrow(new SQLException("could not serialize access", "40001"))
            .thenReturn(true);
        when(update.getResultSet()).thenAnswer(invocation -> resultSetOf(List.of(Map.of("user_id", "u1"))));
        
        Optional<Map<String, Object>> row = store.update("user_data", Map.of("xp", 10), Map.of("user_id", "u1"));
        
        assertEquals(Optional.of("u1"), row.map(r -> r.get("user_id")));
        verify(update, times(2)).execute();
        assertEquals(1.0, meterRegistry.get("chatbot.db.query.retries").counter().count());
    }
    
    @Test
    void testPermanentErrorIsNotRetried() throws SQLException {
        store.initialize();
        PreparedStatement broken = statementFor("SELEC ");
        when(broken.execute()).thenThrow(new SQLException("syntax error at or near \"SELEC\"", "42601"));
        
        DataStoreException.QueryFailedException error = assertThrows(DataStoreException.QueryFailedException.class,
            () -> store.query("SELEC * FROM snipes"));
        
        assertEquals(Optional.of("42601"), error.getSqlState());
        verify(broken, times(1)).execute();
        assertTrue(store.isConnected());
    }
    
    @Test
    void testRepeatedConnectionErrorsMarkDatabaseUnavailable() throws SQLException {
        store.initialize();
        when(primary.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));
        QueryOptions noRetry = QueryOptions.builder().usePrimary(true).noRetry(true).build();
        
        for (int i = 0; i < 2; i++) {
            assertThrows(DataStoreException.QueryFailedException.class,
                () -> store.query("SELECT 1", List.of(), noRetry));
        }
        assertEquals(Optional.of(ServiceState.HEALTHY), coordinator.getServiceState(ResilientDataStore.SERVICE_NAME));
        
        assertThrows(DataStoreException.QueryFailedException.class, () -> store.query("SELECT 1", List.of(), noRetry));
        
        assertEquals(Optional.of(ServiceState.UNAVAILABLE), coordinator.getServiceState(ResilientDataStore.SERVICE_NAME));
        assertEquals(DegradationLevel.CRITICAL, coordinator.getLevel());
        assertFalse(store.isConnected());
        assertEquals(3, store.getStatus().failureCount());
        assertFalse(store.healthCheck());
    }
    
    @Test
    void testSuccessfulQueryRestoresHealth() {
        store.initialize();
        coordinator.markDegraded(ResilientDataStore.SERVICE_NAME, "slow");
        
        assertTrue(store.healthCheck());
        
        assertEquals(Optional.of(ServiceState.HEALTHY), coordinator.getServiceState(ResilientDataStore.SERVICE_NAME));
    }
    
    @Test
    void testSafeWritesQueueWhileUnavailableAndReplayOnRecovery() throws SQLException {
        store.initialize();
        coordinator.markUnavailable(ResilientDataStore.SERVICE_NAME, "maintenance");
        
        SafeWriteResult<Map<String, Object>> result =
            store.safeInsert("snipes", Map.of("channel_id", "c1", "content", "hello"));
        
        assertTrue(result.isQueued());
        assertEquals(WriteOperation.INSERT, result.getOperation());
        assertTrue(result.getResult().isEmpty());
        assertEquals(1, store.getStatus().pendingWrites());
        verify(primaryConnection, never()).prepareStatement(startsWith("INSERT INTO snipes"));
        
        coordinator.markHealthy(ResilientDataStore.SERVICE_NAME);
        
        verify(primaryConnection).prepareStatement(startsWith("INSERT INTO snipes"));
        assertEquals(0, coordinator.getQueueSize());
    }
    
    @Test
    void testSafeWriteExecutesImmediatelyWhenHealthy() {
        store.initialize();
        
        SafeWriteResult<Integer> result = store.safeDelete("snipes", Map.of("channel_id", "c1"));
        
        assertFalse(result.isQueued());
        assertEquals("snipes", result.getTable());
        assertEquals(0, coordinator.getQueueSize());
    }
    
    @Test
    void testInvalidIdentifiersRejectedBeforeAnyStatement() throws SQLException {
        store.initialize();
        clearInvocations(primaryConnection);
        
        assertThrows(DataStoreException.InvalidIdentifierException.class,
            () -> store.insert("users; DROP TABLE snipes", Map.of("id", 1)));
        assertThrows(DataStoreException.InvalidIdentifierException.class,
            () -> store.update("user_data", Map.of("xp = 0 --", 1), Map.of("user_id", "u1")));
        
        coordinator.markUnavailable(ResilientDataStore.SERVICE_NAME, "maintenance");
        assertThrows(DataStoreException.InvalidIdentifierException.class,
            () -> store.safeInsert("snipes", Map.of("bad-column", 1)));
        
        assertEquals(0, coordinator.getQueueSize());
        verify(primaryConnection, never()).prepareStatement(anyString());
    }
    
    @Test
    void testEmptyDataRejected() {
        store.initialize();
        assertThrows(IllegalArgumentException.class, () -> store.insert("snipes", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> store.delete("snipes", Map.of()));
    }
    
    @Test
    void testDeleteReturnsAffectedRows() throws SQLException {
        store.initialize();
        PreparedStatement delete = statementFor("DELETE FROM snipes");
        when(delete.execute()).thenReturn(false);
        when(delete.getUpdateCount()).thenReturn(4);
        
        assertEquals(4, store.delete("snipes", Map.of("channel_id", "c1")));
        verify(primaryConnection).prepareStatement("DELETE FROM snipes WHERE channel_id = ?");
    }
    
    @Test
    void testUpsertDoNothingRereadsFromPrimary() throws SQLException {
        store.initialize();
        
        Optional<Map<String, Object>> row = store.upsert("guild_settings", Map.of("guild_id", "g1"), "guild_id");
        
        assertTrue(row.isPresent());
        verify(primaryConnection).prepareStatement(
            "INSERT INTO guild_settings (guild_id) VALUES (?) ON CONFLICT (guild_id) DO NOTHING");
        verify(primaryConnection).prepareStatement(GUILD_SELECT);
        verify(replicaConnection, never()).prepareStatement(GUILD_SELECT);
    }
    
    @Test
    void testUpsertOverwriteUpdatesNonKeyColumns() throws SQLException {
        store.initialize();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("guild_id", "g1");
        data.put("prefix", "?");
        
        store.upsert("guild_settings", data, "guild_id");
        
        verify(primaryConnection).prepareStatement("INSERT INTO guild_settings (guild_id, prefix) VALUES (?, ?) "
            + "ON CONFLICT (guild_id) DO UPDATE SET prefix = EXCLUDED.prefix RETURNING *");
        assertThrows(IllegalArgumentException.class,
            () -> store.upsert("guild_settings", Map.of("prefix", "?"), "guild_id"));
    }
    
    @Test
    void testTransactionCommits() throws SQLException {
        store.initialize();
        clearInvocations(primaryConnection);
        
        int updated = store.transaction(tx -> {
            tx.query("UPDATE user_data SET xp = xp + ? WHERE user_id = ?", 5, "u1");
            return tx.query("SELECT * FROM user_data WHERE user_id = ?", "u1").rowCount();
        });
        
        assertEquals(1, updated);
        verify(primaryConnection).setAutoCommit(false);
        verify(primaryConnection).commit();
        verify(primaryConnection, never()).rollback();
        verify(primaryConnection).setAutoCommit(true);
        verify(primaryConnection, times(1)).close();
        verify(replicaConnection, never()).prepareStatement(eq("SELECT * FROM user_data WHERE user_id = ?"));
    }
    
    @Test
    void testTransactionRollsBackOnRuntimeException() throws SQLException {
        store.initialize();
        clearInvocations(primaryConnection);
        
        IllegalStateException error = assertThrows(IllegalStateException.class, () -> store.transaction(tx -> {
            tx.query("DELETE FROM snipes WHERE channel_id = ?", "c1");
            throw new IllegalStateException("abort");
        }));
        
        assertEquals("abort", error.getMessage());
        verify(primaryConnection).rollback();
        verify(primaryConnection, never()).commit();
        verify(primaryConnection, times(1)).close();
    }
    
    @Test
    void testTransactionRollsBackOnErrorBeforeRestoringAutoCommit() throws SQLException {
        store.initialize();
        clearInvocations(primaryConnection);

        assertThrows(AssertionError.class, () -> store.transaction(tx -> {
            tx.query("DELETE FROM snipes WHERE channel_id = ?", "c1");
            throw new AssertionError("invariant broken mid-transaction");
        }));

        InOrder order = inOrder(primaryConnection);
        order.verify(primaryConnection).setAutoCommit(false);
        order.verify(primaryConnection).rollback();
        order.verify(primaryConnection).setAutoCommit(true);
        order.verify(primaryConnection).close();
        verify(primaryConnection, never()).commit();
    }

    @Test
    void testTransactionWrapsCheckedException() throws SQLException {
        store.initialize();
        PreparedStatement failing = statementFor("INSERT INTO user_data");
        when(failing.execute()).thenThrow(new SQLException("duplicate key", "23505"));
        
        DataStoreException.TransactionFailedException error = assertThrows(
            DataStoreException.TransactionFailedException.class,
            () -> store.transaction(tx -> tx.query("INSERT INTO user_data (user_id) VALUES (?)", "u1")));
        
        assertInstanceOf(SQLException.class, error.getCause());
        verify(primaryConnection).rollback();
    }
    
    @Test
    void testReplicaHealthCheck() throws SQLException {
        assertFalse(store.readReplicaHealthCheck());
        
        store.initialize();
        assertTrue(store.readReplicaHealthCheck());
        
        when(replica.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));
        assertFalse(store.readReplicaHealthCheck());
    }
    
    @Test
    void testPoolHealthAndCloseEventsAreEmitted() throws SQLException {
        List<String> events = new ArrayList<>();
        store.getPoolMonitor().addListener((poolName, event, details) -> events.add(poolName + ":" + event));
        when(replica.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

        store.initialize();
        store.close();

        assertEquals(List.of(
            "replica:" + PoolEvent.HEALTH_CHECK_FAILED,
            "primary:" + PoolEvent.HEALTH_CHECK_PASSED,
            "replica:" + PoolEvent.POOL_CLOSED,
            "primary:" + PoolEvent.POOL_CLOSED), events);
    }

    @Test
    void testPrimaryProbeFailureIsEmitted() throws SQLException {
        List<PoolEvent> events = new ArrayList<>();
        store.getPoolMonitor().addListener((poolName, event, details) -> {
            if (poolName.equals("primary")) {
                events.add(event);
            }
        });
        when(primary.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

        assertThrows(DataStoreException.QueryFailedException.class, store::initialize);

        assertEquals(List.of(PoolEvent.HEALTH_CHECK_FAILED), events);
    }

    @Test
    void testCloseResetsState() {
        store.initialize();
        store.close();
        
        assertFalse(store.isConnected());
        assertFalse(store.isReplicaEnabled());
        assertThrows(DataStoreException.NotInitializedException.class, () -> store.query("SELECT 1"));
    }
}
