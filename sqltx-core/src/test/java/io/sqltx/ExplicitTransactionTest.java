package io.sqltx;

import io.sqltx.command.SqlCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.sqltx.H2Database.INSERT_ACCOUNT;
import static io.sqltx.H2Database.account;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExplicitTransactionTest {
    private H2Database db;
    private RecordingMetrics metrics;
    private ConnectionFactory factory;

    @BeforeEach
    void setUp() {
        db = new H2Database();
        metrics = new RecordingMetrics();
        factory = ConnectionFactory.builder()
                .connectionProvider(db)
                .scopeManager(new AmbientScopeManager())
                .metrics(metrics)
                .build();
    }

    @Test
    void completeCommits() {
        try (ConnectionHandle conn = factory.open();
             ExplicitTransaction tx = conn.beginTransaction()) {
            SqlCommand.create(INSERT_ACCOUNT, conn, tx).execute(account(1, "ann", 10));
            assertNull(db.owner(1));

            tx.complete();
            assertEquals(CompletionState.COMMITTED, tx.state());
        }

        assertEquals("ann", db.owner(1));
    }

    @Test
    void finishedTransactionRestoresIsolationLevel() {
        try (ConnectionHandle conn = factory.open()) {
            int before = conn.execute(null, Connection::getTransactionIsolation);
            assertNotEquals(Connection.TRANSACTION_SERIALIZABLE, before);

            try (ExplicitTransaction tx = conn.beginTransaction(IsolationLevel.SERIALIZABLE)) {
                assertEquals(Connection.TRANSACTION_SERIALIZABLE,
                        conn.execute(tx, Connection::getTransactionIsolation));
                tx.complete();
            }

            assertEquals(before, conn.execute(null, Connection::getTransactionIsolation));
            assertTrue(conn.execute(null, Connection::getAutoCommit));
        }
    }

    @Test
    void closeWithoutCompleteRollsBack() {
        ExplicitTransaction leaked;
        try (ConnectionHandle conn = factory.open();
             ExplicitTransaction tx = conn.beginTransaction()) {
            SqlCommand.create(INSERT_ACCOUNT, conn, tx).execute(account(1, "ann", 10));
            leaked = tx;
        }

        assertEquals(CompletionState.ROLLED_BACK, leaked.state());
        assertEquals(0, db.countAccounts());
    }

    @Test
    void exceptionInsideBlockRollsBack() {
        assertThrows(IllegalStateException.class, () -> {
            try (ConnectionHandle conn = factory.open();
                 ExplicitTransaction tx = conn.beginTransaction()) {
                SqlCommand.create(INSERT_ACCOUNT, conn, tx).execute(account(1, "ann", 10));
                throw new IllegalStateException("boom");
            }
        });

        assertEquals(0, db.countAccounts());
    }

    @Test
    void completeTwiceFails() {
        try (ConnectionHandle conn = factory.open();
             ExplicitTransaction tx = conn.beginTransaction()) {
            tx.complete();
            assertThrows(InvalidStateException.class, tx::complete);
        }
    }

    @Test
    void completeAfterRollbackFails() {
        try (ConnectionHandle conn = factory.open()) {
            ExplicitTransaction tx = conn.beginTransaction();
            tx.rollback();
            tx.rollback();

            assertThrows(InvalidStateException.class, tx::complete);
        }
    }

    @Test
    void commandOnFinishedTransactionFails() {
        try (ConnectionHandle conn = factory.open()) {
            ExplicitTransaction tx = conn.beginTransaction();
            SqlCommand<Integer> insert = SqlCommand.create(INSERT_ACCOUNT, conn, tx);
            tx.complete();

            assertThrows(InvalidStateException.class, () -> insert.execute(account(1, "ann", 10)));
        }
        assertEquals(0, db.countAccounts());
    }

    @Test
    void isolationLevelIsApplied() {
        try (ConnectionHandle conn = factory.open();
             ExplicitTransaction tx = Transactions.beginExplicit(conn, IsolationLevel.SERIALIZABLE)) {
            int level = conn.execute(tx, Connection::getTransactionIsolation);

            assertEquals(Connection.TRANSACTION_SERIALIZABLE, level);
            assertEquals(IsolationLevel.SERIALIZABLE, tx.isolationLevel());
        }
    }

    @Test
    void autoCommitRestoredAfterCompletion() {
        try (ConnectionHandle conn = factory.open()) {
            try (ExplicitTransaction tx = conn.beginTransaction()) {
                assertFalse(conn.execute(tx, Connection::getAutoCommit));
                tx.complete();
            }
            assertTrue(conn.execute(null, Connection::getAutoCommit));

            SqlCommand.create(INSERT_ACCOUNT, conn).execute(account(1, "ann", 10));
        }
        assertEquals("ann", db.owner(1));
    }

    @Test
    void connectionCanRunAnotherTransactionAfterCompletion() {
        try (ConnectionHandle conn = factory.open()) {
            try (ExplicitTransaction first = conn.beginTransaction()) {
                SqlCommand.create(INSERT_ACCOUNT, conn, first).execute(account(1, "ann", 10));
                first.complete();
            }
            try (ExplicitTransaction second = conn.beginTransaction()) {
                SqlCommand.create(INSERT_ACCOUNT, conn, second).execute(account(2, "bob", 20));
            }
        }

        assertEquals("ann", db.owner(1));
        assertNull(db.owner(2));
    }

    @Test
    void secondTransactionOnSameConnectionIsRejected() {
        try (ConnectionHandle conn = factory.open();
             ExplicitTransaction tx = conn.beginTransaction()) {
            assertThrows(ConnectionInUseException.class, conn::beginTransaction);
        }
    }

    @Test
    void beginOnClosedConnectionFails() {
        ConnectionHandle conn = factory.newConnection();
        assertThrows(InvalidStateException.class, conn::beginTransaction);
    }

    @Test
    void closingConnectionWithActiveTransactionRollsBackAndFails() {
        ConnectionHandle conn = factory.open();
        ExplicitTransaction tx = conn.beginTransaction();
        SqlCommand.create(INSERT_ACCOUNT, conn, tx).execute(account(1, "ann", 10));

        assertThrows(InvalidStateException.class, conn::close);

        assertFalse(conn.isOpen());
        assertEquals(CompletionState.ROLLED_BACK, tx.state());
        assertEquals(0, db.countAccounts());
        assertEquals(0, db.openConnections());
    }

    @Test
    void cancelledTransactionCannotCompleteAndRollsBack() {
        try (ConnectionHandle conn = factory.open();
             ExplicitTransaction tx = conn.beginTransaction()) {
            SqlCommand.create(INSERT_ACCOUNT, conn, tx).execute(account(1, "ann", 10));
            tx.cancel();

            assertTrue(tx.isCancelled());
            assertThrows(InvalidStateException.class, tx::complete);
            assertThrows(InvalidStateException.class,
                    () -> SqlCommand.create(INSERT_ACCOUNT, conn, tx).execute(account(2, "bob", 20)));
        }
        assertEquals(0, db.countAccounts());
    }

    @Test
    void afterCommitCallbacksRunInOrder() {
        List<String> calls = new ArrayList<>();
        AtomicBoolean rollbackCalled = new AtomicBoolean();

        try (ConnectionHandle conn = factory.open();
             ExplicitTransaction tx = conn.beginTransaction()) {
            tx.afterCommit(() -> calls.add("first"));
            tx.afterCommit(() -> calls.add("second"));
            tx.afterRollback(() -> rollbackCalled.set(true));
            tx.complete();
        }

        assertEquals(List.of("first", "second"), calls);
        assertFalse(rollbackCalled.get());
    }

    @Test
    void afterRollbackCallbacksRunOnClose() {
        AtomicBoolean called = new AtomicBoolean();

        try (ConnectionHandle conn = factory.open();
             ExplicitTransaction tx = conn.beginTransaction()) {
            tx.afterRollback(() -> called.set(true));
        }

        assertTrue(called.get());
    }

    @Test
    void failingCallbackDoesNotUndoCommitAndLaterCallbacksStillRun() {
        AtomicBoolean secondCalled = new AtomicBoolean();

        try (ConnectionHandle conn = factory.open();
             ExplicitTransaction tx = conn.beginTransaction()) {
            SqlCommand.create(INSERT_ACCOUNT, conn, tx).execute(account(1, "ann", 10));
            tx.afterCommit(() -> {
                throw new IllegalStateException("callback failed");
            });
            tx.afterCommit(() -> secondCalled.set(true));

            IllegalStateException e = assertThrows(IllegalStateException.class, tx::complete);
            assertEquals("callback failed", e.getMessage());
            assertEquals(CompletionState.COMMITTED, tx.state());
        }

        assertTrue(secondCalled.get());
        assertEquals("ann", db.owner(1));
    }

    @Test
    void callbackRegistrationAfterFinishFails() {
        try (ConnectionHandle conn = factory.open()) {
            ExplicitTransaction tx = conn.beginTransaction();
            tx.complete();
            assertThrows(InvalidStateException.class, () -> tx.afterCommit(() -> {}));
        }
    }

    @Test
    void explicitTransactionIsNeverDistributed() {
        try (ConnectionHandle conn = factory.open();
             ExplicitTransaction tx = conn.beginTransaction()) {
            assertFalse(tx.isDistributed());
            assertDoesNotThrow(tx::requireLocal);
        }
    }

    @Test
    void idsAreUniqueUlids() {
        try (ConnectionHandle conn = factory.open()) {
            ExplicitTransaction first = conn.beginTransaction();
            first.complete();
            ExplicitTransaction second = conn.beginTransaction();
            second.complete();

            assertNotNull(first.id());
            assertEquals(26, first.id().length());
            assertFalse(first.id().equals(second.id()));
        }
    }

    @Test
    void metricsCountStartedCommittedAndRolledBack() {
        try (ConnectionHandle conn = factory.open()) {
            try (ExplicitTransaction tx = conn.beginTransaction()) {
                tx.complete();
            }
            try (ExplicitTransaction tx = conn.beginTransaction()) {
                SqlCommand.create(INSERT_ACCOUNT, conn, tx).execute(account(1, "ann", 10));
            }
        }

        assertEquals(2, metrics.started.get());
        assertEquals(1, metrics.committed.get());
        assertEquals(1, metrics.rolledBack.get());
        assertEquals(1, metrics.executed.get());
    }

    @Test
    void builderRequiresConnectionProvider() {
        assertThrows(NullPointerException.class, () -> ConnectionFactory.builder().build());
    }
}
