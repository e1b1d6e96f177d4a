package io.subatomic.jdbc;

import io.subatomic.DanglingTransactionException;
import io.subatomic.MissingRequiredTransactionException;
import io.subatomic.Subatomic;
import io.subatomic.TestcaseTransaction;
import io.subatomic.TransactionAlreadyOpenException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubatomicJdbcIntegrationTest {

    private JdbcDataSource dataSource;
    private JdbcBackendRegistry backends;
    private Subatomic subatomic;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE items (name VARCHAR(64) NOT NULL)");
        }
        backends = JdbcBackendRegistry.builder().dataSource("default", dataSource).build();
        subatomic = Subatomic.builder().backends(backends).build();
    }

    @AfterEach
    void tearDown() {
        backends.release();
    }

    @Test
    void committedTransactionIsVisibleElsewhere() throws SQLException {
        subatomic.transaction().run(() -> insert("a"));

        assertEquals(1, countFromOtherConnection());
        assertFalse(subatomic.inTransaction());
    }

    @Test
    void failedTransactionLeavesNoRows() throws SQLException {
        assertThrows(IllegalStateException.class, () -> subatomic.transaction().run(() -> {
            insert("a");
            throw new IllegalStateException();
        }));

        assertEquals(0, countFromOtherConnection());
    }

    @Test
    void failedSavepointUndoesOnlyItsOwnWork() throws SQLException {
        subatomic.transaction().run(() -> {
            insert("kept");
            assertThrows(IllegalStateException.class, () -> subatomic.savepoint().run(() -> {
                insert("undone");
                throw new IllegalStateException();
            }));
            insert("also kept");
        });

        assertEquals(2, countFromOtherConnection());
    }

    @Test
    void callbacksSeeCommittedData() throws SQLException {
        List<Integer> seen = new ArrayList<>();

        subatomic.transaction().run(() -> {
            insert("a");
            subatomic.runAfterCommit(() -> {
                try {
                    seen.add(countFromOtherConnection());
                } catch (SQLException e) {
                    throw new IllegalStateException(e);
                }
            });
        });

        assertEquals(List.of(1), seen);
    }

    @Test
    void manualTransactionBlocksTransaction() throws SQLException {
        backends.connectionProvider("default").getConnection().setAutoCommit(false);

        assertFalse(subatomic.inTransaction());
        assertThrows(TransactionAlreadyOpenException.class, () -> subatomic.transaction().open());
        assertThrows(MissingRequiredTransactionException.class, () -> subatomic.savepoint().open());

        backends.backend("default").rollback();
    }

    @Test
    void durableRollsBackDanglingManualTransaction() throws SQLException {
        assertThrows(DanglingTransactionException.class, () -> subatomic.durable().run(() -> {
            Connection conn = backends.connectionProvider("default").getConnection();
            conn.setAutoCommit(false);
            insert("dangling");
        }));

        assertFalse(subatomic.inTransaction());
        assertEquals(0, countFromOtherConnection());
    }

    @Test
    void testcaseTransactionRollsBackCommittedScopes() throws SQLException {
        try (TestcaseTransaction testcase = subatomic.beginTestcaseTransaction()) {
            subatomic.transaction().run(() -> insert("a"));
            subatomic.transaction().run(() -> insert("b"));
            assertEquals(2, countOnBoundConnection());
        }

        assertEquals(0, countFromOtherConnection());
        assertEquals(0, countOnBoundConnection());
    }

    private void insert(String name) throws SQLException {
        try (Statement stmt = backends.connectionProvider("default").getConnection().createStatement()) {
            stmt.executeUpdate("INSERT INTO items (name) VALUES ('" + name + "')");
        }
    }

    private int countOnBoundConnection() throws SQLException {
        return count(backends.connectionProvider("default").getConnection());
    }

    private int countFromOtherConnection() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            return count(conn);
        }
    }

    private static int count(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM items")) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
