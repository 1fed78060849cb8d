package com.landawn.abacus.publisher.transaction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.landawn.abacus.publisher.EntityRepository;
import com.landawn.abacus.publisher.EntitySchema;
import com.landawn.abacus.publisher.PermanentObject;
import com.landawn.abacus.publisher.exception.UserException;
import com.landawn.abacus.publisher.sql.JdbcSQLAdapter;
import com.landawn.abacus.publisher.sql.SQLAdapter;
import com.landawn.abacus.publisher.validation.FieldCheckValidator;
import com.landawn.abacus.publisher.validation.Validation;
import com.landawn.abacus.util.N;

public class TransactionOperationSetTest {

    private static final AtomicInteger dbCounter = new AtomicInteger();

    static final EntitySchema ACCOUNT = EntitySchema.builder("account")
            .fields("id", "owner", "balance", "created_time", "updated_time")
            .editableFields("owner", "balance")
            .validator(FieldCheckValidator.create().add("owner", (input, ref) -> {
                if (!input.containsKey("owner") && ref != null) {
                    return ref.getValue("owner");
                }

                final Object owner = input.get("owner");

                if (owner == null || owner.toString().isEmpty()) {
                    throw new UserException("required");
                }

                return owner;
            }))
            .createEvents("created")
            .updateEvents("updated")
            .build();

    @Mock
    private SQLAdapter mockAdapter;

    private DataSource ds;

    private EntityRepository<Account> accounts;

    private Account alice;

    @BeforeEach
    public void setUp() throws SQLException {
        MockitoAnnotations.openMocks(this);

        final JdbcDataSource h2 = new JdbcDataSource();
        h2.setURL("jdbc:h2:mem:operations_" + dbCounter.incrementAndGet() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE");
        h2.setUser("sa");
        ds = h2;

        execute("CREATE TABLE account (id BIGINT AUTO_INCREMENT PRIMARY KEY, owner VARCHAR(64) NOT NULL, balance INT, created_time BIGINT, updated_time BIGINT)",
                "INSERT INTO account (owner, balance) VALUES ('Alice', 100)", "INSERT INTO account (owner, balance) VALUES ('Bob', 50)");

        accounts = new EntityRepository<>(Account.class, ACCOUNT, Account::new, new JdbcSQLAdapter(ds));
        alice = accounts.load(1L, false);
    }

    @Test
    public void testEmptySet() {
        final TransactionOperationSet set = new TransactionOperationSet();

        assertTrue(set.isEmpty());
        assertTrue(set.save());
        assertThrows(IllegalStateException.class, () -> set.getSQLAdapter());
    }

    @Test
    public void testInvalidOperationBlocksAll() throws SQLException {
        final TransactionOperationSet set = new TransactionOperationSet();
        set.add(accounts.getCreateOperation(N.asMap("owner", "Carol", "balance", 10), null));
        set.add(accounts.getUpdateOperation(alice, N.asMap("balance", 0), List.of()));

        assertFalse(set.save());

        assertTrue(set.getValidation().isValid());
        assertEquals(2L, count());
        assertEquals(100, query("SELECT balance FROM account WHERE id = 1"));
        assertEquals(100, alice.getValue("balance"));
    }

    @Test
    public void testValidationErrorBlocksAll() throws SQLException {
        final TransactionOperationSet set = new TransactionOperationSet();
        set.add(accounts.getUpdateOperation(alice, N.asMap("balance", 0), null));
        set.add(accounts.getCreateOperation(N.asMap("balance", 10), null));
        set.add(accounts.getCreateOperation(N.asMap("owner", ""), null));

        assertFalse(set.save());

        assertEquals(2, set.getValidation().size());
        assertEquals("owner_required", set.getValidation().getErrors().get(0).message());
        assertEquals(100, query("SELECT balance FROM account WHERE id = 1"));
        assertEquals(2L, count());
    }

    @Test
    public void testSave() throws SQLException {
        final Account bob = accounts.load(2L, false);
        final CreateTransactionOperation<Account> create = accounts.getCreateOperation(N.asMap("owner", "Carol", "balance", 10), null);

        final TransactionOperationSet set = new TransactionOperationSet();
        set.add(create).add(accounts.getUpdateOperation(alice, N.asMap("balance", "90"), null)).add(accounts.getDeleteOperation(bob));

        assertEquals(3, set.size());
        assertTrue(set.save());

        assertEquals(3L, create.getInsertId());
        assertEquals(2L, count());
        assertEquals(90, alice.getValue("balance"));
        assertNotNull(alice.getValue("updated_time"));
        assertTrue(bob.isDeleted());
        assertEquals("Carol", query("SELECT owner FROM account WHERE id = 3"));
    }

    @Test
    public void testFailedOperationRollsBack() throws SQLException {
        final Account bob = accounts.load(2L, false);
        execute("DELETE FROM account WHERE id = 2");

        final CreateTransactionOperation<Account> create = accounts.getCreateOperation(N.asMap("owner", "Carol"), null);
        final UpdateTransactionOperation<Account> updateAlice = accounts.getUpdateOperation(alice, N.asMap("balance", 80), null);

        final TransactionOperationSet set = new TransactionOperationSet();
        set.add(create).add(updateAlice).add(accounts.getUpdateOperation(bob, N.asMap("balance", 0), null));

        assertFalse(set.save());

        assertNull(create.getInsertId());
        assertEquals(1L, count());
        assertEquals(100, query("SELECT balance FROM account WHERE id = 1"));
        assertEquals(100, alice.getValue("balance"));
    }

    @Test
    public void testFailedOperationWithoutRollbackSupport() {
        final EntityRepository<Account> mocked = new EntityRepository<>(Account.class, ACCOUNT, Account::new, mockAdapter);
        final Account first = mocked.load(row(1L, "Alice"));
        final Account second = mocked.load(row(2L, "Bob"));

        when(mockAdapter.beginTransaction()).thenCallRealMethod();
        when(mockAdapter.escapeIdentifier(anyString())).thenAnswer(invocation -> invocation.getArgument(0));
        when(mockAdapter.delete(any())).thenReturn(1, 0);

        final TransactionOperationSet set = new TransactionOperationSet();
        set.add(mocked.getDeleteOperation(first)).add(mocked.getDeleteOperation(second));

        assertFalse(set.save());

        verify(mockAdapter, times(2)).delete(any());
        assertTrue(first.isDeleted());
        assertFalse(second.isDeleted());
    }

    @Test
    public void testRunIfValid() {
        final DeleteTransactionOperation<Account> delete = accounts.getDeleteOperation(alice);

        assertFalse(delete.isValid());
        assertEquals(0, delete.runIfValid());
        assertFalse(alice.isDeleted());

        assertTrue(delete.validate().isValid());
        assertEquals(1, delete.runIfValid());
        assertTrue(alice.isDeleted());

        final Validation validation = delete.validate();
        assertEquals("alreadyDeleted", validation.getErrors().get(0).message());
        assertFalse(delete.isValid());
        assertEquals(0, delete.runIfValid());
    }

    @Test
    public void testCreateRunRequiresValidation() {
        final CreateTransactionOperation<Account> create = accounts.getCreateOperation(N.asMap("owner", "Carol"), null);

        assertThrows(IllegalStateException.class, () -> create.run());
        assertTrue(create.getData().isEmpty());

        create.validate();
        assertEquals("Carol", create.getData().get("owner"));
        assertTrue(create.getData().containsKey("created_time"));
    }

    @Test
    public void testUpdateDeletedEntity() {
        alice.markAsDeleted();

        final UpdateTransactionOperation<Account> update = accounts.getUpdateOperation(alice, N.asMap("balance", 0), null);

        assertEquals("alreadyDeleted", update.validate().getErrors().get(0).message());
        assertEquals(0, update.runIfValid());
    }

    @Test
    public void testSQLAdapterFallback() {
        final CreateTransactionOperation<Account> create = new CreateTransactionOperation<>(accounts, N.asMap("owner", "Carol"), null);

        assertSame(accounts.getSQLAdapter(), create.getSQLAdapter());

        final TransactionOperationSet set = new TransactionOperationSet(mockAdapter);
        set.add(create);

        assertSame(set, create.getTransactionOperationSet());
        assertSame(mockAdapter, create.getSQLAdapter());
        assertSame(mockAdapter, set.getSQLAdapter());

        final SQLAdapter own = new JdbcSQLAdapter(ds);
        create.setSQLAdapter(own);
        assertSame(own, create.getSQLAdapter());

        verify(mockAdapter, never()).beginTransaction();
    }

    @Test
    public void testIteration() {
        final TransactionOperationSet set = new TransactionOperationSet();
        final DeleteTransactionOperation<Account> delete = accounts.getDeleteOperation(alice);
        set.add(delete);

        int count = 0;

        for (final TransactionOperation<?> operation : set) {
            assertSame(delete, operation);
            count++;
        }

        assertEquals(1, count);
    }

    @Test
    public void testAddSameOperationTwice() throws SQLException {
        final TransactionOperationSet set = new TransactionOperationSet();
        final CreateTransactionOperation<Account> create = accounts.getCreateOperation(N.asMap("owner", "Carol", "balance", 10), null);
        set.add(create);

        assertThrows(IllegalArgumentException.class, () -> set.add(create));

        set.add(accounts.getCreateOperation(N.asMap("owner", "Carol", "balance", 10), null));

        assertTrue(set.save());
        assertEquals(4, count());
    }

    private static Map<String, Object> row(final long id, final String owner) {
        final Map<String, Object> row = new LinkedHashMap<>();

        for (final String field : ACCOUNT.getFields()) {
            row.put(field, null);
        }

        row.put("id", id);
        row.put("owner", owner);

        return row;
    }

    private void execute(final String... sqls) throws SQLException {
        try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
            for (final String sql : sqls) {
                stmt.execute(sql);
            }
        }
    }

    private Object query(final String sql) throws SQLException {
        try (Connection conn = ds.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql); ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getObject(1) : null;
        }
    }

    private long count() throws SQLException {
        return ((Number) query("SELECT COUNT(*) FROM account")).longValue();
    }

    public static class Account extends PermanentObject {

        public Account(final EntityRepository<Account> repository, final Map<String, ?> row) {
            super(repository, row);
        }
    }
}
