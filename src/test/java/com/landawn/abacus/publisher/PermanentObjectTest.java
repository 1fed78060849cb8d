package com.landawn.abacus.publisher;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.landawn.abacus.publisher.exception.FieldNotFoundException;
import com.landawn.abacus.publisher.exception.ImmutableFieldException;
import com.landawn.abacus.publisher.exception.OutOfDateSchemaException;
import com.landawn.abacus.publisher.sql.JdbcSQLAdapter;
import com.landawn.abacus.publisher.sql.SQLAdapter;
import com.landawn.abacus.publisher.validation.Validation;
import com.landawn.abacus.publisher.validation.ValidationError;
import com.landawn.abacus.util.N;

public class PermanentObjectTest extends TestBase {

    private DataSource ds;

    private SQLAdapter adapter;

    private EntityRepository<User> users;

    private User alice;

    @BeforeEach
    public void setUp() throws SQLException {
        ds = newDataSource();
        execute(ds, User.CREATE_TABLE, "INSERT INTO users (name, email, age) VALUES ('Alice', 'alice@example.com', 30)");

        adapter = spy(new JdbcSQLAdapter(ds));
        users = User.repository(adapter);
        alice = users.load(1L, false);
    }

    @Test
    public void testSetValueThenGetValue() {
        alice.setValue("name", "Bob");

        assertEquals("Bob", alice.getValue("name"));
        assertTrue(alice.hasChanges());
        assertEquals(List.of("name"), alice.listModifiedFields());
        assertEquals("Alice", alice.getOriginalValues().get("name"));
    }

    @Test
    public void testSetSameValueIsNotAChange() {
        alice.setValue("name", "Alice");
        alice.setValue("age", 30);

        assertFalse(alice.hasChanges());
    }

    @Test
    public void testSetOriginalValueBackCancelsChange() {
        alice.setValue("name", "Bob");
        alice.setValue("name", "Carol");

        assertEquals("Alice", alice.getOriginalValues().get("name"));

        alice.setValue("name", "Alice");

        assertFalse(alice.hasChanges());
        assertEquals("Alice", alice.getName());
    }

    @Test
    public void testRevert() {
        alice.setValue("name", "Bob");
        alice.setValue("email", null);
        alice.setValue("age", 99);

        alice.revert();

        assertFalse(alice.hasChanges());
        assertEquals("Alice", alice.getName());
        assertEquals("alice@example.com", alice.getValue("email"));
        assertEquals(30, alice.getValue("age"));
    }

    @Test
    public void testSetIdField() {
        assertThrows(ImmutableFieldException.class, () -> alice.setValue("id", 2L));

        alice.setValue("name", "Bob");
        assertThrows(ImmutableFieldException.class, () -> alice.setValue("id", 1L));
    }

    @Test
    public void testUndeclaredField() {
        final FieldNotFoundException e = assertThrows(FieldNotFoundException.class, () -> alice.getValue("password"));
        assertEquals("password", e.getFieldName());

        assertThrows(FieldNotFoundException.class, () -> alice.setValue("password", "secret"));
        assertThrows(IllegalArgumentException.class, () -> alice.setValue(null, "x"));
    }

    @Test
    public void testGetAllValues() {
        final Map<String, Object> values = alice.getValue();

        assertEquals(User.SCHEMA.getFields(), List.copyOf(values.keySet()));
        assertEquals("Alice", values.get("name"));
        assertEquals(values, alice.getValue(null));
        assertThrows(UnsupportedOperationException.class, () -> values.put("name", "Bob"));
    }

    @Test
    public void testRowMissingDeclaredField() {
        final Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", 5L);
        row.put("name", "Eve");

        assertThrows(OutOfDateSchemaException.class, () -> new User(users, row));

        final EntityRepository<User> lenient = new EntityRepository<>(User.class, User.SCHEMA, User::new, adapter, new InstanceCache<>(),
                PublisherSettings.builder().checkFieldIntegrity(false).build());

        final User eve = new User(lenient, row);
        assertEquals("Eve", eve.getName());
        assertNull(eve.getValue("email"));
        assertFalse(eve.hasChanges());
    }

    @Test
    public void testCheckIntegrityInDevMode() {
        final EntityRepository<CheckedUser> checked = new EntityRepository<>(CheckedUser.class, User.SCHEMA, CheckedUser::new, adapter,
                new InstanceCache<>(), PublisherSettings.builder().devMode(true).build());
        final EntityRepository<CheckedUser> unchecked = new EntityRepository<>(CheckedUser.class, User.SCHEMA, CheckedUser::new, adapter,
                new InstanceCache<>(), PublisherSettings.getDefault());

        assertTrue(checked.load(1L, false).integrityChecked);
        assertFalse(unchecked.load(1L, false).integrityChecked);
    }

    @Test
    public void testSave() throws SQLException {
        alice.setValue("age", 31);

        assertTrue(alice.save());

        assertFalse(alice.hasChanges());
        assertEquals(1, alice.savedCount);
        assertEquals(31, queryForObject(ds, "SELECT age FROM users WHERE id = 1"));
        assertEquals(31, alice.getValue("age"));
    }

    @Test
    public void testSaveWithoutChanges() {
        assertFalse(alice.save());
        assertEquals(0, alice.savedCount);
    }

    @Test
    public void testSaveFailureKeepsChanges() throws SQLException {
        execute(ds, "DELETE FROM users WHERE id = 1");

        alice.setValue("age", 31);

        assertFalse(alice.save());
        assertTrue(alice.hasChanges());
        assertEquals(0, alice.savedCount);
    }

    @Test
    public void testSaveDeletedEntity() {
        alice.markAsDeleted();
        alice.setValue("age", 31);

        assertFalse(alice.save());
    }

    @Test
    public void testSaveHookRunsOncePerSave() throws SQLException {
        final EntityRepository<ResavingUser> resavingUsers = new EntityRepository<>(ResavingUser.class, User.SCHEMA, ResavingUser::new, adapter);
        final ResavingUser user = resavingUsers.load(1L, false);

        user.setValue("age", 31);

        assertTrue(user.save());
        assertEquals(1, user.savedCount);
        assertFalse(user.hasChanges());
        assertEquals("resaved@example.com", queryForObject(ds, "SELECT email FROM users WHERE id = 1"));
    }

    @Test
    public void testUpdate() throws SQLException {
        final Validation validation = new Validation();

        assertEquals(1, alice.update(N.asMap("age", "31"), null, validation));

        assertTrue(validation.isValid());
        assertEquals(31, alice.getValue("age"));
        assertEquals(31, queryForObject(ds, "SELECT age FROM users WHERE id = 1"));
        assertNotNull(alice.getValue("updated_time"));
    }

    @Test
    public void testUpdateWithCurrentValues() throws SQLException {
        final Validation validation = new Validation();

        assertEquals(0, alice.update(N.asMap("age", "30", "name", "Alice"), null, validation));

        assertTrue(validation.isValid());
        assertNull(queryForObject(ds, "SELECT updated_time FROM users WHERE id = 1"));
    }

    @Test
    public void testUpdateInvalid() throws SQLException {
        final Validation validation = new Validation();

        assertEquals(0, alice.update(N.asMap("name", " ", "age", 40), null, validation));

        assertEquals(1, validation.size());

        final ValidationError error = validation.getErrors().get(0);
        assertEquals("name_required", error.message());
        assertEquals("name", error.field());
        assertEquals("users", error.domain());

        assertEquals(30, queryForObject(ds, "SELECT age FROM users WHERE id = 1"));
    }

    @Test
    public void testUpdateOnlyAllowedFields() throws SQLException {
        assertEquals(0, alice.update(N.asMap("email", "bob@example.com"), List.of("age")));

        assertEquals("alice@example.com", queryForObject(ds, "SELECT email FROM users WHERE id = 1"));
    }

    @Test
    public void testRemove() throws SQLException {
        assertEquals(1, alice.remove());

        assertTrue(alice.isDeleted());
        assertFalse(alice.isValid());
        assertEquals(0, count(ds, "users"));

        assertEquals(0, alice.remove());
        verify(adapter, times(1)).delete(any());
    }

    @Test
    public void testFree() {
        assertTrue(alice.free());
        assertTrue(alice.isDeleted());
        assertTrue(alice.getValue().isEmpty());

        assertFalse(alice.free());
    }

    @Test
    public void testReload() throws SQLException {
        execute(ds, "UPDATE users SET name = 'Alicia', age = 32 WHERE id = 1");
        alice.setValue("email", "other@example.com");

        assertTrue(alice.reload());

        assertFalse(alice.hasChanges());
        assertEquals("Alicia", alice.getName());
        assertEquals(32, alice.getValue("age"));
        assertEquals("alice@example.com", alice.getValue("email"));
    }

    @Test
    public void testReloadMissingRow() throws SQLException {
        execute(ds, "DELETE FROM users WHERE id = 1");

        assertFalse(alice.reload());
        assertTrue(alice.isDeleted());
    }

    @Test
    public void testReloadMissingRowKeepsPendingChanges() throws SQLException {
        alice.setValue("name", "Alicia");
        alice.setValue("age", 31);
        execute(ds, "DELETE FROM users WHERE id = 1");

        assertFalse(alice.reload());
        assertFalse(alice.reload("age"));

        assertTrue(alice.isDeleted());
        assertEquals(List.of("name", "age"), alice.listModifiedFields());

        alice.revert();

        assertFalse(alice.hasChanges());
        assertEquals("Alice", alice.getName());
        assertEquals(30, alice.getValue("age"));
    }

    @Test
    public void testReloadField() throws SQLException {
        execute(ds, "UPDATE users SET email = 'alicia@example.com' WHERE id = 1");
        alice.setValue("email", "other@example.com");
        alice.setValue("age", 31);

        assertTrue(alice.reload("email"));

        assertEquals("alicia@example.com", alice.getValue("email"));
        assertEquals(List.of("age"), alice.listModifiedFields());
        assertEquals(31, alice.getValue("age"));

        assertThrows(FieldNotFoundException.class, () -> alice.reload("password"));
    }

    @Test
    public void testIdentity() {
        assertEquals(1L, alice.id());
        assertEquals("users#1", alice.uid());
        assertEquals("User#1", alice.toString());
        assertEquals("User#1", alice.getLabel());
        assertEquals(User.SCHEMA, alice.getSchema());
        assertEquals(users, alice.getRepository());
    }

    @Test
    public void testEqualsAndHashCode() {
        final User other = users.load(1L, false, false);

        assertNotSame(alice, other);
        assertEquals(alice, other);
        assertEquals(alice.hashCode(), other.hashCode());
    }

    @Test
    public void testAsMap() {
        assertEquals(N.asMap("id", 1L, "label", "User#1"), alice.asMap(OutputModel.MINIMALS));
        assertEquals(alice.getValue(), alice.asMap(OutputModel.ALL));
    }

    @Test
    public void testExportData() {
        assertEquals(N.asMap("name", "Alice", "age", 30), alice.getExportData(List.of("name", "age")));

        assertEquals("2024-05-01T10:15:00+00:00", PermanentObject.toExportValue(LocalDateTime.of(2024, 5, 1, 10, 15), ZoneOffset.UTC));
        assertEquals("2024-05-01T12:15:00+02:00",
                PermanentObject.toExportValue(Instant.parse("2024-05-01T10:15:00Z"), ZoneOffset.ofHours(2)));
        assertEquals("2024-05-01", PermanentObject.toExportValue(java.sql.Date.valueOf("2024-05-01"), ZoneOffset.UTC));
        assertEquals(7, PermanentObject.toExportValue(7, ZoneOffset.UTC));
    }

    @Test
    public void testLogEvent() {
        final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:00Z"), ZoneOffset.UTC);
        final EntityRepository<User> clocked = new EntityRepository<>(User.class, User.SCHEMA, User::new, adapter, new InstanceCache<>(),
                PublisherSettings.builder().clock(clock).build());
        final User user = clocked.load(1L, false);

        RequestInfo.bind(new RequestInfo("10.0.0.7", "JUnit", null));

        try {
            user.logEvent("created");
        } finally {
            RequestInfo.unbind();
        }

        assertEquals(1714558500L, user.getValue("created_time"));
        assertEquals("10.0.0.7", user.getValue("created_ip"));
        assertNull(user.getValue("created_date"));
        assertEquals(List.of("created_time", "created_ip"), user.listModifiedFields());

        user.logEvent("login");
        assertEquals(2, user.listModifiedFields().size());
    }

    public static class ResavingUser extends User {

        public ResavingUser(final EntityRepository<? extends User> repository, final Map<String, ?> row) {
            super(repository, row);
        }

        @Override
        protected void onSaved(final Map<String, Object> savedData) {
            super.onSaved(savedData);

            setValue("email", "resaved@example.com");
            save();
        }
    }

    static class CheckedUser extends User {

        boolean integrityChecked;

        CheckedUser(final EntityRepository<CheckedUser> repository, final Map<String, Object> row) {
            super(repository, row);
        }

        @Override
        public void checkIntegrity() {
            integrityChecked = true;
        }
    }
}
