package com.landawn.abacus.publisher;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.sql.DataSource;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.landawn.abacus.publisher.exception.NotFoundException;
import com.landawn.abacus.publisher.exception.UserException;
import com.landawn.abacus.publisher.sql.JdbcSQLAdapter;
import com.landawn.abacus.publisher.sql.SQLAdapter;
import com.landawn.abacus.publisher.sql.SQLAdapters;
import com.landawn.abacus.publisher.sql.SQLOptions;
import com.landawn.abacus.publisher.validation.Translator;
import com.landawn.abacus.publisher.validation.ValidatedInput;
import com.landawn.abacus.publisher.validation.Validation;
import com.landawn.abacus.util.N;

public class EntityRepositoryTest extends TestBase {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:00Z"), ZoneOffset.UTC);

    @Mock
    private SQLAdapter mockAdapter;

    private DataSource ds;

    private JdbcSQLAdapter adapter;

    private EntityRepository<User> users;

    @BeforeEach
    public void setUp() throws SQLException {
        MockitoAnnotations.openMocks(this);

        ds = newDataSource();
        execute(ds, User.CREATE_TABLE, "INSERT INTO users (name, email, age) VALUES ('Alice', 'alice@example.com', 30)",
                "INSERT INTO users (name, email, age) VALUES ('Bob', 'bob@example.com', 25)");

        adapter = new JdbcSQLAdapter(ds);
        users = new EntityRepository<>(User.class, User.SCHEMA, User::new, adapter, new InstanceCache<>(), PublisherSettings.builder().clock(CLOCK).build());
    }

    @AfterEach
    public void tearDown() {
        RequestInfo.unbind();
        SQLAdapters.clear();
    }

    @Test
    public void testMetadata() {
        assertEquals("users", users.getTable());
        assertEquals("id", users.getIDField());
        assertEquals(User.SCHEMA.getFields(), users.getFields());
        assertEquals("users", users.getDomain());
        assertSame(User.SCHEMA.getValidator(), users.getValidator());
        assertSame(User.class, users.getEntityClass());
        assertTrue(users.isFieldEditable("name"));
        assertFalse(users.isFieldEditable("created_time"));
        assertEquals("\"users\"", users.escapeIdentifier());
        assertEquals("'O''Brien'", users.formatValue("O'Brien"));
        assertEquals("1, 'a'", users.formatValueList(List.of(1, "a")));
    }

    @Test
    public void testLoadUsesCache() {
        final User first = users.load(1L);
        final User second = users.load("1");

        assertNotNull(first);
        assertSame(first, second);
        assertSame(first, users.load(first));
        assertSame(first, users.object(1));
        assertEquals(1, users.getCacheStats());
    }

    @Test
    public void testLoadWithoutCache() {
        final User first = users.load(1L, true, false);
        final User second = users.load(1L, true, false);

        assertNotSame(first, second);
        assertEquals(first.getValue(), second.getValue());
        assertEquals(0, users.getCacheStats());
    }

    @Test
    public void testLoadMissing() {
        assertNull(users.load(99L));

        final NotFoundException e = assertThrows(NotFoundException.class, () -> users.load(99L, false));
        assertEquals("notFound", e.getMessage());
        assertEquals("users", e.getDomain());
    }

    @Test
    public void testLoadEmptyInput() {
        assertNull(users.load(null));
        assertNull(users.load(""));
        assertNull(users.load("0"));
        assertNull(users.load(0));
        assertNull(users.load(new LinkedHashMap<>()));

        final NotFoundException e = assertThrows(NotFoundException.class, () -> users.load(null, false));
        assertEquals("invalidParameter_load", e.getMessage());
    }

    @Test
    public void testLoadInvalidId() {
        assertEquals("invalidID", assertThrows(UserException.class, () -> users.load(-3)).getMessage());
        assertThrows(UserException.class, () -> users.load("abc"));
        assertThrows(UserException.class, () -> users.load(1.5));
    }

    @Test
    public void testLoadRowWithoutStorage() {
        final EntityRepository<User> mocked = User.repository(mockAdapter);
        final Map<String, Object> row = new LinkedHashMap<>();

        for (final String field : User.SCHEMA.getFields()) {
            row.put(field, null);
        }

        row.put("id", 7L);
        row.put("name", "Grace");

        final User grace = mocked.load(row);

        assertEquals("Grace", grace.getName());
        assertSame(grace, mocked.load(7L));
        verifyNoInteractions(mockAdapter);
    }

    @Test
    public void testCreate() throws SQLException {
        RequestInfo.bind(new RequestInfo("10.0.0.7", "JUnit", null));

        final Validation validation = new Validation();
        final Object id = users.create(N.asMap("name", "Carol"), List.of("name"), validation);

        assertTrue(validation.isValid());
        assertEquals(3L, id);
        assertEquals(3, count(ds, "users"));
        assertEquals("Carol", queryForObject(ds, "SELECT name FROM users WHERE id = ?", id));
        assertEquals(1714558500L, queryForObject(ds, "SELECT created_time FROM users WHERE id = ?", id));
        assertEquals("10.0.0.7", queryForObject(ds, "SELECT created_ip FROM users WHERE id = ?", id));
        assertNotNull(queryForObject(ds, "SELECT created_date FROM users WHERE id = ?", id));

        final User carol = users.load(id, false);
        assertEquals("Carol", carol.getName());
    }

    @Test
    public void testCreateInvalid() throws SQLException {
        final Validation validation = new Validation();

        assertNull(users.create(N.asMap("name", "", "age", 20), null, validation));

        assertEquals(1, validation.size());
        assertEquals("name_required", validation.getErrors().get(0).message());
        assertEquals(2, count(ds, "users"));
    }

    @Test
    public void testCreateDropsUndeclaredFields() throws SQLException {
        assertNotNull(users.create(N.asMap("name", "Dan", "nickname", "D"), List.of("name", "nickname")));

        assertEquals(3, count(ds, "users"));
    }

    @Test
    public void testCreateAndGet() {
        final User carol = users.createAndGet(N.asMap("name", " Carol ", "age", "41"), null);

        assertNotNull(carol);
        assertEquals("Carol", carol.getName());
        assertEquals(41, carol.getValue("age"));
        assertEquals("127.0.0.1", carol.getValue("created_ip"));
        assertSame(carol, users.load(carol.id()));

        assertNull(users.createAndGet(N.asMap("age", 41), null));
    }

    @Test
    public void testList() {
        final User alice = users.load(1L);
        final List<User> result = users.list(users.select().where("age > ?", 20).orderBy("id"));

        assertEquals(2, result.size());
        assertSame(alice, result.get(0));
        assertEquals("Bob", result.get(1).getName());
        assertEquals(2, users.getCacheStats());

        assertEquals(1, users.count(users.select().where("name = ?", "Bob")));
        assertEquals("Bob", users.findFirst(users.select().orderBy("age")).getName());
        assertNull(users.findFirst(users.select().where("age > ?", 100)));
        assertEquals(2, users.selectRows(users.select().what("name")).size());
        assertEquals(N.asMap("email", "bob@example.com"), users.selectRow(2L, "email"));
        assertNull(users.selectRow(99L));
    }

    @Test
    public void testCount() {
        assertEquals(2, users.count(users.select()));
        assertEquals(2, users.count(users.select().where("age > ?", 20).orderBy("id")));
        assertEquals(0, users.count(users.select().where("age > ?", 100)));
        assertEquals(0, users.getCacheStats());
    }

    @Test
    public void testCacheMaintenance() {
        final User alice = users.load(1L);
        users.load(2L);

        assertEquals(1, alice.remove());
        assertEquals(2, users.getCacheStats());

        assertEquals(1, users.clearDeletedInstances());
        assertEquals(1, users.getCacheStats());

        users.clearAllInstances();
        assertEquals(0, users.getCacheStats());
    }

    @Test
    public void testCacheObjects() {
        final User cached = users.load(2L);
        final User detached = users.load(2L, false, false);
        final User other = users.load(1L, false, false);

        final List<User> result = users.cacheObjects(List.of(detached, other));

        assertSame(cached, result.get(0));
        assertSame(other, result.get(1));
        assertSame(other, users.load(1L));
    }

    @Test
    public void testCompleteFields() {
        final Map<String, Object> completed = users.completeFields(N.asMap("name", "Carol"));

        assertEquals("Carol", completed.get("name"));
        assertEquals("", completed.get("email"));
        assertEquals("", completed.get("id"));
        assertEquals(User.SCHEMA.getFields().size(), completed.size());
    }

    @Test
    public void testLogEvent() {
        final Map<String, Object> log = users.getLogEvent("created", 100L, "10.1.1.1");

        assertEquals(100L, log.get("created_time"));
        assertEquals(new Timestamp(100_000L), log.get("created_date"));
        assertEquals("10.1.1.1", log.get("created_ip"));

        assertEquals(1714558500L, users.getLogEvent("created").get("created_time"));
        assertEquals("127.0.0.1", users.clientIp());
    }

    @Test
    public void testFillLogEvent() {
        final Timestamp supplied = new Timestamp(0L);
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("created_date", supplied);

        users.fillLogEvent(data, "created");

        assertEquals(1714558500L, data.get("created_time"));
        assertSame(supplied, data.get("created_date"));
        assertEquals("127.0.0.1", data.get("created_ip"));
        assertFalse(data.containsKey("created_agent"));

        final Map<String, Object> untouched = new LinkedHashMap<>();
        users.fillLogEvent(untouched, "deleted");
        assertTrue(untouched.isEmpty());
    }

    @Test
    public void testOnValidUpdateRejectsEmptyPayload() {
        final Map<String, Object> data = new LinkedHashMap<>();

        assertFalse(users.onValidUpdate(data, new Validation()));
        assertTrue(data.isEmpty());

        data.put("age", 31);
        assertTrue(users.onValidUpdate(data, new Validation()));
        assertEquals(1714558500L, data.get("updated_time"));

        final Map<String, Object> rejected = new LinkedHashMap<>();
        rejected.put("age", 32);
        assertFalse(users.onValidUpdate(rejected, new Validation().addError("boom")));
        assertFalse(rejected.containsKey("updated_time"));
    }

    @Test
    public void testCheckUserInput() {
        final User alice = users.load(1L, false);

        final ValidatedInput created = users.checkUserInput(N.asMap("name", " Carol ", "age", "41", "id", "7"), null, null, false);
        assertEquals(N.asMap("name", "Carol", "age", "41"), created.data());
        assertTrue(created.validation().isValid());

        final ValidatedInput updated = users.checkUserInput(N.asMap("name", "Alice", "age", "31"), null, alice, false);
        assertEquals(N.asMap("age", "31"), updated.data());

        final ValidatedInput rejected = users.checkUserInput(N.asMap("name", " "), List.of("name"), null, false);
        assertTrue(rejected.data().isEmpty());
        assertEquals("name_required", rejected.validation().getErrors().get(0).message());
    }

    @Test
    public void testTestUserInput() throws SQLException {
        final EntityRepository<User> strict = new EntityRepository<>(User.class, User.SCHEMA, User::new, adapter, new InstanceCache<>(),
                PublisherSettings.getDefault()) {
            @Override
            public void checkForObject(final Map<String, Object> data, final User ref) {
                if (ref == null && !data.containsKey("email")) {
                    throw new UserException("emailRequired");
                }
            }
        };

        final Validation validation = new Validation();

        assertTrue(strict.testUserInput(N.asMap("name", "Carol", "email", "carol@example.com"), null, null, validation));
        assertTrue(validation.isValid());

        assertFalse(strict.testUserInput(N.asMap("name", "Carol"), null, null, validation));
        assertEquals("emailRequired", validation.getErrors().get(0).message());
        assertEquals("users", validation.getErrors().get(0).domain());

        assertFalse(strict.testUserInput(N.asMap("name", ""), null, null, validation));
        assertEquals(2, validation.size());

        assertNull(strict.create(N.asMap("name", "Carol"), null));
        assertEquals(2, count(ds, "users"));
    }

    @Test
    public void testExtractQueries() throws SQLException {
        final EntityRepository<User> stamped = new EntityRepository<>(User.class, User.SCHEMA, User::new, adapter, new InstanceCache<>(),
                PublisherSettings.getDefault()) {
            @Override
            public void onEdit(final Map<String, Object> data, final User entity) {
                data.put("email", entity == null ? "new@example.com" : "edited@example.com");
            }
        };

        final Map<String, Object> createInput = new LinkedHashMap<>();
        createInput.put("name", "Carol");
        createInput.put("unknown", "x");

        final SQLOptions insert = stamped.extractCreateQuery(createInput);

        assertEquals("users", insert.getTable());
        assertEquals(N.asMap("name", "Carol", "email", "new@example.com"), insert.getValues());
        assertFalse(createInput.containsKey("unknown"));

        final User bob = stamped.load(2L, false);
        final Map<String, Object> updateInput = new LinkedHashMap<>();
        updateInput.put("age", 26);

        final SQLOptions update = stamped.extractUpdateQuery(updateInput, bob);

        assertEquals(N.asMap("age", 26, "email", "edited@example.com"), update.getValues());
        assertEquals("\"id\" = ?", update.getWhere());
        assertEquals(List.of(2L), update.getParameters());
        assertEquals(1, update.getNumber());

        assertEquals(1, bob.update(N.asMap("age", "26"), null));
        assertEquals("edited@example.com", queryForObject(ds, "SELECT email FROM users WHERE id = ?", 2L));
    }

    @Test
    public void testText() {
        final EntityRepository<User> translated = new EntityRepository<>(User.class, User.SCHEMA, User::new, adapter, new InstanceCache<>(),
                PublisherSettings.builder().translator((key, domain, args) -> domain + ":" + key + args.length).build());

        assertEquals("notFound", users.text("notFound"));
        assertEquals("tooLong(64)", users.text("tooLong", 64));
        assertEquals("users:notFound0", translated.text("notFound"));
        assertSame(Translator.IDENTITY, users.getSettings().getTranslator());
    }

    @Test
    public void testThrowHelpers() {
        assertThrows(NotFoundException.class, () -> users.throwNotFound("gone"));
        assertEquals("bad", assertThrows(UserException.class, () -> users.throwException("bad")).getMessage());
    }

    @Test
    public void testRegisteredAdapter() {
        final EntityRepository<User> registered = new EntityRepository<>(User.class, User.SCHEMA, User::new);

        assertThrows(IllegalStateException.class, () -> registered.getSQLAdapter());

        SQLAdapters.register(adapter);

        assertSame(adapter, registered.getSQLAdapter());
        assertEquals("Alice", registered.load(1L, false).getName());
    }
}
