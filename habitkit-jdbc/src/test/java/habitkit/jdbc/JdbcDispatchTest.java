package habitkit.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import habitkit.CompletionEntry;
import habitkit.DataManager;
import habitkit.ExtensionBuilder;
import habitkit.HabitSnapshot;
import habitkit.HookResult;
import habitkit.LifecycleEvent;
import habitkit.UserRef;
import habitkit.dispatch.DispatchOutcome;
import habitkit.dispatch.EventDispatcher;
import habitkit.jdbc.store.AbstractJdbcIntegrationStore;
import habitkit.jdbc.store.JdbcIntegrationStores;
import habitkit.registry.DefaultExtensionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Dispatcher wired to a pooled H2 store: the path a service takes in production.
 */
class JdbcDispatchTest {
    private static final UserRef USER = new UserRef("u1", "Ada");

    private HikariDataSource pool;
    private AbstractJdbcIntegrationStore store;
    private EventDispatcher dispatcher;

    @BeforeEach
    void setUp() throws Exception {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:dispatch_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1");
        config.setUsername("sa");
        config.setPassword("");
        config.setMaximumPoolSize(8);
        pool = new HikariDataSource(config);
        Schemas.run(pool, "h2");
        store = JdbcIntegrationStores.detect(pool);

        DataManager counter = new DataManager("counter");
        ExtensionBuilder builder = ExtensionBuilder.named("counter");
        DefaultExtensionRegistry registry = new DefaultExtensionRegistry()
            .register(builder
                .onCreated(e -> counter.createInitialData(Map.of("count", 0)))
                .onCompleted(e -> {
                    Object count = counter.getData(e.habit()).getOrDefault("count", 0);
                    return HookResult.set(counter.path("count"), ((Number) count).intValue() + 1);
                })
                .build())
            .register(ExtensionBuilder.named("broken")
                .onCompleted(e -> {
                    throw new IllegalStateException("boom");
                })
                .build());

        dispatcher = EventDispatcher.builder()
            .registry(registry)
            .store(store)
            .workerCount(4)
            .build();
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
        pool.close();
    }

    @Test
    void outcomeMatchesWhatWasPersisted() {
        HabitSnapshot habit = HabitSnapshot.builder("h1", "simple").userId("u1").name("Walk").build();

        DispatchOutcome created = dispatcher.dispatch(LifecycleEvent.created(habit, USER));

        assertTrue(created.applied());
        assertEquals(store.load("h1"), created.integrations());
        assertEquals(0, ((Number) store.load("h1").get("counter").get("count")).intValue());
    }

    @Test
    void concurrentCompletionsAreSerializedPerHabit() throws Exception {
        HabitSnapshot habit = HabitSnapshot.builder("h1", "simple").userId("u1").name("Walk").build();
        dispatcher.dispatch(LifecycleEvent.created(habit, USER));

        ExecutorService callers = Executors.newFixedThreadPool(6);
        List<Future<DispatchOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            futures.add(callers.submit(() -> dispatcher.dispatch(
                LifecycleEvent.completed(habit, CompletionEntry.completed(LocalDate.now()), USER))));
        }
        for (Future<DispatchOutcome> f : futures) {
            DispatchOutcome outcome = f.get(30, TimeUnit.SECONDS);
            assertTrue(outcome.applied());
            assertEquals(List.of("broken"), outcome.failedExtensions());
        }
        callers.shutdown();

        assertEquals(30, ((Number) store.load("h1").get("counter").get("count")).intValue());
        assertEquals(1, Schemas.countRows(pool, "h1"));
    }

    @Test
    void deletionRemovesRows() throws Exception {
        HabitSnapshot habit = HabitSnapshot.builder("h1", "simple").userId("u1").name("Walk").build();
        dispatcher.dispatch(LifecycleEvent.created(habit, USER));

        DispatchOutcome deleted = dispatcher.dispatch(LifecycleEvent.deleted(habit, USER));

        assertTrue(deleted.integrations().isEmpty());
        assertEquals(0, Schemas.countRows(pool, "h1"));
    }
}
