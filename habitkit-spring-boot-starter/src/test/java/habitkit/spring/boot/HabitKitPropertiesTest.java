package habitkit.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HabitKitPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            HabitKitProperties props = ctx.getBean(HabitKitProperties.class);
            assertEquals(4, props.getDispatcher().getWorkerCount());
            assertEquals(Duration.ofSeconds(5), props.getDispatcher().getHookTimeout());
            assertEquals(Duration.ofSeconds(5), props.getDispatcher().getDrainTimeout());
            assertTrue(props.getDispatcher().isRemoveOnDelete());
            assertEquals(Duration.ofSeconds(2), props.getHealth().getTimeout());
            assertEquals(2, props.getHealth().getWorkerCount());
            assertEquals(HabitKitProperties.StoreType.AUTO, props.getStore().getType());
            assertEquals("habit_integration", props.getStore().getTableName());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("habitkit", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void bindsCustomValues() {
        runner.withPropertyValues(
                "habitkit.dispatcher.worker-count=8",
                "habitkit.dispatcher.hook-timeout=750ms",
                "habitkit.dispatcher.drain-timeout=1s",
                "habitkit.dispatcher.remove-on-delete=false",
                "habitkit.health.timeout=300ms",
                "habitkit.health.worker-count=1",
                "habitkit.store.type=memory",
                "habitkit.store.table-name=coach_integration",
                "habitkit.metrics.enabled=false",
                "habitkit.metrics.name-prefix=coach.habitkit"
        ).run(ctx -> {
            HabitKitProperties props = ctx.getBean(HabitKitProperties.class);
            assertEquals(8, props.getDispatcher().getWorkerCount());
            assertEquals(Duration.ofMillis(750), props.getDispatcher().getHookTimeout());
            assertEquals(Duration.ofSeconds(1), props.getDispatcher().getDrainTimeout());
            assertFalse(props.getDispatcher().isRemoveOnDelete());
            assertEquals(Duration.ofMillis(300), props.getHealth().getTimeout());
            assertEquals(1, props.getHealth().getWorkerCount());
            assertEquals(HabitKitProperties.StoreType.MEMORY, props.getStore().getType());
            assertEquals("coach_integration", props.getStore().getTableName());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("coach.habitkit", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(HabitKitProperties.class)
    static class PropsConfig {
    }
}
