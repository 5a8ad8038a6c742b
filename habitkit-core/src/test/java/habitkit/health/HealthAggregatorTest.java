package habitkit.health;

import habitkit.ExtensionBuilder;
import habitkit.HealthState;
import habitkit.HealthStatus;
import habitkit.dispatch.RecordingMetrics;
import habitkit.registry.DefaultExtensionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealthAggregatorTest {

    private final List<HealthAggregator> aggregators = new ArrayList<>();

    @AfterEach
    void close() {
        aggregators.forEach(HealthAggregator::close);
    }

    @Test
    void throwingCheckMakesOverallUnhealthyWithoutAffectingSiblings() {
        DefaultExtensionRegistry registry = new DefaultExtensionRegistry()
                .register(ExtensionBuilder.named("fine").withHealthCheck(HealthStatus::healthy).build())
                .register(ExtensionBuilder.named("broken").withHealthCheck(() -> {
                    throw new IllegalStateException("database unreachable");
                }).build());
        RecordingMetrics metrics = new RecordingMetrics();

        HealthReport report = aggregator(registry, metrics, 2000).checkAll();

        assertEquals(HealthState.UNHEALTHY, report.overall());
        assertEquals(HealthState.HEALTHY, report.extensions().get("fine").state());
        assertNull(report.extensions().get("fine").error());
        assertEquals(HealthState.UNHEALTHY, report.extensions().get("broken").state());
        assertEquals("database unreachable", report.extensions().get("broken").error());
        assertEquals(HealthState.UNHEALTHY, metrics.health("broken"));
        assertEquals(HealthState.HEALTHY, metrics.health("fine"));
    }

    @Test
    void missingCheckIsHealthy() {
        DefaultExtensionRegistry registry = new DefaultExtensionRegistry()
                .register(ExtensionBuilder.named("noProbe").build());

        HealthReport report = aggregator(registry, null, 2000).checkAll();

        assertEquals(HealthState.HEALTHY, report.overall());
        assertEquals(HealthState.HEALTHY, report.extensions().get("noProbe").state());
    }

    @Test
    void emptyRegistryIsHealthy() {
        HealthReport report = aggregator(new DefaultExtensionRegistry(), null, 2000).checkAll();
        assertEquals(HealthState.HEALTHY, report.overall());
        assertTrue(report.extensions().isEmpty());
    }

    @Test
    void overallIsWorstState() {
        DefaultExtensionRegistry registry = new DefaultExtensionRegistry()
                .register(ExtensionBuilder.named("ok").withHealthCheck(HealthStatus::healthy).build())
                .register(ExtensionBuilder.named("slowish")
                        .withHealthCheck(() -> HealthStatus.degraded("cache cold")).build());

        HealthReport report = aggregator(registry, null, 2000).checkAll();

        assertEquals(HealthState.DEGRADED, report.overall());
        assertEquals("cache cold", report.extensions().get("slowish").error());
    }

    @Test
    void hangingCheckTimesOut() {
        DefaultExtensionRegistry registry = new DefaultExtensionRegistry()
                .register(ExtensionBuilder.named("hangs").withHealthCheck(() -> {
                    Thread.sleep(10_000);
                    return HealthStatus.healthy();
                }).build())
                .register(ExtensionBuilder.named("ok").withHealthCheck(HealthStatus::healthy).build());

        HealthReport report = aggregator(registry, null, 200).checkAll();

        assertEquals(HealthState.UNHEALTHY, report.extensions().get("hangs").state());
        assertTrue(report.extensions().get("hangs").error().contains("timed out"));
        assertEquals(HealthState.HEALTHY, report.extensions().get("ok").state());
    }

    @Test
    void moreSlowChecksThanWorkersAllFinishInTime() {
        DefaultExtensionRegistry registry = new DefaultExtensionRegistry();
        for (String name : List.of("a", "b", "c")) {
            registry.register(ExtensionBuilder.named(name).withHealthCheck(() -> {
                Thread.sleep(1200);
                return HealthStatus.healthy();
            }).build());
        }
        HealthAggregator aggregator = HealthAggregator.builder().registry(registry).build();
        aggregators.add(aggregator);

        HealthReport report = aggregator.checkAll();

        assertEquals(HealthState.HEALTHY, report.overall(), report.toMap().toString());
    }

    @Test
    void nullStatusIsUnhealthy() {
        DefaultExtensionRegistry registry = new DefaultExtensionRegistry()
                .register(ExtensionBuilder.named("empty").withHealthCheck(() -> null).build());

        HealthReport report = aggregator(registry, null, 2000).checkAll();

        assertEquals(HealthState.UNHEALTHY, report.overall());
    }

    @Test
    void toMapRendersExternalFormat() {
        DefaultExtensionRegistry registry = new DefaultExtensionRegistry()
                .register(ExtensionBuilder.named("fine").withHealthCheck(HealthStatus::healthy).build())
                .register(ExtensionBuilder.named("broken").withHealthCheck(() -> {
                    throw new IllegalStateException("nope");
                }).build());

        Map<String, Object> map = aggregator(registry, null, 2000).checkAll().toMap();

        assertEquals("unhealthy", map.get("overall"));
        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> extensions = (Map<String, Map<String, Object>>) map.get("extensions");
        assertEquals("healthy", extensions.get("fine").get("status"));
        assertFalse(extensions.get("fine").containsKey("error"));
        assertEquals("unhealthy", extensions.get("broken").get("status"));
        assertEquals("nope", extensions.get("broken").get("error"));
        assertTrue(extensions.get("broken").containsKey("checkedAt"));
    }

    @Test
    void checkSingleExtension() {
        DefaultExtensionRegistry registry = new DefaultExtensionRegistry()
                .register(ExtensionBuilder.named("fine").withHealthCheck(HealthStatus::healthy).build());
        HealthAggregator aggregator = aggregator(registry, null, 2000);

        assertEquals(HealthState.HEALTHY, aggregator.check("fine").orElseThrow().state());
        assertTrue(aggregator.check("unknown").isEmpty());
    }

    @Test
    void builderRejectsBadTimeout() {
        assertThrows(IllegalArgumentException.class, () ->
                HealthAggregator.builder().registry(new DefaultExtensionRegistry()).timeoutMs(0).build());
    }

    private HealthAggregator aggregator(DefaultExtensionRegistry registry, RecordingMetrics metrics, long timeoutMs) {
        HealthAggregator aggregator = HealthAggregator.builder()
                .registry(registry)
                .metrics(metrics)
                .timeoutMs(timeoutMs)
                .build();
        aggregators.add(aggregator);
        return aggregator;
    }
}
