package habitkit.benchmark;

import habitkit.CompletionEntry;
import habitkit.ExtensionBuilder;
import habitkit.HabitSnapshot;
import habitkit.HookResult;
import habitkit.LifecycleEvent;
import habitkit.UserRef;
import habitkit.benchmark.BenchmarkStores.StoreSetup;
import habitkit.dispatch.EventDispatcher;
import habitkit.registry.DefaultExtensionRegistry;
import org.openjdk.jmh.annotations.*;

import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Measures one completion dispatch end to end: refresh from the store, fan-out to every
 * extension, merge, and atomic apply.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar DispatchBenchmark}
 * <p>MySQL: {@code java -jar benchmarks/target/benchmarks.jar -p store=mysql DispatchBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class DispatchBenchmark {

  private static final int HABITS = 64;

  @Param({"memory", "h2"})
  private String store;

  @Param({"1", "4", "16"})
  private int extensionCount;

  private StoreSetup setup;
  private EventDispatcher dispatcher;
  private HabitSnapshot[] habits;
  private final AtomicInteger next = new AtomicInteger();
  private final UserRef user = UserRef.of("bench-user");

  @Setup(Level.Trial)
  public void setup() {
    setup = BenchmarkStores.create(store, "bench_dispatch");
    BenchmarkStores.truncate(setup.dataSource());

    DefaultExtensionRegistry registry = new DefaultExtensionRegistry();
    for (int i = 0; i < extensionCount; i++) {
      String name = "ext" + i;
      registry.register(ExtensionBuilder.named(name)
          .onCompleted(event -> {
            Object previous = event.habit().integration(name).get("count");
            int count = previous instanceof Number n ? n.intValue() + 1 : 1;
            return HookResult.patch(Map.of(
                "count", count,
                "lastCompletedDate", event.entry().date().toString()));
          })
          .build());
    }

    dispatcher = EventDispatcher.builder()
        .registry(registry)
        .store(setup.store())
        .workerCount(Math.min(extensionCount, 8))
        .build();

    habits = new HabitSnapshot[HABITS];
    for (int i = 0; i < HABITS; i++) {
      habits[i] = HabitSnapshot.builder("habit-" + i, "simple").name("Habit " + i).build();
    }
  }

  @TearDown(Level.Trial)
  public void tearDown() throws Exception {
    dispatcher.close();
    setup.close();
  }

  @Benchmark
  public Object dispatchCompleted() {
    HabitSnapshot habit = habits[Math.floorMod(next.getAndIncrement(), HABITS)];
    return dispatcher.dispatch(LifecycleEvent.completed(habit, CompletionEntry.completed(LocalDate.now()), user));
  }
}
