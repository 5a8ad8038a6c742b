package habitkit.benchmark;

import habitkit.HookResult;
import habitkit.merge.ExtensionResult;
import habitkit.merge.IntegrationDocuments;
import habitkit.merge.IntegrationMerger;
import habitkit.merge.WriteSet;
import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures merging hook results into a write set and applying it to a habit's
 * integrations, without any store or thread pool.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
public class MergeBenchmark {

  @Param({"1", "8", "32"})
  private int extensionCount;

  @Param({"2", "16"})
  private int pathsPerPatch;

  private final IntegrationMerger merger = new IntegrationMerger();
  private List<ExtensionResult> results;
  private Map<String, Map<String, Object>> integrations;

  @Setup(Level.Trial)
  public void setup() {
    results = new ArrayList<>();
    integrations = new LinkedHashMap<>();
    for (int i = 0; i < extensionCount; i++) {
      String name = "ext" + i;
      Map<String, Object> patch = new LinkedHashMap<>();
      for (int p = 0; p < pathsPerPatch; p++) {
        String path = p % 2 == 0 ? "stats.field" + p : "integrations." + name + ".field" + p;
        patch.put(path, p);
      }
      results.add(new ExtensionResult(name, i % 4 == 0
          ? HookResult.seed(Map.of("createdAt", "2024-01-01T00:00:00Z"))
          : HookResult.patch(patch)));
      integrations.put(name, Map.of("stats", Map.of("field0", -1)));
    }
  }

  @Benchmark
  public WriteSet merge() {
    return merger.merge("habit-1", results);
  }

  @Benchmark
  public Map<String, Map<String, Object>> mergeAndApply() {
    return IntegrationDocuments.apply(integrations, merger.merge("habit-1", results));
  }
}
