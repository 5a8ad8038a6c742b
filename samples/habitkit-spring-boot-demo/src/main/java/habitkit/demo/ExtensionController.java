package habitkit.demo;

import habitkit.Endpoint;
import habitkit.EndpointRequest;
import habitkit.ExtensionDescriptor;
import habitkit.health.HealthAggregator;
import habitkit.registry.ExtensionRegistry;
import habitkit.registry.RegistryStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/extensions")
public class ExtensionController {
    private static final Logger log = LoggerFactory.getLogger(ExtensionController.class);

    private final ExtensionRegistry registry;
    private final HealthAggregator health;

    public ExtensionController(ExtensionRegistry registry, HealthAggregator health) {
        this.registry = registry;
        this.health = health;
    }

    @GetMapping
    public List<Map<String, Object>> list() {
        List<Map<String, Object>> summaries = new ArrayList<>();
        for (ExtensionDescriptor descriptor : registry.all()) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("name", descriptor.name());
            summary.put("version", descriptor.version());
            summary.put("description", descriptor.description());
            summary.put("supportedTypes", descriptor.supportedTypes());
            summary.put("hooks", descriptor.hooks().keySet().stream().map(kind -> kind.hookName()).toList());
            summary.put("endpoints", descriptor.endpoints().keySet());
            summaries.add(summary);
        }
        return summaries;
    }

    @GetMapping("/stats")
    public RegistryStats stats() {
        return registry.stats();
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return health.checkAll().toMap();
    }

    @PostMapping("/{name}/endpoints/{endpoint}")
    public Object invoke(@PathVariable String name,
                         @PathVariable String endpoint,
                         @RequestParam(required = false) String habitId,
                         @RequestParam(required = false) String userId,
                         @RequestBody(required = false) Map<String, Object> params) {
        if (registry.get(name).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown extension: " + name);
        }
        Endpoint target = registry.endpoint(name, endpoint)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Unknown endpoint: " + name + "." + endpoint));
        try {
            return target.invoke(new EndpointRequest(habitId, userId, params));
        } catch (Exception e) {
            log.error("Endpoint {}.{} failed", name, endpoint, e);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        }
    }
}
