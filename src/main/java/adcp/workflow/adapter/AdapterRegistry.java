package adcp.workflow.adapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adapter variants by name. Interceptor and resumer stay platform-agnostic and
 * resolve the tenant's adapter through here.
 */
public class AdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<String, AdServerAdapter> adapters = new ConcurrentHashMap<>();

    public AdapterRegistry register(AdServerAdapter adapter) {
        AdServerAdapter previous = adapters.put(adapter.name(), adapter);
        if (previous != null) {
            log.warn("Adapter {} replaced ({} -> {})", adapter.name(),
                    previous.getClass().getSimpleName(), adapter.getClass().getSimpleName());
        } else {
            log.debug("Registered adapter: {}", adapter.name());
        }
        return this;
    }

    public Optional<AdServerAdapter> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(adapters.get(name));
    }

    public Set<String> names() {
        return Set.copyOf(adapters.keySet());
    }
}
