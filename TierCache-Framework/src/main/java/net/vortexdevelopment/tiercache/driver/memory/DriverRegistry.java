package net.vortexdevelopment.tiercache.driver.memory;

import net.vortexdevelopment.tiercache.TierCacheConfig;
import net.vortexdevelopment.tiercache.debug.DebugLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of the memory drivers the host can run. Built once by probing the candidate
 * providers and never modified afterwards.
 */
public final class DriverRegistry {

    private final List<VolatileDriverProvider> available;

    private DriverRegistry(List<VolatileDriverProvider> available) {
        this.available = List.copyOf(available);
    }

    /**
     * Keeps the candidates whose probe succeeds, in the given order. A probe that throws counts as
     * unavailable.
     */
    public static DriverRegistry probe(TierCacheConfig config, List<? extends VolatileDriverProvider> candidates) {
        List<VolatileDriverProvider> available = new ArrayList<>();
        for (VolatileDriverProvider candidate : candidates) {
            try {
                if (candidate.isAvailable(config)) {
                    available.add(candidate);
                    DebugLogger.log(DriverRegistry.class, "Memory driver available: %s", candidate.id());
                }
            } catch (RuntimeException e) {
                DebugLogger.warn(DriverRegistry.class, "Probe of memory driver %s failed: %s", candidate.id(), e.getMessage());
            }
        }
        return new DriverRegistry(available);
    }

    /**
     * Probes the bundled drivers, networked first.
     */
    public static DriverRegistry probeDefaults(TierCacheConfig config) {
        return probe(config, List.of(new RedisDriverProvider(), new CaffeineDriverProvider()));
    }

    public static DriverRegistry empty() {
        return new DriverRegistry(List.of());
    }

    public List<String> ids() {
        return available.stream().map(VolatileDriverProvider::id).toList();
    }

    public boolean isRegistered(String id) {
        return find(id).isPresent();
    }

    public boolean isEmpty() {
        return available.isEmpty();
    }

    /**
     * Providers in selection order: the preferred one first when registered, then the others in
     * registration order.
     */
    public List<VolatileDriverProvider> selectionOrder(String preferredId) {
        List<VolatileDriverProvider> order = new ArrayList<>(available.size());
        find(preferredId).ifPresent(order::add);
        for (VolatileDriverProvider provider : available) {
            if (!order.contains(provider)) {
                order.add(provider);
            }
        }
        return order;
    }

    private Optional<VolatileDriverProvider> find(String id) {
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        return available.stream().filter(provider -> provider.id().equals(id)).findFirst();
    }
}
