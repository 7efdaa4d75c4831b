package com.glossary.mapping.health;

import com.glossary.mapping.index.GlossaryRegistry;
import com.glossary.mapping.index.IndexSnapshot;

import java.util.Optional;

/**
 * DOWN until a glossary is loaded; DEGRADED while the latest reload attempt has failed
 * and an older generation is still serving.
 */
public class GlossaryHealthCheck implements HealthCheck {

    private final GlossaryRegistry registry;

    public GlossaryHealthCheck(GlossaryRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String getName() {
        return "glossary";
    }

    @Override
    public HealthStatus check() {
        Optional<IndexSnapshot> snapshot = registry.currentIfLoaded();
        if (snapshot.isEmpty()) {
            HealthStatus down = HealthStatus.down("No glossary loaded");
            return registry.getLastReloadFailure()
                    .map(failure -> down.withDetail("lastReloadError", String.valueOf(failure.getMessage())))
                    .orElse(down);
        }

        IndexSnapshot active = snapshot.get();
        HealthStatus base = registry.getLastReloadFailure()
                .map(failure -> HealthStatus.degraded("Last reload failed: " + failure.getMessage()))
                .orElseGet(HealthStatus::up);
        return base
                .withDetail("generation", active.getGenerationId())
                .withDetail("entities", active.size())
                .withDetail("loadedAt", active.getLoadedAt().toString());
    }
}
