package com.glossary.mapping.health;

/**
 * Checks one component of the mapping engine.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
