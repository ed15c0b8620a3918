package org.lite.ai.enums;

/**
 * Rolling health estimate of a provider. Declaration order is the selection preference.
 */
public enum ProviderHealthState {
    HEALTHY,
    DEGRADED,
    DOWN
}
