package org.lite.ai.enums;

public enum ProviderCapability {
    COMPLETION,
    EMBEDDING
}
