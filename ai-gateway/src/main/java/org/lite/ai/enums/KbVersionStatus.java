package org.lite.ai.enums;

public enum KbVersionStatus {
    BUILDING,
    ACTIVE,
    ARCHIVED
}
