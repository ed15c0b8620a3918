package org.lite.ai.enums;

public enum AttemptOutcome {
    SUCCESS,
    FAILURE,
    TIMEOUT
}
