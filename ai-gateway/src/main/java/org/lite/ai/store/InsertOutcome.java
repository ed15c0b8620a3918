package org.lite.ai.store;

/**
 * Result of an insert-if-absent: the stored value and whether this call created it.
 */
public record InsertOutcome<T>(T value, boolean created) {
}
