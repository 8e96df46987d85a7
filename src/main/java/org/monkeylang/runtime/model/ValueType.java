package org.monkeylang.runtime.model;

/**
 * Type tags of runtime values.
 */
public enum ValueType {
    INTEGER,
    BOOLEAN
}
