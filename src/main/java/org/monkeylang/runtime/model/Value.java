package org.monkeylang.runtime.model;

/**
 * A runtime value produced by the {@link org.monkeylang.runtime.Evaluator}.
 * Values are immutable once constructed.
 */
public sealed interface Value permits IntegerValue, BooleanValue {

    /**
     * @return The type tag of this value.
     */
    ValueType type();

    /**
     * @return A human-readable rendering of this value.
     */
    String inspect();
}
