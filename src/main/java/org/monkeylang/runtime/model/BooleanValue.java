package org.monkeylang.runtime.model;

/**
 * A boolean. Only the two shared instances {@link #TRUE} and {@link #FALSE} exist,
 * so booleans can be compared by identity.
 */
public final class BooleanValue implements Value {

    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    private final boolean value;

    private BooleanValue(boolean value) {
        this.value = value;
    }

    /**
     * Maps a native boolean to its shared instance.
     * @param value The native boolean.
     * @return {@link #TRUE} or {@link #FALSE}.
     */
    public static BooleanValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean value() {
        return value;
    }

    @Override
    public ValueType type() {
        return ValueType.BOOLEAN;
    }

    @Override
    public String inspect() {
        return Boolean.toString(value);
    }

    @Override
    public String toString() {
        return "BooleanValue[" + value + "]";
    }
}
