package ai.reanalyze.workspace;

import java.util.Objects;

/** Stable identifier of a compilation unit within a workspace. */
public record UnitId(String value) implements Comparable<UnitId> {

    public UnitId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("unit id must not be blank");
        }
    }

    public static UnitId of(String value) {
        return new UnitId(value);
    }

    @Override
    public int compareTo(UnitId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
