package io.kiln.core.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// One column of a {@link Table}: an immutable sequence of values.
///
/// Values may be null.
public final class Series {

    private final List<Object> values;

    private Series(List<?> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Series of(Object... values) {
        return new Series(Arrays.asList(values));
    }

    public static Series of(List<?> values) {
        return new Series(Objects.requireNonNull(values, "values must not be null"));
    }

    /// Creates a series repeating one value.
    ///
    /// @param value the value to repeat, may be null
    /// @param size number of rows, not negative
    /// @return new series, never null
    public static Series filled(Object value, int size) {
        return new Series(Collections.nCopies(size, value));
    }

    public Object get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    /// @return unmodifiable values, never null
    public List<Object> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Series other && values.equals(other.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Series" + values;
    }
}
