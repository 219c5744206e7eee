package io.kiln.core.resolver;

import java.util.Collection;
import java.util.Objects;

/// Comparison applied between a configuration value and the expected value.
///
/// A key absent from the configuration never matches, whatever the condition.
public enum ConfigCondition {
    EQUALS {
        @Override
        boolean test(Object actual, Object expected) {
            return Objects.equals(actual, expected);
        }
    },
    NOT_EQUALS {
        @Override
        boolean test(Object actual, Object expected) {
            return !Objects.equals(actual, expected);
        }
    },
    ONE_OF {
        @Override
        boolean test(Object actual, Object expected) {
            return ((Collection<?>) expected).contains(actual);
        }
    },
    NOT_ONE_OF {
        @Override
        boolean test(Object actual, Object expected) {
            return !((Collection<?>) expected).contains(actual);
        }
    };

    abstract boolean test(Object actual, Object expected);

    /// Returns whether the expected value must be a collection of candidates.
    public boolean expectsCollection() {
        return this == ONE_OF || this == NOT_ONE_OF;
    }
}
