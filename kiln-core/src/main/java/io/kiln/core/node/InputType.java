package io.kiln.core.node;

import java.util.Objects;

/// Declared type and dependency classification of one node input.
///
/// @param type the value type the node expects, not null
/// @param dependencyType whether the input is required or optional, not null
public record InputType(Class<?> type, DependencyType dependencyType) {

    public InputType {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(dependencyType, "dependencyType must not be null");
    }

    /// Creates a required input of the given type.
    ///
    /// @param type the value type, not null
    /// @return new input type, never null
    public static InputType required(Class<?> type) {
        return new InputType(type, DependencyType.REQUIRED);
    }

    /// Creates an optional input of the given type.
    ///
    /// @param type the value type, not null
    /// @return new input type, never null
    public static InputType optional(Class<?> type) {
        return new InputType(type, DependencyType.OPTIONAL);
    }
}
