package io.kiln.core.function;

import java.util.Objects;

/// One declared parameter of a {@link FunctionDefinition}.
///
/// @param name parameter name, also the name of the upstream producer, not null
/// @param type declared type, `Object.class` when unconstrained, not null
/// @param kind binding kind, not null
/// @param required `false` when the parameter declares a default value
public record Parameter(String name, Class<?> type, ParameterKind kind, boolean required) {

    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Creates a required positional-or-keyword parameter.
    public static Parameter of(String name, Class<?> type) {
        return new Parameter(name, type, ParameterKind.POSITIONAL_OR_KEYWORD, true);
    }

    /// Creates a positional-or-keyword parameter with a default value.
    public static Parameter optional(String name, Class<?> type) {
        return new Parameter(name, type, ParameterKind.POSITIONAL_OR_KEYWORD, false);
    }
}
