package io.kiln.core.node;

/// Classification of a node's declared input.
///
/// - `REQUIRED` - the producer must exist and supply a value
/// - `OPTIONAL` - the parameter declared a default; the engine may omit it
public enum DependencyType {
    REQUIRED,
    OPTIONAL;

    /// Maps a parameter's required flag onto a dependency type.
    ///
    /// @param required whether the parameter has no default
    /// @return `REQUIRED` or `OPTIONAL`, never null
    public static DependencyType fromRequired(boolean required) {
        return required ? REQUIRED : OPTIONAL;
    }
}
