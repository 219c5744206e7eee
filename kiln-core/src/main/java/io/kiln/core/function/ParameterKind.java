package io.kiln.core.function;

/// How a declared parameter binds arguments.
///
/// Variadic kinds (`VAR_POSITIONAL`, `VAR_KEYWORD`) collect any number of
/// arguments and never become named node inputs.
public enum ParameterKind {
    POSITIONAL_ONLY,
    POSITIONAL_OR_KEYWORD,
    KEYWORD_ONLY,
    VAR_POSITIONAL,
    VAR_KEYWORD;

    public boolean isVariadic() {
        return this == VAR_POSITIONAL || this == VAR_KEYWORD;
    }
}
