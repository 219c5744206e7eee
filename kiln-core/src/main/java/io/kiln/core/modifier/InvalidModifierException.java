package io.kiln.core.modifier;

import java.io.Serial;

/// Thrown when a modifier's contract is violated while building nodes.
///
/// Covers malformed modifier arguments, signature and return-type mismatches,
/// reserved-name collisions, and missing configuration. The failing function
/// definition contributes no node at all.
public class InvalidModifierException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4105879127722093311L;

    public InvalidModifierException(String message) {
        super(message);
    }

    public InvalidModifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
