package io.kiln.core.validation;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.function.ParameterKind;
import io.kiln.core.modifier.InvalidModifierException;

/// Preconditions shared across modifiers.
///
/// Each check throws {@link InvalidModifierException} on violation and
/// returns normally otherwise.
public final class FunctionValidators {

    private FunctionValidators() {}

    /// Requires the definition to be a pure declaration whose body is never run.
    ///
    /// @param fn the definition to check, not null
    /// @throws InvalidModifierException if the body holds statements
    public static void ensureFunctionEmpty(FunctionDefinition fn) {
        if (!fn.isEmptyBody()) {
            throw new InvalidModifierException(
                    "Function '" + fn.getName() + "' must have an empty body: its implementation"
                            + " is supplied by a modifier and its own code would never run");
        }
    }

    /// Requires an implementation that can be invoked purely by keyword.
    ///
    /// The implementation must collect arbitrary keyword arguments and must
    /// not declare positional-only or variadic positional parameters.
    ///
    /// @param fn the implementation to check, not null
    /// @throws InvalidModifierException if it cannot be called by keyword
    public static void ensureKeywordOnly(FunctionDefinition fn) {
        if (fn.hasParameterOfKind(ParameterKind.POSITIONAL_ONLY)) {
            throw new InvalidModifierException(
                    "Function '" + fn.getName() + "' declares positional-only parameters");
        }
        if (fn.hasParameterOfKind(ParameterKind.VAR_POSITIONAL)) {
            throw new InvalidModifierException(
                    "Function '" + fn.getName() + "' declares a variadic positional parameter");
        }
        if (!fn.hasParameterOfKind(ParameterKind.VAR_KEYWORD)) {
            throw new InvalidModifierException(
                    "Function '" + fn.getName() + "' must accept arbitrary keyword arguments");
        }
    }

    /// Requires the implementation to return the same type as the declaration.
    ///
    /// @param declaration the function being replaced, not null
    /// @param implementation the replacing function, not null
    /// @throws InvalidModifierException if the return types differ
    public static void ensureOutputTypesMatch(
            FunctionDefinition declaration, FunctionDefinition implementation) {
        if (!declaration.getReturnType().equals(implementation.getReturnType())) {
            throw new InvalidModifierException(
                    "Output types of '" + declaration.getName() + "' ("
                            + declaration.getReturnType().getName() + ") and '"
                            + implementation.getName() + "' ("
                            + implementation.getReturnType().getName() + ") do not match");
        }
    }

    /// Requires the definition's return type to be usable as `expected`.
    ///
    /// @param fn the definition to check, not null
    /// @param expected the type the return value must be assignable to, not null
    /// @param modifierName modifier name used in the error message, not null
    /// @throws InvalidModifierException if the return type is not compatible
    public static void ensureReturnType(
            FunctionDefinition fn, Class<?> expected, String modifierName) {
        if (!expected.isAssignableFrom(fn.getReturnType())) {
            throw new InvalidModifierException(
                    modifierName + " requires '" + fn.getName() + "' to return "
                            + expected.getSimpleName() + ", found "
                            + fn.getReturnType().getSimpleName());
        }
    }
}
