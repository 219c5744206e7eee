package io.kiln.core.modifier;

import io.kiln.core.function.FunctionDefinition;

/// Base contract of everything that can be attached to a function definition.
///
/// ### Modifier Kinds
/// - {@link NodeResolver} - keeps or drops a definition based on configuration
/// - {@link NodeCreator} - supplies the single base node
/// - {@link NodeExpander} - turns one node into several
/// - {@link NodeDecorator} - adds metadata to every emitted node
///
/// @implNote Implementations must be immutable. The same modifier instance
/// may be attached to several definitions.
public interface FunctionModifier {

    /// Checks this modifier's preconditions against the raw definition.
    ///
    /// Runs before any node is built. The default accepts every definition.
    ///
    /// @param fn the definition the modifier is attached to, not null
    /// @throws InvalidModifierException if the definition cannot carry this modifier
    default void validate(FunctionDefinition fn) {}
}
