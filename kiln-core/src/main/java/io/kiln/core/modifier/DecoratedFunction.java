package io.kiln.core.modifier;

import io.kiln.core.function.FunctionDefinition;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// A function definition together with its modifiers in attachment order.
///
/// @param definition the authored function, not null
/// @param modifiers attached modifiers, not null (may be empty)
public record DecoratedFunction(FunctionDefinition definition, List<FunctionModifier> modifiers) {

    public DecoratedFunction {
        Objects.requireNonNull(definition, "definition must not be null");
        modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
    }

    public static DecoratedFunction of(FunctionDefinition definition, FunctionModifier... modifiers) {
        return new DecoratedFunction(definition, Arrays.asList(modifiers));
    }

    /// Returns a copy with one more modifier attached after the existing ones.
    public DecoratedFunction with(FunctionModifier modifier) {
        List<FunctionModifier> extended = new ArrayList<>(modifiers);
        extended.add(Objects.requireNonNull(modifier, "modifier must not be null"));
        return new DecoratedFunction(definition, extended);
    }

    /// Returns the attached modifiers of one kind, in attachment order.
    public <T extends FunctionModifier> List<T> modifiersOf(Class<T> kind) {
        return modifiers.stream().filter(kind::isInstance).map(kind::cast).toList();
    }
}
