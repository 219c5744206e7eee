package io.kiln.core.resolver;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.function.FunctionNames;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.NodeResolver;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Keeps a definition only when the configuration satisfies a condition.
///
/// Every `key -> expected` entry is compared with the configuration value of
/// the same key; all must hold. A kept definition is renamed to its sanitized
/// name (see {@link FunctionNames#sanitize}) or to an explicit override, so
/// that sibling variants such as `fn__eu` and `fn__us` all emit `fn`.
///
/// This resolver judges one definition in isolation. Whether exactly one
/// sibling matches is checked by {@link io.kiln.core.assembly.NodeAssembler}.
///
/// {@snippet :
/// DecoratedFunction.of(revenueEu, Modifiers.configWhen("region", "eu"));
/// DecoratedFunction.of(revenueUs, Modifiers.configWhenNotIn("region", List.of("eu")));
/// }
public final class ConfigResolver implements NodeResolver {

    private final ConfigCondition condition;
    private final Map<String, Object> expected;
    private final String nameOverride;

    /// @param condition comparison to apply, not null
    /// @param expected expected value per configuration key, not empty; collections
    ///        of candidates for `ONE_OF` and `NOT_ONE_OF`
    /// @param nameOverride emitted name, or null to use the sanitized name
    /// @throws InvalidModifierException if `expected` is empty or malformed
    public ConfigResolver(ConfigCondition condition, Map<String, ?> expected, String nameOverride) {
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        if (expected == null || expected.isEmpty()) {
            throw new InvalidModifierException("config." + label() + " needs at least one key");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : expected.entrySet()) {
            Object value = entry.getValue();
            if (condition.expectsCollection()) {
                if (!(value instanceof Collection<?> candidates)) {
                    throw new InvalidModifierException(
                            "config." + label() + " expects a collection of values for '"
                                    + entry.getKey() + "'");
                }
                value = Collections.unmodifiableList(new ArrayList<>(candidates));
            }
            copy.put(entry.getKey(), value);
        }
        this.expected = Collections.unmodifiableMap(copy);
        if (nameOverride != null && nameOverride.isBlank()) {
            throw new InvalidModifierException("config." + label() + " name override is blank");
        }
        this.nameOverride = nameOverride;
    }

    /// Returns a copy that emits the kept definition under `name`.
    public ConfigResolver named(String name) {
        return new ConfigResolver(condition, expected, Objects.requireNonNull(name, "name must not be null"));
    }

    public ConfigCondition getCondition() {
        return condition;
    }

    public Map<String, Object> getExpected() {
        return expected;
    }

    public Optional<String> getNameOverride() {
        return Optional.ofNullable(nameOverride);
    }

    @Override
    public void validate(FunctionDefinition fn) {
        if (fn.getName().endsWith(FunctionNames.VARIANT_MARKER)) {
            throw new InvalidModifierException(
                    "config: '" + fn.getName() + "' ends with '" + FunctionNames.VARIANT_MARKER
                            + "'; the variant suffix after it must not be empty");
        }
    }

    @Override
    public Optional<FunctionDefinition> resolve(FunctionDefinition fn, Map<String, Object> config) {
        if (!matches(config)) {
            return Optional.empty();
        }
        String name = nameOverride != null ? nameOverride : FunctionNames.sanitize(fn.getName());
        return Optional.of(fn.withName(name));
    }

    /// Evaluates the condition against a configuration snapshot.
    ///
    /// @param config read-only configuration mapping, not null
    /// @return true if every expected key is present and satisfies the condition
    public boolean matches(Map<String, Object> config) {
        for (Map.Entry<String, Object> entry : expected.entrySet()) {
            if (!config.containsKey(entry.getKey())) {
                return false;
            }
            if (!condition.test(config.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private String label() {
        return switch (condition) {
            case EQUALS -> "when";
            case NOT_EQUALS -> "when_not";
            case ONE_OF -> "when_in";
            case NOT_ONE_OF -> "when_not_in";
        };
    }
}
