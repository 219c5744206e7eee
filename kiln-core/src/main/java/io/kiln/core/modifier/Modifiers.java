package io.kiln.core.modifier;

import io.kiln.core.creator.DelegatingNodeCreator;
import io.kiln.core.creator.ModelFactory;
import io.kiln.core.creator.ModelNodeCreator;
import io.kiln.core.expander.ExtractColumns;
import io.kiln.core.expander.ExtractFields;
import io.kiln.core.expander.OutputSpec;
import io.kiln.core.expander.ParameterizedInputs;
import io.kiln.core.expander.ParametrizedInput;
import io.kiln.core.expander.ParametrizedValue;
import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.resolver.ConfigCondition;
import io.kiln.core.resolver.ConfigResolver;
import io.kiln.core.tag.TagDecorator;
import java.util.Collection;
import java.util.Map;

/// Factory methods for every built-in modifier.
///
/// ### Usage
/// {@snippet :
/// DecoratedFunction prices = DecoratedFunction.of(
///         pricesFn,
///         Modifiers.configWhen("source", "exchange"),
///         Modifiers.extractColumns("bid", OutputSpec.of("ask", "Best ask")),
///         Modifiers.tag(Map.of("owner", "pricing")));
/// }
public final class Modifiers {

    private Modifiers() {}

    /// Delegates a declaration's computation to `implementation`.
    public static DelegatingNodeCreator does(FunctionDefinition implementation) {
        return new DelegatingNodeCreator(implementation);
    }

    /// Wraps a model built from `config[configKey]` as the definition's node.
    public static ModelNodeCreator model(ModelFactory factory, String configKey) {
        return new ModelNodeCreator(factory, configKey);
    }

    /// Binds `parameter` to one literal per output; keys must be {@link OutputSpec}s.
    public static ParametrizedValue parametrized(String parameter, Map<?, ?> assignedOutput) {
        return new ParametrizedValue(parameter, assignedOutput);
    }

    /// Feeds `parameter` from a different upstream node per output.
    public static ParametrizedInput parametrizedInput(
            String parameter, Map<String, OutputSpec> variableInputs) {
        return new ParametrizedInput(parameter, variableInputs);
    }

    /// Remaps several parameters to other upstream nodes per output.
    public static ParameterizedInputs parameterizedInputs(
            Map<String, Map<String, String>> parameterization) {
        return new ParameterizedInputs(parameterization);
    }

    /// Exposes table columns as nodes; chain {@link ExtractColumns#fillWith} for a fill value.
    public static ExtractColumns extractColumns(Object... columns) {
        return ExtractColumns.of(columns);
    }

    /// Exposes map fields as nodes; chain {@link ExtractFields#fillWith} for a fill value.
    public static ExtractFields extractFields(Map<?, ?> fields) {
        return ExtractFields.of(fields);
    }

    public static ConfigResolver configWhen(String key, Object value) {
        return new ConfigResolver(ConfigCondition.EQUALS, Map.of(key, value), null);
    }

    public static ConfigResolver configWhen(Map<String, ?> expected) {
        return new ConfigResolver(ConfigCondition.EQUALS, expected, null);
    }

    public static ConfigResolver configWhenNot(String key, Object value) {
        return new ConfigResolver(ConfigCondition.NOT_EQUALS, Map.of(key, value), null);
    }

    public static ConfigResolver configWhenIn(String key, Collection<?> values) {
        return new ConfigResolver(ConfigCondition.ONE_OF, Map.of(key, values), null);
    }

    public static ConfigResolver configWhenNotIn(String key, Collection<?> values) {
        return new ConfigResolver(ConfigCondition.NOT_ONE_OF, Map.of(key, values), null);
    }

    public static TagDecorator tag(Map<String, ?> tags) {
        return new TagDecorator(tags);
    }
}
