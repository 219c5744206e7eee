package io.kiln.core.expander;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.NodeExpander;
import io.kiln.core.node.Node;
import io.kiln.core.node.NodeCallable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Produces one node per literal value bound to a designated parameter.
///
/// Each entry of `assignedOutput` maps an {@link OutputSpec} to the literal
/// passed as `parameter`; every other input passes through unchanged.
///
/// {@snippet :
/// Modifiers.parametrized("region", Map.of(
///         OutputSpec.of("sales_eu", "Sales in the EU"), "eu",
///         OutputSpec.of("sales_us", "Sales in the US"), "us"));
/// }
public final class ParametrizedValue implements NodeExpander {

    private final String parameter;
    private final Map<OutputSpec, Object> assignedOutput;

    /// @param parameter the parameter to bind, not null
    /// @param assignedOutput literal per output; every key must be an {@link OutputSpec}
    /// @throws InvalidModifierException if empty or if any key is a bare name
    public ParametrizedValue(String parameter, Map<?, ?> assignedOutput) {
        this.parameter = Objects.requireNonNull(parameter, "parameter must not be null");
        if (assignedOutput == null || assignedOutput.isEmpty()) {
            throw new InvalidModifierException(
                    "parametrized '" + parameter + "' needs at least one output");
        }
        Map<OutputSpec, Object> outputs = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : assignedOutput.entrySet()) {
            if (!(entry.getKey() instanceof OutputSpec spec)) {
                throw new InvalidModifierException(
                        "parametrized '" + parameter + "' output keys must be (name, documentation)"
                                + " pairs, found " + entry.getKey());
            }
            outputs.put(spec, entry.getValue());
        }
        this.assignedOutput = Collections.unmodifiableMap(outputs);
    }

    @Override
    public void validate(FunctionDefinition fn) {
        if (!fn.hasParameter(parameter)) {
            throw new InvalidModifierException(
                    "parametrized: '" + fn.getName() + "' has no parameter '" + parameter + "'");
        }
    }

    @Override
    public List<Node> expandNode(Node node, Map<String, Object> config, FunctionDefinition fn) {
        if (!node.getInputTypes().containsKey(parameter)) {
            throw new InvalidModifierException(
                    "parametrized: node '" + node.getName() + "' has no input '" + parameter + "'");
        }
        List<Node> nodes = new ArrayList<>(assignedOutput.size());
        for (Map.Entry<OutputSpec, Object> entry : assignedOutput.entrySet()) {
            nodes.add(
                    node.toBuilder()
                            .name(entry.getKey().name())
                            .documentation(entry.getKey().documentation())
                            .removeInput(parameter)
                            .callable(bind(node.getCallable(), entry.getValue()))
                            .build());
        }
        return nodes;
    }

    private NodeCallable bind(NodeCallable callable, Object value) {
        return kwargs -> {
            Map<String, Object> args = new HashMap<>(kwargs);
            args.put(parameter, value);
            return callable.call(args);
        };
    }
}
