package io.kiln.core.expander;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.NodeExpander;
import io.kiln.core.node.InputType;
import io.kiln.core.node.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Rewires a single parameter to a different upstream node per output.
///
/// `variableInputs` maps each upstream node name to the output it feeds.
/// Prefer {@link ParameterizedInputs} when more than one parameter varies.
public final class ParametrizedInput implements NodeExpander {

    private final String parameter;
    private final Map<String, OutputSpec> variableInputs;

    public ParametrizedInput(String parameter, Map<String, OutputSpec> variableInputs) {
        this.parameter = Objects.requireNonNull(parameter, "parameter must not be null");
        if (variableInputs == null || variableInputs.isEmpty()) {
            throw new InvalidModifierException(
                    "parametrized_input '" + parameter + "' needs at least one input");
        }
        this.variableInputs = Collections.unmodifiableMap(new LinkedHashMap<>(variableInputs));
    }

    @Override
    public void validate(FunctionDefinition fn) {
        if (!fn.hasParameter(parameter)) {
            throw new InvalidModifierException(
                    "parametrized_input: '" + fn.getName() + "' has no parameter '" + parameter
                            + "'");
        }
    }

    @Override
    public List<Node> expandNode(Node node, Map<String, Object> config, FunctionDefinition fn) {
        InputType rewired = node.getInputTypes().get(parameter);
        if (rewired == null) {
            throw new InvalidModifierException(
                    "parametrized_input: node '" + node.getName() + "' has no input '" + parameter
                            + "'");
        }
        List<Node> nodes = new ArrayList<>(variableInputs.size());
        for (Map.Entry<String, OutputSpec> entry : variableInputs.entrySet()) {
            String upstream = entry.getKey();
            boolean shared = !upstream.equals(parameter) && node.getInputTypes().containsKey(upstream);
            nodes.add(
                    node.toBuilder()
                            .name(entry.getValue().name())
                            .documentation(entry.getValue().documentation())
                            .removeInput(parameter)
                            .input(upstream, rewired)
                            .callable(
                                    kwargs -> {
                                        Map<String, Object> args = new HashMap<>(kwargs);
                                        Object value = args.get(upstream);
                                        if (!shared) {
                                            args.remove(upstream);
                                        }
                                        args.put(parameter, value);
                                        return node.getCallable().call(args);
                                    })
                            .build());
        }
        return nodes;
    }
}
